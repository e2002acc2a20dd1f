package com.devevent.registry.domain.validation;

import java.util.Collection;
import java.util.regex.Pattern;

/**
 * Side-effect free guards shared by the write pipelines. All of them accept {@code null}.
 */
public final class FieldValidator {

    // Coarse syntactic check only; deliverability is not verified.
    private static final Pattern EMAIL_SHAPE = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    private FieldValidator() {
    }

    public static boolean isNonEmptyText(Object value) {
        return value instanceof String text && !trimWhitespace(text).isEmpty();
    }

    /**
     * Strips leading and trailing whitespace, where whitespace includes every Unicode space separator
     * (no-break spaces among them) and the byte order mark.
     */
    public static String trimWhitespace(String value) {
        if (value == null) {
            return null;
        }
        int start = 0;
        int end = value.length();
        while (start < end && isWhitespace(value.charAt(start))) {
            start++;
        }
        while (end > start && isWhitespace(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end);
    }

    /**
     * @return true for a collection with at least one element where every element is non-empty text
     */
    public static boolean isNonEmptySequence(Object value) {
        if (!(value instanceof Collection<?> items) || items.isEmpty()) {
            return false;
        }
        return items.stream().allMatch(FieldValidator::isNonEmptyText);
    }

    public static boolean isValidEmailShape(String value) {
        return value != null && EMAIL_SHAPE.matcher(value).matches();
    }

    private static boolean isWhitespace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == '\uFEFF';
    }
}

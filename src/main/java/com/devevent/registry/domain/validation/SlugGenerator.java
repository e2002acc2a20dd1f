package com.devevent.registry.domain.validation;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives URL-safe identifiers from event titles.
 */
public final class SlugGenerator {

    private static final Pattern NON_ALPHANUMERIC_RUN = Pattern.compile("[^a-z0-9]+");
    private static final Pattern EDGE_HYPHENS = Pattern.compile("^-+|-+$");

    private SlugGenerator() {
    }

    /**
     * Lowercases and trims the title, collapses every run of characters outside {@code [a-z0-9]}
     * into one hyphen and strips hyphens from both ends.
     *
     * @return the slug, empty when the title holds no ASCII letters or digits
     */
    public static String slugify(String title) {
        String lowered = title.toLowerCase(Locale.ROOT).trim();
        String hyphenated = NON_ALPHANUMERIC_RUN.matcher(lowered).replaceAll("-");
        return EDGE_HYPHENS.matcher(hyphenated).replaceAll("");
    }
}

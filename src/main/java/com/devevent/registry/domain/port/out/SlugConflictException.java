package com.devevent.registry.domain.port.out;

public class SlugConflictException extends StorageException {

    private final String slug;

    public SlugConflictException(String slug, Throwable cause) {
        super("Slug already in use: " + slug, cause);
        this.slug = slug;
    }

    public String getSlug() {
        return slug;
    }
}

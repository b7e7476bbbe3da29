package com.libragraph.datasink.core.catalog;

import com.libragraph.datasink.core.error.ValidationException;

import java.util.UUID;

/**
 * Validation of client-supplied titles and ids. Titles become path segments and
 * URL parts, so slashes and control characters are refused.
 */
public final class CatalogNames {

    public static final int MAX_TITLE_LENGTH = 255;

    private CatalogNames() {
    }

    public static String requireTitle(String kind, String title) {
        if (title == null || title.isBlank()) {
            throw new ValidationException(kind + " name must not be blank");
        }
        if (title.length() > MAX_TITLE_LENGTH) {
            throw new ValidationException(kind + " name exceeds " + MAX_TITLE_LENGTH + " characters");
        }
        if (!title.equals(title.strip())) {
            throw new ValidationException(kind + " name must not start or end with whitespace");
        }
        for (int i = 0; i < title.length(); i++) {
            char c = title.charAt(i);
            if (c == '/' || Character.isISOControl(c)) {
                throw new ValidationException(kind + " name contains an illegal character: '" + title + "'");
            }
        }
        return title;
    }

    public static String requireId(String kind, String id) {
        if (id == null || id.isBlank()) {
            throw new ValidationException(kind + " id must not be blank");
        }
        try {
            return UUID.fromString(id).toString();
        } catch (IllegalArgumentException e) {
            throw new ValidationException(kind + " id is not a valid UUID: '" + id + "'", e);
        }
    }
}

package com.acme.dcm.domain.model.project;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Project display name. 3-100 characters after trimming, starting with a letter or digit.
 * Uniqueness within a tenant is case-insensitive, see {@link #normalized()}.
 */
public record ProjectName(String value) {
    public static final int MIN_LENGTH = 3;
    public static final int MAX_LENGTH = 100;
    private static final Pattern ALLOWED = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9 ._-]*$");

    public ProjectName {
        if (value == null) {
            throw new IllegalArgumentException("Project name cannot be null");
        }
        value = value.trim();
        if (value.length() < MIN_LENGTH || value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException(
                "Project name must be between " + MIN_LENGTH + " and " + MAX_LENGTH + " characters"
            );
        }
        if (!ALLOWED.matcher(value).matches()) {
            throw new IllegalArgumentException(
                "Project name must start with a letter or digit and contain only letters, digits, spaces, '.', '_' or '-'"
            );
        }
    }

    public static ProjectName of(String value) {
        return new ProjectName(value);
    }

    public String normalized() {
        return value.toLowerCase(Locale.ROOT);
    }
}

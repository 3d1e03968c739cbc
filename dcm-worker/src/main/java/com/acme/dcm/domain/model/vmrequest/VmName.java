package com.acme.dcm.domain.model.vmrequest;

import java.util.regex.Pattern;

/**
 * VM hostname: 3-63 lowercase letters, digits and hyphens, starting with a letter and not ending
 * with a hyphen.
 */
public record VmName(String value) {
    private static final Pattern VALID = Pattern.compile("^[a-z][a-z0-9-]{1,61}[a-z0-9]$");

    public VmName {
        if (value == null || !VALID.matcher(value).matches()) {
            throw new IllegalArgumentException(
                "VM name must be 3-63 lowercase letters, digits or hyphens, start with a letter and not end with a hyphen"
            );
        }
    }

    public static VmName of(String value) {
        return new VmName(value);
    }
}

package com.tempora.versioning.payload;

import java.util.regex.Pattern;

/**
 * SHA-256 fingerprint of a payload's canonical JSON, as 64 lowercase hex characters.
 *
 * @param hex the digest
 */
public record PayloadDigest(String hex) {

    private static final Pattern HEX = Pattern.compile("[0-9a-f]{64}");

    public PayloadDigest {
        if (hex == null || !HEX.matcher(hex).matches()) {
            throw new IllegalArgumentException("payload digest must be 64 lowercase hex characters");
        }
    }

    public static PayloadDigest of(String hex) {
        return new PayloadDigest(hex);
    }

    @Override
    public String toString() {
        return hex;
    }
}

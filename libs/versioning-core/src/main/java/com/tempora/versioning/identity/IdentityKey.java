package com.tempora.versioning.identity;

import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Fixed-size identity key of an entity: the lowercase hex form of a SHA-256 digest.
 *
 * @param hex 64 lowercase hexadecimal characters
 */
public record IdentityKey(String hex) {

    /** Number of hex characters in a key. */
    public static final int HEX_LENGTH = 64;

    private static final Pattern HEX = Pattern.compile("[0-9a-f]{" + HEX_LENGTH + "}");

    public IdentityKey {
        if (hex == null || !HEX.matcher(hex).matches()) {
            throw new IllegalArgumentException("identity key must be 64 lowercase hex characters");
        }
    }

    /** Parses a key from its hex form. */
    public static IdentityKey of(String hex) {
        return new IdentityKey(hex);
    }

    /** Wraps a raw 32-byte digest. */
    public static IdentityKey fromBytes(byte[] digest) {
        return new IdentityKey(HexFormat.of().formatHex(digest));
    }

    /** Returns the raw digest bytes. */
    public byte[] bytes() {
        return HexFormat.of().parseHex(hex);
    }

    @Override
    public String toString() {
        return hex;
    }
}

package com.tempora.versioning.payload;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Computes payload digests and decides whether a write changes anything.
 *
 * <p>The digest is SHA-256 over the UTF-8 bytes of {@link Payload#canonicalJson()}, so it depends
 * only on payload content and not on attribute order. Pure and thread-safe.
 */
public final class ChangeDetector {

    public PayloadDigest digest(Payload payload) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256")
                    .digest(payload.canonicalJson().getBytes(StandardCharsets.UTF_8));
            return PayloadDigest.of(HexFormat.of().formatHex(hash));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Returns true when a payload digesting to {@code candidateDigest} would replace the one that
     * produced {@code currentDigest}. A missing current digest always counts as a change.
     */
    public boolean hasChanged(PayloadDigest currentDigest, PayloadDigest candidateDigest) {
        return currentDigest == null || !currentDigest.equals(candidateDigest);
    }
}

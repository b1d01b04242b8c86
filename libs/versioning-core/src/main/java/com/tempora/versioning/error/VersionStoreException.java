package com.tempora.versioning.error;

/**
 * Base class for failures surfaced by the versioning store.
 *
 * <p>Unchecked: callers handle the specific subtypes they care about and let the rest propagate to
 * the transport layer.
 */
public class VersionStoreException extends RuntimeException {

    public VersionStoreException(String message) {
        super(message);
    }

    public VersionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

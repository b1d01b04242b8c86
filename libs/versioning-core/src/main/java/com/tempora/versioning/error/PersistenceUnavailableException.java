package com.tempora.versioning.error;

/** The persistence backend failed; the transaction was rolled back and nothing was written. */
public class PersistenceUnavailableException extends VersionStoreException {

    public PersistenceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public PersistenceUnavailableException(String message) {
        super(message);
    }
}

package com.tempora.versioningservice.api;

/** No version of the addressed entity exists (or existed at the requested instant). */
public class EntityNotFoundException extends RuntimeException {

    public EntityNotFoundException(String entityType, String businessKey) {
        super("No version of %s/%s".formatted(entityType, businessKey));
    }
}

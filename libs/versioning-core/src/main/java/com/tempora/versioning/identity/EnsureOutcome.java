package com.tempora.versioning.identity;

/** Result of registering an identity. Losing a registration race is not an error. */
public enum EnsureOutcome {
    CREATED,
    ALREADY_EXISTS
}

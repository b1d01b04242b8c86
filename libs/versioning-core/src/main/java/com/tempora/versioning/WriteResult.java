package com.tempora.versioning;

import com.tempora.versioning.identity.IdentityKey;

/**
 * @param identityKey identity the write resolved to
 * @param versionSeq the new version, or the unchanged current version when {@code changed} is false
 * @param changed whether a new version was written
 */
public record WriteResult(IdentityKey identityKey, long versionSeq, boolean changed) {
}

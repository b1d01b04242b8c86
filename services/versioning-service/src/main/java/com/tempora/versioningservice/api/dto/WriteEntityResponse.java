package com.tempora.versioningservice.api.dto;

import com.tempora.versioning.WriteResult;

public record WriteEntityResponse(String identityKey, long versionSeq, boolean changed) {

    public static WriteEntityResponse from(WriteResult result) {
        return new WriteEntityResponse(result.identityKey().hex(), result.versionSeq(), result.changed());
    }
}

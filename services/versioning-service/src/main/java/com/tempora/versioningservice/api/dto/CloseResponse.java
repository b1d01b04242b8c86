package com.tempora.versioningservice.api.dto;

/** @param closed false when the entity was never written or was already closed */
public record CloseResponse(boolean closed) {}

package com.tempora.versioning.spi;

import java.time.Duration;
import java.time.Instant;

/**
 * Result of probing a persistence backend.
 *
 * @param backend backend name
 * @param available whether the probe succeeded
 * @param message human-readable detail (error message when unavailable)
 * @param latency time taken by the probe
 * @param checkedAt when the probe ran
 */
public record BackendHealth(
        String backend,
        boolean available,
        String message,
        Duration latency,
        Instant checkedAt) {

    public static BackendHealth available(String backend, Duration latency) {
        return new BackendHealth(backend, true, "OK", latency, Instant.now());
    }

    public static BackendHealth unavailable(String backend, String message, Duration latency) {
        return new BackendHealth(backend, false, message, latency, Instant.now());
    }
}

/**
 * Temporal entity-versioning engine.
 *
 * <p>{@link com.tempora.versioning.VersionedEntityStore} is the public API. Underneath it:
 *
 * <ul>
 *   <li>{@code identity}: key derivation and the append-only hub registry
 *   <li>{@code payload}: payload type, canonical digests and schema validation
 *   <li>{@code version}: version sequencing and the versioned satellite store
 *   <li>{@code concurrency}: per-identity locking and optimistic retry
 *   <li>{@code audit}: best-effort delivery of change events
 *   <li>{@code spi}: the persistence backend contract, with a heap backend in {@code memory}
 * </ul>
 */
package com.tempora.versioning;

/**
 * JDBC implementation of the versioning store's persistence SPI.
 *
 * <p>Three tables back the store: {@code tempora_identity} (hub), {@code tempora_version}
 * (satellite) and {@code tempora_current_version}, the per-identity pointer that writers swap with
 * compare-and-set. Schema changes ship as Flyway scripts under {@code db/migration/tempora}.
 */
package com.tempora.persistence.jdbc;

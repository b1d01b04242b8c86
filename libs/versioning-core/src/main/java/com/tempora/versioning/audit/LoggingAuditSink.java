package com.tempora.versioning.audit;

import com.tempora.changeevents.ChangeEvent;
import com.tempora.changeevents.ChangeEventSerializer;
import com.tempora.observability.SensitiveDataRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each change event as one line of JSON to the {@code tempora.audit} logger, with sensitive
 * payload attributes redacted.
 */
public final class LoggingAuditSink implements AuditSink {

    public static final String LOGGER_NAME = "tempora.audit";

    private final Logger auditLog;
    private final SensitiveDataRedactor redactor;

    public LoggingAuditSink() {
        this(LoggerFactory.getLogger(LOGGER_NAME), new SensitiveDataRedactor());
    }

    public LoggingAuditSink(Logger auditLog, SensitiveDataRedactor redactor) {
        this.auditLog = auditLog;
        this.redactor = redactor;
    }

    @Override
    public void publish(ChangeEvent event) {
        auditLog.info(ChangeEventSerializer.serialize(redacted(event)));
    }

    ChangeEvent redacted(ChangeEvent event) {
        return new ChangeEvent(
                event.eventId(),
                event.changeType(),
                event.tenantId(),
                event.entityType(),
                event.businessKey(),
                event.identityKey(),
                event.oldVersionSeq(),
                event.newVersionSeq(),
                event.payload() == null ? null : redactor.redact(event.payload()),
                event.actor(),
                event.sourceTag(),
                event.timestamp(),
                event.correlationId());
    }
}

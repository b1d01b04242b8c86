package com.tempora.versioning.audit;

import com.tempora.changeevents.ChangeEvent;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

/** Test sink that throws on every call. */
public final class FailingAuditSink implements AuditSink {

    private final AtomicInteger attempts = new AtomicInteger();

    @Override
    public void publish(ChangeEvent event) throws Exception {
        attempts.incrementAndGet();
        throw new IOException("audit endpoint unreachable");
    }

    public int attempts() {
        return attempts.get();
    }
}

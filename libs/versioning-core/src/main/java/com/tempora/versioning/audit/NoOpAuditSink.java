package com.tempora.versioning.audit;

import com.tempora.changeevents.ChangeEvent;

/** Default sink. Accepts every event and records nothing. */
public final class NoOpAuditSink implements AuditSink {

    @Override
    public void publish(ChangeEvent event) {
        // intentionally empty
    }

    @Override
    public SinkMode mode() {
        return SinkMode.STUB;
    }
}

package com.tempora.versioning.audit;

import com.tempora.changeevents.ChangeEvent;

/**
 * Destination for change events. Called off the write path by {@link AuditBridge}; an exception
 * thrown here is logged and counted but never reaches the writer.
 */
public interface AuditSink {

    void publish(ChangeEvent event) throws Exception;

    /** Whether this sink really delivers. Defaults to {@link SinkMode#LIVE}. */
    default SinkMode mode() {
        return SinkMode.LIVE;
    }

    default String name() {
        return getClass().getSimpleName();
    }
}

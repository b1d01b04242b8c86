package com.tempora.versioning.audit;

/** Whether an audit sink actually delivers events or only simulates delivery. */
public enum SinkMode {
    /** Events reach a real destination. */
    LIVE,
    /** Events are accepted and dropped; nothing is recorded anywhere. */
    STUB
}

package com.subscription.domain.model;

/**
 * Outcome of handling one inbound message.
 */
public enum DispatchResult {

    /** Event applied and its unit of work committed. */
    PROCESSED(true),

    /** Event type this service does not act on. */
    SKIPPED(true),

    /** Poison message: undecodable or failing schema validation. Never retried. */
    REJECTED(true),

    /** Transient failure; the message must be redelivered. */
    FAILED(false);

    private final boolean committable;

    DispatchResult(boolean committable) {
        this.committable = committable;
    }

    /**
     * Whether the stream offset may advance past the message.
     */
    public boolean isCommittable() {
        return committable;
    }
}

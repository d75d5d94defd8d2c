package com.aporkolab.consumer;

/**
 * How a delivery was settled after its handler ran.
 */
public enum MessageOutcome {
    ACKED("acked"),
    RETRIED("retried"),
    DEAD_LETTERED("dead_lettered"),
    REQUEUED("requeued");

    private final String tag;

    MessageOutcome(String tag) {
        this.tag = tag;
    }

    /** Lower-case name used for metric tags. */
    public String tag() {
        return tag;
    }
}

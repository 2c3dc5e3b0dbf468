package com.questrail.meshinfo.collector;

/**
 * States of {@link CollectorService}.
 *
 * <p>{@link #ABORTED} and {@link #STOPPED} are terminal. {@link #ABORTED} is
 * reached only when connecting to the OLSR daemon keeps failing;
 * {@link #STOPPED} ends a single-cycle run normally.</p>
 */
public enum CollectorState {
    IDLE,
    CONNECTING,
    POLLING,
    RECONCILING,
    SLEEPING,
    STOPPED,
    ABORTED;

    public boolean isTerminal() {
        return this == STOPPED || this == ABORTED;
    }
}

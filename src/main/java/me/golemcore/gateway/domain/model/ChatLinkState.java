package me.golemcore.gateway.domain.model;

/**
 * Lifecycle of a chat request as seen by its client.
 *
 * <pre>
 * PENDING -> STREAMING -> FINALIZED
 *    \__________\________> ABORTED
 * </pre>
 */
public enum ChatLinkState {

    /** Dispatched, no assistant text yet. */
    PENDING,

    /** At least one delta buffered. */
    STREAMING,

    /** Final or error projection emitted. */
    FINALIZED,

    /** Cancelled by the caller; terminal phase observed without projection. */
    ABORTED;

    public boolean isTerminal() {
        return this == FINALIZED || this == ABORTED;
    }
}

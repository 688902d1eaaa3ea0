package com.ryuqq.cachequeue.adapter.inmemory.queue;

/**
 * Stream lifecycle state.
 *
 * <pre>
 * UNCREATED → ACTIVE (created on first append/register)
 * ACTIVE    → DRAINING (shutdown with consumers attached)
 * ACTIVE    → STOPPED (shutdown without consumers, undelivered messages discarded)
 * DRAINING  → STOPPED (last dispatcher exits)
 * </pre>
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
public enum StreamState {

    /**
     * Not yet known to the registry.
     */
    UNCREATED,

    /**
     * Accepts append and register.
     */
    ACTIVE,

    /**
     * Rejects new appends while dispatchers finish buffered messages.
     */
    DRAINING,

    /**
     * Finished.
     */
    STOPPED
}

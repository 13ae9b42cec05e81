package com.pedromossi.clinicache.batch;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Tracks whether a bulk operation is in progress and collects the tag invalidations
 * requested while it runs.
 *
 * <p>States are {@link State#IDLE} and {@link State#BATCHED}. Starting a batch while one
 * is already active is a no-op that keeps the tags deferred so far. The first
 * {@link #end()} closes the batch; further calls return nothing.</p>
 *
 * <p>Not thread-safe. The owning cache manager guards every call with its lock.</p>
 *
 * @since 1.0.0
 */
public class BatchCoordinator {

    /** Batch lifecycle state. */
    public enum State {
        IDLE,
        BATCHED
    }

    private State state = State.IDLE;

    private final Set<String> deferredTags = new LinkedHashSet<>();

    /**
     * Opens a batch.
     *
     * @return {@code true} if the state changed, {@code false} if a batch was already open
     */
    public boolean begin() {
        if (state == State.BATCHED) {
            return false;
        }
        state = State.BATCHED;
        deferredTags.clear();
        return true;
    }

    /**
     * Records a tag for invalidation at the end of the batch.
     *
     * @param tag the tag to defer
     * @return {@code true} if a batch is open and the tag was deferred
     */
    public boolean defer(String tag) {
        if (state != State.BATCHED) {
            return false;
        }
        deferredTags.add(tag);
        return true;
    }

    /**
     * Closes the batch and hands back the deferred tags, each exactly once, in the
     * order they were first deferred.
     *
     * @return the deferred tags, empty if no batch was open
     */
    public Set<String> end() {
        if (state != State.BATCHED) {
            return Set.of();
        }
        state = State.IDLE;
        Set<String> tags = new LinkedHashSet<>(deferredTags);
        deferredTags.clear();
        return tags;
    }

    public boolean isActive() {
        return state == State.BATCHED;
    }

    public State getState() {
        return state;
    }

    public int deferredCount() {
        return deferredTags.size();
    }
}

package com.mailmirror.domain;

import com.mailmirror.exception.MirrorException;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.concurrent.atomic.AtomicLong;

/**
 * One source/target pair.
 * Mutated only by the engine that owns it; state and counters are readable from any thread.
 */
@Getter
public class Account {

    private final String name;
    private final SourceMailbox source;
    private final TargetMailbox target;

    private volatile AccountState state = AccountState.INITIAL;
    private volatile MirrorException lastError;
    @Getter(AccessLevel.NONE)
    private final AtomicLong processed = new AtomicLong();

    public Account(String name, SourceMailbox source, TargetMailbox target) {
        this.name = name;
        this.source = source;
        this.target = target;
    }

    /**
     * Move to the next lifecycle state
     *
     * @throws IllegalStateException if the transition table forbids it
     */
    public synchronized void transition(AccountState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(name + ": invalid transition " + state + " -> " + next);
        }
        state = next;
    }

    /**
     * Restore the state saved on entry to a phase.
     * No-op once shutdown has begun.
     */
    public synchronized void restore(AccountState saved) {
        if (state == AccountState.SHUTDOWN || state == AccountState.INITIAL || state == saved) {
            return;
        }
        transition(saved);
    }

    public long getProcessedCount() {
        return processed.get();
    }

    public long recordProcessed() {
        return processed.incrementAndGet();
    }

    public void recordFailure(MirrorException error) {
        error.attribute(name, state);
        this.lastError = error;
    }

    /**
     * Key used in MQTT topics: '@' and '.' replaced by '-'
     */
    public String getKey() {
        return keyOf(name);
    }

    public static String keyOf(String name) {
        return name.replace('@', '-').replace('.', '-');
    }
}

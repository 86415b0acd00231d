package com.mailmirror.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Account lifecycle state machine
 * - INITIAL -> CONNECTING -> CONNECTED -> WATCHING -> HANDLING -> SHUTDOWN
 * - HANDLING is entered from WATCHING only and returns to it
 * - SHUTDOWN always ends in INITIAL
 */
public enum AccountState {
    /** Not started, or closed */
    INITIAL(0),
    /** Probing source and target, opening the watch session */
    CONNECTING(1),
    /** Watch session primed */
    CONNECTED(2),
    /** Waiting in IDLE for mailbox changes */
    WATCHING(3),
    /** Running a fetch/store/cleanup cycle */
    HANDLING(4),
    /** Releasing sessions */
    SHUTDOWN(5);

    private static final Map<AccountState, Set<AccountState>> TRANSITIONS = new EnumMap<>(AccountState.class);

    static {
        TRANSITIONS.put(INITIAL, EnumSet.of(CONNECTING, SHUTDOWN));
        TRANSITIONS.put(CONNECTING, EnumSet.of(CONNECTED, SHUTDOWN));
        TRANSITIONS.put(CONNECTED, EnumSet.of(WATCHING, SHUTDOWN));
        TRANSITIONS.put(WATCHING, EnumSet.of(HANDLING, CONNECTED, SHUTDOWN));
        TRANSITIONS.put(HANDLING, EnumSet.of(WATCHING, SHUTDOWN));
        TRANSITIONS.put(SHUTDOWN, EnumSet.of(INITIAL));
    }

    private final int code;

    AccountState(int code) {
        this.code = code;
    }

    /**
     * Numeric value exported as the account state gauge
     */
    public int getCode() {
        return code;
    }

    public boolean canTransitionTo(AccountState next) {
        return TRANSITIONS.get(this).contains(next);
    }

    public Set<AccountState> successors() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }
}

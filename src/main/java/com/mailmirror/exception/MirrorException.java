package com.mailmirror.exception;

import com.mailmirror.domain.AccountState;

/**
 * Base class for account-level failures.
 * Carries the account and the lifecycle state the failure happened in.
 */
public abstract class MirrorException extends Exception {

    private String accountName;
    private AccountState state;

    protected MirrorException(String message) {
        super(message);
    }

    protected MirrorException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Attribute this failure to an account; the first attribution wins
     */
    public MirrorException attribute(String accountName, AccountState state) {
        if (this.accountName == null) {
            this.accountName = accountName;
            this.state = state;
        }
        return this;
    }

    public String getAccountName() {
        return accountName;
    }

    public AccountState getState() {
        return state;
    }
}

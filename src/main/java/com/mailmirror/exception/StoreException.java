package com.mailmirror.exception;

/**
 * Appending a message to the target mailbox failed
 */
public class StoreException extends MirrorException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

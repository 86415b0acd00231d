package com.mailmirror.exception;

/**
 * Opening, logging in to or selecting a mail store failed, or the watch session dropped
 */
public class ConnectionException extends MirrorException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}

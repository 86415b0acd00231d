package com.mailmirror.exception;

/**
 * Fetching messages from the source mailbox failed
 */
public class FetchException extends MirrorException {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}

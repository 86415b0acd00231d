package com.mailmirror.exception;

/**
 * Flagging forwarded messages as deleted at the source failed
 */
public class CleanupException extends MirrorException {

    public CleanupException(String message) {
        super(message);
    }

    public CleanupException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.mailmirror.exception;

/**
 * Device authorization, token refresh or token persistence failed
 */
public class AuthException extends MirrorException {

    public AuthException(String message) {
        super(message);
    }

    public AuthException(String message, Throwable cause) {
        super(message, cause);
    }
}

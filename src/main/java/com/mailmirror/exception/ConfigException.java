package com.mailmirror.exception;

/**
 * Invalid configuration; prevents every account from starting
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }
}

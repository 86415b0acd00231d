package com.mailmirror.exception;

/**
 * MQTT broker transport failure
 */
public class BrokerException extends MirrorException {

    public BrokerException(String message) {
        super(message);
    }

    public BrokerException(String message, Throwable cause) {
        super(message, cause);
    }
}

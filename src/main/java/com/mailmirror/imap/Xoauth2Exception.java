package com.mailmirror.imap;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import javax.security.sasl.SaslException;

/**
 * XOAUTH2 authentication error reported by the server
 */
public class Xoauth2Exception extends SaslException {

    private final ErrorResponse error;

    public Xoauth2Exception(ErrorResponse error) {
        super("XOAUTH2 authentication error (" + error.status() + ")");
        this.error = error;
    }

    public ErrorResponse getError() {
        return error;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ErrorResponse(String status, String schemes, String scope) {
    }
}

package com.mailmirror.domain;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

/**
 * Device code issued by the authorization server.
 * Exists only until the user completed (or abandoned) the out-of-band approval.
 *
 * @param deviceCode              code exchanged for the token
 * @param userCode                code the user types in
 * @param verificationUri         page where the user enters the code
 * @param verificationUriComplete page with the code pre-filled, may be null
 * @param expiresAt               when the device code stops being accepted
 * @param interval                minimum wait between token polls
 */
public record DeviceAuthChallenge(String deviceCode, String userCode, URI verificationUri,
        URI verificationUriComplete, Instant expiresAt, Duration interval) {

    @Override
    public String toString() {
        return "DeviceAuthChallenge[userCode=" + userCode + ", verificationUri=" + verificationUri + "]";
    }
}

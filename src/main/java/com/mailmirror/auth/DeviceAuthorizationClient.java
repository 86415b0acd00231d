package com.mailmirror.auth;

import com.mailmirror.domain.DeviceAuthChallenge;
import com.mailmirror.domain.OAuthToken;
import com.mailmirror.exception.AuthException;

/**
 * Authorization-server side of the OAuth2 device authorization grant (RFC 8628)
 */
public interface DeviceAuthorizationClient {

    /**
     * Request a device code and verification URI
     */
    DeviceAuthChallenge requestDeviceCode() throws AuthException;

    /**
     * Poll the token endpoint until the user approved, denied, or the code expired
     */
    OAuthToken awaitToken(DeviceAuthChallenge challenge) throws AuthException;

    /**
     * Return the token unchanged while it is valid, otherwise refresh it
     *
     * @throws AuthException if the token expired and cannot be refreshed
     */
    OAuthToken refreshIfNeeded(OAuthToken token) throws AuthException;
}

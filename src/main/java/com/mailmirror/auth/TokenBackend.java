package com.mailmirror.auth;

import com.mailmirror.domain.DeviceAuthChallenge;
import com.mailmirror.domain.OAuthToken;
import com.mailmirror.exception.AuthException;
import com.mailmirror.exception.BrokerException;

import java.util.Optional;

/**
 * Token persistence and user notification for one account
 */
public interface TokenBackend {

    /**
     * @return the stored token, or empty if nothing is stored
     */
    Optional<OAuthToken> loadToken() throws AuthException, BrokerException;

    void saveToken(OAuthToken token) throws AuthException, BrokerException;

    /**
     * Show the verification URI and user code to a human
     */
    void notify(DeviceAuthChallenge challenge) throws AuthException, BrokerException;
}

package com.mailmirror.auth;

import com.mailmirror.domain.OAuthToken;
import com.mailmirror.exception.AuthException;
import com.mailmirror.exception.BrokerException;

/**
 * Supplies bearer tokens for XOAUTH2 logins
 */
public interface TokenSource {

    /**
     * @return a token that is not expired
     */
    OAuthToken token() throws AuthException, BrokerException;
}

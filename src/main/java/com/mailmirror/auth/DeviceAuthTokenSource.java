package com.mailmirror.auth;

import com.mailmirror.domain.DeviceAuthChallenge;
import com.mailmirror.domain.OAuthToken;
import com.mailmirror.exception.AuthException;
import com.mailmirror.exception.BrokerException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Token source using the device authorization grant
 * - Cached token from the backend, else a fresh device-code exchange
 * - Always refreshed (if needed) and saved before returning
 * - Holds no token state of its own
 */
@Slf4j
@RequiredArgsConstructor
public class DeviceAuthTokenSource implements TokenSource {

    private final String name;
    private final DeviceAuthorizationClient client;
    private final TokenBackend backend;

    @Override
    public OAuthToken token() throws AuthException, BrokerException {
        Optional<OAuthToken> cached = backend.loadToken();

        OAuthToken token;
        if (cached.isPresent()) {
            token = cached.get();
        } else {
            log.info("{}: No stored token, starting device authorization", name);
            DeviceAuthChallenge challenge = client.requestDeviceCode();
            backend.notify(challenge);
            log.info("{}: Waiting for approval at {} with code {}", name,
                    challenge.verificationUri(), challenge.userCode());
            token = client.awaitToken(challenge);
        }

        token = client.refreshIfNeeded(token);
        backend.saveToken(token);
        return token;
    }
}

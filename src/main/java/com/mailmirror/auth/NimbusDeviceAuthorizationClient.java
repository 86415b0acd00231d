package com.mailmirror.auth;

import com.mailmirror.config.MirrorProperties;
import com.mailmirror.domain.DeviceAuthChallenge;
import com.mailmirror.domain.OAuthToken;
import com.mailmirror.exception.AuthException;
import com.nimbusds.oauth2.sdk.AccessTokenResponse;
import com.nimbusds.oauth2.sdk.AuthorizationGrant;
import com.nimbusds.oauth2.sdk.ErrorObject;
import com.nimbusds.oauth2.sdk.ParseException;
import com.nimbusds.oauth2.sdk.RefreshTokenGrant;
import com.nimbusds.oauth2.sdk.Scope;
import com.nimbusds.oauth2.sdk.TokenRequest;
import com.nimbusds.oauth2.sdk.TokenResponse;
import com.nimbusds.oauth2.sdk.device.DeviceAuthorizationRequest;
import com.nimbusds.oauth2.sdk.device.DeviceAuthorizationResponse;
import com.nimbusds.oauth2.sdk.device.DeviceAuthorizationSuccessResponse;
import com.nimbusds.oauth2.sdk.device.DeviceCode;
import com.nimbusds.oauth2.sdk.device.DeviceCodeGrant;
import com.nimbusds.oauth2.sdk.http.HTTPRequest;
import com.nimbusds.oauth2.sdk.http.HTTPResponse;
import com.nimbusds.oauth2.sdk.id.ClientID;
import com.nimbusds.oauth2.sdk.token.AccessToken;
import com.nimbusds.oauth2.sdk.token.RefreshToken;
import com.nimbusds.oauth2.sdk.token.Tokens;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Device authorization grant against one configured provider, using the Nimbus OAuth 2.0 SDK
 * - Client id sent in the request body (public client)
 * - Polling honours interval, authorization_pending and slow_down
 */
@Slf4j
public class NimbusDeviceAuthorizationClient implements DeviceAuthorizationClient {

    static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(5);
    static final Duration SLOW_DOWN_STEP = Duration.ofSeconds(5);

    private final ClientID clientId;
    private final Scope scope;
    private final URI deviceAuthorizationUri;
    private final URI tokenUri;
    private final int httpTimeoutMillis;
    private final Clock clock;

    public NimbusDeviceAuthorizationClient(MirrorProperties.Provider provider, Duration httpTimeout, Clock clock) {
        this.clientId = new ClientID(provider.getClientId());
        this.scope = new Scope(provider.getScopes().toArray(new String[0]));
        this.deviceAuthorizationUri = URI.create(provider.getDeviceAuthorizationUri());
        this.tokenUri = URI.create(provider.getTokenUri());
        this.httpTimeoutMillis = (int) httpTimeout.toMillis();
        this.clock = clock;
    }

    @Override
    public DeviceAuthChallenge requestDeviceCode() throws AuthException {
        DeviceAuthorizationRequest request = new DeviceAuthorizationRequest(deviceAuthorizationUri, clientId, scope);
        try {
            DeviceAuthorizationResponse response = DeviceAuthorizationResponse.parse(send(request.toHTTPRequest()));
            if (!response.indicatesSuccess()) {
                throw new AuthException("Device authorization request rejected: "
                        + describe(response.toErrorResponse().getErrorObject()));
            }
            DeviceAuthorizationSuccessResponse success = response.toSuccessResponse();
            Duration interval = success.getInterval() > 0
                    ? Duration.ofSeconds(success.getInterval())
                    : DEFAULT_INTERVAL;
            return new DeviceAuthChallenge(
                    success.getDeviceCode().getValue(),
                    success.getUserCode().getValue(),
                    success.getVerificationURI(),
                    success.getVerificationURIComplete(),
                    clock.instant().plusSeconds(success.getLifetime()),
                    interval);
        } catch (IOException | ParseException e) {
            throw new AuthException("Device authorization request failed: " + e.getMessage(), e);
        }
    }

    @Override
    public OAuthToken awaitToken(DeviceAuthChallenge challenge) throws AuthException {
        DeviceCodeGrant grant = new DeviceCodeGrant(new DeviceCode(challenge.deviceCode()));
        Duration interval = challenge.interval();

        while (clock.instant().isBefore(challenge.expiresAt())) {
            sleep(interval);
            TokenResponse response = requestToken(grant);
            if (response.indicatesSuccess()) {
                return toToken(response.toSuccessResponse(), null);
            }

            ErrorObject error = response.toErrorResponse().getErrorObject();
            String code = error.getCode();
            if ("authorization_pending".equals(code)) {
                continue;
            }
            if ("slow_down".equals(code)) {
                interval = interval.plus(SLOW_DOWN_STEP);
                log.debug("Token endpoint asked to slow down, polling every {}s", interval.toSeconds());
                continue;
            }
            throw new AuthException("Device authorization failed: " + describe(error));
        }
        throw new AuthException("Device code expired before the user approved it");
    }

    @Override
    public OAuthToken refreshIfNeeded(OAuthToken token) throws AuthException {
        if (token.isValid(clock)) {
            return token;
        }
        if (!token.hasRefreshToken()) {
            throw new AuthException("Token expired and refresh token is not set");
        }

        TokenResponse response = requestToken(new RefreshTokenGrant(new RefreshToken(token.refreshToken())));
        if (!response.indicatesSuccess()) {
            throw new AuthException("Token refresh failed: "
                    + describe(response.toErrorResponse().getErrorObject()));
        }
        OAuthToken refreshed = toToken(response.toSuccessResponse(), token.refreshToken());
        if (!refreshed.isValid(clock)) {
            throw new AuthException("Token endpoint returned an expired token");
        }
        log.debug("Token refreshed, new expiry {}", refreshed.expiry());
        return refreshed;
    }

    private TokenResponse requestToken(AuthorizationGrant grant) throws AuthException {
        TokenRequest request = new TokenRequest(tokenUri, clientId, grant, scope);
        try {
            return TokenResponse.parse(send(request.toHTTPRequest()));
        } catch (IOException | ParseException e) {
            throw new AuthException("Token request failed: " + e.getMessage(), e);
        }
    }

    private HTTPResponse send(HTTPRequest request) throws IOException {
        request.setConnectTimeout(httpTimeoutMillis);
        request.setReadTimeout(httpTimeoutMillis);
        return request.send();
    }

    private OAuthToken toToken(AccessTokenResponse response, String previousRefreshToken) {
        Tokens tokens = response.getTokens();
        AccessToken accessToken = tokens.getAccessToken();
        RefreshToken refreshToken = tokens.getRefreshToken();
        Instant expiry = accessToken.getLifetime() > 0
                ? clock.instant().plusSeconds(accessToken.getLifetime())
                : null;
        return new OAuthToken(
                accessToken.getValue(),
                accessToken.getType().getValue(),
                refreshToken != null ? refreshToken.getValue() : previousRefreshToken,
                expiry);
    }

    private static void sleep(Duration interval) throws AuthException {
        try {
            Thread.sleep(interval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthException("Interrupted while waiting for device authorization", e);
        }
    }

    private static String describe(ErrorObject error) {
        if (error == null) {
            return "unknown error";
        }
        return error.getDescription() != null
                ? error.getCode() + " (" + error.getDescription() + ")"
                : error.getCode();
    }
}

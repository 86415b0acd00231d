package com.mailmirror.auth;

import com.mailmirror.domain.DeviceAuthChallenge;
import com.mailmirror.domain.OAuthToken;
import com.mailmirror.exception.AuthException;
import com.mailmirror.exception.BrokerException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * DeviceAuthTokenSource unit tests
 * - Stored token short-circuits the device flow
 * - Missing token starts the device flow
 * - Every returned token is saved
 */
@ExtendWith(MockitoExtension.class)
class DeviceAuthTokenSourceTest {

    @Mock
    private DeviceAuthorizationClient client;

    @Mock
    private TokenBackend backend;

    private DeviceAuthTokenSource tokenSource;

    private final OAuthToken stored = new OAuthToken("stored-access", "Bearer", "stored-refresh",
            Instant.parse("2030-01-01T00:00:00Z"));
    private final OAuthToken fresh = new OAuthToken("fresh-access", "Bearer", "fresh-refresh",
            Instant.parse("2030-01-01T01:00:00Z"));
    private final DeviceAuthChallenge challenge = new DeviceAuthChallenge("device-code", "ABCD-EFGH",
            URI.create("https://microsoft.com/devicelogin"), null,
            Instant.parse("2030-01-01T00:15:00Z"), Duration.ofSeconds(5));

    @BeforeEach
    void setUp() {
        tokenSource = new DeviceAuthTokenSource("alice@source.test", client, backend);
    }

    @Test
    @DisplayName("Stored token: no device authorization request, no notification")
    void testToken_StoredTokenShortCircuits() throws Exception {
        when(backend.loadToken()).thenReturn(Optional.of(stored));
        when(client.refreshIfNeeded(stored)).thenReturn(stored);

        OAuthToken token = tokenSource.token();

        assertThat(token).isEqualTo(stored);
        verify(client, never()).requestDeviceCode();
        verify(backend, never()).notify(any());
        verify(backend).saveToken(stored);
    }

    @Test
    @DisplayName("No stored token: request device code, notify, poll, then save")
    void testToken_DeviceFlowWhenNothingStored() throws Exception {
        when(backend.loadToken()).thenReturn(Optional.empty());
        when(client.requestDeviceCode()).thenReturn(challenge);
        when(client.awaitToken(challenge)).thenReturn(fresh);
        when(client.refreshIfNeeded(fresh)).thenReturn(fresh);

        OAuthToken token = tokenSource.token();

        assertThat(token).isEqualTo(fresh);
        InOrder order = inOrder(client, backend);
        order.verify(backend).loadToken();
        order.verify(client).requestDeviceCode();
        order.verify(backend).notify(challenge);
        order.verify(client).awaitToken(challenge);
        order.verify(backend).saveToken(fresh);
    }

    @Test
    @DisplayName("Refreshed token is the one saved and returned")
    void testToken_RefreshedTokenSaved() throws Exception {
        when(backend.loadToken()).thenReturn(Optional.of(stored));
        when(client.refreshIfNeeded(stored)).thenReturn(fresh);

        assertThat(tokenSource.token()).isEqualTo(fresh);
        verify(backend).saveToken(fresh);
    }

    @Test
    @DisplayName("Refresh failure is an auth error and nothing is saved")
    void testToken_RefreshFailure() throws Exception {
        when(backend.loadToken()).thenReturn(Optional.of(stored));
        when(client.refreshIfNeeded(stored)).thenThrow(new AuthException("invalid_grant"));

        assertThatThrownBy(tokenSource::token).isInstanceOf(AuthException.class);
        verify(backend, never()).saveToken(any());
    }

    @Test
    @DisplayName("Broker failure while loading is propagated")
    void testToken_BrokerFailure() throws Exception {
        when(backend.loadToken()).thenThrow(new BrokerException("connection refused"));

        assertThatThrownBy(tokenSource::token).isInstanceOf(BrokerException.class);
        verify(client, never()).requestDeviceCode();
    }
}

package com.mailmirror.domain;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * OAuthToken validity and stored format tests
 */
class OAuthTokenTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-01-01T12:00:00Z"), ZoneOffset.UTC);
    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

    @Test
    @DisplayName("Token expiring within the margin is not valid")
    void testIsValid_ExpiryMargin() {
        assertThat(token(clock.instant().plusSeconds(60)).isValid(clock)).isTrue();
        assertThat(token(clock.instant().plusSeconds(5)).isValid(clock)).isFalse();
        assertThat(token(clock.instant().minusSeconds(5)).isValid(clock)).isFalse();
    }

    @Test
    @DisplayName("Missing access token is never valid")
    void testIsValid_NoAccessToken() {
        assertThat(new OAuthToken("", "Bearer", "rt", null).isValid(clock)).isFalse();
    }

    @Test
    @DisplayName("Token written by another oauth2 client is readable, zero expiry means none")
    void testRead_StoredFormat() throws Exception {
        String json = "{\"access_token\":\"at\",\"token_type\":\"Bearer\",\"refresh_token\":\"rt\","
                + "\"expiry\":\"0001-01-01T00:00:00Z\",\"extra\":1}";

        OAuthToken token = mapper.readValue(json, OAuthToken.class);

        assertThat(token.accessToken()).isEqualTo("at");
        assertThat(token.hasExpiry()).isFalse();
        assertThat(token.isValid(clock)).isTrue();
    }

    @Test
    @DisplayName("toString hides token values")
    void testToString() {
        assertThat(token(clock.instant()).toString()).doesNotContain("secret-access").doesNotContain("secret-refresh");
    }

    private static OAuthToken token(Instant expiry) {
        return new OAuthToken("secret-access", "Bearer", "secret-refresh", expiry);
    }
}

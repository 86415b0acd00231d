package com.mailmirror.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * OAuth2 bearer token.
 * Serialized with the same field names as golang.org/x/oauth2 so tokens stored by other clients stay readable.
 *
 * @param accessToken  access token
 * @param tokenType    token type, usually "Bearer"
 * @param refreshToken refresh token, may be null
 * @param expiry       expiry instant, null (or the zero time) for tokens that never expire
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OAuthToken(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("refresh_token") String refreshToken,
        @JsonProperty("expiry") Instant expiry) {

    /** Tokens are treated as expired this long before their actual expiry */
    public static final Duration EXPIRY_DELTA = Duration.ofSeconds(10);

    @JsonIgnore
    public boolean hasExpiry() {
        return expiry != null && expiry.isAfter(Instant.EPOCH);
    }

    @JsonIgnore
    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isEmpty();
    }

    /**
     * True if the access token is present and not about to expire
     */
    public boolean isValid(Clock clock) {
        if (accessToken == null || accessToken.isEmpty()) {
            return false;
        }
        if (!hasExpiry()) {
            return true;
        }
        return expiry.minus(EXPIRY_DELTA).isAfter(clock.instant());
    }

    @Override
    public String toString() {
        return "OAuthToken[type=" + tokenType + ", expiry=" + expiry + ", refreshable=" + hasRefreshToken() + "]";
    }
}

package com.mailmirror.imap;

import com.fasterxml.jackson.databind.ObjectMapper;

import javax.security.sasl.SaslClient;
import javax.security.sasl.SaslException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * XOAUTH2 SASL client (https://developers.google.com/gmail/xoauth2_protocol)
 * - Initial response: user={user}^Aauth=Bearer {token}^A^A
 * - Any server challenge is a JSON error {status, schemes, scope}
 */
public class Xoauth2SaslClient implements SaslClient {

    public static final String MECHANISM = "XOAUTH2";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String username;
    private final String token;
    private boolean initialSent;
    private boolean complete;

    public Xoauth2SaslClient(String username, String token) {
        this.username = username;
        this.token = token;
    }

    public static byte[] initialResponse(String username, String token) {
        return ("user=" + username + "\u0001auth=Bearer " + token + "\u0001\u0001")
                .getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Decode a server error challenge
     */
    public static Xoauth2Exception parseError(byte[] challenge) throws SaslException {
        try {
            Xoauth2Exception.ErrorResponse error = MAPPER.readValue(challenge, Xoauth2Exception.ErrorResponse.class);
            return new Xoauth2Exception(error);
        } catch (IOException e) {
            throw new SaslException("Malformed XOAUTH2 error response", e);
        }
    }

    @Override
    public String getMechanismName() {
        return MECHANISM;
    }

    @Override
    public boolean hasInitialResponse() {
        return true;
    }

    @Override
    public byte[] evaluateChallenge(byte[] challenge) throws SaslException {
        if (!initialSent) {
            initialSent = true;
            complete = true;
            return initialResponse(username, token);
        }
        throw parseError(challenge);
    }

    @Override
    public boolean isComplete() {
        return complete;
    }

    @Override
    public byte[] unwrap(byte[] incoming, int offset, int len) {
        throw new IllegalStateException("XOAUTH2 has no security layer");
    }

    @Override
    public byte[] wrap(byte[] outgoing, int offset, int len) {
        throw new IllegalStateException("XOAUTH2 has no security layer");
    }

    @Override
    public Object getNegotiatedProperty(String propName) {
        if (!complete) {
            throw new IllegalStateException("XOAUTH2 authentication not completed");
        }
        return null;
    }

    @Override
    public void dispose() {
    }
}

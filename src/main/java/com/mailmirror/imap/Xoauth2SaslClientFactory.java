package com.mailmirror.imap;

import javax.security.auth.callback.Callback;
import javax.security.auth.callback.CallbackHandler;
import javax.security.auth.callback.NameCallback;
import javax.security.auth.callback.PasswordCallback;
import javax.security.auth.callback.UnsupportedCallbackException;
import javax.security.sasl.SaslClient;
import javax.security.sasl.SaslClientFactory;
import javax.security.sasl.SaslException;
import java.io.IOException;
import java.util.Arrays;
import java.util.Map;

/**
 * Creates {@link Xoauth2SaslClient}s; the callback password is the bearer token
 */
public class Xoauth2SaslClientFactory implements SaslClientFactory {

    @Override
    public SaslClient createSaslClient(String[] mechanisms, String authorizationId, String protocol,
            String serverName, Map<String, ?> props, CallbackHandler cbh) throws SaslException {
        if (!Arrays.asList(mechanisms).contains(Xoauth2SaslClient.MECHANISM)) {
            return null;
        }
        NameCallback name = new NameCallback("username");
        PasswordCallback password = new PasswordCallback("token", false);
        try {
            cbh.handle(new Callback[]{name, password});
        } catch (IOException | UnsupportedCallbackException e) {
            throw new SaslException("Cannot obtain XOAUTH2 credentials", e);
        }
        char[] token = password.getPassword();
        password.clearPassword();
        if (name.getName() == null || token == null) {
            throw new SaslException("XOAUTH2 requires a username and a bearer token");
        }
        return new Xoauth2SaslClient(name.getName(), new String(token));
    }

    @Override
    public String[] getMechanismNames(Map<String, ?> props) {
        return new String[]{Xoauth2SaslClient.MECHANISM};
    }
}

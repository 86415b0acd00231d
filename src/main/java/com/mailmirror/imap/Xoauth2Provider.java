package com.mailmirror.imap;

import java.security.Provider;
import java.security.Security;

/**
 * JCA provider registering the XOAUTH2 SASL client factory
 */
public final class Xoauth2Provider extends Provider {

    public static final String NAME = "MailMirrorXOAUTH2";

    public Xoauth2Provider() {
        super(NAME, "1.0", "XOAUTH2 SASL client");
        put("SaslClientFactory." + Xoauth2SaslClient.MECHANISM, Xoauth2SaslClientFactory.class.getName());
    }

    public static synchronized void install() {
        if (Security.getProvider(NAME) == null) {
            Security.addProvider(new Xoauth2Provider());
        }
    }
}

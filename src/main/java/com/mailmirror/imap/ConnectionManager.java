package com.mailmirror.imap;

import com.mailmirror.auth.TokenSource;
import com.mailmirror.config.MirrorProperties;
import com.mailmirror.domain.MailStoreCredentials;
import com.mailmirror.exception.ConnectionException;
import com.mailmirror.exception.MirrorException;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.angus.mail.imap.IMAPStore;
import org.springframework.lang.Nullable;

import java.util.Properties;

/**
 * Opens authenticated IMAP sessions
 * - Implicit TLS (imaps)
 * - Password LOGIN, or XOAUTH2 with a bearer token from the account's TokenSource
 */
@Slf4j
public class ConnectionManager {

    static {
        Xoauth2Provider.install();
    }

    private final MirrorProperties.Imap settings;
    private final TokenSource tokenSource;

    public ConnectionManager(MirrorProperties.Imap settings, @Nullable TokenSource tokenSource) {
        this.settings = settings;
        this.tokenSource = tokenSource;
    }

    /**
     * Open a session for data transfer
     *
     * @throws ConnectionException on connect/login failure
     * @throws MirrorException     from the token source for bearer-token logins
     */
    public MailSession open(MailStoreCredentials credentials) throws MirrorException {
        return connect(credentials);
    }

    /**
     * Open the long-lived session the watcher idles on
     */
    public WatchSession openWatch(MailStoreCredentials credentials) throws MirrorException {
        return connect(credentials);
    }

    private ImapMailSession connect(MailStoreCredentials credentials) throws MirrorException {
        String secret = secretFor(credentials);
        Session session = Session.getInstance(sessionProperties(credentials));
        try {
            IMAPStore store = (IMAPStore) session.getStore("imaps");
            store.connect(credentials.host(), credentials.port(), credentials.username(), secret);
            log.debug("Logged in to {}", credentials);
            return new ImapMailSession(session, store, credentials.toString());
        } catch (MessagingException e) {
            throw new ConnectionException("Login to " + credentials + " failed: " + e.getMessage(), e);
        }
    }

    Properties sessionProperties(MailStoreCredentials credentials) {
        Properties props = new Properties();
        props.setProperty("mail.store.protocol", "imaps");
        props.setProperty("mail.imaps.connectiontimeout", String.valueOf(settings.getConnectionTimeout().toMillis()));
        props.setProperty("mail.imaps.timeout", String.valueOf(settings.getTimeout().toMillis()));
        props.setProperty("mail.imaps.ssl.checkserveridentity", "true");
        props.setProperty("mail.imaps.peek", "true");
        if (credentials.usesBearerToken()) {
            props.setProperty("mail.imaps.sasl.enable", "true");
            props.setProperty("mail.imaps.sasl.mechanisms", Xoauth2SaslClient.MECHANISM);
            props.setProperty("mail.imaps.auth.mechanisms", Xoauth2SaslClient.MECHANISM);
            props.setProperty("mail.imaps.auth.login.disable", "true");
            props.setProperty("mail.imaps.auth.plain.disable", "true");
        }
        return props;
    }

    private String secretFor(MailStoreCredentials credentials) throws MirrorException {
        if (!credentials.usesBearerToken()) {
            return credentials.password();
        }
        if (tokenSource == null) {
            throw new ConnectionException("No token source for OAuth2 login to " + credentials);
        }
        return tokenSource.token().accessToken();
    }
}

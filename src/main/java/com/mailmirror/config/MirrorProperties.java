package com.mailmirror.config;

import com.mailmirror.domain.Account;
import com.mailmirror.domain.MailStoreCredentials;
import com.mailmirror.domain.SourceMailbox;
import com.mailmirror.domain.TargetMailbox;
import com.mailmirror.exception.ConfigException;
import com.mailmirror.imap.IdleWatcher;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * mailmirror configuration properties
 */
@Data
@Component
@ConfigurationProperties(prefix = "mirror")
public class MirrorProperties {

    private List<AccountPair> accounts = new ArrayList<>();

    /**
     * Interval of the IDLE/NOOP fallback check; zero selects the default (1 minute)
     */
    private Duration idleFallback = Duration.ZERO;

    /**
     * Capacity of the fetch->store and store->cleanup queues
     */
    private int queueCapacity = 1;

    /**
     * Exit the process once every account has terminated
     */
    private boolean exitOnCompletion = true;

    private Imap imap = new Imap();
    private Mqtt mqtt = new Mqtt();
    private OAuth2 oauth2 = new OAuth2();

    @Data
    public static class AccountPair {
        private String name;
        private Mailbox source = new Mailbox();
        private Mailbox target = new Mailbox();
    }

    @Data
    public static class Mailbox {
        private String server;
        private String username;
        private String password;
        private String mailbox = "INBOX";
        private String oauth2Provider;

        public MailStoreCredentials toCredentials() {
            return new MailStoreCredentials(server, username, password, mailbox, oauth2Provider);
        }
    }

    @Data
    public static class Imap {
        private Duration connectionTimeout = Duration.ofSeconds(30);
        private Duration timeout = Duration.ofMinutes(5);
    }

    @Data
    public static class Mqtt {
        private String brokerUrl;
        private String clientId = "mailmirror";
        private String username;
        private String password;
        private Duration loadTimeout = Duration.ofSeconds(1);
        private Duration disconnectTimeout = Duration.ofMillis(250);

        public boolean isConfigured() {
            return brokerUrl != null && !brokerUrl.isBlank();
        }
    }

    @Data
    public static class OAuth2 {
        private Duration httpTimeout = Duration.ofSeconds(30);
        private Map<String, Provider> providers = new LinkedHashMap<>();
    }

    @Data
    public static class Provider {
        private String clientId;
        private List<String> scopes = new ArrayList<>();
        private String deviceAuthorizationUri;
        private String tokenUri;
    }

    /**
     * Build the account records
     */
    public List<Account> toAccounts() {
        List<Account> result = new ArrayList<>();
        for (AccountPair pair : accounts) {
            result.add(new Account(pair.getName(),
                    new SourceMailbox(pair.getSource().toCredentials()),
                    new TargetMailbox(pair.getTarget().toCredentials())));
        }
        return result;
    }

    /**
     * Reject configurations no account could start with
     *
     * @throws ConfigException describing the first problem found
     */
    public void validate() {
        if (accounts == null || accounts.isEmpty()) {
            throw new ConfigException("No accounts configured (mirror.accounts)");
        }
        if (queueCapacity < 1) {
            throw new ConfigException("mirror.queue-capacity must be at least 1");
        }
        if (idleFallback == null || idleFallback.isNegative()) {
            throw new ConfigException("mirror.idle-fallback must not be negative");
        }
        // Zero read timeout means none; otherwise the IDLE keep-alive must fire before it
        Duration keepAlive = idleFallback.isZero() ? IdleWatcher.DEFAULT_FALLBACK : idleFallback;
        Duration readTimeout = imap.getTimeout();
        if (readTimeout != null && !readTimeout.isZero() && keepAlive.compareTo(readTimeout) >= 0) {
            throw new ConfigException("mirror.idle-fallback (" + keepAlive + ") must be shorter than "
                    + "mirror.imap.timeout (" + readTimeout + ")");
        }

        Set<String> names = new HashSet<>();
        for (int i = 0; i < accounts.size(); i++) {
            AccountPair pair = accounts.get(i);
            String prefix = "mirror.accounts[" + i + "]";
            if (isBlank(pair.getName())) {
                throw new ConfigException(prefix + ".name is required");
            }
            if (!names.add(pair.getName())) {
                throw new ConfigException("Duplicate account name: " + pair.getName());
            }
            validateMailbox(prefix + ".source", pair.getSource());
            validateMailbox(prefix + ".target", pair.getTarget());

            boolean sourceBearer = pair.getSource().toCredentials().usesBearerToken();
            boolean targetBearer = pair.getTarget().toCredentials().usesBearerToken();
            if (sourceBearer && targetBearer) {
                throw new ConfigException(prefix + ": only one side of an account may use an OAuth2 login");
            }
            if ((sourceBearer || targetBearer) && !mqtt.isConfigured()) {
                throw new ConfigException(prefix + ": OAuth2 login requires mirror.mqtt.broker-url");
            }
        }
    }

    private void validateMailbox(String prefix, Mailbox mailbox) {
        if (mailbox == null) {
            throw new ConfigException(prefix + " is required");
        }
        if (isBlank(mailbox.getServer())) {
            throw new ConfigException(prefix + ".server is required");
        }
        int idx = mailbox.getServer().lastIndexOf(':');
        if (idx >= 0) {
            try {
                Integer.parseInt(mailbox.getServer().substring(idx + 1));
            } catch (NumberFormatException e) {
                throw new ConfigException(prefix + ".server has an invalid port: " + mailbox.getServer());
            }
        }
        if (isBlank(mailbox.getUsername())) {
            throw new ConfigException(prefix + ".username is required");
        }
        if (isBlank(mailbox.getMailbox())) {
            throw new ConfigException(prefix + ".mailbox is required");
        }
        if (isBlank(mailbox.getOauth2Provider())) {
            if (mailbox.getPassword() == null) {
                throw new ConfigException(prefix + ".password is required");
            }
        } else if (!oauth2.getProviders().containsKey(mailbox.getOauth2Provider())) {
            throw new ConfigException(prefix + ".oauth2-provider is unknown: " + mailbox.getOauth2Provider());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

package com.mailmirror.domain;

/**
 * Login data for one IMAP mail store.
 * Shared by the source and target roles of an account.
 *
 * @param server         host, optionally followed by ":port"
 * @param username       login name
 * @param password       password, unused for bearer-token logins
 * @param mailbox        mailbox to select (e.g., INBOX)
 * @param oauth2Provider OAuth2 provider name, or null for password logins
 */
public record MailStoreCredentials(String server, String username, String password, String mailbox,
        String oauth2Provider) {

    public static final int IMAPS_PORT = 993;

    public boolean usesBearerToken() {
        return oauth2Provider != null && !oauth2Provider.isBlank();
    }

    public String host() {
        int idx = server.lastIndexOf(':');
        return idx < 0 ? server : server.substring(0, idx);
    }

    public int port() {
        int idx = server.lastIndexOf(':');
        if (idx < 0) {
            return IMAPS_PORT;
        }
        return Integer.parseInt(server.substring(idx + 1));
    }

    @Override
    public String toString() {
        return username + "@" + server + "/" + mailbox;
    }
}

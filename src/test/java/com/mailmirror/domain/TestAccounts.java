package com.mailmirror.domain;

/**
 * Account fixtures shared by tests
 */
public final class TestAccounts {

    public static final MailStoreCredentials SOURCE =
            new MailStoreCredentials("imap.source.test", "alice", "secret", "INBOX", null);
    public static final MailStoreCredentials TARGET =
            new MailStoreCredentials("imap.target.test:1993", "bob", "secret", "Archive", null);

    private TestAccounts() {
    }

    public static Account account(String name) {
        return new Account(name, new SourceMailbox(SOURCE), new TargetMailbox(TARGET));
    }
}

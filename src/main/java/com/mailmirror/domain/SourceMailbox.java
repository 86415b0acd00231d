package com.mailmirror.domain;

/**
 * Source role: messages are fetched from here and flagged deleted afterwards
 */
public record SourceMailbox(MailStoreCredentials credentials) {

    public String mailbox() {
        return credentials.mailbox();
    }
}

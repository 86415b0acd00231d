package com.mailmirror.domain;

/**
 * Target role: messages are appended here
 */
public record TargetMailbox(MailStoreCredentials credentials) {

    public String mailbox() {
        return credentials.mailbox();
    }
}

package com.mailmirror.domain;

/**
 * Asynchronous notification observed on the watch session
 */
public record MailboxEvent(Kind kind, int messages) {

    public enum Kind {
        /** EXISTS, or the initial status after SELECT */
        MAILBOX_CHANGED,
        /** FETCH with updated flags */
        MESSAGE_CHANGED,
        /** EXPUNGE */
        MESSAGE_EXPUNGED
    }

    public static MailboxEvent mailboxChanged(int messages) {
        return new MailboxEvent(Kind.MAILBOX_CHANGED, messages);
    }

    public static MailboxEvent messageChanged(int messages) {
        return new MailboxEvent(Kind.MESSAGE_CHANGED, messages);
    }

    public static MailboxEvent messageExpunged(int messages) {
        return new MailboxEvent(Kind.MESSAGE_EXPUNGED, messages);
    }

    /**
     * Only mailbox status changes start a handle cycle
     */
    public boolean isTrigger() {
        return kind == Kind.MAILBOX_CHANGED;
    }
}

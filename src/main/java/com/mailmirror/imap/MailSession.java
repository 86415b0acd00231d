package com.mailmirror.imap;

import com.mailmirror.domain.MailboxStatus;
import com.mailmirror.domain.MirroredMessage;
import com.mailmirror.domain.UidSet;
import jakarta.mail.Flags;
import jakarta.mail.MessagingException;

/**
 * Authenticated connection to one mail store.
 * Closed by the scope that opened it.
 */
public interface MailSession extends AutoCloseable {

    /**
     * SELECT (or EXAMINE when readOnly) a mailbox
     */
    MailboxStatus select(String mailbox, boolean readOnly) throws MessagingException;

    /**
     * FETCH UID, FLAGS, INTERNALDATE and BODY[] for sequence numbers first..last of the selected mailbox,
     * handing messages over in ascending sequence order until the handler declines more.
     */
    void fetch(int first, int last, MessageHandler handler) throws MessagingException, InterruptedException;

    /**
     * APPEND a message with the given flags and the message's internal date
     */
    void append(String mailbox, MirroredMessage message, Flags flags) throws MessagingException;

    /**
     * UID STORE uids +FLAGS (\Deleted) on the selected mailbox
     */
    void markDeleted(UidSet uids) throws MessagingException;

    /**
     * LOGOUT; failures are logged
     */
    @Override
    void close();

    @FunctionalInterface
    interface MessageHandler {

        /**
         * @return false to stop the fetch
         */
        boolean accept(MirroredMessage message) throws InterruptedException;
    }
}

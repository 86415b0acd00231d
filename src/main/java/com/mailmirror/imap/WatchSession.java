package com.mailmirror.imap;

import com.mailmirror.domain.MailboxEvent;
import jakarta.mail.MessagingException;

import java.util.function.Consumer;

/**
 * Session held in IDLE on the source mailbox
 */
public interface WatchSession extends MailSession {

    /**
     * Receives unsolicited mailbox notifications of the selected mailbox
     */
    void setEventListener(Consumer<MailboxEvent> listener);

    boolean supportsIdle() throws MessagingException;

    /**
     * Block in IDLE until the server reports something or {@link #interruptIdle()} is called
     */
    void idle() throws MessagingException;

    void noop() throws MessagingException;

    /**
     * End a running IDLE from another thread
     */
    void interruptIdle();
}

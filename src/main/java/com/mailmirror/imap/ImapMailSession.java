package com.mailmirror.imap;

import com.mailmirror.domain.MailboxEvent;
import com.mailmirror.domain.MailboxStatus;
import com.mailmirror.domain.MirroredMessage;
import com.mailmirror.domain.UidSet;
import jakarta.mail.FetchProfile;
import jakarta.mail.Flags;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.UIDFolder;
import jakarta.mail.event.MessageCountAdapter;
import jakarta.mail.event.MessageCountEvent;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.angus.mail.iap.Response;
import org.eclipse.angus.mail.imap.IMAPFolder;
import org.eclipse.angus.mail.imap.IMAPStore;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Date;
import java.util.function.Consumer;

/**
 * IMAP session backed by Jakarta Mail (Angus)
 * - One IMAPStore connection, at most one selected folder
 * - FETCH/APPEND/UID STORE for the sync pipeline
 * - IDLE/NOOP and folder events for the watcher
 */
@Slf4j
public class ImapMailSession implements WatchSession {

    private final Session session;
    private final IMAPStore store;
    private final String description;

    private volatile IMAPFolder selected;
    private volatile Consumer<MailboxEvent> listener = event -> {
    };

    public ImapMailSession(Session session, IMAPStore store, String description) {
        this.session = session;
        this.store = store;
        this.description = description;
    }

    @Override
    public synchronized MailboxStatus select(String mailbox, boolean readOnly) throws MessagingException {
        int mode = readOnly ? Folder.READ_ONLY : Folder.READ_WRITE;
        IMAPFolder current = selected;
        if (current != null && current.isOpen()) {
            if (current.getFullName().equals(mailbox) && current.getMode() == mode) {
                return new MailboxStatus(current.getFullName(), current.getMessageCount(), readOnly);
            }
            current.close(false);
        }

        IMAPFolder folder = (IMAPFolder) store.getFolder(mailbox);
        folder.addMessageCountListener(new MessageCountAdapter() {
            @Override
            public void messagesAdded(MessageCountEvent e) {
                listener.accept(MailboxEvent.mailboxChanged(countOf(folder)));
            }

            @Override
            public void messagesRemoved(MessageCountEvent e) {
                listener.accept(MailboxEvent.messageExpunged(countOf(folder)));
            }
        });
        folder.addMessageChangedListener(e -> listener.accept(MailboxEvent.messageChanged(countOf(folder))));
        folder.open(mode);
        selected = folder;

        log.debug("Selected {} on {} (readOnly={})", mailbox, description, readOnly);
        return new MailboxStatus(folder.getFullName(), folder.getMessageCount(), readOnly);
    }

    @Override
    public void fetch(int first, int last, MessageHandler handler) throws MessagingException, InterruptedException {
        IMAPFolder folder = requireSelected();
        Message[] messages = folder.getMessages(first, last);

        // Envelope items only; each body is read right before its hand-off
        FetchProfile profile = new FetchProfile();
        profile.add(UIDFolder.FetchProfileItem.UID);
        profile.add(FetchProfile.Item.FLAGS);
        profile.add(IMAPFolder.FetchProfileItem.INTERNALDATE);
        folder.fetch(messages, profile);

        for (int i = 0; i < messages.length; i++) {
            MirroredMessage mirrored = toMirrored(folder, messages[i]);
            messages[i] = null;
            if (!handler.accept(mirrored)) {
                return;
            }
        }
    }

    @Override
    public void append(String mailbox, MirroredMessage message, Flags flags) throws MessagingException {
        IMAPFolder current = selected;
        Folder folder = current != null && current.getFullName().equals(mailbox)
                ? current
                : store.getFolder(mailbox);

        AppendedMessage copy = new AppendedMessage(session, message);
        copy.setFlags(flags, true);
        folder.appendMessages(new Message[]{copy});
    }

    @Override
    public void markDeleted(UidSet uids) throws MessagingException {
        String command = "UID STORE " + uids + " +FLAGS (\\Deleted)";
        requireSelected().doCommand(p -> {
            Response[] responses = p.command(command, null);
            p.notifyResponseHandlers(responses);
            p.handleResult(responses[responses.length - 1]);
            return null;
        });
    }

    @Override
    public void setEventListener(Consumer<MailboxEvent> listener) {
        this.listener = listener;
    }

    @Override
    public boolean supportsIdle() throws MessagingException {
        return store.hasCapability("IDLE");
    }

    @Override
    public void idle() throws MessagingException {
        requireSelected().idle(true);
    }

    @Override
    public void noop() throws MessagingException {
        requireSelected().doCommand(p -> {
            p.noop();
            return null;
        });
    }

    @Override
    public void interruptIdle() {
        IMAPFolder folder = selected;
        if (folder == null || !folder.isOpen()) {
            return;
        }
        try {
            // any command from another thread ends the IDLE
            noop();
        } catch (MessagingException e) {
            log.debug("NOOP to end IDLE on {} failed: {}", description, e.getMessage());
        }
    }

    @Override
    public void close() {
        try {
            IMAPFolder folder = selected;
            if (folder != null && folder.isOpen()) {
                folder.close(false);
            }
            if (store.isConnected()) {
                store.close();
            }
            log.debug("Logged out of {}", description);
        } catch (MessagingException e) {
            log.warn("Logout from {} failed: {}", description, e.getMessage());
        } finally {
            selected = null;
        }
    }

    private IMAPFolder requireSelected() throws MessagingException {
        IMAPFolder folder = selected;
        if (folder == null || !folder.isOpen()) {
            throw new MessagingException("No mailbox selected on " + description);
        }
        return folder;
    }

    private static MirroredMessage toMirrored(IMAPFolder folder, Message message) throws MessagingException {
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        try {
            message.writeTo(body);
        } catch (IOException e) {
            throw new MessagingException("Reading BODY[] of message " + message.getMessageNumber() + " failed", e);
        }
        return new MirroredMessage(folder.getUID(message), new Flags(message.getFlags()),
                message.getReceivedDate(), body.toByteArray());
    }

    private static int countOf(Folder folder) {
        try {
            return folder.getMessageCount();
        } catch (MessagingException e) {
            log.debug("Message count of {} unavailable: {}", folder.getFullName(), e.getMessage());
            return -1;
        }
    }

    /**
     * Raw message whose INTERNALDATE is carried over by APPEND
     */
    private static final class AppendedMessage extends MimeMessage {

        private final Date internalDate;

        AppendedMessage(Session session, MirroredMessage message) throws MessagingException {
            super(session, new ByteArrayInputStream(message.body()));
            this.internalDate = message.internalDate();
        }

        @Override
        public Date getReceivedDate() {
            return internalDate;
        }
    }
}

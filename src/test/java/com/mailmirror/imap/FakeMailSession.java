package com.mailmirror.imap;

import com.mailmirror.domain.MailboxEvent;
import com.mailmirror.domain.MailboxStatus;
import com.mailmirror.domain.MirroredMessage;
import com.mailmirror.domain.UidSet;
import jakarta.mail.Flags;
import jakarta.mail.MessagingException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * In-memory IMAP session for pipeline and watcher tests.
 * Every call is appended to a journal, optionally shared between sessions.
 */
public class FakeMailSession implements WatchSession {

    private final List<String> journal;
    private final List<MirroredMessage> messages = new CopyOnWriteArrayList<>();
    private final List<MirroredMessage> appended = new CopyOnWriteArrayList<>();
    private final List<Flags> appendedFlags = new CopyOnWriteArrayList<>();
    private final List<UidSet> deleted = new CopyOnWriteArrayList<>();
    private final Semaphore idleWakeups = new Semaphore(0);
    private final AtomicInteger noops = new AtomicInteger();

    private volatile Consumer<MailboxEvent> listener = event -> {
    };
    private volatile boolean idleSupported = true;
    private volatile boolean closed;
    private volatile MessagingException selectFailure;
    private volatile MessagingException fetchFailure;
    private volatile long failAppendUid = -1;
    private volatile MessagingException markDeletedFailure;
    private volatile MessagingException idleFailure;

    public FakeMailSession() {
        this(new CopyOnWriteArrayList<>());
    }

    public FakeMailSession(List<String> journal) {
        this.journal = journal;
    }

    public static MirroredMessage message(long uid, Flags.Flag... flags) {
        Flags set = new Flags();
        for (Flags.Flag flag : flags) {
            set.add(flag);
        }
        byte[] body = ("Subject: message " + uid + "\r\n\r\nbody " + uid + "\r\n").getBytes(StandardCharsets.US_ASCII);
        return new MirroredMessage(uid, set, new Date(1_700_000_000_000L + uid), body);
    }

    public FakeMailSession withMessages(MirroredMessage... added) {
        messages.addAll(List.of(added));
        return this;
    }

    public FakeMailSession failSelect(String message) {
        selectFailure = new MessagingException(message);
        return this;
    }

    public FakeMailSession failFetch(String message) {
        fetchFailure = new MessagingException(message);
        return this;
    }

    public FakeMailSession failAppendOf(long uid) {
        failAppendUid = uid;
        return this;
    }

    public FakeMailSession failMarkDeleted(String message) {
        markDeletedFailure = new MessagingException(message);
        return this;
    }

    public FakeMailSession withoutIdle() {
        idleSupported = false;
        return this;
    }

    @Override
    public MailboxStatus select(String mailbox, boolean readOnly) throws MessagingException {
        journal.add((readOnly ? "EXAMINE " : "SELECT ") + mailbox);
        if (selectFailure != null) {
            throw selectFailure;
        }
        return new MailboxStatus(mailbox, messages.size(), readOnly);
    }

    @Override
    public void fetch(int first, int last, MessageHandler handler) throws MessagingException, InterruptedException {
        journal.add("FETCH " + first + ":" + last);
        if (fetchFailure != null) {
            throw fetchFailure;
        }
        for (MirroredMessage message : new ArrayList<>(messages.subList(first - 1, last))) {
            if (!handler.accept(message)) {
                return;
            }
        }
    }

    @Override
    public void append(String mailbox, MirroredMessage message, Flags flags) throws MessagingException {
        if (message.uid() == failAppendUid) {
            journal.add("APPEND " + message.uid() + " failed");
            throw new MessagingException("APPEND rejected for " + message.uid());
        }
        journal.add("APPEND " + message.uid());
        appended.add(message);
        appendedFlags.add(flags);
    }

    @Override
    public void markDeleted(UidSet uids) throws MessagingException {
        journal.add("UID STORE " + uids + " +FLAGS (\\Deleted)");
        if (markDeletedFailure != null) {
            throw markDeletedFailure;
        }
        deleted.add(uids);
    }

    @Override
    public void setEventListener(Consumer<MailboxEvent> listener) {
        this.listener = listener;
    }

    @Override
    public boolean supportsIdle() {
        return idleSupported;
    }

    @Override
    public void idle() throws MessagingException {
        try {
            idleWakeups.tryAcquire(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MessagingException("IDLE interrupted", e);
        }
        MessagingException failure = idleFailure;
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public void noop() {
        noops.incrementAndGet();
    }

    @Override
    public void interruptIdle() {
        idleWakeups.release();
    }

    @Override
    public void close() {
        closed = true;
    }

    /**
     * Deliver an unsolicited server notification, as the IMAP reader thread would
     */
    public void emit(MailboxEvent event) {
        listener.accept(event);
    }

    /**
     * Make the running IDLE end with a connection error
     */
    public void dropConnection(String message) {
        idleFailure = new MessagingException(message);
        idleWakeups.release();
    }

    public List<String> getJournal() {
        return journal;
    }

    public List<MirroredMessage> getAppended() {
        return appended;
    }

    public List<Flags> getAppendedFlags() {
        return appendedFlags;
    }

    public List<UidSet> getDeleted() {
        return deleted;
    }

    public int getNoopCount() {
        return noops.get();
    }

    public boolean isClosed() {
        return closed;
    }
}

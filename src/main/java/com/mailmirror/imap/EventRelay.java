package com.mailmirror.imap;

import com.mailmirror.domain.MailboxEvent;
import com.mailmirror.exception.MirrorException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-slot hand-off between the IMAP reader thread and the watch loop.
 * The reader never blocks: a newer event replaces the pending one,
 * except that a pending mailbox change is kept over non-trigger events.
 */
@Slf4j
class EventRelay {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private MailboxEvent pending;
    private MirrorException failure;
    private boolean finished;

    void publish(MailboxEvent event) {
        lock.lock();
        try {
            if (finished || failure != null) {
                return;
            }
            if (pending != null && pending.isTrigger() && !event.isTrigger()) {
                log.trace("Keeping pending {} over {}", pending.kind(), event.kind());
                return;
            }
            pending = event;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait for the next event
     *
     * @return the pending event, or null once finished
     * @throws MirrorException the failure reported by the reader
     */
    MailboxEvent take() throws MirrorException, InterruptedException {
        lock.lock();
        try {
            while (true) {
                if (finished) {
                    return null;
                }
                if (pending != null) {
                    MailboxEvent event = pending;
                    pending = null;
                    return event;
                }
                if (failure != null) {
                    throw failure;
                }
                changed.await();
            }
        } finally {
            lock.unlock();
        }
    }

    void finish() {
        lock.lock();
        try {
            finished = true;
            pending = null;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    void fail(MirrorException error) {
        lock.lock();
        try {
            if (failure == null) {
                failure = error;
            }
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }
}

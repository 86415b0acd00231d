package com.mailmirror.imap;

import com.mailmirror.domain.Account;
import com.mailmirror.domain.MailboxEvent;
import com.mailmirror.domain.MailboxStatus;
import com.mailmirror.exception.ConnectionException;
import com.mailmirror.exception.MirrorException;
import jakarta.mail.MessagingException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Watches the source mailbox on a dedicated session
 * - IDLE when the server supports it, with a NOOP every fallback interval
 * - Otherwise NOOP polling every fallback interval
 * - Mailbox changes run the change handler on the calling thread, one at a time
 */
@Slf4j
public class IdleWatcher {

    public static final Duration DEFAULT_FALLBACK = Duration.ofMinutes(1);

    /**
     * Invoked for every mailbox change; a failure ends the watch
     */
    @FunctionalInterface
    public interface ChangeHandler {
        void handle() throws MirrorException;
    }

    private final Account account;
    private final WatchSession session;
    private final Duration fallback;
    private final EventRelay relay = new EventRelay();
    private final CountDownLatch stopLatch = new CountDownLatch(1);

    private volatile boolean stopped;

    public IdleWatcher(Account account, WatchSession session, Duration fallback) {
        this.account = account;
        this.session = session;
        this.fallback = fallback == null || fallback.isZero() || fallback.isNegative() ? DEFAULT_FALLBACK : fallback;
    }

    public Duration getFallback() {
        return fallback;
    }

    /**
     * Select the source mailbox and queue an initial change, so the first
     * watch cycle moves whatever is already there.
     */
    public void prime() throws ConnectionException {
        String mailbox = account.getSource().mailbox();
        session.setEventListener(relay::publish);
        try {
            MailboxStatus status = session.select(mailbox, false);
            log.info("{} [{}]: Watching {} ({} messages)", account.getName(), account.getState(),
                    mailbox, status.messages());
            relay.publish(MailboxEvent.mailboxChanged(status.messages()));
        } catch (MessagingException e) {
            throw new ConnectionException("Selecting " + account.getSource().credentials() + " failed: "
                    + e.getMessage(), e);
        }
    }

    /**
     * Block until {@link #stop()} is called, the session fails or the handler fails
     */
    public void watch(ChangeHandler handler) throws MirrorException {
        boolean idle;
        try {
            idle = session.supportsIdle();
        } catch (MessagingException e) {
            throw new ConnectionException("Capability check on " + account.getSource().credentials()
                    + " failed: " + e.getMessage(), e);
        }
        if (!idle) {
            log.info("{} [{}]: IDLE not supported, polling every {}s", account.getName(), account.getState(),
                    fallback.toSeconds());
        }

        Disposable poller = Schedulers.boundedElastic().schedule(() -> longPoll(idle));
        Disposable watchdog = idle
                ? Schedulers.boundedElastic().schedulePeriodically(this::keepAlive,
                        fallback.toMillis(), fallback.toMillis(), TimeUnit.MILLISECONDS)
                : Disposables.disposed();
        try {
            MailboxEvent event;
            while ((event = relay.take()) != null) {
                log.info("{} [{}]: Mailbox update {} ({} messages)", account.getName(), account.getState(),
                        event.kind(), event.messages());
                if (event.isTrigger()) {
                    handler.handle();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionException("Interrupted while watching " + account.getSource().credentials(), e);
        } finally {
            stop();
            watchdog.dispose();
            poller.dispose();
        }
    }

    /**
     * End the watch; safe to call from any thread, more than once
     */
    public void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        stopLatch.countDown();
        relay.finish();
        session.interruptIdle();
    }

    public boolean isStopped() {
        return stopped;
    }

    private void longPoll(boolean idle) {
        try {
            while (!stopped) {
                if (idle) {
                    session.idle();
                } else {
                    if (stopLatch.await(fallback.toMillis(), TimeUnit.MILLISECONDS)) {
                        return;
                    }
                    session.noop();
                }
            }
        } catch (MessagingException e) {
            if (!stopped) {
                relay.fail(new ConnectionException("Watching " + account.getSource().credentials() + " failed: "
                        + e.getMessage(), e));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            relay.fail(new ConnectionException("Watcher of " + account.getSource().credentials()
                    + " stopped unexpectedly", e));
        }
    }

    private void keepAlive() {
        if (stopped) {
            return;
        }
        try {
            session.noop();
        } catch (MessagingException e) {
            log.warn("{} [{}]: NOOP on {} failed: {}", account.getName(), account.getState(),
                    account.getSource().credentials(), e.getMessage());
        }
    }
}

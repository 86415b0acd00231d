package com.mailmirror.service;

import com.mailmirror.domain.Account;
import com.mailmirror.domain.AccountState;
import com.mailmirror.domain.MailStoreCredentials;
import com.mailmirror.exception.MirrorException;
import com.mailmirror.imap.ConnectionManager;
import com.mailmirror.imap.IdleWatcher;
import com.mailmirror.imap.MailSession;
import com.mailmirror.imap.WatchSession;
import com.mailmirror.sync.SyncPipeline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives one account through its lifecycle
 * - init: INITIAL -> CONNECTING -> CONNECTED (login check on both sides, watch session primed)
 * - watch: CONNECTED -> WATCHING, handle cycles on every mailbox change
 * - handle: -> HANDLING, one sync pipeline run on fresh sessions
 * - close: -> SHUTDOWN -> INITIAL
 */
@Slf4j
public class AccountEngine {

    private final Account account;
    private final ConnectionManager connections;
    private final Duration idleFallback;
    private final ExecutorService stageExecutor;
    private final SyncPipeline pipeline;
    private final AtomicBoolean handling = new AtomicBoolean();

    private volatile WatchSession watchSession;
    private volatile IdleWatcher watcher;
    private volatile boolean cancelled;

    public AccountEngine(Account account, ConnectionManager connections, Duration idleFallback, int queueCapacity) {
        this.account = account;
        this.connections = connections;
        this.idleFallback = idleFallback;
        this.stageExecutor = Executors.newCachedThreadPool(
                new CustomizableThreadFactory("mirror-" + account.getKey() + "-"));
        this.pipeline = new SyncPipeline(account, queueCapacity, stageExecutor);
    }

    public Account getAccount() {
        return account;
    }

    /**
     * Run the account until it is cancelled or fails.
     * Failures are recorded on the account, never thrown.
     */
    public void run() {
        try {
            init();
            if (!cancelled) {
                watch();
            }
            log.info("{} [{}]: Stopped", account.getName(), account.getState());
        } catch (MirrorException e) {
            account.recordFailure(e);
            log.error("{} [{}]: {}", account.getName(), e.getState(), e.getMessage(), e);
        } finally {
            close();
        }
    }

    public void init() throws MirrorException {
        account.transition(AccountState.CONNECTING);
        log.info("{} [{}]: Connecting {} -> {}", account.getName(), account.getState(),
                account.getSource().credentials(), account.getTarget().credentials());
        try {
            checkLogin(account.getSource().credentials());
            checkLogin(account.getTarget().credentials());

            WatchSession session = connections.openWatch(account.getSource().credentials());
            watchSession = session;
            IdleWatcher idleWatcher = new IdleWatcher(account, session, idleFallback);
            idleWatcher.prime();
            watcher = idleWatcher;
        } catch (MirrorException e) {
            throw e.attribute(account.getName(), account.getState());
        }
        account.transition(AccountState.CONNECTED);
        log.info("{} [{}]: Connected", account.getName(), account.getState());
    }

    /**
     * Block on the watcher; every mailbox change runs {@link #handle()}
     */
    public void watch() throws MirrorException {
        IdleWatcher idleWatcher = watcher;
        if (idleWatcher == null) {
            throw new IllegalStateException(account.getName() + ": watch() before init()");
        }

        AccountState saved = account.getState();
        account.transition(AccountState.WATCHING);
        try {
            idleWatcher.watch(this::handle);
        } catch (MirrorException e) {
            throw e.attribute(account.getName(), account.getState());
        } finally {
            account.restore(saved);
        }
    }

    /**
     * Move everything currently in the source mailbox; a cycle already in progress makes this a no-op
     */
    public void handle() throws MirrorException {
        if (!handling.compareAndSet(false, true)) {
            log.debug("{} [{}]: Handle cycle already running", account.getName(), account.getState());
            return;
        }

        AccountState saved = account.getState();
        try {
            account.transition(AccountState.HANDLING);
            try (MailSession source = connections.open(account.getSource().credentials());
                 MailSession target = connections.open(account.getTarget().credentials())) {
                pipeline.run(source, target);
            }
        } catch (MirrorException e) {
            throw e.attribute(account.getName(), account.getState());
        } finally {
            account.restore(saved);
            handling.set(false);
        }
    }

    /**
     * Stop watching; the running handle cycle, if any, finishes first
     */
    public void cancel() {
        cancelled = true;
        IdleWatcher idleWatcher = watcher;
        if (idleWatcher != null) {
            idleWatcher.stop();
        }
    }

    public void close() {
        if (account.getState() != AccountState.SHUTDOWN) {
            account.transition(AccountState.SHUTDOWN);
        }
        log.info("{} [{}]: Shutting down", account.getName(), account.getState());

        IdleWatcher idleWatcher = watcher;
        if (idleWatcher != null) {
            idleWatcher.stop();
        }
        WatchSession session = watchSession;
        if (session != null) {
            session.close();
        }
        watcher = null;
        watchSession = null;
        stageExecutor.shutdown();

        account.transition(AccountState.INITIAL);
    }

    private void checkLogin(MailStoreCredentials credentials) throws MirrorException {
        try (MailSession session = connections.open(credentials)) {
            log.debug("{} [{}]: Login to {} ok", account.getName(), account.getState(), credentials);
        }
    }
}

package com.mailmirror.sync;

import com.mailmirror.domain.Account;
import com.mailmirror.domain.MailboxStatus;
import com.mailmirror.domain.MirroredMessage;
import com.mailmirror.domain.UidSet;
import com.mailmirror.exception.CleanupException;
import com.mailmirror.exception.FetchException;
import com.mailmirror.exception.MirrorException;
import com.mailmirror.exception.StoreException;
import com.mailmirror.imap.MailSession;
import jakarta.mail.MessagingException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;

/**
 * Moves every message of the source mailbox to the target mailbox
 * - fetch: EXAMINE source, FETCH 1:n -> message queue
 * - store: SELECT target, APPEND each message -> delete queue (source UIDs)
 * - cleanup: collect UIDs, SELECT source, UID STORE +FLAGS (\Deleted)
 * The three stages run concurrently; the first stage failure is the result.
 */
@Slf4j
public class SyncPipeline {

    private static final int STAGES = 3;

    private final Account account;
    private final int queueCapacity;
    private final Executor executor;

    public SyncPipeline(Account account, int queueCapacity, Executor executor) {
        this.account = account;
        this.queueCapacity = queueCapacity;
        this.executor = executor;
    }

    /**
     * Run one cycle on freshly opened sessions and wait for all stages
     *
     * @throws MirrorException the first stage failure
     */
    public void run(MailSession source, MailSession target) throws MirrorException {
        StageQueue<MirroredMessage> messages = new StageQueue<>(queueCapacity);
        StageQueue<Long> deletes = new StageQueue<>(queueCapacity);

        CompletionService<Void> stages = new ExecutorCompletionService<>(executor);
        stages.submit(() -> {
            fetch(source, messages);
            return null;
        });
        stages.submit(() -> {
            store(target, messages, deletes);
            return null;
        });
        stages.submit(() -> {
            cleanup(source, deletes);
            return null;
        });

        MirrorException failure = null;
        for (int i = 0; i < STAGES; i++) {
            try {
                next(stages, messages).get();
            } catch (ExecutionException e) {
                MirrorException error = toMirrorException(e.getCause());
                if (failure == null) {
                    failure = error;
                    messages.abort();
                } else {
                    log.debug("{} [{}]: Additional stage failure: {}", account.getName(), account.getState(),
                            error.getMessage());
                }
            } catch (InterruptedException e) {
                // next() never throws once the future is done
                Thread.currentThread().interrupt();
            }
        }

        if (failure != null) {
            log.warn("{} [{}]: Message handling failed: {}", account.getName(), account.getState(),
                    failure.getMessage());
            throw failure;
        }
        log.info("{} [{}]: Message handling successful", account.getName(), account.getState());
    }

    void fetch(MailSession source, StageQueue<MirroredMessage> messages) throws FetchException {
        String mailbox = account.getSource().mailbox();
        boolean closed = false;
        try {
            MailboxStatus status = source.select(mailbox, true);
            if (status.messages() < 1) {
                log.info("{} [{}]: No messages in {}", account.getName(), account.getState(), mailbox);
            } else {
                log.info("{} [{}]: Fetching {} messages from {}", account.getName(), account.getState(),
                        status.messages(), mailbox);
                source.fetch(1, status.messages(), messages::put);
            }
            messages.close();
            closed = true;
        } catch (MessagingException e) {
            throw new FetchException("Fetching from " + account.getSource().credentials() + " failed: "
                    + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException("Fetch interrupted", e);
        } finally {
            if (!closed) {
                messages.abort();
            }
        }
    }

    void store(MailSession target, StageQueue<MirroredMessage> messages, StageQueue<Long> deletes)
            throws StoreException {
        String mailbox = account.getTarget().mailbox();
        MirroredMessage message = null;
        try {
            target.select(mailbox, false);
            while ((message = messages.take()) != null) {
                log.info("{} [{}]: Handling message {}", account.getName(), account.getState(), message.uid());
                if (message.isDeleted()) {
                    log.info("{} [{}]: Ignoring message {}", account.getName(), account.getState(), message.uid());
                    continue;
                }

                log.info("{} [{}]: Storing message {}", account.getName(), account.getState(), message.uid());
                target.append(mailbox, message, message.forwardableFlags());
                account.recordProcessed();

                if (!deletes.put(message.uid())) {
                    break;
                }
            }
        } catch (MessagingException e) {
            String what = message != null ? "message " + message.uid() : mailbox;
            throw new StoreException("Storing " + what + " to " + account.getTarget().credentials() + " failed: "
                    + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException("Store interrupted", e);
        } finally {
            messages.abort();
            deletes.close();
        }
    }

    void cleanup(MailSession source, StageQueue<Long> deletes) throws CleanupException {
        String mailbox = account.getSource().mailbox();
        UidSet uids = new UidSet();
        try {
            Long uid;
            while ((uid = deletes.take()) != null) {
                log.info("{} [{}]: Deleting message {}", account.getName(), account.getState(), uid);
                uids.add(uid);
            }
            if (uids.isEmpty()) {
                return;
            }

            source.select(mailbox, false);
            source.markDeleted(uids);
            log.info("{} [{}]: Flagged {} messages as deleted ({})", account.getName(), account.getState(),
                    uids.size(), uids);
        } catch (MessagingException e) {
            throw new CleanupException("Flagging " + uids + " as deleted in " + account.getSource().credentials()
                    + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CleanupException("Cleanup interrupted", e);
        } finally {
            deletes.abort();
        }
    }

    /**
     * Wait for the next stage; an interrupt stops the fetch side but keeps waiting,
     * so messages already stored are still cleaned up.
     */
    private static Future<Void> next(CompletionService<Void> stages, StageQueue<?> messages) {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    return stages.take();
                } catch (InterruptedException e) {
                    interrupted = true;
                    messages.abort();
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static MirrorException toMirrorException(Throwable cause) {
        if (cause instanceof MirrorException mirrorException) {
            return mirrorException;
        }
        if (cause instanceof RuntimeException runtimeException) {
            throw runtimeException;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        throw new IllegalStateException("Unexpected stage failure", cause);
    }
}

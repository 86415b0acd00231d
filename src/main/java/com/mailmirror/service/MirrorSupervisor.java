package com.mailmirror.service;

import com.mailmirror.config.MirrorProperties;
import com.mailmirror.domain.Account;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs every configured account concurrently
 * - One engine per account on the bounded-elastic scheduler
 * - A failing account never stops the others
 * - Shutdown cancels all engines
 * - Optionally exits the process once every account has terminated
 */
@Slf4j
@Component
public class MirrorSupervisor {

    private final MirrorProperties properties;
    private final ApplicationContext context;
    private final List<AccountEngine> engines;
    private final AtomicInteger crashed = new AtomicInteger();

    private volatile Disposable running;
    private volatile boolean shuttingDown;

    public MirrorSupervisor(MirrorProperties properties, AccountEngineFactory engineFactory,
            ApplicationContext context) {
        properties.validate();
        this.properties = properties;
        this.context = context;
        this.engines = properties.toAccounts().stream()
                .map(engineFactory::create)
                .toList();
    }

    @PostConstruct
    public void start() {
        log.info("=== Mirroring {} accounts ===", engines.size());
        running = Flux.fromIterable(engines)
                .flatMap(engine -> Mono.fromRunnable(engine::run)
                        .subscribeOn(Schedulers.boundedElastic())
                        .onErrorResume(e -> {
                            crashed.incrementAndGet();
                            log.error("{}: Engine crashed", engine.getAccount().getName(), e);
                            return Mono.empty();
                        }), Math.max(1, engines.size()))
                .then()
                .subscribe(null, null, this::onAllTerminated);
    }

    @PreDestroy
    public void stop() {
        shuttingDown = true;
        log.info("Shutting down {} accounts...", engines.size());
        engines.forEach(AccountEngine::cancel);
    }

    public List<Account> getAccounts() {
        return engines.stream().map(AccountEngine::getAccount).toList();
    }

    public Optional<Account> findAccount(String name) {
        return getAccounts().stream().filter(account -> account.getName().equals(name)).findFirst();
    }

    public boolean isRunning() {
        Disposable current = running;
        return current != null && !current.isDisposed();
    }

    /**
     * Number of accounts that ended with an error
     */
    public long failedCount() {
        return getAccounts().stream().filter(account -> account.getLastError() != null).count() + crashed.get();
    }

    private void onAllTerminated() {
        long failed = failedCount();
        log.info("All accounts terminated ({} failed)", failed);
        if (!properties.isExitOnCompletion() || shuttingDown) {
            return;
        }

        int status = failed > 0 ? 1 : 0;
        // closing the context from a scheduler thread would block on that scheduler's own disposal
        Thread exit = new Thread(() -> System.exit(SpringApplication.exit(context, () -> status)), "mirror-exit");
        exit.start();
    }
}

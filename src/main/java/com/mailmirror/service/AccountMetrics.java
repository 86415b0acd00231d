package com.mailmirror.service;

import com.mailmirror.domain.Account;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Per-account meters, read from the account records at scrape time
 */
@Component
@RequiredArgsConstructor
public class AccountMetrics implements MeterBinder {

    private final MirrorSupervisor supervisor;

    @Override
    public void bindTo(MeterRegistry registry) {
        for (Account account : supervisor.getAccounts()) {
            Gauge.builder("mail.account.state", account, a -> a.getState().getCode())
                    .description("Lifecycle state of the account (0=INITIAL .. 5=SHUTDOWN)")
                    .tag("name", account.getName())
                    .register(registry);
            FunctionCounter.builder("mail.account.messages", account, Account::getProcessedCount)
                    .description("Messages moved from source to target")
                    .tag("name", account.getName())
                    .register(registry);
        }
    }
}

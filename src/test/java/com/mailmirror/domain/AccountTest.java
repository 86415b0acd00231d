package com.mailmirror.domain;

import com.mailmirror.exception.StoreException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Account and lifecycle state machine tests
 */
class AccountTest {

    private final Account account = TestAccounts.account("alice@source.test");

    @Test
    @DisplayName("Full lifecycle is accepted")
    void testTransition_Lifecycle() {
        account.transition(AccountState.CONNECTING);
        account.transition(AccountState.CONNECTED);
        account.transition(AccountState.WATCHING);
        account.transition(AccountState.HANDLING);
        account.transition(AccountState.WATCHING);
        account.transition(AccountState.SHUTDOWN);
        account.transition(AccountState.INITIAL);

        assertThat(account.getState()).isEqualTo(AccountState.INITIAL);
    }

    @Test
    @DisplayName("Skipping CONNECTING is rejected")
    void testTransition_Invalid() {
        assertThatThrownBy(() -> account.transition(AccountState.WATCHING))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("INITIAL -> WATCHING");
        assertThat(account.getState()).isEqualTo(AccountState.INITIAL);
    }

    @Test
    @DisplayName("Every state can shut down; SHUTDOWN only leads to INITIAL")
    void testTransition_Shutdown() {
        for (AccountState state : AccountState.values()) {
            if (state != AccountState.SHUTDOWN) {
                assertThat(state.canTransitionTo(AccountState.SHUTDOWN)).isTrue();
            }
        }
        assertThat(AccountState.SHUTDOWN.successors()).containsExactly(AccountState.INITIAL);
    }

    @Test
    @DisplayName("HANDLING is only entered from WATCHING")
    void testTransition_HandlingOnlyFromWatching() {
        account.transition(AccountState.CONNECTING);
        account.transition(AccountState.CONNECTED);

        assertThatThrownBy(() -> account.transition(AccountState.HANDLING))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("CONNECTED -> HANDLING");
        assertThat(AccountState.HANDLING.successors())
                .containsExactlyInAnyOrder(AccountState.WATCHING, AccountState.SHUTDOWN);
    }

    @Test
    @DisplayName("Restore returns to the saved state, but not once shutdown began")
    void testRestore() {
        account.transition(AccountState.CONNECTING);
        account.transition(AccountState.CONNECTED);
        account.transition(AccountState.WATCHING);
        account.transition(AccountState.HANDLING);

        account.restore(AccountState.WATCHING);
        assertThat(account.getState()).isEqualTo(AccountState.WATCHING);

        account.restore(AccountState.CONNECTED);
        assertThat(account.getState()).isEqualTo(AccountState.CONNECTED);

        account.transition(AccountState.WATCHING);
        account.transition(AccountState.HANDLING);
        account.transition(AccountState.SHUTDOWN);
        account.restore(AccountState.WATCHING);
        assertThat(account.getState()).isEqualTo(AccountState.SHUTDOWN);
    }

    @Test
    @DisplayName("Gauge codes follow the lifecycle order")
    void testStateCodes() {
        assertThat(AccountState.INITIAL.getCode()).isZero();
        assertThat(AccountState.HANDLING.getCode()).isEqualTo(4);
        assertThat(AccountState.SHUTDOWN.getCode()).isEqualTo(5);
    }

    @Test
    @DisplayName("Failure is attributed to the account and its current state")
    void testRecordFailure() {
        account.transition(AccountState.CONNECTING);
        StoreException error = new StoreException("APPEND failed");

        account.recordFailure(error);

        assertThat(account.getLastError()).isSameAs(error);
        assertThat(error.getAccountName()).isEqualTo("alice@source.test");
        assertThat(error.getState()).isEqualTo(AccountState.CONNECTING);
    }

    @Test
    @DisplayName("Key replaces '@' and '.' with '-'")
    void testKey() {
        assertThat(account.getKey()).isEqualTo("alice-source-test");
    }

    @Test
    @DisplayName("Credentials: default port 993, explicit port, password never printed")
    void testCredentials() {
        assertThat(TestAccounts.SOURCE.port()).isEqualTo(993);
        assertThat(TestAccounts.SOURCE.host()).isEqualTo("imap.source.test");
        assertThat(TestAccounts.TARGET.port()).isEqualTo(1993);
        assertThat(TestAccounts.TARGET.host()).isEqualTo("imap.target.test");
        assertThat(TestAccounts.SOURCE.toString()).doesNotContain("secret");
    }
}

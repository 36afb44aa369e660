package com.libragraph.modelgate.core.task;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class RetryPolicyTest {

    private final RetryPolicy policy =
            new RetryPolicy(3, Duration.ofMillis(500), 2.0, Duration.ofSeconds(10));

    @Test
    void delaysGrowExponentially() {
        assertThat(policy.delayAfter(1)).isEqualTo(Duration.ofMillis(500));
        assertThat(policy.delayAfter(2)).isEqualTo(Duration.ofMillis(1000));
        assertThat(policy.delayAfter(3)).isEqualTo(Duration.ofMillis(2000));
    }

    @Test
    void delaysAreCapped() {
        assertThat(policy.delayAfter(20)).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void attemptBudget() {
        assertThat(policy.allowsAnotherAttempt(1)).isTrue();
        assertThat(policy.allowsAnotherAttempt(2)).isTrue();
        assertThat(policy.allowsAnotherAttempt(3)).isFalse();
        assertThat(RetryPolicy.noRetries().allowsAnotherAttempt(1)).isFalse();
    }

    @Test
    void rejectsNonsense() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new RetryPolicy(0, Duration.ZERO, 2.0, Duration.ZERO));
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new RetryPolicy(3, Duration.ZERO, 0.5, Duration.ZERO));
    }
}

package com.myorg.docinsight.service.ranking;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Deadline Tests")
class DeadlineTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);

    @Test
    @DisplayName("should never expire without a budget")
    void shouldNeverExpire_whenNone() {
        assertThat(Deadline.none().isExpired()).isFalse();
        assertThat(Deadline.ofMillis(0, clock).isExpired()).isFalse();
        assertThat(Deadline.ofMillis(-5, clock).isExpired()).isFalse();
    }

    @Test
    @DisplayName("should expire once the clock reaches the budget")
    void shouldExpire_whenBudgetUsed() {
        assertThat(Deadline.after(Duration.ZERO, clock).isExpired()).isTrue();
        assertThat(Deadline.after(Duration.ofSeconds(1), clock).isExpired()).isFalse();
    }
}

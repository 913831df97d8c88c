package com.wealthdesk.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.wealthdesk.oms.OrderExecutionQueue;
import com.wealthdesk.oms.ScheduledExecution;
import com.wealthdesk.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OrderExecutionQueueTest {

    private static final Instant START = Instant.parse("2025-03-03T10:00:00Z");

    private MutableClock clock;
    private OrderExecutionQueue queue;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        queue = new OrderExecutionQueue(clock, Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("An entry is due fill-delay after enqueue on the injected clock")
    void entryDueAfterDelay() {
        ScheduledExecution execution = queue.enqueue("order-1");

        assertThat(execution.getDueAt()).isEqualTo(START.plusSeconds(2));
        assertThat(queue.pollDue()).isNull();

        clock.advance(Duration.ofMillis(1999));
        assertThat(queue.pollDue()).isNull();

        clock.advance(Duration.ofMillis(1));
        assertThat(queue.pollDue().getOrderId()).isEqualTo("order-1");
        assertThat(queue.size()).isZero();
    }

    @Test
    @DisplayName("Entries come out in due order, ties in submission order")
    void dueOrdering() {
        queue.enqueue("order-1");
        queue.enqueue("order-2");
        clock.advance(Duration.ofSeconds(1));
        queue.enqueue("order-3");

        clock.advance(Duration.ofSeconds(5));

        assertThat(queue.pollDue().getOrderId()).isEqualTo("order-1");
        assertThat(queue.pollDue().getOrderId()).isEqualTo("order-2");
        assertThat(queue.pollDue().getOrderId()).isEqualTo("order-3");
        assertThat(queue.pollDue()).isNull();
    }

    @Test
    @DisplayName("pollAny returns entries that are not yet due")
    void pollAnyIgnoresDelay() {
        queue.enqueue("order-1");

        assertThat(queue.pollDue()).isNull();
        assertThat(queue.pollAny().getOrderId()).isEqualTo("order-1");
        assertThat(queue.pollAny()).isNull();
    }

    @Test
    @DisplayName("A negative fill delay is refused")
    void negativeDelayRefused() {
        assertThatThrownBy(() -> new OrderExecutionQueue(clock, Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("fill-delay");
    }
}

package com.wealthdesk.oms;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;

/**
 * An accepted order waiting in the {@link OrderExecutionQueue} until its fill is due.
 * The remaining delay is measured against the injected clock, so a test clock
 * controls when entries become available.
 */
public class ScheduledExecution implements Delayed {

    private final String orderId;
    private final Instant dueAt;
    private final long sequence;
    private final Clock clock;

    ScheduledExecution(String orderId, Instant dueAt, long sequence, Clock clock) {
        this.orderId = orderId;
        this.dueAt = dueAt;
        this.sequence = sequence;
        this.clock = clock;
    }

    public String getOrderId() {
        return orderId;
    }

    public Instant getDueAt() {
        return dueAt;
    }

    @Override
    public long getDelay(TimeUnit unit) {
        return unit.convert(Duration.between(clock.instant(), dueAt));
    }

    /** Earlier due time first; ties keep submission order. */
    @Override
    public int compareTo(Delayed other) {
        if (other instanceof ScheduledExecution that) {
            int byDue = dueAt.compareTo(that.dueAt);
            return byDue != 0 ? byDue : Long.compare(sequence, that.sequence);
        }
        return Long.compare(getDelay(TimeUnit.NANOSECONDS), other.getDelay(TimeUnit.NANOSECONDS));
    }

    @Override
    public String toString() {
        return "ScheduledExecution{orderId=" + orderId + ", dueAt=" + dueAt + "}";
    }
}

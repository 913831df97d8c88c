package com.wealthdesk.oms;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Delay queue of accepted orders awaiting their simulated fill.
 *
 * <p>Each order becomes available {@code wealthdesk.execution.fill-delay} (default 2s)
 * after it was enqueued, measured on the injected {@link Clock}. The single consumer
 * is {@link OrderExecutionProcessor}.
 */
@Component
public class OrderExecutionQueue {

    private static final Logger log = LoggerFactory.getLogger(OrderExecutionQueue.class);

    private final DelayQueue<ScheduledExecution> queue = new DelayQueue<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;
    private final Duration fillDelay;

    public OrderExecutionQueue(Clock clock, @Value("${wealthdesk.execution.fill-delay:PT2S}") Duration fillDelay) {
        if (fillDelay.isNegative()) {
            throw new IllegalStateException("wealthdesk.execution.fill-delay must not be negative, got " + fillDelay);
        }
        this.clock = clock;
        this.fillDelay = fillDelay;
    }

    public ScheduledExecution enqueue(String orderId) {
        ScheduledExecution execution =
                new ScheduledExecution(orderId, clock.instant().plus(fillDelay), sequence.incrementAndGet(), clock);
        queue.offer(execution);
        log.debug("Enqueued {} (depth={})", execution, queue.size());
        return execution;
    }

    /** Next due entry, or null if none is due yet. */
    public ScheduledExecution pollDue() {
        return queue.poll();
    }

    /** Waits up to {@code timeout} for an entry to become due. */
    public ScheduledExecution pollDue(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    /** Removes and returns the earliest entry whether or not it is due. Used when draining on shutdown. */
    public ScheduledExecution pollAny() {
        ScheduledExecution head = queue.peek();
        if (head != null && queue.remove(head)) {
            return head;
        }
        return null;
    }

    public int size() {
        return queue.size();
    }

    public Duration getFillDelay() {
        return fillDelay;
    }
}

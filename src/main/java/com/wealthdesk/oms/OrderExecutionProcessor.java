package com.wealthdesk.oms;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Single consumer thread that takes due entries from the {@link OrderExecutionQueue}
 * and hands them to the {@link OrderExecutor}.
 *
 * <p>A failure while executing one order is logged and does not stop the loop. On
 * shutdown every remaining entry is executed, due or not, so no accepted order is
 * left PENDING.
 *
 * <p>With {@code wealthdesk.execution.consumer-enabled=false} the thread is not started
 * and callers drive execution through {@link #processDue()}.
 */
@Component
public class OrderExecutionProcessor implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(OrderExecutionProcessor.class);

    private static final long SHUTDOWN_JOIN_MILLIS = 10_000;

    private final OrderExecutionQueue orderExecutionQueue;
    private final OrderExecutor orderExecutor;
    private final boolean consumerEnabled;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private Thread consumerThread;

    public OrderExecutionProcessor(
            OrderExecutionQueue orderExecutionQueue,
            OrderExecutor orderExecutor,
            @Value("${wealthdesk.execution.consumer-enabled:true}") boolean consumerEnabled) {
        this.orderExecutionQueue = orderExecutionQueue;
        this.orderExecutor = orderExecutor;
        this.consumerEnabled = consumerEnabled;
    }

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            consumerThread = new Thread(this::processLoop, "order-execution-processor");
            consumerThread.setDaemon(true);
            consumerThread.start();
            log.info("OrderExecutionProcessor started (fill delay {})", orderExecutionQueue.getFillDelay());
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("OrderExecutionProcessor stopping");
            if (consumerThread != null) {
                consumerThread.interrupt();
                try {
                    consumerThread.join(SHUTDOWN_JOIN_MILLIS);
                } catch (InterruptedException e) {
                    log.warn("Interrupted while waiting for the execution thread to drain");
                    Thread.currentThread().interrupt();
                }
            }
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public boolean isAutoStartup() {
        return consumerEnabled;
    }

    /**
     * Executes every entry that is due now on the calling thread.
     *
     * @return number of entries processed
     */
    public int processDue() {
        int processed = 0;
        ScheduledExecution execution;
        while ((execution = orderExecutionQueue.pollDue()) != null) {
            process(execution);
            processed++;
        }
        return processed;
    }

    void process(ScheduledExecution execution) {
        try {
            orderExecutor.execute(execution.getOrderId());
        } catch (RuntimeException e) {
            log.error("Execution of order {} failed unexpectedly", execution.getOrderId(), e);
        }
    }

    private void processLoop() {
        while (running.get()) {
            try {
                ScheduledExecution execution = orderExecutionQueue.pollDue(1, TimeUnit.SECONDS);
                if (execution != null) {
                    process(execution);
                }
            } catch (InterruptedException e) {
                if (!running.get()) {
                    log.info("OrderExecutionProcessor interrupted during shutdown");
                    break;
                }
                log.warn("OrderExecutionProcessor interrupted unexpectedly, resuming");
            }
        }
        drainRemaining();
    }

    private void drainRemaining() {
        int drained = 0;
        ScheduledExecution remaining;
        while ((remaining = orderExecutionQueue.pollAny()) != null) {
            process(remaining);
            drained++;
        }
        if (drained > 0) {
            log.info("Drained {} remaining executions during shutdown", drained);
        }
    }
}

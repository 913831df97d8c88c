package com.wealthdesk.observability;

import com.wealthdesk.event.OrderEvent;
import com.wealthdesk.event.RiskEvent;
import com.wealthdesk.oms.OrderExecutionQueue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the order pipeline:
 * <ul>
 *   <li><b>orders.created.count</b>: accepted submissions</li>
 *   <li><b>orders.executed.count</b> / <b>orders.failed.count</b>: terminal transitions</li>
 *   <li><b>orders.rejected.count</b>: rejected submissions, tagged with the rejection code</li>
 *   <li><b>orders.fill.latency</b>: order creation to execution</li>
 *   <li><b>orders.execution.queue.depth</b>: entries waiting for their fill</li>
 * </ul>
 *
 * Counters are driven by application events; the gauge is polled on scrape.
 */
@Service
public class CustomMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter ordersCreatedCounter;
    private final Counter ordersExecutedCounter;
    private final Counter ordersFailedCounter;
    private final Timer fillLatencyTimer;

    public CustomMetricsService(MeterRegistry meterRegistry, OrderExecutionQueue orderExecutionQueue) {
        this.meterRegistry = meterRegistry;

        this.ordersCreatedCounter = Counter.builder("orders.created.count")
                .description("Orders accepted at submission")
                .register(meterRegistry);

        this.ordersExecutedCounter = Counter.builder("orders.executed.count")
                .description("Orders filled")
                .register(meterRegistry);

        this.ordersFailedCounter = Counter.builder("orders.failed.count")
                .description("Accepted orders that could not be filled")
                .register(meterRegistry);

        this.fillLatencyTimer = Timer.builder("orders.fill.latency")
                .description("Time from order acceptance to fill")
                .register(meterRegistry);

        meterRegistry.gauge("orders.execution.queue.depth", orderExecutionQueue, OrderExecutionQueue::size);
    }

    @EventListener
    @Order(20)
    public void onOrderEvent(OrderEvent event) {
        switch (event.getEventType()) {
            case CREATED -> ordersCreatedCounter.increment();
            case EXECUTED -> {
                ordersExecutedCounter.increment();
                if (event.getOrder().getCreatedAt() != null && event.getOrder().getExecutedAt() != null) {
                    fillLatencyTimer.record(
                            Duration.between(event.getOrder().getCreatedAt(), event.getOrder().getExecutedAt()));
                }
            }
            case FAILED -> ordersFailedCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onRiskEvent(RiskEvent event) {
        Object code = event.getDetails().getOrDefault("rejectionCode", "UNKNOWN");
        rejectedCounter(String.valueOf(code)).increment();
    }

    private Counter rejectedCounter(String code) {
        return Counter.builder("orders.rejected.count")
                .description("Submissions rejected by pre-trade checks")
                .tag("code", code)
                .register(meterRegistry);
    }
}

package com.wealthdesk.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.wealthdesk.domain.enums.AssetClass;
import com.wealthdesk.domain.enums.OrderSide;
import com.wealthdesk.event.OrderEvent;
import com.wealthdesk.event.RiskEvent;
import com.wealthdesk.observability.CustomMetricsService;
import com.wealthdesk.oms.OrderRequest;
import com.wealthdesk.support.EngineFixture;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Drives the real engine and replays its published events into the metrics
 * listener, then reads the meters back from a SimpleMeterRegistry.
 */
class CustomMetricsServiceTest {

    private EngineFixture fixture;
    private SimpleMeterRegistry meterRegistry;
    private CustomMetricsService metricsService;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        fixture.addInstrument("ins-eq", "EQX", AssetClass.EQUITY, "50", 5);
        fixture.addClient("cli-1", 6, "port-1", "1000");
        meterRegistry = new SimpleMeterRegistry();
        metricsService = new CustomMetricsService(meterRegistry, fixture.executionQueue);
    }

    private void submit(OrderSide side, int quantity) {
        fixture.orderEngine.submitOrder(OrderRequest.builder()
                .portfolioId("port-1")
                .instrumentId("ins-eq")
                .side(side)
                .quantity(quantity)
                .createdBy("adv-1")
                .build());
    }

    private void replayEvents() {
        fixture.eventsOfType(OrderEvent.class).forEach(metricsService::onOrderEvent);
        fixture.eventsOfType(RiskEvent.class).forEach(metricsService::onRiskEvent);
        fixture.publishedEvents.clear();
    }

    private double counter(String name) {
        return meterRegistry.get(name).counter().count();
    }

    @Test
    @DisplayName("Queue depth gauge follows entries waiting for their fill")
    void queueDepthGauge() {
        submit(OrderSide.BUY, 2);
        submit(OrderSide.BUY, 3);

        assertThat(meterRegistry.get("orders.execution.queue.depth").gauge().value())
                .isEqualTo(2.0);

        fixture.runDueExecutions();

        assertThat(meterRegistry.get("orders.execution.queue.depth").gauge().value())
                .isZero();
    }

    @Test
    @DisplayName("Created, executed and failed counters track the order lifecycle")
    void lifecycleCounters() {
        submit(OrderSide.BUY, 4);
        fixture.runDueExecutions();
        submit(OrderSide.SELL, 4);
        submit(OrderSide.SELL, 4);
        fixture.runDueExecutions();

        replayEvents();

        assertThat(counter("orders.created.count")).isEqualTo(3.0);
        assertThat(counter("orders.executed.count")).isEqualTo(2.0);
        assertThat(counter("orders.failed.count")).isEqualTo(1.0);
        assertThat(meterRegistry.get("orders.fill.latency").timer().count()).isEqualTo(2);
        assertThat(meterRegistry.get("orders.fill.latency").timer().totalTime(TimeUnit.MILLISECONDS))
                .isGreaterThanOrEqualTo(2 * EngineFixture.FILL_DELAY.toMillis());
    }

    @Test
    @DisplayName("Rejections are counted per rejection code")
    void rejectionsTaggedByCode() {
        submit(OrderSide.BUY, 100);
        submit(OrderSide.BUY, 50);
        submit(OrderSide.SELL, 1);

        replayEvents();

        assertThat(meterRegistry.get("orders.rejected.count").tag("code", "INSUFFICIENT_CASH").counter().count())
                .isEqualTo(2.0);
        assertThat(meterRegistry.get("orders.rejected.count").tag("code", "INSUFFICIENT_HOLDINGS").counter().count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.find("orders.created.count").counter().count()).isZero();
    }
}

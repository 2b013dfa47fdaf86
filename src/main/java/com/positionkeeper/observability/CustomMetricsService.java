package com.positionkeeper.observability;

import com.positionkeeper.domain.model.ReconciliationResult;
import com.positionkeeper.event.LifecycleEvent;
import com.positionkeeper.event.LifecycleEventType;
import com.positionkeeper.event.ReconciliationEvent;
import com.positionkeeper.event.RiskEvent;
import com.positionkeeper.event.RiskEventType;
import com.positionkeeper.oms.MutationCoordinator;
import com.positionkeeper.registry.PositionRegistry;
import com.positionkeeper.risk.AccountRiskState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for position management.
 * <ul>
 *   <li><b>positions.lifecycle</b> (counter, tag {@code type}): one per lifecycle event type</li>
 *   <li><b>mutations.rejected</b> (counter): proposals refused by the risk gate</li>
 *   <li><b>positions.frozen</b> (counter)</li>
 *   <li><b>reconciliation.drift</b> (counter): new + closed + changed positions found</li>
 *   <li><b>reconciliation.skipped</b> (counter): runs without a venue snapshot</li>
 *   <li><b>reconciliation.duration</b> (timer)</li>
 *   <li><b>positions.active</b>, <b>mutations.pending</b>, <b>daily.pnl</b>,
 *       <b>risk.drawdown</b> (gauges)</li>
 * </ul>
 * Gauges are read lazily at scrape time. Counters are driven by application events, handled on
 * the {@code eventExecutor} pool so the cycle thread never waits on metrics.
 */
@Service
public class CustomMetricsService {

    private final Map<LifecycleEventType, Counter> lifecycleCounters = new EnumMap<>(LifecycleEventType.class);
    private final Counter mutationsRejectedCounter;
    private final Counter positionsFrozenCounter;
    private final Counter reconciliationDriftCounter;
    private final Counter reconciliationSkippedCounter;
    private final Timer reconciliationTimer;

    public CustomMetricsService(
            MeterRegistry meterRegistry,
            PositionRegistry positionRegistry,
            MutationCoordinator mutationCoordinator,
            AccountRiskState accountRiskState) {
        for (LifecycleEventType type : LifecycleEventType.values()) {
            lifecycleCounters.put(
                    type,
                    Counter.builder("positions.lifecycle")
                            .description("Lifecycle events by type")
                            .tag("type", type.name())
                            .register(meterRegistry));
        }

        this.mutationsRejectedCounter = Counter.builder("mutations.rejected")
                .description("Mutations refused by the risk approval gate")
                .register(meterRegistry);

        this.positionsFrozenCounter = Counter.builder("positions.frozen")
                .description("Positions frozen for manual review")
                .register(meterRegistry);

        this.reconciliationDriftCounter = Counter.builder("reconciliation.drift")
                .description("New, closed and changed positions found by reconciliation")
                .register(meterRegistry);

        this.reconciliationSkippedCounter = Counter.builder("reconciliation.skipped")
                .description("Reconciliation runs skipped because the venue snapshot failed")
                .register(meterRegistry);

        this.reconciliationTimer = Timer.builder("reconciliation.duration")
                .description("Reconciliation run duration")
                .register(meterRegistry);

        meterRegistry.gauge("positions.active", positionRegistry, PositionRegistry::activeCount);
        meterRegistry.gauge("mutations.pending", mutationCoordinator, MutationCoordinator::pendingCount);
        meterRegistry.gauge("daily.pnl", accountRiskState, state -> state.getDailyRealizedPnl().doubleValue());
        meterRegistry.gauge("risk.drawdown", accountRiskState, state -> state.drawdown().doubleValue());
    }

    @Async("eventExecutor")
    @EventListener
    @Order(20)
    public void onLifecycleEvent(LifecycleEvent event) {
        lifecycleCounters.get(event.getEventType()).increment();
    }

    @Async("eventExecutor")
    @EventListener
    @Order(20)
    public void onRiskEvent(RiskEvent event) {
        if (event.getEventType() == RiskEventType.MUTATION_REJECTED) {
            mutationsRejectedCounter.increment();
        } else if (event.getEventType() == RiskEventType.POSITION_FROZEN) {
            positionsFrozenCounter.increment();
        }
    }

    @Async("eventExecutor")
    @EventListener
    @Order(20)
    public void onReconciliationEvent(ReconciliationEvent event) {
        ReconciliationResult result = event.getResult();
        if (result.isSkipped()) {
            reconciliationSkippedCounter.increment();
            return;
        }
        int drift = result.getNewCount() + result.getClosedCount() + result.getChangedCount();
        if (drift > 0) {
            reconciliationDriftCounter.increment(drift);
        }
        reconciliationTimer.record(result.getDurationMs(), TimeUnit.MILLISECONDS);
    }
}

package com.positionkeeper.support;

import static org.mockito.Mockito.mock;

import com.positionkeeper.adoption.AdoptionPolicy;
import com.positionkeeper.adoption.PositionAdoptionService;
import com.positionkeeper.config.AdoptionConfig;
import com.positionkeeper.config.CycleConfig;
import com.positionkeeper.config.DynamicRiskConfig;
import com.positionkeeper.config.RetryConfig;
import com.positionkeeper.config.ScalingConfig;
import com.positionkeeper.core.engine.PositionCycleEngine;
import com.positionkeeper.event.EventPublisherHelper;
import com.positionkeeper.lifecycle.PositionLifecycleStateMachine;
import com.positionkeeper.oms.IdempotencyTokenGenerator;
import com.positionkeeper.oms.MutationCoordinator;
import com.positionkeeper.oms.MutationDispatchWorker;
import com.positionkeeper.oms.MutationDispatcher;
import com.positionkeeper.oms.MutationTokenLedger;
import com.positionkeeper.oms.PositionOpenService;
import com.positionkeeper.oms.RetryPolicy;
import com.positionkeeper.reconciliation.PositionReconciliationService;
import com.positionkeeper.reconciliation.ReconciliationEngine;
import com.positionkeeper.registry.PositionRegistry;
import com.positionkeeper.risk.AccountRiskState;
import com.positionkeeper.risk.DynamicRiskAdjustmentEngine;
import com.positionkeeper.risk.RiskApprovalGate;
import com.positionkeeper.risk.RiskLimits;
import com.positionkeeper.risk.RiskModeSelector;
import com.positionkeeper.scaling.ProfitScalingEngine;
import com.positionkeeper.simulator.PaperVenueGateway;
import com.positionkeeper.venue.InMemoryVolatilityProvider;
import com.positionkeeper.venue.SymbolConstraintsCache;
import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

/**
 * Hand-wired position keeper on top of a {@link PaperVenueGateway}. The dispatch worker thread is
 * not started: tests call {@link #processDispatches()} between cycles so every step is
 * deterministic. The token ledger is a Mockito mock because no Redis is available.
 */
public class KeeperFixture {

    public final MutableClock clock = MutableClock.at("2024-03-04T10:00:00Z");
    public final RecordingEventPublisher events = new RecordingEventPublisher();
    public final EventPublisherHelper eventPublisherHelper = new EventPublisherHelper(events);

    public final CycleConfig cycleConfig = new CycleConfig();
    public final RetryConfig retryConfig = new RetryConfig();
    public final ScalingConfig scalingConfig = new ScalingConfig();
    public final AdoptionConfig adoptionConfig = new AdoptionConfig();
    public final DynamicRiskConfig dynamicRiskConfig = new DynamicRiskConfig();
    public final RiskLimits riskLimits = RiskLimits.builder().build();

    public final PaperVenueGateway venue = new PaperVenueGateway(clock, new BigDecimal("10000"));
    public final MutationTokenLedger tokenLedger = mock(MutationTokenLedger.class);
    public final InMemoryVolatilityProvider volatilityProvider = new InMemoryVolatilityProvider();

    public final PositionRegistry registry = new PositionRegistry();
    public final SymbolConstraintsCache constraintsCache = new SymbolConstraintsCache(venue);
    public final AccountRiskState accountRiskState = new AccountRiskState(riskLimits, clock);
    public final RiskApprovalGate riskApprovalGate = new RiskApprovalGate(riskLimits, accountRiskState, registry);
    public final PositionLifecycleStateMachine lifecycle =
            new PositionLifecycleStateMachine(registry, eventPublisherHelper, clock);
    public final IdempotencyTokenGenerator tokenGenerator = new IdempotencyTokenGenerator();
    public final RetryPolicy retryPolicy;
    public final MutationDispatcher dispatcher;
    public final MutationDispatchWorker worker;
    public final MutationCoordinator coordinator;
    public final PositionReconciliationService reconciliation;
    public final PositionAdoptionService adoption;
    public final ProfitScalingEngine scaling;
    public final DynamicRiskAdjustmentEngine dynamicRisk;
    public final PositionCycleEngine cycleEngine;
    public final PositionOpenService openService;

    public KeeperFixture() {
        retryConfig.setInitialBackoff(Duration.ofSeconds(1));
        retryConfig.setMaxBackoff(Duration.ofSeconds(30));
        retryConfig.setMaxAttempts(3);
        cycleConfig.setDispatchTimeout(Duration.ofSeconds(5));

        retryPolicy = new RetryPolicy(retryConfig);
        dispatcher = new MutationDispatcher(venue, tokenLedger, new SimpleAsyncTaskExecutor("venue-call-"), cycleConfig);
        worker = new MutationDispatchWorker(dispatcher, cycleConfig);
        coordinator = new MutationCoordinator(
                registry,
                riskApprovalGate,
                tokenGenerator,
                retryPolicy,
                worker,
                tokenLedger,
                lifecycle,
                constraintsCache,
                eventPublisherHelper,
                retryConfig,
                clock);
        reconciliation = new PositionReconciliationService(
                venue,
                registry,
                new ReconciliationEngine(retryConfig),
                lifecycle,
                coordinator,
                eventPublisherHelper,
                clock);
        adoption = new PositionAdoptionService(
                adoptionConfig,
                new AdoptionPolicy(adoptionConfig),
                registry,
                coordinator,
                constraintsCache,
                eventPublisherHelper,
                clock);
        scaling = new ProfitScalingEngine(scalingConfig, constraintsCache);
        dynamicRisk = new DynamicRiskAdjustmentEngine(dynamicRiskConfig, volatilityProvider, constraintsCache);
        cycleEngine = new PositionCycleEngine(
                cycleConfig,
                venue,
                reconciliation,
                adoption,
                scaling,
                dynamicRisk,
                coordinator,
                registry,
                accountRiskState,
                new RiskModeSelector(dynamicRiskConfig),
                eventPublisherHelper,
                clock);
        openService = new PositionOpenService(cycleEngine, coordinator, registry, tokenGenerator, clock);
    }

    /** Runs every request the coordinator has submitted, as the worker thread would. */
    public int processDispatches() {
        return worker.processQueued();
    }

    /** One cycle followed by the dispatches it submitted. */
    public void cycleAndDispatch() {
        cycleEngine.runCycle("TEST", false);
        processDispatches();
    }
}

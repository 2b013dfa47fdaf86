package com.positionkeeper.oms;

import com.positionkeeper.core.engine.PositionCycleEngine;
import com.positionkeeper.domain.enums.LifecycleState;
import com.positionkeeper.domain.enums.MutationKind;
import com.positionkeeper.domain.enums.MutationSource;
import com.positionkeeper.domain.model.PendingMutation;
import com.positionkeeper.domain.model.Position;
import com.positionkeeper.domain.model.ScalingState;
import com.positionkeeper.domain.model.TradeIntent;
import com.positionkeeper.exception.BusinessException;
import com.positionkeeper.exception.ErrorCode;
import com.positionkeeper.registry.PositionRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for the strategy layer to open positions.
 *
 * <p>An accepted intent becomes an OPENING position under a provisional id equal to its
 * idempotency token, which the venue stores as the client tag. The coordinator dispatches
 * the open on the next cycle; reconciliation recognises the venue position by that tag, so
 * an open whose confirmation was lost is never adopted as foreign.
 */
@Service
public class PositionOpenService {

    private static final Logger log = LoggerFactory.getLogger(PositionOpenService.class);

    private final PositionCycleEngine cycleEngine;
    private final MutationCoordinator mutationCoordinator;
    private final PositionRegistry positionRegistry;
    private final IdempotencyTokenGenerator tokenGenerator;
    private final Clock clock;

    public PositionOpenService(
            PositionCycleEngine cycleEngine,
            MutationCoordinator mutationCoordinator,
            PositionRegistry positionRegistry,
            IdempotencyTokenGenerator tokenGenerator,
            Clock clock) {
        this.cycleEngine = cycleEngine;
        this.mutationCoordinator = mutationCoordinator;
        this.positionRegistry = positionRegistry;
        this.tokenGenerator = tokenGenerator;
        this.clock = clock;
    }

    /**
     * Queues an open.
     *
     * @return snapshot of the OPENING position
     * @throws BusinessException VALIDATION_ERROR for a malformed intent, RISK_LIMIT_EXCEEDED
     *     when the risk gate refuses it
     */
    public Position open(TradeIntent intent) {
        validate(intent);
        return cycleEngine.runExclusive(() -> openLocked(intent));
    }

    private Position openLocked(TradeIntent intent) {
        Instant now = clock.instant();
        String token = tokenGenerator.generateForOpen(intent, now);

        Position position = Position.builder()
                .positionId(token)
                .clientTag(token)
                .symbol(intent.getSymbol())
                .side(intent.getSide())
                .size(intent.getSize())
                .originalSize(intent.getSize())
                .stopLevel(intent.getStopLevel())
                .targetLevel(intent.getTargetLevel())
                .currentPrice(intent.getReferencePrice())
                .openedAt(now)
                .owned(true)
                .strategyTag(intent.getStrategyTag())
                .scalingState(new ScalingState())
                .state(LifecycleState.OPENING)
                .lastUpdated(now)
                .build();

        PendingMutation mutation = PendingMutation.builder()
                .positionId(token)
                .kind(MutationKind.OPEN)
                .source(MutationSource.STRATEGY)
                .idempotencyToken(token)
                .stopLevel(intent.getStopLevel())
                .targetLevel(intent.getTargetLevel())
                .openIntent(intent)
                .reason("Open " + intent.getSide() + " " + intent.getSize() + " " + intent.getSymbol())
                .build();

        // Validated before insertion so exposure caps count the registry without this position
        if (!mutationCoordinator.propose(mutation, position)) {
            throw new BusinessException(
                    ErrorCode.RISK_LIMIT_EXCEEDED,
                    "Open of " + intent.getSize() + " " + intent.getSymbol() + " rejected by risk gate",
                    Map.of("symbol", intent.getSymbol()));
        }
        try {
            positionRegistry.insert(position);
        } catch (RuntimeException e) {
            mutationCoordinator.cancelAll(token, "registration failed");
            throw e;
        }

        log.info(
                "Open queued: {} {} {} (client tag {}, strategy {})",
                intent.getSide(),
                intent.getSize(),
                intent.getSymbol(),
                token,
                intent.getStrategyTag());
        return position.snapshot();
    }

    private void validate(TradeIntent intent) {
        if (intent == null
                || intent.getSymbol() == null
                || intent.getSymbol().isBlank()
                || intent.getSide() == null
                || intent.getSize() == null
                || intent.getSize().signum() <= 0) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Trade intent needs a symbol, side and positive size");
        }
    }
}

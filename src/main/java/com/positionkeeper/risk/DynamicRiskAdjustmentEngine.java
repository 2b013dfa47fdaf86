package com.positionkeeper.risk;

import com.positionkeeper.config.DynamicRiskConfig;
import com.positionkeeper.config.DynamicRiskConfig.ModeMultipliers;
import com.positionkeeper.domain.enums.LifecycleState;
import com.positionkeeper.domain.enums.MutationKind;
import com.positionkeeper.domain.enums.MutationSource;
import com.positionkeeper.domain.enums.PositionSide;
import com.positionkeeper.domain.enums.RiskMode;
import com.positionkeeper.domain.model.PendingMutation;
import com.positionkeeper.domain.model.Position;
import com.positionkeeper.domain.model.SymbolConstraints;
import com.positionkeeper.venue.SymbolConstraintsCache;
import com.positionkeeper.venue.VolatilityProvider;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Tightens protective stops as price moves, scaled by the current {@link RiskMode}.
 *
 * <p>For each eligible OPEN position with a volatility value:
 * <ul>
 *   <li>candidate stop = current price ∓ stopMultiplier × volatility</li>
 *   <li>once the favorable move reaches breakevenTriggerMultiple × volatility, the stop is
 *       at least entry ± breakevenBufferFraction × volatility</li>
 *   <li>the candidate is clamped to the venue's minimum stop distance</li>
 * </ul>
 * A modification is proposed only when the candidate is strictly more protective than the
 * current stop, so stops only ever tighten. A target is proposed only for positions that
 * have none.
 */
@Component
public class DynamicRiskAdjustmentEngine {

    private static final Logger log = LoggerFactory.getLogger(DynamicRiskAdjustmentEngine.class);

    private final DynamicRiskConfig config;
    private final VolatilityProvider volatilityProvider;
    private final SymbolConstraintsCache symbolConstraintsCache;

    public DynamicRiskAdjustmentEngine(
            DynamicRiskConfig config,
            VolatilityProvider volatilityProvider,
            SymbolConstraintsCache symbolConstraintsCache) {
        this.config = config;
        this.volatilityProvider = volatilityProvider;
        this.symbolConstraintsCache = symbolConstraintsCache;
    }

    public List<PendingMutation> evaluate(
            Collection<Position> positions, RiskMode mode, Predicate<String> hasActiveMutation) {
        List<PendingMutation> proposals = new ArrayList<>();
        if (!config.isEnabled()) {
            return proposals;
        }
        ModeMultipliers multipliers = config.multipliersFor(mode);

        for (Position position : positions) {
            if (!isEligible(position, hasActiveMutation)) {
                continue;
            }
            Optional<BigDecimal> volatility = volatilityProvider.volatility(position.getSymbol());
            if (volatility.isEmpty() || volatility.get().signum() <= 0) {
                continue;
            }
            Optional<SymbolConstraints> constraints = symbolConstraintsCache.get(position.getSymbol());
            if (constraints.isEmpty()) {
                continue;
            }
            PendingMutation proposal = propose(position, volatility.get(), multipliers, mode, constraints.get());
            if (proposal != null) {
                proposals.add(proposal);
            }
        }
        return proposals;
    }

    private boolean isEligible(Position position, Predicate<String> hasActiveMutation) {
        return position.getState() == LifecycleState.OPEN
                && !position.isFrozen()
                && !position.isTrackingOnly()
                && position.getCurrentPrice() != null
                && position.getEntryPrice() != null
                && !hasActiveMutation.test(position.getPositionId());
    }

    private PendingMutation propose(
            Position position,
            BigDecimal volatility,
            ModeMultipliers multipliers,
            RiskMode mode,
            SymbolConstraints constraints) {
        PositionSide side = position.getSide();
        BigDecimal current = position.getCurrentPrice();
        BigDecimal minDistance = constraints.getMinStopDistance();

        BigDecimal candidate =
                ProtectiveLevels.stopAt(side, current, multipliers.getStopMultiplier().multiply(volatility));

        boolean breakeven = false;
        BigDecimal trigger = config.getBreakevenTriggerMultiple().multiply(volatility);
        if (position.favorableMove().compareTo(trigger) >= 0) {
            BigDecimal breakevenStop = ProtectiveLevels.targetAt(
                    side, position.getEntryPrice(), config.getBreakevenBufferFraction().multiply(volatility));
            if (ProtectiveLevels.isMoreProtective(side, breakevenStop, candidate)) {
                candidate = breakevenStop;
                breakeven = true;
            }
        }
        candidate = ProtectiveLevels.clampStop(side, candidate, current, minDistance);

        boolean proposeStop = ProtectiveLevels.isMoreProtective(side, candidate, position.getStopLevel());

        BigDecimal target = position.getTargetLevel();
        boolean proposeTarget = false;
        if (target == null) {
            target = ProtectiveLevels.clampTarget(
                    side,
                    ProtectiveLevels.targetAt(side, current, multipliers.getTargetMultiplier().multiply(volatility)),
                    current,
                    minDistance);
            proposeTarget = true;
        }

        if (!proposeStop && !proposeTarget) {
            return null;
        }

        BigDecimal stop = proposeStop ? candidate : position.getStopLevel();
        log.debug(
                "Position {} dynamic levels ({}): stop {} -> {}, target {} -> {}",
                position.getPositionId(),
                mode,
                position.getStopLevel(),
                stop,
                position.getTargetLevel(),
                target);

        return PendingMutation.builder()
                .positionId(position.getPositionId())
                .kind(MutationKind.MODIFY_LEVELS)
                .source(MutationSource.DYNAMIC_RISK)
                .stopLevel(stop)
                .targetLevel(target)
                .setsBreakeven(breakeven && proposeStop)
                .reason(String.format(
                        "%s mode: %s%s",
                        mode,
                        proposeStop ? (breakeven ? "breakeven stop" : "trailing stop") : "",
                        proposeTarget ? (proposeStop ? " + initial target" : "initial target") : ""))
                .build();
    }
}

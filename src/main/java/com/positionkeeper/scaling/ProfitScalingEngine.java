package com.positionkeeper.scaling;

import com.positionkeeper.config.ScalingConfig;
import com.positionkeeper.domain.enums.LifecycleState;
import com.positionkeeper.domain.enums.MutationKind;
import com.positionkeeper.domain.enums.MutationSource;
import com.positionkeeper.domain.enums.PositionSide;
import com.positionkeeper.domain.model.PendingMutation;
import com.positionkeeper.domain.model.Position;
import com.positionkeeper.domain.model.ScalingState;
import com.positionkeeper.domain.model.ScalingTier;
import com.positionkeeper.domain.model.SymbolConstraints;
import com.positionkeeper.risk.ProtectiveLevels;
import com.positionkeeper.venue.SymbolConstraintsCache;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Tiered profit taking with an emergency lock.
 *
 * <p>Profit fraction is {@code unrealizedProfit / (entryPrice × size × contractSize)}. At most one
 * tier fires per position per cycle: the highest eligible one not yet executed. Lower tiers
 * skipped this way can still fire on a later cycle.
 *
 * <p>A firing tier proposes, in order:
 * <ol>
 *   <li>a close of {@code min(closeFraction, remainingFraction)} of the original size</li>
 *   <li>a breakeven modification (stop to entry) when the tier moves the stop to entry</li>
 *   <li>a trailing modification to {@code entry ± trailFraction × |current − entry|}</li>
 * </ol>
 * Modifications are only proposed when they tighten the stop. The emergency lock fires once per
 * position when unrealized profit exceeds a fraction of the balance; it wins over tiers and
 * ignores the age window.
 *
 * <p>Nothing here touches {@link ScalingState} except {@code lastEvaluatedAt}; tiers, closed
 * fraction and flags are recorded by the coordinator when the venue confirms the mutation.
 */
@Component
public class ProfitScalingEngine {

    private static final Logger log = LoggerFactory.getLogger(ProfitScalingEngine.class);

    private final ScalingConfig config;
    private final SymbolConstraintsCache symbolConstraintsCache;

    public ProfitScalingEngine(ScalingConfig config, SymbolConstraintsCache symbolConstraintsCache) {
        this.config = config;
        this.symbolConstraintsCache = symbolConstraintsCache;
    }

    public List<PendingMutation> evaluate(
            Collection<Position> positions, BigDecimal balance, Predicate<String> hasActiveMutation, Instant now) {
        List<PendingMutation> proposals = new ArrayList<>();
        if (!config.isEnabled()) {
            return proposals;
        }
        List<ScalingTier> tiers = tiersFor(balance);

        for (Position position : positions) {
            if (!isEligible(position, hasActiveMutation, now)) {
                continue;
            }
            Optional<SymbolConstraints> constraints = symbolConstraintsCache.get(position.getSymbol());
            if (constraints.isEmpty()) {
                continue;
            }
            position.getScalingState().setLastEvaluatedAt(now);

            List<PendingMutation> emergency = evaluateEmergencyLock(position, balance, constraints.get());
            if (!emergency.isEmpty()) {
                proposals.addAll(emergency);
                continue;
            }
            proposals.addAll(evaluateTiers(position, tiers, constraints.get(), now));
        }
        return proposals;
    }

    /** Micro table when the balance is below the threshold. */
    public List<ScalingTier> tiersFor(BigDecimal balance) {
        if (balance != null && balance.compareTo(config.getMicroAccountThreshold()) < 0) {
            return config.getMicroTiers();
        }
        return config.getTiers();
    }

    public static BigDecimal profitFraction(Position position, SymbolConstraints constraints) {
        BigDecimal notional = position.getEntryPrice()
                .multiply(position.getSize())
                .multiply(constraints.getContractSize());
        if (notional.signum() <= 0 || position.getUnrealizedProfit() == null) {
            return BigDecimal.ZERO;
        }
        return position.getUnrealizedProfit().divide(notional, MathContext.DECIMAL64);
    }

    // ========================
    // ELIGIBILITY
    // ========================

    private boolean isEligible(Position position, Predicate<String> hasActiveMutation, Instant now) {
        LifecycleState state = position.getState();
        if (state != LifecycleState.OPEN && state != LifecycleState.PARTIAL_CLOSE) {
            return false;
        }
        if (position.isFrozen() || position.isTrackingOnly()) {
            return false;
        }
        if (!position.isOwned() && !config.isScaleAdoptedPositions()) {
            return false;
        }
        if (position.getEntryPrice() == null
                || position.getCurrentPrice() == null
                || position.getUnrealizedProfit() == null
                || position.getSize() == null
                || position.getSize().signum() <= 0) {
            return false;
        }
        if (hasActiveMutation.test(position.getPositionId())) {
            return false;
        }
        Instant lastEvaluatedAt = position.getScalingState().getLastEvaluatedAt();
        return lastEvaluatedAt == null
                || Duration.between(lastEvaluatedAt, now).compareTo(config.getMinEvaluationInterval()) >= 0;
    }

    private boolean withinAgeWindow(Position position, Instant now) {
        Duration age = position.age(now);
        return age.compareTo(config.getMaxPositionAge()) <= 0 && age.compareTo(config.getMinPositionAge()) >= 0;
    }

    // ========================
    // EMERGENCY LOCK
    // ========================

    private List<PendingMutation> evaluateEmergencyLock(
            Position position, BigDecimal balance, SymbolConstraints constraints) {
        ScalingState scalingState = position.getScalingState();
        if (scalingState.isEmergencyLockExecuted() || balance == null || balance.signum() <= 0) {
            return List.of();
        }
        BigDecimal lockThreshold = config.getEmergencyLockFraction().multiply(balance);
        if (position.getUnrealizedProfit().compareTo(lockThreshold) <= 0) {
            return List.of();
        }

        List<PendingMutation> proposals = new ArrayList<>();
        BigDecimal requested = position.getSize().multiply(config.getEmergencyCloseFraction());
        PendingMutation close = buildClose(position, requested, constraints, MutationSource.EMERGENCY_LOCK, null);
        if (close == null) {
            return List.of();
        }
        close.setReason(String.format(
                "Emergency lock: profit %s > %s of balance %s",
                position.getUnrealizedProfit().toPlainString(),
                config.getEmergencyLockFraction().toPlainString(),
                balance.toPlainString()));
        proposals.add(close);

        if (close.getKind() == MutationKind.PARTIAL_CLOSE) {
            PositionSide side = position.getSide();
            BigDecimal lockedStop = ProtectiveLevels.targetAt(
                    side,
                    position.getEntryPrice(),
                    config.getEmergencyLockInFraction().multiply(position.favorableMove()));
            lockedStop = ProtectiveLevels.clampStop(
                    side, lockedStop, position.getCurrentPrice(), constraints.getMinStopDistance());
            if (ProtectiveLevels.isMoreProtective(side, lockedStop, position.getStopLevel())) {
                proposals.add(buildModify(
                        position,
                        lockedStop,
                        false,
                        MutationSource.EMERGENCY_LOCK,
                        "Emergency lock: stop locks in "
                                + config.getEmergencyLockInFraction().toPlainString()
                                + " of the move"));
            }
        }

        log.warn(
                "Position {} emergency lock: profit {} exceeds {} x balance {}, closing {}",
                position.getPositionId(),
                position.getUnrealizedProfit(),
                config.getEmergencyLockFraction(),
                balance,
                close.getCloseSize());
        return proposals;
    }

    // ========================
    // TIERS
    // ========================

    private List<PendingMutation> evaluateTiers(
            Position position, List<ScalingTier> tiers, SymbolConstraints constraints, Instant now) {
        if (position.getUnrealizedProfit().compareTo(config.getMinProfitAmount()) < 0
                || !withinAgeWindow(position, now)) {
            return List.of();
        }
        ScalingState scalingState = position.getScalingState();
        if (scalingState.remainingFraction().signum() <= 0) {
            return List.of();
        }
        BigDecimal profitFraction = profitFraction(position, constraints);

        int firing = -1;
        for (int i = tiers.size() - 1; i >= 0; i--) {
            if (!scalingState.hasExecuted(i) && profitFraction.compareTo(tiers.get(i).getProfitThreshold()) >= 0) {
                firing = i;
                break;
            }
        }
        if (firing < 0) {
            return List.of();
        }
        ScalingTier tier = tiers.get(firing);

        List<PendingMutation> proposals = new ArrayList<>();
        BigDecimal fractionOfOriginal = tier.getCloseFraction().min(scalingState.remainingFraction());
        BigDecimal requested = baseSize(position).multiply(fractionOfOriginal);
        PendingMutation close = buildClose(position, requested, constraints, MutationSource.PROFIT_SCALING, firing);
        if (close == null) {
            return List.of();
        }
        close.setReason(String.format(
                "Tier %d: profit fraction %s >= %s",
                firing + 1,
                profitFraction.setScale(4, RoundingMode.HALF_UP).toPlainString(),
                tier.getProfitThreshold().toPlainString()));
        proposals.add(close);

        log.info(
                "Position {} tier {} fired at profit fraction {}: {} {}",
                position.getPositionId(),
                firing + 1,
                profitFraction.setScale(4, RoundingMode.HALF_UP),
                close.getKind(),
                close.getCloseSize());

        if (close.getKind() == MutationKind.FULL_CLOSE) {
            return proposals;
        }

        PositionSide side = position.getSide();
        BigDecimal entry = position.getEntryPrice();
        BigDecimal current = position.getCurrentPrice();
        BigDecimal minDistance = constraints.getMinStopDistance();
        BigDecimal stopSoFar = position.getStopLevel();

        if (tier.isMoveStopToEntry() && !scalingState.isBreakevenSet()) {
            BigDecimal breakeven = ProtectiveLevels.clampStop(side, entry, current, minDistance);
            if (ProtectiveLevels.isMoreProtective(side, breakeven, stopSoFar)) {
                proposals.add(buildModify(
                        position, breakeven, true, MutationSource.PROFIT_SCALING, "Tier " + (firing + 1) + ": stop to entry"));
                stopSoFar = breakeven;
            }
        }

        if (tier.getTrailFraction() != null && tier.getTrailFraction().signum() > 0) {
            BigDecimal trail = ProtectiveLevels.targetAt(
                    side, entry, tier.getTrailFraction().multiply(current.subtract(entry).abs()));
            trail = ProtectiveLevels.clampStop(side, trail, current, minDistance);
            BigDecimal floor = ProtectiveLevels.mostProtective(side, stopSoFar, entry);
            if (ProtectiveLevels.isMoreProtective(side, trail, floor)) {
                proposals.add(buildModify(
                        position,
                        trail,
                        false,
                        MutationSource.PROFIT_SCALING,
                        "Tier " + (firing + 1) + ": trail " + tier.getTrailFraction().toPlainString() + " of the move"));
            }
        }
        return proposals;
    }

    // ========================
    // PROPOSAL BUILDERS
    // ========================

    /**
     * Sizes a close against venue lot rules: rounded down to the size step, raised to the
     * minimum size, and turned into a full close when the residual would be below the minimum.
     * Returns null when nothing can be closed.
     */
    private PendingMutation buildClose(
            Position position,
            BigDecimal requestedSize,
            SymbolConstraints constraints,
            MutationSource source,
            Integer tierIndex) {
        BigDecimal size = position.getSize();
        BigDecimal minSize = constraints.getMinSize();
        BigDecimal closeSize = roundDown(requestedSize, constraints.getSizeStep());
        if (closeSize.compareTo(minSize) < 0) {
            closeSize = minSize;
        }
        closeSize = closeSize.min(size);
        if (closeSize.signum() <= 0) {
            return null;
        }

        BigDecimal residual = size.subtract(closeSize);
        boolean full = residual.signum() <= 0 || (minSize.signum() > 0 && residual.compareTo(minSize) < 0);
        BigDecimal remaining = position.getScalingState().remainingFraction();
        BigDecimal fractionOfOriginal;
        if (full) {
            closeSize = size;
            fractionOfOriginal = remaining;
        } else {
            fractionOfOriginal = closeSize.divide(baseSize(position), MathContext.DECIMAL64).min(remaining);
        }

        return PendingMutation.builder()
                .positionId(position.getPositionId())
                .kind(full ? MutationKind.FULL_CLOSE : MutationKind.PARTIAL_CLOSE)
                .source(source)
                .closeSize(closeSize)
                .closeFractionOfOriginal(fractionOfOriginal)
                .tierIndex(tierIndex)
                .build();
    }

    private PendingMutation buildModify(
            Position position, BigDecimal stop, boolean setsBreakeven, MutationSource source, String reason) {
        return PendingMutation.builder()
                .positionId(position.getPositionId())
                .kind(MutationKind.MODIFY_LEVELS)
                .source(source)
                .stopLevel(stop)
                .targetLevel(position.getTargetLevel())
                .setsBreakeven(setsBreakeven)
                .reason(reason)
                .build();
    }

    private static BigDecimal baseSize(Position position) {
        BigDecimal original = position.getOriginalSize();
        return original != null && original.signum() > 0 ? original : position.getSize();
    }

    private static BigDecimal roundDown(BigDecimal value, BigDecimal step) {
        if (step == null || step.signum() <= 0) {
            return value;
        }
        return value.divide(step, 0, RoundingMode.DOWN).multiply(step);
    }
}

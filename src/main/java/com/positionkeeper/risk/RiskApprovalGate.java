package com.positionkeeper.risk;

import com.positionkeeper.domain.enums.MutationKind;
import com.positionkeeper.domain.model.PendingMutation;
import com.positionkeeper.domain.model.Position;
import com.positionkeeper.domain.model.TradeIntent;
import com.positionkeeper.registry.PositionRegistry;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Validates every proposed mutation against account and exposure limits before it can be
 * dispatched.
 *
 * <p>Checks (all evaluated, not short-circuited):
 * <ol>
 *   <li>Risk halt: daily loss limit breached and the mutation is not a close</li>
 *   <li>Frozen position and the mutation is not a close</li>
 *   <li>Stop-distance ceiling for level changes and opens</li>
 *   <li>Exposure caps (per symbol and total, count and size) for opens</li>
 * </ol>
 * Closes only reduce risk, so they pass the halt and freeze checks.
 */
@Component
public class RiskApprovalGate {

    private final RiskLimits riskLimits;
    private final AccountRiskState accountRiskState;
    private final PositionRegistry positionRegistry;

    public RiskApprovalGate(
            RiskLimits riskLimits, AccountRiskState accountRiskState, PositionRegistry positionRegistry) {
        this.riskLimits = riskLimits;
        this.accountRiskState = accountRiskState;
        this.positionRegistry = positionRegistry;
    }

    public RiskValidationResult validate(PendingMutation mutation, Position position) {
        List<RiskViolation> violations = new ArrayList<>();
        boolean close = mutation.getKind().isClose();

        if (!close) {
            checkHalt(violations);
        }

        if (!close && position.isFrozen()) {
            violations.add(RiskViolation.of(
                    RiskViolation.POSITION_FROZEN, "Position is frozen: " + position.getFrozenReason()));
        }

        checkStopCeiling(mutation, position, violations);

        if (mutation.getKind() == MutationKind.OPEN) {
            checkExposure(mutation.getOpenIntent(), violations);
        }

        return RiskValidationResult.of(violations);
    }

    /**
     * Re-checks the account halt when a queued mutation reaches the head of its queue. A
     * mutation approved before the daily loss limit was breached, or waiting out a retry
     * backoff, must not reach the venue once only closes are allowed.
     */
    public RiskValidationResult validateAtDispatch(PendingMutation mutation) {
        List<RiskViolation> violations = new ArrayList<>();
        if (!mutation.getKind().isClose()) {
            checkHalt(violations);
        }
        return RiskValidationResult.of(violations);
    }

    private void checkHalt(List<RiskViolation> violations) {
        if (accountRiskState.isDailyLimitBreached()) {
            violations.add(RiskViolation.of(
                    RiskViolation.RISK_HALTED,
                    "Daily loss limit breached (realized " + accountRiskState.getDailyRealizedPnl()
                            + "); only closes are allowed"));
        }
    }

    private void checkStopCeiling(PendingMutation mutation, Position position, List<RiskViolation> violations) {
        if (riskLimits.getHardStopCeilingFraction() == null || mutation.getStopLevel() == null) {
            return;
        }
        if (mutation.getKind() != MutationKind.MODIFY_LEVELS && mutation.getKind() != MutationKind.OPEN) {
            return;
        }
        BigDecimal reference = position.getEntryPrice() != null ? position.getEntryPrice() : position.getCurrentPrice();
        if (reference == null || reference.signum() <= 0) {
            return;
        }
        BigDecimal distanceFraction =
                reference.subtract(mutation.getStopLevel()).abs().divide(reference, MathContext.DECIMAL64);
        if (distanceFraction.compareTo(riskLimits.getHardStopCeilingFraction()) > 0) {
            violations.add(RiskViolation.of(
                    RiskViolation.STOP_DISTANCE_CEILING_EXCEEDED,
                    "Stop " + mutation.getStopLevel() + " is " + distanceFraction.toPlainString()
                            + " from " + reference + ", ceiling " + riskLimits.getHardStopCeilingFraction()));
        }
    }

    private void checkExposure(TradeIntent intent, List<RiskViolation> violations) {
        if (intent == null) {
            return;
        }
        String symbol = intent.getSymbol();
        if (riskLimits.getMaxPositionsPerSymbol() != null
                && positionRegistry.countBySymbol(symbol) + 1 > riskLimits.getMaxPositionsPerSymbol()) {
            violations.add(RiskViolation.of(
                    RiskViolation.MAX_POSITIONS_PER_SYMBOL,
                    "Max positions for " + symbol + " reached: " + riskLimits.getMaxPositionsPerSymbol()));
        }
        if (riskLimits.getMaxTotalPositions() != null
                && positionRegistry.activeCount() + 1 > riskLimits.getMaxTotalPositions()) {
            violations.add(RiskViolation.of(
                    RiskViolation.MAX_TOTAL_POSITIONS,
                    "Max total positions reached: " + riskLimits.getMaxTotalPositions()));
        }
        if (riskLimits.getMaxSizePerSymbol() != null
                && positionRegistry.totalSizeBySymbol(symbol).add(intent.getSize())
                                .compareTo(riskLimits.getMaxSizePerSymbol())
                        > 0) {
            violations.add(RiskViolation.of(
                    RiskViolation.MAX_SIZE_PER_SYMBOL,
                    "Size for " + symbol + " would exceed " + riskLimits.getMaxSizePerSymbol()));
        }
        if (riskLimits.getMaxTotalSize() != null
                && positionRegistry.totalSize().add(intent.getSize()).compareTo(riskLimits.getMaxTotalSize()) > 0) {
            violations.add(RiskViolation.of(
                    RiskViolation.MAX_TOTAL_SIZE, "Total size would exceed " + riskLimits.getMaxTotalSize()));
        }
    }
}

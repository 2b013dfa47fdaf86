package com.positionkeeper.domain.model;

import com.positionkeeper.exception.RegistryInvariantException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-position profit scaling progress.
 *
 * <p>{@code closedFraction} is the cumulative fraction of the original size closed by
 * confirmed partial/full closes and must never exceed 1.0. Tier indices are recorded only
 * once the close for that tier is confirmed by the venue.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScalingState {

    @Builder.Default
    private List<Integer> executedTiers = new ArrayList<>();

    @Builder.Default
    private BigDecimal closedFraction = BigDecimal.ZERO;

    private Instant lastEvaluatedAt;

    private boolean emergencyLockExecuted;

    private boolean breakevenSet;

    public boolean hasExecuted(int tierIndex) {
        return executedTiers.contains(tierIndex);
    }

    public BigDecimal remainingFraction() {
        return BigDecimal.ONE.subtract(closedFraction).max(BigDecimal.ZERO);
    }

    /**
     * Records a confirmed close.
     *
     * @param fraction  fraction of the original size closed
     * @param tierIndex tier that produced the close, or null for non-tier closes
     * @throws RegistryInvariantException if the cumulative fraction would exceed 1.0
     */
    public void recordClose(String positionId, BigDecimal fraction, Integer tierIndex) {
        BigDecimal updated = closedFraction.add(fraction);
        if (updated.compareTo(BigDecimal.ONE) > 0) {
            throw new RegistryInvariantException(
                    positionId, "Cumulative closed fraction would exceed 1.0: " + updated.toPlainString());
        }
        closedFraction = updated;
        if (tierIndex != null && !executedTiers.contains(tierIndex)) {
            executedTiers.add(tierIndex);
        }
    }

    public ScalingState copy() {
        return ScalingState.builder()
                .executedTiers(new ArrayList<>(executedTiers))
                .closedFraction(closedFraction)
                .lastEvaluatedAt(lastEvaluatedAt)
                .emergencyLockExecuted(emergencyLockExecuted)
                .breakevenSet(breakevenSet)
                .build();
    }
}

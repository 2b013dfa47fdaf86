package com.positionkeeper.adoption;

import com.positionkeeper.domain.enums.AdoptionMode;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Outcome of one adoption pass: every adopted position with the levels applied or attempted,
 * and every rejected candidate with its reason.
 */
@Getter
@Builder
public class AdoptionResult {

    @Builder.Default
    private final List<AdoptedPosition> adopted = new ArrayList<>();

    @Builder.Default
    private final List<Rejection> rejected = new ArrayList<>();

    public static AdoptionResult empty() {
        return AdoptionResult.builder().build();
    }

    public int adoptedCount() {
        return adopted.size();
    }

    public int rejectedCount() {
        return rejected.size();
    }

    @Getter
    @Builder
    public static class AdoptedPosition {

        private final String positionId;
        private final String symbol;
        private final AdoptionMode mode;
        private final BigDecimal stopLevel;
        private final BigDecimal targetLevel;

        /** True when a level modification was accepted by the risk gate and queued. */
        private final boolean levelsQueued;

        private final String note;
    }

    @Getter
    @Builder
    public static class Rejection {

        private final String positionId;
        private final String symbol;
        private final String reason;
    }
}

package com.positionkeeper.risk;

import java.util.Collections;
import java.util.List;
import lombok.Getter;

/**
 * Result of validating a proposed mutation: approved with no violations, or rejected with
 * every violation found (not only the first).
 */
@Getter
public class RiskValidationResult {

    private final boolean approved;
    private final List<RiskViolation> violations;

    private RiskValidationResult(boolean approved, List<RiskViolation> violations) {
        this.approved = approved;
        this.violations = violations;
    }

    public static RiskValidationResult approved() {
        return new RiskValidationResult(true, Collections.emptyList());
    }

    public static RiskValidationResult rejected(List<RiskViolation> violations) {
        return new RiskValidationResult(false, List.copyOf(violations));
    }

    public static RiskValidationResult of(List<RiskViolation> violations) {
        return violations.isEmpty() ? approved() : rejected(violations);
    }

    public boolean isRejected() {
        return !approved;
    }

    public boolean hasViolation(String code) {
        return violations.stream().anyMatch(violation -> violation.getCode().equals(code));
    }
}

package com.hedgetrader.risk;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Result of risk validation for a prospective hedge: approved, or rejected with every
 * violation found.
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

    public String describe() {
        return violations.stream().map(RiskViolation::toString).collect(Collectors.joining("; "));
    }
}

package nl.bytesoflife.macrogen.drc;

import nl.bytesoflife.macrogen.tech.DesignRule;

import java.util.List;

/**
 * Outcome of one rule. Skipped rules carry no count rather than a zero count.
 */
public record RuleResult(DesignRule rule, RuleStatus status, List<DrcViolation> violations) {

    public RuleResult {
        violations = List.copyOf(violations);
    }

    public static RuleResult skipped(DesignRule rule) {
        return new RuleResult(rule, RuleStatus.SKIPPED, List.of());
    }

    public static RuleResult checked(DesignRule rule, List<DrcViolation> violations) {
        return new RuleResult(rule, violations.isEmpty() ? RuleStatus.PASS : RuleStatus.FAIL, violations);
    }

    public int count() {
        return violations.size();
    }

    public boolean isSkipped() {
        return status == RuleStatus.SKIPPED;
    }
}

package nl.bytesoflife.macrogen.drc;

import nl.bytesoflife.macrogen.tech.DesignRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public class DrcReport {

    private final String cellName;
    private final List<RuleResult> results = new ArrayList<>();

    public DrcReport(String cellName) {
        this.cellName = cellName;
    }

    public void addResult(RuleResult result) {
        results.add(result);
    }

    public String getCellName() {
        return cellName;
    }

    /** Results in rule-set order. */
    public List<RuleResult> getResults() {
        return Collections.unmodifiableList(results);
    }

    public Optional<RuleResult> getResult(String ruleName) {
        return results.stream().filter(r -> r.rule().getName().equals(ruleName)).findFirst();
    }

    public List<DrcViolation> getViolations() {
        return results.stream()
                .flatMap(r -> r.violations().stream())
                .toList();
    }

    public List<DesignRule> getSkippedRules() {
        return results.stream()
                .filter(RuleResult::isSkipped)
                .map(RuleResult::rule)
                .toList();
    }

    public List<RuleResult> getFailures() {
        return results.stream()
                .filter(r -> r.status() == RuleStatus.FAIL)
                .toList();
    }

    public int getTotalViolations() {
        return results.stream().mapToInt(RuleResult::count).sum();
    }

    public boolean isClean() {
        return getTotalViolations() == 0;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("DRC Report: ").append(cellName).append("\n");
        sb.append(String.format(Locale.US, "  %-8s %-42s %6s%n", "Rule", "Description", "Errors"));
        sb.append("  ").append("-".repeat(66)).append("\n");
        for (RuleResult r : results) {
            String count = r.isSkipped() ? "-" : Integer.toString(r.count());
            sb.append(String.format(Locale.US, "  %-8s %-42s %6s  %s%n",
                    r.rule().getName(), r.rule().getDescription(), count, r.status()));
        }
        sb.append("  Violations: ").append(getTotalViolations())
          .append(" (").append(getSkippedRules().size()).append(" rules skipped)\n");
        List<RuleResult> failures = getFailures();
        if (!failures.isEmpty()) {
            sb.append("  Violations by rule:\n");
            for (RuleResult r : failures) {
                sb.append("  - ").append(r.rule().getName()).append(": ").append(r.count())
                  .append(" (").append(r.rule().getDescription()).append(")\n");
                for (DrcViolation v : r.violations()) {
                    sb.append("      ").append(v).append("\n");
                }
            }
        }
        sb.append(isClean() ? "  DRC CLEAN" : "  DRC ERRORS").append("\n");
        return sb.toString();
    }
}

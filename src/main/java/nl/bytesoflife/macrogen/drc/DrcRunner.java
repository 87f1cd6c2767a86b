package nl.bytesoflife.macrogen.drc;

import nl.bytesoflife.macrogen.drc.check.DrcCheck;
import nl.bytesoflife.macrogen.drc.check.EnclosureCheck;
import nl.bytesoflife.macrogen.drc.check.SpacingCheck;
import nl.bytesoflife.macrogen.drc.check.WidthCheck;
import nl.bytesoflife.macrogen.geometry.Cell;
import nl.bytesoflife.macrogen.tech.DesignRule;
import nl.bytesoflife.macrogen.tech.RuleKind;
import nl.bytesoflife.macrogen.tech.RuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates every rule of a rule set against one cell. Each rule is one region pipeline:
 * the check for its kind decides whether it applies, then turns the rule's regions into markers.
 * <p>
 * The runner never modifies the cell, and the same cell always yields the same report.
 */
public class DrcRunner {

    private static final Logger log = LoggerFactory.getLogger(DrcRunner.class);

    private final Map<RuleKind, DrcCheck> checks = new EnumMap<>(RuleKind.class);

    /** A runner with the width, spacing and enclosure checks registered. */
    public static DrcRunner standard() {
        return new DrcRunner()
                .registerCheck(new WidthCheck())
                .registerCheck(new SpacingCheck())
                .registerCheck(new EnclosureCheck());
    }

    public DrcRunner registerCheck(DrcCheck check) {
        checks.put(check.getSupportedKind(), check);
        return this;
    }

    /**
     * @throws IllegalArgumentException if the cell holds no geometry at all
     */
    public DrcReport run(RuleSet ruleSet, Cell cell) {
        if (cell.isEmpty()) {
            throw new IllegalArgumentException("Cell " + cell.getName() + " contains no geometry");
        }
        DrcLayoutInput layout = new DrcLayoutInput(cell, ruleSet.getGridNm());
        DrcReport report = new DrcReport(cell.getName());

        for (DesignRule rule : ruleSet.getRules()) {
            DrcCheck check = checks.get(rule.getKind());
            if (check == null || !check.appliesTo(rule, layout)) {
                report.addResult(RuleResult.skipped(rule));
                log.debug("{} skipped", rule.getName());
                continue;
            }

            int threshold = rule.thresholdInGrid(ruleSet.getGridNm());
            List<DrcViolation> violations = check.check(rule, threshold, layout);
            report.addResult(RuleResult.checked(rule, violations));
            log.debug("{} ({} {}): {} violations", rule.getName(), rule.getKind(), threshold, violations.size());
        }

        log.info("DRC {}: {} violations, {} rules skipped", cell.getName(),
                report.getTotalViolations(), report.getSkippedRules().size());
        return report;
    }
}

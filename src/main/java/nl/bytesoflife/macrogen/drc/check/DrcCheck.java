package nl.bytesoflife.macrogen.drc.check;

import nl.bytesoflife.macrogen.drc.DrcLayoutInput;
import nl.bytesoflife.macrogen.drc.DrcViolation;
import nl.bytesoflife.macrogen.tech.DesignRule;
import nl.bytesoflife.macrogen.tech.RuleKind;

import java.util.List;

/**
 * One rule kind: turns the regions a rule references into violation markers.
 */
public interface DrcCheck {

    /**
     * Whether the rule has anything to check. A rule that does not apply is reported as skipped.
     */
    boolean appliesTo(DesignRule rule, DrcLayoutInput layout);

    /**
     * @param threshold the rule's threshold, already rounded to grid units
     */
    List<DrcViolation> check(DesignRule rule, int threshold, DrcLayoutInput layout);

    RuleKind getSupportedKind();
}

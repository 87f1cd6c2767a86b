package nl.bytesoflife.macrogen.primitive;

import nl.bytesoflife.macrogen.tech.RuleSet;

final class Rules {

    private Rules() {
    }

    /** Threshold of an optional rule in grid units; 0 when the rule set does not define it. */
    static int minimum(RuleSet rules, String name) {
        return rules.findRule(name)
                .map(r -> r.thresholdInGrid(rules.getGridNm()))
                .orElse(0);
    }
}

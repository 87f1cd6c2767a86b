package nl.bytesoflife.macrogen.drc;

public enum RuleStatus {
    PASS,
    FAIL,
    /** Nothing to check: the layer (or, for enclosures, the overlap) is empty. */
    SKIPPED
}

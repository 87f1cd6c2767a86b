package nl.bytesoflife.macrogen.tech;

import java.util.Map;

public enum RuleKind {
    WIDTH,
    SPACING,
    ENCLOSURE;

    private static final Map<String, RuleKind> DECK_NAMES = Map.of(
            "width", WIDTH,
            "spacing", SPACING,
            "space", SPACING,
            "enclosure", ENCLOSURE
    );

    public static RuleKind fromDeckName(String name) {
        RuleKind kind = DECK_NAMES.get(name.toLowerCase());
        if (kind == null) {
            throw new IllegalArgumentException("Unknown rule kind: " + name);
        }
        return kind;
    }

    public boolean isPaired() {
        return this == ENCLOSURE;
    }
}

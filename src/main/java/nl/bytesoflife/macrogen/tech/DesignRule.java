package nl.bytesoflife.macrogen.tech;

import java.util.Objects;

/**
 * One named minimum-dimension rule. Width and spacing rules reference a single layer;
 * enclosure rules reference an inner layer and the outer layer that must surround it.
 */
public final class DesignRule {

    private final String name;
    private final String description;
    private final RuleKind kind;
    private final Layer layer;
    private final Layer outerLayer;
    private final double valueUm;

    private DesignRule(String name, String description, RuleKind kind, Layer layer, Layer outerLayer, double valueUm) {
        this.name = Objects.requireNonNull(name, "name");
        this.description = description != null ? description : name;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.layer = Objects.requireNonNull(layer, "layer");
        this.outerLayer = outerLayer;
        this.valueUm = valueUm;
        if (kind.isPaired() && outerLayer == null) {
            throw new IllegalArgumentException("Enclosure rule " + name + " needs an outer layer");
        }
        if (valueUm <= 0) {
            throw new IllegalArgumentException("Rule " + name + " needs a positive threshold, got " + valueUm);
        }
    }

    public static DesignRule width(String name, String description, Layer layer, double valueUm) {
        return new DesignRule(name, description, RuleKind.WIDTH, layer, null, valueUm);
    }

    public static DesignRule spacing(String name, String description, Layer layer, double valueUm) {
        return new DesignRule(name, description, RuleKind.SPACING, layer, null, valueUm);
    }

    public static DesignRule enclosure(String name, String description, Layer inner, Layer outer, double valueUm) {
        return new DesignRule(name, description, RuleKind.ENCLOSURE, inner, outer, valueUm);
    }

    public String getName() { return name; }
    public String getDescription() { return description; }
    public RuleKind getKind() { return kind; }

    /** The checked layer, or the inner layer of an enclosure rule. */
    public Layer getLayer() { return layer; }

    /** The enclosing layer; {@code null} unless this is an enclosure rule. */
    public Layer getOuterLayer() { return outerLayer; }

    /**
     * Threshold in grid units, rounded to the nearest grid step.
     */
    public int thresholdInGrid(int gridNm) {
        return (int) Math.round(valueUm * 1000.0 / gridNm);
    }

    @Override
    public String toString() {
        return "DesignRule{name='" + name + "', kind=" + kind + ", layer=" + layer.name() +
                (outerLayer != null ? ", outer=" + outerLayer.name() : "") + ", value=" + valueUm + "um}";
    }
}

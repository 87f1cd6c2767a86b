package nl.bytesoflife.macrogen.primitive;

import nl.bytesoflife.macrogen.tech.Layers;
import nl.bytesoflife.macrogen.tech.RuleSet;
import nl.bytesoflife.macrogen.tech.TechConstant;

/** One cut level of the metal stack, with the metals it joins. */
public enum ViaLevel {
    VIA1(Layers.METAL1, Layers.VIA1, Layers.METAL2),
    VIA2(Layers.METAL2, Layers.VIA2, Layers.METAL3),
    VIA3(Layers.METAL3, Layers.VIA3, Layers.METAL4),
    VIA4(Layers.METAL4, Layers.VIA4, Layers.METAL5),
    TOPVIA1(Layers.METAL5, Layers.TOPVIA1, Layers.TOPMETAL1);

    private final String lower;
    private final String cut;
    private final String upper;

    ViaLevel(String lower, String cut, String upper) {
        this.lower = lower;
        this.cut = cut;
        this.upper = upper;
    }

    public String lowerLayer() { return lower; }
    public String cutLayer() { return cut; }
    public String upperLayer() { return upper; }

    int cutSize(RuleSet rules) {
        return this == TOPVIA1 ? rules.length(TechConstant.TOPVIA1_SIZE) : rules.length(TechConstant.VIA_SIZE);
    }

    int lowerPad(RuleSet rules) {
        return switch (this) {
            case VIA1 -> cutSize(rules) + 2 * rules.length(TechConstant.VIA1_METAL1_ENCLOSURE);
            case TOPVIA1 -> rules.length(TechConstant.TOPMETAL1_MIN_WIDTH);
            default -> cutSize(rules) + 2 * rules.length(TechConstant.UPPER_VIA_ENCLOSURE);
        };
    }

    int upperPad(RuleSet rules) {
        return switch (this) {
            case VIA1 -> cutSize(rules) + 2 * rules.length(TechConstant.VIA1_METAL2_ENCLOSURE);
            case TOPVIA1 -> rules.length(TechConstant.TOPMETAL1_MIN_WIDTH);
            default -> cutSize(rules) + 2 * rules.length(TechConstant.UPPER_VIA_ENCLOSURE);
        };
    }
}

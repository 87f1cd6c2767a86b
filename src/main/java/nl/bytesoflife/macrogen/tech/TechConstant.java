package nl.bytesoflife.macrogen.tech;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Derived process constants consumed by the primitive builders. Lengths are stored in
 * grid units; sheet resistances and capacitance density are plain scalars.
 */
public enum TechConstant {
    CONTACT_SIZE("contact_size", true),
    CONTACT_ACTIV_ENCLOSURE("contact_activ_enclosure", true),
    CONTACT_POLY_ENCLOSURE("contact_poly_enclosure", true),
    CONTACT_METAL1_ENCLOSURE("contact_metal1_enclosure", true),
    GATE_EXTENSION("gate_extension", true),
    MIN_GATE_LENGTH("min_gate_length", true),
    IMPLANT_ENCLOSURE("implant_enclosure", true),
    NWELL_ENCLOSURE("nwell_enclosure", true),
    SALBLOCK_ENCLOSURE("salblock_enclosure", true),
    SALBLOCK_CLEARANCE("salblock_clearance", true),
    VIA_SIZE("via_size", true),
    VIA1_METAL1_ENCLOSURE("via1_metal1_enclosure", true),
    VIA1_METAL2_ENCLOSURE("via1_metal2_enclosure", true),
    UPPER_VIA_ENCLOSURE("upper_via_enclosure", true),
    TOPVIA1_SIZE("topvia1_size", true),
    MIM_MIN_SIZE("mim_min_size", true),
    MIM_METAL5_ENCLOSURE("mim_metal5_enclosure", true),
    TOPMETAL1_MIN_WIDTH("topmetal1_min_width", true),
    TOPMETAL1_MIM_ENCLOSURE("topmetal1_mim_enclosure", true),
    RHIGH_SHEET_RESISTANCE("rhigh_sheet_resistance", false),
    RPPD_SHEET_RESISTANCE("rppd_sheet_resistance", false),
    MIM_DENSITY("mim_density", false);

    private static final Map<String, TechConstant> BY_DECK_NAME = Arrays.stream(values())
            .collect(Collectors.toMap(TechConstant::getDeckName, Function.identity()));

    private final String deckName;
    private final boolean length;

    TechConstant(String deckName, boolean length) {
        this.deckName = deckName;
        this.length = length;
    }

    public String getDeckName() {
        return deckName;
    }

    /** True when the value is a length, stored in grid units. */
    public boolean isLength() {
        return length;
    }

    public static TechConstant fromDeckName(String name) {
        TechConstant constant = BY_DECK_NAME.get(name.toLowerCase());
        if (constant == null) {
            throw new IllegalArgumentException("Unknown technology constant: " + name);
        }
        return constant;
    }
}

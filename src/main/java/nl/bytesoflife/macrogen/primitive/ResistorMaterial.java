package nl.bytesoflife.macrogen.primitive;

import nl.bytesoflife.macrogen.tech.RuleSet;
import nl.bytesoflife.macrogen.tech.TechConstant;

/** Resistive poly flavours with their sheet resistance taken from the rule set. */
public enum ResistorMaterial {
    RHIGH(TechConstant.RHIGH_SHEET_RESISTANCE),
    RPPD(TechConstant.RPPD_SHEET_RESISTANCE);

    private final TechConstant sheet;

    ResistorMaterial(TechConstant sheet) {
        this.sheet = sheet;
    }

    public double sheetResistance(RuleSet rules) {
        return rules.value(sheet);
    }
}

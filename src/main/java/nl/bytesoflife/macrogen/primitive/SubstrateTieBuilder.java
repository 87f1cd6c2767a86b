package nl.bytesoflife.macrogen.primitive;

import nl.bytesoflife.macrogen.geometry.Cell;
import nl.bytesoflife.macrogen.geometry.Point;
import nl.bytesoflife.macrogen.geometry.Rect;
import nl.bytesoflife.macrogen.tech.Layers;
import nl.bytesoflife.macrogen.tech.RuleSet;
import nl.bytesoflife.macrogen.tech.TechConstant;

/**
 * Body tie: one contact on a minimal active square, p+ implanted for the substrate or
 * n+ implanted for an NWell.
 */
public class SubstrateTieBuilder {

    /** Furthest a transistor may sit from its nearest tie, in micrometres. */
    public static final double MAX_TIE_DISTANCE_UM = 20.0;

    public enum Kind {
        SUBSTRATE,
        WELL
    }

    private final RuleSet rules;

    public SubstrateTieBuilder(RuleSet rules) {
        this.rules = rules;
    }

    public int maxTieDistance() {
        return (int) Math.round(MAX_TIE_DISTANCE_UM * 1000.0 / rules.getGridNm());
    }

    /** Edge length of the tie's active square. */
    public int size() {
        return Contacts.landing(rules, TechConstant.CONTACT_ACTIV_ENCLOSURE);
    }

    public Rect place(Cell cell, Point center, Kind kind) {
        Rect active = cell.add(rules.layer(Layers.ACTIV), Rect.square(center, size()));
        String implant = kind == Kind.SUBSTRATE ? Layers.PSD : Layers.NSD;
        cell.add(rules.layer(implant), active.grow(rules.length(TechConstant.IMPLANT_ENCLOSURE)));
        Contacts.place(cell, rules, center);
        return active;
    }
}

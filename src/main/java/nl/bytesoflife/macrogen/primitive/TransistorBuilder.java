package nl.bytesoflife.macrogen.primitive;

import nl.bytesoflife.macrogen.geometry.Cell;
import nl.bytesoflife.macrogen.geometry.Point;
import nl.bytesoflife.macrogen.geometry.Rect;
import nl.bytesoflife.macrogen.tech.Layers;
import nl.bytesoflife.macrogen.tech.RuleSet;
import nl.bytesoflife.macrogen.tech.TechConstant;

/**
 * Single-finger MOS transistor with a horizontal channel: source on the left, drain on the right,
 * vertical gate poly overhanging the active area on both ends.
 */
public class TransistorBuilder {

    private final RuleSet rules;

    public TransistorBuilder(RuleSet rules) {
        this.rules = rules;
    }

    /** Extent of the active area along the channel for gate length {@code length}. */
    public int diffusionLength(int length) {
        return 2 * Contacts.landing(rules, TechConstant.CONTACT_ACTIV_ENCLOSURE) + length;
    }

    /** Offset of the drain contact centre from the active area's left edge. */
    public int drainOffset(int length) {
        return diffusionLength(length) - Contacts.landing(rules, TechConstant.CONTACT_ACTIV_ENCLOSURE) / 2;
    }

    /** Offset of the source contact centre from the active area's left edge. */
    public int sourceOffset() {
        return Contacts.landing(rules, TechConstant.CONTACT_ACTIV_ENCLOSURE) / 2;
    }

    /**
     * Places a transistor with the lower-left corner of its active area at {@code origin}.
     *
     * @param drawWell for PMOS, whether to draw its own NWell; callers sharing one well across a row pass false
     */
    public TransistorPins place(Cell cell, Point origin, Polarity polarity, int width, int length,
                                boolean drawWell, GateTap tap) {
        validate(width, length);

        int sd = Contacts.landing(rules, TechConstant.CONTACT_ACTIV_ENCLOSURE);
        int head = Contacts.landing(rules, TechConstant.CONTACT_POLY_ENCLOSURE);
        int ext = rules.length(TechConstant.GATE_EXTENSION);
        int x = origin.x();
        int y = origin.y();
        int diffusion = sd + length + sd;

        Rect active = cell.add(rules.layer(Layers.ACTIV), new Rect(x, y, x + diffusion, y + width));
        int implant = rules.length(TechConstant.IMPLANT_ENCLOSURE);
        String implantLayer = polarity == Polarity.PMOS ? Layers.PSD : Layers.NSD;
        cell.add(rules.layer(implantLayer), active.grow(implant));
        if (polarity == Polarity.PMOS && drawWell) {
            cell.add(rules.layer(Layers.NWELL), active.grow(rules.length(TechConstant.NWELL_ENCLOSURE)));
        }

        int g1 = x + sd;
        int g2 = g1 + length;
        cell.add(rules.layer(Layers.GATPOLY), new Rect(g1, y - ext, g2, y + width + ext));

        Point gate;
        if (tap.side() == GateTap.Side.NONE) {
            gate = new Point(g1 + length / 2, y - ext);
        } else {
            int headX = tap.headX() != null ? tap.headX() : g1 + length / 2;
            int jx1 = Math.min(g1, headX - head / 2);
            int jx2 = Math.max(g2, headX + head / 2);
            int gy;
            if (tap.side() == GateTap.Side.ABOVE) {
                cell.add(rules.layer(Layers.GATPOLY), new Rect(jx1, y + width + ext, jx2, y + width + ext + head));
                gy = y + width + ext + head / 2;
            } else {
                cell.add(rules.layer(Layers.GATPOLY), new Rect(jx1, y - ext - head, jx2, y - ext));
                gy = y - ext - head / 2;
            }
            gate = new Point(headX, gy);
            Contacts.place(cell, rules, gate);
        }

        Point source = new Point(x + sd / 2, y + width / 2);
        Point drain = new Point(x + diffusion - sd / 2, y + width / 2);
        Contacts.place(cell, rules, source);
        Contacts.place(cell, rules, drain);
        return new TransistorPins(gate, source, drain, diffusion, active);
    }

    private void validate(int width, int length) {
        int minLength = Math.max(rules.length(TechConstant.MIN_GATE_LENGTH), Rules.minimum(rules, "Gat.a"));
        if (length < minLength) {
            throw new InvalidParameterException("Gat.a",
                    "Gate length " + length + " is below the technology minimum " + minLength);
        }
        if (width < Rules.minimum(rules, "Act.a")) {
            throw new InvalidParameterException("Act.a", "Transistor width " + width + " is below the minimum active width");
        }
        int cont = rules.length(TechConstant.CONTACT_SIZE);
        if ((width - cont) / 2 < Rules.minimum(rules, "Cnt.c")) {
            throw new InvalidParameterException("Cnt.c",
                    "Transistor width " + width + " cannot enclose its source/drain contacts");
        }
    }
}

package nl.bytesoflife.macrogen.primitive;

import nl.bytesoflife.macrogen.geometry.Cell;
import nl.bytesoflife.macrogen.geometry.Point;
import nl.bytesoflife.macrogen.geometry.Rect;
import nl.bytesoflife.macrogen.tech.Layers;
import nl.bytesoflife.macrogen.tech.RuleSet;
import nl.bytesoflife.macrogen.tech.TechConstant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Poly resistor with a salicide block over the body and a contact head at each end.
 * <p>
 * The body length is always derived from the target resistance:
 * {@code length = resistance / sheetResistance * width}, rounded to the grid.
 */
public class ResistorBuilder {

    private static final Logger log = LoggerFactory.getLogger(ResistorBuilder.class);

    private final RuleSet rules;

    public ResistorBuilder(RuleSet rules) {
        this.rules = rules;
    }

    /**
     * Body length for a target resistance, in grid units.
     *
     * @throws InvalidParameterException if the resistance or sheet resistance is not positive, or the
     *                                   length would round to zero
     */
    public int bodyLength(double sheetOhms, double ohms, int width) {
        if (!(ohms > 0) || Double.isInfinite(ohms)) {
            throw new InvalidParameterException("resistance", "Target resistance must be positive, got " + ohms + " ohm");
        }
        if (!(sheetOhms > 0)) {
            throw new InvalidParameterException("sheet_resistance", "Sheet resistance must be positive, got " + sheetOhms);
        }
        long length = Math.round(ohms / sheetOhms * width);
        if (length <= 0) {
            throw new InvalidParameterException("resistance",
                    ohms + " ohm is below one grid step of " + sheetOhms + " ohm/sq material at width " + width);
        }
        if (length > Integer.MAX_VALUE / 4) {
            throw new InvalidParameterException("resistance", ohms + " ohm does not fit on the layout grid");
        }
        return (int) length;
    }

    /**
     * Places a resistor with its lower-left poly corner at {@code origin}.
     */
    public ResistorEnds place(Cell cell, Point origin, double sheetOhms, double ohms, int width,
                              Orientation orientation) {
        if (width < Rules.minimum(rules, "Gat.a")) {
            throw new InvalidParameterException("Gat.a", "Resistor width " + width + " is below the minimum poly width");
        }
        int cont = rules.length(TechConstant.CONTACT_SIZE);
        if ((width - cont) / 2 < Rules.minimum(rules, "Cnt.d")) {
            throw new InvalidParameterException("Cnt.d", "Resistor width " + width + " cannot enclose an end contact");
        }
        int length = bodyLength(sheetOhms, ohms, width);
        int salEnclosure = rules.length(TechConstant.SALBLOCK_ENCLOSURE);
        if (length + 2 * salEnclosure < Rules.minimum(rules, "Sal.a")) {
            throw new InvalidParameterException("Sal.a",
                    "Resistor body " + length + " is too short for a legal salicide block");
        }

        int head = Contacts.landing(rules, TechConstant.CONTACT_POLY_ENCLOSURE);
        int clearance = rules.length(TechConstant.SALBLOCK_CLEARANCE);
        int implant = rules.length(TechConstant.IMPLANT_ENCLOSURE);
        int total = head + clearance + length + clearance + head;
        int x = origin.x();
        int y = origin.y();

        Rect body;
        Rect block;
        Point a;
        Point b;
        if (orientation == Orientation.HORIZONTAL) {
            body = new Rect(x, y, x + total, y + width);
            block = new Rect(x + head + clearance - salEnclosure, y - salEnclosure,
                    x + head + clearance + length + salEnclosure, y + width + salEnclosure);
            a = new Point(x + head / 2, y + width / 2);
            b = new Point(x + total - head / 2, y + width / 2);
        } else {
            body = new Rect(x, y, x + width, y + total);
            block = new Rect(x - salEnclosure, y + head + clearance - salEnclosure,
                    x + width + salEnclosure, y + head + clearance + length + salEnclosure);
            a = new Point(x + width / 2, y + head / 2);
            b = new Point(x + width / 2, y + total - head / 2);
        }

        cell.add(rules.layer(Layers.GATPOLY), body);
        cell.add(rules.layer(Layers.PSD), body.grow(implant));
        cell.add(rules.layer(Layers.SALBLOCK), block);
        Contacts.place(cell, rules, a);
        Contacts.place(cell, rules, b);

        log.debug("Resistor {} ohm at {}: body {} nm, total {} nm, {}", ohms, origin, length, total, orientation);
        return new ResistorEnds(a, b, length, total, body);
    }

    public ResistorEnds place(Cell cell, Point origin, ResistorMaterial material, double ohms, int width,
                              Orientation orientation) {
        return place(cell, origin, material.sheetResistance(rules), ohms, width, orientation);
    }
}

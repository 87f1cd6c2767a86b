package nl.bytesoflife.macrogen.primitive;

import nl.bytesoflife.macrogen.geometry.Cell;
import nl.bytesoflife.macrogen.geometry.Point;
import nl.bytesoflife.macrogen.geometry.Rect;
import nl.bytesoflife.macrogen.tech.Layers;
import nl.bytesoflife.macrogen.tech.RuleSet;
import nl.bytesoflife.macrogen.tech.TechConstant;

/** A single contact cut with its Metal1 landing pad. */
final class Contacts {

    private Contacts() {
    }

    static Rect place(Cell cell, RuleSet rules, Point center) {
        int size = rules.length(TechConstant.CONTACT_SIZE);
        int pad = size + 2 * rules.length(TechConstant.CONTACT_METAL1_ENCLOSURE);
        cell.add(rules.layer(Layers.CONT), Rect.square(center, size));
        return cell.add(rules.layer(Layers.METAL1), Rect.square(center, pad));
    }

    /** Edge length of the diffusion or poly area a contact needs: the cut plus its enclosure on both sides. */
    static int landing(RuleSet rules, TechConstant enclosure) {
        return rules.length(TechConstant.CONTACT_SIZE) + 2 * rules.length(enclosure);
    }
}

package nl.bytesoflife.macrogen.primitive;

import nl.bytesoflife.macrogen.geometry.Cell;
import nl.bytesoflife.macrogen.geometry.Point;
import nl.bytesoflife.macrogen.geometry.Rect;
import nl.bytesoflife.macrogen.tech.RuleSet;

/**
 * Via cuts with their landing pads on the metals directly below and above.
 * Pads are the cut grown by the technology's minimum enclosure; the top-metal via lands on
 * minimum-width top-metal squares.
 */
public class ViaStackBuilder {

    private final RuleSet rules;

    public ViaStackBuilder(RuleSet rules) {
        this.rules = rules;
    }

    /** Places one via level centred on {@code center}; returns the cut. */
    public Rect place(Cell cell, Point center, ViaLevel level) {
        cell.add(rules.layer(level.lowerLayer()), Rect.square(center, level.lowerPad(rules)));
        cell.add(rules.layer(level.upperLayer()), Rect.square(center, level.upperPad(rules)));
        return cell.add(rules.layer(level.cutLayer()), Rect.square(center, level.cutSize(rules)));
    }

    /** Stacks every level from {@code from} to {@code to}, inclusive, on one centre. */
    public void stack(Cell cell, Point center, ViaLevel from, ViaLevel to) {
        if (to.ordinal() < from.ordinal()) {
            throw new IllegalArgumentException("Via stack " + from + " to " + to + " runs downwards");
        }
        for (ViaLevel level : ViaLevel.values()) {
            if (level.ordinal() >= from.ordinal() && level.ordinal() <= to.ordinal()) {
                place(cell, center, level);
            }
        }
    }
}

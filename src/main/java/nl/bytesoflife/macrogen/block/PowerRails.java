package nl.bytesoflife.macrogen.block;

import nl.bytesoflife.macrogen.geometry.Cell;
import nl.bytesoflife.macrogen.geometry.Rect;
import nl.bytesoflife.macrogen.tech.Layers;
import nl.bytesoflife.macrogen.tech.RuleSet;

/**
 * Full-width Metal3 supply rails: VSS along the bottom edge, VDD along the top edge.
 */
public final class PowerRails {

    public static final String VSS = "vss";
    public static final String VDD = "vdd";
    public static final int HEIGHT = 2000;

    private PowerRails() {
    }

    public static int vssCenter() {
        return HEIGHT / 2;
    }

    public static int vddCenter(int macroHeight) {
        return macroHeight - HEIGHT / 2;
    }

    /** Draws both rails with their pins. */
    public static void draw(Cell cell, RuleSet rules, int width, int height) {
        Rect vss = cell.add(rules.layer(Layers.METAL3), new Rect(0, 0, width, HEIGHT));
        Rect vdd = cell.add(rules.layer(Layers.METAL3), new Rect(0, height - HEIGHT, width, height));
        cell.addPin(rules.layer(Layers.METAL3), vss, VSS);
        cell.addPin(rules.layer(Layers.METAL3), vdd, VDD);
    }
}

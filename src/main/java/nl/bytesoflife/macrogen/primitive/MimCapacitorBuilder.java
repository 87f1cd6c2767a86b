package nl.bytesoflife.macrogen.primitive;

import nl.bytesoflife.macrogen.geometry.Cell;
import nl.bytesoflife.macrogen.geometry.Point;
import nl.bytesoflife.macrogen.geometry.Rect;
import nl.bytesoflife.macrogen.tech.Layers;
import nl.bytesoflife.macrogen.tech.RuleSet;
import nl.bytesoflife.macrogen.tech.TechConstant;

/**
 * Metal-insulator-metal capacitor: the Cmim dielectric, a Metal5 bottom plate enclosing it,
 * and a TopMetal1 cover widened to the minimum top-metal width when the dielectric is narrower.
 */
public class MimCapacitorBuilder {

    private final RuleSet rules;

    public MimCapacitorBuilder(RuleSet rules) {
        this.rules = rules;
    }

    /**
     * Plate size for a target capacitance: square when the area allows it, never below the
     * minimum plate size.
     */
    public CapacitorSize size(double femtoFarads) {
        if (!(femtoFarads > 0) || Double.isInfinite(femtoFarads)) {
            throw new InvalidParameterException("capacitance", "Capacitance must be positive, got " + femtoFarads + " fF");
        }
        double grid = rules.getGridNm();
        double areaUm2 = femtoFarads / rules.value(TechConstant.MIM_DENSITY);
        int min = rules.length(TechConstant.MIM_MIN_SIZE);
        int width = (int) Math.max(min, Math.round(Math.sqrt(areaUm2) * 1000.0 / grid));
        int height = (int) Math.max(min, Math.round(areaUm2 * 1e6 / (grid * grid) / width));
        return new CapacitorSize(width, height);
    }

    /** Capacitance of a plate in femtofarads. */
    public double capacitance(CapacitorSize size) {
        double grid = rules.getGridNm();
        return size.width() * grid / 1000.0 * size.height() * grid / 1000.0 * rules.value(TechConstant.MIM_DENSITY);
    }

    /** Horizontal and vertical TopMetal1 overhang of the plate, in that order. */
    public int[] topPlateEnclosure(CapacitorSize size) {
        return new int[]{topEnclosure(size.width()), topEnclosure(size.height())};
    }

    /**
     * Places the capacitor with the lower-left dielectric corner at {@code origin}.
     */
    public CapacitorPins place(Cell cell, Point origin, CapacitorSize size) {
        int min = Math.max(rules.length(TechConstant.MIM_MIN_SIZE), Rules.minimum(rules, "MIM.a"));
        if (size.width() < min || size.height() < min) {
            throw new InvalidParameterException("MIM.a",
                    "Capacitor plate " + size.width() + "x" + size.height() + " is below the minimum " + min);
        }
        int x = origin.x();
        int y = origin.y();
        Rect plate = cell.add(rules.layer(Layers.CMIM), new Rect(x, y, x + size.width(), y + size.height()));
        Rect bottom = cell.add(rules.layer(Layers.METAL5), plate.grow(rules.length(TechConstant.MIM_METAL5_ENCLOSURE)));
        int ew = topEnclosure(size.width());
        int eh = topEnclosure(size.height());
        Rect top = cell.add(rules.layer(Layers.TOPMETAL1),
                new Rect(x - ew, y - eh, x + size.width() + ew, y + size.height() + eh));

        int cx = x + size.width() / 2;
        return new CapacitorPins(new Point(cx, bottom.y1()), new Point(cx, top.y2()), plate, bottom, top);
    }

    public CapacitorPins place(Cell cell, Point origin, double femtoFarads) {
        return place(cell, origin, size(femtoFarads));
    }

    private int topEnclosure(int plate) {
        int minEnclosure = rules.length(TechConstant.TOPMETAL1_MIM_ENCLOSURE);
        int deficit = rules.length(TechConstant.TOPMETAL1_MIN_WIDTH) - plate;
        return Math.max(minEnclosure, (deficit + 1) / 2);
    }
}

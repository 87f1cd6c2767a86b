package nl.bytesoflife.macrogen.block;

import nl.bytesoflife.macrogen.geometry.Point;
import nl.bytesoflife.macrogen.geometry.Rect;
import nl.bytesoflife.macrogen.primitive.CapacitorSize;

/**
 * A stacked capacitor: dielectric bounds, plate size and the two Metal2 tap points.
 */
public record PlacedCapacitor(CapacitorSpec spec, CapacitorSize size, Rect plate,
                              Point bottomTap, Point topTap) {

    public Point center() {
        return plate.center();
    }
}

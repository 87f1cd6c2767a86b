package nl.bytesoflife.macrogen.primitive;

import nl.bytesoflife.macrogen.geometry.Point;
import nl.bytesoflife.macrogen.geometry.Rect;

/**
 * Connection points of a placed MIM capacitor: {@code bottom} is the lower edge centre of the
 * Metal5 bottom plate, {@code top} the upper edge centre of the TopMetal1 top-plate cover.
 */
public record CapacitorPins(Point bottom, Point top, Rect plate, Rect bottomPlate, Rect topPlate) {
}

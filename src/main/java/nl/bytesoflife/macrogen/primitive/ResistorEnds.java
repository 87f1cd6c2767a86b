package nl.bytesoflife.macrogen.primitive;

import nl.bytesoflife.macrogen.geometry.Point;
import nl.bytesoflife.macrogen.geometry.Rect;

/**
 * Connection points of a placed resistor. For a vertical resistor {@code left} is the bottom
 * contact and {@code right} the top one.
 *
 * @param bodyLength   resistive length between the salicide-block edges, in grid units
 * @param totalLength  extent along the current direction including both contact heads
 * @param bounds       extent of the resistor poly
 */
public record ResistorEnds(Point left, Point right, int bodyLength, int totalLength, Rect bounds) {
}

package nl.bytesoflife.macrogen.geometry;

/** A grid coordinate. */
public record Point(int x, int y) {
}

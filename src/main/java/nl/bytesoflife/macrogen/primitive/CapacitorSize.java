package nl.bytesoflife.macrogen.primitive;

/** Plate dimensions of a MIM capacitor in grid units. */
public record CapacitorSize(int width, int height) {
}

package nl.bytesoflife.macrogen.block;

import nl.bytesoflife.macrogen.geometry.Cell;
import nl.bytesoflife.macrogen.geometry.Rect;
import nl.bytesoflife.macrogen.tech.Layer;

/** Straight routing segments between two centre points, without end extension. Zero-length segments are dropped. */
final class Wires {

    private Wires() {
    }

    static void vertical(Cell cell, Layer layer, int x, int ya, int yb, int width) {
        if (ya == yb) {
            return;
        }
        int half = width / 2;
        cell.add(layer, new Rect(x - half, Math.min(ya, yb), x - half + width, Math.max(ya, yb)));
    }

    static void horizontal(Cell cell, Layer layer, int y, int xa, int xb, int width) {
        if (xa == xb) {
            return;
        }
        int half = width / 2;
        cell.add(layer, new Rect(Math.min(xa, xb), y - half, Math.max(xa, xb), y - half + width));
    }
}

package nl.bytesoflife.macrogen.geometry;

/**
 * An axis-aligned rectangle in grid units, lower-left inclusive corner first.
 * Width and height are always positive.
 */
public record Rect(int x1, int y1, int x2, int y2) {

    public Rect {
        if (x2 <= x1 || y2 <= y1) {
            throw new IllegalArgumentException(
                    "Degenerate rectangle (" + x1 + ", " + y1 + ") - (" + x2 + ", " + y2 + ")");
        }
    }

    /** Builds a rectangle from two opposite corners given in any order. */
    public static Rect of(int xa, int ya, int xb, int yb) {
        return new Rect(Math.min(xa, xb), Math.min(ya, yb), Math.max(xa, xb), Math.max(ya, yb));
    }

    /** A {@code width} x {@code height} rectangle whose lower-left corner is {@code center - size / 2}. */
    public static Rect centered(int cx, int cy, int width, int height) {
        int x1 = cx - width / 2;
        int y1 = cy - height / 2;
        return new Rect(x1, y1, x1 + width, y1 + height);
    }

    public static Rect square(Point center, int size) {
        return centered(center.x(), center.y(), size, size);
    }

    public int width() {
        return x2 - x1;
    }

    public int height() {
        return y2 - y1;
    }

    public Point center() {
        return new Point((x1 + x2) / 2, (y1 + y2) / 2);
    }

    public Rect grow(int margin) {
        return new Rect(x1 - margin, y1 - margin, x2 + margin, y2 + margin);
    }

    public Rect union(Rect other) {
        return new Rect(Math.min(x1, other.x1), Math.min(y1, other.y1),
                Math.max(x2, other.x2), Math.max(y2, other.y2));
    }

    public boolean contains(Point p) {
        return p.x() >= x1 && p.x() <= x2 && p.y() >= y1 && p.y() <= y2;
    }
}

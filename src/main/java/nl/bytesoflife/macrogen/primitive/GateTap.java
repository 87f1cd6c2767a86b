package nl.bytesoflife.macrogen.primitive;

/**
 * Where a transistor's gate contact goes. The contact head sits past the gate end on the
 * chosen side; a poly jog joins it to the gate when {@code headX} is not over the gate.
 */
public record GateTap(Side side, Integer headX) {

    public enum Side {
        NONE,
        ABOVE,
        BELOW
    }

    public static final GateTap NONE = new GateTap(Side.NONE, null);

    /** Head centred on the gate. */
    public static GateTap above() {
        return new GateTap(Side.ABOVE, null);
    }

    public static GateTap below() {
        return new GateTap(Side.BELOW, null);
    }

    /** Head centred on column {@code headX}. */
    public static GateTap above(int headX) {
        return new GateTap(Side.ABOVE, headX);
    }

    public static GateTap below(int headX) {
        return new GateTap(Side.BELOW, headX);
    }
}

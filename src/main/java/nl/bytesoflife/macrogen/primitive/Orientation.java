package nl.bytesoflife.macrogen.primitive;

public enum Orientation {
    HORIZONTAL,
    VERTICAL
}

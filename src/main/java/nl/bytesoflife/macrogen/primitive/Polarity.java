package nl.bytesoflife.macrogen.primitive;

public enum Polarity {
    NMOS,
    PMOS
}

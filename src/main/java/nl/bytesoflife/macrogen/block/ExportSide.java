package nl.bytesoflife.macrogen.block;

/** Macro edge an exported net is brought out to. */
public enum ExportSide {
    LEFT,
    RIGHT
}

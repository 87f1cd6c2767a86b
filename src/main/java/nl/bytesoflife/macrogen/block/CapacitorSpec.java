package nl.bytesoflife.macrogen.block;

/**
 * One capacitor to stack: its value and the nets on its two plates.
 *
 * @param topNet    net on the TopMetal1 top plate
 * @param bottomNet net on the Metal5 bottom plate
 */
public record CapacitorSpec(String name, double femtoFarads, String topNet, String bottomNet) {
}

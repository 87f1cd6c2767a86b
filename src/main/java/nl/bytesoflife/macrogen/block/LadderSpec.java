package nl.bytesoflife.macrogen.block;

/**
 * Placement and electrical parameters of one resistor-ladder channel. Lengths in grid units.
 *
 * @param bits            number of series segments, one switch each
 * @param x0              left edge of the first series resistor
 * @param seriesY         bottom edge of the series resistor row
 * @param switchY         bottom edge of the switch transistors' active area
 * @param pinBaseY        centre of bit 0's input track; bit k sits at {@code pinBaseY + k * pinPitch}
 * @param referenceRiser  whether to route the ladder's reference end up to the VDD rail
 * @param groundStrapY    when non-null, ground verticals stop at this height (an existing strap)
 *                        instead of dropping to the VSS rail
 */
public record LadderSpec(int bits, int x0, int seriesY, int switchY, int pinBaseY, int pinPitch,
                         int macroWidth, int macroHeight, double sheetOhms, double unitOhms, int resistorWidth,
                         boolean referenceRiser, Integer groundStrapY, String pinPrefix) {

    public LadderSpec {
        if (bits < 1) {
            throw new IllegalArgumentException("A ladder needs at least one bit, got " + bits);
        }
    }
}

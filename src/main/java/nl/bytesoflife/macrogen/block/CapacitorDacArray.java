package nl.bytesoflife.macrogen.block;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

/**
 * Binary-weighted capacitor array for a charge-redistribution DAC: weight 0 is a dummy unit,
 * weight {@code b >= 1} is {@code 2^(b-1)} units. All top plates share one net.
 */
public final class CapacitorDacArray {

    private CapacitorDacArray() {
    }

    public static int weight(int bit) {
        if (bit < 0) {
            throw new IllegalArgumentException("Negative bit index " + bit);
        }
        return bit == 0 ? 1 : 1 << (bit - 1);
    }

    /**
     * Capacitors {@code prefix0 .. prefixN} for an N-bit array.
     *
     * @param bottomNet bottom-plate net of each weight
     */
    public static List<CapacitorSpec> specs(String prefix, int bits, double unitFemtoFarads, String topNet,
                                            IntFunction<String> bottomNet) {
        List<CapacitorSpec> specs = new ArrayList<>();
        for (int b = 0; b <= bits; b++) {
            specs.add(new CapacitorSpec(prefix + b, weight(b) * unitFemtoFarads, topNet, bottomNet.apply(b)));
        }
        return specs;
    }
}

package nl.bytesoflife.macrogen.block;

import java.util.List;

/**
 * NMOS pass-transistor selector: one switch per input, drains tied to the output, each gate on
 * its own one-hot select line. No decoding happens here.
 */
public final class OutputMux {

    private OutputMux() {
    }

    public static void add(Schematic s, String name, List<String> inputs, List<String> selects, String out) {
        if (inputs.size() != selects.size()) {
            throw new IllegalArgumentException("Mux " + name + " has " + inputs.size() + " inputs but "
                    + selects.size() + " select lines");
        }
        for (int i = 0; i < inputs.size(); i++) {
            s.nmos(name + ".m" + i, 2000, 130, selects.get(i), inputs.get(i), out);
        }
    }
}

package nl.bytesoflife.macrogen.block;

/**
 * Five-transistor transconductor: NMOS tail, NMOS differential pair and a diode-connected PMOS
 * mirror load. Internal nets are named {@code <name>.tail} and {@code <name>.x}.
 */
public final class Transconductor {

    static final int TAIL_WIDTH = 2000;
    static final int PAIR_WIDTH = 4000;
    static final int LOAD_WIDTH = 2000;
    static final int LENGTH = 500;

    private Transconductor() {
    }

    public static void add(Schematic s, String name, String inp, String inn, String out, String bias) {
        String tail = name + ".tail";
        String mirror = name + ".x";
        s.nmos(name + ".mt", TAIL_WIDTH, LENGTH, bias, PowerRails.VSS, tail);
        s.nmos(name + ".m1", PAIR_WIDTH, LENGTH, inp, tail, mirror);
        s.nmos(name + ".m2", PAIR_WIDTH, LENGTH, inn, tail, out);
        s.pmos(name + ".m3", LOAD_WIDTH, LENGTH, mirror, PowerRails.VDD, mirror);
        s.pmos(name + ".m4", LOAD_WIDTH, LENGTH, mirror, PowerRails.VDD, out);
    }
}

package nl.bytesoflife.macrogen.block;

/**
 * StrongARM latch: clocked tail, input pair, cross-coupled NMOS and PMOS pairs and four PMOS
 * reset devices precharging both outputs and both internal nodes while the clock is low.
 */
public final class LatchedComparator {

    private LatchedComparator() {
    }

    public static void add(Schematic s, String name, String inp, String inn, String clock,
                           String outp, String outn) {
        String tail = name + ".tail";
        String xp = name + ".xp";
        String xn = name + ".xn";
        s.nmos(name + ".mt", 4000, 130, clock, PowerRails.VSS, tail);
        s.nmos(name + ".mip", 2000, 500, inp, tail, xp);
        s.nmos(name + ".min", 2000, 500, inn, tail, xn);
        s.nmos(name + ".mn1", 1000, 130, outn, xp, outp);
        s.nmos(name + ".mn2", 1000, 130, outp, xn, outn);
        s.pmos(name + ".mp1", 2000, 130, outn, PowerRails.VDD, outp);
        s.pmos(name + ".mp2", 2000, 130, outp, PowerRails.VDD, outn);
        s.pmos(name + ".mr1", 1000, 130, clock, PowerRails.VDD, outp);
        s.pmos(name + ".mr2", 1000, 130, clock, PowerRails.VDD, outn);
        s.pmos(name + ".mr3", 1000, 130, clock, PowerRails.VDD, xp);
        s.pmos(name + ".mr4", 1000, 130, clock, PowerRails.VDD, xn);
    }
}

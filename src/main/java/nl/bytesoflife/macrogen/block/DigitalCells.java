package nl.bytesoflife.macrogen.block;

/**
 * Static CMOS cells at minimum gate length.
 */
public final class DigitalCells {

    static final int MIN_LENGTH = 130;
    static final int NMOS_WIDTH = 1000;
    static final int PMOS_WIDTH = 2000;

    /** Outputs of a two-phase non-overlapping clock generator. */
    public record ClockPhases(String phi1, String phi1b, String phi2, String phi2b) {
    }

    private DigitalCells() {
    }

    public static void inverter(Schematic s, String name, String in, String out) {
        inverter(s, name, in, out, PowerRails.VDD);
    }

    /** Inverter whose PMOS pulls up to {@code high} instead of VDD, e.g. a reference driver. */
    public static void inverter(Schematic s, String name, String in, String out, String high) {
        s.nmos(name + ".mn", NMOS_WIDTH, MIN_LENGTH, in, PowerRails.VSS, out);
        s.pmos(name + ".mp", PMOS_WIDTH, MIN_LENGTH, in, high, out);
    }

    public static void nand2(Schematic s, String name, String a, String b, String out) {
        String mid = name + ".mid";
        s.nmos(name + ".na", NMOS_WIDTH, MIN_LENGTH, a, PowerRails.VSS, mid);
        s.nmos(name + ".nb", NMOS_WIDTH, MIN_LENGTH, b, mid, out);
        s.pmos(name + ".pa", PMOS_WIDTH, MIN_LENGTH, a, PowerRails.VDD, out);
        s.pmos(name + ".pb", PMOS_WIDTH, MIN_LENGTH, b, PowerRails.VDD, out);
    }

    /** CMOS transmission gate between {@code a} and {@code b}, on when {@code control} is high. */
    public static void transmissionGate(Schematic s, String name, String a, String b,
                                        String control, String controlBar) {
        s.nmos(name + ".mn", 2 * NMOS_WIDTH, MIN_LENGTH, control, a, b);
        s.pmos(name + ".mp", 2 * PMOS_WIDTH, MIN_LENGTH, controlBar, a, b);
    }

    /**
     * Cross-coupled NAND latch producing two non-overlapping phases from one clock: phi1 follows
     * the clock, phi2 its inverse, and neither rises before the other has fallen.
     */
    public static ClockPhases nonOverlappingClock(Schematic s, String name, String clock) {
        String clockBar = name + ".clkb";
        ClockPhases phases = new ClockPhases(name + ".phi1", name + ".phi1b", name + ".phi2", name + ".phi2b");
        inverter(s, name + ".i0", clock, clockBar);
        nand2(s, name + ".n1", clock, phases.phi2(), phases.phi1b());
        inverter(s, name + ".i1", phases.phi1b(), phases.phi1());
        nand2(s, name + ".n2", clockBar, phases.phi1(), phases.phi2b());
        inverter(s, name + ".i2", phases.phi2b(), phases.phi2());
        return phases;
    }
}

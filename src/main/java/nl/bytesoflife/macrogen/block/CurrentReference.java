package nl.bytesoflife.macrogen.block;

/** Diode-connected NMOS that turns an input bias current into a mirror gate voltage. */
public final class CurrentReference {

    private CurrentReference() {
    }

    public static void add(Schematic s, String name, String net) {
        s.nmos(name, 2000, 1000, net, PowerRails.VSS, net);
    }
}

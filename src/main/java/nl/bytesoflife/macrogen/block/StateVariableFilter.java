package nl.bytesoflife.macrogen.block;

import java.util.ArrayList;
import java.util.List;

/**
 * Second-order state-variable filters with low-pass, band-pass and high-pass outputs on nets
 * {@code lp}, {@code bp} and {@code hp}, and a 4:1 selector driving {@code vout} from those three
 * and the input {@code vin}.
 */
public final class StateVariableFilter {

    public static final String INPUT = "vin";
    public static final String COMMON_MODE = "vcm";
    public static final String OUTPUT = "vout";
    public static final List<String> MUX_INPUTS = List.of("lp", "bp", "hp", INPUT);

    static final double GM_C_INTEGRATOR_FF = 1000;
    static final double SC_INTEGRATOR_FF = 1100;
    static final double SC_SAMPLING_FF = 294;
    static final double SC_UNIT_FF = 73.5;

    private StateVariableFilter() {
    }

    public static List<String> selectLines() {
        return indexed("sel", MUX_INPUTS.size());
    }

    /** Integration capacitors of the gm-C filter, one per integrator output. */
    public static List<CapacitorSpec> gmCCapacitors() {
        return List.of(
                new CapacitorSpec("c1", GM_C_INTEGRATOR_FF, "bp", PowerRails.VSS),
                new CapacitorSpec("c2", GM_C_INTEGRATOR_FF, "lp", PowerRails.VSS));
    }

    /**
     * Continuous-time filter: a summing transconductor, two gm-C integrators and a damping
     * transconductor whose bias, and with it Q, comes from a separate reference.
     */
    public static void gmC(Schematic s, String frequencyBias, String qBias) {
        CurrentReference.add(s, "bfc", frequencyBias);
        CurrentReference.add(s, "bq", qBias);
        Transconductor.add(s, "ota1", INPUT, "lp", "hp", frequencyBias);
        Transconductor.add(s, "ota2", "hp", COMMON_MODE, "bp", frequencyBias);
        Transconductor.add(s, "ota3", "bp", COMMON_MODE, "lp", frequencyBias);
        Transconductor.add(s, "ota4", "bp", "hp", "hp", qBias);
        OutputMux.add(s, "mux", MUX_INPUTS, selectLines(), OUTPUT);
    }

    /**
     * Capacitors of the switched-capacitor filter: two integration capacitors, three sampling
     * capacitors into the summing node, two switched-capacitor resistors and a binary-weighted
     * Q array of {@code qBits} capacitors.
     */
    public static List<CapacitorSpec> switchedCapacitorCapacitors(int qBits) {
        List<CapacitorSpec> specs = new ArrayList<>();
        specs.add(new CapacitorSpec("cint1", SC_INTEGRATOR_FF, "s1", "bp"));
        specs.add(new CapacitorSpec("cint2", SC_INTEGRATOR_FF, "s2", "lp"));
        specs.add(new CapacitorSpec("cin", SC_SAMPLING_FF, "sh", INPUT));
        specs.add(new CapacitorSpec("cf", SC_SAMPLING_FF, "sh", "hp"));
        specs.add(new CapacitorSpec("clp", SC_SAMPLING_FF, "sh", "lp"));
        specs.add(new CapacitorSpec("csw1", SC_UNIT_FF, "n1", PowerRails.VSS));
        specs.add(new CapacitorSpec("csw2", SC_UNIT_FF, "n2", PowerRails.VSS));
        for (int k = 0; k < qBits; k++) {
            specs.add(new CapacitorSpec("cq" + k, SC_UNIT_FF * (1 << k), "sh", "m" + k));
        }
        return specs;
    }

    /**
     * Switched-capacitor filter: a summing amplifier, two integrators each fed by a pair of
     * transmission gates on opposite clock phases, and the Q array whose capacitors are switched
     * onto the band-pass output by the {@code q[k]} bits.
     */
    public static void switchedCapacitor(Schematic s, String bias, String clock, int qBits) {
        CurrentReference.add(s, "bias", bias);
        DigitalCells.ClockPhases phases = DigitalCells.nonOverlappingClock(s, "nol", clock);
        Transconductor.add(s, "otah", COMMON_MODE, "sh", "hp", bias);
        integrator(s, "1", "hp", "bp", bias, phases);
        integrator(s, "2", "bp", "lp", bias, phases);
        for (int k = 0; k < qBits; k++) {
            s.nmos("q" + k, 2000, 130, "q[" + k + "]", "bp", "m" + k);
        }
        OutputMux.add(s, "mux", MUX_INPUTS, selectLines(), OUTPUT);
    }

    public static List<String> indexed(String prefix, int count) {
        List<String> nets = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            nets.add(prefix + "[" + i + "]");
        }
        return nets;
    }

    private static void integrator(Schematic s, String id, String in, String out, String bias,
                                   DigitalCells.ClockPhases phases) {
        String node = "n" + id;
        String summing = "s" + id;
        DigitalCells.transmissionGate(s, "s" + id + "a", in, node, phases.phi1(), phases.phi1b());
        DigitalCells.transmissionGate(s, "s" + id + "b", node, summing, phases.phi2(), phases.phi2b());
        Transconductor.add(s, "ota" + id, COMMON_MODE, summing, out, bias);
    }
}

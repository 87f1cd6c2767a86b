package nl.bytesoflife.macrogen.block;

import nl.bytesoflife.macrogen.primitive.Polarity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Transistor-level netlist of one macro, in placement order, plus the fixed connection points of
 * already placed capacitors and the nets brought out to the macro edges.
 * <p>
 * Nets are plain strings. {@link PowerRails#VSS} and {@link PowerRails#VDD} are rails: the router
 * drops them straight onto the supply straps instead of giving them a routing track.
 */
public class Schematic {

    /** One single-finger transistor. Width and length in grid units. */
    public record Device(String name, Polarity polarity, int width, int length,
                         String gate, String source, String drain) {
    }

    /** A fixed connection point, on Metal2, that the router must reach. */
    public record Terminal(String net, int x, int y) {
    }

    private final List<Device> devices = new ArrayList<>();
    private final List<Terminal> terminals = new ArrayList<>();
    private final Map<String, ExportSide> exports = new LinkedHashMap<>();

    public Schematic device(String name, Polarity polarity, int width, int length,
                            String gate, String source, String drain) {
        devices.add(new Device(name, polarity, width, length, gate, source, drain));
        return this;
    }

    public Schematic nmos(String name, int width, int length, String gate, String source, String drain) {
        return device(name, Polarity.NMOS, width, length, gate, source, drain);
    }

    public Schematic pmos(String name, int width, int length, String gate, String source, String drain) {
        return device(name, Polarity.PMOS, width, length, gate, source, drain);
    }

    public Schematic terminal(String net, int x, int y) {
        terminals.add(new Terminal(net, x, y));
        return this;
    }

    public Schematic terminals(List<Terminal> placed) {
        terminals.addAll(placed);
        return this;
    }

    public Schematic export(String net, ExportSide side) {
        exports.put(net, side);
        return this;
    }

    public Schematic export(List<String> nets, ExportSide side) {
        for (String net : nets) {
            export(net, side);
        }
        return this;
    }

    public boolean isRail(String net) {
        return PowerRails.VSS.equals(net) || PowerRails.VDD.equals(net);
    }

    public List<Device> getDevices() {
        return Collections.unmodifiableList(devices);
    }

    public List<Terminal> getTerminals() {
        return Collections.unmodifiableList(terminals);
    }

    public Map<String, ExportSide> getExports() {
        return Collections.unmodifiableMap(exports);
    }
}

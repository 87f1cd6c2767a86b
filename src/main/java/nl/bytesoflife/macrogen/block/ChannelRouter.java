package nl.bytesoflife.macrogen.block;

import nl.bytesoflife.macrogen.geometry.Cell;
import nl.bytesoflife.macrogen.geometry.Point;
import nl.bytesoflife.macrogen.primitive.GateTap;
import nl.bytesoflife.macrogen.primitive.Polarity;
import nl.bytesoflife.macrogen.primitive.SubstrateTieBuilder;
import nl.bytesoflife.macrogen.primitive.TransistorBuilder;
import nl.bytesoflife.macrogen.primitive.TransistorPins;
import nl.bytesoflife.macrogen.primitive.ViaLevel;
import nl.bytesoflife.macrogen.primitive.ViaStackBuilder;
import nl.bytesoflife.macrogen.tech.Layer;
import nl.bytesoflife.macrogen.tech.Layers;
import nl.bytesoflife.macrogen.tech.RuleSet;
import nl.bytesoflife.macrogen.tech.TechConstant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Places a schematic's transistors in two rows, NMOS at the bottom and PMOS on top, and routes
 * every net through a Metal3 channel between them.
 * <p>
 * Each device occupies three routing columns (gate, source, drain) on a fixed pitch. Device pins
 * rise on Metal1 to a Via1 row at the channel edge, then run on Metal2 to their net's Metal3 track,
 * or straight to the supply strap for rail nets. Tracks are packed left-edge first. Capacitor
 * terminals reach their track on Metal2 from above, so device columns keep clear of them.
 */
public class ChannelRouter {

    private static final Logger log = LoggerFactory.getLogger(ChannelRouter.class);

    /** Routing column and track pitch. */
    public static final int PITCH = 450;
    public static final int NMOS_ROW_Y = 3500;
    public static final int FIRST_COLUMN = 1500;

    static final int RIGHT_MARGIN = 500;
    static final int CHANNEL_CLEARANCE = 900;
    static final int TIE_CLEARANCE = 300;
    static final int CAP_CLEARANCE = 1000;
    static final int M1_WIDTH = 160;
    static final int M2_WIDTH = 200;
    static final int M3_HALF_WIDTH = 100;
    /** Source and drain contact centres sit this far inside the active area. */
    static final int HALF_CONTACT = 160;

    private enum PinKind {
        NMOS,
        PMOS,
        CAPACITOR
    }

    private record Pin(int column, PinKind kind, int y) {
    }

    private record Track(int index, int lo, int hi) {
    }

    private static final class Placed {
        final Schematic.Device device;
        final int gateColumn;
        final int sourceColumn;
        final int drainColumn;
        final int x;
        Integer tie;

        Placed(Schematic.Device device, int gateColumn) {
            this.device = device;
            this.gateColumn = gateColumn;
            this.sourceColumn = gateColumn + PITCH;
            this.drainColumn = sourceColumn + 2 * HALF_CONTACT + device.length();
            this.x = sourceColumn - HALF_CONTACT;
        }

        int right(int diffusion) {
            return x + diffusion;
        }
    }

    private final RuleSet rules;
    private final TransistorBuilder transistors;
    private final SubstrateTieBuilder ties;
    private final ViaStackBuilder vias;
    private final Layer metal1;
    private final Layer metal2;
    private final Layer metal3;

    public ChannelRouter(RuleSet rules) {
        this.rules = rules;
        this.transistors = new TransistorBuilder(rules);
        this.ties = new SubstrateTieBuilder(rules);
        this.vias = new ViaStackBuilder(rules);
        this.metal1 = rules.layer(Layers.METAL1);
        this.metal2 = rules.layer(Layers.METAL2);
        this.metal3 = rules.layer(Layers.METAL3);
    }

    public RoutedRows route(Cell cell, Schematic schematic, int width, int height) {
        return route(cell, schematic, width, height, null);
    }

    /**
     * @param capacitorFloor lowest y occupied by capacitors placed above the rows, or null if none
     * @throws MissingConnectionException if an exported net has no pins, or an internal net only one
     * @throws LayoutOverflowException    if the rows do not fit the outline or reach the capacitors
     */
    public RoutedRows route(Cell cell, Schematic schematic, int width, int height, Integer capacitorFloor) {
        List<Placed> placed = placeColumns(schematic, width);
        assignTies(placed);

        Map<String, List<Pin>> pins = collectPins(schematic, placed);
        Map<String, Track> tracks = assignTracks(schematic, pins, width);
        int trackCount = tracks.values().stream().mapToInt(Track::index).max().orElse(-1) + 1;

        int nmosWidth = maxWidth(placed, Polarity.NMOS);
        int pmosWidth = maxWidth(placed, Polarity.PMOS);
        int nmosChannel = NMOS_ROW_Y + nmosWidth + CHANNEL_CLEARANCE;
        int pmosChannel = nmosChannel + (trackCount + 1) * PITCH;
        int pmosTop = pmosChannel + pmosWidth + CHANNEL_CLEARANCE;
        int tieOffset = TIE_CLEARANCE + ties.size() / 2;
        int wellEnclosure = rules.length(TechConstant.NWELL_ENCLOSURE);
        int top = pmosTop + tieOffset + ties.size() / 2 + wellEnclosure;

        if (top > height - PowerRails.HEIGHT) {
            throw new LayoutOverflowException("Device rows reach y=" + top + ", into the VDD rail of a "
                    + height + " high macro");
        }
        if (capacitorFloor != null && capacitorFloor < pmosTop + CAP_CLEARANCE) {
            throw new LayoutOverflowException("Capacitors end at y=" + capacitorFloor
                    + ", below the device rows which need " + (pmosTop + CAP_CLEARANCE));
        }

        int vssY = PowerRails.vssCenter();
        int vddY = PowerRails.vddCenter(height);
        Integer wellLeft = null;
        Integer wellRight = null;
        for (Placed p : placed) {
            Schematic.Device d = p.device;
            int diffusion = transistors.diffusionLength(d.length());
            if (d.polarity() == Polarity.NMOS) {
                TransistorPins tp = transistors.place(cell, new Point(p.x, NMOS_ROW_Y), Polarity.NMOS,
                        d.width(), d.length(), false, GateTap.above(p.gateColumn));
                for (Point pin : List.of(tp.gate(), tp.source(), tp.drain())) {
                    Wires.vertical(cell, metal1, pin.x(), pin.y(), nmosChannel, M1_WIDTH);
                    vias.place(cell, new Point(pin.x(), nmosChannel), ViaLevel.VIA1);
                }
                if (p.tie != null) {
                    int tieY = NMOS_ROW_Y - tieOffset;
                    ties.place(cell, new Point(p.tie, tieY), SubstrateTieBuilder.Kind.SUBSTRATE);
                    vias.place(cell, new Point(p.tie, tieY), ViaLevel.VIA1);
                    if (p.tie != p.sourceColumn || !PowerRails.VSS.equals(d.source())) {
                        Wires.vertical(cell, metal2, p.tie, vssY, tieY, M2_WIDTH);
                        vias.place(cell, new Point(p.tie, vssY), ViaLevel.VIA2);
                    }
                }
            } else {
                TransistorPins tp = transistors.place(cell, new Point(p.x, pmosTop - d.width()), Polarity.PMOS,
                        d.width(), d.length(), false, GateTap.below(p.gateColumn));
                for (Point pin : List.of(tp.gate(), tp.source(), tp.drain())) {
                    Wires.vertical(cell, metal1, pin.x(), pmosChannel, pin.y(), M1_WIDTH);
                    vias.place(cell, new Point(pin.x(), pmosChannel), ViaLevel.VIA1);
                }
                int left = p.x;
                int right = p.right(diffusion);
                if (p.tie != null) {
                    int tieY = pmosTop + tieOffset;
                    ties.place(cell, new Point(p.tie, tieY), SubstrateTieBuilder.Kind.WELL);
                    vias.place(cell, new Point(p.tie, tieY), ViaLevel.VIA1);
                    if (p.tie != p.sourceColumn || !PowerRails.VDD.equals(d.source())) {
                        Wires.vertical(cell, metal2, p.tie, tieY, vddY, M2_WIDTH);
                        vias.place(cell, new Point(p.tie, vddY), ViaLevel.VIA2);
                    }
                    left = Math.min(left, p.tie - ties.size() / 2);
                    right = Math.max(right, p.tie + ties.size() / 2);
                }
                wellLeft = wellLeft == null ? left : Math.min(wellLeft, left);
                wellRight = wellRight == null ? right : Math.max(wellRight, right);
            }
        }
        if (wellLeft != null) {
            cell.add(rules.layer(Layers.NWELL), wellLeft - wellEnclosure, pmosTop - pmosWidth - wellEnclosure,
                    wellRight + wellEnclosure, top);
        }

        Map<String, Integer> trackY = new LinkedHashMap<>();
        for (Map.Entry<String, Track> e : tracks.entrySet()) {
            trackY.put(e.getKey(), trackCentre(nmosChannel, e.getValue().index()));
        }

        for (Map.Entry<String, List<Pin>> e : pins.entrySet()) {
            String net = e.getKey();
            Integer target;
            if (schematic.isRail(net)) {
                target = PowerRails.VSS.equals(net) ? vssY : vddY;
            } else {
                target = trackY.get(net);
            }
            if (target == null) {
                continue;
            }
            for (Pin pin : e.getValue()) {
                int from = switch (pin.kind()) {
                    case NMOS -> nmosChannel;
                    case PMOS -> pmosChannel;
                    case CAPACITOR -> pin.y();
                };
                Wires.vertical(cell, metal2, pin.column(), from, target, M2_WIDTH);
                vias.place(cell, new Point(pin.column(), target), ViaLevel.VIA2);
            }
        }
        for (Map.Entry<String, Track> e : tracks.entrySet()) {
            Track t = e.getValue();
            int y = trackY.get(e.getKey());
            int x1 = t.lo() == 0 ? 0 : t.lo() - M3_HALF_WIDTH;
            int x2 = t.hi() == width ? width : t.hi() + M3_HALF_WIDTH;
            cell.add(metal3, x1, y - M3_HALF_WIDTH, x2, y + M3_HALF_WIDTH);
        }

        int used = placed.isEmpty() ? FIRST_COLUMN : placed.get(placed.size() - 1).drainColumn + PITCH;
        log.debug("Routed {} devices in {}: {} tracks, channel {}..{}, rows up to {}",
                placed.size(), cell.getName(), trackCount, nmosChannel, pmosChannel, top);
        return new RoutedRows(trackCount, nmosChannel, pmosChannel, trackY, used, top);
    }

    static int trackCentre(int nmosChannel, int index) {
        return nmosChannel + (index + 1) * PITCH;
    }

    private List<Placed> placeColumns(Schematic schematic, int width) {
        List<Integer> reserved = new ArrayList<>();
        for (Schematic.Terminal t : schematic.getTerminals()) {
            reserved.add(t.x());
        }
        List<Placed> placed = new ArrayList<>();
        int cursor = FIRST_COLUMN;
        for (Schematic.Device d : schematic.getDevices()) {
            int gate = cursor;
            while (true) {
                Placed candidate = new Placed(d, gate);
                int shift = 0;
                for (int column : new int[]{candidate.gateColumn, candidate.sourceColumn, candidate.drainColumn}) {
                    for (int r : reserved) {
                        if (Math.abs(column - r) < PITCH) {
                            shift = Math.max(shift, r + PITCH - column);
                        }
                    }
                }
                if (shift == 0) {
                    placed.add(candidate);
                    cursor = candidate.drainColumn + PITCH;
                    break;
                }
                gate += shift;
            }
        }
        if (cursor > width - RIGHT_MARGIN) {
            throw new LayoutOverflowException("Device rows need width " + cursor + ", macro is " + width + " wide");
        }
        return placed;
    }

    /** One tie per polarity at the first device, then whenever a device ends too far from the last tie. */
    private void assignTies(List<Placed> placed) {
        int maxDistance = ties.maxTieDistance();
        for (Polarity polarity : Polarity.values()) {
            String rail = polarity == Polarity.NMOS ? PowerRails.VSS : PowerRails.VDD;
            Integer last = null;
            for (Placed p : placed) {
                if (p.device.polarity() != polarity) {
                    continue;
                }
                int right = p.right(transistors.diffusionLength(p.device.length()));
                if (last == null || right - last > maxDistance) {
                    p.tie = rail.equals(p.device.source()) ? p.sourceColumn : p.gateColumn;
                    last = p.tie;
                }
            }
        }
    }

    private Map<String, List<Pin>> collectPins(Schematic schematic, List<Placed> placed) {
        Map<String, List<Pin>> pins = new LinkedHashMap<>();
        for (Placed p : placed) {
            PinKind kind = p.device.polarity() == Polarity.NMOS ? PinKind.NMOS : PinKind.PMOS;
            pins.computeIfAbsent(p.device.gate(), k -> new ArrayList<>()).add(new Pin(p.gateColumn, kind, 0));
            pins.computeIfAbsent(p.device.source(), k -> new ArrayList<>()).add(new Pin(p.sourceColumn, kind, 0));
            pins.computeIfAbsent(p.device.drain(), k -> new ArrayList<>()).add(new Pin(p.drainColumn, kind, 0));
        }
        for (Schematic.Terminal t : schematic.getTerminals()) {
            pins.computeIfAbsent(t.net(), k -> new ArrayList<>()).add(new Pin(t.x(), PinKind.CAPACITOR, t.y()));
        }
        for (String net : schematic.getExports().keySet()) {
            if (!pins.containsKey(net)) {
                throw new MissingConnectionException(net, "Exported net " + net + " is not connected to any device");
            }
        }
        for (Map.Entry<String, List<Pin>> e : pins.entrySet()) {
            String net = e.getKey();
            if (e.getValue().size() < 2 && !schematic.isRail(net) && !schematic.getExports().containsKey(net)) {
                throw new MissingConnectionException(net, "Net " + net + " has a single connection and is not exported");
            }
        }
        return pins;
    }

    private Map<String, Track> assignTracks(Schematic schematic, Map<String, List<Pin>> pins, int width) {
        record Span(String net, int lo, int hi) {
        }
        List<Span> spans = new ArrayList<>();
        for (Map.Entry<String, List<Pin>> e : pins.entrySet()) {
            String net = e.getKey();
            if (schematic.isRail(net)) {
                continue;
            }
            int lo = e.getValue().stream().mapToInt(Pin::column).min().orElseThrow();
            int hi = e.getValue().stream().mapToInt(Pin::column).max().orElseThrow();
            ExportSide side = schematic.getExports().get(net);
            if (side == ExportSide.LEFT) {
                lo = 0;
            } else if (side == ExportSide.RIGHT) {
                hi = width;
            }
            spans.add(new Span(net, lo, hi));
        }
        spans.sort(Comparator.comparingInt(Span::lo).thenComparingInt(Span::hi).thenComparing(Span::net));

        List<Integer> trackEnds = new ArrayList<>();
        Map<String, Track> tracks = new LinkedHashMap<>();
        for (Span s : spans) {
            int index = -1;
            for (int i = 0; i < trackEnds.size(); i++) {
                if (s.lo() > trackEnds.get(i)) {
                    index = i;
                    break;
                }
            }
            if (index < 0) {
                trackEnds.add(s.hi());
                index = trackEnds.size() - 1;
            } else {
                trackEnds.set(index, s.hi());
            }
            tracks.put(s.net(), new Track(index, s.lo(), s.hi()));
        }
        return tracks;
    }

    private static int maxWidth(List<Placed> placed, Polarity polarity) {
        return placed.stream()
                .filter(p -> p.device.polarity() == polarity)
                .mapToInt(p -> p.device.width())
                .max()
                .orElse(0);
    }
}

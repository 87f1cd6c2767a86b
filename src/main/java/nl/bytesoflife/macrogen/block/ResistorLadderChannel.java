package nl.bytesoflife.macrogen.block;

import nl.bytesoflife.macrogen.geometry.Cell;
import nl.bytesoflife.macrogen.geometry.Point;
import nl.bytesoflife.macrogen.geometry.Rect;
import nl.bytesoflife.macrogen.primitive.GateTap;
import nl.bytesoflife.macrogen.primitive.Orientation;
import nl.bytesoflife.macrogen.primitive.Polarity;
import nl.bytesoflife.macrogen.primitive.ResistorBuilder;
import nl.bytesoflife.macrogen.primitive.ResistorEnds;
import nl.bytesoflife.macrogen.primitive.SubstrateTieBuilder;
import nl.bytesoflife.macrogen.primitive.TransistorBuilder;
import nl.bytesoflife.macrogen.primitive.TransistorPins;
import nl.bytesoflife.macrogen.primitive.ViaLevel;
import nl.bytesoflife.macrogen.primitive.ViaStackBuilder;
import nl.bytesoflife.macrogen.tech.Layer;
import nl.bytesoflife.macrogen.tech.Layers;
import nl.bytesoflife.macrogen.tech.RuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * R-2R ladder: a horizontal chain of R segments, and under each junction a vertical 2R shunt
 * dropping onto the drain of an NMOS switch whose gate is driven by one bit.
 * <p>
 * Every shunt/switch pair sits directly under its own junction, so each switch's drain lands on
 * the junction's vertical track and bits never share a node. The most significant bit is the
 * leftmost switch; the chain output is the rightmost junction.
 */
public class ResistorLadderChannel {

    private static final Logger log = LoggerFactory.getLogger(ResistorLadderChannel.class);

    static final int SERIES_GAP = 300;
    static final int SHUNT_GAP = 500;
    static final int TIE_OFFSET = 2200;
    static final int GROUND_OFFSET = 1050;
    static final int TRACK_HALF_HEIGHT = 200;
    static final int PIN_LENGTH = 400;
    static final int RAIL_VIA_OFFSET = 2500;
    static final int SWITCH_WIDTH = 2000;
    static final int SWITCH_LENGTH = 130;

    private final RuleSet rules;
    private final ResistorBuilder resistors;
    private final TransistorBuilder transistors;
    private final ViaStackBuilder vias;
    private final SubstrateTieBuilder ties;
    private final Layer metal1;
    private final Layer metal2;

    public ResistorLadderChannel(RuleSet rules) {
        this.rules = rules;
        this.resistors = new ResistorBuilder(rules);
        this.transistors = new TransistorBuilder(rules);
        this.vias = new ViaStackBuilder(rules);
        this.ties = new SubstrateTieBuilder(rules);
        this.metal1 = rules.layer(Layers.METAL1);
        this.metal2 = rules.layer(Layers.METAL2);
    }

    public LadderChannel place(Cell cell, LadderSpec spec) {
        int w = spec.resistorWidth();
        int m1 = Math.max(rules.threshold("M1.a"), 1);
        int rail = PowerRails.vssCenter();

        List<ResistorEnds> series = new ArrayList<>();
        List<Point> junctions = new ArrayList<>();
        int x = spec.x0();
        for (int i = 0; i < spec.bits(); i++) {
            ResistorEnds r = resistors.place(cell, new Point(x, spec.seriesY()), spec.sheetOhms(),
                    spec.unitOhms(), w, Orientation.HORIZONTAL);
            if (i > 0) {
                Wires.horizontal(cell, metal1, r.left().y(), junctions.get(i - 1).x(), r.left().x(), m1);
            }
            series.add(r);
            junctions.add(r.right());
            x += r.totalLength() + SERIES_GAP;
        }
        Point output = junctions.get(junctions.size() - 1);
        if (output.x() > spec.macroWidth() - PIN_LENGTH) {
            throw new LayoutOverflowException("Ladder " + spec.pinPrefix() + " ends at x=" + output.x()
                    + ", beyond macro width " + spec.macroWidth());
        }

        int shuntLength = resistors.bodyLength(spec.sheetOhms(), 2 * spec.unitOhms(), w);
        int shuntTotal = series.get(0).totalLength() - series.get(0).bodyLength() + shuntLength;
        int junctionY = spec.seriesY() + w / 2;

        List<ResistorEnds> shunts = new ArrayList<>();
        List<LadderChannel.BitPin> pins = new ArrayList<>();
        int groundY = 0;
        for (int i = 0; i < spec.bits(); i++) {
            int jx = junctions.get(i).x();

            ResistorEnds shunt = resistors.place(cell, new Point(jx - w / 2, spec.seriesY() - SHUNT_GAP - shuntTotal),
                    spec.sheetOhms(), 2 * spec.unitOhms(), w, Orientation.VERTICAL);
            shunts.add(shunt);
            Wires.vertical(cell, metal1, jx, shunt.right().y(), junctionY, m1);

            TransistorPins sw = transistors.place(cell, new Point(jx - transistors.drainOffset(SWITCH_LENGTH),
                            spec.switchY()), Polarity.NMOS,
                    SWITCH_WIDTH, SWITCH_LENGTH, false, GateTap.below());
            Wires.vertical(cell, metal1, jx, sw.drain().y(), shunt.left().y(), m1);

            // bit input: gate via, M2 jog down or up to the bit's track, track out to the left edge
            Point gate = sw.gate();
            vias.place(cell, gate, ViaLevel.VIA1);
            int bit = spec.bits() - 1 - i;
            int trackY = spec.pinBaseY() + bit * spec.pinPitch();
            cell.add(metal2, gate.x() - 100, trackY, gate.x() + 100, gate.y());
            cell.add(metal2, 0, trackY - TRACK_HALF_HEIGHT, gate.x() + 100, trackY + TRACK_HALF_HEIGHT);
            pins.add(new LadderChannel.BitPin(spec.pinPrefix() + "[" + bit + "]",
                    new Rect(0, trackY - TRACK_HALF_HEIGHT, PIN_LENGTH, trackY + TRACK_HALF_HEIGHT)));

            // ground: tie left of the switch, source strap, vertical to the rail or to an existing strap
            Point source = sw.source();
            groundY = source.y();
            ties.place(cell, new Point(jx - TIE_OFFSET, source.y()), SubstrateTieBuilder.Kind.SUBSTRATE);
            Wires.horizontal(cell, metal1, source.y(), jx - TIE_OFFSET, source.x(), m1);
            int gx = jx - GROUND_OFFSET;
            if (spec.groundStrapY() == null) {
                Wires.vertical(cell, metal1, gx, RAIL_VIA_OFFSET, source.y(), m1);
                vias.place(cell, new Point(gx, RAIL_VIA_OFFSET), ViaLevel.VIA1);
                cell.add(metal2, gx - 100, rail, gx + 100, RAIL_VIA_OFFSET);
                vias.place(cell, new Point(gx, rail), ViaLevel.VIA2);
            } else {
                Wires.vertical(cell, metal1, gx, spec.groundStrapY(), source.y(), m1);
            }
        }

        vias.place(cell, output, ViaLevel.VIA1);
        cell.add(metal2, output.x(), output.y() - TRACK_HALF_HEIGHT, spec.macroWidth(), output.y() + TRACK_HALF_HEIGHT);
        Rect outputPin = new Rect(spec.macroWidth() - PIN_LENGTH, output.y() - TRACK_HALF_HEIGHT,
                spec.macroWidth(), output.y() + TRACK_HALF_HEIGHT);

        Point reference = series.get(0).left();
        if (spec.referenceRiser()) {
            int top = spec.macroHeight() - RAIL_VIA_OFFSET;
            int vdd = PowerRails.vddCenter(spec.macroHeight());
            Wires.vertical(cell, metal1, reference.x(), reference.y(), top, m1);
            vias.place(cell, new Point(reference.x(), top), ViaLevel.VIA1);
            cell.add(metal2, reference.x() - 100, top, reference.x() + 100, vdd);
            vias.place(cell, new Point(reference.x(), vdd), ViaLevel.VIA2);
        }

        log.debug("Ladder {}: {} bits, series body {} nm, shunt body {} nm, output at {}",
                spec.pinPrefix(), spec.bits(), series.get(0).bodyLength(), shuntLength, output);
        return new LadderChannel(junctions, reference, pins, output, outputPin, groundY, series, shunts);
    }

    /** Joins the reference ends of two channels that share their first column. */
    public void joinReferences(Cell cell, LadderChannel lower, LadderChannel upper) {
        Point a = lower.reference();
        Point b = upper.reference();
        if (a.x() != b.x()) {
            throw new MissingConnectionException("vref", "Ladder references at x=" + a.x() + " and x=" + b.x()
                    + " are not in one column");
        }
        Wires.vertical(cell, metal1, a.x(), a.y(), b.y(), Math.max(rules.threshold("M1.a"), 1));
    }
}

package nl.bytesoflife.macrogen.block;

import nl.bytesoflife.macrogen.drc.DrcReport;
import nl.bytesoflife.macrogen.drc.DrcRunner;
import nl.bytesoflife.macrogen.geometry.Cell;
import nl.bytesoflife.macrogen.geometry.Point;
import nl.bytesoflife.macrogen.macro.R2rDacDriver;
import nl.bytesoflife.macrogen.primitive.InvalidParameterException;
import nl.bytesoflife.macrogen.primitive.ResistorEnds;
import nl.bytesoflife.macrogen.primitive.ResistorMaterial;
import nl.bytesoflife.macrogen.tech.BuiltinTechnologies;
import nl.bytesoflife.macrogen.tech.RuleSet;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ResistorLadderChannelTest {

    private final RuleSet rules = BuiltinTechnologies.sg13g2();
    private final ResistorLadderChannel ladder = new ResistorLadderChannel(rules);
    private final R2rDacDriver r2r = new R2rDacDriver();

    @Test
    void eightBitLadderHasRAndTwoRSegments() {
        Cell cell = new Cell("ladder");
        LadderChannel channel = ladder.place(cell, r2r.ladderSpec(rules));

        assertEquals(8, channel.series().size());
        assertEquals(8, channel.shunts().size());
        for (ResistorEnds r : channel.series()) {
            assertEquals(3077, r.bodyLength());
        }
        for (ResistorEnds r : channel.shunts()) {
            assertEquals(6154, r.bodyLength());
        }
        assertEquals(channel.junctions().get(7), channel.output());
        assertEquals(channel.series().get(0).left(), channel.reference());
    }

    @Test
    void ladderWithRailsIsRuleClean() {
        Cell cell = new Cell("ladder");
        ladder.place(cell, r2r.ladderSpec(rules));
        PowerRails.draw(cell, rules, r2r.getWidth(), r2r.getHeight());

        DrcReport report = DrcRunner.standard().run(rules, cell);
        assertTrue(report.isClean(), report::toString);
    }

    @Test
    void everyBitHasItsOwnPin() {
        LadderChannel channel = ladder.place(new Cell("ladder"), r2r.ladderSpec(rules));

        List<LadderChannel.BitPin> pins = channel.bitPins();
        assertEquals(8, pins.size());
        // most significant bit is placed first
        assertEquals("d[7]", pins.get(0).name());
        assertEquals("d[0]", pins.get(7).name());

        Set<Point> centres = new HashSet<>();
        for (LadderChannel.BitPin pin : pins) {
            assertEquals(0, pin.pin().x1());
            assertTrue(centres.add(pin.pin().center()), pin.name());
        }
        assertTrue(centres.add(channel.outputPin().center()));
        assertEquals(r2r.getWidth(), channel.outputPin().x2());
    }

    @Test
    void ladderWiderThanMacroOverflows() {
        LadderSpec narrow = new LadderSpec(8, 4982, 40000, 29626, 4000, 3000, 20000, 60000,
                ResistorMaterial.RHIGH.sheetResistance(rules), 2000, 2000, false, null, "d");
        assertThrows(LayoutOverflowException.class, () -> ladder.place(new Cell("ladder"), narrow));
    }

    @Test
    void zeroBitsIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new LadderSpec(0, 4982, 40000, 29626, 4000, 3000,
                45000, 60000, 1300, 2000, 2000, true, null, "d"));
    }

    @Test
    void nonPositiveUnitResistanceIsRejected() {
        LadderSpec spec = new LadderSpec(4, 3000, 18374, 8000, 4000, 1000, 35000, 42000,
                1300, 0, 2000, false, null, "d");
        assertThrows(InvalidParameterException.class,
                () -> ladder.place(new Cell("ladder"), spec));
    }

    @Test
    void referencesInDifferentColumnsCannotBeJoined() {
        Cell cell = new Cell("ladders");
        LadderChannel lower = ladder.place(cell, new LadderSpec(2, 3000, 18374, 8000, 4000, 1000, 35000, 42000,
                1300, 2000, 2000, false, null, "a"));
        LadderChannel upper = ladder.place(cell, new LadderSpec(2, 3500, 36374, 26000, 22000, 1000, 35000, 42000,
                1300, 2000, 2000, false, lower.groundY(), "b"));

        MissingConnectionException e = assertThrows(MissingConnectionException.class,
                () -> ladder.joinReferences(cell, lower, upper));
        assertEquals("vref", e.getNet());
    }
}

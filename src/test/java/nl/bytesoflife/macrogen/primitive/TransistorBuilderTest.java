package nl.bytesoflife.macrogen.primitive;

import nl.bytesoflife.macrogen.drc.DrcReport;
import nl.bytesoflife.macrogen.drc.DrcRunner;
import nl.bytesoflife.macrogen.geometry.Cell;
import nl.bytesoflife.macrogen.geometry.Point;
import nl.bytesoflife.macrogen.tech.BuiltinTechnologies;
import nl.bytesoflife.macrogen.tech.Layers;
import nl.bytesoflife.macrogen.tech.RuleSet;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TransistorBuilderTest {

    private final RuleSet rules = BuiltinTechnologies.sg13g2();
    private final TransistorBuilder builder = new TransistorBuilder(rules);

    @Test
    void pinsAndDiffusionLength() {
        Cell cell = new Cell("m");
        TransistorPins pins = builder.place(cell, new Point(0, 0), Polarity.NMOS, 2000, 130, false, GateTap.NONE);

        assertEquals(770, pins.diffusionLength());
        assertEquals(770, builder.diffusionLength(130));
        assertEquals(new Point(160, 1000), pins.source());
        assertEquals(new Point(610, 1000), pins.drain());
        assertEquals(new Point(385, -180), pins.gate());
        assertEquals(610, builder.drainOffset(130));
        assertEquals(160, builder.sourceOffset());
    }

    @Test
    void gateTapOnAColumn() {
        TransistorPins pins = builder.place(new Cell("m"), new Point(0, 0), Polarity.NMOS, 1000, 500, false,
                GateTap.above(-300));
        assertEquals(new Point(-300, 1000 + 180 + 160), pins.gate());
    }

    @Test
    void shortGateFails() {
        InvalidParameterException e = assertThrows(InvalidParameterException.class,
                () -> builder.place(new Cell("m"), new Point(0, 0), Polarity.NMOS, 2000, 100, false, GateTap.NONE));
        assertEquals("Gat.a", e.getRule());
    }

    @Test
    void narrowChannelFails() {
        InvalidParameterException e = assertThrows(InvalidParameterException.class,
                () -> builder.place(new Cell("m"), new Point(0, 0), Polarity.PMOS, 100, 130, true, GateTap.NONE));
        assertEquals("Act.a", e.getRule());

        e = assertThrows(InvalidParameterException.class,
                () -> builder.place(new Cell("m"), new Point(0, 0), Polarity.PMOS, 200, 130, true, GateTap.NONE));
        assertEquals("Cnt.c", e.getRule());
    }

    @Test
    void pmosWellIsOptional() {
        Cell shared = new Cell("shared");
        builder.place(shared, new Point(0, 0), Polarity.PMOS, 2000, 130, false, GateTap.below());
        assertTrue(shared.getRects(rules.layer(Layers.NWELL)).isEmpty());
        assertEquals(1, shared.getRects(rules.layer(Layers.PSD)).size());

        Cell own = new Cell("own");
        builder.place(own, new Point(0, 0), Polarity.PMOS, 2000, 130, true, GateTap.below());
        assertEquals(1, own.getRects(rules.layer(Layers.NWELL)).size());
    }

    @Test
    void tappedTransistorIsRuleClean() {
        Cell cell = new Cell("m");
        builder.place(cell, new Point(0, 0), Polarity.NMOS, 2000, 130, false, GateTap.above());
        DrcReport report = DrcRunner.standard().run(rules, cell);
        assertTrue(report.isClean(), report::toString);
    }
}

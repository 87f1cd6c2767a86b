package nl.bytesoflife.macrogen.primitive;

import nl.bytesoflife.macrogen.drc.DrcReport;
import nl.bytesoflife.macrogen.drc.DrcRunner;
import nl.bytesoflife.macrogen.geometry.Cell;
import nl.bytesoflife.macrogen.geometry.Point;
import nl.bytesoflife.macrogen.geometry.Rect;
import nl.bytesoflife.macrogen.tech.BuiltinTechnologies;
import nl.bytesoflife.macrogen.tech.Layers;
import nl.bytesoflife.macrogen.tech.RuleSet;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MimCapacitorBuilderTest {

    private final RuleSet rules = BuiltinTechnologies.sg13g2();
    private final MimCapacitorBuilder builder = new MimCapacitorBuilder(rules);

    @Test
    void largeCapacitorIsSquare() {
        CapacitorSize size = builder.size(1000);
        assertEquals(new CapacitorSize(25820, 25820), size);
        assertEquals(1000, builder.capacitance(size), 1.0);
    }

    @Test
    void smallCapacitorIsClampedToMinimumPlate() {
        assertEquals(new CapacitorSize(1140, 1140), builder.size(0.5));
        assertArrayEquals(new int[]{250, 250}, builder.topPlateEnclosure(new CapacitorSize(1140, 1140)));
        assertArrayEquals(new int[]{100, 100}, builder.topPlateEnclosure(new CapacitorSize(25820, 25820)));
    }

    @Test
    void invalidCapacitanceFails() {
        InvalidParameterException e = assertThrows(InvalidParameterException.class, () -> builder.size(0));
        assertEquals("capacitance", e.getRule());
        assertThrows(InvalidParameterException.class, () -> builder.size(Double.NaN));
    }

    @Test
    void undersizedPlateFails() {
        InvalidParameterException e = assertThrows(InvalidParameterException.class,
                () -> builder.place(new Cell("c"), new Point(0, 0), new CapacitorSize(1000, 2000)));
        assertEquals("MIM.a", e.getRule());
    }

    @Test
    void platesAndConnectionPoints() {
        Cell cell = new Cell("c");
        CapacitorPins pins = builder.place(cell, new Point(0, 0), new CapacitorSize(2000, 3000));

        assertEquals(new Rect(0, 0, 2000, 3000), pins.plate());
        assertEquals(new Rect(-600, -600, 2600, 3600), pins.bottomPlate());
        assertEquals(new Point(1000, -600), pins.bottom());
        assertEquals(new Point(1000, 3100), pins.top());
        assertEquals(1, cell.getRects(rules.layer(Layers.TOPMETAL1)).size());
    }

    @Test
    void minimumCapacitorIsRuleClean() {
        Cell cell = new Cell("c");
        builder.place(cell, new Point(0, 0), 1.0);
        DrcReport report = DrcRunner.standard().run(rules, cell);
        assertTrue(report.isClean(), report::toString);
    }
}

package nl.bytesoflife.macrogen.primitive;

import nl.bytesoflife.macrogen.geometry.Cell;
import nl.bytesoflife.macrogen.geometry.Point;
import nl.bytesoflife.macrogen.geometry.Rect;
import nl.bytesoflife.macrogen.tech.BuiltinTechnologies;
import nl.bytesoflife.macrogen.tech.Layers;
import nl.bytesoflife.macrogen.tech.RuleSet;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ViaStackBuilderTest {

    private final RuleSet rules = BuiltinTechnologies.sg13g2();
    private final ViaStackBuilder builder = new ViaStackBuilder(rules);

    @Test
    void via1PadsUseTheirOwnEnclosures() {
        Cell cell = new Cell("v");
        Rect cut = builder.place(cell, new Point(1000, 1000), ViaLevel.VIA1);

        assertEquals(190, cut.width());
        assertEquals(210, cell.getRects(rules.layer(Layers.METAL1)).get(0).width());
        assertEquals(200, cell.getRects(rules.layer(Layers.METAL2)).get(0).width());
    }

    @Test
    void stackToTopMetal() {
        Cell cell = new Cell("v");
        builder.stack(cell, new Point(0, 0), ViaLevel.VIA2, ViaLevel.TOPVIA1);

        assertEquals(1, cell.getRects(rules.layer(Layers.VIA2)).size());
        assertEquals(1, cell.getRects(rules.layer(Layers.VIA4)).size());
        assertEquals(420, cell.getRects(rules.layer(Layers.TOPVIA1)).get(0).width());
        assertEquals(1640, cell.getRects(rules.layer(Layers.TOPMETAL1)).get(0).width());
        assertTrue(cell.getRects(rules.layer(Layers.VIA1)).isEmpty());
    }

    @Test
    void downwardStackIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> builder.stack(new Cell("v"), new Point(0, 0), ViaLevel.VIA3, ViaLevel.VIA1));
    }

    @Test
    void substrateTie() {
        SubstrateTieBuilder ties = new SubstrateTieBuilder(rules);
        Cell cell = new Cell("t");
        Rect active = ties.place(cell, new Point(0, 0), SubstrateTieBuilder.Kind.WELL);

        assertEquals(320, active.width());
        assertEquals(20000, ties.maxTieDistance());
        assertEquals(1, cell.getRects(rules.layer(Layers.NSD)).size());
        assertTrue(cell.getRects(rules.layer(Layers.PSD)).isEmpty());
    }
}

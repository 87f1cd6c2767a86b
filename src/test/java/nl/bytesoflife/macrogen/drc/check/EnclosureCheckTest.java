package nl.bytesoflife.macrogen.drc.check;

import nl.bytesoflife.macrogen.drc.DrcLayoutInput;
import nl.bytesoflife.macrogen.drc.DrcViolation;
import nl.bytesoflife.macrogen.geometry.Cell;
import nl.bytesoflife.macrogen.geometry.Point;
import nl.bytesoflife.macrogen.geometry.Rect;
import nl.bytesoflife.macrogen.tech.BuiltinTechnologies;
import nl.bytesoflife.macrogen.tech.DesignRule;
import nl.bytesoflife.macrogen.tech.Layers;
import nl.bytesoflife.macrogen.tech.RuleSet;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EnclosureCheckTest {

    private final RuleSet rules = BuiltinTechnologies.sg13g2();
    private final EnclosureCheck check = new EnclosureCheck();
    private final DesignRule rule = rules.rule("V1.c");

    private DrcLayoutInput layout(Cell cell) {
        return new DrcLayoutInput(cell, rules.getGridNm());
    }

    @Test
    void detectFlushVia() {
        Cell cell = new Cell("e");
        cell.add(rules.layer(Layers.VIA1), Rect.square(new Point(0, 0), 190));
        cell.add(rules.layer(Layers.METAL1), Rect.square(new Point(0, 0), 190));

        DrcLayoutInput input = layout(cell);
        assertTrue(check.appliesTo(rule, input));
        List<DrcViolation> violations = check.check(rule, rules.threshold("V1.c"), input);
        assertEquals(1, violations.size());
        assertNull(violations.get(0).getMeasuredUm());
        assertEquals(0.01, violations.get(0).getRequiredUm(), 0.0001);
        assertEquals("Via1", violations.get(0).getLayer());
        assertEquals(210, violations.get(0).getMarkerBounds().getWidth(), 0.001);
    }

    @Test
    void passEnclosedVia() {
        Cell cell = new Cell("e");
        cell.add(rules.layer(Layers.VIA1), Rect.square(new Point(0, 0), 190));
        cell.add(rules.layer(Layers.METAL1), Rect.square(new Point(0, 0), 210));

        DrcLayoutInput input = layout(cell);
        assertTrue(check.check(rule, rules.threshold("V1.c"), input).isEmpty());
    }

    @Test
    void viaOffsetToOneSide() {
        Cell cell = new Cell("e");
        cell.add(rules.layer(Layers.VIA1), 0, 0, 190, 190);
        cell.add(rules.layer(Layers.METAL1), -10, -10, 195, 200);

        List<DrcViolation> violations = check.check(rule, rules.threshold("V1.c"), layout(cell));
        assertEquals(1, violations.size());
        assertTrue(violations.get(0).getX() > 0.19);
    }

    @Test
    void disjointLayersDoNotApply() {
        Cell cell = new Cell("e");
        cell.add(rules.layer(Layers.VIA1), 0, 0, 190, 190);
        cell.add(rules.layer(Layers.METAL1), 1000, 0, 1210, 210);
        assertFalse(check.appliesTo(rule, layout(cell)));
    }

    @Test
    void onlyOverlappingPartIsChecked() {
        Cell cell = new Cell("e");
        // contact on poly, diffusion elsewhere
        cell.add(rules.layer(Layers.CONT), 0, 0, 160, 160);
        cell.add(rules.layer(Layers.GATPOLY), -80, -80, 240, 240);
        cell.add(rules.layer(Layers.ACTIV), 1000, 0, 1320, 320);
        cell.add(rules.layer(Layers.CONT), 1080, 80, 1240, 240);

        DesignRule activ = rules.rule("Cnt.c");
        DrcLayoutInput input = layout(cell);
        assertTrue(check.appliesTo(activ, input));
        assertTrue(check.check(activ, rules.threshold("Cnt.c"), input).isEmpty());
    }
}

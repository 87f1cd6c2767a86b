package nl.bytesoflife.macrogen.drc.check;

import nl.bytesoflife.macrogen.drc.DrcLayoutInput;
import nl.bytesoflife.macrogen.drc.DrcViolation;
import nl.bytesoflife.macrogen.geometry.Cell;
import nl.bytesoflife.macrogen.tech.BuiltinTechnologies;
import nl.bytesoflife.macrogen.tech.DesignRule;
import nl.bytesoflife.macrogen.tech.Layers;
import nl.bytesoflife.macrogen.tech.RuleSet;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WidthCheckTest {

    private final RuleSet rules = BuiltinTechnologies.sg13g2();
    private final WidthCheck check = new WidthCheck();
    private final DesignRule rule = rules.rule("M1.a");

    private List<DrcViolation> run(Cell cell) {
        DrcLayoutInput layout = new DrcLayoutInput(cell, rules.getGridNm());
        assertTrue(check.appliesTo(rule, layout));
        return check.check(rule, rules.threshold("M1.a"), layout);
    }

    @Test
    void detectNarrowWire() {
        Cell cell = new Cell("w");
        cell.add(rules.layer(Layers.METAL1), 0, 0, 2000, 100);

        List<DrcViolation> violations = run(cell);
        assertEquals(1, violations.size());
        assertEquals(0.1, violations.get(0).getMeasuredUm(), 0.001);
        assertEquals(0.16, violations.get(0).getRequiredUm(), 0.001);
        assertEquals("Metal1", violations.get(0).getLayer());
    }

    @Test
    void passWireAtMinimumWidth() {
        Cell cell = new Cell("w");
        cell.add(rules.layer(Layers.METAL1), 0, 0, 2000, 160);
        assertTrue(run(cell).isEmpty());
    }

    @Test
    void passBentWire() {
        Cell cell = new Cell("w");
        cell.add(rules.layer(Layers.METAL1), 0, 0, 1000, 160);
        cell.add(rules.layer(Layers.METAL1), 0, 0, 160, 1000);
        assertTrue(run(cell).isEmpty());
    }

    @Test
    void narrowNeckInsideWideShape() {
        Cell cell = new Cell("w");
        cell.add(rules.layer(Layers.METAL1), 0, 0, 1000, 1000);
        cell.add(rules.layer(Layers.METAL1), 1000, 450, 2000, 550);
        cell.add(rules.layer(Layers.METAL1), 2000, 0, 3000, 1000);

        List<DrcViolation> violations = run(cell);
        assertEquals(1, violations.size());
        assertEquals(0.1, violations.get(0).getMeasuredUm(), 0.001);
        assertEquals(1.5, violations.get(0).getX(), 0.01);
    }

    @Test
    void detectDiagonalNeck() {
        Cell cell = new Cell("w");
        cell.add(rules.layer(Layers.METAL1), 0, 0, 400, 400);
        // 50 x 50 overlap: the reentrant corners are 70.7 apart
        cell.add(rules.layer(Layers.METAL1), 350, 350, 750, 750);

        List<DrcViolation> violations = run(cell);
        assertEquals(1, violations.size());
        assertEquals(0.0707, violations.get(0).getMeasuredUm(), 0.001);
        assertEquals(0.375, violations.get(0).getX(), 0.001);
        assertEquals(0.375, violations.get(0).getY(), 0.001);
    }

    @Test
    void passDiagonalOverlapAtMinimum() {
        Cell cell = new Cell("w");
        cell.add(rules.layer(Layers.METAL1), 0, 0, 400, 400);
        // 120 x 120 overlap: 169.7 across
        cell.add(rules.layer(Layers.METAL1), 280, 280, 680, 680);
        assertTrue(run(cell).isEmpty());
    }

    @Test
    void passWireJoiningPadCorner() {
        Cell cell = new Cell("w");
        cell.add(rules.layer(Layers.METAL1), 0, 0, 240, 240);
        cell.add(rules.layer(Layers.METAL1), 40, -1540, 200, 120);
        cell.add(rules.layer(Layers.METAL1), 120, 40, 740, 200);
        assertTrue(run(cell).isEmpty());
    }

    @Test
    void cornerContactHasZeroWidth() {
        Cell cell = new Cell("w");
        cell.add(rules.layer(Layers.METAL1), 0, 0, 400, 400);
        cell.add(rules.layer(Layers.METAL1), 400, 400, 800, 800);

        List<DrcViolation> violations = run(cell);
        assertEquals(1, violations.size());
        assertEquals(0.0, violations.get(0).getMeasuredUm(), 0.0);
        assertEquals(0.4, violations.get(0).getX(), 0.001);
        assertEquals(0.4, violations.get(0).getY(), 0.001);
    }

    @Test
    void holeTouchingOutlineHasZeroWidth() {
        Cell cell = new Cell("w");
        // frame around a 400 x 400 hole whose lower-left corner meets a notch corner of the outline
        cell.add(rules.layer(Layers.METAL1), 0, 400, 400, 1200);
        cell.add(rules.layer(Layers.METAL1), 400, 0, 1200, 400);
        cell.add(rules.layer(Layers.METAL1), 800, 400, 1200, 1200);
        cell.add(rules.layer(Layers.METAL1), 400, 800, 800, 1200);

        List<DrcViolation> violations = run(cell);
        assertEquals(1, violations.size());
        assertEquals(0.0, violations.get(0).getMeasuredUm(), 0.0);
        assertEquals(0.4, violations.get(0).getX(), 0.001);
        assertEquals(0.4, violations.get(0).getY(), 0.001);
    }

    @Test
    void emptyLayerDoesNotApply() {
        Cell cell = new Cell("w");
        cell.add(rules.layer(Layers.METAL2), 0, 0, 100, 100);
        assertFalse(check.appliesTo(rule, new DrcLayoutInput(cell, rules.getGridNm())));
    }
}

package nl.bytesoflife.macrogen.drc;

import nl.bytesoflife.macrogen.gds.GdsReader;
import nl.bytesoflife.macrogen.gds.GdsWriter;
import nl.bytesoflife.macrogen.geometry.Cell;
import nl.bytesoflife.macrogen.geometry.Point;
import nl.bytesoflife.macrogen.macro.R2rDacDriver;
import nl.bytesoflife.macrogen.primitive.Orientation;
import nl.bytesoflife.macrogen.primitive.ResistorBuilder;
import nl.bytesoflife.macrogen.primitive.ResistorEnds;
import nl.bytesoflife.macrogen.primitive.ResistorMaterial;
import nl.bytesoflife.macrogen.tech.BuiltinTechnologies;
import nl.bytesoflife.macrogen.tech.Layers;
import nl.bytesoflife.macrogen.tech.RuleSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DrcRunnerTest {

    private final RuleSet rules = BuiltinTechnologies.sg13g2();
    private final DrcRunner runner = DrcRunner.standard();

    @Test
    void rulesWithoutGeometryAreSkipped() {
        Cell cell = new Cell("m1_only");
        cell.add(rules.layer(Layers.METAL1), 0, 0, 1000, 160);

        DrcReport report = runner.run(rules, cell);

        assertTrue(report.isClean());
        assertEquals(RuleStatus.SKIPPED, report.getResult("Cnt.c").orElseThrow().status());
        assertEquals(RuleStatus.PASS, report.getResult("M1.a").orElseThrow().status());
        assertEquals(RuleStatus.PASS, report.getResult("M1.b").orElseThrow().status());
        assertEquals(rules.getRules().size() - 2, report.getSkippedRules().size());
        assertEquals(rules.getRules().size(), report.getResults().size());
    }

    @Test
    void abuttingResistorsViolateOnlyPolySpacing() {
        Cell cell = new Cell("two_resistors");
        ResistorBuilder resistors = new ResistorBuilder(rules);
        ResistorEnds first = resistors.place(cell, new Point(0, 0), ResistorMaterial.RHIGH, 2000, 2000,
                Orientation.HORIZONTAL);
        resistors.place(cell, new Point(first.totalLength() + 100, 0), ResistorMaterial.RHIGH, 2000, 2000,
                Orientation.HORIZONTAL);

        DrcReport report = runner.run(rules, cell);

        List<RuleResult> failures = report.getFailures();
        assertEquals(1, failures.size(), report::toString);
        RuleResult gatB = failures.get(0);
        assertEquals("Gat.b", gatB.rule().getName());
        assertEquals(1, gatB.count());
        assertEquals(0.1, gatB.violations().get(0).getMeasuredUm(), 0.001);
        assertEquals(0.18, gatB.violations().get(0).getRequiredUm(), 0.001);
        assertEquals(RuleStatus.PASS, report.getResult("M1.b").orElseThrow().status());
        assertEquals(RuleStatus.PASS, report.getResult("Cnt.b").orElseThrow().status());
    }

    @Test
    void sameCellGivesSameReport() {
        Cell cell = new R2rDacDriver().build(rules);
        int rects = cell.rectCount();

        DrcReport first = runner.run(rules, cell);
        DrcReport second = runner.run(rules, cell);

        assertEquals(first.toString(), second.toString());
        assertEquals(rects, cell.rectCount());
    }

    @Test
    void persistedLayoutGivesSameMarkers(@TempDir Path dir) throws IOException {
        Cell cell = new Cell("faulty");
        cell.add(rules.layer(Layers.METAL1), 0, 0, 2000, 100);
        cell.add(rules.layer(Layers.METAL1), 0, 200, 2000, 360);
        cell.add(rules.layer(Layers.METAL1), 3000, 0, 3400, 400);
        cell.add(rules.layer(Layers.METAL1), 3350, 350, 3750, 750);
        cell.add(rules.layer(Layers.METAL2), 0, 1000, 400, 1400);
        cell.add(rules.layer(Layers.METAL2), 400, 1400, 800, 1800);
        Path file = dir.resolve("faulty.gds");
        new GdsWriter(rules.getGridNm()).write(cell, file);

        GdsReader reader = new GdsReader(rules);
        DrcReport first = runner.run(rules, reader.read(file, null));
        DrcReport second = runner.run(rules, reader.read(file, null));

        assertFalse(first.isClean());
        assertEquals(first.getResults().size(), second.getResults().size());
        for (int i = 0; i < first.getResults().size(); i++) {
            RuleResult a = first.getResults().get(i);
            RuleResult b = second.getResults().get(i);
            assertEquals(a.rule().getName(), b.rule().getName());
            assertEquals(a.status(), b.status());
            assertEquals(a.count(), b.count(), a.rule().getName());
            for (int k = 0; k < a.count(); k++) {
                DrcViolation va = a.violations().get(k);
                DrcViolation vb = b.violations().get(k);
                assertTrue(va.getMarker().equalsExact(vb.getMarker()), a.rule().getName() + " marker " + k);
                assertEquals(va.getMeasuredUm(), vb.getMeasuredUm());
            }
        }
        assertEquals(first.toString(), second.toString());
    }

    @Test
    void emptyCellIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> runner.run(rules, new Cell("empty")));
    }

    @Test
    void reportListsFailuresByRule() {
        Cell cell = new Cell("bad");
        cell.add(rules.layer(Layers.METAL1), 0, 0, 1000, 100);
        cell.add(rules.layer(Layers.METAL1), 0, 200, 1000, 360);

        DrcReport report = runner.run(rules, cell);
        String text = report.toString();

        assertFalse(report.isClean());
        assertEquals(2, report.getTotalViolations());
        assertEquals(2, report.getViolations().size());
        assertTrue(text.contains("M1.a"));
        assertTrue(text.contains("DRC ERRORS"));
    }
}

package nl.bytesoflife.macrogen.gds;

import nl.bytesoflife.macrogen.geometry.Cell;
import nl.bytesoflife.macrogen.geometry.Label;
import nl.bytesoflife.macrogen.geometry.Rect;
import nl.bytesoflife.macrogen.macro.R2rDacDriver;
import nl.bytesoflife.macrogen.tech.BuiltinTechnologies;
import nl.bytesoflife.macrogen.tech.Layer;
import nl.bytesoflife.macrogen.tech.RuleSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GdsRoundTripTest {

    private final RuleSet rules = BuiltinTechnologies.sg13g2();

    @Test
    void macroSurvivesWriteAndRead(@TempDir Path dir) throws IOException {
        Cell original = new R2rDacDriver().build(rules);
        Path file = dir.resolve("out/r2r.gds");

        new GdsWriter(rules.getGridNm()).write(original, file);
        Cell read = new GdsReader(rules).read(file, null);

        assertEquals(original.getName(), read.getName());
        assertEquals(new HashSet<>(original.getLayers()), new HashSet<>(read.getLayers()));
        for (Layer layer : original.getLayers()) {
            assertEquals(original.getRects(layer), read.getRects(layer), layer.name());
        }
        assertEquals(labelSet(original.getLabels()), labelSet(read.getLabels()));
    }

    @Test
    void namedCellIsSelected() throws IOException {
        byte[] bytes = write(smallCell());
        Cell read = new GdsReader(rules).read(new ByteArrayInputStream(bytes), "small");
        assertEquals(2, read.rectCount());
    }

    @Test
    void unknownCellNameIsRejected() throws IOException {
        byte[] bytes = write(smallCell());
        assertThrows(GdsFormatException.class,
                () -> new GdsReader(rules).read(new ByteArrayInputStream(bytes), "other"));
    }

    @Test
    void truncatedStreamIsRejected() throws IOException {
        byte[] bytes = write(smallCell());
        byte[] truncated = Arrays.copyOf(bytes, bytes.length / 2);
        assertThrows(IOException.class,
                () -> new GdsReader(rules).read(new ByteArrayInputStream(truncated), null));
    }

    @Test
    void mismatchedDatabaseUnitIsRejected() throws IOException {
        byte[] bytes = write(smallCell());
        RuleSet coarse = RuleSet.builder("coarse").grid(5).layer("Metal1", 8, 0).build();
        assertThrows(GdsFormatException.class,
                () -> new GdsReader(coarse).read(new ByteArrayInputStream(bytes), null));
    }

    @Test
    void fixedTimestampGivesIdenticalBytes(@TempDir Path dir) throws IOException {
        LocalDateTime when = LocalDateTime.of(2024, 1, 2, 3, 4, 5);
        Path a = dir.resolve("a.gds");
        Path b = dir.resolve("b.gds");
        new GdsWriter(1, when).write(smallCell(), a);
        new GdsWriter(1, when).write(smallCell(), b);
        assertArrayEquals(Files.readAllBytes(a), Files.readAllBytes(b));
    }

    @Test
    void real8Encoding() {
        for (double v : new double[]{1e-3, 1e-9, 0.5, 1.0, 0.0}) {
            assertEquals(v, GdsRecord.fromReal8(GdsRecord.toReal8(v)), Math.abs(v) * 1e-12);
        }
    }

    private Cell smallCell() {
        Cell cell = new Cell("small");
        Layer metal1 = rules.layer("Metal1");
        cell.add(metal1, new Rect(0, 0, 1000, 160));
        cell.addPin(metal1, new Rect(0, 0, 160, 160), "a");
        return cell;
    }

    private byte[] write(Cell cell) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new GdsWriter(rules.getGridNm(), LocalDateTime.of(2024, 1, 1, 0, 0)).write(cell, out);
        return out.toByteArray();
    }

    private static Set<String> labelSet(List<Label> labels) {
        Set<String> set = new HashSet<>();
        for (Label l : labels) {
            set.add(l.layer() + ":" + l.text() + "@" + l.position());
        }
        return set;
    }
}

package nl.bytesoflife.macrogen.geometry;

import nl.bytesoflife.macrogen.tech.Layer;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CellTest {

    private static final Layer METAL1 = new Layer("Metal1", 8, 0);

    @Test
    void cornersInAnyOrder() {
        Cell cell = new Cell("t");
        Rect r = cell.add(METAL1, 100, 50, 0, 0);
        assertEquals(new Rect(0, 0, 100, 50), r);
        assertEquals(1, cell.rectCount());
    }

    @Test
    void degenerateRectanglesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Rect(0, 0, 0, 10));
        assertThrows(IllegalArgumentException.class, () -> new Rect(0, 10, 10, 10));
    }

    @Test
    void pinAddsShapeAndLabel() {
        Cell cell = new Cell("t");
        cell.addPin(METAL1, new Rect(0, 0, 400, 200), "vout");

        assertTrue(cell.getRects(METAL1).isEmpty());
        assertEquals(1, cell.getRects(METAL1.pin()).size());
        Label label = cell.getLabels().get(0);
        assertEquals("vout", label.text());
        assertEquals(new Point(200, 100), label.position());
        assertEquals(Layer.LABEL_DATATYPE, label.layer().datatype());
    }

    @Test
    void boundingBoxCoversAllLayers() {
        Cell cell = new Cell("t");
        assertEquals(Optional.empty(), cell.boundingBox());
        cell.add(METAL1, 0, 0, 10, 10);
        cell.add(new Layer("Metal2", 10, 0), -5, 20, 5, 30);
        assertEquals(new Rect(-5, 0, 10, 30), cell.boundingBox().orElseThrow());
    }

    @Test
    void centeredRectangleUsesFloorOfHalfSize() {
        Rect r = Rect.centered(0, 0, 5, 4);
        assertEquals(new Rect(-2, -2, 3, 2), r);
        assertEquals(new Point(0, 0), r.center());
    }

    @Test
    void blankNameIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Cell(" "));
    }
}

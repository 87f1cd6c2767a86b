package nl.bytesoflife.macrogen.block;

import nl.bytesoflife.macrogen.geometry.Cell;
import nl.bytesoflife.macrogen.tech.BuiltinTechnologies;
import nl.bytesoflife.macrogen.tech.Layers;
import nl.bytesoflife.macrogen.tech.RuleSet;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CapacitorStackTest {

    private final RuleSet rules = BuiltinTechnologies.sg13g2();
    private final CapacitorStack stack = new CapacitorStack(rules);

    private final List<CapacitorSpec> pair = List.of(
            new CapacitorSpec("big", 100, "out", PowerRails.VSS),
            new CapacitorSpec("small", 1, "out", "in"));

    @Test
    void capacitorsStackDownOneColumn() {
        Cell cell = new Cell("caps");
        CapacitorStack.Result result = stack.place(cell, pair, 1500, 30000, 0, 20000);

        assertEquals(2, result.capacitors().size());
        assertEquals(20935, result.get("big").plate().y1());
        assertEquals(16355, result.get("small").plate().y1());
        assertEquals(13815, result.lowestY());
        assertEquals(10865, result.rightEdge());
        assertEquals(2, cell.getRects(rules.layer(Layers.CMIM)).size());
    }

    @Test
    void everyCapacitorExportsTwoTerminals() {
        CapacitorStack.Result result = stack.place(new Cell("caps"), pair, 1500, 30000, 0, 20000);

        List<Schematic.Terminal> terminals = result.terminals();
        assertEquals(4, terminals.size());
        assertEquals(List.of(PowerRails.VSS, "out", "in", "out"),
                terminals.stream().map(Schematic.Terminal::net).toList());
        for (int i = 0; i < terminals.size(); i++) {
            for (int j = i + 1; j < terminals.size(); j++) {
                assertTrue(Math.abs(terminals.get(i).x() - terminals.get(j).x()) >= ChannelRouter.PITCH,
                        terminals.get(i) + " vs " + terminals.get(j));
            }
        }
    }

    @Test
    void fullColumnStartsANewOne() {
        CapacitorStack.Result result = stack.place(new Cell("caps"), pair, 1500, 30000, 17000, 40000);

        assertEquals(1500 + 600, result.get("big").plate().x1());
        assertEquals(30000 - 900, result.get("big").plate().y2());
        assertEquals(30000 - 900, result.get("small").plate().y2());
        assertEquals(13805, result.rightEdge());
        assertTrue(result.get("small").plate().x1() > result.get("big").plate().x2());
    }

    @Test
    void columnsPastMacroWidthOverflow() {
        assertThrows(LayoutOverflowException.class,
                () -> stack.place(new Cell("caps"), pair, 1500, 30000, 0, 10000));
    }

    @Test
    void capacitorTallerThanColumnOverflows() {
        assertThrows(LayoutOverflowException.class,
                () -> stack.place(new Cell("caps"), pair, 1500, 30000, 20000, 40000));
    }

    @Test
    void unknownCapacitorIsMissing() {
        CapacitorStack.Result result = stack.place(new Cell("caps"), pair, 1500, 30000, 0, 20000);
        assertThrows(MissingConnectionException.class, () -> result.get("c9"));
    }

    @Test
    void freeColumnKeepsAPitchFromUsedColumns() {
        assertEquals(2000, CapacitorStack.freeColumn(List.of(1000), 2000, 450));
        assertEquals(1450, CapacitorStack.freeColumn(List.of(1000), 800, 450));
        assertEquals(1900, CapacitorStack.freeColumn(List.of(1000, 1450), 1000, 450));
    }
}

package nl.bytesoflife.macrogen.drc;

import nl.bytesoflife.macrogen.geometry.Cell;
import nl.bytesoflife.macrogen.geometry.Region;
import nl.bytesoflife.macrogen.tech.Layer;

import java.util.HashMap;
import java.util.Map;

/**
 * The geometry under check: one cell, with the merged region of each layer computed on first use.
 * The cell itself is never modified.
 */
public class DrcLayoutInput {

    private final Cell cell;
    private final int gridNm;
    private final Map<Layer, Region> regions = new HashMap<>();

    public DrcLayoutInput(Cell cell, int gridNm) {
        this.cell = cell;
        this.gridNm = gridNm;
    }

    public Cell getCell() {
        return cell;
    }

    public Region region(Layer layer) {
        return regions.computeIfAbsent(layer, l -> Region.of(cell.getRects(l)));
    }

    public boolean isEmpty(Layer layer) {
        return cell.getRects(layer).isEmpty();
    }

    /** Converts a grid-unit length or coordinate to micrometres. */
    public double toUm(double gridUnits) {
        return gridUnits * gridNm / 1000.0;
    }
}

package nl.bytesoflife.macrogen.macro;

import nl.bytesoflife.macrogen.block.ExportSide;
import nl.bytesoflife.macrogen.block.PowerRails;
import nl.bytesoflife.macrogen.block.RoutedRows;
import nl.bytesoflife.macrogen.block.Schematic;
import nl.bytesoflife.macrogen.geometry.Cell;
import nl.bytesoflife.macrogen.geometry.Rect;
import nl.bytesoflife.macrogen.tech.Layer;
import nl.bytesoflife.macrogen.tech.Layers;
import nl.bytesoflife.macrogen.tech.RuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Common frame of every macro: the driver draws its contents, then the supply rails and the
 * placement boundary are added over the full outline.
 */
public abstract class AbstractMacroDriver implements MacroDriver {

    private static final Logger log = LoggerFactory.getLogger(AbstractMacroDriver.class);

    /** Length of a pin rectangle along its track, measured in from the macro edge. */
    static final int PIN_LENGTH = 400;
    static final int TRACK_PIN_HALF_HEIGHT = 100;

    private final String name;
    private final String description;
    private final int width;
    private final int height;

    protected AbstractMacroDriver(String name, String description, int width, int height) {
        this.name = name;
        this.description = description;
        this.width = width;
        this.height = height;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public int getWidth() {
        return width;
    }

    @Override
    public int getHeight() {
        return height;
    }

    @Override
    public final Cell build(RuleSet rules) {
        Cell cell = new Cell(name);
        draw(cell, rules);
        PowerRails.draw(cell, rules, width, height);
        cell.add(rules.layer(Layers.BOUNDARY), 0, 0, width, height);
        log.info("Generated {}: {} x {} um, {} rectangles, {} labels", name,
                width * rules.getGridNm() / 1000.0, height * rules.getGridNm() / 1000.0,
                cell.rectCount(), cell.getLabels().size());
        return cell;
    }

    protected abstract void draw(Cell cell, RuleSet rules);

    /** Pins every exported net of a routed schematic on its Metal3 track at the export edge. */
    protected void addTrackPins(Cell cell, RuleSet rules, Schematic schematic, RoutedRows routed) {
        Layer metal3 = rules.layer(Layers.METAL3);
        for (Map.Entry<String, ExportSide> e : schematic.getExports().entrySet()) {
            int y = routed.track(e.getKey());
            int x1 = e.getValue() == ExportSide.LEFT ? 0 : width - PIN_LENGTH;
            cell.addPin(metal3, new Rect(x1, y - TRACK_PIN_HALF_HEIGHT, x1 + PIN_LENGTH, y + TRACK_PIN_HALF_HEIGHT),
                    e.getKey());
        }
    }

    @Override
    public String toString() {
        return name + " (" + description + ")";
    }
}

package nl.bytesoflife.macrogen.block;

import nl.bytesoflife.macrogen.geometry.Cell;
import nl.bytesoflife.macrogen.geometry.Point;
import nl.bytesoflife.macrogen.primitive.CapacitorPins;
import nl.bytesoflife.macrogen.primitive.CapacitorSize;
import nl.bytesoflife.macrogen.primitive.MimCapacitorBuilder;
import nl.bytesoflife.macrogen.primitive.ViaLevel;
import nl.bytesoflife.macrogen.primitive.ViaStackBuilder;
import nl.bytesoflife.macrogen.tech.Layers;
import nl.bytesoflife.macrogen.tech.RuleSet;
import nl.bytesoflife.macrogen.tech.TechConstant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stacks MIM capacitors top-down in columns, starting a new column to the right when the next
 * capacitor would pass the floor.
 * <p>
 * Below each capacitor sits its top-plate island: a TopMetal1 strap from the top plate down to a
 * Metal5 pad carrying a TopVia1 and a via stack to Metal2. The bottom plate is tapped by a via stack
 * just inside its lower edge. Both taps land on routing columns at least one router pitch apart so
 * the router can bring Metal2 straight down from every tap.
 */
public class CapacitorStack {

    private static final Logger log = LoggerFactory.getLogger(CapacitorStack.class);

    /** Clearance between Metal5 of neighbouring capacitors and islands. */
    static final int ISOLATION = 300;
    /** Horizontal gap between columns. */
    static final int COLUMN_GAP = 600;
    /** Bottom-tap column inset from the Metal5 plate edge. */
    static final int TAP_INSET = 150;

    public record Result(List<PlacedCapacitor> capacitors, List<Schematic.Terminal> terminals,
                         int rightEdge, int lowestY) {

        public PlacedCapacitor get(String name) {
            return capacitors.stream()
                    .filter(c -> c.spec().name().equals(name))
                    .findFirst()
                    .orElseThrow(() -> new MissingConnectionException(name, "No capacitor named " + name));
        }
    }

    private final RuleSet rules;
    private final MimCapacitorBuilder capacitors;
    private final ViaStackBuilder vias;

    public CapacitorStack(RuleSet rules) {
        this.rules = rules;
        this.capacitors = new MimCapacitorBuilder(rules);
        this.vias = new ViaStackBuilder(rules);
    }

    /**
     * @param x0         left edge of the first column
     * @param top        upper bound of every column
     * @param floor      lower bound of every column
     * @param macroWidth right bound of the last column
     * @throws LayoutOverflowException if a capacitor is taller than a column or the columns pass the right bound
     */
    public Result place(Cell cell, List<CapacitorSpec> specs, int x0, int top, int floor, int macroWidth) {
        int enclosure = rules.length(TechConstant.MIM_METAL5_ENCLOSURE);
        int island = rules.length(TechConstant.TOPMETAL1_MIN_WIDTH);
        int pitch = ChannelRouter.PITCH;

        Map<String, CapacitorSize> sizes = new LinkedHashMap<>();
        List<List<CapacitorSpec>> columns = new ArrayList<>();
        List<CapacitorSpec> current = new ArrayList<>();
        int used = 0;
        for (CapacitorSpec spec : specs) {
            CapacitorSize size = capacitors.size(spec.femtoFarads());
            sizes.put(spec.name(), size);
            int footprint = ISOLATION + island + enclosure + size.height() + enclosure + ISOLATION;
            if (top - footprint < floor) {
                throw new LayoutOverflowException("Capacitor " + spec.name() + " needs " + footprint
                        + " but columns are only " + (top - floor) + " high");
            }
            if (!current.isEmpty() && top - (used + footprint) < floor) {
                columns.add(current);
                current = new ArrayList<>();
                used = 0;
            }
            current.add(spec);
            used += footprint;
        }
        if (!current.isEmpty()) {
            columns.add(current);
        }

        List<PlacedCapacitor> placed = new ArrayList<>();
        List<Schematic.Terminal> terminals = new ArrayList<>();
        int sx = x0;
        int lowest = top;
        for (List<CapacitorSpec> column : columns) {
            Map<String, Integer> plateY = new LinkedHashMap<>();
            int y = top;
            for (CapacitorSpec spec : column) {
                int cy = y - ISOLATION - enclosure - sizes.get(spec.name()).height();
                plateY.put(spec.name(), cy);
                y = cy - enclosure - ISOLATION - island;
            }

            // narrowest plates pick their tap columns first
            List<Integer> usedColumns = new ArrayList<>();
            Map<String, int[]> taps = new LinkedHashMap<>();
            List<CapacitorSpec> byWidth = new ArrayList<>(column);
            byWidth.sort(Comparator.comparingInt((CapacitorSpec s) -> sizes.get(s.name()).width())
                    .thenComparing(CapacitorSpec::name));
            int columnWidth = 0;
            for (CapacitorSpec spec : byWidth) {
                CapacitorSize size = sizes.get(spec.name());
                int metal5Width = size.width() + 2 * enclosure;
                int bottom = freeColumn(usedColumns, sx + TAP_INSET, pitch);
                if (bottom > sx + metal5Width - TAP_INSET) {
                    throw new LayoutOverflowException("No free bottom-plate tap column under capacitor " + spec.name());
                }
                usedColumns.add(bottom);
                int topOverhang = capacitors.topPlateEnclosure(size)[0];
                int topTap = freeColumn(usedColumns, Math.max(sx + island / 2, bottom), pitch);
                if (topTap - island / 2 >= sx + enclosure + size.width() + topOverhang) {
                    throw new LayoutOverflowException("No free top-plate tap column under capacitor " + spec.name());
                }
                usedColumns.add(topTap);
                taps.put(spec.name(), new int[]{bottom, topTap});
                columnWidth = Math.max(columnWidth, Math.max(metal5Width, topTap + island / 2 - sx));
            }

            for (CapacitorSpec spec : column) {
                CapacitorSize size = sizes.get(spec.name());
                int cy = plateY.get(spec.name());
                CapacitorPins pins = capacitors.place(cell, new Point(sx + enclosure, cy), size);
                int[] tap = taps.get(spec.name());

                Point bottomTap = new Point(tap[0], cy - enclosure / 2);
                vias.stack(cell, bottomTap, ViaLevel.VIA2, ViaLevel.VIA4);
                terminals.add(new Schematic.Terminal(spec.bottomNet(), bottomTap.x(), bottomTap.y()));

                int islandY = cy - enclosure - ISOLATION - island / 2;
                Point topTap = new Point(tap[1], islandY);
                vias.stack(cell, topTap, ViaLevel.VIA2, ViaLevel.TOPVIA1);
                // strap overlaps the plate cover by a full top-metal width
                cell.add(rules.layer(Layers.TOPMETAL1), topTap.x() - island / 2, islandY - island / 2,
                        topTap.x() + island / 2, pins.topPlate().y1() + island);
                terminals.add(new Schematic.Terminal(spec.topNet(), topTap.x(), topTap.y()));

                placed.add(new PlacedCapacitor(spec, size, pins.plate(), bottomTap, topTap));
                lowest = Math.min(lowest, cy - enclosure - ISOLATION - island);
            }
            sx += columnWidth + COLUMN_GAP;
        }
        int rightEdge = sx - COLUMN_GAP;
        if (rightEdge > macroWidth) {
            throw new LayoutOverflowException("Capacitor columns end at x=" + rightEdge
                    + ", beyond macro width " + macroWidth);
        }
        log.debug("Stacked {} capacitors in {} columns, x {}..{}, down to y={}",
                placed.size(), columns.size(), x0, rightEdge, lowest);
        return new Result(placed, terminals, rightEdge, lowest);
    }

    /** First column at or right of {@code from} that keeps a full pitch from every used column. */
    static int freeColumn(List<Integer> used, int from, int pitch) {
        int column = from;
        while (true) {
            int next = column;
            for (int u : used) {
                if (Math.abs(column - u) < pitch) {
                    next = Math.max(next, u + pitch);
                }
            }
            if (next == column) {
                return column;
            }
            column = next;
        }
    }
}

package nl.bytesoflife.macrogen.macro;

import nl.bytesoflife.macrogen.block.CapacitorStack;
import nl.bytesoflife.macrogen.block.ChannelRouter;
import nl.bytesoflife.macrogen.block.ExportSide;
import nl.bytesoflife.macrogen.block.RoutedRows;
import nl.bytesoflife.macrogen.block.Schematic;
import nl.bytesoflife.macrogen.block.StateVariableFilter;
import nl.bytesoflife.macrogen.geometry.Cell;
import nl.bytesoflife.macrogen.tech.RuleSet;

import java.util.ArrayList;
import java.util.List;

/**
 * Continuous-time gm-C state-variable filter. Cutoff and Q are set by the two bias currents,
 * {@code ibias_fc} and {@code ibias_q}, normally supplied by {@link BiasDacDriver}'s outputs.
 */
public class SvfDriver extends AbstractMacroDriver {

    public static final String NAME = "svf_2nd";

    static final int CAP_FLOOR = 20000;

    public SvfDriver() {
        super(NAME, "2nd-order gm-C state-variable filter", 70000, 85000);
    }

    @Override
    protected void draw(Cell cell, RuleSet rules) {
        CapacitorStack.Result caps = new CapacitorStack(rules).place(cell, StateVariableFilter.gmCCapacitors(),
                ChannelRouter.FIRST_COLUMN, getHeight() - 2500, CAP_FLOOR, getWidth());

        Schematic s = new Schematic().terminals(caps.terminals());
        StateVariableFilter.gmC(s, "ibias_fc", "ibias_q");

        List<String> left = new ArrayList<>(List.of(StateVariableFilter.INPUT, StateVariableFilter.COMMON_MODE,
                "ibias_fc", "ibias_q"));
        left.addAll(StateVariableFilter.selectLines());
        s.export(left, ExportSide.LEFT);
        s.export(StateVariableFilter.OUTPUT, ExportSide.RIGHT);

        RoutedRows routed = new ChannelRouter(rules).route(cell, s, getWidth(), getHeight(), caps.lowestY());
        addTrackPins(cell, rules, s, routed);
    }
}

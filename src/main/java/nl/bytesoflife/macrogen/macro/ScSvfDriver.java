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
 * Switched-capacitor state-variable filter clocked by {@code sc_clk}. Cutoff follows the clock
 * frequency; Q is selected by the 4-bit binary-weighted feedback array on {@code q[0..3]}.
 */
public class ScSvfDriver extends AbstractMacroDriver {

    public static final String NAME = "sc_svf_2nd";
    public static final int Q_BITS = 4;

    static final int CAP_FLOOR = 30000;

    public ScSvfDriver() {
        super(NAME, "2nd-order switched-capacitor state-variable filter", 90000, 110000);
    }

    @Override
    protected void draw(Cell cell, RuleSet rules) {
        CapacitorStack.Result caps = new CapacitorStack(rules).place(cell,
                StateVariableFilter.switchedCapacitorCapacitors(Q_BITS),
                ChannelRouter.FIRST_COLUMN, getHeight() - 2500, CAP_FLOOR, getWidth());

        Schematic s = new Schematic().terminals(caps.terminals());
        StateVariableFilter.switchedCapacitor(s, "ibias", "sc_clk", Q_BITS);

        List<String> left = new ArrayList<>(List.of(StateVariableFilter.INPUT, StateVariableFilter.COMMON_MODE,
                "ibias", "sc_clk"));
        left.addAll(StateVariableFilter.indexed("q", Q_BITS));
        left.addAll(StateVariableFilter.selectLines());
        s.export(left, ExportSide.LEFT);
        s.export(StateVariableFilter.OUTPUT, ExportSide.RIGHT);

        RoutedRows routed = new ChannelRouter(rules).route(cell, s, getWidth(), getHeight(), caps.lowestY());
        addTrackPins(cell, rules, s, routed);
    }
}

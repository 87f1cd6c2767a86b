package nl.bytesoflife.macrogen.macro;

import nl.bytesoflife.macrogen.block.CapacitorDacArray;
import nl.bytesoflife.macrogen.block.CapacitorSpec;
import nl.bytesoflife.macrogen.block.CapacitorStack;
import nl.bytesoflife.macrogen.block.ChannelRouter;
import nl.bytesoflife.macrogen.block.DigitalCells;
import nl.bytesoflife.macrogen.block.ExportSide;
import nl.bytesoflife.macrogen.block.LatchedComparator;
import nl.bytesoflife.macrogen.block.PowerRails;
import nl.bytesoflife.macrogen.block.RoutedRows;
import nl.bytesoflife.macrogen.block.Schematic;
import nl.bytesoflife.macrogen.block.StateVariableFilter;
import nl.bytesoflife.macrogen.geometry.Cell;
import nl.bytesoflife.macrogen.tech.RuleSet;

import java.util.ArrayList;
import java.util.List;

/**
 * Analog half of an 8-bit charge-redistribution SAR ADC: the sampling switch, a 9-weight
 * capacitor DAC whose bottom plates are driven between VSS and {@code vref} by inverters, and a
 * StrongARM comparator against {@code vcm}. The successive-approximation register itself lives in
 * digital logic outside the macro and drives {@code ctl[0..7]}.
 */
public class SarAdcDriver extends AbstractMacroDriver {

    public static final String NAME = "sar_adc_8bit";
    public static final int BITS = 8;
    public static final double UNIT_FF = 2.0;

    static final int CAP_FLOOR = 24000;

    public SarAdcDriver() {
        super(NAME, "8-bit SAR ADC analog core", 56000, 56000);
    }

    public static List<CapacitorSpec> capacitors() {
        return CapacitorDacArray.specs("c", BITS, UNIT_FF, "top", b -> b == 0 ? PowerRails.VSS : "bot" + b);
    }

    @Override
    protected void draw(Cell cell, RuleSet rules) {
        CapacitorStack.Result caps = new CapacitorStack(rules).place(cell, capacitors(),
                ChannelRouter.FIRST_COLUMN, getHeight() - 2500, CAP_FLOOR, getWidth());

        Schematic s = new Schematic().terminals(caps.terminals());
        s.nmos("sw", 3000, 130, "sample", "vin", "top");
        LatchedComparator.add(s, "cmp", "top", "vcm", "clk", "outp", "outn");
        for (int b = 1; b <= BITS; b++) {
            DigitalCells.inverter(s, "drv" + b, "ctl[" + (b - 1) + "]", "bot" + b, "vref");
        }

        List<String> left = new ArrayList<>(List.of("vin", "sample", "clk", "vcm", "vref"));
        left.addAll(StateVariableFilter.indexed("ctl", BITS));
        s.export(left, ExportSide.LEFT);
        s.export(List.of("outp", "outn"), ExportSide.RIGHT);

        RoutedRows routed = new ChannelRouter(rules).route(cell, s, getWidth(), getHeight(), caps.lowestY());
        addTrackPins(cell, rules, s, routed);
    }
}

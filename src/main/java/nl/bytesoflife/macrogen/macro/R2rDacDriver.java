package nl.bytesoflife.macrogen.macro;

import nl.bytesoflife.macrogen.block.LadderChannel;
import nl.bytesoflife.macrogen.block.LadderSpec;
import nl.bytesoflife.macrogen.block.ResistorLadderChannel;
import nl.bytesoflife.macrogen.geometry.Cell;
import nl.bytesoflife.macrogen.primitive.ResistorMaterial;
import nl.bytesoflife.macrogen.tech.Layer;
import nl.bytesoflife.macrogen.tech.Layers;
import nl.bytesoflife.macrogen.tech.RuleSet;

/**
 * Single-ended 8-bit R-2R DAC on high-resistance poly. The ladder's reference end is tied to VDD.
 */
public class R2rDacDriver extends AbstractMacroDriver {

    public static final String NAME = "r2r_dac_8bit";
    public static final int BITS = 8;
    public static final double UNIT_OHMS = 2000;
    public static final int RESISTOR_WIDTH = 2000;

    public R2rDacDriver() {
        super(NAME, "8-bit R-2R voltage DAC", 45000, 60000);
    }

    /** Ladder placement for this macro's outline. */
    public LadderSpec ladderSpec(RuleSet rules) {
        return new LadderSpec(BITS, 4982, 40000, 29626, 4000, 3000, getWidth(), getHeight(),
                ResistorMaterial.RHIGH.sheetResistance(rules), UNIT_OHMS, RESISTOR_WIDTH, true, null, "d");
    }

    @Override
    protected void draw(Cell cell, RuleSet rules) {
        LadderChannel ladder = new ResistorLadderChannel(rules).place(cell, ladderSpec(rules));
        Layer metal2 = rules.layer(Layers.METAL2);
        for (LadderChannel.BitPin pin : ladder.bitPins()) {
            cell.addPin(metal2, pin.pin(), pin.name());
        }
        cell.addPin(metal2, ladder.outputPin(), "vout");
    }
}

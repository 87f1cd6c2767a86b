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
 * Two 4-bit R-2R channels stacked vertically, generating the filter's cutoff and Q bias voltages.
 * The lower channel grounds its switches straight to the VSS rail and the upper one reuses the
 * lower channel's source strap; both reference ends share one riser to VDD.
 */
public class BiasDacDriver extends AbstractMacroDriver {

    public static final String NAME = "bias_dac_2ch";
    public static final int BITS = 4;

    public BiasDacDriver() {
        super(NAME, "Dual 4-bit bias DAC (cutoff and Q)", 35000, 42000);
    }

    public LadderSpec cutoffChannel(RuleSet rules) {
        return new LadderSpec(BITS, 3000, 18374, 8000, 4000, 1000, getWidth(), getHeight(),
                ResistorMaterial.RHIGH.sheetResistance(rules), R2rDacDriver.UNIT_OHMS, R2rDacDriver.RESISTOR_WIDTH,
                false, null, "d_fc");
    }

    public LadderSpec qChannel(RuleSet rules, int groundStrapY) {
        return new LadderSpec(BITS, 3000, 36374, 26000, 22000, 1000, getWidth(), getHeight(),
                ResistorMaterial.RHIGH.sheetResistance(rules), R2rDacDriver.UNIT_OHMS, R2rDacDriver.RESISTOR_WIDTH,
                true, groundStrapY, "d_q");
    }

    @Override
    protected void draw(Cell cell, RuleSet rules) {
        ResistorLadderChannel ladders = new ResistorLadderChannel(rules);
        LadderChannel cutoff = ladders.place(cell, cutoffChannel(rules));
        LadderChannel q = ladders.place(cell, qChannel(rules, cutoff.groundY()));
        ladders.joinReferences(cell, cutoff, q);

        Layer metal2 = rules.layer(Layers.METAL2);
        for (LadderChannel channel : new LadderChannel[]{cutoff, q}) {
            for (LadderChannel.BitPin pin : channel.bitPins()) {
                cell.addPin(metal2, pin.pin(), pin.name());
            }
        }
        cell.addPin(metal2, cutoff.outputPin(), "vout_fc");
        cell.addPin(metal2, q.outputPin(), "vout_q");
    }
}

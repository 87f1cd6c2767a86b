package nl.bytesoflife.macrogen.macro;

import nl.bytesoflife.macrogen.geometry.Cell;
import nl.bytesoflife.macrogen.tech.RuleSet;

/**
 * Builds one hard macro as a single flat cell named after the macro.
 * <p>
 * Outlines and the fixed placement offsets of the drivers are drawn for a 1nm grid; a rule deck
 * with a coarser grid scales every fixed dimension with it.
 */
public interface MacroDriver {

    String getName();

    String getDescription();

    /** Outline width in grid units. */
    int getWidth();

    /** Outline height in grid units. */
    int getHeight();

    Cell build(RuleSet rules);
}

package nl.bytesoflife.macrogen.primitive;

import nl.bytesoflife.macrogen.geometry.Point;
import nl.bytesoflife.macrogen.geometry.Rect;

/**
 * Connection points of a placed MOS transistor. Without a gate tap, {@code gate} is the end of
 * the gate poly and carries no contact.
 *
 * @param diffusionLength extent of the active area along the channel direction
 * @param active          the active (diffusion) rectangle
 */
public record TransistorPins(Point gate, Point source, Point drain, int diffusionLength, Rect active) {
}

package nl.bytesoflife.macrogen.geometry;

import nl.bytesoflife.macrogen.tech.Layer;

/** A text annotation naming an external terminal. */
public record Label(Layer layer, String text, Point position) {
}

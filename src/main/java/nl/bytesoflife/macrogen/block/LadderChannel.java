package nl.bytesoflife.macrogen.block;

import nl.bytesoflife.macrogen.geometry.Point;
import nl.bytesoflife.macrogen.geometry.Rect;
import nl.bytesoflife.macrogen.primitive.ResistorEnds;

import java.util.List;

/**
 * What a ladder channel exposes: the series junctions (rightmost one is the output), the left
 * contact of the first series resistor (the reference end), the bit input pins and the output pin.
 */
public record LadderChannel(List<Point> junctions, Point reference, List<BitPin> bitPins,
                            Point output, Rect outputPin, int groundY,
                            List<ResistorEnds> series, List<ResistorEnds> shunts) {

    public record BitPin(String name, Rect pin) {
    }
}

package nl.bytesoflife.macrogen.drc;

import nl.bytesoflife.macrogen.tech.DesignRule;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;

import java.util.Locale;

/**
 * One marker produced by a check. Lengths and coordinates are reported in micrometres;
 * the marker geometry stays in grid units.
 */
public class DrcViolation {

    private final DesignRule rule;
    private final String description;
    private final Double measuredUm;
    private final Double requiredUm;
    private final double x;
    private final double y;
    private final String layer;
    private final Geometry marker;

    public DrcViolation(DesignRule rule, String description, Double measuredUm, Double requiredUm,
                        double x, double y, String layer, Geometry marker) {
        this.rule = rule;
        this.description = description;
        this.measuredUm = measuredUm;
        this.requiredUm = requiredUm;
        this.x = x;
        this.y = y;
        this.layer = layer;
        this.marker = marker;
    }

    public DesignRule getRule() { return rule; }
    public String getDescription() { return description; }
    public Double getMeasuredUm() { return measuredUm; }
    public Double getRequiredUm() { return requiredUm; }
    public double getX() { return x; }
    public double getY() { return y; }
    public String getLayer() { return layer; }
    public Geometry getMarker() { return marker; }

    public Envelope getMarkerBounds() {
        return marker.getEnvelopeInternal();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(rule.getName()).append(": ");
        sb.append(description);
        if (measuredUm != null && requiredUm != null) {
            sb.append(String.format(Locale.US, " (measured=%.3fum, required=%.3fum)", measuredUm, requiredUm));
        } else if (requiredUm != null) {
            sb.append(String.format(Locale.US, " (required=%.3fum)", requiredUm));
        }
        sb.append(String.format(Locale.US, " at (%.3f, %.3f)", x, y));
        if (layer != null) {
            sb.append(" on ").append(layer);
        }
        return sb.toString();
    }
}

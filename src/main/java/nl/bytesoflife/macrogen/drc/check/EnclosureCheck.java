package nl.bytesoflife.macrogen.drc.check;

import nl.bytesoflife.macrogen.drc.DrcLayoutInput;
import nl.bytesoflife.macrogen.drc.DrcViolation;
import nl.bytesoflife.macrogen.geometry.Region;
import nl.bytesoflife.macrogen.tech.DesignRule;
import nl.bytesoflife.macrogen.tech.RuleKind;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

import java.util.ArrayList;
import java.util.List;

/**
 * Minimum enclosure of an inner layer by an outer layer. Only the part of the inner layer that
 * overlaps the outer layer is checked, so inner shapes sitting on some other structure are ignored.
 * The overlap grown by the margin must stay inside the outer layer.
 */
public class EnclosureCheck implements DrcCheck {

    @Override
    public RuleKind getSupportedKind() {
        return RuleKind.ENCLOSURE;
    }

    @Override
    public boolean appliesTo(DesignRule rule, DrcLayoutInput layout) {
        if (layout.isEmpty(rule.getLayer()) || layout.isEmpty(rule.getOuterLayer())) {
            return false;
        }
        return !overlap(rule, layout).isEmpty();
    }

    @Override
    public List<DrcViolation> check(DesignRule rule, int threshold, DrcLayoutInput layout) {
        List<DrcViolation> violations = new ArrayList<>();
        Region outer = layout.region(rule.getOuterLayer());
        Region uncovered = overlap(rule, layout).grow(threshold).minus(outer);

        for (Polygon marker : uncovered.polygons()) {
            if (marker.getArea() < WidthCheck.MIN_MARKER_AREA) continue;
            Point at = marker.getInteriorPoint();
            violations.add(new DrcViolation(
                    rule, rule.getOuterLayer().name() + " enclosure of " + rule.getLayer().name() + " below minimum",
                    null, layout.toUm(threshold),
                    layout.toUm(at.getX()), layout.toUm(at.getY()),
                    rule.getLayer().name(), marker));
        }

        return violations;
    }

    private static Region overlap(DesignRule rule, DrcLayoutInput layout) {
        return layout.region(rule.getLayer()).and(layout.region(rule.getOuterLayer()));
    }
}

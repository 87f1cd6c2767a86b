package nl.bytesoflife.macrogen.drc.check;

import nl.bytesoflife.macrogen.drc.DrcLayoutInput;
import nl.bytesoflife.macrogen.drc.DrcViolation;
import nl.bytesoflife.macrogen.geometry.Region;
import nl.bytesoflife.macrogen.geometry.SpatialIndex;
import nl.bytesoflife.macrogen.tech.DesignRule;
import nl.bytesoflife.macrogen.tech.RuleKind;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.operation.distance.DistanceOp;

import java.util.ArrayList;
import java.util.List;

/**
 * Minimum spacing between the separate pieces of one merged layer, by Euclidean distance.
 * <p>
 * Pieces that share an edge merge into one polygon. Pieces that meet only at a corner stay separate
 * and are reported with zero spacing. Gaps inside one piece, such as the slot of a U shape, are not
 * measured: only distances between different pieces count, where a full edge-pair space check would
 * also flag notches.
 */
public class SpacingCheck implements DrcCheck {

    private final GeometryFactory factory = new GeometryFactory();

    @Override
    public RuleKind getSupportedKind() {
        return RuleKind.SPACING;
    }

    @Override
    public boolean appliesTo(DesignRule rule, DrcLayoutInput layout) {
        return !layout.isEmpty(rule.getLayer());
    }

    @Override
    public List<DrcViolation> check(DesignRule rule, int threshold, DrcLayoutInput layout) {
        List<DrcViolation> violations = new ArrayList<>();
        Region region = layout.region(rule.getLayer());
        List<Polygon> pieces = region.polygons();
        if (pieces.size() < 2) return violations;

        SpatialIndex index = new SpatialIndex(pieces);
        for (SpatialIndex.GeometryPair pair : index.findPairsWithinDistance(threshold)) {
            double distance = pair.distance();

            Coordinate[] closest = DistanceOp.nearestPoints(pair.geom1(), pair.geom2());
            double vx = (closest[0].x + closest[1].x) / 2;
            double vy = (closest[0].y + closest[1].y) / 2;
            Geometry marker = distance > 0
                    ? factory.createLineString(closest)
                    : factory.createPoint(closest[0]);

            violations.add(new DrcViolation(
                    rule, "Spacing below minimum",
                    layout.toUm(distance), layout.toUm(threshold),
                    layout.toUm(vx), layout.toUm(vy),
                    rule.getLayer().name(), marker));
        }

        return violations;
    }
}

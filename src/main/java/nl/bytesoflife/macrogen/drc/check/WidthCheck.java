package nl.bytesoflife.macrogen.drc.check;

import nl.bytesoflife.macrogen.drc.DrcLayoutInput;
import nl.bytesoflife.macrogen.drc.DrcViolation;
import nl.bytesoflife.macrogen.geometry.Region;
import nl.bytesoflife.macrogen.geometry.SpatialIndex;
import nl.bytesoflife.macrogen.tech.DesignRule;
import nl.bytesoflife.macrogen.tech.RuleKind;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineSegment;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.operation.distance.DistanceOp;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Minimum width, in three passes over the merged layer:
 * <ol>
 *   <li>Morphological opening: shrinking the region by just under half the threshold and growing
 *   it back removes every part narrower than the threshold. What the opening lost is marked.</li>
 *   <li>Facing edges: two boundary edges pointing against each other with material between them
 *   and a Euclidean distance below the threshold. The opening uses a square structuring element,
 *   so this pass finds the diagonal necks it lets through.</li>
 *   <li>Point contacts: pieces that touch only at a corner, and rings that touch themselves,
 *   have zero width there.</li>
 * </ol>
 */
public class WidthCheck implements DrcCheck {

    /** Opening residue below this area (grid units squared) is numerical noise. */
    static final double MIN_MARKER_AREA = 1.0;

    private final GeometryFactory factory = new GeometryFactory();

    @Override
    public RuleKind getSupportedKind() {
        return RuleKind.WIDTH;
    }

    @Override
    public boolean appliesTo(DesignRule rule, DrcLayoutInput layout) {
        return !layout.isEmpty(rule.getLayer());
    }

    @Override
    public List<DrcViolation> check(DesignRule rule, int threshold, DrcLayoutInput layout) {
        List<DrcViolation> violations = new ArrayList<>();
        Region region = layout.region(rule.getLayer());

        // a part exactly threshold wide keeps a 1-unit core after the shrink
        double erosion = (threshold - 1) / 2.0;
        Region opened = region.grow(-erosion).grow(erosion);
        Region residue = region.minus(opened);

        for (Polygon marker : residue.polygons()) {
            if (marker.getArea() < MIN_MARKER_AREA) continue;
            Envelope env = marker.getEnvelopeInternal();
            double measured = Math.min(env.getWidth(), env.getHeight());
            Point at = marker.getInteriorPoint();
            violations.add(new DrcViolation(
                    rule, "Width below minimum",
                    layout.toUm(measured), layout.toUm(threshold),
                    layout.toUm(at.getX()), layout.toUm(at.getY()),
                    rule.getLayer().name(), marker));
        }

        List<Polygon> pieces = region.polygons();
        for (Polygon piece : pieces) {
            checkFacingEdges(rule, threshold, layout, piece, residue.getGeometry(), violations);
            checkSelfContacts(rule, threshold, layout, piece, violations);
        }
        checkPieceContacts(rule, threshold, layout, pieces, violations);

        return violations;
    }

    private void checkFacingEdges(DesignRule rule, int threshold, DrcLayoutInput layout, Polygon piece,
                                  Geometry residue, List<DrcViolation> violations) {
        // normalized rings keep the material on the right of every edge, shell and holes alike
        Polygon normalized = (Polygon) piece.norm();
        List<LineSegment> edges = edges(normalized);
        Set<LineSegment> reported = new HashSet<>();

        for (int i = 0; i < edges.size(); i++) {
            LineSegment a = edges.get(i);
            for (int j = i + 1; j < edges.size(); j++) {
                LineSegment b = edges.get(j);
                if (sharesEndpoint(a, b) || !facing(a, b)) continue;

                double distance = a.distance(b);
                if (distance <= 0 || distance >= threshold) continue;

                Coordinate[] closest = a.closestPoints(b);
                LineSegment gap = new LineSegment(closest[0], closest[1]);
                gap.normalize();
                Point middle = factory.createPoint(gap.midPoint());
                if (!normalized.contains(middle)) continue;
                if (!residue.isEmpty() && residue.distance(middle) <= 1.0) continue;
                if (!reported.add(gap)) continue;

                violations.add(new DrcViolation(
                        rule, "Width below minimum",
                        layout.toUm(distance), layout.toUm(threshold),
                        layout.toUm(middle.getX()), layout.toUm(middle.getY()),
                        rule.getLayer().name(), gap.toGeometry(factory)));
            }
        }
    }

    private void checkSelfContacts(DesignRule rule, int threshold, DrcLayoutInput layout, Polygon piece,
                                   List<DrcViolation> violations) {
        Set<Coordinate> seen = new HashSet<>();
        Set<Coordinate> touching = new LinkedHashSet<>();
        for (LinearRing ring : rings(piece)) {
            Coordinate[] coords = ring.getCoordinates();
            // the closing coordinate repeats the first
            for (int k = 0; k < coords.length - 1; k++) {
                if (!seen.add(coords[k])) {
                    touching.add(coords[k]);
                }
            }
        }
        for (Coordinate at : touching) {
            violations.add(pointContact(rule, threshold, layout, at));
        }
    }

    private void checkPieceContacts(DesignRule rule, int threshold, DrcLayoutInput layout, List<Polygon> pieces,
                                    List<DrcViolation> violations) {
        if (pieces.size() < 2) return;
        for (SpatialIndex.GeometryPair pair : new SpatialIndex(pieces).findTouchingPairs()) {
            Coordinate at = DistanceOp.nearestPoints(pair.geom1(), pair.geom2())[0];
            violations.add(pointContact(rule, threshold, layout, at));
        }
    }

    private DrcViolation pointContact(DesignRule rule, int threshold, DrcLayoutInput layout, Coordinate at) {
        return new DrcViolation(
                rule, "Shapes meet only at a corner",
                0.0, layout.toUm(threshold),
                layout.toUm(at.x), layout.toUm(at.y),
                rule.getLayer().name(), factory.createPoint(at));
    }

    /** Directions more than a right angle apart: the edges point against each other. */
    private static boolean facing(LineSegment a, LineSegment b) {
        double dot = (a.p1.x - a.p0.x) * (b.p1.x - b.p0.x) + (a.p1.y - a.p0.y) * (b.p1.y - b.p0.y);
        return dot < 0;
    }

    private static boolean sharesEndpoint(LineSegment a, LineSegment b) {
        return a.p0.equals2D(b.p0) || a.p0.equals2D(b.p1) || a.p1.equals2D(b.p0) || a.p1.equals2D(b.p1);
    }

    private static List<LinearRing> rings(Polygon polygon) {
        List<LinearRing> rings = new ArrayList<>();
        rings.add(polygon.getExteriorRing());
        for (int i = 0; i < polygon.getNumInteriorRing(); i++) {
            rings.add(polygon.getInteriorRingN(i));
        }
        return rings;
    }

    private static List<LineSegment> edges(Polygon polygon) {
        List<LineSegment> edges = new ArrayList<>();
        for (LinearRing ring : rings(polygon)) {
            Coordinate[] coords = ring.getCoordinates();
            for (int k = 0; k + 1 < coords.length; k++) {
                if (!coords[k].equals2D(coords[k + 1])) {
                    edges.add(new LineSegment(coords[k], coords[k + 1]));
                }
            }
        }
        return edges;
    }
}

package nl.bytesoflife.macrogen.geometry;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.operation.buffer.BufferOp;
import org.locationtech.jts.operation.buffer.BufferParameters;
import org.locationtech.jts.operation.union.UnaryUnionOp;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Merged area of a set of rectangles, backed by a JTS geometry.
 * <p>
 * Regions are immutable; every boolean operation returns a new region. Grow and shrink use
 * mitred joins so rectilinear shapes stay rectilinear.
 */
public final class Region {

    private static final GeometryFactory FACTORY = new GeometryFactory(new PrecisionModel(), 0);
    private static final BufferParameters MITRE = mitreParameters();

    private final Geometry geometry;

    private Region(Geometry geometry) {
        this.geometry = geometry;
    }

    public static Region empty() {
        return new Region(FACTORY.createGeometryCollection());
    }

    public static Region of(Collection<Rect> rects) {
        if (rects.isEmpty()) return empty();
        List<Geometry> polygons = new ArrayList<>(rects.size());
        for (Rect rect : rects) {
            polygons.add(toPolygon(rect));
        }
        return new Region(UnaryUnionOp.union(polygons, FACTORY));
    }

    public static Polygon toPolygon(Rect r) {
        return FACTORY.createPolygon(new Coordinate[]{
                new Coordinate(r.x1(), r.y1()),
                new Coordinate(r.x2(), r.y1()),
                new Coordinate(r.x2(), r.y2()),
                new Coordinate(r.x1(), r.y2()),
                new Coordinate(r.x1(), r.y1())
        });
    }

    public Geometry getGeometry() {
        return geometry;
    }

    public boolean isEmpty() {
        return geometry.isEmpty();
    }

    public double area() {
        return geometry.getArea();
    }

    public Region and(Region other) {
        if (isEmpty() || other.isEmpty()) return empty();
        return new Region(geometry.intersection(other.geometry));
    }

    public Region or(Region other) {
        if (isEmpty()) return other;
        if (other.isEmpty()) return this;
        return new Region(geometry.union(other.geometry));
    }

    public Region minus(Region other) {
        if (isEmpty() || other.isEmpty()) return this;
        return new Region(geometry.difference(other.geometry));
    }

    /** Grows the region by {@code margin} grid units; a negative margin shrinks it. */
    public Region grow(double margin) {
        if (isEmpty() || margin == 0) return this;
        return new Region(BufferOp.bufferOp(geometry, margin, MITRE));
    }

    /**
     * The separate polygons making up this region, in a stable order (by lower-left envelope corner).
     */
    public List<Polygon> polygons() {
        List<Polygon> result = new ArrayList<>();
        for (int i = 0; i < geometry.getNumGeometries(); i++) {
            Geometry part = geometry.getGeometryN(i);
            if (part instanceof Polygon polygon && !polygon.isEmpty()) {
                result.add(polygon);
            }
        }
        result.sort((a, b) -> {
            Envelope ea = a.getEnvelopeInternal();
            Envelope eb = b.getEnvelopeInternal();
            int cmp = Double.compare(ea.getMinX(), eb.getMinX());
            return cmp != 0 ? cmp : Double.compare(ea.getMinY(), eb.getMinY());
        });
        return result;
    }

    private static BufferParameters mitreParameters() {
        BufferParameters params = new BufferParameters();
        params.setJoinStyle(BufferParameters.JOIN_MITRE);
        params.setMitreLimit(10.0);
        params.setEndCapStyle(BufferParameters.CAP_FLAT);
        params.setSimplifyFactor(0.0);
        return params;
    }

    @Override
    public String toString() {
        return "Region{polygons=" + geometry.getNumGeometries() + ", area=" + geometry.getArea() + "}";
    }
}

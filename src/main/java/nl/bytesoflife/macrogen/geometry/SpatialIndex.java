package nl.bytesoflife.macrogen.geometry;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.index.strtree.STRtree;

import java.util.ArrayList;
import java.util.List;

/**
 * STR-tree over a list of polygons, answering "which pairs are closer than d".
 * Each pair is reported once, lower index first.
 */
public class SpatialIndex {

    private final STRtree tree = new STRtree();
    private final List<? extends Geometry> geometries;

    public SpatialIndex(List<? extends Geometry> geometries) {
        this.geometries = geometries;
        for (int i = 0; i < geometries.size(); i++) {
            tree.insert(geometries.get(i).getEnvelopeInternal(), i);
        }
        tree.build();
    }

    @SuppressWarnings("unchecked")
    public List<Integer> queryNeighbors(Geometry geometry, double searchDistance) {
        Envelope searchEnvelope = geometry.getEnvelopeInternal().copy();
        searchEnvelope.expandBy(searchDistance);
        List<Integer> hits = new ArrayList<>((List<Integer>) tree.query(searchEnvelope));
        hits.sort(null);
        return hits;
    }

    public List<GeometryPair> findPairsWithinDistance(double maxDistance) {
        List<GeometryPair> pairs = new ArrayList<>();

        for (int i = 0; i < geometries.size(); i++) {
            Geometry geom = geometries.get(i);
            for (int j : queryNeighbors(geom, maxDistance)) {
                if (j <= i) continue;

                Geometry neighbor = geometries.get(j);
                double distance = geom.distance(neighbor);
                if (distance < maxDistance) {
                    pairs.add(new GeometryPair(geom, neighbor, distance));
                }
            }
        }

        return pairs;
    }

    /** Pairs that meet without overlapping, such as the pieces of a merged region touching at a corner. */
    public List<GeometryPair> findTouchingPairs() {
        List<GeometryPair> pairs = new ArrayList<>();

        for (int i = 0; i < geometries.size(); i++) {
            Geometry geom = geometries.get(i);
            for (int j : queryNeighbors(geom, 0)) {
                if (j <= i) continue;

                Geometry neighbor = geometries.get(j);
                if (geom.touches(neighbor)) {
                    pairs.add(new GeometryPair(geom, neighbor, 0));
                }
            }
        }

        return pairs;
    }

    public record GeometryPair(Geometry geom1, Geometry geom2, double distance) {}
}

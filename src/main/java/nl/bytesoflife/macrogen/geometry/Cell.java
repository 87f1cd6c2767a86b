package nl.bytesoflife.macrogen.geometry;

import nl.bytesoflife.macrogen.tech.Layer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A flat, named layout cell: per-layer rectangles plus text labels.
 * <p>
 * Geometry is append-only. A cell is owned by the single generation call that fills it and
 * is treated as read-only once handed to the checker or the writer. Not thread-safe.
 */
public class Cell {

    private final String name;
    private final Map<Layer, List<Rect>> shapes = new LinkedHashMap<>();
    private final List<Label> labels = new ArrayList<>();

    public Cell(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Cell name must not be blank");
        }
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public Rect add(Layer layer, Rect rect) {
        shapes.computeIfAbsent(layer, k -> new ArrayList<>()).add(rect);
        return rect;
    }

    /** Adds the rectangle spanned by two opposite corners. */
    public Rect add(Layer layer, int xa, int ya, int xb, int yb) {
        return add(layer, Rect.of(xa, ya, xb, yb));
    }

    public void addLabel(Label label) {
        labels.add(label);
    }

    /**
     * Adds a pin: the rectangle on the pin purpose of {@code layer} and a label at its centre.
     */
    public void addPin(Layer layer, Rect rect, String netName) {
        add(layer.pin(), rect);
        addLabel(new Label(layer.label(), netName, rect.center()));
    }

    public List<Rect> getRects(Layer layer) {
        List<Rect> rects = shapes.get(layer);
        return rects == null ? List.of() : Collections.unmodifiableList(rects);
    }

    public List<Layer> getLayers() {
        return List.copyOf(shapes.keySet());
    }

    public List<Label> getLabels() {
        return Collections.unmodifiableList(labels);
    }

    public int rectCount() {
        return shapes.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return shapes.isEmpty();
    }

    public Optional<Rect> boundingBox() {
        return shapes.values().stream()
                .flatMap(List::stream)
                .reduce(Rect::union);
    }

    @Override
    public String toString() {
        return "Cell{name='" + name + "', layers=" + shapes.size() + ", rects=" + rectCount() +
                ", labels=" + labels.size() + "}";
    }
}

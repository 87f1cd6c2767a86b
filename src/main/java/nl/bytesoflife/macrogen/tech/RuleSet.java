package nl.bytesoflife.macrogen.tech;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable table of one technology's layers, design rules and derived constants.
 * <p>
 * A rule set is passed explicitly to every builder and to the checker, so several
 * technologies (or a synthetic rule set in a test) can be used side by side.
 */
public final class RuleSet {

    private final String technology;
    private final int gridNm;
    private final Map<String, Layer> layers;
    private final List<DesignRule> rules;
    private final Map<TechConstant, Double> constants;

    private RuleSet(Builder builder) {
        this.technology = builder.technology;
        this.gridNm = builder.gridNm;
        this.layers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.layers));
        this.rules = List.copyOf(builder.rules);
        this.constants = Collections.unmodifiableMap(new EnumMap<>(builder.constants));
    }

    public static Builder builder(String technology) {
        return new Builder(technology);
    }

    public String getTechnology() {
        return technology;
    }

    /** Size of one grid step in nanometres. All geometry coordinates are multiples of it. */
    public int getGridNm() {
        return gridNm;
    }

    public List<DesignRule> getRules() {
        return rules;
    }

    public Optional<DesignRule> findRule(String name) {
        return rules.stream().filter(r -> r.getName().equals(name)).findFirst();
    }

    public DesignRule rule(String name) {
        return findRule(name).orElseThrow(() ->
                new IllegalArgumentException("Rule " + name + " not defined for " + technology));
    }

    /** Threshold of the named rule in grid units. */
    public int threshold(String ruleName) {
        return rule(ruleName).thresholdInGrid(gridNm);
    }

    public Map<String, Layer> getLayers() {
        return layers;
    }

    public Layer layer(String name) {
        Layer layer = layers.get(name);
        if (layer == null) {
            throw new IllegalArgumentException("Layer " + name + " not defined for " + technology);
        }
        return layer;
    }

    /**
     * Resolves a stream layer number/datatype pair, including the pin and label purposes
     * of the drawing layers. Unknown pairs yield an anonymous layer.
     */
    public Layer layer(int number, int datatype) {
        for (Layer layer : layers.values()) {
            if (layer.number() != number) continue;
            if (layer.datatype() == datatype) return layer;
            if (datatype == Layer.PIN_DATATYPE) return layer.pin();
            if (datatype == Layer.LABEL_DATATYPE) return layer.label();
        }
        return new Layer("L" + number + "/" + datatype, number, datatype);
    }

    public boolean hasConstant(TechConstant constant) {
        return constants.containsKey(constant);
    }

    /** A length constant in grid units. */
    public int length(TechConstant constant) {
        if (!constant.isLength()) {
            throw new IllegalArgumentException(constant + " is not a length");
        }
        return (int) Math.round(value(constant));
    }

    public double value(TechConstant constant) {
        Double value = constants.get(constant);
        if (value == null) {
            throw new IllegalArgumentException("Constant " + constant.getDeckName() + " not defined for " + technology);
        }
        return value;
    }

    @Override
    public String toString() {
        return "RuleSet{technology='" + technology + "', layers=" + layers.size() +
                ", rules=" + rules.size() + ", constants=" + constants.size() + "}";
    }

    public static final class Builder {
        private final String technology;
        private int gridNm = 1;
        private final Map<String, Layer> layers = new LinkedHashMap<>();
        private final List<DesignRule> rules = new ArrayList<>();
        private final Map<TechConstant, Double> constants = new EnumMap<>(TechConstant.class);
        private boolean lengthsScaled;

        private Builder(String technology) {
            this.technology = technology;
        }

        public Builder grid(int gridNm) {
            if (gridNm <= 0) throw new IllegalArgumentException("Grid must be positive: " + gridNm);
            if (lengthsScaled && gridNm != this.gridNm) {
                throw new IllegalArgumentException("Grid " + gridNm + "nm declared after length constants were "
                        + "converted on a " + this.gridNm + "nm grid");
            }
            this.gridNm = gridNm;
            return this;
        }

        public Builder layer(String name, int number, int datatype) {
            layers.put(name, new Layer(name, number, datatype));
            return this;
        }

        public Builder rule(DesignRule rule) {
            rules.add(rule);
            return this;
        }

        public Builder width(String name, String layer, double valueUm) {
            return rule(DesignRule.width(name, null, requireLayer(layer), valueUm));
        }

        public Builder spacing(String name, String layer, double valueUm) {
            return rule(DesignRule.spacing(name, null, requireLayer(layer), valueUm));
        }

        public Builder enclosure(String name, String inner, String outer, double valueUm) {
            return rule(DesignRule.enclosure(name, null, requireLayer(inner), requireLayer(outer), valueUm));
        }

        /** Stores a length given in micrometres, converted to grid units. */
        public Builder lengthUm(TechConstant constant, double valueUm) {
            lengthsScaled = true;
            return constant(constant, valueUm * 1000.0 / gridNm);
        }

        public Builder constant(TechConstant constant, double value) {
            constants.put(constant, value);
            return this;
        }

        public Layer requireLayer(String name) {
            Layer layer = layers.get(name);
            if (layer == null) {
                throw new IllegalArgumentException("Layer " + name + " must be declared before it is used");
            }
            return layer;
        }

        public RuleSet build() {
            return new RuleSet(this);
        }
    }
}

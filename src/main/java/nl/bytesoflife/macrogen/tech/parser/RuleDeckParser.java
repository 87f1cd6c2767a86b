package nl.bytesoflife.macrogen.tech.parser;

import nl.bytesoflife.macrogen.tech.DesignRule;
import nl.bytesoflife.macrogen.tech.Layer;
import nl.bytesoflife.macrogen.tech.RuleKind;
import nl.bytesoflife.macrogen.tech.RuleSet;
import nl.bytesoflife.macrogen.tech.TechConstant;

import java.util.List;

/**
 * Builds a {@link RuleSet} from an s-expression rule deck.
 *
 * <pre>
 * (technology sg13g2)
 * (grid 1nm)
 * (layer Activ 1 0)
 * (rule Act.a (description "Min Activ width") (width Activ) (min 0.15um))
 * (rule Cnt.c (enclosure Cont Activ) (min 0.07um))
 * (constant contact_size 0.16um)
 * </pre>
 *
 * The grid and every layer must be declared before the rules and constants that use them.
 */
public class RuleDeckParser {

    public RuleSet parse(String content) {
        List<SNode> nodes = new SExpressionParser().parse(content);
        return buildRuleSet(nodes);
    }

    private RuleSet buildRuleSet(List<SNode> nodes) {
        String technology = nodes.stream()
                .filter(SNode.SList.class::isInstance)
                .map(SNode.SList.class::cast)
                .filter(l -> "technology".equals(l.tag()))
                .map(l -> l.atom(1))
                .findFirst()
                .orElse("unnamed");
        RuleSet.Builder builder = RuleSet.builder(technology);

        for (SNode node : nodes) {
            if (!(node instanceof SNode.SList list)) continue;
            switch (list.tag()) {
                case "technology" -> { }
                case "grid" -> builder.grid((int) Math.round(parseValueUm(list.atom(1)) * 1000.0));
                case "layer" -> builder.layer(list.atom(1),
                        parseInt(list.atom(2), list), parseInt(list.atom(3), list));
                case "rule" -> builder.rule(parseRule(list, builder));
                case "constant" -> parseConstant(list, builder);
                default -> throw new IllegalArgumentException("Unknown rule deck entry: " + list);
            }
        }

        return builder.build();
    }

    private DesignRule parseRule(SNode.SList list, RuleSet.Builder builder) {
        String name = list.atom(1);
        String description = null;
        RuleKind kind = null;
        Layer layer = null;
        Layer outer = null;
        Double valueUm = null;

        for (SNode.SList child : list.lists()) {
            String tag = child.tag();
            switch (tag) {
                case "description" -> description = child.atom(1);
                case "min" -> valueUm = parseValueUm(child.atom(1));
                default -> {
                    kind = RuleKind.fromDeckName(tag);
                    layer = builder.requireLayer(child.atom(1));
                    if (kind.isPaired()) {
                        outer = builder.requireLayer(child.atom(2));
                    }
                }
            }
        }

        if (kind == null) {
            throw new IllegalArgumentException("Rule " + name + " has no width, spacing or enclosure clause");
        }
        if (valueUm == null) {
            throw new IllegalArgumentException("Rule " + name + " has no (min ...) value");
        }
        return switch (kind) {
            case WIDTH -> DesignRule.width(name, description, layer, valueUm);
            case SPACING -> DesignRule.spacing(name, description, layer, valueUm);
            case ENCLOSURE -> DesignRule.enclosure(name, description, layer, outer, valueUm);
        };
    }

    private void parseConstant(SNode.SList list, RuleSet.Builder builder) {
        TechConstant constant = TechConstant.fromDeckName(list.atom(1));
        String value = list.atom(2);
        if (constant.isLength()) {
            builder.lengthUm(constant, parseValueUm(value));
        } else {
            builder.constant(constant, Double.parseDouble(value));
        }
    }

    /** Parses a length with an optional {@code um} or {@code nm} suffix; bare numbers are micrometres. */
    static double parseValueUm(String value) {
        if (value.endsWith("um")) {
            return Double.parseDouble(value.substring(0, value.length() - 2));
        } else if (value.endsWith("nm")) {
            return Double.parseDouble(value.substring(0, value.length() - 2)) / 1000.0;
        }
        return Double.parseDouble(value);
    }

    private static int parseInt(String value, SNode.SList context) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected an integer in " + context, e);
        }
    }
}

package nl.bytesoflife.macrogen.primitive;

/**
 * A builder parameter that cannot be realised without breaking a design rule or a
 * physical constraint. Builders never clamp: they throw this instead.
 */
public class InvalidParameterException extends IllegalArgumentException {

    private final String rule;

    public InvalidParameterException(String rule, String message) {
        super(message + " [" + rule + "]");
        this.rule = rule;
    }

    /** Name of the rule or parameter that would be violated. */
    public String getRule() {
        return rule;
    }
}

package nl.bytesoflife.macrogen.block;

/**
 * A net or connection point was referenced that no sub-block produced. This is a construction
 * error in the generator, not a rule violation in the generated layout.
 */
public class MissingConnectionException extends IllegalStateException {

    private final String net;

    public MissingConnectionException(String net, String message) {
        super(message);
        this.net = net;
    }

    public String getNet() {
        return net;
    }
}

package nl.bytesoflife.macrogen.gds;

import java.io.IOException;

/** A layout stream that is truncated, malformed, or uses constructs this reader does not support. */
public class GdsFormatException extends IOException {

    public GdsFormatException(String message) {
        super(message);
    }
}

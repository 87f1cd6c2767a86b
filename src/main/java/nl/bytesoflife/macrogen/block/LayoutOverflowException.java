package nl.bytesoflife.macrogen.block;

/** Placement does not fit inside the requested macro outline. */
public class LayoutOverflowException extends IllegalStateException {

    public LayoutOverflowException(String message) {
        super(message);
    }
}

package nl.bytesoflife.macrogen.tech;

/**
 * A mask layer identified by its stream layer number and datatype.
 * <p>
 * Drawing layers use datatype 0. Pin shapes and their text labels live on the same layer
 * number with the pin and label datatypes.
 */
public record Layer(String name, int number, int datatype) {

    public static final int PIN_DATATYPE = 2;
    public static final int LABEL_DATATYPE = 25;

    public Layer pin() {
        return new Layer(name + ".pin", number, PIN_DATATYPE);
    }

    public Layer label() {
        return new Layer(name + ".label", number, LABEL_DATATYPE);
    }

    @Override
    public String toString() {
        return name + " (" + number + "/" + datatype + ")";
    }
}

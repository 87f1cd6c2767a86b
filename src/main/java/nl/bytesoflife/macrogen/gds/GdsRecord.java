package nl.bytesoflife.macrogen.gds;

/**
 * Record and data type codes of the GDSII stream format, plus the excess-64 real encoding.
 */
final class GdsRecord {

    static final int HEADER = 0x00;
    static final int BGNLIB = 0x01;
    static final int LIBNAME = 0x02;
    static final int UNITS = 0x03;
    static final int ENDLIB = 0x04;
    static final int BGNSTR = 0x05;
    static final int STRNAME = 0x06;
    static final int ENDSTR = 0x07;
    static final int BOUNDARY = 0x08;
    static final int PATH = 0x09;
    static final int SREF = 0x0A;
    static final int AREF = 0x0B;
    static final int TEXT = 0x0C;
    static final int LAYER = 0x0D;
    static final int DATATYPE = 0x0E;
    static final int XY = 0x10;
    static final int ENDEL = 0x11;
    static final int SNAME = 0x12;
    static final int TEXTTYPE = 0x16;
    static final int STRING = 0x19;
    static final int BOX = 0x2D;
    static final int BOXTYPE = 0x2E;

    static final int NO_DATA = 0;
    static final int INT2 = 2;
    static final int INT4 = 3;
    static final int REAL8 = 5;
    static final int ASCII = 6;

    static final int STREAM_VERSION = 600;

    private static final double TWO_POW_56 = 72057594037927936.0;

    private GdsRecord() {
    }

    static long toReal8(double value) {
        if (value == 0) return 0L;
        long sign = value < 0 ? Long.MIN_VALUE : 0L;
        double v = Math.abs(value);
        int exponent = 64;
        while (v >= 1.0) {
            v /= 16.0;
            exponent++;
        }
        while (v < 0.0625) {
            v *= 16.0;
            exponent--;
        }
        long mantissa = Math.round(v * TWO_POW_56);
        if (mantissa >= (1L << 56)) {
            mantissa >>>= 4;
            exponent++;
        }
        if (exponent < 0 || exponent > 127) {
            throw new IllegalArgumentException("Value out of GDS real range: " + value);
        }
        return sign | ((long) exponent << 56) | mantissa;
    }

    static double fromReal8(long bits) {
        int exponent = (int) ((bits >>> 56) & 0x7F);
        long mantissa = bits & 0x00FF_FFFF_FFFF_FFFFL;
        double value = mantissa / TWO_POW_56 * Math.pow(16.0, exponent - 64);
        return bits < 0 ? -value : value;
    }
}

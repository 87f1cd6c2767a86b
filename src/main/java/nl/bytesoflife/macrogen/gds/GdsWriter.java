package nl.bytesoflife.macrogen.gds;

import nl.bytesoflife.macrogen.geometry.Cell;
import nl.bytesoflife.macrogen.geometry.Label;
import nl.bytesoflife.macrogen.geometry.Rect;
import nl.bytesoflife.macrogen.tech.Layer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;

/**
 * Writes a flat cell as a single-structure GDSII stream: one BOUNDARY per rectangle
 * and one TEXT per label. Coordinates are written in grid units.
 */
public class GdsWriter {

    private static final Logger log = LoggerFactory.getLogger(GdsWriter.class);

    private final int gridNm;
    private final LocalDateTime timestamp;

    public GdsWriter(int gridNm) {
        this(gridNm, LocalDateTime.now());
    }

    public GdsWriter(int gridNm, LocalDateTime timestamp) {
        this.gridNm = gridNm;
        this.timestamp = timestamp;
    }

    public void write(Cell cell, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream os = new BufferedOutputStream(Files.newOutputStream(file))) {
            write(cell, os);
        }
        log.debug("Wrote {} ({} rectangles, {} labels) to {}", cell.getName(), cell.rectCount(),
                cell.getLabels().size(), file);
    }

    public void write(Cell cell, OutputStream out) throws IOException {
        DataOutputStream os = new DataOutputStream(out);

        writeInt2(os, GdsRecord.HEADER, GdsRecord.STREAM_VERSION);
        writeInt2(os, GdsRecord.BGNLIB, dateFields());
        writeString(os, GdsRecord.LIBNAME, cell.getName() + ".DB");
        double userUnitsPerDbUnit = gridNm * 1e-3;
        double metresPerDbUnit = gridNm * 1e-9;
        writeRecordHeader(os, GdsRecord.UNITS, GdsRecord.REAL8, 16);
        os.writeLong(GdsRecord.toReal8(userUnitsPerDbUnit));
        os.writeLong(GdsRecord.toReal8(metresPerDbUnit));

        writeInt2(os, GdsRecord.BGNSTR, dateFields());
        writeString(os, GdsRecord.STRNAME, cell.getName());

        for (Layer layer : cell.getLayers()) {
            for (Rect rect : cell.getRects(layer)) {
                writeBoundary(os, layer, rect);
            }
        }
        for (Label label : cell.getLabels()) {
            writeText(os, label);
        }

        writeRecordHeader(os, GdsRecord.ENDSTR, GdsRecord.NO_DATA, 0);
        writeRecordHeader(os, GdsRecord.ENDLIB, GdsRecord.NO_DATA, 0);
        os.flush();
    }

    private void writeBoundary(DataOutputStream os, Layer layer, Rect r) throws IOException {
        writeRecordHeader(os, GdsRecord.BOUNDARY, GdsRecord.NO_DATA, 0);
        writeInt2(os, GdsRecord.LAYER, layer.number());
        writeInt2(os, GdsRecord.DATATYPE, layer.datatype());
        writeRecordHeader(os, GdsRecord.XY, GdsRecord.INT4, 5 * 8);
        int[] xs = {r.x1(), r.x2(), r.x2(), r.x1(), r.x1()};
        int[] ys = {r.y1(), r.y1(), r.y2(), r.y2(), r.y1()};
        for (int i = 0; i < 5; i++) {
            os.writeInt(xs[i]);
            os.writeInt(ys[i]);
        }
        writeRecordHeader(os, GdsRecord.ENDEL, GdsRecord.NO_DATA, 0);
    }

    private void writeText(DataOutputStream os, Label label) throws IOException {
        writeRecordHeader(os, GdsRecord.TEXT, GdsRecord.NO_DATA, 0);
        writeInt2(os, GdsRecord.LAYER, label.layer().number());
        writeInt2(os, GdsRecord.TEXTTYPE, label.layer().datatype());
        writeRecordHeader(os, GdsRecord.XY, GdsRecord.INT4, 8);
        os.writeInt(label.position().x());
        os.writeInt(label.position().y());
        writeString(os, GdsRecord.STRING, label.text());
        writeRecordHeader(os, GdsRecord.ENDEL, GdsRecord.NO_DATA, 0);
    }

    private int[] dateFields() {
        int[] one = {timestamp.getYear(), timestamp.getMonthValue(), timestamp.getDayOfMonth(),
                timestamp.getHour(), timestamp.getMinute(), timestamp.getSecond()};
        int[] both = new int[12];
        System.arraycopy(one, 0, both, 0, 6);
        System.arraycopy(one, 0, both, 6, 6);
        return both;
    }

    private static void writeInt2(DataOutputStream os, int recordType, int... values) throws IOException {
        writeRecordHeader(os, recordType, GdsRecord.INT2, values.length * 2);
        for (int value : values) {
            os.writeShort(value);
        }
    }

    private static void writeString(DataOutputStream os, int recordType, String value) throws IOException {
        byte[] bytes = value.getBytes(StandardCharsets.US_ASCII);
        int padded = bytes.length + (bytes.length % 2);
        writeRecordHeader(os, recordType, GdsRecord.ASCII, padded);
        os.write(bytes);
        if (padded != bytes.length) {
            os.writeByte(0);
        }
    }

    private static void writeRecordHeader(DataOutputStream os, int recordType, int dataType, int payload)
            throws IOException {
        int length = payload + 4;
        if (length > 0xFFFF) {
            throw new IOException("GDS record too long: " + length + " bytes");
        }
        os.writeShort(length);
        os.writeByte(recordType);
        os.writeByte(dataType);
    }
}

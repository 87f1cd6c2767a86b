package nl.bytesoflife.macrogen.gds;

import nl.bytesoflife.macrogen.geometry.Cell;
import nl.bytesoflife.macrogen.geometry.Label;
import nl.bytesoflife.macrogen.geometry.Point;
import nl.bytesoflife.macrogen.geometry.Rect;
import nl.bytesoflife.macrogen.tech.Layer;
import nl.bytesoflife.macrogen.tech.RuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads one flat cell from a GDSII stream.
 * <p>
 * Boundaries and boxes must be axis-aligned rectangles; paths and cell references are rejected,
 * since the checker works on flat rectangle geometry only. Layer numbers are resolved against
 * the rule set so that rectangles land on the same {@link Layer}s the builders use.
 */
public class GdsReader {

    private static final Logger log = LoggerFactory.getLogger(GdsReader.class);

    private final RuleSet ruleSet;

    public GdsReader(RuleSet ruleSet) {
        this.ruleSet = ruleSet;
    }

    /**
     * Reads the named cell, or the top cell when {@code cellName} is {@code null}.
     */
    public Cell read(Path file, String cellName) throws IOException {
        try (InputStream is = new BufferedInputStream(Files.newInputStream(file))) {
            Cell cell = read(is, cellName);
            log.debug("Read {} ({} rectangles) from {}", cell.getName(), cell.rectCount(), file);
            return cell;
        }
    }

    public Cell read(InputStream in, String cellName) throws IOException {
        DataInputStream is = new DataInputStream(in);
        Map<String, Structure> structures = new LinkedHashMap<>();
        Set<String> referenced = new HashSet<>();
        Structure current = null;
        Element element = null;
        boolean unitsSeen = false;

        while (true) {
            RecordData record = readRecord(is);
            switch (record.type) {
                case GdsRecord.UNITS -> {
                    checkUnits(record);
                    unitsSeen = true;
                }
                case GdsRecord.BGNSTR -> current = new Structure();
                case GdsRecord.STRNAME -> {
                    requireStructure(current, record);
                    current.name = record.string();
                    structures.put(current.name, current);
                }
                case GdsRecord.ENDSTR -> current = null;
                case GdsRecord.BOUNDARY, GdsRecord.BOX, GdsRecord.TEXT, GdsRecord.PATH,
                     GdsRecord.SREF, GdsRecord.AREF -> {
                    requireStructure(current, record);
                    element = new Element(record.type);
                }
                case GdsRecord.LAYER -> requireElement(element, record).layer = record.int2(0);
                case GdsRecord.DATATYPE, GdsRecord.TEXTTYPE, GdsRecord.BOXTYPE ->
                        requireElement(element, record).datatype = record.int2(0);
                case GdsRecord.XY -> requireElement(element, record).xy = record.int4s();
                case GdsRecord.STRING -> requireElement(element, record).text = record.string();
                case GdsRecord.SNAME -> {
                    requireElement(element, record).text = record.string();
                    referenced.add(record.string());
                }
                case GdsRecord.ENDEL -> {
                    requireStructure(current, record);
                    current.elements.add(requireElement(element, record));
                    element = null;
                }
                case GdsRecord.ENDLIB -> {
                    if (!unitsSeen) throw new GdsFormatException("Stream has no UNITS record");
                    return toCell(selectStructure(structures, referenced, cellName));
                }
                default -> {
                    // HEADER, BGNLIB, LIBNAME and element properties carry nothing we need
                }
            }
        }
    }

    private Structure selectStructure(Map<String, Structure> structures, Set<String> referenced, String cellName)
            throws GdsFormatException {
        if (structures.isEmpty()) {
            throw new GdsFormatException("Stream contains no cells");
        }
        if (cellName != null) {
            Structure s = structures.get(cellName);
            if (s == null) {
                throw new GdsFormatException("Cell '" + cellName + "' not found; available: " + structures.keySet());
            }
            return s;
        }
        List<Structure> tops = structures.values().stream()
                .filter(s -> !referenced.contains(s.name))
                .toList();
        if (tops.size() != 1) {
            throw new GdsFormatException("Cannot pick a top cell among " + tops.stream().map(s -> s.name).toList());
        }
        return tops.get(0);
    }

    private Cell toCell(Structure structure) throws GdsFormatException {
        Cell cell = new Cell(structure.name);
        for (Element e : structure.elements) {
            switch (e.type) {
                case GdsRecord.BOUNDARY, GdsRecord.BOX ->
                        cell.add(ruleSet.layer(e.layer, e.datatype), toRect(e, structure.name));
                case GdsRecord.TEXT -> {
                    if (e.xy == null || e.xy.length < 2 || e.text == null) {
                        throw new GdsFormatException("Incomplete TEXT element in " + structure.name);
                    }
                    cell.addLabel(new Label(ruleSet.layer(e.layer, e.datatype), e.text, new Point(e.xy[0], e.xy[1])));
                }
                case GdsRecord.PATH -> throw new GdsFormatException(
                        "PATH elements are not supported (cell " + structure.name + ")");
                default -> throw new GdsFormatException(
                        "Cell " + structure.name + " references " + e.text + "; hierarchical layouts are not supported");
            }
        }
        return cell;
    }

    private static Rect toRect(Element e, String cellName) throws GdsFormatException {
        int[] xy = e.xy;
        if (xy == null || xy.length != 10 || xy[0] != xy[8] || xy[1] != xy[9]) {
            throw new GdsFormatException("Only closed four-corner boundaries are supported (cell " + cellName + ")");
        }
        int minX = Integer.MAX_VALUE, minY = Integer.MAX_VALUE, maxX = Integer.MIN_VALUE, maxY = Integer.MIN_VALUE;
        for (int i = 0; i < 8; i += 2) {
            minX = Math.min(minX, xy[i]);
            maxX = Math.max(maxX, xy[i]);
            minY = Math.min(minY, xy[i + 1]);
            maxY = Math.max(maxY, xy[i + 1]);
        }
        for (int i = 0; i < 8; i += 2) {
            boolean onX = xy[i] == minX || xy[i] == maxX;
            boolean onY = xy[i + 1] == minY || xy[i + 1] == maxY;
            boolean axisAligned = xy[i] == xy[i + 2] || xy[i + 1] == xy[i + 3];
            if (!onX || !onY || !axisAligned) {
                throw new GdsFormatException("Non-rectangular boundary in cell " + cellName);
            }
        }
        if (minX == maxX || minY == maxY) {
            throw new GdsFormatException("Zero-area boundary in cell " + cellName);
        }
        return new Rect(minX, minY, maxX, maxY);
    }

    private void checkUnits(RecordData record) throws GdsFormatException {
        double metresPerDbUnit = GdsRecord.fromReal8(record.long8(1));
        double expected = ruleSet.getGridNm() * 1e-9;
        if (Math.abs(metresPerDbUnit - expected) > expected * 1e-6) {
            throw new GdsFormatException("Database unit " + metresPerDbUnit + " m does not match the "
                    + ruleSet.getGridNm() + " nm grid of " + ruleSet.getTechnology());
        }
    }

    private static void requireStructure(Structure current, RecordData record) throws GdsFormatException {
        if (current == null) {
            throw new GdsFormatException(String.format("Record 0x%02X outside of a cell", record.type));
        }
    }

    private static Element requireElement(Element element, RecordData record) throws GdsFormatException {
        if (element == null) {
            throw new GdsFormatException(String.format("Record 0x%02X outside of an element", record.type));
        }
        return element;
    }

    private static RecordData readRecord(DataInputStream is) throws IOException {
        int length;
        int type;
        try {
            length = is.readUnsignedShort();
            type = is.readUnsignedByte();
            is.readUnsignedByte();
        } catch (EOFException e) {
            throw new GdsFormatException("Unexpected end of stream before ENDLIB");
        }
        if (length < 4) {
            throw new GdsFormatException("Invalid record length " + length);
        }
        byte[] payload = new byte[length - 4];
        try {
            is.readFully(payload);
        } catch (EOFException e) {
            throw new GdsFormatException(String.format("Truncated record 0x%02X", type));
        }
        return new RecordData(type, payload);
    }

    private record RecordData(int type, byte[] payload) {

        int int2(int index) throws GdsFormatException {
            int at = index * 2;
            if (at + 2 > payload.length) throw new GdsFormatException("Short INT2 record");
            return (short) (((payload[at] & 0xFF) << 8) | (payload[at + 1] & 0xFF));
        }

        int[] int4s() {
            int[] values = new int[payload.length / 4];
            for (int i = 0; i < values.length; i++) {
                int at = i * 4;
                values[i] = ((payload[at] & 0xFF) << 24) | ((payload[at + 1] & 0xFF) << 16)
                        | ((payload[at + 2] & 0xFF) << 8) | (payload[at + 3] & 0xFF);
            }
            return values;
        }

        long long8(int index) throws GdsFormatException {
            int at = index * 8;
            if (at + 8 > payload.length) throw new GdsFormatException("Short REAL8 record");
            long value = 0;
            for (int i = 0; i < 8; i++) {
                value = (value << 8) | (payload[at + i] & 0xFF);
            }
            return value;
        }

        String string() {
            int end = payload.length;
            while (end > 0 && payload[end - 1] == 0) end--;
            return new String(payload, 0, end, StandardCharsets.US_ASCII);
        }
    }

    private static final class Structure {
        String name;
        final List<Element> elements = new ArrayList<>();
    }

    private static final class Element {
        final int type;
        int layer;
        int datatype;
        int[] xy;
        String text;

        Element(int type) {
            this.type = type;
        }
    }
}

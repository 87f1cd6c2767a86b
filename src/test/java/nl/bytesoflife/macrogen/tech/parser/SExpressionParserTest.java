package nl.bytesoflife.macrogen.tech.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SExpressionParserTest {

    private final SExpressionParser parser = new SExpressionParser();

    @Test
    void parseSimpleList() {
        List<SNode> nodes = parser.parse("(grid 1nm)");
        assertEquals(1, nodes.size());
        assertInstanceOf(SNode.SList.class, nodes.get(0));
        SNode.SList list = (SNode.SList) nodes.get(0);
        assertEquals(2, list.size());
        assertEquals("grid", list.tag());
        assertEquals("1nm", list.atom(1));
    }

    @Test
    void parseNestedLists() {
        List<SNode> nodes = parser.parse("(rule M1.a (width Metal1) (min 0.16um))");
        SNode.SList list = (SNode.SList) nodes.get(0);
        assertEquals(4, list.size());
        assertEquals(2, list.lists().size());
        assertEquals("width", list.lists().get(0).tag());
        assertEquals("Metal1", list.lists().get(0).atom(1));
    }

    @Test
    void parseQuotedString() {
        List<SNode> nodes = parser.parse("(description \"Min Metal1 width\")");
        SNode.SList list = (SNode.SList) nodes.get(0);
        assertEquals("Min Metal1 width", list.atom(1));
    }

    @Test
    void skipComments() {
        String input = """
                # layers
                (layer Activ 1 0)
                # rules
                (layer Metal1 8 0)
                """;
        assertEquals(2, parser.parse(input).size());
    }

    @Test
    void parseEmptyInput() {
        assertTrue(parser.parse("").isEmpty());
        assertTrue(parser.parse("   \n\n  # comment only\n  ").isEmpty());
    }

    @Test
    void unbalancedParenthesesReportLine() {
        SExpressionParser.ParseException e = assertThrows(SExpressionParser.ParseException.class,
                () -> parser.parse("(layer Activ 1 0)\n(layer Metal1 8 0"));
        assertEquals(2, e.getLine());
    }

    @Test
    void atomAtListIndexMustBeAtom() {
        SNode.SList list = (SNode.SList) parser.parse("(rule (min 1))").get(0);
        assertThrows(IllegalArgumentException.class, () -> list.atom(1));
    }
}

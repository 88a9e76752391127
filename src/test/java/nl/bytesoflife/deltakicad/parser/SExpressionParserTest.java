package nl.bytesoflife.deltakicad.parser;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SExpressionParserTest {

    private final SExpressionParser parser = new SExpressionParser();

    @Test
    void parseNestedLists() {
        SNode.SList root = parser.parseDocument("(kicad_sch (version 20231120) (paper \"A4\"))");
        assertEquals("kicad_sch", root.tag());
        assertEquals(3, root.size());
        assertEquals(20231120, root.first("version").orElseThrow().number(1, 0), 0.0);
        assertEquals("A4", root.first("paper").orElseThrow().atomValue(1));
    }

    @Test
    void classifyAtoms() {
        SNode.SList list = parser.parseDocument("(at -2.54 1e3 .5 yes \"12\")");
        assertTrue(((SNode.SAtom) list.get(1)).isNumber());
        assertTrue(((SNode.SAtom) list.get(2)).isNumber());
        assertTrue(((SNode.SAtom) list.get(3)).isNumber());
        assertFalse(((SNode.SAtom) list.get(4)).isNumber());
        assertTrue(((SNode.SAtom) list.get(5)).isString());
        assertEquals("12", list.atomValue(5));
    }

    @Test
    void quotedStringsKeepParenthesesAndEscapes() {
        SNode.SList list = parser.parseDocument("(property \"Note\" \"a (b) \\\"c\\\" d\\\\e\")");
        assertEquals("a (b) \"c\" d\\e", list.atomValue(2));
        assertEquals(3, list.size());
    }

    @Test
    void parseMultipleTopLevelForms() {
        SNode.SList forms = parser.parse("(a 1)\n(b 2)\n");
        assertEquals(2, forms.size());
        assertEquals("b", forms.lists().get(1).tag());
    }

    @Test
    void rejectUnclosedList() {
        MalformedDocumentException e = assertThrows(MalformedDocumentException.class,
                () -> parser.parse("(kicad_sch (version 1)"));
        assertEquals(0, e.getPosition());
    }

    @Test
    void rejectStrayClosingParenthesis() {
        MalformedDocumentException e = assertThrows(MalformedDocumentException.class, () -> parser.parse("(a))"));
        assertEquals(3, e.getPosition());
    }

    @Test
    void rejectUnterminatedString() {
        assertThrows(MalformedDocumentException.class, () -> parser.parse("(title \"open)"));
    }

    @Test
    void documentMustStartWithList() {
        assertThrows(MalformedDocumentException.class, () -> parser.parseDocument("version 1"));
        assertThrows(MalformedDocumentException.class, () -> parser.parseDocument("   "));
    }

    @Test
    void writtenTreeParsesBackEqual() throws IOException {
        SNode.SList original = parser.parseDocument(Files.readString(Path.of("testdata/schematics/divider.kicad_sch")));
        String written = SExpressionWriter.write(original);
        assertEquals(original, parser.parseDocument(written));
    }

    @Test
    void quoteAndUnquoteAreInverse() {
        String value = "say \"hi\"\n\\ok";
        assertEquals(value, SExpressionWriter.unquote(SExpressionWriter.quote(value)));
        assertEquals("bare", SExpressionWriter.unquote("bare"));
    }
}

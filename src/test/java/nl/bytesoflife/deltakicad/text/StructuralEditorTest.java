package nl.bytesoflife.deltakicad.text;

import nl.bytesoflife.deltakicad.NotFoundException;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class StructuralEditorTest {

    private static final UUID FIXED = UUID.fromString("00000000-0000-4000-8000-000000000001");

    private final StructuralEditor editor = new StructuralEditor(() -> FIXED);

    @Test
    void insertBeforeEndKeepsEverythingElse() {
        String text = "(kicad_sch\n  (version 1)\n)\n";
        String result = editor.insertBeforeEnd(text, "  (wire)");
        assertEquals("(kicad_sch\n  (version 1)\n  (wire)\n)\n", result);
    }

    @Test
    void insertBeforeEndOnSingleLineDocument() {
        assertEquals("(a (b)\n(c)\n)", editor.insertBeforeEnd("(a (b))", "(c)"));
    }

    @Test
    void insertIntoBlockAddsLastChild() {
        String text = "(root\n  (lib_symbols\n    (symbol \"A\")\n  )\n)\n";
        Span section = BlockFinder.findSection(text, "lib_symbols").orElseThrow();
        String result = editor.insertIntoBlock(text, section, "    (symbol \"B\")");
        assertEquals("(root\n  (lib_symbols\n    (symbol \"A\")\n    (symbol \"B\")\n  )\n)\n", result);
    }

    @Test
    void insertsFollowCrlfLineEndings() {
        String text = "(root\r\n  (lib_symbols\r\n    (symbol \"A\")\r\n  )\r\n)\r\n";
        Span section = BlockFinder.findSection(text, "lib_symbols").orElseThrow();
        String result = editor.insertIntoBlock(text, section, "    (symbol \"B\"\n      (pin 1)\n    )");
        result = editor.insertBeforeEnd(result, "  (wire\n    (pts)\n  )\n");

        assertEquals("(root\r\n  (lib_symbols\r\n    (symbol \"A\")\r\n    (symbol \"B\"\r\n      (pin 1)\r\n    )\r\n  )\r\n"
                + "  (wire\r\n    (pts)\r\n  )\r\n)\r\n", result);
        assertFalse(result.replace("\r\n", "").contains("\n"));
    }

    @Test
    void lfDocumentsStayLf() {
        assertEquals("(a\n  (b)\n)", editor.insertAt("(a\n)", 3, "  (b)\r\n"));
    }

    @Test
    void replaceTouchesOnlySpan() {
        String text = "(a (at 1 2) (b \"x\"))";
        Span at = BlockFinder.child(text, new Span(0, text.length()), "at").orElseThrow();
        assertEquals("(a (at 3 4) (b \"x\"))", editor.replace(text, at, "(at 3 4)"));
    }

    @Test
    void deleteRemovesWholeLines() {
        String text = "(root\n  (keep 1)\n  (drop\n    (x 1)\n  )\n  (keep 2)\n)\n";
        Span drop = BlockFinder.findSection(text, "drop").orElseThrow();
        assertEquals("(root\n  (keep 1)\n  (keep 2)\n)\n", editor.delete(text, drop));
    }

    @Test
    void deleteCollapsesBlankLines() {
        String text = "(root\n  (keep 1)\n\n  (drop)\n\n  (keep 2)\n)\n";
        Span drop = BlockFinder.findSection(text, "drop").orElseThrow();
        String result = editor.delete(text, drop);
        assertFalse(result.contains("\n\n\n"));
        assertEquals("(root\n  (keep 1)\n\n  (keep 2)\n)\n", result);
    }

    @Test
    void deleteInlineBlock() {
        String text = "(a (b) (c))";
        Span b = BlockFinder.findSection(text, "b").orElseThrow();
        assertEquals("(a  (c))", editor.delete(text, b));
    }

    @Test
    void deleteMissingTargetFails() {
        NotFoundException e = assertThrows(NotFoundException.class,
                () -> editor.delete("(a)", Optional.empty(), "Wire"));
        assertEquals("Wire", e.getTarget());
    }

    @Test
    void relocateMovesPropertiesAndRenewsIdentifier() {
        String block = "(symbol (lib_id \"Device:R\") (at 10 20 0)\n"
                + "    (uuid \"old\")\n"
                + "    (property \"Reference\" \"R1\" (at 12 19 0))\n"
                + "    (property \"Value\" \"10k\" (at 12 21 90)))";
        String moved = editor.relocate(block, 15, 30, 90.0, true);
        assertTrue(moved.contains("(at 15 30 90)"));
        assertTrue(moved.contains("(at 17 29 0)"));
        assertTrue(moved.contains("(at 17 31 90)"));
        assertTrue(moved.contains("(uuid \"" + FIXED + "\")"));
        assertFalse(moved.contains("\"old\""));
    }

    @Test
    void relocateKeepsRotationWhenNotGiven() {
        String moved = editor.relocate("(footprint \"X\" (at 1 2 180) (uuid \"u\"))", 5, 6, null, false);
        assertTrue(moved.contains("(at 5 6 180)"));
    }

    @Test
    void relocateNeedsPosition() {
        assertThrows(NotFoundException.class, () -> editor.relocate("(wire (uuid \"u\"))", 1, 1, null, true));
    }

    @Test
    void nextNumberScansCurrentText() {
        Pattern power = Pattern.compile("\"#PWR(\\d+)\"");
        assertEquals(1, StructuralEditor.nextNumber("(kicad_sch)", power));
        assertEquals(8, StructuralEditor.nextNumber("(p \"#PWR02\") (p \"#PWR007\")", power));
    }

    @Test
    void reindentRebasesContinuationLines() {
        String block = "(symbol \"R\"\n\t\t(pin)\n\t)";
        assertEquals("(symbol \"R\"\n    \t(pin)\n    )", StructuralEditor.reindent(block, "\t", "    "));
        assertEquals("\t\t", StructuralEditor.nested("\t"));
        assertEquals("    ", StructuralEditor.nested("  "));
    }

    @Test
    void coordinatesRenderCompactly() {
        assertEquals("48.73", CoordinateFormat.format(48.73));
        assertEquals("100", CoordinateFormat.format(100.0));
        assertEquals("0", CoordinateFormat.format(-0.0));
        assertEquals("-2.54", CoordinateFormat.format(-2.54));
        assertEquals("1.2346", CoordinateFormat.format(1.23456));
    }
}

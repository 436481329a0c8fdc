package org.dxworks.codemod.generate;

import org.dxworks.codemod.model.ErrorKind;
import org.dxworks.codemod.request.TextPatch;
import org.junit.jupiter.api.Test;

import static org.dxworks.codemod.TestUtils.lines;
import static org.junit.jupiter.api.Assertions.*;

public class TextPatcherTest {

    private static final String SOURCE = lines(
            "const a = 1;",
            "const b = 2;",
            "const c = 3;");

    @Test
    void replaceAllReplacesEveryOccurrence() {
        assertEquals(lines("let a = 1;", "let b = 2;", "let c = 3;"),
                TextPatcher.replaceAll(SOURCE, "const ", "let "));
    }

    @Test
    void replaceAllTreatsSearchTextLiterally() {
        assertEquals("a.b(x)", TextPatcher.replaceAll("a.b(*)", "(*)", "(x)"));
    }

    @Test
    void missingSearchTextIsReported() {
        TextNotFoundException e = assertThrows(TextNotFoundException.class,
                () -> TextPatcher.replaceAll(SOURCE, "const d", "let d"));

        assertEquals(ErrorKind.TEXT_NOT_FOUND, e.getKind());
        assertTrue(e.getMessage().contains("const d"));
    }

    @Test
    void emptySearchTextIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> TextPatcher.replaceAll(SOURCE, "", "x"));
    }

    @Test
    void insertAfterAddsLineBelowFirstMatch() {
        assertEquals(lines("const a = 1;", "const b = 2;", "// after b", "const c = 3;"),
                TextPatcher.insertAfter(SOURCE, "b = 2", "// after b"));
    }

    @Test
    void insertAfterLastLineWithoutNewline() {
        assertEquals("x\ny\n", TextPatcher.insertAfter("x", "x", "y"));
    }

    @Test
    void insertBeforeAddsLineAboveFirstMatch() {
        assertEquals(lines("const a = 1;", "// before b", "const b = 2;", "const c = 3;"),
                TextPatcher.insertBefore(SOURCE, "b = 2", "// before b\n"));
    }

    @Test
    void deleteLineRemovesWholeLine() {
        assertEquals(lines("const a = 1;", "const c = 3;"), TextPatcher.deleteLine(SOURCE, "b = 2"));
    }

    @Test
    void appendAddsSeparatorOnlyWhenNeeded() {
        assertEquals("x\ny", TextPatcher.append("x", "y"));
        assertEquals("x\ny", TextPatcher.append("x\n", "y"));
    }

    @Test
    void applyDispatchesOnKind() {
        assertEquals(lines("const a = 1;", "const c = 3;"), TextPatcher.apply(SOURCE, TextPatch.deleteLine("const b")));
        assertEquals(SOURCE + "// end", TextPatcher.apply(SOURCE, TextPatch.append("// end")));
    }
}

package org.dxworks.codemod;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class CodemodConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileGivesDefaults() {
        CodemodConfig config = CodemodConfig.load(tempDir.resolve("codemod-config.yml"));

        assertEquals("  ", config.getIndentation());
        assertEquals(Dialect.JAVASCRIPT, config.getDialect());
        assertTrue(config.isValidateOutput());
        assertEquals("react", config.getHookSource());
        assertEquals(20000, config.getMaxFileLines());
    }

    @Test
    void readsAllSettings() throws IOException {
        Path file = tempDir.resolve("codemod-config.yml");
        Files.writeString(file, TestUtils.lines(
                "indentation: \"    \"",
                "dialect: typescript",
                "validateOutput: false",
                "hookSource: preact/hooks",
                "maxFileLines: 500"));

        CodemodConfig config = CodemodConfig.load(file);

        assertEquals("    ", config.getIndentation());
        assertEquals(Dialect.TYPESCRIPT, config.getDialect());
        assertFalse(config.isValidateOutput());
        assertEquals("preact/hooks", config.getHookSource());
        assertEquals(500, config.getMaxFileLines());
    }

    @Test
    void invalidValuesFallBackToDefaults() throws IOException {
        Path file = tempDir.resolve("codemod-config.yml");
        Files.writeString(file, TestUtils.lines(
                "indentation: ab",
                "dialect: cobol",
                "maxFileLines: -1"));

        CodemodConfig config = CodemodConfig.load(file);

        assertEquals("  ", config.getIndentation());
        assertEquals(Dialect.JAVASCRIPT, config.getDialect());
        assertEquals(20000, config.getMaxFileLines());
    }

    @Test
    void malformedFileGivesDefaults() throws IOException {
        Path file = tempDir.resolve("codemod-config.yml");
        Files.writeString(file, "indentation: [unclosed\n");

        CodemodConfig config = CodemodConfig.load(file);

        assertEquals("  ", config.getIndentation());
        assertTrue(config.isValidateOutput());
    }

    @Test
    void withKeepsUnrelatedSettings() {
        CodemodConfig config = CodemodConfig.with("\t", null, false).withHookSource("preact/hooks");

        assertEquals("\t", config.getIndentation());
        assertEquals(Dialect.JAVASCRIPT, config.getDialect());
        assertFalse(config.isValidateOutput());
        assertEquals("preact/hooks", config.getHookSource());
    }
}

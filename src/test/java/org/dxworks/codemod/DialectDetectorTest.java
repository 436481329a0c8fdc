package org.dxworks.codemod;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class DialectDetectorTest {

    @Test
    void detectsByExtension() {
        assertEquals(Optional.of(Dialect.JAVASCRIPT), DialectDetector.detectDialect(Paths.get("src/App.jsx")));
        assertEquals(Optional.of(Dialect.JAVASCRIPT), DialectDetector.detectDialect(Paths.get("index.MJS")));
        assertEquals(Optional.of(Dialect.TYPESCRIPT), DialectDetector.detectDialect(Paths.get("Button.tsx")));
        assertEquals(Optional.empty(), DialectDetector.detectDialect(Paths.get("styles.css")));
    }
}

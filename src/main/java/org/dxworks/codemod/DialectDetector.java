package org.dxworks.codemod;

import java.nio.file.Path;
import java.util.Optional;

public class DialectDetector {

    public static Optional<Dialect> detectDialect(Path filePath) {
        String fileName = filePath.getFileName().toString().toLowerCase();
        for (Dialect dialect : Dialect.values()) {
            if (dialect.matchesFileName(fileName)) {
                return Optional.of(dialect);
            }
        }
        return Optional.empty();
    }
}

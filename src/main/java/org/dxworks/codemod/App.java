package org.dxworks.codemod;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.codemod.model.GenerationResult;
import org.dxworks.codemod.plan.ModificationPlan;
import org.dxworks.codemod.plan.PlanExecutor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    static final int EXIT_OK = 0;
    static final int EXIT_GENERATION_FAILED = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length < 2 || args.length > 3) {
            System.err.println("Usage: java -jar codemod.jar <source-file> <plan.json> [<output-file>]");
            System.err.println("  <source-file>: JSX/TSX component to modify");
            System.err.println("  <plan.json>:   Change plan ({\"changes\": [...]})");
            System.err.println("  <output-file>: Where to write the modified source (optional)");
            return EXIT_USAGE;
        }

        Path sourcePath = Paths.get(args[0]);
        Path planPath = Paths.get(args[1]);
        if (!Files.isRegularFile(sourcePath)) {
            System.err.println("Error: Source file does not exist: " + sourcePath);
            return EXIT_USAGE;
        }
        if (!Files.isRegularFile(planPath)) {
            System.err.println("Error: Plan file does not exist: " + planPath);
            return EXIT_USAGE;
        }

        CodemodConfig config = CodemodConfig.load();
        Dialect dialect = DialectDetector.detectDialect(sourcePath).orElse(config.getDialect());
        if (!withinMaxLines(sourcePath, config.getMaxFileLines())) {
            System.err.println("Error: " + sourcePath.getFileName() + " has more than "
                    + config.getMaxFileLines() + " lines");
            return EXIT_USAGE;
        }

        String sourceCode;
        ModificationPlan plan;
        try {
            sourceCode = Files.readString(sourcePath, StandardCharsets.UTF_8);
            plan = PlanExecutor.readPlan(planPath);
        } catch (IOException e) {
            System.err.println("Error: Could not read input: " + e.getMessage());
            return EXIT_USAGE;
        }

        System.out.println("Applying " + plan.changes.size() + " change(s) to " + sourcePath.getFileName()
                + " (" + dialect.getName() + ")");

        GenerationResult result;
        try {
            result = new PlanExecutor(config.withDialect(dialect)).execute(sourceCode, plan);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: Invalid plan: " + e.getMessage());
            return EXIT_USAGE;
        }

        try {
            System.out.println(MAPPER.writeValueAsString(result));
            if (result.success && args.length == 3) {
                Path output = Paths.get(args[2]);
                if (output.getParent() != null) {
                    Files.createDirectories(output.getParent());
                }
                Files.writeString(output, result.code, StandardCharsets.UTF_8);
                System.out.println("Output written to: " + output.toAbsolutePath());
            }
        } catch (IOException e) {
            System.err.println("Error: Could not write output: " + e.getMessage());
            return EXIT_GENERATION_FAILED;
        }

        if (!result.success) {
            System.err.println("Generation failed with " + result.errors.size() + " error(s)");
            return EXIT_GENERATION_FAILED;
        }
        if (!result.errors.isEmpty()) {
            System.out.println("Completed with " + result.errors.size() + " skipped change(s)");
        }
        return EXIT_OK;
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path, StandardCharsets.UTF_8)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (IOException | UncheckedIOException e) {
            System.err.println("Warning: could not count lines of " + path + ": " + e.getMessage());
            return true;
        }
    }
}

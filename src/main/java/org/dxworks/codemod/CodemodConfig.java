package org.dxworks.codemod;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class CodemodConfig {
    private static final Logger LOG = LoggerFactory.getLogger(CodemodConfig.class);

    private static final String CONFIG_FILE_NAME = "codemod-config.yml";
    private static final String DEFAULT_INDENTATION = "  ";
    private static final Dialect DEFAULT_DIALECT = Dialect.JAVASCRIPT;
    private static final boolean DEFAULT_VALIDATE_OUTPUT = true;
    private static final String DEFAULT_HOOK_SOURCE = "react";
    private static final int DEFAULT_MAX_FILE_LINES = 20000;

    private final String indentation;
    private final Dialect dialect;
    private final boolean validateOutput;
    private final String hookSource;
    private final int maxFileLines;

    private CodemodConfig(String indentation, Dialect dialect, boolean validateOutput, String hookSource, int maxFileLines) {
        this.indentation = indentation;
        this.dialect = dialect;
        this.validateOutput = validateOutput;
        this.hookSource = hookSource;
        this.maxFileLines = maxFileLines;
    }

    /** One level of indentation for generated statements whose surroundings give no hint. */
    public String getIndentation() {
        return indentation;
    }

    public Dialect getDialect() {
        return dialect;
    }

    public boolean isValidateOutput() {
        return validateOutput;
    }

    /** Module the implicit hook imports come from. */
    public String getHookSource() {
        return hookSource;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public static CodemodConfig defaults() {
        return new CodemodConfig(DEFAULT_INDENTATION, DEFAULT_DIALECT, DEFAULT_VALIDATE_OUTPUT,
                DEFAULT_HOOK_SOURCE, DEFAULT_MAX_FILE_LINES);
    }

    public static CodemodConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static CodemodConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                String indentation = yamlConfig.indentation != null && !yamlConfig.indentation.isEmpty()
                        && yamlConfig.indentation.isBlank()
                        ? yamlConfig.indentation
                        : DEFAULT_INDENTATION;
                Dialect dialect = Dialect.fromName(yamlConfig.dialect).orElse(DEFAULT_DIALECT);
                boolean validateOutput = yamlConfig.validateOutput != null
                        ? yamlConfig.validateOutput
                        : DEFAULT_VALIDATE_OUTPUT;
                String hookSource = yamlConfig.hookSource != null && !yamlConfig.hookSource.isBlank()
                        ? yamlConfig.hookSource
                        : DEFAULT_HOOK_SOURCE;
                int maxFileLines = (yamlConfig.maxFileLines != null && yamlConfig.maxFileLines > 0)
                        ? yamlConfig.maxFileLines
                        : DEFAULT_MAX_FILE_LINES;

                return new CodemodConfig(indentation, dialect, validateOutput, hookSource, maxFileLines);
            }
        } catch (IOException e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static CodemodConfig with(String indentation, Dialect dialect, boolean validateOutput) {
        String effectiveIndentation = indentation != null && !indentation.isEmpty() && indentation.isBlank()
                ? indentation
                : DEFAULT_INDENTATION;
        Dialect effectiveDialect = dialect != null ? dialect : DEFAULT_DIALECT;
        return new CodemodConfig(effectiveIndentation, effectiveDialect, validateOutput,
                DEFAULT_HOOK_SOURCE, DEFAULT_MAX_FILE_LINES);
    }

    public CodemodConfig withDialect(Dialect dialect) {
        return new CodemodConfig(indentation, dialect, validateOutput, hookSource, maxFileLines);
    }

    public CodemodConfig withValidateOutput(boolean validateOutput) {
        return new CodemodConfig(indentation, dialect, validateOutput, hookSource, maxFileLines);
    }

    public CodemodConfig withHookSource(String hookSource) {
        return new CodemodConfig(indentation, dialect, validateOutput, hookSource, maxFileLines);
    }

    private static class YamlConfig {
        public String indentation;
        public String dialect;
        public Boolean validateOutput;
        public String hookSource;
        public Integer maxFileLines;
    }
}

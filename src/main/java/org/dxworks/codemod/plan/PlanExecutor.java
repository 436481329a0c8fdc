package org.dxworks.codemod.plan;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.dxworks.codemod.CodemodConfig;
import org.dxworks.codemod.ComponentModifier;
import org.dxworks.codemod.imports.AmbiguousImportCombinationException;
import org.dxworks.codemod.model.GenerationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Runs a plan document against one source in a fresh session.
 */
public class PlanExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(PlanExecutor.class);
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();

    private final CodemodConfig config;

    public PlanExecutor(CodemodConfig config) {
        this.config = config;
    }

    public static ModificationPlan readPlan(String json) throws IOException {
        ModificationPlan plan = MAPPER.readValue(json, ModificationPlan.class);
        return plan != null ? plan : new ModificationPlan();
    }

    public static ModificationPlan readPlan(Path path) throws IOException {
        return readPlan(Files.readString(path, StandardCharsets.UTF_8));
    }

    /**
     * @throws IllegalArgumentException when a change is malformed; nothing is generated then
     */
    public GenerationResult execute(String sourceCode, ModificationPlan plan) {
        ComponentModifier modifier = ComponentModifier.initialize(sourceCode, config);
        for (int i = 0; i < plan.changes.size(); i++) {
            PlannedChange change = plan.changes.get(i);
            if (change == null) continue;
            try {
                change.applyTo(modifier);
            } catch (AmbiguousImportCombinationException e) {
                throw e;
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Change #" + (i + 1) + " (" + change.type + "): " + e.getMessage(), e);
            }
        }
        LOG.debug("Executing plan with {} change(s)", plan.changes.size());
        return modifier.generate();
    }
}

package org.dxworks.codemod.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one generation pass. {@code success} only asserts that no fatal failure happened;
 * partial failures are still listed in {@code errors}.
 */
public class GenerationResult {
    public boolean success;
    public String code;
    public List<String> errors = new ArrayList<>();

    @JsonIgnore
    public List<ModificationError> problems = new ArrayList<>();

    public static GenerationResult success(String code, List<ModificationError> problems) {
        GenerationResult result = new GenerationResult();
        result.success = true;
        result.code = code;
        result.addAll(problems);
        return result;
    }

    public static GenerationResult failure(List<ModificationError> problems) {
        GenerationResult result = new GenerationResult();
        result.success = false;
        result.addAll(problems);
        return result;
    }

    public boolean hasErrors() {
        return !problems.isEmpty();
    }

    public boolean hasError(ErrorKind kind) {
        for (ModificationError problem : problems) {
            if (problem.kind == kind) return true;
        }
        return false;
    }

    private void addAll(List<ModificationError> toAdd) {
        for (ModificationError problem : toAdd) {
            problems.add(problem);
            errors.add(problem.render());
        }
    }
}

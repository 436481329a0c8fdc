package org.dxworks.codemod.plan;

import org.dxworks.codemod.CodemodConfig;
import org.dxworks.codemod.TestUtils;
import org.dxworks.codemod.imports.AmbiguousImportCombinationException;
import org.dxworks.codemod.model.ErrorKind;
import org.dxworks.codemod.model.GenerationResult;
import org.dxworks.codemod.request.ConditionalRenderSpec;
import org.dxworks.codemod.request.MarkupPosition;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.dxworks.codemod.TestUtils.lines;
import static org.junit.jupiter.api.Assertions.*;

public class PlanExecutorTest {

    private final PlanExecutor executor = new PlanExecutor(CodemodConfig.defaults());

    @Test
    void executesMixedPlan() throws IOException {
        String json = "{\"changes\": ["
                + "{\"type\": \"ADD_STATE\", \"name\": \"count\", \"initialValue\": \"0\"},"
                + "{\"type\": \"WRAP_ELEMENT\", \"targetElement\": \"div\", \"identifier\": \"counter\","
                + " \"wrapperComponent\": \"AuthGuard\", \"wrapperProps\": {\"fallback\": \"<Login />\"},"
                + " \"import\": {\"source\": \"./AuthGuard\", \"defaultImport\": \"AuthGuard\"}},"
                + "{\"type\": \"REPLACE\", \"searchFor\": \"Counter</h1>\", \"replaceWith\": \"Clicker</h1>\"},"
                + "{\"type\": \"APPEND\", \"content\": \"// generated\\n\"}"
                + "]}";

        GenerationResult result = executor.execute(TestUtils.readSample("Counter.jsx"), PlanExecutor.readPlan(json));

        assertTrue(result.success);
        assertEquals(List.of(), result.errors);
        assertEquals(lines(
                "import React, { useState } from 'react';",
                "import AuthGuard from './AuthGuard';",
                "",
                "export default function Counter() {",
                "  const [count, setCount] = useState(0);",
                "  return (",
                "    <AuthGuard fallback={<Login />}><div className=\"counter\">",
                "      <h1>Clicker</h1>",
                "    </div></AuthGuard>",
                "  );",
                "}",
                "// generated"), result.code);
    }

    @Test
    void readsAliasesAndLowercaseEnums() throws IOException {
        ModificationPlan plan = PlanExecutor.readPlan("{\"changes\": ["
                + "{\"type\": \"INSERT_MARKUP\", \"elementType\": \"h1\", \"position\": \"after\", \"jsx\": \"<hr />\"},"
                + "{\"type\": \"ADD_MEMO\", \"name\": \"double\", \"value\": \"count * 2\", \"dependencies\": [\"count\"]}"
                + "]}");

        InsertMarkupChange insert = (InsertMarkupChange) plan.changes.get(0);
        assertEquals("h1", insert.targetElement);
        assertEquals(MarkupPosition.AFTER, insert.position);
        assertEquals("<hr />", insert.markup);
        assertTrue(plan.changes.get(1) instanceof AddHookChange);
    }

    @Test
    void unknownChangeTypeIsRejected() {
        assertThrows(IOException.class,
                () -> PlanExecutor.readPlan("{\"changes\": [{\"type\": \"REWRITE_EVERYTHING\"}]}"));
    }

    @Test
    void missingRequiredFieldNamesTheChange() throws IOException {
        ModificationPlan plan = PlanExecutor.readPlan("{\"changes\": ["
                + "{\"type\": \"ADD_STATE\", \"name\": \"count\", \"initialValue\": \"0\"},"
                + "{\"type\": \"WRAP_ELEMENT\", \"targetElement\": \"div\"}"
                + "]}");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> executor.execute(TestUtils.readSample("Counter.jsx"), plan));
        assertEquals("Change #2 (WRAP_ELEMENT): WRAP_ELEMENT requires wrapperComponent", e.getMessage());
    }

    @Test
    void ambiguousImportIsRaisedAsIs() throws IOException {
        ModificationPlan plan = PlanExecutor.readPlan("{\"changes\": [{\"type\": \"ADD_IMPORT\", \"source\": \"react\","
                + " \"defaultImport\": \"React\", \"namespaceImport\": \"R\"}]}");

        assertThrows(AmbiguousImportCombinationException.class,
                () -> executor.execute(TestUtils.readSample("Counter.jsx"), plan));
    }

    @Test
    void textPatchesFollowStructuralEdits() throws IOException {
        ModificationPlan plan = PlanExecutor.readPlan("{\"changes\": ["
                + "{\"type\": \"INSERT_BEFORE\", \"searchFor\": \"export default\", \"content\": \"// Counter component\"},"
                + "{\"type\": \"DELETE\", \"searchFor\": \"<h1>Counter</h1>\"}"
                + "]}");

        GenerationResult result = executor.execute(TestUtils.readSample("Counter.jsx"), plan);

        assertEquals(lines(
                "import React from 'react';",
                "",
                "// Counter component",
                "export default function Counter() {",
                "  return (",
                "    <div className=\"counter\">",
                "    </div>",
                "  );",
                "}"), result.code);
    }

    @Test
    void deletesElementFilteredByContent() throws IOException {
        ModificationPlan plan = PlanExecutor.readPlan("{\"changes\": ["
                + "{\"type\": \"DELETE_ELEMENT\", \"targetElement\": \"h1\", \"content\": \"Counter\"},"
                + "{\"type\": \"DELETE_ELEMENT\", \"targetElement\": \"h2\"}"
                + "]}");

        GenerationResult result = executor.execute(TestUtils.readSample("Counter.jsx"), plan);

        assertTrue(result.success);
        assertEquals(1, result.errors.size());
        assertTrue(result.hasError(ErrorKind.TARGET_NOT_FOUND));
        assertEquals(lines(
                "import React from 'react';",
                "",
                "export default function Counter() {",
                "  return (",
                "    <div className=\"counter\">",
                "    </div>",
                "  );",
                "}"), result.code);
    }

    @Test
    void executesReducerClassNameAndConditionalChanges() throws IOException {
        String json = "{\"changes\": ["
                + "{\"type\": \"ADD_REDUCER\", \"name\": \"count\", \"initialState\": \"0\","
                + " \"actions\": {\"increment\": \"return state + 1;\"}},"
                + "{\"type\": \"MODIFY_CLASS_NAME\", \"targetElement\": \"div\", \"addClasses\": [\"wide\"]},"
                + "{\"type\": \"CONDITIONAL_RENDER\", \"condition\": \"visible\", \"style\": \"ternary\"}"
                + "]}";

        GenerationResult result = executor.execute(TestUtils.readSample("Counter.jsx"), PlanExecutor.readPlan(json));

        assertEquals(List.of(), result.errors);
        assertEquals(lines(
                "import React, { useReducer } from 'react';",
                "",
                "export default function Counter() {",
                "  function countReducer(state, action) {",
                "    switch (action.type) {",
                "      case 'increment':",
                "        return state + 1;",
                "      default:",
                "        return state;",
                "    }",
                "  }",
                "  const [count, dispatch] = useReducer(countReducer, 0);",
                "  return visible ? (",
                "    <div className=\"counter wide\">",
                "      <h1>Counter</h1>",
                "    </div>",
                "  ) : null;",
                "}"), result.code);
    }

    @Test
    void readsFunctionBodyAndConditionalChanges() throws IOException {
        ModificationPlan plan = PlanExecutor.readPlan("{\"changes\": ["
                + "{\"type\": \"REPLACE_FUNCTION_BODY\", \"name\": \"onSave\", \"body\": \"save();\"},"
                + "{\"type\": \"CONDITIONAL_RENDER\", \"condition\": \"ready\", \"fallback\": \"<Spinner />\","
                + " \"style\": \"early_return\"}"
                + "]}");

        ReplaceFunctionBodyChange replace = (ReplaceFunctionBodyChange) plan.changes.get(0);
        assertEquals("onSave", replace.name);
        assertEquals("save();", replace.body);
        ConditionalRenderChange conditional = (ConditionalRenderChange) plan.changes.get(1);
        assertEquals(ConditionalRenderSpec.Style.EARLY_RETURN, conditional.style);

        GenerationResult result = executor.execute(lines(
                "export default function Editor({ ready }) {",
                "  function onSave() {}",
                "  return <button onClick={onSave}>Save</button>;",
                "}"), plan);

        assertEquals(lines(
                "export default function Editor({ ready }) {",
                "  function onSave() {",
                "    save();",
                "  }",
                "  if (!ready) {",
                "    return <Spinner />;",
                "  }",
                "",
                "  return <button onClick={onSave}>Save</button>;",
                "}"), result.code);
    }
}

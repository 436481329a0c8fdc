package org.dxworks.codemod;

import org.approvaltests.Approvals;
import org.dxworks.codemod.imports.ImportSpec;
import org.dxworks.codemod.model.GenerationResult;
import org.dxworks.codemod.query.ElementLocator;
import org.dxworks.codemod.request.ElementTarget;
import org.dxworks.codemod.request.FunctionSpec;
import org.dxworks.codemod.request.MarkupPosition;
import org.dxworks.codemod.request.PropSpec;
import org.dxworks.codemod.request.StateVariableSpec;
import org.dxworks.codemod.request.UseEffectSpec;
import org.dxworks.codemod.request.WrapperSpec;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ComponentModifierApprovalTest {

    @Test
    void counterWithStateEffectAndWrapper() throws IOException {
        ComponentModifier modifier = ComponentModifier.initialize(TestUtils.readSample("Counter.jsx"));
        ElementLocator counter = ElementLocator.tag("div").withIdentifier("counter");

        modifier.addStateVariable(new StateVariableSpec("count", "setCount", "0"))
                .addUseEffect(new UseEffectSpec("document.title = `Count: ${count}`;", List.of("count")))
                .wrapElement(counter, new WrapperSpec("AuthGuard", null,
                        ImportSpec.defaultImport("./AuthGuard", "AuthGuard")))
                .insertMarkup(ElementTarget.of(counter), MarkupPosition.INSIDE_END,
                        "<button onClick={() => setCount(count + 1)}>+1</button>");

        verify(modifier.generate());
    }

    @Test
    void todoListWithMemoEffectHelperAndProp() throws IOException {
        ComponentModifier modifier = ComponentModifier.initialize(TestUtils.readSample("TodoList.jsx"));

        modifier.addUseEffect(new UseEffectSpec("localStorage.setItem('items', JSON.stringify(items));", List.of("items")))
                .addMemo("doneCount", "items.filter((item) => item.done).length", List.of("items"))
                .addFunction(FunctionSpec.arrow("clearAll", List.of(), "setItems([]);"))
                .modifyProp(ElementTarget.of(ElementLocator.tag("ul").withIdentifier("todo-list")),
                        new PropSpec("aria-label", "\"Todo items\"", PropSpec.Action.ADD));

        verify(modifier.generate());
    }

    private static void verify(GenerationResult result) {
        assertTrue(result.success, () -> "generation failed: " + result.errors);
        assertEquals(List.of(), result.errors);
        Approvals.verify(result.code);
    }
}

package org.dxworks.codemod.query;

import org.dxworks.codemod.Dialect;
import org.dxworks.codemod.parser.ComponentParser;
import org.dxworks.codemod.parser.SyntaxNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.dxworks.codemod.TestUtils.lines;
import static org.junit.jupiter.api.Assertions.*;

public class NodeQueryTest {

    private static final String LAYOUT = lines(
            "import React, { useState as useLocalState } from 'react';",
            "import * as styles from \"./Layout.module.css\";",
            "import './global.css';",
            "",
            "function Layout({ title, children }) {",
            "  const [open, setOpen] = useLocalState(false);",
            "  const [count, setCount] = useState(0);",
            "  const toggle = () => setOpen(!open);",
            "  return (",
            "    <div className=\"layout main\">",
            "      <div id=\"inner\">",
            "        <h1>{title}</h1>",
            "      </div>",
            "      <Footer text=\"bye\" />",
            "    </div>",
            "  );",
            "}",
            "",
            "const helper = function () {",
            "  return 1;",
            "};",
            "",
            "export default Layout;");

    private static NodeQuery query(String source) {
        return new NodeQuery(new ComponentParser(Dialect.JAVASCRIPT).parse(source));
    }

    @Test
    void findElementReturnsOutermostMatchFirstAndIsStable() {
        NodeQuery query = query(LAYOUT);

        SyntaxNode first = query.findComponent("div").orElseThrow();
        SyntaxNode again = query.findComponent("div").orElseThrow();

        assertSame(first, again);
        assertTrue(first.getText().startsWith("<div className=\"layout main\">"));
    }

    @Test
    void findElementNarrowsByIdentifierAndContent() {
        NodeQuery query = query(LAYOUT);

        SyntaxNode inner = query.findElement(ElementLocator.tag("div").withIdentifier("inner")).orElseThrow();
        assertTrue(inner.getText().startsWith("<div id=\"inner\">"));

        SyntaxNode byClass = query.findElement(ElementLocator.tag("div").withIdentifier("main")).orElseThrow();
        assertTrue(byClass.getText().startsWith("<div className=\"layout main\">"));

        assertTrue(query.findElement(ElementLocator.tag("h1").withContent("{title}")).isPresent());
        assertFalse(query.findElement(ElementLocator.tag("h1").withContent("Goodbye")).isPresent());
    }

    @Test
    void findComponentMatchesSelfClosingElements() {
        SyntaxNode footer = query(LAYOUT).findComponent("Footer").orElseThrow();

        assertEquals("jsx_self_closing_element", footer.getType());
    }

    @Test
    void missingElementIsEmpty() {
        assertEquals(Optional.empty(), query(LAYOUT).findComponent("section"));
        assertEquals(Optional.empty(), query(LAYOUT).findComponent(""));
    }

    @Test
    void findFunctionCoversDeclarationsArrowsAndExpressions() {
        NodeQuery query = query(LAYOUT);

        assertEquals(FunctionMatch.Kind.FUNCTION_DECLARATION, query.findFunction("Layout").orElseThrow().getKind());
        assertEquals(FunctionMatch.Kind.ARROW_FUNCTION, query.findFunction("toggle").orElseThrow().getKind());
        assertEquals(FunctionMatch.Kind.FUNCTION_EXPRESSION, query.findFunction("helper").orElseThrow().getKind());
        assertFalse(query.findFunction("open").isPresent());

        FunctionMatch toggle = query.findFunction("toggle").orElseThrow();
        assertEquals("variable_declarator", toggle.getDeclarator().getType());
        assertEquals("arrow_function", toggle.getFunctionNode().getType());
        assertNull(toggle.getBody());
    }

    @Test
    void importInfoDescribesEveryClauseShape() {
        List<ImportInfo> imports = query(LAYOUT).findImportInfos();
        assertEquals(3, imports.size());

        ImportInfo react = imports.get(0);
        assertEquals("react", react.source);
        assertEquals('\'', react.quote);
        assertEquals("React", react.defaultImport);
        assertEquals(List.of("useState as useLocalState"), react.namedSpecifiers);
        assertEquals(List.of("useState"), react.importedNames);

        ImportInfo styles = imports.get(1);
        assertEquals("./Layout.module.css", styles.source);
        assertEquals('"', styles.quote);
        assertEquals("styles", styles.namespaceImport);
        assertTrue(styles.isNamespaceOnly());

        ImportInfo css = imports.get(2);
        assertEquals("./global.css", css.source);
        assertTrue(css.isSideEffectOnly());
    }

    @Test
    void defaultExportByNameResolvesToTheFunction() {
        NodeQuery query = query(LAYOUT);

        assertTrue(query.findDefaultExport().isPresent());
        assertEquals("Layout", query.findDefaultExportedFunction().orElseThrow().getName());
        assertEquals("Layout", query.findComponentFunction(null).orElseThrow().getName());
    }

    @Test
    void componentFunctionFallsBackToFirstCapitalizedFunction() {
        NodeQuery query = query(lines(
                "const helper = () => 1;",
                "export const Card = () => {",
                "  return <div />;",
                "};"));

        assertEquals("Card", query.findComponentFunction(null).orElseThrow().getName());
    }

    @Test
    void findsStateVariables() {
        List<StateVariable> state = query(LAYOUT).findStateVariables();

        assertEquals(1, state.size());
        assertEquals("count", state.get(0).name);
        assertEquals("setCount", state.get(0).setter);
        assertEquals("0", state.get(0).initialValue);
    }

    @Test
    void isDeclaredInSeesBindingsOfTheBody() {
        NodeQuery query = query(LAYOUT);
        SyntaxNode body = query.findFunction("Layout").orElseThrow().getBody();

        assertTrue(query.isDeclaredIn(body, "open"));
        assertTrue(query.isDeclaredIn(body, "setCount"));
        assertTrue(query.isDeclaredIn(body, "toggle"));
        assertFalse(query.isDeclaredIn(body, "title"));
        assertFalse(query.isDeclaredIn(body, "helper"));
    }

    @Test
    void errorsComeFromTheTree() {
        assertTrue(query(LAYOUT).getErrors().isEmpty());
        assertFalse(query("const = ;").getErrors().isEmpty());
    }
}

package org.dxworks.codemod.parser;

import org.dxworks.codemod.Dialect;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.codemod.TestUtils.lines;
import static org.junit.jupiter.api.Assertions.*;

public class ComponentParserTest {

    @Test
    void parsesComponentWithoutDiagnostics() {
        SyntaxTree tree = new ComponentParser(Dialect.JAVASCRIPT).parse(lines(
                "export default function App() {",
                "  return <div className=\"app\">Hi</div>;",
                "}"));

        assertEquals("program", tree.getRootNode().getType());
        assertFalse(tree.hasErrors());
        assertTrue(tree.getDiagnostics().isEmpty());
    }

    @Test
    void reportsSyntaxErrorsWithPosition() {
        SyntaxTree tree = new ComponentParser(Dialect.JAVASCRIPT).parse("function App( { return <div>; }");

        assertTrue(tree.hasErrors());
        SyntaxDiagnostic first = tree.getDiagnostics().get(0);
        assertTrue(first.line >= 1);
        assertTrue(first.describe().startsWith("Syntax error at "));
    }

    @Test
    void reportsClosingTagNamingAnotherElement() {
        SyntaxTree tree = new ComponentParser(Dialect.JAVASCRIPT).parse(lines(
                "export default function App() {",
                "  return <A><B><div /></A></B>;",
                "}"));

        assertTrue(tree.hasErrors());
        SyntaxDiagnostic first = tree.getDiagnostics().get(0);
        assertEquals(SyntaxDiagnostic.MISMATCHED_TAG, first.nodeType);
        assertEquals(2, first.line);
        assertTrue(first.describe().contains("closing tag does not match"));
    }

    @Test
    void matchingMemberAndFragmentTagsAreAccepted() {
        SyntaxTree tree = new ComponentParser(Dialect.JAVASCRIPT).parse(lines(
                "export default function App() {",
                "  return <><Theme.Provider value={1}><p>Hi</p></Theme.Provider></>;",
                "}"));

        assertFalse(tree.hasErrors(), () -> String.valueOf(tree.getDiagnostics()));
    }

    @Test
    void rangesAreUtf8ByteOffsets() {
        SyntaxTree tree = new ComponentParser(Dialect.JAVASCRIPT).parse("const s = \"ä\";");

        SyntaxNode string = findFirst(tree.getRootNode(), "string");
        assertNotNull(string);
        assertEquals(10, string.getStartIndex());
        assertEquals(14, string.getEndIndex());
        assertEquals("\"ä\"", string.getText());
    }

    @Test
    void exposesFieldChildren() {
        SyntaxTree tree = new ComponentParser(Dialect.JAVASCRIPT).parse("function Header() { return null; }");

        SyntaxNode function = tree.getRootNode().getNamedChild(0);
        assertEquals("function_declaration", function.getType());
        assertEquals("Header", function.getChildByFieldName("name").getText());
        assertEquals("statement_block", function.getChildByFieldName("body").getType());
        assertSame(tree.getRootNode(), function.getParent());
        assertTrue(tree.owns(function));
    }

    @Test
    void nodesOfAnotherTreeAreNotOwned() {
        ComponentParser parser = new ComponentParser(Dialect.JAVASCRIPT);
        SyntaxTree first = parser.parse("const a = 1;");
        SyntaxTree second = parser.parse("const a = 1;");

        assertFalse(first.owns(second.getRootNode().getNamedChild(0)));
    }

    @Test
    void typescriptDialectParsesTypeAnnotations() {
        SyntaxTree tree = new ComponentParser(Dialect.TYPESCRIPT).parse("const count: number = 1;");

        assertFalse(tree.hasErrors());
        assertEquals(Dialect.TYPESCRIPT, tree.getDialect());
    }

    private static SyntaxNode findFirst(SyntaxNode node, String type) {
        if (type.equals(node.getType())) return node;
        List<SyntaxNode> children = node.getChildren();
        for (SyntaxNode child : children) {
            SyntaxNode found = findFirst(child, type);
            if (found != null) return found;
        }
        return null;
    }
}

package org.dxworks.codemod.query;

import org.dxworks.codemod.parser.SyntaxDiagnostic;
import org.dxworks.codemod.parser.SyntaxNode;
import org.dxworks.codemod.parser.SyntaxTree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import static org.dxworks.codemod.query.TreeHelper.*;

/**
 * Generic and semantic lookups over one {@link SyntaxTree}. Every search walks the tree in
 * pre-order, so repeated calls return the same node.
 */
public class NodeQuery {
    private static final String[] FUNCTION_VALUE_TYPES = {"arrow_function", "function_expression", "function"};
    private static final String[] DECLARATION_TYPES = {"lexical_declaration", "variable_declaration"};
    private static final String[] IDENTIFYING_ATTRIBUTES = {"className", "class", "id"};

    private final SyntaxTree tree;

    public NodeQuery(SyntaxTree tree) {
        this.tree = tree;
    }

    public SyntaxTree getTree() {
        return tree;
    }

    /**
     * Every node of exactly {@code nodeType}, in pre-order.
     */
    public List<SyntaxNode> findNodes(String nodeType) {
        if (nodeType == null || nodeType.isEmpty()) return new ArrayList<>();
        return findAllDescendants(tree.getRootNode(), nodeType);
    }

    /**
     * First JSX element, regular or self-closing, whose tag name equals {@code tagName}.
     */
    public Optional<SyntaxNode> findComponent(String tagName) {
        if (tagName == null || tagName.isEmpty()) return Optional.empty();
        return findElement(ElementLocator.tag(tagName));
    }

    public Optional<SyntaxNode> findElement(ElementLocator locator) {
        for (SyntaxNode element : findAllDescendantsOfTypes(tree.getRootNode(), "jsx_element", "jsx_self_closing_element")) {
            if (matches(element, locator)) {
                return Optional.of(element);
            }
        }
        return Optional.empty();
    }

    private boolean matches(SyntaxNode element, ElementLocator locator) {
        if (!locator.getTagName().equals(getTagName(element))) {
            return false;
        }
        if (locator.getIdentifier() != null && !hasIdentifier(element, locator.getIdentifier())) {
            return false;
        }
        return locator.getContent() == null || element.getText().contains(locator.getContent());
    }

    private boolean hasIdentifier(SyntaxNode element, String identifier) {
        for (String attributeName : IDENTIFYING_ATTRIBUTES) {
            SyntaxNode attribute = findAttribute(element, attributeName);
            if (attribute == null) continue;
            SyntaxNode value = getAttributeValue(attribute);
            if (value != null && value.getText().contains(identifier)) {
                return true;
            }
        }
        return false;
    }

    /**
     * A function declaration named {@code name}, or a variable declarator named {@code name}
     * whose value is an arrow function or function expression.
     */
    public Optional<FunctionMatch> findFunction(String name) {
        if (name == null || name.isEmpty()) return Optional.empty();
        for (SyntaxNode node : findAllDescendantsOfTypes(tree.getRootNode(), "function_declaration", "variable_declarator")) {
            SyntaxNode nameNode = node.getChildByFieldName("name");
            if (nameNode == null || !name.equals(nameNode.getText())) continue;

            if ("function_declaration".equals(node.getType())) {
                return Optional.of(new FunctionMatch(name, FunctionMatch.Kind.FUNCTION_DECLARATION, node, null));
            }
            SyntaxNode value = node.getChildByFieldName("value");
            if (isNodeTypeOneOf(value, FUNCTION_VALUE_TYPES)) {
                FunctionMatch.Kind kind = "arrow_function".equals(value.getType())
                        ? FunctionMatch.Kind.ARROW_FUNCTION
                        : FunctionMatch.Kind.FUNCTION_EXPRESSION;
                return Optional.of(new FunctionMatch(name, kind, value, node));
            }
        }
        return Optional.empty();
    }

    public List<SyntaxNode> findImports() {
        return findAllChildren(tree.getRootNode(), "import_statement");
    }

    public List<ImportInfo> findImportInfos() {
        List<ImportInfo> result = new ArrayList<>();
        for (SyntaxNode node : findImports()) {
            ImportInfo info = getImportInfo(node);
            if (info != null) result.add(info);
        }
        return result;
    }

    public ImportInfo getImportInfo(SyntaxNode importNode) {
        if (importNode == null || !"import_statement".equals(importNode.getType())) {
            return null;
        }
        SyntaxNode source = importNode.getChildByFieldName("source");
        if (source == null) source = findFirstChild(importNode, "string");
        if (source == null) return null;

        ImportInfo info = new ImportInfo();
        info.node = importNode;
        String sourceText = source.getText();
        if (sourceText.length() >= 2 && (sourceText.charAt(0) == '"' || sourceText.charAt(0) == '\'')) {
            info.quote = sourceText.charAt(0);
            info.source = sourceText.substring(1, sourceText.length() - 1);
        } else {
            info.source = sourceText;
        }
        info.typeOnly = importNode.findToken("type") != null;

        SyntaxNode clause = findFirstChild(importNode, "import_clause");
        info.clause = clause;
        if (clause == null) {
            return info;
        }
        for (SyntaxNode child : clause.getNamedChildren()) {
            if ("identifier".equals(child.getType())) {
                info.defaultImport = child.getText();
            } else if ("namespace_import".equals(child.getType())) {
                SyntaxNode alias = findFirstChild(child, "identifier");
                info.namespaceImport = alias != null ? alias.getText() : null;
            } else if ("named_imports".equals(child.getType())) {
                info.namedImports = child;
                for (SyntaxNode specifier : findAllChildren(child, "import_specifier")) {
                    SyntaxNode name = specifier.getChildByFieldName("name");
                    if (name == null) name = specifier.getNamedChild(0);
                    info.namedSpecifiers.add(normalizeInline(specifier.getText()));
                    info.importedNames.add(name != null ? name.getText() : specifier.getText());
                }
            }
        }
        return info;
    }

    public Optional<SyntaxNode> findDefaultExport() {
        for (SyntaxNode export : findAllChildren(tree.getRootNode(), "export_statement")) {
            if (export.findToken("default") != null) {
                return Optional.of(export);
            }
        }
        return Optional.empty();
    }

    /**
     * The function behind {@code export default}, whether declared inline or exported by name
     * ({@code export default App;}).
     */
    public Optional<FunctionMatch> findDefaultExportedFunction() {
        Optional<SyntaxNode> export = findDefaultExport();
        if (export.isEmpty()) return Optional.empty();

        for (SyntaxNode child : export.get().getNamedChildren()) {
            if (isNodeTypeOneOf(child, "function_declaration", "function", "function_expression")) {
                SyntaxNode name = child.getChildByFieldName("name");
                return Optional.of(new FunctionMatch(name != null ? name.getText() : null,
                        FunctionMatch.Kind.FUNCTION_DECLARATION, child, null));
            }
            if ("arrow_function".equals(child.getType())) {
                return Optional.of(new FunctionMatch(null, FunctionMatch.Kind.ARROW_FUNCTION, child, null));
            }
            if ("identifier".equals(child.getType())) {
                return findFunction(child.getText());
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves the component a hook or function insertion targets: the named function when a name
     * is given, otherwise the default export, otherwise the first top-level function whose name
     * starts with an uppercase letter.
     */
    public Optional<FunctionMatch> findComponentFunction(String componentName) {
        if (componentName != null && !componentName.isEmpty()) {
            return findFunction(componentName);
        }
        Optional<FunctionMatch> defaultExport = findDefaultExportedFunction();
        if (defaultExport.isPresent()) {
            return defaultExport;
        }
        for (SyntaxNode statement : tree.getRootNode().getNamedChildren()) {
            SyntaxNode declaration = statement;
            if ("export_statement".equals(statement.getType())) {
                declaration = statement.getChildByFieldName("declaration");
                if (declaration == null) continue;
            }
            for (String name : declaredFunctionNames(declaration)) {
                if (Character.isUpperCase(name.charAt(0))) {
                    return findFunction(name);
                }
            }
        }
        return Optional.empty();
    }

    private List<String> declaredFunctionNames(SyntaxNode declaration) {
        List<String> names = new ArrayList<>();
        if ("function_declaration".equals(declaration.getType())) {
            SyntaxNode name = declaration.getChildByFieldName("name");
            if (name != null) names.add(name.getText());
        } else if (isNodeTypeOneOf(declaration, DECLARATION_TYPES)) {
            for (SyntaxNode declarator : findAllChildren(declaration, "variable_declarator")) {
                SyntaxNode name = declarator.getChildByFieldName("name");
                SyntaxNode value = declarator.getChildByFieldName("value");
                if (name != null && "identifier".equals(name.getType()) && isNodeTypeOneOf(value, FUNCTION_VALUE_TYPES)) {
                    names.add(name.getText());
                }
            }
        }
        return names;
    }

    /**
     * Existing {@code useState} declarations anywhere in the file.
     */
    public List<StateVariable> findStateVariables() {
        List<StateVariable> result = new ArrayList<>();
        for (SyntaxNode declarator : findNodes("variable_declarator")) {
            SyntaxNode name = declarator.getChildByFieldName("name");
            SyntaxNode value = declarator.getChildByFieldName("value");
            if (name == null || !"array_pattern".equals(name.getType())) continue;
            if (!"useState".equals(getCalleeName(value))) continue;

            List<SyntaxNode> elements = name.getNamedChildren();
            if (elements.size() < 2) continue;
            String initialValue = null;
            SyntaxNode arguments = value.getChildByFieldName("arguments");
            if (arguments != null && arguments.getNamedChildCount() > 0) {
                initialValue = arguments.getNamedChild(0).getText();
            }
            result.add(new StateVariable(elements.get(0).getText(), elements.get(1).getText(),
                    initialValue, declarator.getParent()));
        }
        return result;
    }

    /**
     * Whether a statement directly inside {@code body} already binds {@code name}.
     */
    public boolean isDeclaredIn(SyntaxNode body, String name) {
        if (body == null || name == null) return false;
        for (SyntaxNode statement : body.getNamedChildren()) {
            if ("function_declaration".equals(statement.getType())) {
                SyntaxNode functionName = statement.getChildByFieldName("name");
                if (functionName != null && name.equals(functionName.getText())) return true;
            } else if (isNodeTypeOneOf(statement, DECLARATION_TYPES)) {
                for (SyntaxNode declarator : findAllChildren(statement, "variable_declarator")) {
                    if (bindsName(declarator.getChildByFieldName("name"), name)) return true;
                }
            }
        }
        return false;
    }

    private boolean bindsName(SyntaxNode pattern, String name) {
        if (pattern == null) return false;
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(pattern);
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            if (isNodeTypeOneOf(node, "identifier", "shorthand_property_identifier_pattern")
                    && name.equals(node.getText())) {
                return true;
            }
            // a default value's expression does not bind anything
            if ("assignment_pattern".equals(node.getType())) {
                SyntaxNode left = node.getChildByFieldName("left");
                if (left != null) stack.push(left);
                continue;
            }
            for (SyntaxNode child : node.getNamedChildren()) {
                stack.push(child);
            }
        }
        return false;
    }

    public List<SyntaxDiagnostic> getErrors() {
        return tree.getDiagnostics();
    }
}

package org.dxworks.codemod.generate;

import org.dxworks.codemod.CodemodConfig;
import org.dxworks.codemod.model.ErrorKind;
import org.dxworks.codemod.model.ModificationException;
import org.dxworks.codemod.model.TextEdit;
import org.dxworks.codemod.parser.SourceText;
import org.dxworks.codemod.parser.SyntaxNode;
import org.dxworks.codemod.query.FunctionMatch;
import org.dxworks.codemod.query.NodeQuery;
import org.dxworks.codemod.request.ConditionalRenderSpec;
import org.dxworks.codemod.request.FunctionSpec;
import org.dxworks.codemod.request.HookKind;
import org.dxworks.codemod.request.HookVariableSpec;
import org.dxworks.codemod.request.ReducerSpec;
import org.dxworks.codemod.request.StateVariableSpec;
import org.dxworks.codemod.request.UseEffectSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.dxworks.codemod.query.TreeHelper.*;

/**
 * Computes edits of a component body: hook calls, helper functions, function bodies and the
 * condition around the returned markup.
 * <p>
 * Reducer functions, state and refs go to the top of the body. Reducer hooks, memos, callbacks and
 * effects go after the last statement that calls a hook (before the terminal return), or to the
 * top when there is none. Helper functions go right before the terminal return. At a shared
 * offset, reducer functions come first, then state, refs, reducer hooks, memos, callbacks, effects
 * and functions.
 */
public class HookInserter {
    private static final Logger LOG = LoggerFactory.getLogger(HookInserter.class);

    static final int CONDITION_OPEN_PRIORITY = 95;
    static final int REDUCER_FUNCTION_PRIORITY = 95;
    static final int STATE_PRIORITY = 90;
    static final int REF_PRIORITY = 85;
    static final int REDUCER_PRIORITY = 82;
    static final int MEMO_PRIORITY = 80;
    static final int CALLBACK_PRIORITY = 75;
    static final int EFFECT_PRIORITY = 70;
    static final int FUNCTION_PRIORITY = 60;
    static final int BODY_PRIORITY = 60;
    static final int GUARD_PRIORITY = 20;
    static final int CONDITION_CLOSE_PRIORITY = 5;
    private static final int CLOSING_BREAK_PRIORITY = 0;

    private final NodeQuery query;
    private final SourceText source;
    private final String indentation;
    private final Map<Integer, Set<String>> queuedNames = new HashMap<>();
    private final Set<Integer> brokenEmptyBodies = new HashSet<>();

    public HookInserter(NodeQuery query, CodemodConfig config) {
        this.query = query;
        this.source = query.getTree().getSource();
        this.indentation = config.getIndentation();
    }

    public List<TextEdit> addState(StateVariableSpec spec, int sequence) {
        Body body = resolveBody(spec.getComponent());
        claim(body, spec.getName());
        claim(body, spec.getSetter());
        String statement = "const [" + spec.getName() + ", " + spec.getSetter() + "] = useState("
                + (spec.getInitialValue() == null ? "" : spec.getInitialValue()) + ");";
        return insertAtTop(body, statement, STATE_PRIORITY, sequence, "add state '" + spec.getName() + "'");
    }

    public List<TextEdit> addEffect(UseEffectSpec spec, int sequence) {
        Body body = resolveBody(spec.getComponent());
        String inner = body.indent + indentation;

        StringBuilder effect = new StringBuilder("useEffect(() => {");
        if (!spec.getBody().isBlank()) {
            effect.append("\n").append(indentBlock(spec.getBody(), inner));
        }
        if (spec.getCleanup() != null && !spec.getCleanup().isBlank()) {
            effect.append("\n").append(inner).append("return () => {")
                    .append("\n").append(indentBlock(spec.getCleanup(), inner + indentation))
                    .append("\n").append(inner).append("};");
        }
        effect.append("\n").append(body.indent).append("}");
        if (spec.getDependencies() != null) {
            effect.append(", [").append(String.join(", ", spec.getDependencies())).append("]");
        }
        effect.append(");");
        return insertAfterHooks(body, effect.toString(), EFFECT_PRIORITY, sequence, "add effect");
    }

    public List<TextEdit> addHookVariable(HookVariableSpec spec, int sequence) {
        Body body = resolveBody(spec.getComponent());
        claim(body, spec.getName());
        String description = "add " + spec.getKind().getHookName() + " '" + spec.getName() + "'";
        String deps = "[" + String.join(", ", spec.getDependencies()) + "]";

        switch (spec.getKind()) {
            case REF: {
                String initial = spec.getValue() == null ? "null" : spec.getValue();
                String statement = "const " + spec.getName() + " = useRef(" + initial + ");";
                return insertAtTop(body, statement, REF_PRIORITY, sequence, description);
            }
            case MEMO: {
                String statement = "const " + spec.getName() + " = useMemo(() => " + spec.getValue() + ", " + deps + ");";
                return insertAfterHooks(body, statement, MEMO_PRIORITY, sequence, description);
            }
            case CALLBACK: {
                String statement = "const " + spec.getName() + " = useCallback((" + String.join(", ", spec.getParams())
                        + ") => {" + blockBody(spec.getValue(), body.indent) + "}, " + deps + ");";
                return insertAfterHooks(body, statement, CALLBACK_PRIORITY, sequence, description);
            }
            default:
                throw new IllegalArgumentException("Unsupported hook: " + spec.getKind());
        }
    }

    public List<TextEdit> addFunction(FunctionSpec spec, int sequence) {
        Body body = resolveBody(spec.getComponent());
        claim(body, spec.getName());
        String params = String.join(", ", spec.getParams());
        String async = spec.isAsync() ? "async " : "";
        String statement = spec.isArrow()
                ? "const " + spec.getName() + " = " + async + "(" + params + ") => {" + blockBody(spec.getBody(), body.indent) + "};"
                : async + "function " + spec.getName() + "(" + params + ") {" + blockBody(spec.getBody(), body.indent) + "}";
        String description = "add function '" + spec.getName() + "'";

        SyntaxNode anchor = null;
        for (SyntaxNode statementNode : body.statements) {
            if (statementNode == body.terminalReturn) break;
            if (!"comment".equals(statementNode.getType())) anchor = statementNode;
        }
        if (anchor == null) {
            return insertAtTop(body, statement, FUNCTION_PRIORITY, sequence, description);
        }
        return List.of(TextEdit.insert(anchor.getEndIndex(), "\n" + body.indent + statement,
                FUNCTION_PRIORITY, sequence, description));
    }

    /**
     * Adds {@code const [name, dispatch] = useReducer(reducer, initialState);} after the hooks and the
     * reducer function, a switch over {@code action.type}, at the top of the body.
     */
    public List<TextEdit> addReducer(ReducerSpec spec, int sequence) {
        Body body = resolveBody(spec.getComponent());
        claim(body, spec.getName());
        claim(body, spec.getDispatch());
        claim(body, spec.getReducerName());
        String description = "add reducer '" + spec.getName() + "'";
        String inner = body.indent + indentation;
        String caseIndent = inner + indentation;

        StringBuilder reducer = new StringBuilder("function ").append(spec.getReducerName())
                .append("(state, action) {\n")
                .append(inner).append("switch (action.type) {\n");
        for (Map.Entry<String, String> action : spec.getActions().entrySet()) {
            reducer.append(caseIndent).append("case '").append(action.getKey()).append("':\n");
            if (!action.getValue().isBlank()) {
                reducer.append(indentBlock(action.getValue(), caseIndent + indentation)).append("\n");
            }
        }
        reducer.append(caseIndent).append("default:\n")
                .append(caseIndent).append(indentation).append("return state;\n")
                .append(inner).append("}\n")
                .append(body.indent).append("}");
        String call = "const [" + spec.getName() + ", " + spec.getDispatch() + "] = useReducer("
                + spec.getReducerName() + ", " + spec.getInitialState() + ");";

        List<TextEdit> edits = new ArrayList<>(insertAtTop(body, reducer.toString(), REDUCER_FUNCTION_PRIORITY,
                sequence, description + " (reducer function)"));
        edits.addAll(insertAfterHooks(body, call, REDUCER_PRIORITY, sequence, description));
        return edits;
    }

    /**
     * Replaces the block body of the function named {@code functionName}, keeping its signature.
     */
    public List<TextEdit> replaceFunctionBody(String functionName, String code, int sequence) {
        FunctionMatch function = query.findFunction(functionName).orElseThrow(() ->
                new ModificationException(ErrorKind.TARGET_NOT_FOUND, "function '" + functionName + "' not found"));
        SyntaxNode block = function.getBody();
        if (block == null) {
            throw new ModificationException(ErrorKind.TARGET_NOT_FOUND,
                    "function '" + functionName + "' has an expression body");
        }
        String indent = source.lineIndentation(block.getStartIndex());
        return List.of(TextEdit.replace(block.getStartIndex(), block.getEndIndex(), "{" + blockBody(code, indent) + "}",
                BODY_PRIORITY, sequence, "replace body of function '" + functionName + "'"));
    }

    public List<TextEdit> addConditionalRender(ConditionalRenderSpec spec, int sequence) {
        Body body = resolveBody(spec.getComponent());
        SyntaxNode returnStatement = body.terminalReturn;
        SyntaxNode returned = null;
        if (returnStatement != null) {
            for (SyntaxNode child : returnStatement.getNamedChildren()) {
                if (!"comment".equals(child.getType())) {
                    returned = child;
                    break;
                }
            }
        }
        if (returned == null) {
            throw new ModificationException(ErrorKind.TARGET_NOT_FOUND,
                    "component " + body.component.describe() + " does not end with a return statement that returns a value");
        }
        String description = "render " + body.component.describe() + " only if " + spec.getCondition();

        if (spec.getStyle() == ConditionalRenderSpec.Style.EARLY_RETURN) {
            String indent = source.lineIndentation(returnStatement.getStartIndex());
            String guard = "if (" + negate(spec.getCondition()) + ") {\n"
                    + indent + indentation + "return " + spec.getFallback() + ";\n"
                    + indent + "}\n\n" + indent;
            return List.of(TextEdit.insert(returnStatement.getStartIndex(), guard, GUARD_PRIORITY, sequence, description));
        }
        // a later condition closes before an earlier one, so nested ternaries stay balanced
        return List.of(
                TextEdit.insert(returned.getStartIndex(), spec.getCondition() + " ? ",
                        CONDITION_OPEN_PRIORITY, sequence, description + " (condition)")
                        .anchoredTo(returned.getStartIndex(), returned.getEndIndex()),
                TextEdit.insert(returned.getEndIndex(), " : " + spec.getFallback(),
                        CONDITION_CLOSE_PRIORITY, -sequence, description + " (fallback)")
                        .anchoredTo(returned.getStartIndex(), returned.getEndIndex()));
    }

    private static String negate(String condition) {
        if (condition.matches("!*[A-Za-z_$][\\w$]*(\\??\\.[A-Za-z_$][\\w$]*)*")) {
            return "!" + condition;
        }
        return "!(" + condition + ")";
    }

    private List<TextEdit> insertAfterHooks(Body body, String statement, int priority, int sequence, String description) {
        SyntaxNode anchor = null;
        for (SyntaxNode statementNode : body.statements) {
            if (statementNode == body.terminalReturn) break;
            if (isHookStatement(statementNode)) anchor = statementNode;
        }
        if (anchor == null) {
            return insertAtTop(body, statement, priority, sequence, description);
        }
        return List.of(TextEdit.insert(anchor.getEndIndex(), "\n" + body.indent + statement,
                priority, sequence, description));
    }

    private List<TextEdit> insertAtTop(Body body, String statement, int priority, int sequence, String description) {
        List<TextEdit> edits = new ArrayList<>();
        edits.add(TextEdit.insert(body.openEnd, "\n" + body.indent + statement, priority, sequence, description));
        if (body.closesOnSameLine && brokenEmptyBodies.add(body.node.getStartIndex())) {
            edits.add(TextEdit.insert(body.closeStart, "\n" + source.lineIndentation(body.node.getStartIndex()),
                    CLOSING_BREAK_PRIORITY, sequence, description + " (closing line break)"));
        }
        return edits;
    }

    private boolean isHookStatement(SyntaxNode statement) {
        if (isNodeTypeOneOf(statement, "lexical_declaration", "variable_declaration")) {
            for (SyntaxNode declarator : findAllChildren(statement, "variable_declarator")) {
                if (isHookName(getCalleeName(declarator.getChildByFieldName("value")))) return true;
            }
            return false;
        }
        if ("expression_statement".equals(statement.getType())) {
            return isHookName(getCalleeName(statement.getNamedChild(0)));
        }
        return false;
    }

    private String blockBody(String code, String indent) {
        if (code == null || code.isBlank()) {
            return "\n" + indent;
        }
        return "\n" + indentBlock(code, indent + indentation) + "\n" + indent;
    }

    /**
     * Re-indents {@code code} so its least indented line starts at {@code prefix}.
     */
    static String indentBlock(String code, String prefix) {
        String[] lines = code.stripIndent().split("\n", -1);
        int first = 0;
        int last = lines.length - 1;
        while (first < last && lines[first].isBlank()) first++;
        while (last > first && lines[last].isBlank()) last--;

        StringBuilder sb = new StringBuilder();
        for (int i = first; i <= last; i++) {
            if (i > first) sb.append("\n");
            if (!lines[i].isBlank()) sb.append(prefix).append(lines[i]);
        }
        return sb.toString();
    }

    private void claim(Body body, String name) {
        Set<String> queued = queuedNames.computeIfAbsent(body.node.getStartIndex(), k -> new HashSet<>());
        if (query.isDeclaredIn(body.node, name) || queued.contains(name)) {
            throw new ModificationException(ErrorKind.DUPLICATE_DECLARATION,
                    "'" + name + "' is already declared in " + body.component.describe());
        }
        queued.add(name);
    }

    private Body resolveBody(String componentName) {
        FunctionMatch component = query.findComponentFunction(componentName).orElseThrow(() ->
                new ModificationException(ErrorKind.TARGET_NOT_FOUND, componentName != null
                        ? "component function '" + componentName + "' not found"
                        : "no component function found (no default export and no capitalized top-level function)"));
        SyntaxNode body = component.getBody();
        if (body == null) {
            throw new ModificationException(ErrorKind.TARGET_NOT_FOUND,
                    "component " + component.describe() + " has an expression body; hooks need a block body");
        }
        LOG.debug("Inserting into {} body at {}", component.describe(), body);
        return new Body(component, body);
    }

    private final class Body {
        final FunctionMatch component;
        final SyntaxNode node;
        final List<SyntaxNode> statements;
        final SyntaxNode terminalReturn;
        final String indent;
        final int openEnd;
        final int closeStart;
        final boolean closesOnSameLine;

        Body(FunctionMatch component, SyntaxNode node) {
            this.component = component;
            this.node = node;
            this.statements = node.getNamedChildren();

            SyntaxNode lastStatement = null;
            for (SyntaxNode statement : statements) {
                if (!"comment".equals(statement.getType())) lastStatement = statement;
            }
            this.terminalReturn = lastStatement != null && "return_statement".equals(lastStatement.getType())
                    ? lastStatement : null;

            SyntaxNode open = node.findToken("{");
            SyntaxNode close = node.findToken("}");
            this.openEnd = open != null ? open.getEndIndex() : node.getStartIndex() + 1;
            this.closeStart = close != null ? close.getStartIndex() : node.getEndIndex() - 1;
            this.closesOnSameLine = statements.isEmpty() && !source.substring(openEnd, closeStart).contains("\n");

            SyntaxNode first = statements.isEmpty() ? null : statements.get(0);
            this.indent = first != null && source.isFirstOnLine(first.getStartIndex())
                    ? source.lineIndentation(first.getStartIndex())
                    : source.lineIndentation(node.getStartIndex()) + indentation;
        }
    }
}

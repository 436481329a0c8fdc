package org.dxworks.codemod;

import org.dxworks.codemod.generate.CodeGenerator;
import org.dxworks.codemod.imports.ImportSpec;
import org.dxworks.codemod.model.ErrorKind;
import org.dxworks.codemod.model.GenerationResult;
import org.dxworks.codemod.model.ModificationError;
import org.dxworks.codemod.model.ModificationException;
import org.dxworks.codemod.parser.ComponentParser;
import org.dxworks.codemod.parser.SyntaxNode;
import org.dxworks.codemod.parser.SyntaxTree;
import org.dxworks.codemod.query.ElementLocator;
import org.dxworks.codemod.query.NodeQuery;
import org.dxworks.codemod.request.AddConditionalRender;
import org.dxworks.codemod.request.AddFunction;
import org.dxworks.codemod.request.AddHookVariable;
import org.dxworks.codemod.request.AddImport;
import org.dxworks.codemod.request.AddReducer;
import org.dxworks.codemod.request.AddStateVariable;
import org.dxworks.codemod.request.AddUseEffect;
import org.dxworks.codemod.request.ClassNameSpec;
import org.dxworks.codemod.request.ConditionalRenderSpec;
import org.dxworks.codemod.request.DeleteElement;
import org.dxworks.codemod.request.ElementTarget;
import org.dxworks.codemod.request.FunctionSpec;
import org.dxworks.codemod.request.HookVariableSpec;
import org.dxworks.codemod.request.InsertMarkup;
import org.dxworks.codemod.request.MarkupPosition;
import org.dxworks.codemod.request.ModificationRequest;
import org.dxworks.codemod.request.ModifyClassName;
import org.dxworks.codemod.request.ModifyProp;
import org.dxworks.codemod.request.PatchText;
import org.dxworks.codemod.request.PropSpec;
import org.dxworks.codemod.request.ReducerSpec;
import org.dxworks.codemod.request.ReplaceFunctionBody;
import org.dxworks.codemod.request.ReplaceText;
import org.dxworks.codemod.request.StateVariableSpec;
import org.dxworks.codemod.request.TextPatch;
import org.dxworks.codemod.request.UseEffectSpec;
import org.dxworks.codemod.request.WrapElement;
import org.dxworks.codemod.request.WrapperSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A modification session over one component source. The source is parsed once; mutation methods
 * only queue requests, and {@link #generate()} resolves the whole queue against the original tree.
 * <p>
 * A session is single use: after {@code generate()} every further call fails with
 * {@link IllegalStateException}.
 */
public class ComponentModifier {
    private static final Logger LOG = LoggerFactory.getLogger(ComponentModifier.class);
    private static final String BOM = "\uFEFF";

    private enum State {IDLE, ACCUMULATING, GENERATED}

    private final CodemodConfig config;
    private final List<ModificationRequest> queue = new ArrayList<>();
    private State state = State.IDLE;
    private boolean initialized;
    private String bom = "";
    private SyntaxTree tree;
    private NodeQuery query;
    private ModificationError parseFailure;

    public ComponentModifier(CodemodConfig config) {
        this.config = config;
    }

    public static ComponentModifier initialize(String sourceCode) {
        return initialize(sourceCode, CodemodConfig.defaults());
    }

    public static ComponentModifier initialize(String sourceCode, CodemodConfig config) {
        ComponentModifier modifier = new ComponentModifier(config);
        modifier.parse(sourceCode);
        return modifier;
    }

    /**
     * Parses {@code sourceCode}. Parse problems do not throw; they are reported by {@link #generate()}.
     */
    public ComponentModifier parse(String sourceCode) {
        if (initialized) {
            throw new IllegalStateException("Session already initialized");
        }
        initialized = true;
        String code = sourceCode == null ? "" : sourceCode;
        if (code.startsWith(BOM)) {
            bom = BOM;
            code = code.substring(1);
        }
        try {
            tree = new ComponentParser(config.getDialect()).parse(code);
            query = new NodeQuery(tree);
            if (tree.hasErrors()) {
                parseFailure = new ModificationError(ErrorKind.PARSE_FAILURE,
                        "source has " + tree.getDiagnostics().size() + " syntax problem(s), first "
                                + tree.getDiagnostics().get(0).describe());
            }
        } catch (ModificationException e) {
            LOG.warn("Could not parse source: {}", e.getMessage());
            parseFailure = e.toError();
        }
        return this;
    }

    /** The session's tree, or null when parsing produced none. */
    public SyntaxTree getTree() {
        return tree;
    }

    public NodeQuery getQueryLayer() {
        return query;
    }

    public CodemodConfig getConfig() {
        return config;
    }

    public List<ModificationRequest> getQueue() {
        return Collections.unmodifiableList(queue);
    }

    public ComponentModifier addImport(ImportSpec spec) {
        return enqueue(new AddImport(spec));
    }

    public ComponentModifier addStateVariable(StateVariableSpec spec) {
        AddStateVariable request = new AddStateVariable(spec);
        requireHook("useState");
        return enqueue(request);
    }

    public ComponentModifier addUseEffect(UseEffectSpec spec) {
        AddUseEffect request = new AddUseEffect(spec);
        requireHook("useEffect");
        return enqueue(request);
    }

    public ComponentModifier addRef(String name, String initialValue) {
        return addHookVariable(HookVariableSpec.ref(name, initialValue));
    }

    public ComponentModifier addMemo(String name, String computation, List<String> dependencies) {
        return addHookVariable(HookVariableSpec.memo(name, computation, dependencies));
    }

    public ComponentModifier addCallback(String name, List<String> params, String body, List<String> dependencies) {
        return addHookVariable(HookVariableSpec.callback(name, params, body, dependencies));
    }

    public ComponentModifier addHookVariable(HookVariableSpec spec) {
        AddHookVariable request = new AddHookVariable(spec);
        requireHook(spec.getKind().getHookName());
        return enqueue(request);
    }

    public ComponentModifier addFunction(FunctionSpec spec) {
        return enqueue(new AddFunction(spec));
    }

    public ComponentModifier addReducer(ReducerSpec spec) {
        AddReducer request = new AddReducer(spec);
        requireHook("useReducer");
        return enqueue(request);
    }

    public ComponentModifier replaceFunctionBody(String functionName, String body) {
        return enqueue(new ReplaceFunctionBody(functionName, body));
    }

    public ComponentModifier addConditionalRender(ConditionalRenderSpec spec) {
        return enqueue(new AddConditionalRender(spec));
    }

    public ComponentModifier wrapElement(SyntaxNode target, WrapperSpec wrapper) {
        return wrapElement(ElementTarget.of(target), wrapper);
    }

    public ComponentModifier wrapElement(ElementLocator target, WrapperSpec wrapper) {
        return wrapElement(ElementTarget.of(target), wrapper);
    }

    public ComponentModifier wrapElement(ElementTarget target, WrapperSpec wrapper) {
        WrapElement request = new WrapElement(target, wrapper);
        if (wrapper.getImportSpec() != null) {
            addImport(wrapper.getImportSpec());
        }
        return enqueue(request);
    }

    public ComponentModifier insertMarkup(ElementTarget target, MarkupPosition position, String markup) {
        return enqueue(new InsertMarkup(target, position, markup));
    }

    public ComponentModifier deleteElement(ElementLocator locator) {
        return enqueue(new DeleteElement(locator));
    }

    public ComponentModifier modifyProp(ElementTarget target, PropSpec prop) {
        return enqueue(new ModifyProp(target, prop));
    }

    public ComponentModifier modifyClassName(ElementTarget target, ClassNameSpec spec) {
        return enqueue(new ModifyClassName(target, spec));
    }

    public ComponentModifier replaceText(String searchFor, String replaceWith) {
        return enqueue(new ReplaceText(searchFor, replaceWith));
    }

    public ComponentModifier patchText(TextPatch patch) {
        return enqueue(new PatchText(patch));
    }

    /**
     * Resolves the queue. Can be called once per session.
     */
    public GenerationResult generate() {
        requireOpen();
        state = State.GENERATED;
        if (parseFailure != null) {
            return GenerationResult.failure(List.of(parseFailure));
        }
        LOG.debug("Generating code for {} queued request(s)", queue.size());
        GenerationResult result = new CodeGenerator(query, config).generate(queue);
        if (result.success && !bom.isEmpty()) {
            result.code = bom + result.code;
        }
        return result;
    }

    private void requireHook(String hookName) {
        addImport(ImportSpec.named(config.getHookSource(), hookName));
    }

    private ComponentModifier enqueue(ModificationRequest request) {
        requireOpen();
        queue.add(request);
        state = State.ACCUMULATING;
        LOG.debug("Queued #{}: {}", queue.size() - 1, request.describe());
        return this;
    }

    private void requireOpen() {
        if (!initialized) {
            throw new IllegalStateException("Session not initialized; call parse(source) first");
        }
        if (state == State.GENERATED) {
            throw new IllegalStateException("generate() was already called on this session");
        }
    }
}

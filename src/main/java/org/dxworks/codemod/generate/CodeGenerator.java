package org.dxworks.codemod.generate;

import org.dxworks.codemod.CodemodConfig;
import org.dxworks.codemod.imports.AmbiguousImportCombinationException;
import org.dxworks.codemod.imports.ImportMergeResolver;
import org.dxworks.codemod.imports.ImportResolution;
import org.dxworks.codemod.imports.ImportSpec;
import org.dxworks.codemod.model.ErrorKind;
import org.dxworks.codemod.model.GenerationResult;
import org.dxworks.codemod.model.ModificationError;
import org.dxworks.codemod.model.ModificationException;
import org.dxworks.codemod.model.TextEdit;
import org.dxworks.codemod.parser.ComponentParser;
import org.dxworks.codemod.parser.SyntaxDiagnostic;
import org.dxworks.codemod.parser.SyntaxTree;
import org.dxworks.codemod.query.NodeQuery;
import org.dxworks.codemod.request.AddConditionalRender;
import org.dxworks.codemod.request.AddFunction;
import org.dxworks.codemod.request.AddHookVariable;
import org.dxworks.codemod.request.AddImport;
import org.dxworks.codemod.request.AddReducer;
import org.dxworks.codemod.request.AddStateVariable;
import org.dxworks.codemod.request.AddUseEffect;
import org.dxworks.codemod.request.DeleteElement;
import org.dxworks.codemod.request.InsertMarkup;
import org.dxworks.codemod.request.ModificationRequest;
import org.dxworks.codemod.request.ModifyClassName;
import org.dxworks.codemod.request.ModifyProp;
import org.dxworks.codemod.request.PatchText;
import org.dxworks.codemod.request.ReplaceFunctionBody;
import org.dxworks.codemod.request.ReplaceText;
import org.dxworks.codemod.request.WrapElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a queue of requests into new source text.
 * <ol>
 *     <li>imports are merged per source, one edit per source</li>
 *     <li>structural requests become edits against the original tree's ranges</li>
 *     <li>edits are spliced right to left</li>
 *     <li>text replacements and patches run over the spliced text, in queue order</li>
 *     <li>optionally the output is parsed again; when it does not parse, requests are re-applied
 *     one by one and those that break the output are dropped with a syntax error</li>
 * </ol>
 * Per-request problems are collected; the run stops only on parse or unexpected failures.
 */
public class CodeGenerator {
    private static final Logger LOG = LoggerFactory.getLogger(CodeGenerator.class);

    private final SyntaxTree tree;
    private final NodeQuery query;
    private final CodemodConfig config;

    public CodeGenerator(NodeQuery query, CodemodConfig config) {
        this.tree = query.getTree();
        this.query = query;
        this.config = config;
    }

    public GenerationResult generate(List<ModificationRequest> queue) {
        List<ModificationError> problems = new ArrayList<>();
        try {
            EditList edits = new EditList();
            List<EditBatch> batches = new ArrayList<>();
            resolveImports(queue, edits, batches, problems);
            resolveStructural(queue, edits, batches, problems);

            LOG.debug("Splicing {} edit(s) into {} bytes", edits.size(), tree.getSource().length());
            List<ModificationError> patchProblems = new ArrayList<>();
            String code = applyTextPatches(queue, edits.apply(tree.getSource()), patchProblems);

            if (config.isValidateOutput()) {
                SyntaxDiagnostic first = firstDiagnostic(code);
                if (first != null) {
                    LOG.warn("Generated code failed validation, replaying requests one by one: {}", first.describe());
                    return GenerationResult.success(keepParsingRequests(queue, batches, problems), problems);
                }
            }
            problems.addAll(patchProblems);
            return GenerationResult.success(code, problems);
        } catch (AmbiguousImportCombinationException e) {
            throw e;
        } catch (ModificationException e) {
            problems.add(e.toError());
            return GenerationResult.failure(problems);
        } catch (RuntimeException e) {
            LOG.error("Code generation failed", e);
            problems.add(new ModificationError(ErrorKind.GENERATION_FAILURE, String.valueOf(e.getMessage())));
            return GenerationResult.failure(problems);
        }
    }

    /**
     * Re-applies the accepted work one request at a time, in queue order, keeping each request only
     * if the output still parses with it. The original source parses, so the result always does.
     */
    private String keepParsingRequests(List<ModificationRequest> queue, List<EditBatch> batches,
                                       List<ModificationError> problems) {
        List<EditBatch> ordered = new ArrayList<>(batches);
        ordered.sort(Comparator.comparingInt(batch -> batch.sequence));

        List<TextEdit> kept = new ArrayList<>();
        String code = tree.getSourceCode();
        for (EditBatch batch : ordered) {
            EditList candidate = new EditList();
            candidate.addAll(kept);
            candidate.addAll(batch.edits);
            String candidateCode = candidate.apply(tree.getSource());
            SyntaxDiagnostic first = firstDiagnostic(candidateCode);
            if (first == null) {
                kept.addAll(batch.edits);
                code = candidateCode;
            } else {
                reject(batch.description, first, problems);
            }
        }

        for (ModificationRequest request : queue) {
            if (!(request instanceof ReplaceText) && !(request instanceof PatchText)) continue;
            try {
                String patched = applyTextPatch(request, code);
                SyntaxDiagnostic first = firstDiagnostic(patched);
                if (first == null) {
                    code = patched;
                } else {
                    reject(request.describe(), first, problems);
                }
            } catch (TextNotFoundException e) {
                LOG.warn("Skipping {}: {}", request.describe(), e.getMessage());
                problems.add(e.toError());
            }
        }
        return code;
    }

    private void reject(String description, SyntaxDiagnostic diagnostic, List<ModificationError> problems) {
        LOG.warn("Dropping {}: {}", description, diagnostic.describe());
        problems.add(new ModificationError(ErrorKind.SYNTAX_ERROR,
                description + " was dropped, the output would not parse: " + diagnostic.describe()));
    }

    private SyntaxDiagnostic firstDiagnostic(String code) {
        List<SyntaxDiagnostic> diagnostics = new ComponentParser(tree.getDialect()).parse(code).getDiagnostics();
        return diagnostics.isEmpty() ? null : diagnostics.get(0);
    }

    private void resolveImports(List<ModificationRequest> queue, EditList edits, List<EditBatch> batches,
                                List<ModificationError> problems) {
        Map<String, List<ImportSpec>> bySource = new LinkedHashMap<>();
        Map<String, Integer> firstSeen = new LinkedHashMap<>();
        for (int i = 0; i < queue.size(); i++) {
            if (queue.get(i) instanceof AddImport) {
                ImportSpec spec = ((AddImport) queue.get(i)).getSpec();
                bySource.computeIfAbsent(spec.getSource(), k -> new ArrayList<>()).add(spec);
                firstSeen.putIfAbsent(spec.getSource(), i);
            }
        }
        if (bySource.isEmpty()) return;

        ImportMergeResolver resolver = new ImportMergeResolver(query);
        for (Map.Entry<String, List<ImportSpec>> entry : bySource.entrySet()) {
            try {
                int sequence = firstSeen.get(entry.getKey());
                ImportResolution resolution = resolver.resolve(entry.getValue(), sequence);
                problems.addAll(resolution.getConflicts());
                if (!resolution.isUnchanged()) {
                    edits.add(resolution.getEdit());
                    batches.add(new EditBatch(sequence, "imports from '" + entry.getKey() + "'",
                            List.of(resolution.getEdit())));
                }
            } catch (ModificationException e) {
                LOG.warn("Skipping imports from '{}': {}", entry.getKey(), e.getMessage());
                problems.add(e.toError());
            }
        }
    }

    private void resolveStructural(List<ModificationRequest> queue, EditList edits, List<EditBatch> batches,
                                   List<ModificationError> problems) {
        HookInserter hooks = new HookInserter(query, config);
        MarkupEditor markup = new MarkupEditor(query, config);

        for (int sequence = 0; sequence < queue.size(); sequence++) {
            ModificationRequest request = queue.get(sequence);
            try {
                List<TextEdit> requestEdits = editsFor(request, sequence, hooks, markup);
                if (requestEdits.isEmpty()) continue;
                edits.addAll(requestEdits);
                batches.add(new EditBatch(sequence, request.describe(), requestEdits));
                LOG.debug("Queued {}: {}", request.describe(), requestEdits);
            } catch (ModificationException e) {
                LOG.warn("Skipping {}: {}", request.describe(), e.getMessage());
                problems.add(e.toError());
            }
        }
    }

    private List<TextEdit> editsFor(ModificationRequest request, int sequence, HookInserter hooks, MarkupEditor markup) {
        switch (request.getType()) {
            case ADD_STATE_VARIABLE:
                return hooks.addState(((AddStateVariable) request).getSpec(), sequence);
            case ADD_USE_EFFECT:
                return hooks.addEffect(((AddUseEffect) request).getSpec(), sequence);
            case ADD_HOOK_VARIABLE:
                return hooks.addHookVariable(((AddHookVariable) request).getSpec(), sequence);
            case ADD_REDUCER:
                return hooks.addReducer(((AddReducer) request).getSpec(), sequence);
            case ADD_FUNCTION:
                return hooks.addFunction(((AddFunction) request).getSpec(), sequence);
            case REPLACE_FUNCTION_BODY: {
                ReplaceFunctionBody replace = (ReplaceFunctionBody) request;
                return hooks.replaceFunctionBody(replace.getFunctionName(), replace.getBody(), sequence);
            }
            case ADD_CONDITIONAL_RENDER:
                return hooks.addConditionalRender(((AddConditionalRender) request).getSpec(), sequence);
            case WRAP_ELEMENT: {
                WrapElement wrap = (WrapElement) request;
                return markup.wrap(wrap.getTarget(), wrap.getWrapper(), sequence);
            }
            case INSERT_MARKUP: {
                InsertMarkup insert = (InsertMarkup) request;
                return markup.insert(insert.getTarget(), insert.getPosition(), insert.getMarkup(), sequence);
            }
            case DELETE_ELEMENT:
                return markup.delete(((DeleteElement) request).getLocator(), sequence);
            case MODIFY_PROP: {
                ModifyProp modify = (ModifyProp) request;
                return markup.modifyProp(modify.getTarget(), modify.getProp(), sequence);
            }
            case MODIFY_CLASS_NAME: {
                ModifyClassName modify = (ModifyClassName) request;
                return markup.modifyClassName(modify.getTarget(), modify.getSpec(), sequence);
            }
            default:
                // imports were resolved up front, text patches run after splicing
                return List.of();
        }
    }

    private String applyTextPatches(List<ModificationRequest> queue, String code, List<ModificationError> problems) {
        String result = code;
        for (ModificationRequest request : queue) {
            try {
                result = applyTextPatch(request, result);
            } catch (TextNotFoundException e) {
                LOG.warn("Skipping {}: {}", request.describe(), e.getMessage());
                problems.add(e.toError());
            }
        }
        return result;
    }

    private static String applyTextPatch(ModificationRequest request, String code) {
        if (request instanceof ReplaceText) {
            ReplaceText replace = (ReplaceText) request;
            return TextPatcher.replaceAll(code, replace.getSearchFor(), replace.getReplaceWith());
        }
        if (request instanceof PatchText) {
            return TextPatcher.apply(code, ((PatchText) request).getPatch());
        }
        return code;
    }

    /**
     * The edits one request (or one import source) contributed.
     */
    private static final class EditBatch {
        final int sequence;
        final String description;
        final List<TextEdit> edits;

        EditBatch(int sequence, String description, List<TextEdit> edits) {
            this.sequence = sequence;
            this.description = description;
            this.edits = edits;
        }
    }
}

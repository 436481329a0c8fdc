package org.dxworks.codemod.imports;

import org.dxworks.codemod.model.ErrorKind;
import org.dxworks.codemod.model.ModificationError;
import org.dxworks.codemod.model.TextEdit;
import org.dxworks.codemod.parser.SyntaxNode;
import org.dxworks.codemod.query.ImportInfo;
import org.dxworks.codemod.query.NodeQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges requested {@link ImportSpec}s with the import statements already present in a file.
 * Per source, the result is either a patch to one existing statement, a new statement, or nothing.
 */
public class ImportMergeResolver {
    private static final Logger LOG = LoggerFactory.getLogger(ImportMergeResolver.class);

    public static final int IMPORT_PRIORITY = 100;

    private final NodeQuery query;
    private final List<ImportInfo> existing;

    public ImportMergeResolver(NodeQuery query) {
        this.query = query;
        this.existing = query.findImportInfos();
    }

    public static void requireUnambiguous(String source, String defaultImport, String namespaceImport) {
        if (defaultImport != null && namespaceImport != null) {
            throw new AmbiguousImportCombinationException(source, defaultImport, namespaceImport);
        }
    }

    /**
     * Folds several requests for the same source into one spec. Named specifiers are unioned in
     * request order; a later request naming a different default or namespace specifier, or the
     * other kind of the two, is dropped and reported.
     */
    public static MergedImport mergeRequests(List<ImportSpec> requests) {
        if (requests.isEmpty()) {
            throw new IllegalArgumentException("Nothing to merge");
        }
        String source = requests.get(0).getSource();
        String defaultImport = null;
        String namespaceImport = null;
        List<String> named = new ArrayList<>();
        List<ModificationError> conflicts = new ArrayList<>();

        for (ImportSpec request : requests) {
            if (!source.equals(request.getSource())) {
                throw new IllegalArgumentException("Cannot merge imports from '" + source
                        + "' and '" + request.getSource() + "'");
            }
            String requestedDefault = request.getDefaultImport();
            if (requestedDefault != null) {
                if (namespaceImport != null) {
                    conflicts.add(conflict("default import '" + requestedDefault + "' from '" + source
                            + "' cannot join namespace import '" + namespaceImport + "'"));
                } else if (defaultImport == null) {
                    defaultImport = requestedDefault;
                } else if (!defaultImport.equals(requestedDefault)) {
                    conflicts.add(conflict("default import '" + requestedDefault + "' from '" + source
                            + "' conflicts with requested default '" + defaultImport + "'"));
                }
            }
            String requestedNamespace = request.getNamespaceImport();
            if (requestedNamespace != null) {
                if (defaultImport != null) {
                    conflicts.add(conflict("namespace import '" + requestedNamespace + "' from '" + source
                            + "' cannot join default import '" + defaultImport + "'"));
                } else if (namespaceImport == null) {
                    namespaceImport = requestedNamespace;
                } else if (!namespaceImport.equals(requestedNamespace)) {
                    conflicts.add(conflict("namespace import '" + requestedNamespace + "' from '" + source
                            + "' conflicts with requested namespace '" + namespaceImport + "'"));
                }
            }
            named.addAll(request.getNamedImports());
        }
        return new MergedImport(new ImportSpec(source, defaultImport, named, namespaceImport), conflicts);
    }

    public ImportResolution resolve(ImportSpec spec) {
        return resolve(List.of(spec), 0);
    }

    /**
     * Resolves all requests for one source against the file's existing imports.
     *
     * @param sequence queue position used to order the resulting edit among others at the same offset
     */
    public ImportResolution resolve(List<ImportSpec> requests, int sequence) {
        MergedImport merged = mergeRequests(requests);
        ImportSpec spec = merged.getSpec();
        List<ModificationError> conflicts = new ArrayList<>(merged.getConflicts());

        List<ImportInfo> matching = new ArrayList<>();
        for (ImportInfo info : existing) {
            if (!info.typeOnly && spec.getSource().equals(info.source)) {
                matching.add(info);
            }
        }
        if (matching.isEmpty()) {
            TextEdit edit = newStatementEdit(spec, sequence);
            LOG.debug("New import statement for '{}' at offset {}", spec.getSource(), edit.getStart());
            return new ImportResolution(spec.getSource(), edit, true, conflicts);
        }

        TextEdit edit = patchExisting(spec, matching, sequence, conflicts);
        if (edit == null) {
            LOG.debug("Existing imports already cover '{}'", spec.getSource());
        }
        return new ImportResolution(spec.getSource(), edit, false, conflicts);
    }

    private TextEdit patchExisting(ImportSpec spec, List<ImportInfo> matching, int sequence,
                                   List<ModificationError> conflicts) {
        String source = spec.getSource();
        String existingDefault = null;
        String existingNamespace = null;
        boolean existingNamed = false;
        Set<String> present = new HashSet<>();
        for (ImportInfo info : matching) {
            if (existingDefault == null) existingDefault = info.defaultImport;
            if (existingNamespace == null) existingNamespace = info.namespaceImport;
            existingNamed |= info.namedImports != null;
            present.addAll(info.importedNames);
        }

        String addDefault = spec.getDefaultImport();
        if (addDefault != null) {
            if (existingDefault != null) {
                if (!existingDefault.equals(addDefault)) {
                    conflicts.add(conflict("default import '" + addDefault + "' from '" + source
                            + "' conflicts with existing default '" + existingDefault + "'"));
                }
                addDefault = null;
            } else if (existingNamespace != null) {
                conflicts.add(conflict("default import '" + addDefault + "' cannot be combined with existing namespace import '"
                        + existingNamespace + "' from '" + source + "'"));
                addDefault = null;
            }
        }

        String addNamespace = spec.getNamespaceImport();
        if (addNamespace != null) {
            if (existingNamespace != null) {
                if (!existingNamespace.equals(addNamespace)) {
                    conflicts.add(conflict("namespace import '" + addNamespace + "' from '" + source
                            + "' conflicts with existing namespace '" + existingNamespace + "'"));
                }
                addNamespace = null;
            } else if (existingDefault != null || existingNamed) {
                conflicts.add(conflict("namespace import '" + addNamespace + "' cannot be combined with the existing import from '"
                        + source + "'"));
                addNamespace = null;
            }
        }

        List<String> addNamed = new ArrayList<>();
        for (String specifier : spec.getNamedImports()) {
            if (!present.contains(ImportSpec.importedName(specifier))) {
                addNamed.add(specifier);
            }
        }

        ImportInfo target = chooseTarget(matching, !addNamed.isEmpty() || addDefault != null);
        if (target == null && (!addNamed.isEmpty() || addDefault != null)) {
            conflicts.add(conflict("named imports " + addNamed + " cannot be added to namespace import '"
                    + existingNamespace + "' from '" + source + "'"));
            addNamed.clear();
        }
        if (addDefault == null && addNamespace == null && addNamed.isEmpty()) {
            return null;
        }
        if (target == null) {
            // only a namespace remains to add and every statement is side-effect only
            target = matching.get(0);
        }

        String description = "import from '" + source + "'";
        if (target.isSideEffectOnly()) {
            ImportSpec upgraded = new ImportSpec(source, addDefault, addNamed, addNamespace);
            SyntaxNode node = target.node;
            return TextEdit.replace(node.getStartIndex(), node.getEndIndex(), render(upgraded, target.quote),
                    IMPORT_PRIORITY, sequence, description);
        }

        if (addDefault == null && addNamespace == null && target.namedImports != null) {
            return appendNamed(target, addNamed, sequence, description);
        }

        List<String> named = new ArrayList<>(target.namedSpecifiers);
        named.addAll(addNamed);
        String defaultName = target.defaultImport != null ? target.defaultImport : addDefault;
        String namespaceName = target.namespaceImport != null ? target.namespaceImport : addNamespace;
        requireUnambiguous(source, defaultName, namespaceName);
        String clause = renderClause(defaultName, namespaceName, named);
        return TextEdit.replace(target.clause.getStartIndex(), target.clause.getEndIndex(), clause,
                IMPORT_PRIORITY, sequence, description);
    }

    /**
     * Statement the new specifiers go into: one with a brace list, then a default-only one, then a
     * side-effect import. Namespace-only statements cannot take named or default specifiers.
     */
    private ImportInfo chooseTarget(List<ImportInfo> matching, boolean needsClause) {
        for (ImportInfo info : matching) {
            if (info.namedImports != null) return info;
        }
        for (ImportInfo info : matching) {
            if (info.defaultImport != null && info.namespaceImport == null) return info;
        }
        for (ImportInfo info : matching) {
            if (info.isSideEffectOnly()) return info;
        }
        return needsClause ? null : matching.get(0);
    }

    private TextEdit appendNamed(ImportInfo target, List<String> addNamed, int sequence, String description) {
        List<SyntaxNode> specifiers = new ArrayList<>();
        for (SyntaxNode child : target.namedImports.getNamedChildren()) {
            if ("import_specifier".equals(child.getType())) specifiers.add(child);
        }
        String joined = String.join(", ", addNamed);
        if (!specifiers.isEmpty()) {
            SyntaxNode last = specifiers.get(specifiers.size() - 1);
            return TextEdit.insert(last.getEndIndex(), ", " + joined, IMPORT_PRIORITY, sequence, description);
        }
        SyntaxNode brace = target.namedImports.findToken("{");
        int offset = brace != null ? brace.getEndIndex() : target.namedImports.getStartIndex() + 1;
        return TextEdit.insert(offset, " " + joined + " ", IMPORT_PRIORITY, sequence, description);
    }

    private TextEdit newStatementEdit(ImportSpec spec, int sequence) {
        char quote = existing.isEmpty() ? '\'' : existing.get(0).quote;
        String statement = render(spec, quote);
        String description = "import from '" + spec.getSource() + "'";

        List<SyntaxNode> imports = query.findImports();
        if (!imports.isEmpty()) {
            SyntaxNode last = imports.get(imports.size() - 1);
            return TextEdit.insert(last.getEndIndex(), "\n" + statement, IMPORT_PRIORITY, sequence, description);
        }
        SyntaxNode prologueEnd = lastDirective();
        if (prologueEnd != null) {
            return TextEdit.insert(prologueEnd.getEndIndex(), "\n" + statement, IMPORT_PRIORITY, sequence, description);
        }
        return TextEdit.insert(0, statement + "\n", IMPORT_PRIORITY, sequence, description);
    }

    /**
     * Last statement of a leading run of string directives such as {@code 'use client';}.
     */
    private SyntaxNode lastDirective() {
        SyntaxNode last = null;
        for (SyntaxNode statement : query.getTree().getRootNode().getNamedChildren()) {
            String type = statement.getType();
            if ("comment".equals(type)) continue;
            if ("hash_bang_line".equals(type)) {
                last = statement;
                continue;
            }
            if ("expression_statement".equals(type) && statement.getNamedChildCount() == 1
                    && "string".equals(statement.getNamedChild(0).getType())) {
                last = statement;
                continue;
            }
            break;
        }
        return last;
    }

    /**
     * Source text of a complete import statement for {@code spec}.
     */
    public static String render(ImportSpec spec, char quote) {
        String from = quote + spec.getSource() + quote;
        if (spec.isSideEffectOnly()) {
            return "import " + from + ";";
        }
        return "import " + renderClause(spec.getDefaultImport(), spec.getNamespaceImport(), spec.getNamedImports())
                + " from " + from + ";";
    }

    private static String renderClause(String defaultImport, String namespaceImport, List<String> named) {
        List<String> parts = new ArrayList<>();
        if (defaultImport != null) parts.add(defaultImport);
        if (namespaceImport != null) parts.add("* as " + namespaceImport);
        if (!named.isEmpty()) parts.add("{ " + String.join(", ", named) + " }");
        return String.join(", ", parts);
    }

    private static ModificationError conflict(String message) {
        LOG.warn("Import conflict: {}", message);
        return new ModificationError(ErrorKind.IMPORT_CONFLICT, message);
    }

    public static class MergedImport {
        private final ImportSpec spec;
        private final List<ModificationError> conflicts;

        MergedImport(ImportSpec spec, List<ModificationError> conflicts) {
            this.spec = spec;
            this.conflicts = conflicts;
        }

        public ImportSpec getSpec() {
            return spec;
        }

        public List<ModificationError> getConflicts() {
            return conflicts;
        }
    }
}

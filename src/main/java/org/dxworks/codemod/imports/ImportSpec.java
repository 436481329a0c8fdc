package org.dxworks.codemod.imports;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * What a request wants imported from one module source. Named specifiers keep request order and
 * are deduplicated by imported name; each may carry an alias ({@code "Foo as Bar"}).
 */
public final class ImportSpec {
    private final String source;
    private final String defaultImport;
    private final String namespaceImport;
    private final List<String> namedImports;

    /**
     * @throws AmbiguousImportCombinationException when both a default and a namespace import are given
     */
    public ImportSpec(String source, String defaultImport, List<String> namedImports, String namespaceImport) {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("Import source must not be blank");
        }
        String defaultName = blankToNull(defaultImport);
        String namespaceName = blankToNull(namespaceImport);
        ImportMergeResolver.requireUnambiguous(source, defaultName, namespaceName);

        this.source = source;
        this.defaultImport = defaultName;
        this.namespaceImport = namespaceName;
        this.namedImports = Collections.unmodifiableList(dedupe(namedImports));
    }

    public static ImportSpec named(String source, String... names) {
        return new ImportSpec(source, null, List.of(names), null);
    }

    public static ImportSpec defaultImport(String source, String name) {
        return new ImportSpec(source, name, List.of(), null);
    }

    public static ImportSpec namespace(String source, String alias) {
        return new ImportSpec(source, null, List.of(), alias);
    }

    public static ImportSpec sideEffect(String source) {
        return new ImportSpec(source, null, List.of(), null);
    }

    /**
     * The name a specifier imports, i.e. {@code Foo} for {@code "Foo as Bar"}.
     */
    public static String importedName(String specifier) {
        String trimmed = specifier.trim();
        int alias = trimmed.indexOf(" as ");
        return alias < 0 ? trimmed : trimmed.substring(0, alias).trim();
    }

    private static List<String> dedupe(List<String> names) {
        List<String> result = new ArrayList<>();
        if (names == null) return result;
        Set<String> seen = new LinkedHashSet<>();
        for (String name : names) {
            if (name == null || name.isBlank()) continue;
            String specifier = name.trim().replaceAll("\\s+", " ");
            if (seen.add(importedName(specifier))) {
                result.add(specifier);
            }
        }
        return result;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public String getSource() {
        return source;
    }

    public String getDefaultImport() {
        return defaultImport;
    }

    public String getNamespaceImport() {
        return namespaceImport;
    }

    public List<String> getNamedImports() {
        return namedImports;
    }

    public boolean isSideEffectOnly() {
        return defaultImport == null && namespaceImport == null && namedImports.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImportSpec)) return false;
        ImportSpec that = (ImportSpec) o;
        return source.equals(that.source)
                && Objects.equals(defaultImport, that.defaultImport)
                && Objects.equals(namespaceImport, that.namespaceImport)
                && namedImports.equals(that.namedImports);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, defaultImport, namespaceImport, namedImports);
    }

    @Override
    public String toString() {
        return ImportMergeResolver.render(this, '\'');
    }
}

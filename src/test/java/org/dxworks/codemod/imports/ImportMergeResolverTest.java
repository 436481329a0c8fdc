package org.dxworks.codemod.imports;

import org.dxworks.codemod.Dialect;
import org.dxworks.codemod.generate.EditList;
import org.dxworks.codemod.model.ErrorKind;
import org.dxworks.codemod.parser.ComponentParser;
import org.dxworks.codemod.parser.SyntaxTree;
import org.dxworks.codemod.query.NodeQuery;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.dxworks.codemod.TestUtils.lines;
import static org.junit.jupiter.api.Assertions.*;

public class ImportMergeResolverTest {

    private static ImportResolution resolve(String source, ImportSpec... specs) {
        SyntaxTree tree = new ComponentParser(Dialect.JAVASCRIPT).parse(source);
        return new ImportMergeResolver(new NodeQuery(tree)).resolve(Arrays.asList(specs), 0);
    }

    private static String apply(String source, ImportSpec... specs) {
        SyntaxTree tree = new ComponentParser(Dialect.JAVASCRIPT).parse(source);
        ImportResolution resolution = new ImportMergeResolver(new NodeQuery(tree)).resolve(Arrays.asList(specs), 0);
        EditList edits = new EditList();
        if (!resolution.isUnchanged()) {
            edits.add(resolution.getEdit());
        }
        return edits.apply(tree.getSource());
    }

    @Test
    void addsNewStatementAfterLastImport() {
        String result = apply(lines(
                "import React from 'react';",
                "",
                "const x = 1;"), ImportSpec.named("react-router-dom", "Link"));

        assertEquals(lines(
                "import React from 'react';",
                "import { Link } from 'react-router-dom';",
                "",
                "const x = 1;"), result);
    }

    @Test
    void reportsNewStatementForUnknownSource() {
        ImportResolution resolution = resolve("import React from 'react';\n", ImportSpec.sideEffect("./app.css"));

        assertTrue(resolution.isNewStatement());
        assertEquals("./app.css", resolution.getSource());
        assertEquals("\nimport './app.css';", resolution.getEdit().getReplacement());
    }

    @Test
    void isIdempotentWhenNameAlreadyImported() {
        ImportResolution resolution = resolve("import { useState } from 'react';\n", ImportSpec.named("react", "useState"));

        assertTrue(resolution.isUnchanged());
        assertNull(resolution.getEdit());
        assertTrue(resolution.getConflicts().isEmpty());
    }

    @Test
    void appendsNamedSpecifiersInRequestOrder() {
        String result = apply("import { useEffect } from 'react';\n",
                ImportSpec.named("react", "useState"),
                ImportSpec.named("react", "useMemo", "useEffect"),
                ImportSpec.named("react", "useCallback"));

        assertEquals("import { useEffect, useState, useMemo, useCallback } from 'react';\n", result);
    }

    @Test
    void namedImportJoinsDefaultOnlyStatement() {
        String result = apply("import React from 'react';\n", ImportSpec.named("react", "useState"));

        assertEquals("import React, { useState } from 'react';\n", result);
    }

    @Test
    void fillsEmptyBraces() {
        String result = apply("import {} from 'react';\n", ImportSpec.named("react", "useState"));

        assertEquals("import { useState } from 'react';\n", result);
    }

    @Test
    void conflictingDefaultIsReportedAndNotApplied() {
        ImportResolution resolution = resolve("import React from 'react';\n", ImportSpec.defaultImport("react", "Preact"));

        assertNull(resolution.getEdit());
        assertEquals(1, resolution.getConflicts().size());
        assertEquals(ErrorKind.IMPORT_CONFLICT, resolution.getConflicts().get(0).kind);
    }

    @Test
    void namedCannotJoinNamespaceImport() {
        ImportResolution resolution = resolve("import * as R from 'react';\n", ImportSpec.named("react", "useState"));

        assertTrue(resolution.isUnchanged());
        assertEquals(ErrorKind.IMPORT_CONFLICT, resolution.getConflicts().get(0).kind);
    }

    @Test
    void differentNamespaceConflictsWithExistingNamespace() {
        String source = "import * as R from 'react';\n";
        ImportResolution resolution = resolve(source, ImportSpec.namespace("react", "X"));

        assertTrue(resolution.isUnchanged());
        assertEquals(1, resolution.getConflicts().size());
        assertEquals(ErrorKind.IMPORT_CONFLICT, resolution.getConflicts().get(0).kind);
        assertTrue(resolution.getConflicts().get(0).render().contains("existing namespace 'R'"));
        assertEquals(source, apply(source, ImportSpec.namespace("react", "X")));
    }

    @Test
    void sameNamespaceAsExistingIsUnchanged() {
        ImportResolution resolution = resolve("import * as R from 'react';\n", ImportSpec.namespace("react", "R"));

        assertTrue(resolution.isUnchanged());
        assertTrue(resolution.getConflicts().isEmpty());
    }

    @Test
    void sideEffectImportIsUpgraded() {
        String result = apply("import 'x';\n", ImportSpec.named("x", "a"));

        assertEquals("import { a } from 'x';\n", result);
    }

    @Test
    void newStatementGoesAfterDirectivePrologue() {
        String result = apply(lines(
                "'use client';",
                "",
                "export const A = () => <div />;"), ImportSpec.named("react", "useState"));

        assertEquals(lines(
                "'use client';",
                "import { useState } from 'react';",
                "",
                "export const A = () => <div />;"), result);
    }

    @Test
    void newStatementGoesAtStartWithoutImports() {
        String result = apply("const A = () => <div />;\n", ImportSpec.defaultImport("react", "React"));

        assertEquals("import React from 'react';\nconst A = () => <div />;\n", result);
    }

    @Test
    void newStatementFollowsQuoteStyleOfFile() {
        String result = apply("import React from \"react\";\n", ImportSpec.namespace("./api", "api"));

        assertEquals("import React from \"react\";\nimport * as api from \"./api\";\n", result);
    }

    @Test
    void aliasedSpecifierCoversItsImportedName() {
        ImportResolution resolution = resolve("import { Foo as Bar } from './foo';\n", ImportSpec.named("./foo", "Foo"));

        assertTrue(resolution.isUnchanged());
    }

    @Test
    void defaultAndNamespaceTogetherAreAmbiguous() {
        assertThrows(AmbiguousImportCombinationException.class,
                () -> new ImportSpec("react", "React", List.of(), "R"));
        assertThrows(AmbiguousImportCombinationException.class,
                () -> ImportMergeResolver.requireUnambiguous("react", "React", "R"));
    }

    @Test
    void mergingRequestsReportsConflictingDefaults() {
        ImportMergeResolver.MergedImport merged = ImportMergeResolver.mergeRequests(List.of(
                ImportSpec.defaultImport("./Guard", "Guard"),
                ImportSpec.defaultImport("./Guard", "AuthGuard"),
                ImportSpec.named("./Guard", "useGuard")));

        assertEquals("Guard", merged.getSpec().getDefaultImport());
        assertEquals(List.of("useGuard"), merged.getSpec().getNamedImports());
        assertEquals(1, merged.getConflicts().size());
    }

    @Test
    void rendersEveryStatementShape() {
        assertEquals("import React, { useState } from 'react';",
                ImportMergeResolver.render(new ImportSpec("react", "React", List.of("useState"), null), '\''));
        assertEquals("import * as NS from \"ns\";", ImportMergeResolver.render(ImportSpec.namespace("ns", "NS"), '"'));
        assertEquals("import './a.css';", ImportMergeResolver.render(ImportSpec.sideEffect("./a.css"), '\''));
    }
}

package com.repoatlas.core.graph;

import com.repoatlas.core.config.AtlasProperties;
import com.repoatlas.core.model.Edge;
import com.repoatlas.core.model.FileCategory;
import com.repoatlas.core.model.Module;
import com.repoatlas.core.signals.FileSignals;
import com.repoatlas.core.signals.SignalExtractor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ModuleGraphBuilderTest {

    AtlasProperties properties = new AtlasProperties();
    SignalExtractor extractor = new SignalExtractor(properties);
    ModuleGraphBuilder builder = new ModuleGraphBuilder(properties);

    private FileSignals file(String path, String text) {
        String ext = path.substring(path.lastIndexOf('.'));
        return extractor.analyze(path, ext, text, (int) text.lines().count(), false);
    }

    @Test
    @DisplayName("drops self references and merges duplicate edges")
    void noSelfOrDuplicateEdges() {
        var graph = builder.build(List.of(
                file("src/a.ts", "import './a';\nimport { x } from './b';\nimport { y } from './b.js';\nconst z = require('./b');\n"),
                file("src/b.ts", "export const x = 1;\n")));

        assertEquals(List.of(new Edge("src/a.ts", "src/b.ts", Edge.Kind.REFERENCE, Edge.Resolution.EXACT)), graph.edges());
        assertEquals(0, graph.unresolvedCount());
    }

    @Test
    @DisplayName("a re-export of an already referenced module upgrades the edge")
    void reexportUpgradesEdge() {
        var graph = builder.build(List.of(
                file("src/index.ts", "export * from './b';\n"),
                file("src/b.ts", "export const x = 1;\n")));

        Edge edge = graph.edges().get(0);
        assertEquals(Edge.Kind.REEXPORT, edge.kind());
        assertTrue(graph.module("src/index.ts").barrel());
    }

    @Test
    @DisplayName("counts unresolved references and keeps a sample")
    void countsUnresolved() {
        var graph = builder.build(List.of(
                file("src/a.ts", "import React from 'react';\nimport lodash from 'lodash';\nimport './b';\n"),
                file("src/b.ts", "")));

        assertEquals(2, graph.unresolvedCount());
        assertEquals(List.of("src/a.ts -> react", "src/a.ts -> lodash"), graph.unresolvedSample());
        assertEquals(1, graph.edges().size());
    }

    @Test
    @DisplayName("non-code files are not modules")
    void skipsNonCode() {
        var graph = builder.build(List.of(
                file("README.md", "# readme"),
                file("src/app.css", "body {}"),
                file("src/a.ts", "")));

        assertEquals(Set.of("src/a.ts"), graph.modules().keySet());
    }

    @Test
    @DisplayName("input order does not change the graph")
    void orderIndependent() {
        var files = new ArrayList<>(List.of(
                file("src/a.ts", "import './b';\nimport './c';\n"),
                file("src/b.ts", "import './c';\n"),
                file("src/c.ts", "import './a';\n")));
        var first = builder.build(files);
        Collections.reverse(files);
        var second = builder.build(files);

        assertEquals(first.edges(), second.edges());
        assertEquals(first.modules(), second.modules());
    }

    @Test
    @DisplayName("every edge endpoint is a module")
    void edgesReferenceModules() {
        var graph = builder.build(List.of(
                file("server/routes/users.js", "const svc = require('../services/users');\n"),
                file("server/services/users.js", "const db = require('../db');\n"),
                file("server/db/index.js", "")));

        var paths = new HashSet<>(graph.modules().keySet());
        for (Edge edge : graph.edges()) {
            assertTrue(paths.contains(edge.from()) && paths.contains(edge.to()), edge.toString());
        }
        assertEquals(2, graph.edges().size());
        assertEquals(FileCategory.BACKEND, graph.module("server/db/index.js").category());
    }

    @Test
    @DisplayName("boundary graph collapses files onto logical modules")
    void boundaryGraph() {
        var graph = builder.build(List.of(
                file("server/routes/users.js", "require('../services/users');\nrequire('../services/auth');\n"),
                file("server/services/users.js", "require('./auth');\n"),
                file("server/services/auth.js", ""),
                file("index.js", "require('./server/routes/users');\n")));

        var boundary = graph.boundaryGraph();
        assertEquals(Set.of("routes"), boundary.get(Module.ROOT));
        assertEquals(Set.of("services"), boundary.get("routes"));
        assertTrue(boundary.get("services").isEmpty(), "Edges inside one logical module disappear");
        assertEquals(Set.of("routes"), graph.boundaryDependents().get("services"));
    }

    @Test
    @DisplayName("logical names follow boundary hints, then source containers")
    void logicalNames() {
        assertEquals(Module.ROOT, ModuleNaming.logicalName("index.js"));
        assertEquals("components", ModuleNaming.logicalName("src/components/ui/Button.tsx"));
        assertEquals("billing", ModuleNaming.logicalName("src/billing/invoice.ts"));
        assertEquals("scripts", ModuleNaming.logicalName("scripts/deploy.js"));
    }
}

package com.repoatlas.core.signals;

import com.repoatlas.core.config.AtlasProperties;
import com.repoatlas.core.model.FileCategory;
import com.repoatlas.core.model.Signal;
import com.repoatlas.core.model.SignalCategory;
import com.repoatlas.core.scanner.SourceFile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SignalExtractorTest {

    SignalExtractor extractor = new SignalExtractor(new AtlasProperties());

    private List<String> values(FileSignals file, SignalCategory category) {
        return file.signals().stream()
                .filter(s -> s.category() == category)
                .map(Signal::value)
                .toList();
    }

    // ── Categorisation ───────────────────────────────────────────────

    @Nested
    @DisplayName("file categorisation")
    class Categorisation {

        @Test
        @DisplayName("component extensions are frontend, server languages are backend")
        void byExtension() {
            assertEquals(FileCategory.FRONTEND, FileCategorizer.categorize("src/App.tsx", ".tsx"));
            assertEquals(FileCategory.BACKEND, FileCategorizer.categorize("app/main.py", ".py"));
            assertEquals(FileCategory.STYLE, FileCategorizer.categorize("src/app.css", ".css"));
            assertEquals(FileCategory.CONFIG, FileCategorizer.categorize("package.json", ".json"));
        }

        @Test
        @DisplayName("plain scripts take the deepest recognisable directory")
        void byDirectory() {
            assertEquals(FileCategory.BACKEND, FileCategorizer.categorize("server/routes/users.js", ".js"));
            assertEquals(FileCategory.FRONTEND, FileCategorizer.categorize("api/components/Button.js", ".js"));
            assertEquals(FileCategory.SHARED, FileCategorizer.categorize("lib/format.ts", ".ts"));
        }
    }

    // ── Pattern catalog ──────────────────────────────────────────────

    @Nested
    @DisplayName("pattern catalog")
    class Catalog {

        @Test
        @DisplayName("reports every matching value for one category")
        void multipleValuesPerCategory() {
            String text = """
                    import { configureStore } from '@reduxjs/toolkit';
                    import { create } from 'zustand';
                    """;
            var file = extractor.analyze("src/store/index.tsx", ".tsx", text, 2, false);
            assertEquals(List.of("redux", "zustand"), values(file, SignalCategory.STATE_MANAGEMENT));
        }

        @Test
        @DisplayName("state management is never reported for backend files")
        void stateManagementIsFrontendOnly() {
            String text = "const [a, setA] = useState(0);\nimport { create } from 'zustand';\n";
            var file = extractor.analyze("server/handlers.js", ".js", text, 2, false);
            assertEquals(FileCategory.BACKEND, file.category());
            assertTrue(values(file, SignalCategory.STATE_MANAGEMENT).isEmpty());
        }

        @Test
        @DisplayName("detects backend routing, ORM and auth together")
        void detectsBackendStack() {
            String text = """
                    const express = require('express');
                    const mongoose = require('mongoose');
                    const jwt = require('jsonwebtoken');
                    const router = express.Router();
                    router.get('/users', (req, res) => res.json([]));
                    """;
            var file = extractor.analyze("server/routes/users.js", ".js", text, 5, false);
            assertEquals(List.of("express-router"), values(file, SignalCategory.ROUTING));
            assertEquals(List.of("mongoose"), values(file, SignalCategory.ORM));
            assertEquals(List.of("jwt"), values(file, SignalCategory.AUTH));
        }

        @Test
        @DisplayName("style and docs files report no signals")
        void nonCodeFilesReportNothing() {
            var file = extractor.analyze("README.md", ".md", "Uses useState( and fetch(", 1, false);
            assertTrue(file.signals().isEmpty());
            assertTrue(file.routes().isEmpty());
        }

        @Test
        @DisplayName("a custom table replaces the default one")
        void customTable() {
            var custom = new SignalExtractor(List.of(
                    PatternGroup.of(SignalCategory.TESTING, "spock", java.util.Set.of(FileCategory.BACKEND), "extends\\s+Specification")),
                    100);
            var file = custom.analyze("src/FooSpec.java", ".java", "class FooSpec extends Specification {}", 1, false);
            assertEquals(List.of("spock"), values(file, SignalCategory.TESTING));
        }
    }

    // ── Reading files ────────────────────────────────────────────────

    @Nested
    @DisplayName("reading files")
    class Reading {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("analyses only the first configured lines but counts all of them")
        void truncatesLongFiles() throws IOException {
            Path file = tempDir.resolve("big.js");
            var text = new StringBuilder();
            for (int i = 0; i < 10; i++) {
                text.append("// filler ").append(i).append('\n');
            }
            text.append("import axios from 'axios';\n");
            Files.writeString(file, text);

            var limited = new SignalExtractor(PatternCatalog.DEFAULT_GROUPS, 5);
            var signals = limited.extract(new SourceFile(file, "big.js", ".js", Files.size(file)));

            assertTrue(signals.truncated());
            assertEquals(11, signals.lines());
            assertTrue(signals.references().isEmpty(), "Reference beyond the line limit must be ignored");
        }

        @Test
        @DisplayName("drops malformed UTF-8 instead of failing")
        void readsMalformedUtf8() throws IOException {
            Path file = tempDir.resolve("odd.js");
            byte[] prefix = "import x from './x';\n".getBytes(java.nio.charset.StandardCharsets.UTF_8);
            byte[] bytes = new byte[prefix.length + 2];
            System.arraycopy(prefix, 0, bytes, 0, prefix.length);
            bytes[prefix.length] = (byte) 0xC3;
            bytes[prefix.length + 1] = (byte) 0x28;
            Files.write(file, bytes);

            var signals = extractor.extract(new SourceFile(file, "odd.js", ".js", bytes.length));
            assertEquals("./x", signals.references().get(0).specifier());
        }
    }

    // ── Index ────────────────────────────────────────────────────────

    @Test
    @DisplayName("index groups files by category and value")
    void indexAggregates() {
        var index = new SignalIndex();
        index.add(extractor.analyze("src/a.tsx", ".tsx", "useState(1)", 1, false));
        index.add(extractor.analyze("src/b.tsx", ".tsx", "useState(2)", 1, false));

        assertEquals(2, index.files(SignalCategory.STATE_MANAGEMENT, "useState").size());
        assertTrue(index.values(SignalCategory.ORM).isEmpty());
        assertFalse(index.isEmpty());
    }
}

package com.repoatlas.core.graph;

import com.repoatlas.core.model.Edge;
import com.repoatlas.core.signals.RawReference;
import com.repoatlas.core.signals.Syntax;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceResolverTest {

    private static final Set<String> KNOWN = Set.of(
            "src/App.tsx", "src/lib/api.ts", "src/lib/index.ts", "src/components/Button.tsx",
            "src/utils/format.ts", "lib/helpers.js",
            "app/__init__.py", "app/models.py", "app/views/__init__.py", "app/views/users.py",
            "src/main/java/com/acme/model/User.java", "src/main/java/com/acme/util/Strings.java");

    ReferenceResolver resolver = new ReferenceResolver(KNOWN,
            Map.of("@/", "src/", "@lib/", "src/lib/"), List.of("src/main/java", "src", ""));

    private Optional<ReferenceResolver.Resolved> resolve(String importer, String specifier, Syntax syntax) {
        return resolver.resolve(importer, new RawReference(specifier, Edge.Kind.REFERENCE), syntax);
    }

    @Nested
    @DisplayName("script resolution")
    class Script {

        @Test
        @DisplayName("relative paths try extensions and index files")
        void relative() {
            assertEquals("src/lib/api.ts", resolve("src/App.tsx", "./lib/api", Syntax.SCRIPT).orElseThrow().path());
            assertEquals("src/lib/index.ts", resolve("src/App.tsx", "./lib", Syntax.SCRIPT).orElseThrow().path());
            assertEquals("src/App.tsx", resolve("src/components/Button.tsx", "../App", Syntax.SCRIPT).orElseThrow().path());
        }

        @Test
        @DisplayName("an emitted .js extension still finds the TypeScript source")
        void jsExtensionMapsToTs() {
            var resolved = resolve("src/App.tsx", "./utils/format.js", Syntax.SCRIPT).orElseThrow();
            assertEquals("src/utils/format.ts", resolved.path());
            assertEquals(Edge.Resolution.EXACT, resolved.resolution());
        }

        @Test
        @DisplayName("the longest alias prefix wins")
        void aliases() {
            var resolved = resolve("src/App.tsx", "@lib/api", Syntax.SCRIPT).orElseThrow();
            assertEquals("src/lib/api.ts", resolved.path());
            assertEquals(Edge.Resolution.ALIAS, resolved.resolution());
            assertEquals("src/components/Button.tsx", resolve("src/App.tsx", "@/components/Button", Syntax.SCRIPT).orElseThrow().path());
        }

        @Test
        @DisplayName("a bare name may be a sibling file")
        void sameDirectory() {
            var resolved = resolve("src/components/Other.tsx", "Button", Syntax.SCRIPT).orElseThrow();
            assertEquals("src/components/Button.tsx", resolved.path());
            assertEquals(Edge.Resolution.SAME_DIRECTORY, resolved.resolution());
        }

        @Test
        @DisplayName("external packages, builtins and escaping paths stay unresolved")
        void unresolved() {
            assertTrue(resolve("src/App.tsx", "react", Syntax.SCRIPT).isEmpty());
            assertTrue(resolve("src/App.tsx", "node:fs", Syntax.SCRIPT).isEmpty());
            assertTrue(resolve("src/App.tsx", "https://cdn.example.com/x.js", Syntax.SCRIPT).isEmpty());
            assertTrue(resolve("src/App.tsx", "../../outside", Syntax.SCRIPT).isEmpty());
        }
    }

    @Nested
    @DisplayName("python resolution")
    class Python {

        @Test
        @DisplayName("relative imports climb one package per extra dot")
        void relative() {
            assertEquals("app/models.py", resolve("app/views/users.py", "..models", Syntax.PYTHON).orElseThrow().path());
            assertEquals("app/views/users.py", resolve("app/views/__init__.py", ".users", Syntax.PYTHON).orElseThrow().path());
        }

        @Test
        @DisplayName("absolute imports search the source roots and packages")
        void absolute() {
            assertEquals("app/models.py", resolve("main.py", "app.models", Syntax.PYTHON).orElseThrow().path());
            assertEquals("app/views/__init__.py", resolve("main.py", "app.views", Syntax.PYTHON).orElseThrow().path());
            assertTrue(resolve("main.py", "os", Syntax.PYTHON).isEmpty());
        }
    }

    @Test
    @DisplayName("java imports trim member names until a source file matches")
    void java() {
        assertEquals("src/main/java/com/acme/model/User.java",
                resolve("x", "com.acme.model.User", Syntax.JAVA).orElseThrow().path());
        assertEquals("src/main/java/com/acme/util/Strings.java",
                resolve("x", "com.acme.util.Strings.trim", Syntax.JAVA).orElseThrow().path());
        assertTrue(resolve("x", "java.util.List", Syntax.JAVA).isEmpty());
    }

    @Test
    @DisplayName("normalize collapses dot segments and rejects escapes")
    void normalize() {
        assertEquals(Optional.of("src/lib/api"), ReferenceResolver.normalize("src/./components/../lib/api"));
        assertEquals(Optional.empty(), ReferenceResolver.normalize("../x"));
    }
}

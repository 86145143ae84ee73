package com.repoatlas.core.signals;

import com.repoatlas.core.model.Edge;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical recognition of import, require and re-export statements. No parsing: a
 * statement built at runtime (e.g. {@code require(name)}) is invisible here.
 */
public final class ReferenceParser {

    /** {@code import x from 'y'}, {@code import { a, b } from 'y'}, {@code import * as z from 'y'} */
    private static final Pattern SCRIPT_IMPORT_FROM = Pattern.compile(
            "\\bimport\\s+(?:type\\s+)?[\\w*${},\\s]+?\\s+from\\s+['\"]([^'\"]+)['\"]");

    /** Side-effect import: {@code import './polyfills'} */
    private static final Pattern SCRIPT_IMPORT_BARE = Pattern.compile(
            "\\bimport\\s+['\"]([^'\"]+)['\"]");

    private static final Pattern SCRIPT_DYNAMIC_IMPORT = Pattern.compile(
            "\\bimport\\s*\\(\\s*['\"]([^'\"]+)['\"]\\s*\\)");

    private static final Pattern SCRIPT_REQUIRE = Pattern.compile(
            "\\brequire\\s*\\(\\s*['\"]([^'\"]+)['\"]\\s*\\)");

    /** {@code export * from 'x'}, {@code export { a } from 'x'}, {@code export * as ns from 'x'} */
    static final Pattern SCRIPT_REEXPORT = Pattern.compile(
            "\\bexport\\s+(?:type\\s+)?(?:\\*(?:\\s+as\\s+\\w+)?|\\{[^}]*})\\s*from\\s+['\"]([^'\"]+)['\"]\\s*;?");

    private static final Pattern PYTHON_FROM_IMPORT = Pattern.compile(
            "(?m)^\\s*from\\s+(\\.*[\\w.]*)\\s+import\\s+(?:\\(([^)]*)\\)|([^\\n]+))");

    private static final Pattern PYTHON_IMPORT = Pattern.compile(
            "(?m)^\\s*import\\s+([\\w.]+(?:\\s+as\\s+\\w+)?(?:\\s*,\\s*[\\w.]+(?:\\s+as\\s+\\w+)?)*)");

    private static final Pattern JAVA_IMPORT = Pattern.compile(
            "(?m)^\\s*import\\s+(?:static\\s+)?([\\w.]+?)(?:\\.\\*)?\\s*;");

    private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*[\\s\\S]*?\\*/");
    private static final Pattern LINE_COMMENT = Pattern.compile("(?m)^\\s*//.*$");
    private static final Pattern PYTHON_COMMENT = Pattern.compile("(?m)^\\s*#.*$");
    private static final Pattern PYTHON_DOCSTRING = Pattern.compile("(\"\"\"[\\s\\S]*?\"\"\"|'''[\\s\\S]*?''')");
    private static final Pattern PYTHON_RELATIVE_IMPORT_STMT = Pattern.compile(
            "(?m)^\\s*from\\s+\\.[\\w.]*\\s+import\\s+(\\([^)]*\\)|[^\\n]+)");
    private static final Pattern PYTHON_ALL = Pattern.compile("(?m)^\\s*__all__\\s*=\\s*[\\[(][^\\])]*[\\])]");

    private ReferenceParser() {} // utility class

    /**
     * Extracts references in source order. A specifier seen as both a plain reference
     * and a re-export is reported once, as a re-export.
     */
    public static List<RawReference> parse(String text, Syntax syntax, boolean packageInit) {
        var found = new LinkedHashMap<String, Edge.Kind>();
        switch (syntax) {
            case SCRIPT -> {
                String code = stripComments(text);
                collect(found, SCRIPT_REEXPORT, code, Edge.Kind.REEXPORT);
                collect(found, SCRIPT_IMPORT_FROM, code, Edge.Kind.REFERENCE);
                collect(found, SCRIPT_IMPORT_BARE, code, Edge.Kind.REFERENCE);
                collect(found, SCRIPT_DYNAMIC_IMPORT, code, Edge.Kind.REFERENCE);
                collect(found, SCRIPT_REQUIRE, code, Edge.Kind.REFERENCE);
            }
            case PYTHON -> parsePython(text, packageInit, found);
            case JAVA -> collect(found, JAVA_IMPORT, text, Edge.Kind.REFERENCE);
            case NONE -> { }
        }
        var references = new ArrayList<RawReference>(found.size());
        found.forEach((specifier, kind) -> references.add(new RawReference(specifier, kind)));
        return references;
    }

    /**
     * A barrel only re-exports: once re-export statements and comments are removed,
     * nothing is left.
     */
    public static boolean isBarrel(String text, Syntax syntax, boolean packageInit) {
        if (syntax == Syntax.SCRIPT) {
            String code = stripComments(text);
            if (!SCRIPT_REEXPORT.matcher(code).find()) {
                return false;
            }
            return SCRIPT_REEXPORT.matcher(code).replaceAll("").isBlank();
        }
        if (syntax == Syntax.PYTHON && packageInit) {
            String code = PYTHON_DOCSTRING.matcher(text).replaceAll("");
            code = PYTHON_COMMENT.matcher(code).replaceAll("");
            if (!PYTHON_RELATIVE_IMPORT_STMT.matcher(code).find()) {
                return false;
            }
            code = PYTHON_RELATIVE_IMPORT_STMT.matcher(code).replaceAll("");
            return PYTHON_ALL.matcher(code).replaceAll("").isBlank();
        }
        return false;
    }

    private static void parsePython(String text, boolean packageInit, Map<String, Edge.Kind> found) {
        Edge.Kind fromKind = packageInit ? Edge.Kind.REEXPORT : Edge.Kind.REFERENCE;
        Matcher from = PYTHON_FROM_IMPORT.matcher(text);
        while (from.find()) {
            String module = from.group(1);
            if (module.isEmpty()) {
                continue;
            }
            if (module.chars().allMatch(c -> c == '.')) {
                // from . import a, b  ->  each name is a sibling module; "(...)" may span lines
                String names = from.group(2) != null ? from.group(2) : from.group(3);
                for (String name : names.split(",")) {
                    String bare = name.strip().split("\\s+")[0];
                    if (bare.matches("\\w+")) {
                        found.merge(module + bare, fromKind, ReferenceParser::strongest);
                    }
                }
            } else {
                found.merge(module, fromKind, ReferenceParser::strongest);
            }
        }
        Matcher plain = PYTHON_IMPORT.matcher(text);
        while (plain.find()) {
            for (String part : plain.group(1).split(",")) {
                String module = part.trim().split("\\s+")[0];
                if (!module.isEmpty()) {
                    found.merge(module, Edge.Kind.REFERENCE, ReferenceParser::strongest);
                }
            }
        }
    }

    private static void collect(Map<String, Edge.Kind> found, Pattern pattern, String text, Edge.Kind kind) {
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            found.merge(m.group(1).trim(), kind, ReferenceParser::strongest);
        }
    }

    private static Edge.Kind strongest(Edge.Kind a, Edge.Kind b) {
        return a == Edge.Kind.REEXPORT || b == Edge.Kind.REEXPORT ? Edge.Kind.REEXPORT : Edge.Kind.REFERENCE;
    }

    static String stripComments(String text) {
        return LINE_COMMENT.matcher(BLOCK_COMMENT.matcher(text).replaceAll("")).replaceAll("");
    }
}

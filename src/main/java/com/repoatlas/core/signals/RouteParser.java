package com.repoatlas.core.signals;

import com.repoatlas.core.model.RouteEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds route registrations: Express-style router calls, Flask/FastAPI decorators and
 * Spring MVC mapping annotations.
 */
public final class RouteParser {

    private static final int MAX_HANDLER_CHARS = 60;

    private static final Pattern EXPRESS_ROUTE = Pattern.compile(
            "\\b(?:router|app|\\w+Router)\\.(get|post|put|delete|patch|options|head|all)\\s*\\(\\s*['\"`]([^'\"`]+)['\"`]\\s*,\\s*([^\\n]+)");

    private static final Pattern PYTHON_ROUTE = Pattern.compile(
            "(?m)^\\s*@\\w+\\.(get|post|put|delete|patch|route)\\(\\s*['\"]([^'\"]+)['\"]([^)]*)\\)");

    private static final Pattern PYTHON_METHODS = Pattern.compile("methods\\s*=\\s*\\[\\s*['\"](\\w+)['\"]");

    private static final Pattern PYTHON_DEF = Pattern.compile("(?m)^\\s*(?:async\\s+)?def\\s+(\\w+)");

    private static final Pattern SPRING_CLASS_PREFIX = Pattern.compile(
            "@RequestMapping\\s*\\(\\s*(?:value\\s*=\\s*|path\\s*=\\s*)?\"([^\"]*)\"[^)]*\\)(?:\\s*@\\w+(?:\\([^)]*\\))?)*\\s*(?:public\\s+)?(?:final\\s+)?class\\b");

    private static final Pattern SPRING_METHOD_ROUTE = Pattern.compile(
            "@(Get|Post|Put|Delete|Patch)Mapping\\b(?:\\s*\\(\\s*(?:value\\s*=\\s*|path\\s*=\\s*)?\"([^\"]*)\"[^)]*\\))?");

    private static final Pattern JAVA_METHOD_NAME = Pattern.compile(
            "(?:public|protected|private)?\\s*(?:static\\s+)?[\\w<>\\[\\]?,. ]+?\\s+(\\w+)\\s*\\(");

    private RouteParser() {} // utility class

    public static List<RouteEntry> parse(String file, String text, Syntax syntax) {
        return switch (syntax) {
            case SCRIPT -> parseExpress(file, text);
            case PYTHON -> parsePython(file, text);
            case JAVA -> parseSpring(file, text);
            case NONE -> List.of();
        };
    }

    private static List<RouteEntry> parseExpress(String file, String text) {
        var routes = new ArrayList<RouteEntry>();
        Matcher m = EXPRESS_ROUTE.matcher(text);
        while (m.find()) {
            routes.add(new RouteEntry(m.group(1).toUpperCase(Locale.ROOT), m.group(2), cleanHandler(m.group(3)), file));
        }
        return routes;
    }

    private static List<RouteEntry> parsePython(String file, String text) {
        var routes = new ArrayList<RouteEntry>();
        Matcher m = PYTHON_ROUTE.matcher(text);
        while (m.find()) {
            String method = m.group(1);
            if ("route".equals(method)) {
                Matcher methods = PYTHON_METHODS.matcher(m.group(3));
                method = methods.find() ? methods.group(1) : "GET";
            }
            Matcher def = PYTHON_DEF.matcher(text);
            String handler = def.find(m.end()) ? def.group(1) : "?";
            routes.add(new RouteEntry(method.toUpperCase(Locale.ROOT), m.group(2), handler, file));
        }
        return routes;
    }

    private static List<RouteEntry> parseSpring(String file, String text) {
        Matcher prefixMatcher = SPRING_CLASS_PREFIX.matcher(text);
        String prefix = prefixMatcher.find() ? trimSlash(prefixMatcher.group(1)) : "";
        var routes = new ArrayList<RouteEntry>();
        Matcher m = SPRING_METHOD_ROUTE.matcher(text);
        while (m.find()) {
            String path = m.group(2) == null ? "" : m.group(2);
            String full = prefix + trimSlash(path);
            Matcher name = JAVA_METHOD_NAME.matcher(text);
            String handler = name.find(m.end()) ? name.group(1) : "?";
            routes.add(new RouteEntry(m.group(1).toUpperCase(Locale.ROOT), full.isEmpty() ? "/" : full, handler, file));
        }
        return routes;
    }

    static String cleanHandler(String raw) {
        String handler = raw.trim();
        while (handler.endsWith(";") || handler.endsWith(")")) {
            handler = handler.substring(0, handler.length() - 1).trim();
        }
        // Middleware chains: the last argument is the handler
        if (!handler.contains("=>") && !handler.startsWith("function") && handler.contains(",")) {
            handler = handler.substring(handler.lastIndexOf(',') + 1).trim();
        }
        if (handler.contains("=>") || handler.startsWith("async") || handler.startsWith("function")) {
            handler = "inline";
        }
        return handler.length() > MAX_HANDLER_CHARS ? handler.substring(0, MAX_HANDLER_CHARS) : handler;
    }

    private static String trimSlash(String path) {
        String trimmed = path.strip();
        while (trimmed.startsWith("/")) trimmed = trimmed.substring(1);
        while (trimmed.endsWith("/")) trimmed = trimmed.substring(0, trimmed.length() - 1);
        return trimmed.isEmpty() ? "" : "/" + trimmed;
    }
}

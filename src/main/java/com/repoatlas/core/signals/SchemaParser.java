package com.repoatlas.core.signals;

import com.repoatlas.core.model.DataModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts data-model definitions (mongoose, sequelize, typeorm, JPA, SQLAlchemy, Django)
 * together with their top-level field names.
 */
public final class SchemaParser {

    static final int MAX_FIELDS = 60;

    /** Keys that configure a field rather than name one. */
    private static final Set<String> OPTION_KEYS = Set.of(
            "type", "required", "default", "ref", "allowNull", "primaryKey", "unique", "validate",
            "autoIncrement", "references", "onDelete", "onUpdate", "index", "enum", "trim",
            "lowercase", "uppercase", "min", "max", "minlength", "maxlength", "timestamps");

    private static final Pattern MONGOOSE_SCHEMA = Pattern.compile(
            "(?:const|let|var)\\s+(\\w+)\\s*=\\s*new\\s+(?:mongoose\\.)?Schema\\s*\\(\\s*\\{");
    private static final Pattern MONGOOSE_MODEL = Pattern.compile(
            "\\bmodel\\s*(?:<[^>]*>)?\\s*\\(\\s*['\"](\\w+)['\"]\\s*,\\s*(\\w+)");
    private static final Pattern SEQUELIZE_DEFINE = Pattern.compile(
            "\\.define\\s*\\(\\s*['\"](\\w+)['\"]\\s*,\\s*\\{");
    private static final Pattern SEQUELIZE_CLASS = Pattern.compile(
            "\\bclass\\s+(\\w+)\\s+extends\\s+Model\\b");
    private static final Pattern SEQUELIZE_INIT = Pattern.compile(
            "\\b(\\w+)\\.init\\s*\\(\\s*\\{");
    private static final Pattern TYPEORM_ENTITY = Pattern.compile(
            "@Entity\\s*\\([^)]*\\)\\s*(?:export\\s+)?(?:default\\s+)?class\\s+(\\w+)");
    private static final Pattern TYPEORM_COLUMN = Pattern.compile(
            "@(?:Column|PrimaryGeneratedColumn|PrimaryColumn|CreateDateColumn|UpdateDateColumn|ManyToOne|OneToMany|OneToOne|ManyToMany)\\s*\\([^)]*\\)\\s*(\\w+)\\s*[!?]?\\s*:");
    private static final Pattern JPA_ENTITY = Pattern.compile(
            "@Entity\\b(?:\\s*\\([^)]*\\))?(?:\\s*@\\w+(?:\\([^)]*\\))?)*\\s*(?:public\\s+)?(?:final\\s+)?class\\s+(\\w+)");
    private static final Pattern JAVA_FIELD = Pattern.compile(
            "(?m)^\\s*(?:private|protected|public)\\s+(?!static)(?:final\\s+)?[\\w<>\\[\\]?, .]+?\\s+(\\w+)\\s*[;=]");
    private static final Pattern PYTHON_MODEL_CLASS = Pattern.compile(
            "(?m)^class\\s+(\\w+)\\s*\\(\\s*(db\\.Model|Base|DeclarativeBase|models\\.Model)\\s*\\)\\s*:");
    private static final Pattern PYTHON_FIELD = Pattern.compile(
            "(?m)^\\s+(\\w+)\\s*(?::\\s*[\\w\\[\\]., ]+)?=\\s*(?:db\\.)?(?:Column|mapped_column|relationship|models\\.\\w+)\\s*\\(");
    private static final Pattern TOP_LEVEL_LINE = Pattern.compile("(?m)^\\S");
    private static final Pattern TOP_LEVEL_KEY = Pattern.compile(
            "(?:^|[,{\\n])\\s*['\"]?([A-Za-z_$][\\w$]*)['\"]?\\s*:");

    private SchemaParser() {} // utility class

    public static List<DataModel> parse(String file, String text, Syntax syntax) {
        return switch (syntax) {
            case SCRIPT -> parseScript(file, text);
            case PYTHON -> parsePython(file, text);
            case JAVA -> parseJava(file, text);
            case NONE -> List.of();
        };
    }

    private static List<DataModel> parseScript(String file, String text) {
        var models = new ArrayList<DataModel>();

        Matcher schema = MONGOOSE_SCHEMA.matcher(text);
        while (schema.find()) {
            String variable = schema.group(1);
            String name = mongooseModelName(text, variable);
            models.add(model(name, "mongoose", objectKeys(text, schema.end() - 1), file));
        }

        Matcher define = SEQUELIZE_DEFINE.matcher(text);
        while (define.find()) {
            models.add(model(define.group(1), "sequelize", objectKeys(text, define.end() - 1), file));
        }

        Matcher sequelizeClass = SEQUELIZE_CLASS.matcher(text);
        while (sequelizeClass.find()) {
            String name = sequelizeClass.group(1);
            List<String> fields = List.of();
            Matcher init = SEQUELIZE_INIT.matcher(text);
            while (init.find()) {
                if (init.group(1).equals(name)) {
                    fields = objectKeys(text, init.end() - 1);
                    break;
                }
            }
            models.add(model(name, "sequelize", fields, file));
        }

        Matcher entity = TYPEORM_ENTITY.matcher(text);
        while (entity.find()) {
            String body = classBody(text, entity.end());
            var fields = new ArrayList<String>();
            Matcher column = TYPEORM_COLUMN.matcher(body);
            while (column.find()) {
                fields.add(column.group(1));
            }
            models.add(model(entity.group(1), "typeorm", fields, file));
        }
        return models;
    }

    private static List<DataModel> parseJava(String file, String text) {
        var models = new ArrayList<DataModel>();
        Matcher entity = JPA_ENTITY.matcher(text);
        while (entity.find()) {
            String body = classBody(text, entity.end());
            var fields = new ArrayList<String>();
            Matcher field = JAVA_FIELD.matcher(body);
            while (field.find()) {
                fields.add(field.group(1));
            }
            models.add(model(entity.group(1), "jpa", fields, file));
        }
        return models;
    }

    private static List<DataModel> parsePython(String file, String text) {
        var models = new ArrayList<DataModel>();
        Matcher cls = PYTHON_MODEL_CLASS.matcher(text);
        while (cls.find()) {
            Matcher nextTopLevel = TOP_LEVEL_LINE.matcher(text);
            int end = nextTopLevel.find(cls.end()) ? nextTopLevel.start() : text.length();
            var fields = new ArrayList<String>();
            Matcher field = PYTHON_FIELD.matcher(text.substring(cls.end(), end));
            while (field.find()) {
                fields.add(field.group(1));
            }
            String type = cls.group(2).startsWith("models") ? "django" : "sqlalchemy";
            models.add(model(cls.group(1), type, fields, file));
        }
        return models;
    }

    private static String mongooseModelName(String text, String schemaVariable) {
        Matcher model = MONGOOSE_MODEL.matcher(text);
        while (model.find()) {
            if (model.group(2).equals(schemaVariable)) {
                return model.group(1);
            }
        }
        String base = schemaVariable.replaceFirst("(?i)schema$", "");
        if (base.isEmpty()) {
            base = schemaVariable;
        }
        return Character.toUpperCase(base.charAt(0)) + base.substring(1);
    }

    /**
     * Returns the keys of the object literal opening at {@code braceIndex}, ignoring
     * anything nested deeper than its first level.
     */
    static List<String> objectKeys(String text, int braceIndex) {
        var topLevel = new StringBuilder();
        int depth = 0;
        char quote = 0;
        for (int i = braceIndex; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote && text.charAt(i - 1) != '\\') quote = 0;
                if (depth == 1) topLevel.append(c);
                continue;
            }
            if (c == '\'' || c == '"' || c == '`') {
                quote = c;
                if (depth == 1) topLevel.append(c);
                continue;
            }
            if (c == '{' || c == '[' || c == '(') {
                depth++;
                if (depth == 1) topLevel.append('{');
                continue;
            }
            if (c == '}' || c == ']' || c == ')') {
                depth--;
                if (depth == 0) break;
                continue;
            }
            if (depth == 1) topLevel.append(c);
        }
        var keys = new ArrayList<String>();
        Matcher key = TOP_LEVEL_KEY.matcher(topLevel);
        while (key.find()) {
            keys.add(key.group(1));
        }
        return keys;
    }

    private static String classBody(String text, int from) {
        int open = text.indexOf('{', from);
        if (open < 0) {
            return "";
        }
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '{') depth++;
            if (c == '}' && --depth == 0) {
                return text.substring(open + 1, i);
            }
        }
        return text.substring(open + 1);
    }

    private static DataModel model(String name, String type, List<String> rawFields, String file) {
        var fields = new TreeSet<String>();
        for (String field : rawFields) {
            if (!OPTION_KEYS.contains(field)) {
                fields.add(field);
            }
        }
        return new DataModel(name, type, fields.stream().limit(MAX_FIELDS).toList(), file);
    }
}

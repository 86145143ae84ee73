package com.repoatlas.core.signals;

import com.repoatlas.core.config.AtlasProperties;
import com.repoatlas.core.model.DataModel;
import com.repoatlas.core.model.FileCategory;
import com.repoatlas.core.model.RouteEntry;
import com.repoatlas.core.model.Signal;
import com.repoatlas.core.scanner.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads one file and applies the {@link PatternCatalog} plus the structural parsers
 * (references, routes, schemas, barrel detection).
 */
@Service
public class SignalExtractor {

    private static final Logger log = LoggerFactory.getLogger(SignalExtractor.class);

    private final List<PatternGroup> groups;
    private final int maxLines;

    @Autowired
    public SignalExtractor(AtlasProperties properties) {
        this(PatternCatalog.DEFAULT_GROUPS, properties.getScan().getMaxLines());
    }

    public SignalExtractor(List<PatternGroup> groups, int maxLines) {
        this.groups = List.copyOf(groups);
        this.maxLines = maxLines;
    }

    /**
     * Reads the file leniently (malformed UTF-8 is dropped) and extracts its signals.
     * Only the first configured lines are examined; the full line count is still recorded.
     *
     * @throws IOException if the file cannot be read
     */
    public FileSignals extract(SourceFile file) throws IOException {
        var decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.IGNORE)
                .onUnmappableCharacter(CodingErrorAction.IGNORE);
        var text = new StringBuilder();
        int lines = 0;
        try (var reader = new BufferedReader(new InputStreamReader(Files.newInputStream(file.absolutePath()), decoder))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (lines < maxLines) {
                    text.append(line).append('\n');
                }
                lines++;
            }
        }
        boolean truncated = lines > maxLines;
        if (truncated) {
            log.warn("{} has {} lines; only the first {} were analysed", file.relativePath(), lines, maxLines);
        }
        return analyze(file.relativePath(), file.extension(), text.toString(), lines, truncated);
    }

    /**
     * Pure extraction over already-loaded text.
     */
    public FileSignals analyze(String relativePath, String extension, String text, int lines, boolean truncated) {
        FileCategory category = FileCategorizer.categorize(relativePath, extension);
        Syntax syntax = FileCategorizer.syntax(extension);
        boolean packageInit = relativePath.endsWith("__init__.py");

        var signals = new ArrayList<Signal>();
        for (PatternGroup group : groups) {
            if (group.appliesTo(category) && group.matches(text)) {
                signals.add(new Signal(group.category(), group.value()));
            }
        }

        List<RawReference> references = ReferenceParser.parse(text, syntax, packageInit);
        List<RouteEntry> routes = category.isCode() ? RouteParser.parse(relativePath, text, syntax) : List.of();
        List<DataModel> models = category.isCode() ? SchemaParser.parse(relativePath, text, syntax) : List.of();
        boolean barrel = ReferenceParser.isBarrel(text, syntax, packageInit);

        if (log.isDebugEnabled()) {
            log.debug("{}: category={}, {} references, {} signals, {} routes, {} models{}",
                    relativePath, category, references.size(), signals.size(), routes.size(), models.size(),
                    barrel ? ", barrel" : "");
        }
        return new FileSignals(relativePath, extension, category, syntax, lines,
                references, signals, routes, models, barrel, truncated);
    }
}

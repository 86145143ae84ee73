package com.repoatlas.core.signals;

import com.repoatlas.core.model.DataModel;
import com.repoatlas.core.model.FileCategory;
import com.repoatlas.core.model.RouteEntry;
import com.repoatlas.core.model.Signal;

import java.util.List;

/**
 * Everything the extractor learned about one file.
 *
 * @param truncated true when only the first configured lines were examined
 */
public record FileSignals(
        String path,
        String extension,
        FileCategory category,
        Syntax syntax,
        int lines,
        List<RawReference> references,
        List<Signal> signals,
        List<RouteEntry> routes,
        List<DataModel> models,
        boolean barrel,
        boolean truncated
) {}

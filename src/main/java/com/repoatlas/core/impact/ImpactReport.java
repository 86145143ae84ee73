package com.repoatlas.core.impact;

import com.repoatlas.core.model.Cycle;

import java.util.List;

public record ImpactReport(
        List<String> changedFiles,
        List<String> unknownFiles,
        BlastRadius blastRadius,
        int size,
        boolean escalate,
        ImpactLevel level,
        List<Cycle> cycles,
        List<String> warnings
) {}

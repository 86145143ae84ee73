package com.repoatlas.core.impact;

public enum ImpactLevel { LOW, MEDIUM, HIGH, CRITICAL }

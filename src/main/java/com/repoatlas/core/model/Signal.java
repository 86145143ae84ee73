package com.repoatlas.core.model;

/**
 * One recognised technology marker, e.g. {@code (ORM, "prisma")}.
 */
public record Signal(SignalCategory category, String value) {}

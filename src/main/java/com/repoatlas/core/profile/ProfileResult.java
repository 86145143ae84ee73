package com.repoatlas.core.profile;

import java.util.List;

/**
 * The main profile plus its secondary module maps.
 */
public record ProfileResult(Profile main, List<Profile> moduleMaps) {}

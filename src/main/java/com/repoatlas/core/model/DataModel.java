package com.repoatlas.core.model;

import java.util.List;

/**
 * A schema or entity definition, e.g. a mongoose schema or a sequelize model.
 */
public record DataModel(
        String name,
        String type,            // mongoose, sequelize, typeorm, jpa, sqlalchemy, django
        List<String> fields,    // sorted, de-duplicated
        String file
) {}

package com.mlorenc.project.board.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.mlorenc.project.board.model.FieldMetadata;

import java.util.List;

/**
 * Read-through cache of field lists, owned by a single run. A failed fetch is not cached.
 */
class SnapshotFieldLookup implements FieldLookup {

    private final ProjectFieldResolver resolver;
    private final Cache<String, List<FieldMetadata>> fieldsByProject = Caffeine.newBuilder()
            .maximumSize(64)
            .build();

    SnapshotFieldLookup(ProjectFieldResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public FieldMetadata resolveField(String projectId, String fieldName) {
        List<FieldMetadata> fields = fieldsByProject.get(projectId, resolver::listFields);
        return ProjectFieldResolver.selectField(fields, projectId, fieldName);
    }
}

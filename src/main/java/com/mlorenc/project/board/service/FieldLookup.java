package com.mlorenc.project.board.service;

import com.mlorenc.project.board.model.FieldMetadata;

/**
 * Name-to-metadata lookup for the fields of a project.
 */
public interface FieldLookup {

    FieldMetadata resolveField(String projectId, String fieldName);
}

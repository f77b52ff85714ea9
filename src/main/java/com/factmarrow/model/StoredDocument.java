package com.factmarrow.model;

import java.nio.file.Path;

/**
 * A document written to storage.
 *
 * @param documentId content-derived identifier
 * @param filename   original filename
 * @param path       stored file
 * @param sizeBytes  size in bytes
 */
public record StoredDocument(String documentId, String filename, Path path, long sizeBytes) {}

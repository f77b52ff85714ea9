package com.factmarrow.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * A submitted document. The id is derived from the content hash, so
 * re-submitting identical bytes maps to the same record.
 *
 * @param id        content-derived identifier (first 12 hex chars of SHA-256)
 * @param title     original filename
 * @param filePath  where the document is stored
 * @param sizeBytes size of the document
 * @param createdAt first submission time
 */
@Document(collection = "documents")
public record DocumentRecord(
        @Id String id,
        String title,
        String filePath,
        long sizeBytes,
        Instant createdAt
) {}

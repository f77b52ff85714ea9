package com.factmarrow.model;

import java.util.List;

/**
 * Bibliographic metadata extracted by the document-processing phase.
 * Scalar fields are null when the agent did not report them.
 *
 * @param title           document title
 * @param authors         author names (empty when unknown)
 * @param publicationDate publication date as reported by the agent
 * @param institution     publishing institution
 * @param abstractText    the document abstract
 * @param keywords        keywords (empty when unknown)
 */
public record DocumentMetadata(
        String title,
        List<String> authors,
        String publicationDate,
        String institution,
        String abstractText,
        List<String> keywords
) {
    public DocumentMetadata {
        authors = authors != null ? List.copyOf(authors) : List.of();
        keywords = keywords != null ? List.copyOf(keywords) : List.of();
    }
}

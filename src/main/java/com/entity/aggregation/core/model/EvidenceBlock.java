package com.entity.aggregation.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The proof shown next to a result: the best quote, every supporting post and,
 * for places, any address or venue text found in the posts.
 */
public record EvidenceBlock(
        SourceEvidence primaryQuote,
        List<EvidenceReference> references,
        double confidence,
        Optional<String> geographicContext
) {
    public EvidenceBlock {
        Objects.requireNonNull(primaryQuote, "primaryQuote is required");
        references = references != null ? List.copyOf(references) : List.of();
        geographicContext = geographicContext != null ? geographicContext : Optional.empty();
    }

    public String quote() {
        return primaryQuote.snippet();
    }
}

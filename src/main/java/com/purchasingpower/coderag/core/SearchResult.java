package com.purchasingpower.coderag.core;

import lombok.Builder;
import lombok.Value;

/**
 * One ranked hit. Within a returned list, scores never increase by index.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class SearchResult {

    Document document;

    double score;

    SearchSource source;

    public String getDocumentId() {
        return document.getId();
    }

    public static SearchResult of(Document document, double score, SearchSource source) {
        return new SearchResult(document, score, source);
    }
}

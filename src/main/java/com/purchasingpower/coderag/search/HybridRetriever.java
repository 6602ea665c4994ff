package com.purchasingpower.coderag.search;

import com.purchasingpower.coderag.core.SearchResult;

import java.util.List;

/**
 * Fuses dense vector similarity with BM25 for one session's corpus.
 *
 * <p>Returns at most {@code topK} results with non-increasing scores. A failing
 * or empty candidate list degrades the search to the other one; an empty corpus
 * gives an empty list.
 */
public interface HybridRetriever {

    /**
     * @throws IllegalArgumentException if {@code topK < 1}
     */
    List<SearchResult> search(String query, int topK);
}

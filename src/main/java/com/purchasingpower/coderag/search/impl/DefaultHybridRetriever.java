package com.purchasingpower.coderag.search.impl;

import com.purchasingpower.coderag.core.Document;
import com.purchasingpower.coderag.core.SearchResult;
import com.purchasingpower.coderag.core.SearchSource;
import com.purchasingpower.coderag.knowledge.DocumentStore;
import com.purchasingpower.coderag.knowledge.EmbeddingGateway;
import com.purchasingpower.coderag.search.Bm25Index;
import com.purchasingpower.coderag.search.HybridRetriever;
import com.purchasingpower.coderag.search.LexicalSnapshot;
import com.purchasingpower.coderag.search.QueryTokenizer;
import com.purchasingpower.coderag.search.ReciprocalRankFusion;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import java.util.stream.IntStream;

/**
 * Runs the vector and lexical legs in parallel on the worker pool and fuses them.
 *
 * <p>Each leg asks for {@code topK * oversample} candidates. A leg that throws is
 * logged and treated as empty, so one failing backend degrades the search instead
 * of failing it.
 */
@Slf4j
public class DefaultHybridRetriever implements HybridRetriever {

    private final EmbeddingGateway embeddingGateway;
    private final DocumentStore documentStore;
    private final Supplier<LexicalSnapshot> lexicalState;
    private final QueryTokenizer tokenizer;
    private final ReciprocalRankFusion fusion;
    private final int oversample;
    private final Executor executor;

    public DefaultHybridRetriever(EmbeddingGateway embeddingGateway,
                                  DocumentStore documentStore,
                                  Supplier<LexicalSnapshot> lexicalState,
                                  QueryTokenizer tokenizer,
                                  ReciprocalRankFusion fusion,
                                  int oversample,
                                  Executor executor) {
        this.embeddingGateway = embeddingGateway;
        this.documentStore = documentStore;
        this.lexicalState = lexicalState;
        this.tokenizer = tokenizer;
        this.fusion = fusion;
        this.oversample = Math.max(1, oversample);
        this.executor = executor;
    }

    @Override
    public List<SearchResult> search(String query, int topK) {
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be at least 1, got " + topK);
        }
        int candidateK = topK * oversample;
        LexicalSnapshot snapshot = lexicalState.get();

        CompletableFuture<List<SearchResult>> vector = CompletableFuture
                .supplyAsync(() -> vectorCandidates(query, candidateK), executor)
                .exceptionally(e -> {
                    log.warn("⚠️ Vector search failed, using lexical results only: {}", e.getMessage());
                    return List.of();
                });
        CompletableFuture<List<SearchResult>> lexical = CompletableFuture
                .supplyAsync(() -> lexicalCandidates(snapshot, query, candidateK), executor)
                .exceptionally(e -> {
                    log.warn("⚠️ Lexical search failed, using vector results only: {}", e.getMessage());
                    return List.of();
                });

        List<SearchResult> vectorResults = vector.join();
        List<SearchResult> lexicalResults = lexical.join();
        List<SearchResult> fused = fusion.fuse(vectorResults, lexicalResults, topK);

        log.debug("🔍 '{}' -> vector={}, lexical={}, fused={}",
                query, vectorResults.size(), lexicalResults.size(), fused.size());
        return fused;
    }

    private List<SearchResult> vectorCandidates(String query, int candidateK) {
        float[] queryVector = embeddingGateway.embedText(query);
        if (queryVector.length == 0) {
            return List.of();
        }
        return documentStore.search(queryVector, candidateK, Map.of());
    }

    /**
     * BM25 scores sorted descending with a stable sort, so equal scores keep
     * corpus order; only strictly positive scores count as matches.
     */
    static List<SearchResult> lexicalCandidates(LexicalSnapshot snapshot, QueryTokenizer tokenizer,
                                                String query, int candidateK) {
        Bm25Index bm25 = snapshot.getBm25();
        if (bm25 == null || snapshot.size() == 0) {
            return List.of();
        }
        List<String> tokens = tokenizer.tokenize(query);
        if (tokens.isEmpty()) {
            return List.of();
        }
        double[] scores = bm25.scores(tokens);
        List<Document> documents = snapshot.getDocuments();

        List<Integer> order = new ArrayList<>(IntStream.range(0, scores.length).boxed().toList());
        order.sort(Comparator.comparingDouble((Integer i) -> scores[i]).reversed());

        List<SearchResult> results = new ArrayList<>();
        for (int i = 0; i < Math.min(candidateK, order.size()); i++) {
            int index = order.get(i);
            if (scores[index] > 0) {
                results.add(SearchResult.of(documents.get(index).withoutEmbedding(),
                        scores[index], SearchSource.LEXICAL));
            }
        }
        return results;
    }

    private List<SearchResult> lexicalCandidates(LexicalSnapshot snapshot, String query, int candidateK) {
        return lexicalCandidates(snapshot, tokenizer, query, candidateK);
    }
}

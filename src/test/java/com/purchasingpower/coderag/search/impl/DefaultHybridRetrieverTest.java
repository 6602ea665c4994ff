package com.purchasingpower.coderag.search.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.coderag.core.Document;
import com.purchasingpower.coderag.core.SearchResult;
import com.purchasingpower.coderag.core.SearchSource;
import com.purchasingpower.coderag.knowledge.EmbeddingGateway;
import com.purchasingpower.coderag.knowledge.impl.LocalDocumentStore;
import com.purchasingpower.coderag.search.Bm25Index;
import com.purchasingpower.coderag.search.LexicalSnapshot;
import com.purchasingpower.coderag.search.QueryTokenizer;
import com.purchasingpower.coderag.search.ReciprocalRankFusion;
import com.purchasingpower.coderag.support.FakeEmbeddingGateway;
import com.purchasingpower.coderag.support.FastRetries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("Hybrid Retriever Tests")
class DefaultHybridRetrieverTest {

    private static final List<String> CORPUS = List.of(
            "render html page template",
            "parse configuration text into settings",
            "open socket connection with retry",
            "compute checksum of bytes",
            "log message formatter");

    @TempDir
    Path tempDir;

    private final QueryTokenizer tokenizer = new QueryTokenizer("[^\\p{L}\\p{N}_]+");
    private final AtomicReference<LexicalSnapshot> snapshot = new AtomicReference<>(LexicalSnapshot.empty());

    private FakeEmbeddingGateway embeddings;
    private LocalDocumentStore store;
    private DefaultHybridRetriever retriever;

    @BeforeEach
    void setUp() {
        embeddings = new FakeEmbeddingGateway();
        store = new LocalDocumentStore("repo_test", tempDir, new ObjectMapper(), FastRetries.withAttempts(1));
        store.initialize();
        retriever = new DefaultHybridRetriever(embeddings, store, snapshot::get, tokenizer,
                new ReciprocalRankFusion(60, 1.0, 0.3), 2, Runnable::run);
    }

    @Test
    @DisplayName("Should return nothing for an empty corpus")
    void testEmptyCorpus_ShouldYieldNothing() {
        assertTrue(retriever.search("parse configuration", 5).isEmpty());
    }

    @Test
    @DisplayName("Should reject topK below one")
    void testInvalidTopK_ShouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> retriever.search("anything", 0));
    }

    @Test
    @DisplayName("Should fall back to vector results when no lexical index exists")
    void testNoLexicalIndex_ShouldUseVectorOnly() {
        // Given: vectors stored but the lexical snapshot never built
        List<Document> documents = index(false);

        // When
        List<SearchResult> results = retriever.search("compute checksum of bytes", 3);

        // Then
        assertFalse(results.isEmpty());
        assertTrue(results.size() <= 3);
        assertEquals(documents.get(3).getId(), results.get(0).getDocumentId());
        assertNull(results.get(0).getDocument().getEmbedding(), "results never carry vectors");
    }

    @Test
    @DisplayName("Should rescue keyword matches through BM25 when the vector leg fails")
    void testVectorFailure_ShouldUseLexicalOnly() {
        List<Document> documents = index(true);
        embeddings.setThrowing(true);

        List<SearchResult> results = retriever.search("parse configuration", 3);

        assertFalse(results.isEmpty());
        List<String> top = results.stream().map(SearchResult::getDocumentId).toList();
        assertTrue(top.contains(documents.get(1).getId()), "expected the configuration parser in " + top);
        System.out.println("✅ Lexical rescue returned " + top);
    }

    @Test
    @DisplayName("Should let a keyword match outrank a vector leg that points elsewhere")
    void testWeakVectorLeg_ShouldBeLiftedByLexicalWeight() {
        // Given a working vector leg whose query embedding resembles the log formatter
        List<Document> documents = index(true);
        EmbeddingGateway offTopic = mock(EmbeddingGateway.class);
        when(offTopic.embedText(anyString())).thenReturn(FakeEmbeddingGateway.vectorOf("log message formatter"));
        DefaultHybridRetriever hybrid = new DefaultHybridRetriever(offTopic, store, snapshot::get, tokenizer,
                new ReciprocalRankFusion(60, 1.0, 0.3), 2, Runnable::run);

        // When
        List<SearchResult> results = hybrid.search("parse configuration", 3);

        // Then the parser, last by vector, wins on its single lexical hit
        List<String> top = results.stream().map(SearchResult::getDocumentId).toList();
        assertEquals(List.of(documents.get(1).getId(), documents.get(4).getId(), documents.get(0).getId()), top);
        assertEquals(1.0 / 65 + 0.3 / 61, results.get(0).getScore(), 1e-9);
        assertEquals(1.0 / 61, results.get(1).getScore(), 1e-9);
        verify(offTopic).embedText("parse configuration");
        System.out.println("✅ Weighted fusion ranked " + top);
    }

    @Test
    @DisplayName("Should fuse both legs into at most topK results with non-increasing scores")
    void testBothLegs_ShouldFuse() {
        index(true);

        List<SearchResult> results = retriever.search("open socket connection", 2);

        assertTrue(results.size() <= 2);
        for (int i = 1; i < results.size(); i++) {
            assertTrue(results.get(i - 1).getScore() >= results.get(i).getScore());
        }
        results.forEach(result -> assertEquals(SearchSource.HYBRID, result.getSource()));
        assertEquals("file_2", results.get(0).getDocumentId());
    }

    @Test
    @DisplayName("Should only report strictly positive lexical matches")
    void testLexicalCandidates_ShouldSkipZeroScores() {
        index(true);

        List<SearchResult> none = DefaultHybridRetriever.lexicalCandidates(snapshot.get(), tokenizer,
                "kubernetes", 10);
        List<SearchResult> one = DefaultHybridRetriever.lexicalCandidates(snapshot.get(), tokenizer,
                "checksum", 10);

        assertTrue(none.isEmpty());
        assertEquals(1, one.size());
        assertEquals(SearchSource.LEXICAL, one.get(0).getSource());
        assertEquals("file_3", one.get(0).getDocumentId());
    }

    private List<Document> index(boolean withLexical) {
        List<Document> documents = new ArrayList<>();
        List<float[]> vectors = new ArrayList<>();
        List<List<String>> tokenized = new ArrayList<>();
        Set<String> files = new LinkedHashSet<>();
        for (int i = 0; i < CORPUS.size(); i++) {
            String file = "src/module" + i + ".py";
            documents.add(Document.builder()
                    .id("file_" + i)
                    .content(CORPUS.get(i))
                    .metadata(Map.of(Document.META_FILE, file, Document.META_START_LINE, "1"))
                    .build());
            vectors.add(FakeEmbeddingGateway.vectorOf(CORPUS.get(i)));
            tokenized.add(tokenizer.tokenize(CORPUS.get(i)));
            files.add(file);
        }
        store.add(documents, vectors);
        if (withLexical) {
            snapshot.set(new LexicalSnapshot(documents, Bm25Index.build(tokenized), files));
        }
        return documents;
    }
}

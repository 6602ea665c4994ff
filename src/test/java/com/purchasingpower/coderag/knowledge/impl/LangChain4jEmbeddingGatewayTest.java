package com.purchasingpower.coderag.knowledge.impl;

import com.purchasingpower.coderag.config.GlobalRetryConfig;
import com.purchasingpower.coderag.configuration.EmbeddingProperties;
import com.purchasingpower.coderag.util.RetryExecutor;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("LangChain4j Embedding Gateway Tests")
class LangChain4jEmbeddingGatewayTest {

    @Mock
    private EmbeddingModel embeddingModel;

    private LangChain4jEmbeddingGateway gateway;

    @BeforeEach
    void setUp() {
        EmbeddingProperties properties = new EmbeddingProperties();
        properties.setDimension(3);
        properties.setBatchSize(2);
        properties.setMaxTextLength(20);
        properties.setMaxConcurrentBatches(2);

        GlobalRetryConfig retryConfig = new GlobalRetryConfig();
        retryConfig.setMaxAttempts(2);
        retryConfig.setBackoffMs(1);
        retryConfig.setMaxBackoffMs(2);
        retryConfig.setJitter(0.0);

        gateway = new LangChain4jEmbeddingGateway(embeddingModel, properties,
                new RetryExecutor(retryConfig), Runnable::run);
    }

    @Test
    @DisplayName("Should flatten and truncate text before embedding")
    void testEmbedText_ShouldPrepareText() {
        when(embeddingModel.embed(anyString())).thenReturn(Response.from(Embedding.from(new float[]{1, 2, 3})));

        float[] vector = gateway.embedText("  first line\nsecond line that is long  ");

        assertArrayEquals(new float[]{1, 2, 3}, vector);
        verify(embeddingModel).embed("first line second li");
    }

    @Test
    @DisplayName("Should return an empty vector for blank text without calling the model")
    void testEmbedText_ShouldSkipBlank() {
        assertEquals(0, gateway.embedText("  \n ").length);
        verifyNoInteractions(embeddingModel);
    }

    @Test
    @DisplayName("Should swallow model failures as an empty vector")
    void testEmbedText_ShouldReturnEmptyOnFailure() {
        when(embeddingModel.embed(anyString())).thenThrow(new IllegalArgumentException("model not found"));

        assertEquals(0, gateway.embedText("query").length);
        assertEquals(1, gateway.getStats().getFailed());
    }

    @Test
    @DisplayName("Should embed in batches and preserve input order, leaving blanks empty")
    void testEmbedBatch_ShouldPreserveOrder() {
        when(embeddingModel.embedAll(anyList())).thenAnswer(invocation -> {
            List<TextSegment> segments = invocation.getArgument(0);
            List<Embedding> embeddings = new ArrayList<>();
            for (TextSegment segment : segments) {
                embeddings.add(Embedding.from(new float[]{segment.text().length(), 0, 0}));
            }
            return Response.from(embeddings);
        });

        List<float[]> vectors = gateway.embedBatch(List.of("a", "bb", "", "dddd", "eeeee"));

        assertEquals(5, vectors.size());
        assertEquals(1f, vectors.get(0)[0]);
        assertEquals(2f, vectors.get(1)[0]);
        assertEquals(0, vectors.get(2).length);
        assertEquals(4f, vectors.get(3)[0]);
        assertEquals(5f, vectors.get(4)[0]);
        verify(embeddingModel, times(3)).embedAll(anyList());
    }

    @Test
    @DisplayName("Should retry a transient batch failure and then succeed")
    void testEmbedBatch_ShouldRetryTransientFailure() {
        when(embeddingModel.embedAll(anyList()))
                .thenThrow(new RuntimeException("503 Service Unavailable"))
                .thenReturn(Response.from(List.of(Embedding.from(new float[]{1, 1, 1}))));

        List<float[]> vectors = gateway.embedBatch(List.of("retry me"));

        assertEquals(3, vectors.get(0).length);
        verify(embeddingModel, times(2)).embedAll(anyList());
    }

    @Test
    @DisplayName("Should leave empty slots when a batch fails for good")
    void testEmbedBatch_ShouldEmptyFailedBatch() {
        when(embeddingModel.embedAll(anyList()))
                .thenReturn(Response.from(List.of(Embedding.from(new float[]{1, 1, 1}),
                        Embedding.from(new float[]{2, 2, 2}))))
                .thenThrow(new IllegalArgumentException("context length exceeded"));

        List<float[]> vectors = gateway.embedBatch(List.of("one", "two", "three"));

        assertEquals(3, vectors.size());
        assertEquals(3, vectors.get(0).length);
        assertEquals(3, vectors.get(1).length);
        assertEquals(0, vectors.get(2).length);
        assertEquals(1, gateway.getStats().getFailed());
    }

    @Test
    @DisplayName("Should treat a short model response as a failed batch")
    void testEmbedBatch_ShouldRejectSizeMismatch() {
        when(embeddingModel.embedAll(anyList()))
                .thenReturn(Response.from(List.of(Embedding.from(new float[]{1, 1, 1}))));

        List<float[]> vectors = gateway.embedBatch(List.of("one", "two"));

        assertEquals(0, vectors.get(0).length);
        assertEquals(0, vectors.get(1).length);
    }
}

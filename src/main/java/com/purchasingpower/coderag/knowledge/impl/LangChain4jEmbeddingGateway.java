package com.purchasingpower.coderag.knowledge.impl;

import com.purchasingpower.coderag.configuration.CodeRagProperties;
import com.purchasingpower.coderag.configuration.EmbeddingProperties;
import com.purchasingpower.coderag.exception.EmbeddingFailureException;
import com.purchasingpower.coderag.knowledge.EmbeddingGateway;
import com.purchasingpower.coderag.util.CallContext;
import com.purchasingpower.coderag.util.RetryExecutor;
import com.purchasingpower.coderag.util.ServiceType;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Embedding gateway backed by a LangChain4j {@link EmbeddingModel} (Ollama by default).
 *
 * <p>Texts are flattened to one line and truncated before embedding. Batches run
 * concurrently on the retrieval executor, at most {@code max-concurrent-batches}
 * at a time, each retried on transient errors. A batch that still fails leaves
 * empty vectors in its slots; callers drop those.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class LangChain4jEmbeddingGateway implements EmbeddingGateway {

    private static final float[] EMPTY = new float[0];

    private final EmbeddingModel embeddingModel;
    private final EmbeddingProperties properties;
    private final RetryExecutor retryExecutor;
    private final Executor executor;
    private final Semaphore batchPermits;

    private final AtomicLong requests = new AtomicLong();
    private final AtomicLong embedded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    @Autowired
    public LangChain4jEmbeddingGateway(CodeRagProperties properties,
                                       RetryExecutor retryExecutor,
                                       @Qualifier("retrievalExecutor") Executor executor) {
        this(buildOllamaModel(properties.getEmbedding()), properties.getEmbedding(), retryExecutor, executor);
    }

    public LangChain4jEmbeddingGateway(EmbeddingModel embeddingModel,
                                       EmbeddingProperties properties,
                                       RetryExecutor retryExecutor,
                                       Executor executor) {
        this.embeddingModel = embeddingModel;
        this.properties = properties;
        this.retryExecutor = retryExecutor;
        this.executor = executor;
        this.batchPermits = new Semaphore(Math.max(1, properties.getMaxConcurrentBatches()));
    }

    private static EmbeddingModel buildOllamaModel(EmbeddingProperties properties) {
        log.info("🔷 Initializing embedding gateway");
        log.info("   - Ollama URL: {}", properties.getBaseUrl());
        log.info("   - Model: {} ({} dimensions)", properties.getModel(), properties.getDimension());

        // Retries go through RetryExecutor
        EmbeddingModel model = OllamaEmbeddingModel.builder()
                .baseUrl(properties.getBaseUrl())
                .modelName(properties.getModel())
                .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                .maxRetries(1)
                .logRequests(false)
                .logResponses(false)
                .build();

        log.info("✅ Embedding gateway initialized");
        return model;
    }

    @Override
    public float[] embedText(String text) {
        String prepared = prepare(text);
        if (prepared.isEmpty()) {
            return EMPTY;
        }
        requests.incrementAndGet();

        CallContext ctx = CallContext.start(ServiceType.EMBEDDING, "embed", log);
        ctx.logRequest(CallContext.abbreviate(prepared, 80));
        try {
            Response<Embedding> response = retryExecutor.execute("embed text",
                    () -> embeddingModel.embed(prepared));
            float[] vector = response.content().vector();
            ctx.logResponse("dimensions=" + vector.length);
            embedded.incrementAndGet();
            return vector;
        } catch (RuntimeException e) {
            ctx.logError("Query embedding failed", e);
            failed.incrementAndGet();
            return EMPTY;
        }
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        List<String> prepared = texts.stream().map(this::prepare).toList();

        int batchSize = Math.max(1, properties.getBatchSize());
        List<CompletableFuture<List<float[]>>> batches = new ArrayList<>();
        for (int start = 0; start < prepared.size(); start += batchSize) {
            List<String> batch = prepared.subList(start, Math.min(start + batchSize, prepared.size()));
            int batchNumber = start / batchSize + 1;
            batches.add(CompletableFuture.supplyAsync(() -> embedGuarded(batch, batchNumber), executor));
        }

        List<float[]> vectors = new ArrayList<>(texts.size());
        for (CompletableFuture<List<float[]>> batch : batches) {
            vectors.addAll(batch.join());
        }

        long empty = vectors.stream().filter(vector -> vector.length == 0).count();
        if (empty > 0) {
            log.warn("⚠️ {} of {} texts have no embedding", empty, texts.size());
        } else {
            log.debug("✅ Embedded {} texts in {} batches", texts.size(), batches.size());
        }
        return vectors;
    }

    @Override
    public int dimension() {
        return properties.getDimension();
    }

    public EmbeddingStats getStats() {
        return new EmbeddingStats(requests.get(), embedded.get(), failed.get());
    }

    private List<float[]> embedGuarded(List<String> batch, int batchNumber) {
        try {
            batchPermits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return emptyVectors(batch.size());
        }
        try {
            return embedBatchWithRetry(batch, batchNumber);
        } catch (EmbeddingFailureException e) {
            log.error("❌ Embedding batch {} failed ({} texts): {}", batchNumber, e.getTextCount(), e.getMessage());
            failed.addAndGet(batch.size());
            return emptyVectors(batch.size());
        } finally {
            batchPermits.release();
        }
    }

    /**
     * Blank texts are skipped (the model rejects them) and keep an empty slot.
     */
    private List<float[]> embedBatchWithRetry(List<String> batch, int batchNumber) {
        List<Integer> positions = new ArrayList<>();
        List<TextSegment> segments = new ArrayList<>();
        for (int i = 0; i < batch.size(); i++) {
            if (!batch.get(i).isEmpty()) {
                positions.add(i);
                segments.add(TextSegment.from(batch.get(i)));
            }
        }
        List<float[]> vectors = emptyVectors(batch.size());
        if (segments.isEmpty()) {
            return vectors;
        }
        requests.incrementAndGet();

        CallContext ctx = CallContext.start(ServiceType.EMBEDDING, "embedAll", log);
        ctx.logRequest("batch " + batchNumber, "texts", segments.size());
        List<Embedding> embeddings;
        try {
            embeddings = retryExecutor.execute("embed batch " + batchNumber,
                    () -> embeddingModel.embedAll(segments).content());
        } catch (RuntimeException e) {
            ctx.logError("Batch " + batchNumber + " failed", e);
            throw new EmbeddingFailureException(e.getMessage(), segments.size(), e);
        }
        if (embeddings == null || embeddings.size() != segments.size()) {
            int got = embeddings == null ? 0 : embeddings.size();
            throw new EmbeddingFailureException(
                    "model returned " + got + " vectors for " + segments.size() + " texts", segments.size(), null);
        }
        ctx.logResponse("vectors=" + embeddings.size());

        for (int i = 0; i < positions.size(); i++) {
            vectors.set(positions.get(i), embeddings.get(i).vector());
        }
        embedded.addAndGet(segments.size());
        return vectors;
    }

    private String prepare(String text) {
        return truncate(preprocess(text), properties.getMaxTextLength());
    }

    static String preprocess(String text) {
        if (text == null) {
            return "";
        }
        return text.replace('\n', ' ').strip();
    }

    private static String truncate(String text, int maxLength) {
        return text.length() > maxLength ? text.substring(0, maxLength) : text;
    }

    private static List<float[]> emptyVectors(int count) {
        List<float[]> vectors = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            vectors.add(EMPTY);
        }
        return vectors;
    }

    /**
     * Counters since startup. {@code requests} counts model calls, the other two count texts.
     */
    @Value
    public static class EmbeddingStats {
        long requests;
        long embedded;
        long failed;
    }
}

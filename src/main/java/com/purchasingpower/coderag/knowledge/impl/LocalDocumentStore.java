package com.purchasingpower.coderag.knowledge.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.coderag.core.Document;
import com.purchasingpower.coderag.core.SearchResult;
import com.purchasingpower.coderag.core.SearchSource;
import com.purchasingpower.coderag.exception.StorageWriteException;
import com.purchasingpower.coderag.knowledge.DocumentStore;
import com.purchasingpower.coderag.util.CallContext;
import com.purchasingpower.coderag.util.RetryExecutor;
import com.purchasingpower.coderag.util.RetryExecutor.RetryExhaustedException;
import com.purchasingpower.coderag.util.ServiceType;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * File-backed document store: one JSON file per collection, loaded into memory
 * and searched by brute-force cosine similarity.
 *
 * <p>Every successful {@link #add} rewrites the file through a temp file and an
 * atomic move, so a crash never leaves a half-written collection behind. Failed
 * writes are retried with backoff.
 */
@Slf4j
public class LocalDocumentStore implements DocumentStore {

    private static final TypeReference<List<Document>> DOCUMENT_LIST = new TypeReference<>() {
    };

    private final String collectionName;
    private final Path file;
    private final ObjectMapper objectMapper;
    private final RetryExecutor retryExecutor;
    private final Object monitor = new Object();

    private List<Document> documents;

    public LocalDocumentStore(String collectionName, Path directory, ObjectMapper objectMapper,
                              RetryExecutor retryExecutor) {
        this.collectionName = collectionName;
        this.file = directory.resolve(collectionName + ".json");
        this.objectMapper = objectMapper;
        this.retryExecutor = retryExecutor;
    }

    @Override
    public void initialize() {
        synchronized (monitor) {
            if (documents != null) {
                return;
            }
            documents = new ArrayList<>(load());
            log.debug("📁 Collection {} ready ({} documents)", collectionName, documents.size());
        }
    }

    @Override
    public int add(List<Document> batch, List<float[]> embeddings) {
        if (batch.size() != embeddings.size()) {
            throw new IllegalArgumentException("documents and embeddings differ in size: "
                    + batch.size() + " vs " + embeddings.size());
        }
        if (batch.isEmpty()) {
            return 0;
        }
        synchronized (monitor) {
            initialize();
            List<Document> updated = new ArrayList<>(documents.size() + batch.size());
            updated.addAll(documents);
            for (int i = 0; i < batch.size(); i++) {
                updated.add(batch.get(i).toBuilder().embedding(embeddings.get(i)).build());
            }

            CallContext ctx = CallContext.start(ServiceType.FILESYSTEM, "write " + collectionName, log);
            ctx.logRequest(null, "documents", batch.size());
            try {
                retryExecutor.execute("write " + collectionName, () -> {
                    write(updated);
                    return null;
                });
            } catch (RetryExhaustedException e) {
                ctx.logError("Write failed", e.getCause());
                throw new StorageWriteException(collectionName, e.getAttempts(), "Could not write " + file, e.getCause());
            }
            ctx.logResponse("total=" + updated.size());
            documents = updated;
            return batch.size();
        }
    }

    @Override
    public List<SearchResult> search(float[] queryVector, int topK, Map<String, String> filter) {
        List<Document> snapshot;
        synchronized (monitor) {
            initialize();
            snapshot = documents;
        }
        List<SearchResult> scored = new ArrayList<>();
        for (Document document : snapshot) {
            float[] embedding = document.getEmbedding();
            if (embedding == null || embedding.length != queryVector.length || !matches(document, filter)) {
                continue;
            }
            scored.add(SearchResult.of(document.withoutEmbedding(),
                    cosine(queryVector, embedding), SearchSource.VECTOR));
        }
        scored.sort(Comparator.comparingDouble(SearchResult::getScore).reversed());
        return scored.size() > topK ? new ArrayList<>(scored.subList(0, topK)) : scored;
    }

    @Override
    public List<Document> scrollAll() {
        synchronized (monitor) {
            initialize();
            return documents.stream().map(Document::withoutEmbedding).toList();
        }
    }

    @Override
    public List<Document> getByFile(String filePath) {
        return scrollAll().stream()
                .filter(document -> filePath.equals(document.getFilePath()))
                .sorted(Comparator.comparingInt(Document::getStartLine))
                .toList();
    }

    @Override
    public long count() {
        synchronized (monitor) {
            initialize();
            return documents.size();
        }
    }

    @Override
    public void deleteCollection() {
        synchronized (monitor) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                throw new StorageWriteException(collectionName, 1, "Could not delete " + file, e);
            }
            documents = null;
            log.info("🗑️ Deleted collection {}", collectionName);
        }
    }

    @Override
    public String getCollectionName() {
        return collectionName;
    }

    @Override
    public void close() {
        synchronized (monitor) {
            documents = null;
        }
    }

    private List<Document> load() {
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            return objectMapper.readValue(file.toFile(), DOCUMENT_LIST);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read collection file " + file, e);
        }
    }

    private void write(List<Document> all) throws IOException {
        Files.createDirectories(file.getParent());
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        objectMapper.writeValue(temp.toFile(), all);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private static boolean matches(Document document, Map<String, String> filter) {
        if (filter == null || filter.isEmpty()) {
            return true;
        }
        for (Map.Entry<String, String> entry : filter.entrySet()) {
            if (!entry.getValue().equals(document.getMetadata().get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    static double cosine(float[] a, float[] b) {
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}

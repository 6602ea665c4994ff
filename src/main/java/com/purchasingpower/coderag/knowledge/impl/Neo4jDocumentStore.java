package com.purchasingpower.coderag.knowledge.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.coderag.core.Document;
import com.purchasingpower.coderag.core.SearchResult;
import com.purchasingpower.coderag.core.SearchSource;
import com.purchasingpower.coderag.exception.StorageWriteException;
import com.purchasingpower.coderag.knowledge.DocumentStore;
import com.purchasingpower.coderag.util.CallContext;
import com.purchasingpower.coderag.util.RetryExecutor;
import com.purchasingpower.coderag.util.ServiceType;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Document store over a shared Neo4j {@link Driver}. Every document is a
 * {@code :CodeChunk} node tagged with its collection name, so one database holds
 * all sessions.
 *
 * <p>Similarity is exact cosine over the collection's nodes, which keeps results
 * scoped to the collection. Writes go out in {@code UNWIND} batches, each retried
 * on transient errors.
 */
@Slf4j
public class Neo4jDocumentStore implements DocumentStore {

    private static final TypeReference<Map<String, String>> METADATA = new TypeReference<>() {
    };

    private final String collectionName;
    private final Driver driver;
    private final RetryExecutor retryExecutor;
    private final ObjectMapper objectMapper;
    private final int writeBatchSize;

    public Neo4jDocumentStore(String collectionName, Driver driver, RetryExecutor retryExecutor,
                              ObjectMapper objectMapper, int writeBatchSize) {
        this.collectionName = collectionName;
        this.driver = driver;
        this.retryExecutor = retryExecutor;
        this.objectMapper = objectMapper;
        this.writeBatchSize = Math.max(1, writeBatchSize);
    }

    /**
     * Nodes are created on first write; the label indexes are owned by the factory.
     */
    @Override
    public void initialize() {
        log.debug("🟢 Collection {} bound to Neo4j", collectionName);
    }

    @Override
    public int add(List<Document> documents, List<float[]> embeddings) {
        if (documents.size() != embeddings.size()) {
            throw new IllegalArgumentException("documents and embeddings differ in size: "
                    + documents.size() + " vs " + embeddings.size());
        }
        if (documents.isEmpty()) {
            return 0;
        }
        long base = count();
        int written = 0;
        for (int start = 0; start < documents.size(); start += writeBatchSize) {
            int end = Math.min(start + writeBatchSize, documents.size());
            List<Map<String, Object>> rows = new ArrayList<>(end - start);
            for (int i = start; i < end; i++) {
                rows.add(row(documents.get(i), embeddings.get(i), base + i));
            }
            writeBatch(rows, start / writeBatchSize + 1);
            written += rows.size();
        }
        return written;
    }

    private void writeBatch(List<Map<String, Object>> rows, int batchNumber) {
        String cypher = """
            UNWIND $rows AS row
            MERGE (c:CodeChunk {collection: $collection, docId: row.docId})
            SET c.content = row.content,
                c.file = row.file,
                c.startLine = row.startLine,
                c.ordinal = row.ordinal,
                c.metadataJson = row.metadataJson,
                c.embedding = row.embedding
            """;

        CallContext ctx = CallContext.start(ServiceType.NEO4J, "UpsertChunks", log);
        ctx.logRequest("collection=" + collectionName, "batch", batchNumber, "rows", rows.size());

        AtomicInteger attempts = new AtomicInteger();
        try {
            retryExecutor.execute("write " + collectionName + " batch " + batchNumber, () -> {
                attempts.incrementAndGet();
                try (Session session = driver.session()) {
                    return session.executeWrite(tx -> tx.run(cypher,
                            Map.of("rows", rows, "collection", collectionName)).consume());
                }
            });
            ctx.logResponse("Stored " + rows.size() + " chunks");
        } catch (RuntimeException e) {
            ctx.logError("Batch " + batchNumber + " failed", e);
            throw new StorageWriteException(collectionName, attempts.get(),
                    "Failed to write batch " + batchNumber + " to " + collectionName, e);
        }
    }

    @Override
    public List<SearchResult> search(float[] queryVector, int topK, Map<String, String> filter) {
        boolean filtered = filter != null && !filter.isEmpty();
        String cypher = """
            MATCH (c:CodeChunk {collection: $collection})
            WHERE c.embedding IS NOT NULL AND size(c.embedding) = $dimensions
            WITH c, vector.similarity.cosine(c.embedding, $vector) AS score
            RETURN c.docId AS docId, c.content AS content, c.metadataJson AS metadataJson, score
            ORDER BY score DESC, c.ordinal ASC
            """ + (filtered ? "" : "LIMIT $limit");

        CallContext ctx = CallContext.start(ServiceType.NEO4J, "VectorSearch", log);
        ctx.logRequest("collection=" + collectionName, "topK", topK);

        List<Record> records = retryExecutor.execute("search " + collectionName, () -> {
            try (Session session = driver.session()) {
                return session.executeRead(tx -> tx.run(cypher, Map.of(
                        "collection", collectionName,
                        "vector", toList(queryVector),
                        "dimensions", queryVector.length,
                        "limit", topK)).list());
            }
        });

        List<SearchResult> results = new ArrayList<>();
        for (Record record : records) {
            Document document = toDocument(record);
            if (filtered && !matches(document, filter)) {
                continue;
            }
            results.add(SearchResult.of(document, record.get("score").asDouble(), SearchSource.VECTOR));
            if (results.size() >= topK) {
                break;
            }
        }
        ctx.logResponse("hits=" + results.size());
        return results;
    }

    @Override
    public List<Document> scrollAll() {
        String cypher = """
            MATCH (c:CodeChunk {collection: $collection})
            RETURN c.docId AS docId, c.content AS content, c.metadataJson AS metadataJson
            ORDER BY c.ordinal ASC
            """;
        return readDocuments(cypher, Map.of("collection", collectionName), "ScrollAll");
    }

    @Override
    public List<Document> getByFile(String filePath) {
        String cypher = """
            MATCH (c:CodeChunk {collection: $collection, file: $file})
            RETURN c.docId AS docId, c.content AS content, c.metadataJson AS metadataJson
            ORDER BY c.startLine ASC, c.ordinal ASC
            """;
        return readDocuments(cypher, Map.of("collection", collectionName, "file", filePath), "GetByFile");
    }

    @Override
    public long count() {
        String cypher = "MATCH (c:CodeChunk {collection: $collection}) RETURN count(c) AS total";
        return retryExecutor.execute("count " + collectionName, () -> {
            try (Session session = driver.session()) {
                return session.executeRead(tx -> tx.run(cypher, Map.of("collection", collectionName))
                        .single().get("total").asLong());
            }
        });
    }

    @Override
    public void deleteCollection() {
        String cypher = """
            MATCH (c:CodeChunk {collection: $collection})
            CALL { WITH c DETACH DELETE c } IN TRANSACTIONS OF 1000 ROWS
            """;
        CallContext ctx = CallContext.start(ServiceType.NEO4J, "DeleteCollection", log);
        ctx.logRequest("collection=" + collectionName);
        try {
            retryExecutor.execute("delete " + collectionName, () -> {
                // CALL ... IN TRANSACTIONS needs an auto-commit transaction
                try (Session session = driver.session()) {
                    return session.run(cypher, Map.of("collection", collectionName)).consume();
                }
            });
            ctx.logResponse("deleted");
            log.info("🗑️ Deleted collection {}", collectionName);
        } catch (RuntimeException e) {
            ctx.logError("Delete failed", e);
            throw new StorageWriteException(collectionName, 1, "Failed to delete " + collectionName, e);
        }
    }

    @Override
    public String getCollectionName() {
        return collectionName;
    }

    /**
     * The driver is shared and owned by {@link Neo4jDocumentStoreFactory}.
     */
    @Override
    public void close() {
    }

    private List<Document> readDocuments(String cypher, Map<String, Object> params, String operation) {
        CallContext ctx = CallContext.start(ServiceType.NEO4J, operation, log);
        ctx.logRequest("collection=" + collectionName);
        List<Record> records = retryExecutor.execute(operation + " " + collectionName, () -> {
            try (Session session = driver.session()) {
                return session.executeRead(tx -> tx.run(cypher, params).list());
            }
        });
        List<Document> documents = records.stream().map(this::toDocument).toList();
        ctx.logResponse("documents=" + documents.size());
        return documents;
    }

    private Map<String, Object> row(Document document, float[] embedding, long ordinal) {
        Map<String, Object> row = new HashMap<>();
        row.put("docId", document.getId());
        row.put("content", document.getContent());
        row.put("file", document.getFilePath());
        row.put("startLine", document.getStartLine());
        row.put("ordinal", ordinal);
        row.put("embedding", toList(embedding));
        try {
            row.put("metadataJson", objectMapper.writeValueAsString(document.getMetadata()));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
        return row;
    }

    private Document toDocument(Record record) {
        Map<String, String> metadata;
        try {
            metadata = objectMapper.readValue(record.get("metadataJson").asString("{}"), METADATA);
        } catch (JsonProcessingException e) {
            log.warn("⚠️ Unreadable metadata on {} in {}", record.get("docId").asString(), collectionName);
            metadata = Map.of();
        }
        return Document.builder()
                .id(record.get("docId").asString())
                .content(record.get("content").asString(""))
                .metadata(metadata)
                .build();
    }

    private static boolean matches(Document document, Map<String, String> filter) {
        return filter.entrySet().stream()
                .allMatch(entry -> entry.getValue().equals(document.getMetadata().get(entry.getKey())));
    }

    private static List<Double> toList(float[] vector) {
        List<Double> values = new ArrayList<>(vector.length);
        for (float value : vector) {
            values.add((double) value);
        }
        return values;
    }
}

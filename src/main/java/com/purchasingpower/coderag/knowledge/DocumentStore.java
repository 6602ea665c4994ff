package com.purchasingpower.coderag.knowledge;

import com.purchasingpower.coderag.core.Document;
import com.purchasingpower.coderag.core.SearchResult;

import java.util.List;
import java.util.Map;

/**
 * Durable store of documents and their vectors for one named collection.
 *
 * <p>This is the source of truth for a session: the lexical index is rebuilt from
 * {@link #scrollAll()} whenever its cache is missing. Implementations are thread-safe.
 */
public interface DocumentStore extends AutoCloseable {

    /**
     * Creates the collection if needed. Safe to call more than once.
     */
    void initialize();

    /**
     * Writes documents with their vectors, matched by position.
     *
     * @return number of documents written
     * @throws com.purchasingpower.coderag.exception.StorageWriteException when the write
     *         still fails after retries
     */
    int add(List<Document> documents, List<float[]> embeddings);

    /**
     * Nearest neighbours by cosine similarity, best first.
     *
     * @param filter exact-match metadata constraints, or an empty map
     */
    List<SearchResult> search(float[] queryVector, int topK, Map<String, String> filter);

    /**
     * Every document in the collection, without vectors, in insertion order.
     */
    List<Document> scrollAll();

    List<Document> getByFile(String filePath);

    long count();

    /**
     * Drops the collection and everything in it.
     */
    void deleteCollection();

    String getCollectionName();

    /**
     * Releases this handle. Persisted data is kept.
     */
    @Override
    void close();
}

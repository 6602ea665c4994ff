package com.purchasingpower.coderag.session;

import com.purchasingpower.coderag.core.Chunk;
import com.purchasingpower.coderag.core.Document;
import com.purchasingpower.coderag.core.SearchResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One repository's (or chat's) indexed corpus: durable documents, the lexical
 * index over them and the session context file.
 *
 * <p>Searches may run concurrently with each other and with appends; a reset
 * waits for both. Callers that reset and re-index should hold the repository
 * lock for the whole sequence.
 */
public interface SessionStore extends AutoCloseable {

    String getSessionId();

    /**
     * Opens the document store and restores the lexical index, from its cache
     * file when valid or else from the document store. Idempotent.
     */
    void initialize();

    /**
     * Appends chunks with their embeddings, matched by position. Chunks whose
     * embedding is missing or has the wrong dimension are skipped.
     *
     * @return number of documents added
     * @throws IllegalArgumentException when the two lists differ in size
     * @throws com.purchasingpower.coderag.exception.StorageWriteException when the
     *         durable write fails; the lexical index is left untouched
     */
    int addDocuments(List<Chunk> chunks, List<float[]> embeddings);

    /**
     * Embeds the chunks and appends them.
     *
     * @return number of documents added; 0 when every embedding failed
     */
    int indexChunks(List<Chunk> chunks);

    /**
     * Hybrid search returning the configured default number of results.
     */
    List<SearchResult> searchHybrid(String query);

    /**
     * @throws IllegalArgumentException if {@code topK < 1}
     */
    List<SearchResult> searchHybrid(String query, int topK);

    /**
     * Deletes all documents, the lexical index, and the context and cache files.
     */
    void reset();

    /**
     * Documents of one file, ordered by start line.
     */
    List<Document> getDocumentsByFile(String filePath);

    Set<String> indexedFiles();

    int documentCount();

    /**
     * Records the analysed repository. Other keys of the context file are kept.
     */
    void saveContext(String repoUrl, Map<String, Object> globalContext);

    Optional<SessionContext> loadContext();

    /**
     * True once a repository has been analysed into this session.
     */
    boolean hasIndex();

    void saveReport(String report, String language);

    Optional<String> getReport(String language);

    List<String> availableReportLanguages();

    /**
     * Releases in-memory state and the store handle. Persisted data is kept.
     * The store cannot be used afterwards.
     */
    @Override
    void close();
}

package com.purchasingpower.coderag.session.impl;

import com.purchasingpower.coderag.core.Chunk;
import com.purchasingpower.coderag.core.Document;
import com.purchasingpower.coderag.core.SearchResult;
import com.purchasingpower.coderag.exception.CacheCorruptionException;
import com.purchasingpower.coderag.knowledge.DocumentStore;
import com.purchasingpower.coderag.knowledge.EmbeddingGateway;
import com.purchasingpower.coderag.search.Bm25Index;
import com.purchasingpower.coderag.search.HybridRetriever;
import com.purchasingpower.coderag.search.LexicalSnapshot;
import com.purchasingpower.coderag.search.QueryTokenizer;
import com.purchasingpower.coderag.session.SessionContext;
import com.purchasingpower.coderag.session.SessionStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Session store over a {@link DocumentStore}, with the lexical side kept in an
 * immutable {@link LexicalSnapshot} that every append replaces.
 *
 * <p>Locking: searches and appends hold the read side of {@code stateLock}, reset
 * and close hold the write side. Appends are additionally serialized by
 * {@code appendLock} because each one derives its document ids from the snapshot
 * it replaces. A closed store rejects further use.
 */
@Slf4j
public class DefaultSessionStore implements SessionStore {

    private static final String UNKNOWN_FILE = "unknown";

    private final String sessionId;
    private final DocumentStore documentStore;
    private final EmbeddingGateway embeddingGateway;
    private final QueryTokenizer tokenizer;
    private final HybridRetriever retriever;
    private final LexicalIndexCache cache;
    private final SessionContextFile contextFile;
    private final Executor executor;
    private final int defaultTopK;

    private final ReentrantReadWriteLock stateLock = new ReentrantReadWriteLock();
    private final ReentrantLock appendLock = new ReentrantLock();
    private final Object initLock = new Object();

    private volatile LexicalSnapshot snapshot = LexicalSnapshot.empty();
    private volatile boolean initialized;
    private volatile boolean closed;

    DefaultSessionStore(String sessionId,
                        DocumentStore documentStore,
                        EmbeddingGateway embeddingGateway,
                        QueryTokenizer tokenizer,
                        RetrieverFactory retrieverFactory,
                        LexicalIndexCache cache,
                        SessionContextFile contextFile,
                        Executor executor,
                        int defaultTopK) {
        this.sessionId = sessionId;
        this.documentStore = documentStore;
        this.embeddingGateway = embeddingGateway;
        this.tokenizer = tokenizer;
        this.cache = cache;
        this.contextFile = contextFile;
        this.executor = executor;
        this.defaultTopK = defaultTopK;
        this.retriever = retrieverFactory.create(documentStore, () -> snapshot);
    }

    @Override
    public String getSessionId() {
        return sessionId;
    }

    @Override
    public void initialize() {
        if (initialized) {
            return;
        }
        synchronized (initLock) {
            ensureOpen();
            if (initialized) {
                return;
            }
            documentStore.initialize();
            snapshot = restoreLexicalState();
            initialized = true;
            log.info("✅ Session {} ready ({} documents, {} files)",
                    sessionId, snapshot.size(), snapshot.getIndexedFiles().size());
        }
    }

    private LexicalSnapshot restoreLexicalState() {
        try {
            Optional<LexicalSnapshot> cached = cache.load();
            if (cached.isPresent()) {
                long stored = documentStore.count();
                if (cached.get().size() == stored) {
                    log.debug("📦 Lexical index for {} loaded from cache", sessionId);
                    return cached.get();
                }
                log.warn("⚠️ Lexical cache for {} holds {} documents but the store has {} - rebuilding",
                        sessionId, cached.get().size(), stored);
                cache.delete();
            }
        } catch (CacheCorruptionException e) {
            log.warn("⚠️ {} - deleting and rebuilding from the document store", e.getMessage());
            cache.delete();
        }
        return rebuildFromStore();
    }

    private LexicalSnapshot rebuildFromStore() {
        List<Document> documents = documentStore.scrollAll();
        if (documents.isEmpty()) {
            return LexicalSnapshot.empty();
        }
        Set<String> files = new LinkedHashSet<>();
        for (Document document : documents) {
            files.add(document.getFilePath());
        }
        LexicalSnapshot rebuilt = new LexicalSnapshot(documents, buildIndex(documents), files);
        cache.save(rebuilt);
        log.info("🔷 Rebuilt lexical index for {} from {} stored documents", sessionId, documents.size());
        return rebuilt;
    }

    @Override
    public int addDocuments(List<Chunk> chunks, List<float[]> embeddings) {
        if (chunks.size() != embeddings.size()) {
            throw new IllegalArgumentException("chunks and embeddings differ in size: "
                    + chunks.size() + " vs " + embeddings.size());
        }
        if (chunks.isEmpty()) {
            return 0;
        }
        initialize();

        stateLock.readLock().lock();
        appendLock.lock();
        try {
            ensureOpen();
            LexicalSnapshot current = snapshot;
            int dimension = embeddingGateway.dimension();

            List<Document> added = new ArrayList<>();
            List<float[]> vectors = new ArrayList<>();
            for (int i = 0; i < chunks.size(); i++) {
                float[] vector = embeddings.get(i);
                if (vector == null || vector.length == 0 || (dimension > 0 && vector.length != dimension)) {
                    continue;
                }
                Chunk chunk = chunks.get(i);
                String file = chunk.getFilePath() == null || chunk.getFilePath().isEmpty()
                        ? UNKNOWN_FILE : chunk.getFilePath();
                Map<String, String> metadata = chunk.toMetadata();
                metadata.put(Document.META_FILE, file);
                added.add(Document.builder()
                        .id(file + "_" + (current.size() + added.size()))
                        .content(chunk.getContent())
                        .metadata(metadata)
                        .build());
                vectors.add(vector);
            }

            int dropped = chunks.size() - added.size();
            if (dropped > 0) {
                log.warn("⚠️ Session {}: dropped {} of {} chunks without a usable embedding",
                        sessionId, dropped, chunks.size());
            }
            if (added.isEmpty()) {
                return 0;
            }

            // Durable write first; a failure here leaves the lexical state as it was
            documentStore.add(added, vectors);

            List<Document> all = new ArrayList<>(current.size() + added.size());
            all.addAll(current.getDocuments());
            all.addAll(added);
            Set<String> files = new LinkedHashSet<>(current.getIndexedFiles());
            added.forEach(document -> files.add(document.getFilePath()));

            Bm25Index bm25 = CompletableFuture.supplyAsync(() -> buildIndex(all), executor).join();
            LexicalSnapshot next = new LexicalSnapshot(all, bm25, files);
            snapshot = next;
            cache.save(next);

            log.info("📊 Session {}: added {} documents (total {})", sessionId, added.size(), next.size());
            return added.size();
        } finally {
            appendLock.unlock();
            stateLock.readLock().unlock();
        }
    }

    @Override
    public int indexChunks(List<Chunk> chunks) {
        if (chunks.isEmpty()) {
            return 0;
        }
        List<String> texts = chunks.stream().map(Chunk::getContent).toList();
        List<float[]> embeddings = embeddingGateway.embedBatch(texts);
        return addDocuments(chunks, embeddings);
    }

    @Override
    public List<SearchResult> searchHybrid(String query) {
        return searchHybrid(query, defaultTopK);
    }

    @Override
    public List<SearchResult> searchHybrid(String query, int topK) {
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be at least 1, got " + topK);
        }
        initialize();
        stateLock.readLock().lock();
        try {
            ensureOpen();
            return retriever.search(query, topK);
        } finally {
            stateLock.readLock().unlock();
        }
    }

    @Override
    public void reset() {
        stateLock.writeLock().lock();
        try {
            ensureOpen();
            documentStore.initialize();
            documentStore.deleteCollection();
            documentStore.initialize();
            cache.delete();
            contextFile.delete();
            snapshot = LexicalSnapshot.empty();
            initialized = true;
            log.info("🗑️ Session {} reset", sessionId);
        } finally {
            stateLock.writeLock().unlock();
        }
    }

    @Override
    public List<Document> getDocumentsByFile(String filePath) {
        initialize();
        return snapshot.getDocuments().stream()
                .filter(document -> filePath.equals(document.getFilePath()))
                .sorted(Comparator.comparingInt(Document::getStartLine))
                .toList();
    }

    @Override
    public Set<String> indexedFiles() {
        initialize();
        return snapshot.getIndexedFiles();
    }

    @Override
    public int documentCount() {
        initialize();
        return snapshot.size();
    }

    @Override
    public void saveContext(String repoUrl, Map<String, Object> globalContext) {
        contextFile.update(context -> {
            context.setRepoUrl(repoUrl);
            context.setGlobalContext(globalContext == null ? new LinkedHashMap<>() : new LinkedHashMap<>(globalContext));
        });
        log.debug("💾 Saved context for {}", sessionId);
    }

    @Override
    public Optional<SessionContext> loadContext() {
        return contextFile.load();
    }

    @Override
    public boolean hasIndex() {
        return contextFile.load().map(context -> context.getRepoUrl() != null).orElse(false);
    }

    @Override
    public void saveReport(String report, String language) {
        contextFile.update(context -> {
            if (context.getReports() == null) {
                context.setReports(new LinkedHashMap<>());
            }
            context.getReports().put(language, report);
            context.setReport(report);
            context.setReportLanguage(language);
        });
        log.info("💾 Saved {} report for {}", language, sessionId);
    }

    @Override
    public Optional<String> getReport(String language) {
        Optional<SessionContext> loaded = contextFile.load();
        if (loaded.isEmpty()) {
            return Optional.empty();
        }
        SessionContext context = loaded.get();
        if (context.getReports() != null && context.getReports().containsKey(language)) {
            return Optional.ofNullable(context.getReports().get(language));
        }
        String storedLanguage = context.getReportLanguage() == null ? "en" : context.getReportLanguage();
        if (context.getReport() != null && storedLanguage.equals(language)) {
            return Optional.of(context.getReport());
        }
        return Optional.empty();
    }

    @Override
    public List<String> availableReportLanguages() {
        return contextFile.load()
                .map(context -> context.getReports() == null
                        ? List.<String>of()
                        : List.copyOf(context.getReports().keySet()))
                .orElse(List.of());
    }

    /**
     * Waits for in-flight searches, appends and resets to finish, then releases
     * the store. Later calls fail with {@link IllegalStateException}.
     */
    @Override
    public void close() {
        stateLock.writeLock().lock();
        try {
            synchronized (initLock) {
                if (closed) {
                    return;
                }
                closed = true;
                documentStore.close();
                snapshot = LexicalSnapshot.empty();
                initialized = false;
            }
        } finally {
            stateLock.writeLock().unlock();
        }
        log.debug("🔒 Session {} closed", sessionId);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Session " + sessionId + " is closed");
        }
    }

    private Bm25Index buildIndex(List<Document> documents) {
        List<List<String>> tokenized = new ArrayList<>(documents.size());
        for (Document document : documents) {
            tokenized.add(tokenizer.tokenize(document.getContent()));
        }
        return Bm25Index.build(tokenized);
    }

    /**
     * Builds the retriever once the store exists, so it can read the live snapshot.
     */
    @FunctionalInterface
    interface RetrieverFactory {
        HybridRetriever create(DocumentStore documentStore, Supplier<LexicalSnapshot> snapshot);
    }
}

package com.purchasingpower.coderag.search;

import com.purchasingpower.coderag.core.Document;

import java.util.List;
import java.util.Set;

/**
 * Immutable view of a session's lexical state: the documents in index order, the
 * BM25 index built over them ({@code null} until first built) and the indexed files.
 *
 * <p>Writers build a new snapshot and swap it in; readers never see a partial one.
 */
public final class LexicalSnapshot {

    private static final LexicalSnapshot EMPTY = new LexicalSnapshot(List.of(), null, Set.of());

    private final List<Document> documents;
    private final Bm25Index bm25;
    private final Set<String> indexedFiles;

    public LexicalSnapshot(List<Document> documents, Bm25Index bm25, Set<String> indexedFiles) {
        this.documents = List.copyOf(documents);
        this.bm25 = bm25;
        this.indexedFiles = Set.copyOf(indexedFiles);
    }

    public static LexicalSnapshot empty() {
        return EMPTY;
    }

    public List<Document> getDocuments() {
        return documents;
    }

    public Bm25Index getBm25() {
        return bm25;
    }

    public Set<String> getIndexedFiles() {
        return indexedFiles;
    }

    public boolean hasIndex() {
        return bm25 != null && !documents.isEmpty();
    }

    public int size() {
        return documents.size();
    }
}

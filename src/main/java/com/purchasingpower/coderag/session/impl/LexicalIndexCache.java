package com.purchasingpower.coderag.session.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.coderag.core.Document;
import com.purchasingpower.coderag.exception.CacheCorruptionException;
import com.purchasingpower.coderag.search.Bm25Index;
import com.purchasingpower.coderag.search.LexicalSnapshot;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * On-disk copy of a session's lexical snapshot, so a restart does not have to
 * scroll the whole document store.
 *
 * <p>The file carries a format version; a file written under another version is
 * deleted and treated as missing.
 */
@Slf4j
class LexicalIndexCache {

    private final Path file;
    private final String formatVersion;
    private final ObjectMapper objectMapper;

    LexicalIndexCache(Path file, String formatVersion, ObjectMapper objectMapper) {
        this.file = file;
        this.formatVersion = formatVersion;
        this.objectMapper = objectMapper;
    }

    /**
     * @throws CacheCorruptionException when the file exists but cannot be read back
     */
    Optional<LexicalSnapshot> load() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        CacheFile cache;
        try {
            cache = objectMapper.readValue(file.toFile(), CacheFile.class);
        } catch (IOException e) {
            throw new CacheCorruptionException(file.toString(), e);
        }
        if (!formatVersion.equals(cache.getFormatVersion())) {
            log.info("📦 Lexical cache {} has format {} (expected {}), rebuilding",
                    file.getFileName(), cache.getFormatVersion(), formatVersion);
            delete();
            return Optional.empty();
        }
        List<Document> documents = cache.getDocuments() == null ? List.of() : cache.getDocuments();
        if (cache.getBm25() == null || cache.getBm25().size() != documents.size()) {
            throw new CacheCorruptionException(file.toString(),
                    new IllegalStateException("index size does not match document count"));
        }
        Set<String> files = cache.getIndexedFiles() == null ? Set.of() : cache.getIndexedFiles();
        return Optional.of(new LexicalSnapshot(documents, cache.getBm25(), files));
    }

    /**
     * Writes through a temp file and an atomic move. An empty snapshot is not written.
     */
    void save(LexicalSnapshot snapshot) {
        if (snapshot.size() == 0 || snapshot.getBm25() == null) {
            return;
        }
        CacheFile cache = new CacheFile(formatVersion, snapshot.getBm25(), snapshot.getDocuments(),
                new LinkedHashSet<>(snapshot.getIndexedFiles()));
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.createDirectories(file.getParent());
            objectMapper.writeValue(temp.toFile(), cache);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("💾 Saved lexical cache {} ({} documents)", file.getFileName(), snapshot.size());
        } catch (IOException e) {
            // The document store stays authoritative; next start rebuilds from it
            log.warn("⚠️ Could not save lexical cache {}: {}", file, e.getMessage());
        }
    }

    void delete() {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("⚠️ Could not delete lexical cache {}: {}", file, e.getMessage());
        }
    }

    Path getFile() {
        return file;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class CacheFile {
        private String formatVersion;
        private Bm25Index bm25;
        private List<Document> documents;
        private Set<String> indexedFiles;
    }
}

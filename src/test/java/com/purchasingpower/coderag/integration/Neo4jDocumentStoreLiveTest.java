package com.purchasingpower.coderag.integration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.coderag.core.Document;
import com.purchasingpower.coderag.core.SearchResult;
import com.purchasingpower.coderag.knowledge.impl.Neo4jDocumentStore;
import com.purchasingpower.coderag.support.FastRetries;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Round trip through a real Neo4j 5 database (vector functions need 5.18 or later).
 *
 * REQUIRES: NEO4J_URI, plus NEO4J_USERNAME and NEO4J_PASSWORD unless the defaults apply
 */
@DisplayName("Neo4j Document Store Live Tests")
@EnabledIfEnvironmentVariable(named = "NEO4J_URI", matches = ".+")
class Neo4jDocumentStoreLiveTest {

    private Driver driver;
    private Neo4jDocumentStore store;

    @BeforeEach
    void setUp() {
        driver = GraphDatabase.driver(System.getenv("NEO4J_URI"), AuthTokens.basic(
                System.getenv().getOrDefault("NEO4J_USERNAME", "neo4j"),
                System.getenv().getOrDefault("NEO4J_PASSWORD", "password")));
        String collection = "repo_live_" + UUID.randomUUID().toString().substring(0, 8);
        store = new Neo4jDocumentStore(collection, driver, FastRetries.withAttempts(2), new ObjectMapper(), 2);
        store.initialize();
    }

    @AfterEach
    void tearDown() {
        store.deleteCollection();
        driver.close();
    }

    @Test
    @DisplayName("Should store, search, list and delete a collection")
    void testRoundTrip_ShouldWork() {
        List<Document> documents = List.of(
                document("src/config.py_0", "src/config.py", 10, "def parse_config(text): ..."),
                document("src/config.py_1", "src/config.py", 2, "import json"),
                document("web/socket.js_2", "web/socket.js", 1, "function connect(host) {}"));
        List<float[]> vectors = List.of(
                new float[]{1f, 0f, 0f}, new float[]{0.6f, 0.8f, 0f}, new float[]{0f, 0f, 1f});

        assertEquals(3, store.add(documents, vectors));
        assertEquals(3, store.count());

        List<SearchResult> hits = store.search(new float[]{1f, 0f, 0f}, 2, Map.of());
        assertEquals(List.of("src/config.py_0", "src/config.py_1"),
                hits.stream().map(SearchResult::getDocumentId).toList());
        assertEquals(1.0, hits.get(0).getScore(), 1e-6);

        List<Integer> lines = store.getByFile("src/config.py").stream().map(Document::getStartLine).toList();
        assertEquals(List.of(2, 10), lines);
        assertEquals(3, store.scrollAll().size());

        store.deleteCollection();
        assertEquals(0, store.count());
        System.out.println("✅ Neo4j round trip complete");
    }

    private static Document document(String id, String file, int line, String content) {
        return Document.builder()
                .id(id)
                .content(content)
                .metadata(Map.of(Document.META_FILE, file, Document.META_START_LINE, String.valueOf(line)))
                .build();
    }
}

package com.purchasingpower.coderag.knowledge.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.coderag.configuration.CodeRagProperties;
import com.purchasingpower.coderag.configuration.StoreProperties;
import com.purchasingpower.coderag.knowledge.DocumentStore;
import com.purchasingpower.coderag.knowledge.DocumentStoreFactory;
import com.purchasingpower.coderag.util.RetryExecutor;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Session;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Owns the single Neo4j driver shared by every session's store.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "coderag.store", name = "backend", havingValue = "neo4j")
public class Neo4jDocumentStoreFactory implements DocumentStoreFactory {

    private final StoreProperties properties;
    private final RetryExecutor retryExecutor;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private Driver driver;

    public Neo4jDocumentStoreFactory(CodeRagProperties properties, RetryExecutor retryExecutor) {
        this.properties = properties.getStore();
        this.retryExecutor = retryExecutor;
    }

    @PostConstruct
    public void init() {
        log.info("Initializing Neo4j document store at: {}", properties.getNeo4jUri());
        driver = GraphDatabase.driver(properties.getNeo4jUri(),
                AuthTokens.basic(properties.getNeo4jUsername(), properties.getNeo4jPassword()));
        createIndexes();
    }

    @PreDestroy
    public void close() {
        if (driver != null) {
            driver.close();
            log.info("Neo4j document store connection closed");
        }
    }

    private void createIndexes() {
        try (Session session = driver.session()) {
            session.run("CREATE INDEX code_chunk_collection IF NOT EXISTS FOR (c:CodeChunk) ON (c.collection)");
            session.run("CREATE INDEX code_chunk_doc IF NOT EXISTS FOR (c:CodeChunk) ON (c.collection, c.docId)");
            session.run("CREATE INDEX code_chunk_file IF NOT EXISTS FOR (c:CodeChunk) ON (c.collection, c.file)");
            log.info("✅ CodeChunk indexes ready");
        } catch (Exception e) {
            log.warn("⚠️ Could not create CodeChunk indexes: {}", e.getMessage());
        }
    }

    @Override
    public DocumentStore create(String collectionName) {
        return new Neo4jDocumentStore(collectionName, driver, retryExecutor, objectMapper,
                properties.getWriteBatchSize());
    }
}

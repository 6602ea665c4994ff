package com.purchasingpower.coderag.knowledge.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.coderag.configuration.CodeRagProperties;
import com.purchasingpower.coderag.knowledge.DocumentStore;
import com.purchasingpower.coderag.knowledge.DocumentStoreFactory;
import com.purchasingpower.coderag.util.RetryExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Slf4j
@Component
@ConditionalOnProperty(prefix = "coderag.store", name = "backend", havingValue = "local", matchIfMissing = true)
public class LocalDocumentStoreFactory implements DocumentStoreFactory {

    private final Path directory;
    private final RetryExecutor retryExecutor;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public LocalDocumentStoreFactory(CodeRagProperties properties, RetryExecutor retryExecutor) {
        this.directory = Path.of(properties.getStore().getLocalDir());
        this.retryExecutor = retryExecutor;
        log.info("✅ Using local document store at {}", directory.toAbsolutePath());
    }

    @Override
    public DocumentStore create(String collectionName) {
        return new LocalDocumentStore(collectionName, directory, objectMapper, retryExecutor);
    }
}

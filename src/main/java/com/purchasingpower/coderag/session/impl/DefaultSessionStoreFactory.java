package com.purchasingpower.coderag.session.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.coderag.configuration.CodeRagProperties;
import com.purchasingpower.coderag.configuration.SessionProperties;
import com.purchasingpower.coderag.knowledge.DocumentStoreFactory;
import com.purchasingpower.coderag.knowledge.EmbeddingGateway;
import com.purchasingpower.coderag.search.QueryTokenizer;
import com.purchasingpower.coderag.search.ReciprocalRankFusion;
import com.purchasingpower.coderag.search.impl.DefaultHybridRetriever;
import com.purchasingpower.coderag.session.SessionStore;
import com.purchasingpower.coderag.session.SessionStoreFactory;
import com.purchasingpower.coderag.util.SessionIds;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.concurrent.Executor;

/**
 * Wires a session store to its collection ({@code repo_<sessionId>}) and to its
 * files under the context directory.
 */
@Component
public class DefaultSessionStoreFactory implements SessionStoreFactory {

    private final DocumentStoreFactory documentStoreFactory;
    private final EmbeddingGateway embeddingGateway;
    private final QueryTokenizer tokenizer;
    private final ReciprocalRankFusion fusion;
    private final Executor executor;
    private final SessionProperties sessionProperties;
    private final int oversample;
    private final int defaultTopK;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public DefaultSessionStoreFactory(DocumentStoreFactory documentStoreFactory,
                                      EmbeddingGateway embeddingGateway,
                                      QueryTokenizer tokenizer,
                                      ReciprocalRankFusion fusion,
                                      CodeRagProperties properties,
                                      @Qualifier("retrievalExecutor") Executor executor) {
        this.documentStoreFactory = documentStoreFactory;
        this.embeddingGateway = embeddingGateway;
        this.tokenizer = tokenizer;
        this.fusion = fusion;
        this.executor = executor;
        this.sessionProperties = properties.getSession();
        this.oversample = properties.getSearch().getOversampleFactor();
        this.defaultTopK = properties.getSearch().getDefaultTopK();
    }

    @Override
    public SessionStore create(String sessionId) {
        String safeId = SessionIds.sanitize(sessionId);
        if (safeId.isEmpty()) {
            throw new IllegalArgumentException("Invalid session id: '" + sessionId + "'");
        }
        Path contextDir = Path.of(sessionProperties.getContextDir());

        return new DefaultSessionStore(
                safeId,
                documentStoreFactory.create(SessionIds.collectionName(sessionId)),
                embeddingGateway,
                tokenizer,
                (store, snapshot) -> new DefaultHybridRetriever(
                        embeddingGateway, store, snapshot, tokenizer, fusion, oversample, executor),
                new LexicalIndexCache(contextDir.resolve(safeId + "_bm25.json"),
                        sessionProperties.getCacheVersion(), objectMapper),
                new SessionContextFile(contextDir.resolve(safeId + ".json"), objectMapper),
                executor,
                defaultTopK);
    }
}

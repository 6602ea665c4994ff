package com.purchasingpower.coderag.session.impl;

import com.purchasingpower.coderag.configuration.CodeRagProperties;
import com.purchasingpower.coderag.knowledge.DocumentStore;
import com.purchasingpower.coderag.knowledge.DocumentStoreFactory;
import com.purchasingpower.coderag.search.QueryTokenizer;
import com.purchasingpower.coderag.search.ReciprocalRankFusion;
import com.purchasingpower.coderag.session.SessionStore;
import com.purchasingpower.coderag.support.FakeEmbeddingGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("Session Store Factory Tests")
class DefaultSessionStoreFactoryTest {

    @TempDir
    Path tempDir;

    private DocumentStoreFactory documentStoreFactory;
    private DefaultSessionStoreFactory factory;

    @BeforeEach
    void setUp() {
        CodeRagProperties properties = new CodeRagProperties();
        properties.getSession().setContextDir(tempDir.toString());
        documentStoreFactory = mock(DocumentStoreFactory.class);
        when(documentStoreFactory.create(anyString())).thenReturn(mock(DocumentStore.class));

        factory = new DefaultSessionStoreFactory(documentStoreFactory, new FakeEmbeddingGateway(),
                new QueryTokenizer(properties.getSearch().getTokenizePattern()),
                new ReciprocalRankFusion(60, 1.0, 0.3), properties, Runnable::run);
    }

    @Test
    @DisplayName("Should use the repo_ prefixed collection for the session")
    void testCreate_ShouldNameCollection() {
        SessionStore store = factory.create("repo_1a2b3c4d_acme_widgets");

        assertEquals("repo_1a2b3c4d_acme_widgets", store.getSessionId());
        verify(documentStoreFactory).create("repo_repo_1a2b3c4d_acme_widgets");
    }

    @Test
    @DisplayName("Should strip unsafe characters from the session id")
    void testCreate_ShouldSanitizeId() {
        SessionStore store = factory.create("chat/../42");

        assertEquals("chat42", store.getSessionId());
        verify(documentStoreFactory).create("repo_chat42");
    }

    @Test
    @DisplayName("Should reject an id with no safe characters")
    void testCreate_ShouldRejectEmptyId() {
        assertThrows(IllegalArgumentException.class, () -> factory.create("../"));
        verifyNoInteractions(documentStoreFactory);
    }
}

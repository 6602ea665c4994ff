package com.purchasingpower.coderag.knowledge;

/**
 * Creates store handles. Handles for different collections may share one client.
 */
public interface DocumentStoreFactory {

    DocumentStore create(String collectionName);
}

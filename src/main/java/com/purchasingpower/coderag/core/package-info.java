/**
 * Core domain models shared by every layer of the retrieval engine.
 *
 * <p>Contains:
 * <ul>
 *   <li>Chunk - transient output of the chunker</li>
 *   <li>Document - persisted unit owned by a document store</li>
 *   <li>SearchResult - ranked hit returned by the retriever</li>
 * </ul>
 *
 * <p>This package has no dependency on storage, embedding or Spring classes.
 *
 * @since 1.0.0
 */
package com.purchasingpower.coderag.core;

/**
 * Collaborators of the retrieval engine that talk to the outside world.
 *
 * <ul>
 *   <li>{@link com.purchasingpower.coderag.knowledge.EmbeddingGateway} - text to vector</li>
 *   <li>{@link com.purchasingpower.coderag.knowledge.DocumentStore} - durable documents and vectors</li>
 * </ul>
 */
package com.purchasingpower.coderag.knowledge;

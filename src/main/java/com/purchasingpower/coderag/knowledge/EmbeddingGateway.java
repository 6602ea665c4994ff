package com.purchasingpower.coderag.knowledge;

import java.util.List;

/**
 * Text to dense vector. Failures never escape: they show up as empty vectors.
 */
public interface EmbeddingGateway {

    /**
     * @return the vector, or an empty array when the text is blank or the call failed
     */
    float[] embedText(String text);

    /**
     * Embeds many texts, preserving order. Entries whose batch failed are empty arrays.
     */
    List<float[]> embedBatch(List<String> texts);

    /**
     * Length of every non-empty vector this gateway returns.
     */
    int dimension();
}

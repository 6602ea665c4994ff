package com.purchasingpower.coderag.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class StoreProperties {

    public enum Backend {
        LOCAL,
        NEO4J
    }

    @NotNull
    private Backend backend = Backend.LOCAL;

    /**
     * Directory for the local JSON-backed store.
     */
    @NotBlank
    private String localDir = "data/vector_store";

    @Min(1)
    private int writeBatchSize = 100;

    @NotBlank
    private String neo4jUri = "bolt://localhost:7687";

    @NotBlank
    private String neo4jUsername = "neo4j";

    private String neo4jPassword = "password";
}

package com.purchasingpower.coderag.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class EmbeddingProperties {

    @NotBlank
    private String baseUrl = "http://localhost:11434";

    @NotBlank
    private String model = "bge-m3";

    @Min(1)
    private int dimension = 1024;

    @Min(1)
    private int batchSize = 50;

    @Min(1)
    private int maxTextLength = 8000;

    @Min(1)
    private int maxConcurrentBatches = 5;

    @Min(1)
    private int timeoutSeconds = 60;
}

package com.purchasingpower.coderag.configuration;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Hybrid search tuning: candidate oversampling and reciprocal rank fusion.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchProperties {

    @Min(1)
    @Builder.Default
    private int defaultTopK = 10;

    @Min(1)
    @Builder.Default
    private int oversampleFactor = 2;

    @Min(1)
    @Builder.Default
    private int rrfK = 60;

    @DecimalMin("0.0")
    @Builder.Default
    private double vectorWeight = 1.0;

    @DecimalMin("0.0")
    @Builder.Default
    private double lexicalWeight = 0.3;

    /**
     * Separator class for lexical tokens. Letters of any script are kept.
     */
    @NotBlank
    @Builder.Default
    private String tokenizePattern = "[^\\p{L}\\p{N}_]+";
}

package com.purchasingpower.coderag.configuration;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Size limits for the chunker. All sizes are in characters except the window length.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkerProperties {

    @Min(0)
    @Builder.Default
    private int minChunkSize = 50;

    @Min(100)
    @Builder.Default
    private int maxChunkSize = 2000;

    /**
     * Module globals larger than this become a standalone GLOBAL_CONTEXT chunk
     * instead of being prepended to every declaration.
     */
    @Min(0)
    @Builder.Default
    private int maxContextSize = 800;

    @Min(1)
    @Builder.Default
    private int fallbackWindowLines = 100;

    /**
     * A declaration-free script is kept whole up to this multiple of maxChunkSize.
     */
    @DecimalMin("1.0")
    @Builder.Default
    private double scriptTolerance = 1.5;
}

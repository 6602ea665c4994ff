package com.purchasingpower.coderag.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class SessionProperties {

    @Min(1)
    private int maxCount = 100;

    /**
     * Where lexical caches and session context files live.
     */
    @NotBlank
    private String contextDir = "data/contexts";

    /**
     * Bumped whenever the cache layout changes; older files trigger a rebuild.
     */
    @NotBlank
    private String cacheVersion = "bm25-v2";
}

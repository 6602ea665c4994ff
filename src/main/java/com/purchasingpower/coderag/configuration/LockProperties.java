package com.purchasingpower.coderag.configuration;

import com.purchasingpower.coderag.lock.LockBackend;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class LockProperties {

    @NotNull
    private LockBackend backend = LockBackend.FILE;

    @NotBlank
    private String dir = "data/locks";

    @NotBlank
    private String redisHost = "localhost";

    @Min(1)
    private int redisPort = 6379;

    /**
     * Expiry of a distributed lock that is never released (crashed holder).
     */
    @Min(1)
    private long leaseSeconds = 300;

    @Min(1)
    private long acquireTimeoutSeconds = 60;
}

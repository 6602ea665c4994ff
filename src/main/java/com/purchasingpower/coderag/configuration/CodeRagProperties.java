package com.purchasingpower.coderag.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "coderag")
public class CodeRagProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ChunkerProperties chunker = new ChunkerProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private SearchProperties search = new SearchProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private SessionProperties session = new SessionProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private EmbeddingProperties embedding = new EmbeddingProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private StoreProperties store = new StoreProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private LockProperties lock = new LockProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private WorkerPoolProperties workerPool = new WorkerPoolProperties();
}

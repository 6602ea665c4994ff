package com.purchasingpower.coderag.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the configuration property classes that are not components themselves.
 *
 * <ul>
 *   <li>{@link GlobalRetryConfig} - retry and backoff settings
 * </ul>
 *
 * @since 1.0.0
 */
@Configuration
@EnableConfigurationProperties({
    GlobalRetryConfig.class
})
public class ConfigurationPropertiesEnablerConfig {
}

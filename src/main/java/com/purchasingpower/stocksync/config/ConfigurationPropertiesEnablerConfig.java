package com.purchasingpower.stocksync.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the application's {@code @ConfigurationProperties} classes:
 * <ul>
 *   <li>{@link SyncProperties} - view model synchronisation settings
 * </ul>
 *
 * @since 1.0.0
 */
@Configuration
@EnableConfigurationProperties({
    SyncProperties.class
})
public class ConfigurationPropertiesEnablerConfig {
}

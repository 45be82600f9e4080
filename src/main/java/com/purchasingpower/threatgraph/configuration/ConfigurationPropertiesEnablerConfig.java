package com.purchasingpower.threatgraph.configuration;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the application's {@code @ConfigurationProperties} classes with Spring's binder.
 *
 * <ul>
 *   <li>{@link GraphProperties} - traversal limits, context thresholds, mirroring</li>
 * </ul>
 */
@Configuration
@EnableConfigurationProperties(GraphProperties.class)
public class ConfigurationPropertiesEnablerConfig {
}

package com.platform.discovery.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Run bookkeeping settings.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "discovery.runs")
public class DiscoveryRunConfig {
    
    /**
     * Finished runs kept in memory. The oldest finished run is evicted first.
     */
    private int retained = 20;
}

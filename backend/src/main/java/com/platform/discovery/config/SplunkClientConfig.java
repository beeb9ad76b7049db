package com.platform.discovery.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration properties for the splunkd REST client.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "discovery.splunk")
public class SplunkClientConfig {
    
    /**
     * Scheme of the management port.
     */
    private String scheme = "https";
    
    /**
     * Port used when a seed or a reference does not name one.
     */
    private int defaultPort = 8089;
    
    /**
     * Connection timeout in milliseconds.
     */
    private int connectTimeoutMs = 5000;
    
    /**
     * Timeout of every REST call in milliseconds.
     */
    private int requestTimeoutMs = 30000;
    
    /**
     * Whether to verify the management port certificate. splunkd ships a self-signed one.
     */
    private boolean verifyTls = false;
    
    public Duration getRequestTimeout() {
        return Duration.ofMillis(requestTimeoutMs);
    }
    
    public Duration getConnectTimeout() {
        return Duration.ofMillis(connectTimeoutMs);
    }
}

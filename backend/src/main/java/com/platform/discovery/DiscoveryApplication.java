package com.platform.discovery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Splunk Discovery Application
 * 
 * Polls Splunk Enterprise and Universal Forwarder instances over the splunkd
 * management REST API and builds a layered topology of the deployment:
 * - Per-instance health, configuration and clustering reports
 * - Sequential discovery runs over a CSV seed list
 * - Role inference and layered topology export (JSON, DOT, CSV)
 */
@SpringBootApplication
public class DiscoveryApplication {

    public static void main(String[] args) {
        SpringApplication.run(DiscoveryApplication.class, args);
    }
}

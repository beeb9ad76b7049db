package com.platform.discovery.model;

import java.time.Instant;

/**
 * Bulletin message shown in Splunk Web, from /services/messages.
 */
public record InstanceMessage(String title, String severity, String description, Instant createdAt) {

    public boolean isInformational() {
        return severity == null || "info".equalsIgnoreCase(severity);
    }
}

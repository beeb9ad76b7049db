package com.platform.discovery.model;

/**
 * Splunk Web settings from /services/server/settings. Fields are null when not reported.
 */
public record WebSettings(Boolean enabled, Integer port, Boolean sslEnabled) {

    public static WebSettings unknown() {
        return new WebSettings(null, null, null);
    }
}

package com.platform.discovery.model;

import java.time.Instant;
import java.util.Set;

/**
 * General server facts from /services/server/info and /services/server/settings.
 */
public record ServerInfo(
    String serverName,
    String guid,
    String version,
    String productType,
    String mode,
    String os,
    Set<String> roles,
    Integer cores,
    Long physicalMemoryMb,
    Instant startupTime,
    WebSettings web
) {
    public ServerInfo {
        roles = roles == null ? Set.of() : Set.copyOf(roles);
        web = web == null ? WebSettings.unknown() : web;
    }

    public Boolean webSslEnabled() {
        return web.sslEnabled();
    }

    public boolean isUniversalForwarder() {
        return roles.contains("universal_forwarder");
    }

    /**
     * Human readable product description, e.g. "Splunk Enterprise v9.1.2".
     */
    public String describeType() {
        String v = version != null ? version : "?";
        if (isUniversalForwarder()) {
            return "Splunk Universal Forwarder v" + v;
        }
        if ("enterprise".equals(productType)) {
            return "Splunk Enterprise v" + v;
        }
        if ("dedicated forwarder".equals(mode)) {
            return "Splunk Forwarder v" + v;
        }
        return "Splunk v" + v;
    }
}

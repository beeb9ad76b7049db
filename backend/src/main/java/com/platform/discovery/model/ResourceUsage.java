package com.platform.discovery.model;

/**
 * Host-wide CPU, memory and swap usage in percent; null when not reported.
 */
public record ResourceUsage(Integer cpuUsagePct, Integer memUsagePct, Integer swapUsagePct) {
}

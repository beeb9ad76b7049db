package com.platform.discovery.client;

import com.platform.discovery.model.InstanceKey;

import java.net.URI;
import java.time.Duration;

/**
 * Authenticated session with one splunkd instance, returned by {@link InstanceClient#connect}.
 */
public record InstanceHandle(
    InstanceKey key,
    URI baseUri,
    String authorization,
    Duration timeout
) {
    @Override
    public String toString() {
        return "InstanceHandle[" + baseUri + "]";
    }
}

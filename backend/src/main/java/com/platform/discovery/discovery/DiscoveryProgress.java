package com.platform.discovery.discovery;

import com.platform.discovery.model.InstanceKey;
import com.platform.discovery.model.PollOutcome;

import java.time.Instant;

/**
 * Emitted once per polled instance.
 *
 * @param index      1-based position of the instance among the distinct seeds
 * @param discovered placeholders known so far
 */
public record DiscoveryProgress(
    int index,
    int total,
    InstanceKey instance,
    PollOutcome outcome,
    String message,
    int discovered,
    Instant timestamp
) {
}

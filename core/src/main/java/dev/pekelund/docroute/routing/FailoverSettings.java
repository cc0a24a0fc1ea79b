package dev.pekelund.docroute.routing;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings of the AI failover router.
 *
 * @param enabled              when {@code false} no group is routed and no batch is produced
 * @param useVisionIfAvailable send positioned words along with the text to clients that accept them
 * @param maxConcurrentGroups  upper bound of AI calls in flight at once
 * @param groupTimeout         how long to wait for one group's AI response
 */
public record FailoverSettings(
    boolean enabled,
    boolean useVisionIfAvailable,
    int maxConcurrentGroups,
    Duration groupTimeout
) {

    public static final Duration DEFAULT_GROUP_TIMEOUT = Duration.ofSeconds(60);

    public FailoverSettings {
        Objects.requireNonNull(groupTimeout, "groupTimeout");
        if (maxConcurrentGroups < 1) {
            throw new IllegalArgumentException("maxConcurrentGroups must be at least 1");
        }
        if (groupTimeout.isNegative() || groupTimeout.isZero()) {
            throw new IllegalArgumentException("groupTimeout must be positive");
        }
    }

    public static FailoverSettings defaults() {
        return new FailoverSettings(true, true, 3, DEFAULT_GROUP_TIMEOUT);
    }
}

package com.streamfleet.controlplane.balancer;

/**
 * Client priority; scales the client's rate-limit bucket.
 */
public enum ClientPriority {
    CRITICAL(5.0),
    HIGH(2.0),
    MEDIUM(1.0),
    LOW(0.5);

    private final double rateLimitMultiplier;

    ClientPriority(double rateLimitMultiplier) {
        this.rateLimitMultiplier = rateLimitMultiplier;
    }

    public double getRateLimitMultiplier() {
        return rateLimitMultiplier;
    }

    /**
     * Bucket capacity for this priority: {@code floor(requestsPerMinute × multiplier)}.
     */
    public int tokenCapacity(int requestsPerMinute) {
        return (int) Math.floor(requestsPerMinute * rateLimitMultiplier);
    }
}

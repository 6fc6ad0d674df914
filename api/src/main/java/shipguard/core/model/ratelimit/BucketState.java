package shipguard.core.model.ratelimit;

/**
 * Fixed-window token bucket state for one (policy, key) pair.
 *
 * @param remainingPoints points left in the current window, never negative
 * @param windowStartMillis start of the current window (epoch millis)
 * @param blockedUntilMillis end of the current block (epoch millis), 0 when not blocked
 * @param lastSeenMillis last consumption attempt (epoch millis), used for eviction
 */
public record BucketState(long remainingPoints, long windowStartMillis, long blockedUntilMillis, long lastSeenMillis) {

    public BucketState {
        if (remainingPoints < 0) {
            throw new IllegalArgumentException("remainingPoints must be non-negative");
        }
    }

    public static BucketState initial(long points, long nowMillis) {
        return new BucketState(points, nowMillis, 0, nowMillis);
    }

    public boolean isBlockedAt(long nowMillis) {
        return blockedUntilMillis > 0 && nowMillis < blockedUntilMillis;
    }

    public BucketState consume(long nowMillis) {
        return new BucketState(remainingPoints - 1, windowStartMillis, 0, nowMillis);
    }

    public BucketState blockUntil(long untilMillis, long nowMillis) {
        return new BucketState(0, windowStartMillis, untilMillis, nowMillis);
    }

    public BucketState touch(long nowMillis) {
        return new BucketState(remainingPoints, windowStartMillis, blockedUntilMillis, nowMillis);
    }
}

package com.asvarishch.wheel.service;

import com.asvarishch.wheel.exception.WheelErrorCode;
import com.asvarishch.wheel.exception.WheelException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Claim timing for a drawn prize. All values are epoch/duration millis.
 * <pre>
 *   claimable:   spinTime + delay  <=  now  <  spinTime + delay + window
 *   reclaimable: lastSpinTime + delay + window  <=  now
 * </pre>
 * Delay and window are each capped at {@link #MAX_DURATION_MS} when configured, so the
 * sums above stay far from {@code Long.MAX_VALUE} for any clock reading.
 */
@Component
public class ClaimWindowPolicy {

    public static final long DEFAULT_CLAIM_WINDOW_MS = 86_400_000L;
    public static final long MIN_CLAIM_WINDOW_MS = 3_600_000L;
    /** 3650 days. */
    public static final long MAX_DURATION_MS = 315_360_000_000L;

    private final long defaultWindowMs;
    private final long minWindowMs;

    public ClaimWindowPolicy(@Value("${wheel.claim-window.default-ms:86400000}") long defaultWindowMs,
                             @Value("${wheel.claim-window.min-ms:3600000}") long minWindowMs) {
        if (minWindowMs <= 0 || defaultWindowMs < minWindowMs || defaultWindowMs > MAX_DURATION_MS) {
            throw new IllegalArgumentException("Claim window config invalid: default=" + defaultWindowMs + ", min=" + minWindowMs);
        }
        this.defaultWindowMs = defaultWindowMs;
        this.minWindowMs = minWindowMs;
    }

    /**
     * 0 means "use the default"; anything else below the floor is raised to the floor.
     */
    public long normalize(long requestedMs) {
        if (requestedMs < 0 || requestedMs > MAX_DURATION_MS) {
            throw new WheelException(WheelErrorCode.INVALID_CLAIM_WINDOW, requestedMs);
        }
        if (requestedMs == 0) {
            return defaultWindowMs;
        }
        return Math.max(requestedMs, minWindowMs);
    }

    public void validateDelay(long delayMs) {
        if (delayMs < 0 || delayMs > MAX_DURATION_MS) {
            throw new WheelException(WheelErrorCode.INVALID_DELAY, delayMs);
        }
    }

    public boolean canClaim(long now, long spinTime, long delayMs, long windowMs) {
        long opensAt = spinTime + delayMs;
        return now >= opensAt && now < opensAt + windowMs;
    }

    public boolean isWindowPassed(long now, long spinTime, long delayMs, long windowMs) {
        return now >= spinTime + delayMs + windowMs;
    }

    public void requireClaimable(long now, long spinTime, long delayMs, long windowMs) {
        if (canClaim(now, spinTime, delayMs, windowMs)) {
            return;
        }
        long opensAt = spinTime + delayMs;
        if (now < opensAt) {
            throw new WheelException(WheelErrorCode.CLAIM_TOO_EARLY, "now=" + now + ", opensAt=" + opensAt);
        }
        throw new WheelException(WheelErrorCode.CLAIM_WINDOW_PASSED, "now=" + now + ", closedAt=" + (opensAt + windowMs));
    }

    public boolean canReclaim(long now, long lastSpinTime, long delayMs, long windowMs) {
        return isWindowPassed(now, lastSpinTime, delayMs, windowMs);
    }

    public void requireReclaimable(long now, long lastSpinTime, long delayMs, long windowMs) {
        if (!canReclaim(now, lastSpinTime, delayMs, windowMs)) {
            throw new WheelException(WheelErrorCode.RECLAIM_TOO_EARLY,
                    "now=" + now + ", reclaimableAt=" + (lastSpinTime + delayMs + windowMs));
        }
    }
}

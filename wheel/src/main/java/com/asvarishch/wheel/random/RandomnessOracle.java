package com.asvarishch.wheel.random;

/**
 * Source of unbiased random integers. Asked at most once per draw.
 */
public interface RandomnessOracle {

    /**
     * @param bound exclusive upper bound, positive
     * @return uniformly distributed value in {@code [0, bound)}
     */
    int nextIndex(int bound);
}

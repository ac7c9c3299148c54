package com.asvarishch.wheel.strategy;

import java.util.List;

/**
 * Result of one spin.
 *
 * @param winner           address that won
 * @param removedPositions positions dropped from the entries, as they were numbered before the spin
 * @param oracleConsumed   whether the randomness oracle was asked
 */
public record SpinOutcome(
        String winner,
        List<Integer> removedPositions,
        boolean oracleConsumed
) {
}

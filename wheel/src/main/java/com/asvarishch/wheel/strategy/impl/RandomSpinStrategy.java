package com.asvarishch.wheel.strategy.impl;

import com.asvarishch.wheel.enums.SpinMode;
import com.asvarishch.wheel.exception.WheelErrorCode;
import com.asvarishch.wheel.exception.WheelException;
import com.asvarishch.wheel.model.EntryPool;
import com.asvarishch.wheel.random.RandomnessOracle;
import com.asvarishch.wheel.strategy.SpinOutcome;
import com.asvarishch.wheel.strategy.SpinStrategy;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * RANDOM spin:
 *   - one oracle index in [0, size) picks the winner;
 *   - every occurrence of the winner leaves the pool, so an address wins at most once.
 * A single remaining entry is assigned without asking the oracle.
 */
@Component
@RequiredArgsConstructor
public class RandomSpinStrategy implements SpinStrategy {

    private final RandomnessOracle oracle;

    @Override
    public SpinMode getType() {
        return SpinMode.RANDOM;
    }

    @Override
    public SpinOutcome spin(EntryPool pool, List<Integer> order) {
        if (pool.isEmpty()) {
            throw new WheelException(WheelErrorCode.NO_ENTRIES, 0);
        }

        if (pool.size() == 1) {
            String only = pool.get(0);
            return new SpinOutcome(only, pool.removeByValue(only), false);
        }

        int index = oracle.nextIndex(pool.size());
        String winner = pool.get(index);
        return new SpinOutcome(winner, pool.removeByValue(winner), true);
    }
}

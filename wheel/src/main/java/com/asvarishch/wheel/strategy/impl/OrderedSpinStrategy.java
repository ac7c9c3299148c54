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
 * ORDERED spin:
 *   - the caller supplies {@code order}, one position per remaining entry;
 *   - one oracle index r in [0, size) is drawn and {@code order[r]} is the winning position;
 *   - only that position is removed. Duplicates of the winner elsewhere can still win later.
 *
 * Unlike RANDOM, the oracle is asked even when a single entry remains.
 */
@Component
@RequiredArgsConstructor
public class OrderedSpinStrategy implements SpinStrategy {

    private final RandomnessOracle oracle;

    @Override
    public SpinMode getType() {
        return SpinMode.ORDERED;
    }

    @Override
    public SpinOutcome spin(EntryPool pool, List<Integer> order) {
        if (pool.isEmpty()) {
            throw new WheelException(WheelErrorCode.NO_ENTRIES, 0);
        }
        validateOrder(order, pool.size());

        int drawn = oracle.nextIndex(pool.size());
        int position = order.get(drawn);
        String winner = pool.removeByPosition(position);
        return new SpinOutcome(winner, List.of(position), true);
    }

    private static void validateOrder(List<Integer> order, int size) {
        if (order == null || order.size() != size) {
            throw new WheelException(WheelErrorCode.INVALID_ORDER_LENGTH,
                    "order=" + (order == null ? null : order.size()) + ", entries=" + size);
        }
        for (Integer position : order) {
            if (position == null || position < 0 || position >= size) {
                throw new WheelException(WheelErrorCode.INVALID_ORDER_INDEX, position);
            }
        }
    }
}

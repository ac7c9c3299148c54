package com.asvarishch.wheel.strategy;

import com.asvarishch.wheel.enums.SpinMode;
import com.asvarishch.wheel.model.EntryPool;

import java.util.List;

public interface SpinStrategy {

    SpinMode getType();

    /**
     * Picks a winner from {@code pool} and removes it according to the mode's removal rule.
     *
     * @param order caller-supplied draw order; only meaningful for {@link SpinMode#ORDERED}
     */
    SpinOutcome spin(EntryPool pool, List<Integer> order);
}

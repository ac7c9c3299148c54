package com.asvarishch.wheel.strategy;

import com.asvarishch.wheel.enums.SpinMode;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Picks the spin strategy bean for a draw mode. Exactly one bean per mode.
 */
@Component
public class SpinStrategyResolver {

    private final Map<SpinMode, SpinStrategy> strategyByMode;

    public SpinStrategyResolver(List<SpinStrategy> strategies) {
        this.strategyByMode = index(strategies);
    }

    public SpinStrategy resolve(SpinMode mode) {
        Objects.requireNonNull(mode, "mode must not be null");
        SpinStrategy strategy = strategyByMode.get(mode);
        if (strategy == null) {
            throw new IllegalArgumentException("No SpinStrategy bean for mode=" + mode);
        }
        return strategy;
    }

    private static Map<SpinMode, SpinStrategy> index(List<SpinStrategy> beans) {
        EnumMap<SpinMode, SpinStrategy> map = new EnumMap<>(SpinMode.class);
        for (SpinStrategy s : beans) {
            SpinMode k = Objects.requireNonNull(s.getType(), s.getClass().getName() + " returned null getType()");
            if (map.putIfAbsent(k, s) != null) {
                throw new IllegalStateException("Duplicate SpinStrategy for mode=" + k);
            }
        }
        return map;
    }
}

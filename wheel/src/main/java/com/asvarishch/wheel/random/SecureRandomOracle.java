package com.asvarishch.wheel.random;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;

@Component
public class SecureRandomOracle implements RandomnessOracle {

    private final SecureRandom random = new SecureRandom();

    @Override
    public int nextIndex(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive: " + bound);
        }
        return random.nextInt(bound);
    }
}

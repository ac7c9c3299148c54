package com.asvarishch.wheel.dto;

import lombok.Builder;

import java.math.BigDecimal;
import java.util.List;

/**
 * @param claimWindowMs 0 selects the default window
 */
@Builder
public record CreateWheelRequestDTO(
        List<String> entries,
        List<BigDecimal> prizeAmounts,
        long delayMs,
        long claimWindowMs,
        String currency
) {}

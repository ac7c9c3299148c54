package com.asvarishch.wheel.dto;

import lombok.Builder;

import java.math.BigDecimal;

@Builder
public record PayoutResponseDTO(
        Long wheelId,
        String recipient,
        BigDecimal amount,
        String currency,
        String message
) {}

package com.asvarishch.wheel.dto;

import lombok.Builder;

import java.math.BigDecimal;

@Builder
public record WinnerViewDTO(
        String address,
        int prizeIndex,
        BigDecimal amount,
        long spinTime,
        boolean claimed
) {}

package com.asvarishch.wheel.dto;

import java.math.BigDecimal;

public record DonationRequestDTO(BigDecimal amount) {}

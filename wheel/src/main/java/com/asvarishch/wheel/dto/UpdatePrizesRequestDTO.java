package com.asvarishch.wheel.dto;

import java.math.BigDecimal;
import java.util.List;

public record UpdatePrizesRequestDTO(List<BigDecimal> prizeAmounts) {}

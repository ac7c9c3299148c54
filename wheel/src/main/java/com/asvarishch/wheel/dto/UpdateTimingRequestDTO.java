package com.asvarishch.wheel.dto;

/** Body of the delay and claim-window updates. */
public record UpdateTimingRequestDTO(long valueMs) {}

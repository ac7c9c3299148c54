package com.asvarishch.wheel.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.Map;

@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponseDTO(
        String message,
        String errorCode,
        String kind,
        Map<String, Object> details
) {}

package com.asvarishch.wheel.dto;

import java.util.List;

public record UpdateEntriesRequestDTO(List<String> entries) {}

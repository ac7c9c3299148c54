package com.asvarishch.wheel.dto;

import java.util.List;

/**
 * @param order      absent for a plain random draw; present for an ordered draw
 * @param autoAssign also hand out the last prize when only one address is left
 */
public record DrawRequestDTO(
        List<Integer> order,
        boolean autoAssign
) {}

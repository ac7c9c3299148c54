package com.asvarishch.wheel.dto;

import com.asvarishch.wheel.enums.SpinMode;
import lombok.Builder;

import java.util.List;

/**
 * @param winners one entry per prize assigned by the call (two when auto-assign kicked in)
 */
@Builder
public record DrawResultDTO(
        Long wheelId,
        SpinMode mode,
        List<WinnerViewDTO> winners,
        int spunCount,
        int remainingEntries
) {

    public String winner() {
        return winners.isEmpty() ? null : winners.get(0).address();
    }
}

package com.asvarishch.wheel.dto;

import com.asvarishch.wheel.enums.WheelPhase;
import com.asvarishch.wheel.model.Wheel;
import com.asvarishch.wheel.model.WheelWinner;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Builder
public record WheelViewDTO(
        Long wheelId,
        String organizer,
        String currency,
        WheelPhase phase,
        List<String> remainingEntries,
        List<BigDecimal> prizeAmounts,
        List<WinnerViewDTO> winners,
        List<Long> spinTimes,
        int spunCount,
        long delayMs,
        long claimWindowMs,
        BigDecimal pool,
        boolean cancelled,
        Instant createdAt,
        Instant updatedAt
) {

    public static WheelViewDTO from(Wheel wheel) {
        List<WinnerViewDTO> winners = new ArrayList<>();
        for (int i = 0; i < wheel.getWinners().size(); i++) {
            winners.add(winnerView(wheel, i));
        }
        return WheelViewDTO.builder()
                .wheelId(wheel.getWheelId())
                .organizer(wheel.getOrganizer())
                .currency(wheel.getCurrency())
                .phase(wheel.getPhase())
                .remainingEntries(List.copyOf(wheel.getRemainingEntries()))
                .prizeAmounts(List.copyOf(wheel.getPrizeAmounts()))
                .winners(winners)
                .spinTimes(List.copyOf(wheel.getSpinTimes()))
                .spunCount(wheel.getSpunCount())
                .delayMs(wheel.getDelayMs())
                .claimWindowMs(wheel.getClaimWindowMs())
                .pool(wheel.getPool())
                .cancelled(wheel.isCancelled())
                .createdAt(wheel.getCreatedAt())
                .updatedAt(wheel.getUpdatedAt())
                .build();
    }

    public static WinnerViewDTO winnerView(Wheel wheel, int winnerIndex) {
        WheelWinner w = wheel.getWinners().get(winnerIndex);
        return WinnerViewDTO.builder()
                .address(w.getAddress())
                .prizeIndex(w.getPrizeIndex())
                .amount(wheel.getPrizeAmounts().get(w.getPrizeIndex()))
                .spinTime(wheel.getSpinTimes().get(winnerIndex))
                .claimed(w.isClaimed())
                .build();
    }
}

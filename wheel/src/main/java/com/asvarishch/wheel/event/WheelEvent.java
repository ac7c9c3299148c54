package com.asvarishch.wheel.event;

import com.asvarishch.wheel.enums.WheelEventType;
import lombok.Builder;

import java.math.BigDecimal;

/**
 * Informational record of a committed wheel operation.
 * <ul>
 *   <li>CREATED - address = organizer</li>
 *   <li>DRAWN - address = winner, prizeIndex set</li>
 *   <li>CLAIMED - address = winner, prizeIndex and amount set</li>
 *   <li>RECLAIMED - address = organizer, amount set</li>
 * </ul>
 */
@Builder
public record WheelEvent(
        WheelEventType type,
        Long wheelId,
        String address,
        Integer prizeIndex,
        BigDecimal amount,
        String currency,
        long occurredAt
) {

    public static WheelEvent created(Long wheelId, String organizer, long occurredAt) {
        return WheelEvent.builder()
                .type(WheelEventType.CREATED)
                .wheelId(wheelId)
                .address(organizer)
                .occurredAt(occurredAt)
                .build();
    }

    public static WheelEvent drawn(Long wheelId, String winner, int prizeIndex, long occurredAt) {
        return WheelEvent.builder()
                .type(WheelEventType.DRAWN)
                .wheelId(wheelId)
                .address(winner)
                .prizeIndex(prizeIndex)
                .occurredAt(occurredAt)
                .build();
    }

    public static WheelEvent claimed(Long wheelId, String winner, int prizeIndex,
                                     BigDecimal amount, String currency, long occurredAt) {
        return WheelEvent.builder()
                .type(WheelEventType.CLAIMED)
                .wheelId(wheelId)
                .address(winner)
                .prizeIndex(prizeIndex)
                .amount(amount)
                .currency(currency)
                .occurredAt(occurredAt)
                .build();
    }

    public static WheelEvent reclaimed(Long wheelId, String organizer, BigDecimal amount,
                                       String currency, long occurredAt) {
        return WheelEvent.builder()
                .type(WheelEventType.RECLAIMED)
                .wheelId(wheelId)
                .address(organizer)
                .amount(amount)
                .currency(currency)
                .occurredAt(occurredAt)
                .build();
    }
}

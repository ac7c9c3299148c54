package com.asvarishch.wheel.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

/**
 * One completed draw. {@code prizeIndex} points into {@link Wheel#getPrizeAmounts()}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@EqualsAndHashCode
@Embeddable
public class WheelWinner {

    @Column(name = "address", length = 128, nullable = false)
    private String address;

    @Column(name = "prize_index", nullable = false)
    private int prizeIndex;

    @Column(name = "claimed", nullable = false)
    private boolean claimed;
}

package com.asvarishch.wheel.model;

import com.asvarishch.wheel.enums.WheelPhase;
import com.asvarishch.wheel.model.base.AuditableEntity;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * A prize wheel. Mutated only through {@code WheelService}; callers against the same
 * wheel are serialized by the store ({@link #version} rejects a concurrent commit).
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = {"remainingEntries", "winners", "spinTimes"})
@EqualsAndHashCode(of = "wheelId", callSuper = false)
@Entity
@Table(
        name = "wheels",
        indexes = {
                @Index(name = "ix_wheel_organizer", columnList = "organizer")
        }
)
public class Wheel extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "wheel_id")
    private Long wheelId;

    @Column(name = "organizer", length = 128, nullable = false, updatable = false)
    private String organizer;

    /** Currency the pool and every prize are denominated in. */
    @Column(name = "currency", length = 32, nullable = false, updatable = false)
    private String currency;

    @ElementCollection
    @CollectionTable(name = "wheel_entries", joinColumns = @JoinColumn(name = "wheel_id"))
    @OrderColumn(name = "entry_position")
    @Column(name = "address", length = 128, nullable = false)
    @Builder.Default
    private List<String> remainingEntries = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "wheel_prizes", joinColumns = @JoinColumn(name = "wheel_id"))
    @OrderColumn(name = "prize_index")
    @Column(name = "amount", precision = 19, scale = 2, nullable = false)
    @Builder.Default
    private List<BigDecimal> prizeAmounts = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "wheel_winners", joinColumns = @JoinColumn(name = "wheel_id"))
    @OrderColumn(name = "winner_index")
    @Builder.Default
    private List<WheelWinner> winners = new ArrayList<>();

    /** Parallel to {@link #winners}: epoch millis of each draw. */
    @ElementCollection
    @CollectionTable(name = "wheel_spin_times", joinColumns = @JoinColumn(name = "wheel_id"))
    @OrderColumn(name = "spin_index")
    @Column(name = "spin_time_ms", nullable = false)
    @Builder.Default
    private List<Long> spinTimes = new ArrayList<>();

    @Column(name = "spun_count", nullable = false)
    private int spunCount;

    @Column(name = "delay_ms", nullable = false)
    private long delayMs;

    @Column(name = "claim_window_ms", nullable = false)
    private long claimWindowMs;

    @Column(name = "pool", precision = 19, scale = 2, nullable = false)
    @Builder.Default
    private BigDecimal pool = BigDecimal.ZERO;

    @Column(name = "is_cancelled", nullable = false)
    private boolean cancelled;

    /** Package version that created the wheel; checked before every operation. */
    @Column(name = "package_version", nullable = false)
    private int packageVersion;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    public WheelPhase getPhase() {
        if (cancelled) {
            return WheelPhase.CANCELLED;
        }
        if (spunCount == 0) {
            return WheelPhase.CREATED;
        }
        return spunCount < prizeAmounts.size() ? WheelPhase.ACTIVE : WheelPhase.EXHAUSTED;
    }

    public int getRemainingDraws() {
        return prizeAmounts.size() - spunCount;
    }

    public boolean isOrganizer(String address) {
        return organizer != null && organizer.equals(address);
    }

    /**
     * Appends the winner of the next prize and stamps the draw time.
     *
     * @return index of the prize just assigned
     */
    public int recordSpin(String winnerAddress, long spinTimeMs) {
        final int prizeIndex = spunCount;
        winners.add(WheelWinner.builder()
                .address(winnerAddress)
                .prizeIndex(prizeIndex)
                .claimed(false)
                .build());
        spinTimes.add(spinTimeMs);
        spunCount = spunCount + 1;
        return prizeIndex;
    }

    public long getLastSpinTime() {
        return spinTimes.stream().mapToLong(Long::longValue).max().orElse(0L);
    }
}

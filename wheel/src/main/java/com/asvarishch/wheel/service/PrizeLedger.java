package com.asvarishch.wheel.service;

import com.asvarishch.wheel.exception.WheelErrorCode;
import com.asvarishch.wheel.exception.WheelException;
import com.asvarishch.wheel.model.EntryPool;
import com.asvarishch.wheel.model.Wheel;
import com.asvarishch.wheel.model.WheelWinner;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

import static java.math.BigDecimal.ZERO;

/**
 * Prize amounts and the custody pool of one wheel.
 * <p>
 * Conservation: a claim takes exactly its prize amount out of the pool, a reclaim
 * takes everything that is left. Nothing else decreases the pool.
 */
@Component
public class PrizeLedger {

    /** Matches the {@code (19,2)} money columns on {@link Wheel}. */
    public static final int MONEY_SCALE = 2;

    /**
     * @return the amounts at {@link #MONEY_SCALE}, ready to store
     */
    public List<BigDecimal> validatePrizes(List<BigDecimal> prizeAmounts, int uniqueEntries) {
        if (prizeAmounts == null || prizeAmounts.isEmpty() || prizeAmounts.size() > uniqueEntries) {
            throw new WheelException(WheelErrorCode.INVALID_PRIZE_COUNT,
                    "prizes=" + (prizeAmounts == null ? null : prizeAmounts.size()) + ", uniqueEntries=" + uniqueEntries);
        }
        final List<BigDecimal> scaled = new ArrayList<>(prizeAmounts.size());
        for (int i = 0; i < prizeAmounts.size(); i++) {
            BigDecimal amount = prizeAmounts.get(i);
            if (!isMoney(amount)) {
                throw new WheelException(WheelErrorCode.INVALID_PRIZE_AMOUNT, "prize[" + i + "]=" + amount);
            }
            scaled.add(amount.setScale(MONEY_SCALE, RoundingMode.UNNECESSARY));
        }
        return scaled;
    }

    /** Positive and representable in the pool column without rounding. */
    private static boolean isMoney(BigDecimal amount) {
        return amount != null
                && amount.signum() > 0
                && amount.stripTrailingZeros().scale() <= MONEY_SCALE;
    }

    public BigDecimal total(List<BigDecimal> prizeAmounts) {
        return prizeAmounts.stream().reduce(ZERO, BigDecimal::add);
    }

    /**
     * The pool must cover the sum of all prizes, claimed or not. Checked at draw time only,
     * so a donation made after a claim cures the shortfall.
     */
    public void requireSufficientFunds(Wheel wheel) {
        BigDecimal required = total(wheel.getPrizeAmounts());
        if (required.compareTo(wheel.getPool()) > 0) {
            throw new WheelException(WheelErrorCode.INSUFFICIENT_FUNDS,
                    "required=" + required + ", pool=" + wheel.getPool());
        }
    }

    /** No sufficiency check: the organizer may fund before prizes are final. */
    public BigDecimal donate(Wheel wheel, BigDecimal amount) {
        if (!isMoney(amount)) {
            throw new WheelException(WheelErrorCode.INVALID_AMOUNT, amount);
        }
        wheel.setPool(wheel.getPool().add(amount.setScale(MONEY_SCALE, RoundingMode.UNNECESSARY)));
        return wheel.getPool();
    }

    /**
     * Replaces the prize list and clears winners and spin times, whose indices would go stale.
     * Validates and checks funds before touching the wheel.
     */
    public void replacePrizes(Wheel wheel, List<BigDecimal> newAmounts) {
        final List<BigDecimal> scaled = validatePrizes(newAmounts, EntryPool.of(wheel).distinctCount());
        BigDecimal required = total(scaled);
        if (required.compareTo(wheel.getPool()) > 0) {
            throw new WheelException(WheelErrorCode.INSUFFICIENT_FUNDS,
                    "required=" + required + ", pool=" + wheel.getPool());
        }
        wheel.getPrizeAmounts().clear();
        wheel.getPrizeAmounts().addAll(scaled);
        wheel.getWinners().clear();
        wheel.getSpinTimes().clear();
    }

    /**
     * Pays out {@code winners[winnerIndex]}: marks it claimed and takes its prize out of the pool.
     *
     * @return amount paid
     */
    public BigDecimal settleClaim(Wheel wheel, int winnerIndex) {
        WheelWinner winner = wheel.getWinners().get(winnerIndex);
        if (winner.isClaimed()) {
            throw new WheelException(WheelErrorCode.ALREADY_CLAIMED, "prizeIndex=" + winner.getPrizeIndex());
        }
        BigDecimal amount = wheel.getPrizeAmounts().get(winner.getPrizeIndex());
        if (amount.compareTo(wheel.getPool()) > 0) {
            throw new WheelException(WheelErrorCode.INSUFFICIENT_FUNDS,
                    "prize=" + amount + ", pool=" + wheel.getPool());
        }
        winner.setClaimed(true);
        wheel.setPool(wheel.getPool().subtract(amount));
        return amount;
    }

    /**
     * Empties the pool.
     *
     * @return amount that was in the pool, ZERO if it was already empty
     */
    public BigDecimal drain(Wheel wheel) {
        BigDecimal amount = wheel.getPool();
        wheel.setPool(ZERO);
        return amount;
    }
}

package com.asvarishch.wheel.service;

import com.asvarishch.wheel.dto.CreateWheelRequestDTO;
import com.asvarishch.wheel.dto.DrawResultDTO;
import com.asvarishch.wheel.dto.PayoutResponseDTO;
import com.asvarishch.wheel.dto.WheelViewDTO;
import com.asvarishch.wheel.dto.WinnerViewDTO;
import com.asvarishch.wheel.enums.SpinMode;
import com.asvarishch.wheel.event.WheelEvent;
import com.asvarishch.wheel.exception.WheelErrorCode;
import com.asvarishch.wheel.exception.WheelException;
import com.asvarishch.wheel.model.EntryPool;
import com.asvarishch.wheel.model.Wheel;
import com.asvarishch.wheel.model.WheelWinner;
import com.asvarishch.wheel.repository.WheelRepository;
import com.asvarishch.wheel.strategy.SpinOutcome;
import com.asvarishch.wheel.strategy.SpinStrategyResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lifecycle of a prize wheel.
 * <p>
 * Phases: CREATED (no draw yet) -> ACTIVE -> EXHAUSTED (every prize drawn).
 * CANCELLED is reachable from CREATED only and is terminal.
 * <ol>
 *   <li>Every call loads the wheel, checks the package version, then authorization and phase.</li>
 *   <li>All guards run before the first mutation; a failure throws {@link WheelException} and
 *       the transaction rolls back, so no call is ever partially applied.</li>
 *   <li>The clock is read at most once per call; a draw asks the oracle at most once per spin.</li>
 *   <li>Notifications are published as application events and leave the service only after commit.</li>
 * </ol>
 * The service takes no locks of its own. Calls against one wheel are serialized by the store
 * (optimistic {@code @Version} on {@link Wheel}).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WheelService {

    private final WheelRepository wheelRepository;
    private final SpinStrategyResolver spinStrategyResolver;
    private final PrizeLedger prizeLedger;
    private final ClaimWindowPolicy claimWindowPolicy;
    private final VersionGate versionGate;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    // ------------------------------------------------------------------
    // Configuration
    // ------------------------------------------------------------------

    /**
     * Creates a wheel owned by {@code organizer} with an empty pool.
     *
     * @throws WheelException VALIDATION when entries, prizes, delay, window or currency are invalid
     */
    @Transactional
    public WheelViewDTO create(String organizer, CreateWheelRequestDTO request) {
        // --- 1) Validate input ---
        requireAddress(organizer);
        if (request.currency() == null || request.currency().isBlank()) {
            throw new WheelException(WheelErrorCode.INVALID_CURRENCY, request.currency());
        }
        claimWindowPolicy.validateDelay(request.delayMs());
        final List<BigDecimal> requestedPrizes = request.prizeAmounts();
        EntryPool.validate(request.entries(), requestedPrizes == null ? 0 : requestedPrizes.size());
        final List<BigDecimal> prizes = prizeLedger.validatePrizes(requestedPrizes, EntryPool.distinctCount(request.entries()));
        final long claimWindowMs = claimWindowPolicy.normalize(request.claimWindowMs());

        // --- 2) Build and persist ---
        final Wheel wheel = Wheel.builder()
                .organizer(organizer)
                .currency(request.currency())
                .remainingEntries(new ArrayList<>(request.entries()))
                .prizeAmounts(new ArrayList<>(prizes))
                .winners(new ArrayList<>())
                .spinTimes(new ArrayList<>())
                .spunCount(0)
                .delayMs(request.delayMs())
                .claimWindowMs(claimWindowMs)
                .pool(BigDecimal.ZERO)
                .cancelled(false)
                .packageVersion(versionGate.currentVersion())
                .build();
        final Wheel saved = wheelRepository.save(wheel);

        // --- 3) Notify ---
        eventPublisher.publishEvent(WheelEvent.created(saved.getWheelId(), organizer, clock.millis()));
        log.info("[CREATE] Wheel {} created by {}: entries={}, prizes={}, delayMs={}, claimWindowMs={}, currency={}",
                saved.getWheelId(), organizer, saved.getRemainingEntries().size(), saved.getPrizeAmounts(),
                saved.getDelayMs(), saved.getClaimWindowMs(), saved.getCurrency());
        return WheelViewDTO.from(saved);
    }

    /**
     * Adds funds to the pool. Allowed in every phase except CANCELLED, and deliberately
     * without a sufficiency check.
     */
    @Transactional
    public WheelViewDTO donate(Long wheelId, String caller, BigDecimal amount) {
        final Wheel wheel = loadWheel(wheelId);
        requireOrganizer(wheel, caller);
        requireNotCancelled(wheel);

        final BigDecimal poolBefore = wheel.getPool();
        prizeLedger.donate(wheel, amount);
        wheelRepository.save(wheel);

        log.info("[DONATE] Wheel {}: +{} {}, pool {} -> {}",
                wheelId, amount, wheel.getCurrency(), poolBefore, wheel.getPool());
        return WheelViewDTO.from(wheel);
    }

    @Transactional
    public WheelViewDTO updateEntries(Long wheelId, String caller, List<String> entries) {
        final Wheel wheel = loadConfigurableWheel(wheelId, caller);

        EntryPool.of(wheel).replace(entries, wheel.getPrizeAmounts().size());
        wheelRepository.save(wheel);

        log.info("[UPDATE] Wheel {}: entries replaced, count={}", wheelId, wheel.getRemainingEntries().size());
        return WheelViewDTO.from(wheel);
    }

    /**
     * Replaces the prize list and resets winners and spin times.
     *
     * @throws WheelException FUNDS when the current pool does not cover the new total
     */
    @Transactional
    public WheelViewDTO updatePrizes(Long wheelId, String caller, List<BigDecimal> prizeAmounts) {
        final Wheel wheel = loadConfigurableWheel(wheelId, caller);

        prizeLedger.replacePrizes(wheel, prizeAmounts);
        wheelRepository.save(wheel);

        log.info("[UPDATE] Wheel {}: prizes replaced {}", wheelId, wheel.getPrizeAmounts());
        return WheelViewDTO.from(wheel);
    }

    @Transactional
    public WheelViewDTO updateDelay(Long wheelId, String caller, long delayMs) {
        final Wheel wheel = loadConfigurableWheel(wheelId, caller);
        claimWindowPolicy.validateDelay(delayMs);

        wheel.setDelayMs(delayMs);
        wheelRepository.save(wheel);

        log.info("[UPDATE] Wheel {}: delayMs={}", wheelId, delayMs);
        return WheelViewDTO.from(wheel);
    }

    @Transactional
    public WheelViewDTO updateClaimWindow(Long wheelId, String caller, long claimWindowMs) {
        final Wheel wheel = loadConfigurableWheel(wheelId, caller);

        wheel.setClaimWindowMs(claimWindowPolicy.normalize(claimWindowMs));
        wheelRepository.save(wheel);

        log.info("[UPDATE] Wheel {}: claimWindowMs requested={}, stored={}",
                wheelId, claimWindowMs, wheel.getClaimWindowMs());
        return WheelViewDTO.from(wheel);
    }

    // ------------------------------------------------------------------
    // Draws
    // ------------------------------------------------------------------

    /** Random draw: the winner and all of its duplicates leave the entries. */
    @Transactional
    public DrawResultDTO draw(Long wheelId, String caller) {
        return drawInternal(wheelId, caller, SpinMode.RANDOM, null, false);
    }

    /** Ordered draw: only the drawn position leaves the entries. */
    @Transactional
    public DrawResultDTO drawWithOrder(Long wheelId, String caller, List<Integer> order) {
        return drawInternal(wheelId, caller, SpinMode.ORDERED, order, false);
    }

    @Transactional
    public DrawResultDTO drawAndAutoAssign(Long wheelId, String caller) {
        return drawInternal(wheelId, caller, SpinMode.RANDOM, null, true);
    }

    @Transactional
    public DrawResultDTO drawWithOrderAndAutoAssign(Long wheelId, String caller, List<Integer> order) {
        return drawInternal(wheelId, caller, SpinMode.ORDERED, order, true);
    }

    /**
     * Hands the last prize to the last remaining address without asking the oracle.
     *
     * @throws WheelException STATE unless exactly one prize and one distinct entry remain
     */
    @Transactional
    public DrawResultDTO autoAssignLast(Long wheelId, String caller) {
        final Wheel wheel = loadWheel(wheelId);
        requireOrganizer(wheel, caller);
        requireNotCancelled(wheel);
        final EntryPool pool = EntryPool.of(wheel);
        if (!canAutoAssign(wheel, pool)) {
            throw new WheelException(WheelErrorCode.AUTO_ASSIGN_UNAVAILABLE,
                    "remainingDraws=" + wheel.getRemainingDraws() + ", uniqueEntries=" + pool.distinctCount());
        }
        prizeLedger.requireSufficientFunds(wheel);

        final long now = clock.millis();
        final int prizeIndex = assignLast(wheel, pool, now);
        wheelRepository.save(wheel);

        return drawResult(wheel, null, List.of(prizeIndex));
    }

    private DrawResultDTO drawInternal(Long wheelId, String caller, SpinMode mode,
                                       List<Integer> order, boolean autoAssign) {
        // --- 1) Load and guard ---
        final Wheel wheel = loadWheel(wheelId);
        requireOrganizer(wheel, caller);
        requireNotCancelled(wheel);
        if (wheel.getRemainingDraws() <= 0) {
            throw new WheelException(WheelErrorCode.ALL_PRIZES_DRAWN, "spunCount=" + wheel.getSpunCount());
        }
        final EntryPool pool = EntryPool.of(wheel);
        if (pool.isEmpty()) {
            throw new WheelException(WheelErrorCode.NO_ENTRIES, 0);
        }
        prizeLedger.requireSufficientFunds(wheel);

        // --- 2) Spin ---
        final long now = clock.millis();
        final SpinOutcome outcome = spinStrategyResolver.resolve(mode).spin(pool, order);
        final int prizeIndex = wheel.recordSpin(outcome.winner(), now);
        eventPublisher.publishEvent(WheelEvent.drawn(wheelId, outcome.winner(), prizeIndex, now));
        log.info("[DRAW] Wheel {} ({}): winner={}, prizeIndex={}, amount={}, removedPositions={}, entriesLeft={}, oracleUsed={}",
                wheelId, mode, outcome.winner(), prizeIndex, wheel.getPrizeAmounts().get(prizeIndex),
                outcome.removedPositions(), pool.size(), outcome.oracleConsumed());

        final List<Integer> assigned = new ArrayList<>();
        assigned.add(prizeIndex);

        // --- 3) Optional auto-assign of the last prize ---
        if (autoAssign && canAutoAssign(wheel, pool)) {
            assigned.add(assignLast(wheel, pool, now));
        }

        wheelRepository.save(wheel);
        return drawResult(wheel, mode, assigned);
    }

    private static boolean canAutoAssign(Wheel wheel, EntryPool pool) {
        return wheel.getRemainingDraws() == 1 && !pool.isEmpty() && pool.distinctCount() == 1;
    }

    private int assignLast(Wheel wheel, EntryPool pool, long now) {
        final String winner = pool.popIfSingleton()
                .orElseThrow(() -> new WheelException(WheelErrorCode.AUTO_ASSIGN_UNAVAILABLE, "uniqueEntries=" + pool.distinctCount()));
        final int prizeIndex = wheel.recordSpin(winner, now);
        eventPublisher.publishEvent(WheelEvent.drawn(wheel.getWheelId(), winner, prizeIndex, now));
        log.info("[AUTO-ASSIGN] Wheel {}: last prize {} -> {}", wheel.getWheelId(), prizeIndex, winner);
        return prizeIndex;
    }

    private static DrawResultDTO drawResult(Wheel wheel, SpinMode mode, List<Integer> prizeIndices) {
        final List<WinnerViewDTO> winners = new ArrayList<>();
        for (Integer idx : prizeIndices) {
            winners.add(WheelViewDTO.winnerView(wheel, idx));
        }
        return DrawResultDTO.builder()
                .wheelId(wheel.getWheelId())
                .mode(mode)
                .winners(winners)
                .spunCount(wheel.getSpunCount())
                .remainingEntries(wheel.getRemainingEntries().size())
                .build();
    }

    // ------------------------------------------------------------------
    // Payouts
    // ------------------------------------------------------------------

    /**
     * Pays the caller's first unclaimed prize whose window has not closed.
     * <ol>
     *   <li>Caller never won -> AUTHORIZATION.</li>
     *   <li>Every win already claimed -> NOT_FOUND.</li>
     *   <li>Every unclaimed win past its window -> TIMING (window passed).</li>
     *   <li>Chosen win still inside its delay -> TIMING (too early).</li>
     * </ol>
     */
    @Transactional
    public PayoutResponseDTO claim(Long wheelId, String caller) {
        final Wheel wheel = loadWheel(wheelId);
        requireNotCancelled(wheel);
        final long now = clock.millis();

        final int winnerIndex = selectClaimableWin(wheel, caller, now);
        claimWindowPolicy.requireClaimable(now, wheel.getSpinTimes().get(winnerIndex),
                wheel.getDelayMs(), wheel.getClaimWindowMs());

        final BigDecimal poolBefore = wheel.getPool();
        final BigDecimal amount = prizeLedger.settleClaim(wheel, winnerIndex);
        final int prizeIndex = wheel.getWinners().get(winnerIndex).getPrizeIndex();
        wheelRepository.save(wheel);

        eventPublisher.publishEvent(WheelEvent.claimed(wheelId, caller, prizeIndex, amount, wheel.getCurrency(), now));
        log.info("[CLAIM] Wheel {}: {} claimed prize {} = {} {}, pool {} -> {}",
                wheelId, caller, prizeIndex, amount, wheel.getCurrency(), poolBefore, wheel.getPool());
        return PayoutResponseDTO.builder()
                .wheelId(wheelId)
                .recipient(caller)
                .amount(amount)
                .currency(wheel.getCurrency())
                .message("CLAIMED: prize " + prizeIndex + " paid out.")
                .build();
    }

    private int selectClaimableWin(Wheel wheel, String caller, long now) {
        boolean won = false;
        boolean unclaimed = false;
        final List<WheelWinner> winners = wheel.getWinners();
        for (int i = 0; i < winners.size(); i++) {
            final WheelWinner w = winners.get(i);
            if (!w.getAddress().equals(caller)) {
                continue;
            }
            won = true;
            if (w.isClaimed()) {
                continue;
            }
            unclaimed = true;
            if (!claimWindowPolicy.isWindowPassed(now, wheel.getSpinTimes().get(i),
                    wheel.getDelayMs(), wheel.getClaimWindowMs())) {
                return i;
            }
        }
        if (!won) {
            throw new WheelException(WheelErrorCode.NOT_WINNER, caller);
        }
        if (!unclaimed) {
            throw new WheelException(WheelErrorCode.NO_ENTITLEMENT, caller);
        }
        throw new WheelException(WheelErrorCode.CLAIM_WINDOW_PASSED, "caller=" + caller + ", now=" + now);
    }

    /**
     * Returns whatever is left in the pool to the organizer once every prize is drawn
     * and the last claim window has closed.
     */
    @Transactional
    public PayoutResponseDTO reclaim(Long wheelId, String caller) {
        final Wheel wheel = loadWheel(wheelId);
        requireOrganizer(wheel, caller);
        requireNotCancelled(wheel);
        if (wheel.getRemainingDraws() > 0) {
            throw new WheelException(WheelErrorCode.NOT_ALL_PRIZES_DRAWN, "remainingDraws=" + wheel.getRemainingDraws());
        }
        final long now = clock.millis();
        claimWindowPolicy.requireReclaimable(now, wheel.getLastSpinTime(), wheel.getDelayMs(), wheel.getClaimWindowMs());
        if (wheel.getPool().signum() == 0) {
            throw new WheelException(WheelErrorCode.NOTHING_TO_RECLAIM, wheel.getPool());
        }

        final BigDecimal amount = prizeLedger.drain(wheel);
        wheelRepository.save(wheel);

        eventPublisher.publishEvent(WheelEvent.reclaimed(wheelId, caller, amount, wheel.getCurrency(), now));
        log.info("[RECLAIM] Wheel {}: {} {} returned to organizer {}", wheelId, amount, wheel.getCurrency(), caller);
        return PayoutResponseDTO.builder()
                .wheelId(wheelId)
                .recipient(caller)
                .amount(amount)
                .currency(wheel.getCurrency())
                .message("RECLAIMED: remaining pool returned to organizer.")
                .build();
    }

    /**
     * Cancels a wheel that has not been drawn yet and returns its pool to the organizer.
     *
     * @return the refunded amount, empty when the pool was already empty
     */
    @Transactional
    public Optional<BigDecimal> cancelAndReclaim(Long wheelId, String caller) {
        final Wheel wheel = loadWheel(wheelId);
        requireOrganizer(wheel, caller);
        requireNotCancelled(wheel);
        requireNotSpun(wheel);

        wheel.setCancelled(true);
        final BigDecimal amount = prizeLedger.drain(wheel);
        wheelRepository.save(wheel);

        if (amount.signum() == 0) {
            log.info("[CANCEL] Wheel {} cancelled by {}; pool was empty", wheelId, caller);
            return Optional.empty();
        }
        eventPublisher.publishEvent(WheelEvent.reclaimed(wheelId, caller, amount, wheel.getCurrency(), clock.millis()));
        log.info("[CANCEL] Wheel {} cancelled by {}; {} {} returned", wheelId, caller, amount, wheel.getCurrency());
        return Optional.of(amount);
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public WheelViewDTO getWheel(Long wheelId) {
        return WheelViewDTO.from(findWheel(wheelId));
    }

    @Transactional(readOnly = true)
    public List<WheelViewDTO> listByOrganizer(String organizer) {
        return wheelRepository.findByOrganizerOrderByWheelIdAsc(organizer).stream()
                .map(WheelViewDTO::from)
                .toList();
    }

    // ------------------------------------------------------------------
    // Guards
    // ------------------------------------------------------------------

    private Wheel findWheel(Long wheelId) {
        return wheelRepository.findById(wheelId)
                .orElseThrow(() -> new WheelException(WheelErrorCode.WHEEL_NOT_FOUND, wheelId));
    }

    /** Loads the wheel and applies the version gate that precedes every operation. */
    private Wheel loadWheel(Long wheelId) {
        final Wheel wheel = findWheel(wheelId);
        versionGate.check(wheel);
        return wheel;
    }

    private Wheel loadConfigurableWheel(Long wheelId, String caller) {
        final Wheel wheel = loadWheel(wheelId);
        requireOrganizer(wheel, caller);
        requireNotCancelled(wheel);
        requireNotSpun(wheel);
        return wheel;
    }

    private static void requireOrganizer(Wheel wheel, String caller) {
        if (!wheel.isOrganizer(caller)) {
            throw new WheelException(WheelErrorCode.NOT_ORGANIZER, caller);
        }
    }

    private static void requireNotCancelled(Wheel wheel) {
        if (wheel.isCancelled()) {
            throw new WheelException(WheelErrorCode.WHEEL_CANCELLED, wheel.getWheelId());
        }
    }

    private static void requireNotSpun(Wheel wheel) {
        if (wheel.getSpunCount() > 0) {
            throw new WheelException(WheelErrorCode.ALREADY_SPUN, "spunCount=" + wheel.getSpunCount());
        }
    }

    private static void requireAddress(String address) {
        if (address == null || address.isBlank()) {
            throw new WheelException(WheelErrorCode.NOT_ORGANIZER, address);
        }
    }
}

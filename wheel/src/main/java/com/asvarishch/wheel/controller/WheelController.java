package com.asvarishch.wheel.controller;

import com.asvarishch.wheel.dto.*;
import com.asvarishch.wheel.service.WheelService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * REST surface of the wheel. The acting address arrives in {@value #CALLER_HEADER}.
 * <p>
 * POST /api/wheels/{id}/draws
 * Body: { "order": [..] | null, "autoAssign": true|false }
 * Without {@code order} the draw is random, with it the draw is ordered.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/wheels")
public class WheelController {

    public static final String CALLER_HEADER = "X-Caller-Address";

    private final WheelService wheelService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public WheelViewDTO create(@RequestHeader(CALLER_HEADER) String caller,
                               @RequestBody CreateWheelRequestDTO req) {
        return wheelService.create(caller, req);
    }

    @GetMapping("/{wheelId}")
    public WheelViewDTO get(@PathVariable Long wheelId) {
        return wheelService.getWheel(wheelId);
    }

    @GetMapping
    public List<WheelViewDTO> listByOrganizer(@RequestParam String organizer) {
        return wheelService.listByOrganizer(organizer);
    }

    @PostMapping("/{wheelId}/donations")
    public WheelViewDTO donate(@PathVariable Long wheelId,
                               @RequestHeader(CALLER_HEADER) String caller,
                               @RequestBody DonationRequestDTO req) {
        return wheelService.donate(wheelId, caller, req.amount());
    }

    @PutMapping("/{wheelId}/entries")
    public WheelViewDTO updateEntries(@PathVariable Long wheelId,
                                      @RequestHeader(CALLER_HEADER) String caller,
                                      @RequestBody UpdateEntriesRequestDTO req) {
        return wheelService.updateEntries(wheelId, caller, req.entries());
    }

    @PutMapping("/{wheelId}/prizes")
    public WheelViewDTO updatePrizes(@PathVariable Long wheelId,
                                     @RequestHeader(CALLER_HEADER) String caller,
                                     @RequestBody UpdatePrizesRequestDTO req) {
        return wheelService.updatePrizes(wheelId, caller, req.prizeAmounts());
    }

    @PutMapping("/{wheelId}/delay")
    public WheelViewDTO updateDelay(@PathVariable Long wheelId,
                                    @RequestHeader(CALLER_HEADER) String caller,
                                    @RequestBody UpdateTimingRequestDTO req) {
        return wheelService.updateDelay(wheelId, caller, req.valueMs());
    }

    @PutMapping("/{wheelId}/claim-window")
    public WheelViewDTO updateClaimWindow(@PathVariable Long wheelId,
                                          @RequestHeader(CALLER_HEADER) String caller,
                                          @RequestBody UpdateTimingRequestDTO req) {
        return wheelService.updateClaimWindow(wheelId, caller, req.valueMs());
    }

    @PostMapping("/{wheelId}/draws")
    public DrawResultDTO draw(@PathVariable Long wheelId,
                              @RequestHeader(CALLER_HEADER) String caller,
                              @RequestBody(required = false) DrawRequestDTO req) {
        final List<Integer> order = req == null ? null : req.order();
        final boolean autoAssign = req != null && req.autoAssign();
        if (order == null) {
            return autoAssign
                    ? wheelService.drawAndAutoAssign(wheelId, caller)
                    : wheelService.draw(wheelId, caller);
        }
        return autoAssign
                ? wheelService.drawWithOrderAndAutoAssign(wheelId, caller, order)
                : wheelService.drawWithOrder(wheelId, caller, order);
    }

    @PostMapping("/{wheelId}/auto-assign")
    public DrawResultDTO autoAssignLast(@PathVariable Long wheelId,
                                        @RequestHeader(CALLER_HEADER) String caller) {
        return wheelService.autoAssignLast(wheelId, caller);
    }

    @PostMapping("/{wheelId}/claims")
    public PayoutResponseDTO claim(@PathVariable Long wheelId,
                                   @RequestHeader(CALLER_HEADER) String caller) {
        return wheelService.claim(wheelId, caller);
    }

    @PostMapping("/{wheelId}/reclaim")
    public PayoutResponseDTO reclaim(@PathVariable Long wheelId,
                                     @RequestHeader(CALLER_HEADER) String caller) {
        return wheelService.reclaim(wheelId, caller);
    }

    @PostMapping("/{wheelId}/cancel")
    public ResponseEntity<PayoutResponseDTO> cancel(@PathVariable Long wheelId,
                                                    @RequestHeader(CALLER_HEADER) String caller) {
        final Optional<BigDecimal> refunded = wheelService.cancelAndReclaim(wheelId, caller);
        return ResponseEntity.ok(PayoutResponseDTO.builder()
                .wheelId(wheelId)
                .recipient(caller)
                .amount(refunded.orElse(BigDecimal.ZERO))
                .message(refunded.isPresent()
                        ? "CANCELLED: pool returned to organizer."
                        : "CANCELLED: pool was empty.")
                .build());
    }
}

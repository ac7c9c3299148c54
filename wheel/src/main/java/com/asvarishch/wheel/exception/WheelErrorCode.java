package com.asvarishch.wheel.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import static com.asvarishch.wheel.exception.ErrorKind.*;

@Getter
@RequiredArgsConstructor
public enum WheelErrorCode {

    NOT_ORGANIZER(AUTHORIZATION, "Caller is not the organizer of this wheel"),
    NOT_WINNER(AUTHORIZATION, "Caller is not the recorded winner"),

    WHEEL_CANCELLED(STATE, "Wheel is cancelled"),
    ALREADY_SPUN(STATE, "Wheel configuration is locked once the first draw happened"),
    ALL_PRIZES_DRAWN(STATE, "Every prize has already been drawn"),
    NOT_ALL_PRIZES_DRAWN(STATE, "Prizes are still waiting to be drawn"),
    AUTO_ASSIGN_UNAVAILABLE(STATE, "Auto-assign needs exactly one prize and one remaining entry"),
    ALREADY_CLAIMED(STATE, "Prize was already claimed"),
    WRONG_VERSION(STATE, "Wheel was created by an incompatible package version"),

    INVALID_ENTRY_COUNT(VALIDATION, "Entry count must be between 2 and 200"),
    INVALID_ENTRY(VALIDATION, "Entry address must not be blank"),
    INVALID_PRIZE_COUNT(VALIDATION, "Prize count must be positive and not exceed the number of unique entries"),
    INVALID_PRIZE_AMOUNT(VALIDATION, "Prize amounts must be positive with at most 2 decimals"),
    INVALID_AMOUNT(VALIDATION, "Amount must be positive with at most 2 decimals"),
    INVALID_DELAY(VALIDATION, "Delay must be between 0 and the maximum duration"),
    INVALID_CLAIM_WINDOW(VALIDATION, "Claim window must be between 0 and the maximum duration"),
    INVALID_CURRENCY(VALIDATION, "Currency must not be blank"),
    INVALID_ORDER_LENGTH(VALIDATION, "Order length must match the number of remaining entries"),
    INVALID_ORDER_INDEX(VALIDATION, "Order index must address a remaining entry"),

    CLAIM_TOO_EARLY(TIMING, "Claim delay has not elapsed yet"),
    CLAIM_WINDOW_PASSED(TIMING, "Claim window has closed"),
    RECLAIM_TOO_EARLY(TIMING, "Claim windows are still open"),

    INSUFFICIENT_FUNDS(FUNDS, "Pool does not cover the configured prizes"),

    WHEEL_NOT_FOUND(NOT_FOUND, "Wheel not found"),
    NO_ENTITLEMENT(NOT_FOUND, "Caller has no unclaimed prize on this wheel"),
    NO_ENTRIES(NOT_FOUND, "No entries remain"),
    NOTHING_TO_RECLAIM(NOT_FOUND, "Pool is already empty");

    private final ErrorKind kind;
    private final String message;
}

package com.asvarishch.wheel.enums;

public enum WheelPhase {
    /** No draw yet; configuration may still change. */
    CREATED,
    /** At least one draw done, at least one prize left. */
    ACTIVE,
    /** Every prize drawn; only claim and reclaim remain. */
    EXHAUSTED,
    CANCELLED
}

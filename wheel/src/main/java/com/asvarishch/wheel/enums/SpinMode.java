package com.asvarishch.wheel.enums;

/**
 * How a draw picks its winner.
 * <ul>
 *   <li>{@link #RANDOM} - oracle index straight into the entries; every occurrence of the winner is removed.</li>
 *   <li>{@link #ORDERED} - oracle index mapped through a caller-supplied order; only the drawn position is removed.</li>
 * </ul>
 */
public enum SpinMode {
    RANDOM,
    ORDERED
}

package com.asvarishch.wheel.model;

import com.asvarishch.wheel.exception.WheelErrorCode;
import com.asvarishch.wheel.exception.WheelException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * View over a wheel's remaining entries. Writes go straight into the wheel's list.
 * <p>
 * Duplicates are allowed and raise an address's chance of being drawn.
 */
public final class EntryPool {

    public static final int MIN_ENTRIES = 2;
    public static final int MAX_ENTRIES = 200;

    private final List<String> entries;

    private EntryPool(List<String> entries) {
        this.entries = entries;
    }

    public static EntryPool of(Wheel wheel) {
        Objects.requireNonNull(wheel, "wheel must not be null");
        return new EntryPool(wheel.getRemainingEntries());
    }

    /**
     * Checks a candidate entry list against the bounds that apply whenever entries are set.
     *
     * @param candidate  entries about to be stored
     * @param prizeCount prizes the entries must be able to cover with distinct winners
     */
    public static void validate(List<String> candidate, int prizeCount) {
        if (candidate == null || candidate.size() < MIN_ENTRIES || candidate.size() > MAX_ENTRIES) {
            throw new WheelException(WheelErrorCode.INVALID_ENTRY_COUNT, candidate == null ? null : candidate.size());
        }
        for (int i = 0; i < candidate.size(); i++) {
            String address = candidate.get(i);
            if (address == null || address.isBlank()) {
                throw new WheelException(WheelErrorCode.INVALID_ENTRY, "position " + i);
            }
        }
        final int unique = distinctCount(candidate);
        if (unique < prizeCount) {
            throw new WheelException(WheelErrorCode.INVALID_PRIZE_COUNT,
                    "prizes=" + prizeCount + ", uniqueEntries=" + unique);
        }
    }

    public static int distinctCount(List<String> addresses) {
        return new HashSet<>(addresses).size();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public String get(int position) {
        return entries.get(position);
    }

    public int distinctCount() {
        return distinctCount(entries);
    }

    /** Caller has already checked the wheel phase. */
    public void replace(List<String> newEntries, int prizeCount) {
        validate(newEntries, prizeCount);
        entries.clear();
        entries.addAll(newEntries);
    }

    /**
     * Removes every occurrence of {@code address}.
     *
     * @return positions (in the list before removal) that were dropped
     */
    public List<Integer> removeByValue(String address) {
        List<Integer> removed = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).equals(address)) {
                removed.add(i);
            }
        }
        entries.removeIf(address::equals);
        return removed;
    }

    /** Removes the single occurrence at {@code position}; duplicates elsewhere stay eligible. */
    public String removeByPosition(int position) {
        return entries.remove(position);
    }

    /**
     * When every remaining entry is the same address, removes them all and returns it.
     * Consumes no randomness.
     */
    public Optional<String> popIfSingleton() {
        if (entries.isEmpty() || distinctCount() != 1) {
            return Optional.empty();
        }
        final String only = entries.get(0);
        entries.clear();
        return Optional.of(only);
    }
}

package com.asvarishch.wheel.model;

import com.asvarishch.wheel.exception.WheelErrorCode;
import com.asvarishch.wheel.exception.WheelException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EntryPoolTest {

    private static Wheel wheelWith(String... entries) {
        return Wheel.builder()
                .remainingEntries(new ArrayList<>(List.of(entries)))
                .build();
    }

    @Nested
    @DisplayName("validate()")
    class Validate {

        @Test
        @DisplayName("Accepts 2 and 200 entries")
        void bounds_inclusive() {
            EntryPool.validate(List.of("A", "B"), 2);
            List<String> many = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                many.add("addr-" + i);
            }
            EntryPool.validate(many, 5);
        }

        @Test
        @DisplayName("Rejects 1 and 201 entries with INVALID_ENTRY_COUNT")
        void bounds_exceeded() {
            assertThatThrownBy(() -> EntryPool.validate(List.of("A"), 1))
                    .isInstanceOf(WheelException.class)
                    .extracting("code").isEqualTo(WheelErrorCode.INVALID_ENTRY_COUNT);

            List<String> tooMany = new ArrayList<>(Collections.nCopies(201, "A"));
            assertThatThrownBy(() -> EntryPool.validate(tooMany, 1))
                    .isInstanceOf(WheelException.class)
                    .extracting("code").isEqualTo(WheelErrorCode.INVALID_ENTRY_COUNT);
        }

        @Test
        @DisplayName("Duplicates count once against the prize count")
        void uniqueCount_againstPrizes() {
            EntryPool.validate(List.of("A", "A", "B", "B"), 2);

            assertThatThrownBy(() -> EntryPool.validate(List.of("A", "A", "B", "B"), 3))
                    .isInstanceOf(WheelException.class)
                    .extracting("code").isEqualTo(WheelErrorCode.INVALID_PRIZE_COUNT);
        }

        @Test
        @DisplayName("Blank address is rejected")
        void blankAddress() {
            assertThatThrownBy(() -> EntryPool.validate(List.of("A", " "), 1))
                    .isInstanceOf(WheelException.class)
                    .extracting("code").isEqualTo(WheelErrorCode.INVALID_ENTRY);
        }
    }

    @Nested
    @DisplayName("Removal")
    class Removal {

        @Test
        @DisplayName("removeByValue() drops every occurrence and reports original positions")
        void removeByValue_allDuplicates() {
            Wheel wheel = wheelWith("A", "B", "A", "C", "A");
            EntryPool pool = EntryPool.of(wheel);

            List<Integer> removed = pool.removeByValue("A");

            assertThat(removed).containsExactly(0, 2, 4);
            assertThat(wheel.getRemainingEntries()).containsExactly("B", "C");
        }

        @Test
        @DisplayName("removeByPosition() drops one occurrence; duplicates stay")
        void removeByPosition_single() {
            Wheel wheel = wheelWith("A", "B", "A");
            EntryPool pool = EntryPool.of(wheel);

            String removed = pool.removeByPosition(2);

            assertThat(removed).isEqualTo("A");
            assertThat(wheel.getRemainingEntries()).containsExactly("A", "B");
        }

        @Test
        @DisplayName("popIfSingleton() empties a pool holding one address, possibly repeated")
        void popIfSingleton() {
            Wheel one = wheelWith("Z");
            assertThat(EntryPool.of(one).popIfSingleton()).contains("Z");
            assertThat(one.getRemainingEntries()).isEmpty();

            Wheel repeated = wheelWith("B", "B");
            assertThat(EntryPool.of(repeated).popIfSingleton()).contains("B");
            assertThat(repeated.getRemainingEntries()).isEmpty();

            Wheel two = wheelWith("A", "B");
            assertThat(EntryPool.of(two).popIfSingleton()).isEmpty();
            assertThat(two.getRemainingEntries()).containsExactly("A", "B");
        }
    }

    @Test
    @DisplayName("replace() validates before clearing the current entries")
    void replace_validatesFirst() {
        Wheel wheel = wheelWith("A", "B", "C");
        EntryPool pool = EntryPool.of(wheel);

        assertThatThrownBy(() -> pool.replace(List.of("X"), 1))
                .isInstanceOf(WheelException.class);
        assertThat(wheel.getRemainingEntries()).containsExactly("A", "B", "C");

        pool.replace(List.of("X", "Y"), 2);
        assertThat(wheel.getRemainingEntries()).containsExactly("X", "Y");
    }
}

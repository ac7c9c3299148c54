package com.asvarishch.wheel.controller;

import com.asvarishch.wheel.dto.DrawResultDTO;
import com.asvarishch.wheel.dto.PayoutResponseDTO;
import com.asvarishch.wheel.dto.WheelViewDTO;
import com.asvarishch.wheel.dto.WinnerViewDTO;
import com.asvarishch.wheel.enums.SpinMode;
import com.asvarishch.wheel.enums.WheelPhase;
import com.asvarishch.wheel.exception.ErrorKind;
import com.asvarishch.wheel.exception.WheelErrorCode;
import com.asvarishch.wheel.exception.WheelException;
import com.asvarishch.wheel.model.Wheel;
import com.asvarishch.wheel.service.WheelService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.asvarishch.wheel.controller.WheelController.CALLER_HEADER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * HTTP routing and error mapping. The service is mocked; its rules are covered in WheelServiceTest.
 */
@WebMvcTest(WheelController.class)
class WheelControllerTest {

    private static final String ORG = "0xorganizer";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private WheelService wheelService;

    private static WheelViewDTO view(Long id) {
        return WheelViewDTO.builder()
                .wheelId(id)
                .organizer(ORG)
                .currency("USD")
                .phase(WheelPhase.CREATED)
                .remainingEntries(List.of("A", "B", "C"))
                .prizeAmounts(List.of(new BigDecimal("1000"), new BigDecimal("500")))
                .winners(List.of())
                .spinTimes(List.of())
                .claimWindowMs(86_400_000L)
                .pool(BigDecimal.ZERO)
                .build();
    }

    private static DrawResultDTO drawResult(SpinMode mode, String... winners) {
        List<WinnerViewDTO> views = new ArrayList<>();
        for (int i = 0; i < winners.length; i++) {
            views.add(WinnerViewDTO.builder().address(winners[i]).prizeIndex(i).amount(BigDecimal.TEN).build());
        }
        return DrawResultDTO.builder().wheelId(1L).mode(mode).winners(views).spunCount(winners.length).build();
    }

    @Nested
    @DisplayName("Routing")
    class Routing {

        @Test
        @DisplayName("POST /api/wheels -> 201 with the created wheel")
        void create() throws Exception {
            when(wheelService.create(eq(ORG), any())).thenReturn(view(1L));

            mockMvc.perform(post("/api/wheels")
                            .header(CALLER_HEADER, ORG)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"entries":["A","B","C"],"prizeAmounts":[1000,500],
                                     "delayMs":0,"claimWindowMs":0,"currency":"USD"}
                                    """))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.wheelId").value(1))
                    .andExpect(jsonPath("$.phase").value("CREATED"))
                    .andExpect(jsonPath("$.remainingEntries.length()").value(3));
        }

        @Test
        @DisplayName("Draw without body -> random draw")
        void drawNoBody() throws Exception {
            when(wheelService.draw(1L, ORG)).thenReturn(drawResult(SpinMode.RANDOM, "A"));

            mockMvc.perform(post("/api/wheels/1/draws").header(CALLER_HEADER, ORG))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.mode").value("RANDOM"))
                    .andExpect(jsonPath("$.winners[0].address").value("A"));
        }

        @Test
        @DisplayName("Draw with order and autoAssign -> ordered draw with auto-assign")
        void drawOrderedAutoAssign() throws Exception {
            when(wheelService.drawWithOrderAndAutoAssign(1L, ORG, List.of(2, 0, 1)))
                    .thenReturn(drawResult(SpinMode.ORDERED, "B", "A"));

            mockMvc.perform(post("/api/wheels/1/draws")
                            .header(CALLER_HEADER, ORG)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"order\":[2,0,1],\"autoAssign\":true}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.winners.length()").value(2));
        }

        @Test
        @DisplayName("Draw with autoAssign only -> random draw with auto-assign")
        void drawRandomAutoAssign() throws Exception {
            when(wheelService.drawAndAutoAssign(1L, ORG)).thenReturn(drawResult(SpinMode.RANDOM, "A", "B"));

            mockMvc.perform(post("/api/wheels/1/draws")
                            .header(CALLER_HEADER, ORG)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"autoAssign\":true}"))
                    .andExpect(status().isOk());

            verify(wheelService).drawAndAutoAssign(1L, ORG);
        }

        @Test
        @DisplayName("Donation and timing updates pass the body values through")
        void donateAndUpdate() throws Exception {
            when(wheelService.donate(eq(1L), eq(ORG), any())).thenReturn(view(1L));
            when(wheelService.updateDelay(1L, ORG, 60_000L)).thenReturn(view(1L));

            mockMvc.perform(post("/api/wheels/1/donations")
                            .header(CALLER_HEADER, ORG)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"amount\":250.50}"))
                    .andExpect(status().isOk());
            mockMvc.perform(put("/api/wheels/1/delay")
                            .header(CALLER_HEADER, ORG)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"valueMs\":60000}"))
                    .andExpect(status().isOk());

            verify(wheelService).donate(1L, ORG, new BigDecimal("250.50"));
            verify(wheelService).updateDelay(1L, ORG, 60_000L);
        }

        @Test
        @DisplayName("Claim returns the payout")
        void claim() throws Exception {
            when(wheelService.claim(1L, "A")).thenReturn(PayoutResponseDTO.builder()
                    .wheelId(1L).recipient("A").amount(new BigDecimal("1000")).currency("USD")
                    .message("CLAIMED: prize 0 paid out.").build());

            mockMvc.perform(post("/api/wheels/1/claims").header(CALLER_HEADER, "A"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.recipient").value("A"))
                    .andExpect(jsonPath("$.amount").value(1000));
        }

        @Test
        @DisplayName("Cancel with an empty pool -> 200 with zero amount")
        void cancelEmpty() throws Exception {
            when(wheelService.cancelAndReclaim(1L, ORG)).thenReturn(Optional.empty());

            mockMvc.perform(post("/api/wheels/1/cancel").header(CALLER_HEADER, ORG))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.amount").value(0))
                    .andExpect(jsonPath("$.message").value("CANCELLED: pool was empty."));
        }

        @Test
        @DisplayName("GET ?organizer= lists the organizer's wheels")
        void list() throws Exception {
            when(wheelService.listByOrganizer(ORG)).thenReturn(List.of(view(1L), view(2L)));

            mockMvc.perform(get("/api/wheels").param("organizer", ORG))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$[1].wheelId").value(2));
        }
    }

    @Nested
    @DisplayName("Error mapping")
    class Errors {

        @Test
        @DisplayName("NOT_ORGANIZER -> 403 with code and kind")
        void authorization() throws Exception {
            when(wheelService.draw(1L, "0xstranger"))
                    .thenThrow(new WheelException(WheelErrorCode.NOT_ORGANIZER, "0xstranger"));

            mockMvc.perform(post("/api/wheels/1/draws").header(CALLER_HEADER, "0xstranger"))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.errorCode").value("NOT_ORGANIZER"))
                    .andExpect(jsonPath("$.kind").value("AUTHORIZATION"))
                    .andExpect(jsonPath("$.details.value").value("0xstranger"));
        }

        @Test
        @DisplayName("INSUFFICIENT_FUNDS -> 422")
        void funds() throws Exception {
            when(wheelService.draw(1L, ORG)).thenThrow(new WheelException(WheelErrorCode.INSUFFICIENT_FUNDS, "pool=0"));

            mockMvc.perform(post("/api/wheels/1/draws").header(CALLER_HEADER, ORG))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.kind").value("FUNDS"));
        }

        @Test
        @DisplayName("CLAIM_TOO_EARLY -> 409")
        void timing() throws Exception {
            when(wheelService.claim(1L, "A")).thenThrow(new WheelException(WheelErrorCode.CLAIM_TOO_EARLY, "now=0"));

            mockMvc.perform(post("/api/wheels/1/claims").header(CALLER_HEADER, "A"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.errorCode").value("CLAIM_TOO_EARLY"));
        }

        @Test
        @DisplayName("WHEEL_NOT_FOUND -> 404")
        void notFound() throws Exception {
            when(wheelService.getWheel(9L)).thenThrow(new WheelException(WheelErrorCode.WHEEL_NOT_FOUND, 9L));

            mockMvc.perform(get("/api/wheels/9"))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("Concurrent commit on the same wheel -> 409 CONCURRENT_UPDATE")
        void optimisticLock() throws Exception {
            when(wheelService.claim(1L, "A")).thenThrow(new ObjectOptimisticLockingFailureException(Wheel.class, 1L));

            mockMvc.perform(post("/api/wheels/1/claims").header(CALLER_HEADER, "A"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.errorCode").value("CONCURRENT_UPDATE"));
        }

        @Test
        @DisplayName("Missing caller header -> 400, service not called")
        void missingHeader() throws Exception {
            mockMvc.perform(post("/api/wheels/1/claims"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.kind").value("VALIDATION"));

            verifyNoInteractions(wheelService);
        }

        @ParameterizedTest
        @EnumSource(ErrorKind.class)
        @DisplayName("Every error kind maps to a client error status")
        void everyKindMapped(ErrorKind kind) {
            HttpStatus status = WheelExceptionHandler.statusOf(kind);

            assertThat(status.is4xxClientError()).isTrue();
        }
    }
}

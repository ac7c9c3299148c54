package com.asvarishch.wheel.controller;

import com.asvarishch.wheel.dto.ErrorResponseDTO;
import com.asvarishch.wheel.exception.ErrorKind;
import com.asvarishch.wheel.exception.WheelException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class WheelExceptionHandler {

    @ExceptionHandler(WheelException.class)
    public ResponseEntity<ErrorResponseDTO> handleWheel(WheelException ex) {
        log.warn("Wheel operation rejected: code={}, kind={}, detail={}", ex.getCode(), ex.getKind(), ex.getDetail());

        Map<String, Object> details = new LinkedHashMap<>();
        if (ex.getDetail() != null) {
            details.put("value", String.valueOf(ex.getDetail()));
        }
        return ResponseEntity.status(statusOf(ex.getKind()))
                .body(ErrorResponseDTO.builder()
                        .message(ex.getCode().getMessage())
                        .errorCode(ex.getCode().name())
                        .kind(ex.getKind().name())
                        .details(details.isEmpty() ? null : details)
                        .build());
    }

    /** Another operation committed against the same wheel first; the caller may retry. */
    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponseDTO> handleConcurrentUpdate(ObjectOptimisticLockingFailureException ex) {
        log.warn("Concurrent wheel update rejected: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ErrorResponseDTO.builder()
                        .message("Wheel was modified concurrently, retry the operation")
                        .errorCode("CONCURRENT_UPDATE")
                        .kind(ErrorKind.STATE.name())
                        .build());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingRequestHeaderException.class})
    public ResponseEntity<ErrorResponseDTO> handleBadRequest(Exception ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponseDTO.builder()
                        .message(ex instanceof MissingRequestHeaderException
                                ? "Missing header " + WheelController.CALLER_HEADER
                                : "Malformed request body")
                        .errorCode("BAD_REQUEST")
                        .kind(ErrorKind.VALIDATION.name())
                        .build());
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case STATE, TIMING -> HttpStatus.CONFLICT;
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case FUNDS -> HttpStatus.UNPROCESSABLE_ENTITY;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
        };
    }
}

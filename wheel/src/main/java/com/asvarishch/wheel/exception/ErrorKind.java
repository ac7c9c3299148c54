package com.asvarishch.wheel.exception;

public enum ErrorKind {
    AUTHORIZATION,
    STATE,
    VALIDATION,
    TIMING,
    FUNDS,
    NOT_FOUND
}

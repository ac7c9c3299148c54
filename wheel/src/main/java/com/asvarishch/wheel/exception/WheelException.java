package com.asvarishch.wheel.exception;

import lombok.Getter;

/**
 * Aborts a wheel operation. Carries the failed rule and the value that broke it;
 * the surrounding transaction is rolled back so nothing of the operation is kept.
 */
@Getter
public class WheelException extends RuntimeException {

    private final WheelErrorCode code;
    private final Object detail;

    public WheelException(WheelErrorCode code, Object detail) {
        super(code.getMessage() + " (" + detail + ")");
        this.code = code;
        this.detail = detail;
    }

    public ErrorKind getKind() {
        return code.getKind();
    }
}

package com.asvarishch.wheel.enums;

public enum WheelEventType {
    CREATED,
    DRAWN,
    CLAIMED,
    RECLAIMED
}

package com.asvarishch.wheel.service;

import com.asvarishch.wheel.exception.WheelErrorCode;
import com.asvarishch.wheel.exception.WheelException;
import com.asvarishch.wheel.model.Wheel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Rejects operations on wheels stamped by another package version.
 */
@Component
public class VersionGate {

    private final int currentVersion;

    public VersionGate(@Value("${wheel.package-version:1}") int currentVersion) {
        this.currentVersion = currentVersion;
    }

    public int currentVersion() {
        return currentVersion;
    }

    public void check(Wheel wheel) {
        if (wheel.getPackageVersion() != currentVersion) {
            throw new WheelException(WheelErrorCode.WRONG_VERSION,
                    "wheel=" + wheel.getPackageVersion() + ", package=" + currentVersion);
        }
    }
}

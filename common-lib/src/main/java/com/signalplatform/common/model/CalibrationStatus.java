package com.signalplatform.common.model;

public enum CalibrationStatus {
    ADJUSTED,
    UNCHANGED,
    INSUFFICIENT_DATA,
    FAILED
}

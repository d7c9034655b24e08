package com.signalplatform.common.model;

public enum VolumeTrend {
    INCREASING,
    DECREASING,
    FLAT
}

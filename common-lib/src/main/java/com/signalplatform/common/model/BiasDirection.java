package com.signalplatform.common.model;

public enum BiasDirection {
    BULLISH,
    BEARISH,
    NEUTRAL
}

package com.signalplatform.common.model;

public record DecisionTypeMetrics(
    int count,
    double accuracy,
    double avgConfidence
) {}

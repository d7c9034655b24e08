package com.signalplatform.orchestrator.controller;

import com.signalplatform.common.model.Timeframe;

/**
 * Body of {@code POST /api/v1/signals/generate}. {@code timeframe} accepts labels such as
 * {@code "15m"}; {@code analysisWindow} may be omitted.
 */
public record GenerateSignalRequest(String instrument, Timeframe timeframe, Integer analysisWindow) {}

package com.signalplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Which consensus rule produced a {@link ConsensusDecision}. */
public enum ConsensusSource {
    AGREEMENT("agreement"),
    BELOW_THRESHOLD("below-threshold"),
    SINGLE_FALLBACK("single-fallback"),
    DISAGREEMENT("disagreement"),
    HIGHEST_CONFIDENCE_WINNER("highest-confidence-winner"),
    NONE("none");

    private final String label;

    ConsensusSource(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}

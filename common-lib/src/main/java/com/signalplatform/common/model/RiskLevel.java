package com.signalplatform.common.model;

/**
 * Judge-reported risk. The numeric score is what gets averaged across agreeing judges.
 */
public enum RiskLevel {
    LOW(1),
    MEDIUM(2),
    HIGH(3);

    private final int score;

    RiskLevel(int score) {
        this.score = score;
    }

    public int score() {
        return score;
    }

    public static RiskLevel fromScore(long score) {
        if (score <= 1) return LOW;
        if (score >= 3) return HIGH;
        return MEDIUM;
    }

    /** Unknown or missing text maps to {@link #MEDIUM}. */
    public static RiskLevel fromText(String text) {
        if (text == null) return MEDIUM;
        for (RiskLevel level : values()) {
            if (level.name().equalsIgnoreCase(text.trim())) return level;
        }
        return MEDIUM;
    }
}

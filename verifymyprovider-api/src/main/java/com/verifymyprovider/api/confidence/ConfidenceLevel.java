package com.verifymyprovider.api.confidence;

public enum ConfidenceLevel {
    VERY_HIGH(91, "Verified through multiple sources with strong community agreement"),
    HIGH(76, "Verified by several independent sources and recently confirmed"),
    MEDIUM(51, "Some verification exists but more confirmations are needed"),
    LOW(26, "Limited or aging verification; call the office to confirm"),
    VERY_LOW(0, "Unverified or stale; call the office before relying on this");

    private final int minScore;
    private final String description;

    ConfidenceLevel(int minScore, String description) {
        this.minScore = minScore;
        this.description = description;
    }

    public static ConfidenceLevel fromScore(int score) {
        for (ConfidenceLevel level : values()) {
            if (score >= level.minScore) {
                return level;
            }
        }
        return VERY_LOW;
    }

    public boolean isAbove(ConfidenceLevel other) {
        return minScore > other.minScore;
    }

    public int getMinScore() { return minScore; }
    public String getDescription() { return description; }
}

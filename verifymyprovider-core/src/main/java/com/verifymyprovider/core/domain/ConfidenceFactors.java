package com.verifymyprovider.core.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import java.util.Objects;

/**
 * Snapshot of the four sub-scores behind a confidence score.
 * Persisted alongside the acceptance so the breakdown can be shown without rescoring.
 */
@Embeddable
public class ConfidenceFactors {

    public static final int MAX_DATA_SOURCE = 25;
    public static final int MAX_RECENCY = 30;
    public static final int MAX_VERIFICATION = 25;
    public static final int MAX_AGREEMENT = 20;

    @Column(name = "data_source_score", nullable = false)
    private int dataSourceScore;

    @Column(name = "recency_score", nullable = false)
    private int recencyScore;

    @Column(name = "verification_score", nullable = false)
    private int verificationScore;

    @Column(name = "agreement_score", nullable = false)
    private int agreementScore;

    protected ConfidenceFactors() {}

    private ConfidenceFactors(int dataSourceScore, int recencyScore, int verificationScore, int agreementScore) {
        this.dataSourceScore = dataSourceScore;
        this.recencyScore = recencyScore;
        this.verificationScore = verificationScore;
        this.agreementScore = agreementScore;
    }

    public static ConfidenceFactors of(int dataSourceScore, int recencyScore, int verificationScore, int agreementScore) {
        requireInBand("dataSourceScore", dataSourceScore, MAX_DATA_SOURCE);
        requireInBand("recencyScore", recencyScore, MAX_RECENCY);
        requireInBand("verificationScore", verificationScore, MAX_VERIFICATION);
        requireInBand("agreementScore", agreementScore, MAX_AGREEMENT);
        return new ConfidenceFactors(dataSourceScore, recencyScore, verificationScore, agreementScore);
    }

    public static ConfidenceFactors none() {
        return new ConfidenceFactors(0, 0, 0, 0);
    }

    private static void requireInBand(String name, int value, int max) {
        if (value < 0 || value > max) {
            throw new IllegalArgumentException(name + " must be between 0 and " + max + ": " + value);
        }
    }

    public int total() {
        return dataSourceScore + recencyScore + verificationScore + agreementScore;
    }

    // Getters
    public int getDataSourceScore() { return dataSourceScore; }
    public int getRecencyScore() { return recencyScore; }
    public int getVerificationScore() { return verificationScore; }
    public int getAgreementScore() { return agreementScore; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConfidenceFactors that)) return false;
        return dataSourceScore == that.dataSourceScore
                && recencyScore == that.recencyScore
                && verificationScore == that.verificationScore
                && agreementScore == that.agreementScore;
    }

    @Override
    public int hashCode() {
        return Objects.hash(dataSourceScore, recencyScore, verificationScore, agreementScore);
    }

    @Override
    public String toString() {
        return "ConfidenceFactors[dataSource=" + dataSourceScore + ", recency=" + recencyScore
                + ", verification=" + verificationScore + ", agreement=" + agreementScore + "]";
    }
}

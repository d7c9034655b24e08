package com.signalplatform.common.model;

import java.time.Instant;

/**
 * Versioned tunables shared between the pipeline and the calibrator.
 *
 * <p>Instances are never mutated. The calibrator publishes a new version and readers
 * take one snapshot per pipeline invocation.
 *
 * @param minConfidence            agreement confidence (0-100) required for consensus
 * @param consensusRequired        whether judge disagreement forces NO_TRADE
 * @param consensusAgreementBonus  points added to the mean confidence when judges agree
 */
public record AdaptiveThresholds(
    long version,
    double minConfidence,
    boolean consensusRequired,
    double consensusAgreementBonus,
    Instant publishedAt
) {

    public static AdaptiveThresholds initial(double minConfidence, boolean consensusRequired,
                                             double consensusAgreementBonus, Instant publishedAt) {
        return new AdaptiveThresholds(1L, minConfidence, consensusRequired, consensusAgreementBonus, publishedAt);
    }

    /** Successor version carrying the given values. */
    public AdaptiveThresholds next(double minConfidence, boolean consensusRequired,
                                   double consensusAgreementBonus, Instant publishedAt) {
        return new AdaptiveThresholds(version + 1, minConfidence, consensusRequired,
                                      consensusAgreementBonus, publishedAt);
    }

    public boolean sameValuesAs(AdaptiveThresholds other) {
        return Double.compare(minConfidence, other.minConfidence) == 0
            && consensusRequired == other.consensusRequired
            && Double.compare(consensusAgreementBonus, other.consensusAgreementBonus) == 0;
    }
}

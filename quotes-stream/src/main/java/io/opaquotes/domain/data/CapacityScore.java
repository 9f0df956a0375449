package io.opaquotes.domain.data;

import java.time.Instant;

/**
 * Capacity scoring result published for a ticker by the scoring model.
 */
public record CapacityScore(
    String ticker,
    double score,
    double confidence,
    Instant lastUpdated,
    String modelVersion
) {
    public CapacityScore {
        if (ticker == null || ticker.isBlank()) {
            throw new IllegalArgumentException("ticker cannot be blank");
        }
        if (score < 0 || score > 1) {
            throw new IllegalArgumentException("score must be within [0,1]: " + score);
        }
        if (confidence < 0 || confidence > 1) {
            throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
        }
        if (lastUpdated == null || modelVersion == null) {
            throw new IllegalArgumentException("lastUpdated and modelVersion cannot be null");
        }
    }
}

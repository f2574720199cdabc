package com.supplier.matching.api;

/**
 * Thrown when a run is cancelled. No partial result is returned.
 */
public class MatchingCancelledException extends RuntimeException {

    private final String phase;

    public MatchingCancelledException(String phase) {
        super("Matching run cancelled before phase '" + phase + "'");
        this.phase = phase;
    }

    /**
     * Phase that was about to start when cancellation was observed.
     */
    public String getPhase() {
        return phase;
    }
}

package com.example.rcaengine.analysis;

/**
 * Versioned weight set for the four root-cause factors.
 *
 * Scoring is a pure function of the factors and this record, so a weight
 * change is a new version and never an edit in the scorer.
 */
public record ScoringWeights(String version, double time, double dependency, double historical,
                             double criticality) {

    private static final double TOLERANCE = 1e-6;

    /**
     * @throws IllegalStateException when a weight lies outside [0,1] or the weights do not sum to 1
     */
    public void validate() {
        if (version == null || version.isBlank()) {
            throw new IllegalStateException("Scoring weights need a version");
        }
        for (double w : new double[]{time, dependency, historical, criticality}) {
            if (w < 0.0 || w > 1.0) {
                throw new IllegalStateException("Scoring weight out of range in " + version + ": " + w);
            }
        }
        double sum = time + dependency + historical + criticality;
        if (Math.abs(sum - 1.0) > TOLERANCE) {
            throw new IllegalStateException("Scoring weights " + version + " sum to " + sum + ", expected 1.0");
        }
    }

    /**
     * Weights used when the historical factor is unavailable: its share is
     * spread over the other three in proportion to their own weight.
     */
    public ScoringWeights withoutHistorical() {
        double remaining = time + dependency + criticality;
        if (remaining <= 0.0) {
            throw new IllegalStateException("Scoring weights " + version + " rely on the historical factor only");
        }
        return new ScoringWeights(version, time / remaining, dependency / remaining, 0.0,
                criticality / remaining);
    }

    public double combine(double timeFactor, double dependencyFactor, double historicalFactor,
                          double criticalityFactor) {
        return time * timeFactor
                + dependency * dependencyFactor
                + historical * historicalFactor
                + criticality * criticalityFactor;
    }
}

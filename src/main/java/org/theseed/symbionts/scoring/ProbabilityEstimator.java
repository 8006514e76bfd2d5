/**
 *
 */
package org.theseed.symbionts.scoring;

/**
 * This object estimates the probability that a predicted function is actually present in the
 * sample.  A logistic curve on the function's total relative abundance gives the base
 * probability, which is then multiplied by factors for the mean taxonomic confidence, the mean
 * host-match weight, the mean evidence weight, and the number of contributing taxa.  The result
 * is clamped to [0, 1].
 *
 */
public class ProbabilityEstimator {

    // FIELDS
    /** steepness of the abundance curve */
    public static final double STEEPNESS = 0.3;
    /** abundance percentage at the midpoint of the curve */
    public static final double MIDPOINT = 5.0;

    /**
     * @return the base probability for a total relative abundance
     *
     * @param totalPct		total relative abundance of the function (percent)
     */
    public double baseProbability(double totalPct) {
        return 1.0 / (1.0 + Math.exp(-STEEPNESS * (totalPct - MIDPOINT)));
    }

    /**
     * Estimate the probability of a function.
     *
     * @param totalPct				total relative abundance of the function (percent)
     * @param meanConfidence		mean taxonomic confidence weight
     * @param meanHostMatch			mean host-match weight
     * @param meanEvidenceWeight	mean evidence weight
     * @param taxaCount				number of contributing taxa
     *
     * @return the estimated probability
     *
     * @throws IllegalStateException if the computation does not produce a finite number
     */
    public double estimate(double totalPct, double meanConfidence, double meanHostMatch,
            double meanEvidenceWeight, int taxaCount) {
        double confidenceFactor = 0.9 + meanConfidence * 0.2;
        double hostFactor = 0.95 + (meanHostMatch - 1.0) * 0.1;
        double evidenceFactor = 0.95 + (meanEvidenceWeight - 1.0) * 0.1;
        double taxaFactor = 1.0 + Math.log10(taxaCount + 1) * 0.05;
        double raw = this.baseProbability(totalPct) * confidenceFactor * hostFactor * evidenceFactor * taxaFactor;
        if (! Double.isFinite(raw))
            throw new IllegalStateException(String.format("Internal error:  probability computation produced %s "
                    + "(abundance %s, confidence %s, host %s, evidence %s, taxa %d).", raw, totalPct,
                    meanConfidence, meanHostMatch, meanEvidenceWeight, taxaCount));
        return Math.max(0.0, Math.min(1.0, raw));
    }

}

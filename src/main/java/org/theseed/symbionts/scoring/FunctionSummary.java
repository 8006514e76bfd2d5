/**
 *
 */
package org.theseed.symbionts.scoring;

/**
 * This object summarizes the evidence for a single predicted function across all the scored
 * candidates that support it.  Summaries sort by descending final score sum, then function name.
 *
 */
public class FunctionSummary implements Comparable<FunctionSummary> {

    // FIELDS
    /** function tag */
    private final String function;
    /** sum of the final scores */
    private final double finalScoreSum;
    /** total relative abundance of the contributing rows (percent) */
    private final double totalRelativeAbundancePct;
    /** mean taxonomic confidence */
    private final double meanConfidence;
    /** mean host-match weight */
    private final double meanHostMatch;
    /** mean evidence weight */
    private final double meanEvidenceWeight;
    /** number of distinct contributing taxa */
    private final int taxaCount;
    /** estimated probability of presence */
    private final double probability;
    /** candidate with the highest final score */
    private final ScoredCandidate dominant;
    /** percent of the function's relative abundance contributed by the dominant taxon */
    private final double dominantShare;

    /**
     * Construct a function summary.
     *
     * @param function					function tag
     * @param finalScoreSum				sum of the final scores
     * @param totalRelativeAbundancePct	total relative abundance (percent)
     * @param meanConfidence			mean taxonomic confidence
     * @param meanHostMatch				mean host-match weight
     * @param meanEvidenceWeight		mean evidence weight
     * @param taxaCount					number of distinct contributing taxa
     * @param probability				estimated probability
     * @param dominant					candidate with the highest final score
     * @param dominantShare				percent of the relative abundance from the dominant taxon
     */
    public FunctionSummary(String function, double finalScoreSum, double totalRelativeAbundancePct,
            double meanConfidence, double meanHostMatch, double meanEvidenceWeight, int taxaCount,
            double probability, ScoredCandidate dominant, double dominantShare) {
        this.function = function;
        this.finalScoreSum = finalScoreSum;
        this.totalRelativeAbundancePct = totalRelativeAbundancePct;
        this.meanConfidence = meanConfidence;
        this.meanHostMatch = meanHostMatch;
        this.meanEvidenceWeight = meanEvidenceWeight;
        this.taxaCount = taxaCount;
        this.probability = probability;
        this.dominant = dominant;
        this.dominantShare = dominantShare;
    }

    @Override
    public int compareTo(FunctionSummary o) {
        int retVal = Double.compare(o.finalScoreSum, this.finalScoreSum);
        if (retVal == 0)
            retVal = this.function.compareTo(o.function);
        return retVal;
    }

    /**
     * @return the function tag
     */
    public String getFunction() {
        return this.function;
    }

    /**
     * @return the sum of the final scores
     */
    public double getFinalScoreSum() {
        return this.finalScoreSum;
    }

    /**
     * @return the total relative abundance of the contributing rows (percent)
     */
    public double getTotalRelativeAbundancePct() {
        return this.totalRelativeAbundancePct;
    }

    /**
     * @return the mean taxonomic confidence
     */
    public double getMeanConfidence() {
        return this.meanConfidence;
    }

    /**
     * @return the mean host-match weight
     */
    public double getMeanHostMatch() {
        return this.meanHostMatch;
    }

    /**
     * @return the mean evidence weight
     */
    public double getMeanEvidenceWeight() {
        return this.meanEvidenceWeight;
    }

    /**
     * @return the number of distinct contributing taxa
     */
    public int getTaxaCount() {
        return this.taxaCount;
    }

    /**
     * @return the estimated probability that the function is present
     */
    public double getProbability() {
        return this.probability;
    }

    /**
     * @return the taxonomy label of the dominant contributor
     */
    public String getDominantContributor() {
        return this.dominant.getTaxonLabel();
    }

    /**
     * @return the candidate with the highest final score
     */
    public ScoredCandidate getDominantCandidate() {
        return this.dominant;
    }

    /**
     * @return the percent of this function's relative abundance contributed by the dominant taxon
     */
    public double getDominantShare() {
        return this.dominantShare;
    }

    /**
     * @return a display string for the dominant contributor
     */
    public String getDominantDescription() {
        return String.format("%s (%.1f%% contribution)", this.dominant.getDisplayName(), this.dominantShare);
    }

}

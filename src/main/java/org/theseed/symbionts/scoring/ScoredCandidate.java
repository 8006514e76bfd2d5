/**
 *
 */
package org.theseed.symbionts.scoring;

import org.theseed.symbionts.host.HostMatchLevel;
import org.theseed.symbionts.records.ReferenceRecord;
import org.theseed.symbionts.taxonomy.MatchResult;

/**
 * This object contains the scores for a single taxon/record match.  The base score depends on the
 * taxonomic confidence and the relative abundance.  The final score is the base score times the
 * host-match weight times the evidence weight.
 *
 * Candidates sort by descending final score, then descending relative abundance, then taxon name.
 *
 */
public class ScoredCandidate implements Comparable<ScoredCandidate> {

    // FIELDS
    /** match being scored */
    private final MatchResult match;
    /** relative abundance of the matched row (percent) */
    private final double relativeAbundancePct;
    /** base score */
    private final double baseScore;
    /** host-match tier */
    private final HostMatchLevel hostMatchLevel;
    /** evidence level */
    private final int evidenceLevel;
    /** evidence weight */
    private final double evidenceWeight;
    /** final score */
    private final double finalScore;

    /**
     * Construct a scored candidate.
     *
     * @param match					taxonomic match
     * @param relativeAbundancePct	relative abundance of the row (percent)
     * @param baseScore				base score
     * @param hostMatchLevel		host-match tier
     * @param evidenceLevel			evidence level
     * @param evidenceWeight		evidence weight
     */
    public ScoredCandidate(MatchResult match, double relativeAbundancePct, double baseScore,
            HostMatchLevel hostMatchLevel, int evidenceLevel, double evidenceWeight) {
        this.match = match;
        this.relativeAbundancePct = relativeAbundancePct;
        this.baseScore = baseScore;
        this.hostMatchLevel = hostMatchLevel;
        this.evidenceLevel = evidenceLevel;
        this.evidenceWeight = evidenceWeight;
        this.finalScore = baseScore * hostMatchLevel.getWeight() * evidenceWeight;
    }

    @Override
    public int compareTo(ScoredCandidate o) {
        int retVal = Double.compare(o.finalScore, this.finalScore);
        if (retVal == 0) {
            retVal = Double.compare(o.relativeAbundancePct, this.relativeAbundancePct);
            if (retVal == 0) {
                retVal = this.getDisplayName().compareTo(o.getDisplayName());
                if (retVal == 0)
                    retVal = this.getTaxonLabel().compareTo(o.getTaxonLabel());
            }
        }
        return retVal;
    }

    /**
     * @return the taxonomic match
     */
    public MatchResult getMatch() {
        return this.match;
    }

    /**
     * @return the matched reference record
     */
    public ReferenceRecord getRecord() {
        return this.match.getRecord();
    }

    /**
     * @return the function predicted by this candidate
     */
    public String getFunction() {
        return this.match.getRecord().getFunction();
    }

    /**
     * @return the taxonomy label of the matched abundance row
     */
    public String getTaxonLabel() {
        return this.match.getRow().getTaxonLabel();
    }

    /**
     * @return the display name of the matched taxon
     */
    public String getDisplayName() {
        return this.match.getDisplayName();
    }

    /**
     * @return the taxonomic confidence weight
     */
    public double getConfidence() {
        return this.match.getWeight();
    }

    /**
     * @return the relative abundance of the matched row (percent)
     */
    public double getRelativeAbundancePct() {
        return this.relativeAbundancePct;
    }

    /**
     * @return the base score
     */
    public double getBaseScore() {
        return this.baseScore;
    }

    /**
     * @return the host-match tier
     */
    public HostMatchLevel getHostMatchLevel() {
        return this.hostMatchLevel;
    }

    /**
     * @return the host-match weight
     */
    public double getHostMatchWeight() {
        return this.hostMatchLevel.getWeight();
    }

    /**
     * @return the evidence level
     */
    public int getEvidenceLevel() {
        return this.evidenceLevel;
    }

    /**
     * @return the evidence weight
     */
    public double getEvidenceWeight() {
        return this.evidenceWeight;
    }

    /**
     * @return the final score
     */
    public double getFinalScore() {
        return this.finalScore;
    }

    @Override
    public String toString() {
        return String.format("%s -> %s (%.1f)", this.getDisplayName(), this.getFunction(), this.finalScore);
    }

}

/**
 *
 */
package org.theseed.symbionts.scoring;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.theseed.symbionts.abundance.AbundanceRow;
import org.theseed.symbionts.evidence.EvidenceClassifier;
import org.theseed.symbionts.host.HostContextResolver;
import org.theseed.symbionts.host.HostMatchLevel;
import org.theseed.symbionts.taxonomy.MatchResult;

/**
 * This object scores individual taxonomic matches and rolls the scored candidates up into
 * per-function summaries.  It holds no state between calls other than its weighting components,
 * so every summary is recomputed from scratch.
 *
 */
public class ScoreAggregator {

    // FIELDS
    /** multiplier for the base score */
    public static final double SCORE_SCALE = 100.0;
    /** host-match weighting component */
    private final HostContextResolver hostResolver;
    /** evidence weighting component */
    private final EvidenceClassifier evidenceClassifier;
    /** probability estimator */
    private final ProbabilityEstimator estimator;

    /**
     * This class accumulates the candidates for a single function.
     */
    private static class FunctionAccumulator {

        /** function tag */
        private final String function;
        /** candidates supporting the function */
        private final List<ScoredCandidate> candidates;
        /** rows already counted toward the relative abundance */
        private final Set<AbundanceRow> rowsSeen;
        /** distinct contributing taxon labels */
        private final Set<String> taxa;
        /** total relative abundance */
        private double totalPct;

        private FunctionAccumulator(String function) {
            this.function = function;
            this.candidates = new ArrayList<ScoredCandidate>();
            this.rowsSeen = Collections.newSetFromMap(new IdentityHashMap<AbundanceRow, Boolean>());
            this.taxa = new TreeSet<String>();
            this.totalPct = 0.0;
        }

        /**
         * Add a candidate to this function.
         *
         * @param candidate		candidate to add
         */
        private void add(ScoredCandidate candidate) {
            this.candidates.add(candidate);
            if (this.rowsSeen.add(candidate.getMatch().getRow()))
                this.totalPct += candidate.getRelativeAbundancePct();
            this.taxa.add(candidate.getTaxonLabel());
        }

        /**
         * @return the summary of this function
         *
         * @param estimator		probability estimator to use
         */
        private FunctionSummary summarize(ProbabilityEstimator estimator) {
            double scoreSum = 0.0;
            double confSum = 0.0;
            double hostSum = 0.0;
            double evidenceSum = 0.0;
            ScoredCandidate dominant = null;
            for (ScoredCandidate candidate : this.candidates) {
                scoreSum += candidate.getFinalScore();
                confSum += candidate.getConfidence();
                hostSum += candidate.getHostMatchWeight();
                evidenceSum += candidate.getEvidenceWeight();
                if (dominant == null || candidate.compareTo(dominant) < 0)
                    dominant = candidate;
            }
            final int n = this.candidates.size();
            double meanConf = confSum / n;
            double meanHost = hostSum / n;
            double meanEvidence = evidenceSum / n;
            int taxaCount = this.taxa.size();
            double probability = estimator.estimate(this.totalPct, meanConf, meanHost, meanEvidence, taxaCount);
            double share = (this.totalPct > 0.0 ? dominant.getRelativeAbundancePct() * 100.0 / this.totalPct : 0.0);
            return new FunctionSummary(this.function, scoreSum, this.totalPct, meanConf, meanHost, meanEvidence,
                    taxaCount, probability, dominant, share);
        }

    }

    /**
     * Construct a score aggregator.
     *
     * @param hostResolver			host-match weighting component
     * @param evidenceClassifier	evidence weighting component
     */
    public ScoreAggregator(HostContextResolver hostResolver, EvidenceClassifier evidenceClassifier) {
        this.hostResolver = hostResolver;
        this.evidenceClassifier = evidenceClassifier;
        this.estimator = new ProbabilityEstimator();
    }

    /**
     * @return the base score for a taxonomic weight and relative abundance
     *
     * @param taxonWeight	taxonomic confidence weight
     * @param pct			relative abundance (percent)
     */
    public static double baseScore(double taxonWeight, double pct) {
        return taxonWeight * Math.log10(pct + 1.0) * SCORE_SCALE;
    }

    /**
     * Score a single taxonomic match.
     *
     * @param match		taxonomic match to score
     * @param pct		relative abundance of the matched row (percent)
     *
     * @return the scored candidate
     */
    public ScoredCandidate score(MatchResult match, double pct) {
        double base = baseScore(match.getWeight(), pct);
        HostMatchLevel hostLevel = this.hostResolver.match(match.getRecord());
        int evidenceLevel = this.evidenceClassifier.levelOf(match.getRecord());
        double evidenceWeight = EvidenceClassifier.weightOf(evidenceLevel);
        return new ScoredCandidate(match, pct, base, hostLevel, evidenceLevel, evidenceWeight);
    }

    /**
     * Summarize a collection of scored candidates by function.
     *
     * @param candidates	scored candidates to summarize
     *
     * @return the function summaries, sorted from highest final score sum to lowest
     */
    public List<FunctionSummary> summarize(Collection<ScoredCandidate> candidates) {
        Map<String, FunctionAccumulator> accumulators = new LinkedHashMap<String, FunctionAccumulator>();
        for (ScoredCandidate candidate : candidates) {
            if (candidate.getMatch().getLevel().isScored())
                accumulators.computeIfAbsent(candidate.getFunction(), x -> new FunctionAccumulator(x)).add(candidate);
        }
        List<FunctionSummary> retVal = new ArrayList<FunctionSummary>(accumulators.size());
        for (FunctionAccumulator accumulator : accumulators.values())
            retVal.add(accumulator.summarize(this.estimator));
        Collections.sort(retVal);
        return retVal;
    }

    /**
     * Sort scored candidates into report order:  grouped by function in the order of the
     * function summaries, and within each function in candidate order.
     *
     * @param candidates	scored candidates to sort
     * @param summaries		function summaries in report order
     *
     * @return the sorted candidates
     */
    public static List<ScoredCandidate> sortDetails(Collection<ScoredCandidate> candidates,
            List<FunctionSummary> summaries) {
        Map<String, List<ScoredCandidate>> groups = new LinkedHashMap<String, List<ScoredCandidate>>();
        for (FunctionSummary summary : summaries)
            groups.put(summary.getFunction(), new ArrayList<ScoredCandidate>());
        for (ScoredCandidate candidate : candidates) {
            List<ScoredCandidate> group = groups.get(candidate.getFunction());
            if (group != null)
                group.add(candidate);
        }
        List<ScoredCandidate> retVal = new ArrayList<ScoredCandidate>(candidates.size());
        for (List<ScoredCandidate> group : groups.values()) {
            Collections.sort(group);
            retVal.addAll(group);
        }
        return retVal;
    }

}

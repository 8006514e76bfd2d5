/**
 *
 */
package org.theseed.symbionts.scoring;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.symbionts.abundance.AbundanceRow;
import org.theseed.symbionts.abundance.AbundanceTable;
import org.theseed.symbionts.evidence.EvidenceClassifier;
import org.theseed.symbionts.host.HostContextResolver;
import org.theseed.symbionts.records.IRecordStore;
import org.theseed.symbionts.taxonomy.MatchResult;
import org.theseed.symbionts.taxonomy.TaxonomyMatcher;

/**
 * This is the prediction engine.  Each abundance row is matched against the reference records,
 * each match is scored, and the scores are summarized by function.  The record store and host
 * context are read-only, so a single predictor can be applied to any number of abundance tables.
 *
 */
public class SymbiontPredictor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(SymbiontPredictor.class);
    /** taxonomy matcher */
    private final TaxonomyMatcher matcher;
    /** host context */
    private final HostContextResolver hostResolver;
    /** evidence classifier */
    private final EvidenceClassifier evidenceClassifier;

    /**
     * Construct a predictor.
     *
     * @param store					reference record store
     * @param hostResolver			host context, or NULL for a general run
     * @param evidenceClassifier	evidence classifier
     */
    public SymbiontPredictor(IRecordStore store, HostContextResolver hostResolver,
            EvidenceClassifier evidenceClassifier) {
        this.matcher = new TaxonomyMatcher(store);
        this.hostResolver = (hostResolver == null ? HostContextResolver.neutral() : hostResolver);
        this.evidenceClassifier = evidenceClassifier;
    }

    /**
     * Predict the functions of the symbionts in an abundance table.
     *
     * @param table		abundance table to process
     *
     * @return the prediction result
     */
    public PredictionResult predict(AbundanceTable table) {
        List<String> warnings = new ArrayList<String>();
        if (this.hostResolver.getWarning() != null)
            warnings.add(this.hostResolver.getWarning());
        ScoreAggregator aggregator = new ScoreAggregator(this.hostResolver, this.evidenceClassifier);
        List<ScoredCandidate> candidates = new ArrayList<ScoredCandidate>();
        int mapped = 0;
        int skipped = 0;
        for (AbundanceRow row : table) {
            if (TaxonomyMatcher.isMalformed(row)) {
                String message = "Taxonomy label \"" + row.getTaxonLabel() + "\" could not be parsed:  row treated as unmatched.";
                log.warn(message);
                warnings.add(message);
            } else if (row.getAbundance() <= 0.0)
                skipped++;
            else {
                List<MatchResult> matches = this.matcher.match(row);
                if (! matches.isEmpty()) {
                    mapped++;
                    double pct = table.getRelativePct(row);
                    for (MatchResult match : matches)
                        candidates.add(aggregator.score(match, pct));
                }
            }
        }
        log.info("{} of {} abundance rows matched reference records ({} zero-abundance rows skipped).",
                mapped, table.size(), skipped);
        List<FunctionSummary> summaries = aggregator.summarize(candidates);
        List<ScoredCandidate> details = ScoreAggregator.sortDetails(candidates, summaries);
        log.info("{} candidates scored for {} functions.", details.size(), summaries.size());
        PredictionResult retVal = new PredictionResult(summaries, details, this.hostResolver.getProfile(),
                table.size(), mapped, table.getTotal());
        retVal.addWarnings(warnings);
        return retVal;
    }

}

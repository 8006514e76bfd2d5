/**
 *
 */
package org.theseed.symbionts.scoring;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.theseed.symbionts.abundance.AbundanceRow;
import org.theseed.symbionts.evidence.EvidenceClassifier;
import org.theseed.symbionts.host.FamilyDerivation;
import org.theseed.symbionts.host.HostContextResolver;
import org.theseed.symbionts.host.HostMatchLevel;
import org.theseed.symbionts.host.HostProfile;
import org.theseed.symbionts.records.ReferenceRecord;
import org.theseed.symbionts.taxonomy.MatchResult;
import org.theseed.symbionts.taxonomy.TaxonMatchLevel;

/**
 *
 */
class TestScoring {

    private static final HostProfile PEA_APHID = new HostProfile("Acyrthosiphon pisum", "Hemiptera", "Aphididae",
            "Acyrthosiphon", "Acyrthosiphon pisum");

    /**
     * @return a match between a new abundance row and a new reference record
     *
     * @param label		taxon label
     * @param level		taxonomic match level
     * @param host		record host
     * @param function	record function
     * @param evidence	record evidence level
     */
    private static MatchResult match(String label, TaxonMatchLevel level, String host, String function, int evidence) {
        AbundanceRow row = new AbundanceRow(label, 1.0);
        ReferenceRecord record = new ReferenceRecord.Builder(label + "/" + function).taxonLabel(label).host(host)
                .function(function).hostOrder("Diptera").hostFamily("Glossinidae").evidenceLevel(evidence).build();
        return new MatchResult(row, record, level);
    }

    @Test
    void testCandidateScores() {
        HostContextResolver resolver = new HostContextResolver(PEA_APHID, null, FamilyDerivation.NONE);
        ScoreAggregator aggregator = new ScoreAggregator(resolver, new EvidenceClassifier());
        // Exact species and host, top evidence.
        ScoredCandidate a = aggregator.score(match("Buchnera aphidicola", TaxonMatchLevel.SPECIES,
                "Acyrthosiphon pisum", "Amino acid provisioning", 5), 10.0);
        assertThat(a.getBaseScore(), closeTo(104.1, 0.25));
        assertThat(a.getHostMatchLevel(), equalTo(HostMatchLevel.SPECIES));
        assertThat(a.getHostMatchWeight(), closeTo(1.5, 1e-9));
        assertThat(a.getEvidenceWeight(), closeTo(1.5, 1e-9));
        assertThat(a.getFinalScore(), closeTo(234.2, 0.25));
        assertThat(a.getDisplayName(), equalTo("Buchnera aphidicola"));
        // Genus match, general host, level 3.
        ScoredCandidate b = aggregator.score(match("Wolbachia sp.", TaxonMatchLevel.GENUS,
                "General", "Cytoplasmic incompatibility", 3), 5.0);
        assertThat(b.getBaseScore(), closeTo(46.9, 0.25));
        assertThat(b.getHostMatchLevel(), equalTo(HostMatchLevel.GENERAL));
        assertThat(b.getEvidenceWeight(), closeTo(1.15, 1e-9));
        assertThat(b.getFinalScore(), closeTo(53.9, 0.25));
        assertThat(b.getDisplayName(), equalTo("Wolbachia (sp.)"));
        // Genus match, host mismatch, level 2.
        ScoredCandidate c = aggregator.score(match("Sodalis praecaptivus", TaxonMatchLevel.GENUS,
                "Glossina morsitans", "Thiamine synthesis", 2), 2.0);
        assertThat(c.getBaseScore(), closeTo(28.7, 0.25));
        assertThat(c.getHostMatchLevel(), equalTo(HostMatchLevel.MISMATCH));
        assertThat(c.getFinalScore(), closeTo(23.0, 0.25));
        // Zero abundance gives a zero score.
        assertThat(ScoreAggregator.baseScore(1.0, 0.0), closeTo(0.0, 1e-12));
        // Candidates sort from highest final score down.
        List<ScoredCandidate> sorted = new ArrayList<ScoredCandidate>(Arrays.asList(c, a, b));
        sorted.sort(null);
        assertThat(sorted, contains(a, b, c));
    }

    @Test
    void testSummaries() {
        ScoreAggregator aggregator = new ScoreAggregator(HostContextResolver.neutral(), new EvidenceClassifier());
        MatchResult m1 = match("g__Buchnera;s__aphidicola", TaxonMatchLevel.SPECIES, "Acyrthosiphon pisum", "Vitamin provisioning", 4);
        MatchResult m2 = match("g__Serratia;s__symbiotica", TaxonMatchLevel.SPECIES, "Acyrthosiphon kondoi", "Vitamin provisioning", 2);
        // Two records for the same row and function count the row once.
        MatchResult m3 = new MatchResult(m2.getRow(), new ReferenceRecord.Builder("dup").taxonLabel("g__Serratia;s__symbiotica")
                .host("General").function("Vitamin provisioning").evidenceLevel(3).build(), TaxonMatchLevel.SPECIES);
        MatchResult m4 = match("g__Wolbachia", TaxonMatchLevel.GENUS, "General", "Cytoplasmic incompatibility", 3);
        List<ScoredCandidate> candidates = Arrays.asList(aggregator.score(m2, 6.0), aggregator.score(m1, 10.0),
                aggregator.score(m3, 6.0), aggregator.score(m4, 5.0));
        List<FunctionSummary> summaries = aggregator.summarize(candidates);
        assertThat(summaries.size(), equalTo(2));
        FunctionSummary vitamin = summaries.get(0);
        assertThat(vitamin.getFunction(), equalTo("Vitamin provisioning"));
        double expectedSum = candidates.get(0).getFinalScore() + candidates.get(1).getFinalScore()
                + candidates.get(2).getFinalScore();
        assertThat(vitamin.getFinalScoreSum(), closeTo(expectedSum, 1e-9));
        assertThat(vitamin.getTotalRelativeAbundancePct(), closeTo(16.0, 1e-9));
        assertThat(vitamin.getTaxaCount(), equalTo(2));
        assertThat(vitamin.getMeanConfidence(), closeTo(1.0, 1e-9));
        assertThat(vitamin.getMeanHostMatch(), closeTo(1.0, 1e-9));
        assertThat(vitamin.getMeanEvidenceWeight(), closeTo((1.3 + 1.0 + 1.15) / 3, 1e-9));
        assertThat(vitamin.getDominantContributor(), equalTo("g__Buchnera;s__aphidicola"));
        assertThat(vitamin.getDominantShare(), closeTo(62.5, 1e-9));
        assertThat(vitamin.getDominantDescription(), equalTo("Buchnera aphidicola (62.5% contribution)"));
        FunctionSummary ci = summaries.get(1);
        assertThat(ci.getFunction(), equalTo("Cytoplasmic incompatibility"));
        assertThat(ci.getTaxaCount(), equalTo(1));
        assertThat(ci.getMeanConfidence(), closeTo(0.6, 1e-9));
        assertThat(ci.getDominantShare(), closeTo(100.0, 1e-9));
        for (FunctionSummary summary : summaries) {
            assertThat(summary.getProbability(), greaterThanOrEqualTo(0.0));
            assertThat(summary.getProbability(), lessThanOrEqualTo(1.0));
        }
        // Details are grouped by function in summary order.
        List<ScoredCandidate> details = ScoreAggregator.sortDetails(candidates, summaries);
        assertThat(details.size(), equalTo(4));
        assertThat(details.get(0).getTaxonLabel(), equalTo("g__Buchnera;s__aphidicola"));
        assertThat(details.get(1).getFunction(), equalTo("Vitamin provisioning"));
        assertThat(details.get(2).getFunction(), equalTo("Vitamin provisioning"));
        assertThat(details.get(1).getFinalScore(), greaterThanOrEqualTo(details.get(2).getFinalScore()));
        assertThat(details.get(3).getFunction(), equalTo("Cytoplasmic incompatibility"));
        assertThat(aggregator.summarize(new ArrayList<ScoredCandidate>()), empty());
    }

    @Test
    void testProbability() {
        ProbabilityEstimator estimator = new ProbabilityEstimator();
        assertThat(estimator.baseProbability(5.0), closeTo(0.5, 1e-9));
        // Neutral host and evidence weights each scale the result by 0.95.
        assertThat(estimator.estimate(10.0, 1.0, 1.0, 1.0, 1), closeTo(0.8239, 0.001));
        assertThat(estimator.estimate(10.0, 1.0, 1.5, 1.5, 1), closeTo(0.9129, 0.001));
        assertThat(estimator.estimate(100.0, 1.0, 1.5, 1.5, 50), equalTo(1.0));
        double low = estimator.estimate(0.0, 0.0, 0.8, 0.8, 1);
        assertThat(low, greaterThan(0.0));
        assertThat(low, closeTo(0.1441, 0.001));
        // Probability never decreases with abundance.
        double[][] settings = new double[][] { { 0.6, 0.8, 0.8 }, { 1.0, 1.0, 1.0 }, { 1.0, 1.5, 1.5 }, { 0.0, 1.2, 1.15 } };
        for (double[] setting : settings) {
            double prev = -1.0;
            for (double pct = 0.0; pct <= 100.0; pct += 0.5) {
                double prob = estimator.estimate(pct, setting[0], setting[1], setting[2], 3);
                assertThat(prob, greaterThanOrEqualTo(prev));
                assertThat(prob, lessThanOrEqualTo(1.0));
                assertThat(prob, greaterThanOrEqualTo(0.0));
                prev = prob;
            }
        }
        assertThrows(IllegalStateException.class, () -> estimator.estimate(Double.NaN, 1.0, 1.0, 1.0, 1));
        assertThrows(IllegalStateException.class, () -> estimator.estimate(10.0, Double.POSITIVE_INFINITY, 1.0, 1.0, 1));
    }

}

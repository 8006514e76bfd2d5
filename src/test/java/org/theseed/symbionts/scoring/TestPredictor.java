/**
 *
 */
package org.theseed.symbionts.scoring;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.theseed.symbionts.abundance.AbundanceTable;
import org.theseed.symbionts.evidence.EvidenceClassifier;
import org.theseed.symbionts.host.FamilyDerivation;
import org.theseed.symbionts.host.HostContextResolver;
import org.theseed.symbionts.host.HostMatchLevel;
import org.theseed.symbionts.host.NodeTableHostTaxonomy;
import org.theseed.symbionts.records.RecordStore;
import org.theseed.symbionts.taxonomy.TaxonMatchLevel;
import org.theseed.symbionts.utils.ParseFailureException;

/**
 *
 */
class TestPredictor {

    private static RecordStore store;
    private static AbundanceTable table;
    private static NodeTableHostTaxonomy taxonomy;

    @BeforeAll
    static void setup() throws IOException, ParseFailureException {
        store = RecordStore.load(new File("data", "records.tsv"));
        table = AbundanceTable.load(new File("data", "abundance.tsv"));
        taxonomy = new NodeTableHostTaxonomy(new File("data", "insect_nodes.tsv"));
    }

    /**
     * @return the prediction result for the specified host
     *
     * @param host		host name, or NULL for none
     */
    private static PredictionResult predict(String host) {
        HostContextResolver resolver = HostContextResolver.create(host, taxonomy, FamilyDerivation.NONE);
        SymbiontPredictor predictor = new SymbiontPredictor(store, resolver, new EvidenceClassifier());
        return predictor.predict(table);
    }

    /**
     * @return a string describing all the scores in a prediction result
     *
     * @param result	prediction result to describe
     */
    private static String describe(PredictionResult result) {
        String summaries = result.getSummaries().stream().map(x -> String.format("%s=%.6f/%.6f/%s", x.getFunction(),
                x.getFinalScoreSum(), x.getProbability(), x.getDominantContributor())).collect(Collectors.joining(","));
        String details = result.getDetails().stream().map(x -> String.format("%s:%s=%.6f", x.getTaxonLabel(),
                x.getFunction(), x.getFinalScore())).collect(Collectors.joining(","));
        return summaries + "|" + details;
    }

    @Test
    void testHostSpecific() {
        PredictionResult result = predict("Acyrthosiphon pisum");
        assertThat(result.getMode(), equalTo(PredictionResult.HOST_SPECIFIC_MODE));
        assertThat(result.getHostName(), equalTo("Acyrthosiphon pisum"));
        assertThat(result.getTotalRows(), equalTo(9));
        assertThat(result.getMappedRows(), equalTo(6));
        assertThat(result.getUnmappedRows(), equalTo(3));
        assertThat(result.getTotalReads(), closeTo(100.0, 1e-9));
        assertThat(result.getFunctionCount(), equalTo(6));
        // The only warning is for the unparseable row.
        assertThat(result.getWarnings().size(), equalTo(1));
        assertThat(result.getWarnings().get(0), containsString("unclassified"));
        List<String> functions = result.getSummaries().stream().map(x -> x.getFunction()).collect(Collectors.toList());
        assertThat(functions, contains("Vitamin provisioning", "Amino acid provisioning", "Parasitoid defense",
                "Cytoplasmic incompatibility", "Carotenoid synthesis", "Thiamine synthesis"));
        FunctionSummary vitamin = result.getSummary("Vitamin provisioning");
        assertThat(vitamin.getFinalScoreSum(), closeTo(312.9, 0.25));
        assertThat(vitamin.getTotalRelativeAbundancePct(), closeTo(16.0, 1e-9));
        assertThat(vitamin.getTaxaCount(), equalTo(2));
        assertThat(vitamin.getMeanHostMatch(), closeTo(1.4, 1e-9));
        assertThat(vitamin.getMeanEvidenceWeight(), closeTo(1.15, 1e-9));
        assertThat(vitamin.getProbability(), closeTo(0.99995, 1e-4));
        assertThat(vitamin.getDominantCandidate().getDisplayName(), equalTo("Buchnera aphidicola"));
        assertThat(vitamin.getDominantShare(), closeTo(62.5, 1e-9));
        FunctionSummary amino = result.getSummary("Amino acid provisioning");
        assertThat(amino.getFinalScoreSum(), closeTo(234.3, 0.25));
        assertThat(amino.getTotalRelativeAbundancePct(), closeTo(10.0, 1e-9));
        assertThat(amino.getProbability(), closeTo(0.913, 0.001));
        assertThat(result.getSummary("Parasitoid defense").getFinalScoreSum(), closeTo(93.9, 0.25));
        assertThat(result.getSummary("Cytoplasmic incompatibility").getFinalScoreSum(), closeTo(53.7, 0.25));
        assertThat(result.getSummary("Carotenoid synthesis").getFinalScoreSum(), closeTo(36.9, 0.25));
        assertThat(result.getSummary("Thiamine synthesis").getFinalScoreSum(), closeTo(22.9, 0.25));
        assertThat(result.getSummary("Nitrogen fixation"), nullValue());
        // Check the detail rows.
        List<ScoredCandidate> details = result.getDetails();
        assertThat(details.size(), equalTo(7));
        ScoredCandidate candidate = details.get(0);
        assertThat(candidate.getDisplayName(), equalTo("Buchnera aphidicola"));
        assertThat(candidate.getFunction(), equalTo("Vitamin provisioning"));
        assertThat(candidate.getEvidenceLevel(), equalTo(4));
        assertThat(candidate.getHostMatchLevel(), equalTo(HostMatchLevel.SPECIES));
        candidate = details.get(1);
        assertThat(candidate.getDisplayName(), equalTo("Serratia symbiotica"));
        assertThat(candidate.getEvidenceLevel(), equalTo(2));
        assertThat(candidate.getHostMatchLevel(), equalTo(HostMatchLevel.GENUS));
        candidate = details.get(3);
        assertThat(candidate.getFunction(), equalTo("Parasitoid defense"));
        assertThat(candidate.getHostMatchLevel(), equalTo(HostMatchLevel.FAMILY));
        candidate = details.get(4);
        assertThat(candidate.getDisplayName(), equalTo("Wolbachia (sp.)"));
        assertThat(candidate.getMatch().getLevel(), equalTo(TaxonMatchLevel.GENUS));
        assertThat(candidate.getHostMatchLevel(), equalTo(HostMatchLevel.GENERAL));
        candidate = details.get(5);
        assertThat(candidate.getDisplayName(), equalTo("Portiera (sp.)"));
        assertThat(candidate.getEvidenceLevel(), equalTo(1));
        assertThat(candidate.getHostMatchLevel(), equalTo(HostMatchLevel.ORDER));
        candidate = details.get(6);
        assertThat(candidate.getDisplayName(), equalTo("Sodalis (sp.)"));
        assertThat(candidate.getHostMatchLevel(), equalTo(HostMatchLevel.MISMATCH));
        for (ScoredCandidate other : details) {
            assertThat(other.getHostMatchWeight(), allOf(greaterThanOrEqualTo(0.8), lessThanOrEqualTo(1.5)));
            assertThat(other.getEvidenceWeight(), allOf(greaterThanOrEqualTo(0.8), lessThanOrEqualTo(1.5)));
        }
        for (FunctionSummary summary : result.getSummaries())
            assertThat(summary.getProbability(), allOf(greaterThanOrEqualTo(0.0), lessThanOrEqualTo(1.0)));
    }

    @Test
    void testIdempotence() {
        String first = describe(predict("Acyrthosiphon pisum"));
        String second = describe(predict("Acyrthosiphon pisum"));
        assertThat(second, equalTo(first));
    }

    @Test
    void testNoHost() {
        PredictionResult general = predict(null);
        assertThat(general.getMode(), equalTo(PredictionResult.GENERAL_MODE));
        assertThat(general.getHostName(), equalTo("None"));
        for (ScoredCandidate candidate : general.getDetails()) {
            assertThat(candidate.getHostMatchLevel(), equalTo(HostMatchLevel.GENERAL));
            assertThat(candidate.getHostMatchWeight(), equalTo(1.0));
        }
        // An unresolvable host gives the same scores plus a warning.
        PredictionResult unknown = predict("Nilaparvata lugens");
        assertThat(unknown.getMode(), equalTo(PredictionResult.GENERAL_MODE));
        assertThat(describe(unknown), equalTo(describe(general)));
        assertThat(unknown.getWarnings().size(), equalTo(general.getWarnings().size() + 1));
        // A null resolver is the same as no host.
        SymbiontPredictor predictor = new SymbiontPredictor(store, null, new EvidenceClassifier());
        assertThat(describe(predictor.predict(table)), equalTo(describe(general)));
        // The host-specific run scores differently.
        assertThat(describe(predict("Acyrthosiphon pisum")), not(equalTo(describe(general))));
    }

}

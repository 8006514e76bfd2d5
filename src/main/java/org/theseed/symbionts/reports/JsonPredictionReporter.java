/**
 *
 */
package org.theseed.symbionts.reports;

import java.io.File;
import java.io.IOException;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.theseed.symbionts.records.ReferenceRecord;
import org.theseed.symbionts.scoring.FunctionSummary;
import org.theseed.symbionts.scoring.PredictionResult;
import org.theseed.symbionts.scoring.ScoredCandidate;

import com.github.cliftonlabs.json_simple.JsonArray;
import com.github.cliftonlabs.json_simple.JsonObject;
import com.github.cliftonlabs.json_simple.Jsoner;

/**
 * This class produces the prediction report as a single JSON document with a ".json" suffix.
 * The document has four members:  "metadata" (host and mode), "statistics" (row counts),
 * "functions" (the function summaries) and "symbionts" (the scored candidates).
 *
 */
public class JsonPredictionReporter extends PredictionReporter {

    // FIELDS
    /** document being built */
    private JsonObject document;

    @Override
    protected void startReport(PredictionResult result) throws IOException {
        JsonObject metadata = new JsonObject().putChain("host", result.getHostName())
                .putChain("mode", result.getMode())
                .putChain("warnings", new JsonArray(result.getWarnings()));
        JsonObject statistics = new JsonObject().putChain("total_rows", result.getTotalRows())
                .putChain("mapped_rows", result.getMappedRows())
                .putChain("unmapped_rows", result.getUnmappedRows())
                .putChain("unique_functions", result.getFunctionCount())
                .putChain("total_reads", result.getTotalReads());
        this.document = new JsonObject().putChain("metadata", metadata).putChain("statistics", statistics);
    }

    @Override
    protected void writeFunctions(List<FunctionSummary> summaries) throws IOException {
        JsonArray functions = new JsonArray();
        for (FunctionSummary summary : summaries) {
            JsonObject dominant = new JsonObject().putChain("taxon", summary.getDominantContributor())
                    .putChain("name", summary.getDominantCandidate().getDisplayName())
                    .putChain("share_pct", summary.getDominantShare());
            functions.addChain(new JsonObject().putChain("function", summary.getFunction())
                    .putChain("final_score_sum", summary.getFinalScoreSum())
                    .putChain("total_relative_abundance_pct", summary.getTotalRelativeAbundancePct())
                    .putChain("mean_confidence", summary.getMeanConfidence())
                    .putChain("mean_host_match", summary.getMeanHostMatch())
                    .putChain("mean_evidence_weight", summary.getMeanEvidenceWeight())
                    .putChain("taxa_count", summary.getTaxaCount())
                    .putChain("probability", summary.getProbability())
                    .putChain("dominant_contributor", dominant));
        }
        this.document.put("functions", functions);
    }

    @Override
    protected void writeSymbionts(List<ScoredCandidate> details) throws IOException {
        JsonArray symbionts = new JsonArray();
        for (ScoredCandidate candidate : details) {
            ReferenceRecord record = candidate.getRecord();
            symbionts.addChain(new JsonObject().putChain("taxon", candidate.getTaxonLabel())
                    .putChain("name", candidate.getDisplayName())
                    .putChain("function", candidate.getFunction())
                    .putChain("final_score", candidate.getFinalScore())
                    .putChain("base_score", candidate.getBaseScore())
                    .putChain("host_match_level", candidate.getHostMatchLevel().toString())
                    .putChain("host_match_weight", candidate.getHostMatchWeight())
                    .putChain("evidence_level", candidate.getEvidenceLevel())
                    .putChain("evidence_weight", candidate.getEvidenceWeight())
                    .putChain("match_level", candidate.getMatch().getLevel().toString())
                    .putChain("relative_abundance_pct", candidate.getRelativeAbundancePct())
                    .putChain("record_id", record.getId())
                    .putChain("record_host", record.getHost())
                    .putChain("description", shorten(record.getDescription()))
                    .putChain("evidence", record.getEvidenceCitation()));
        }
        this.document.put("symbionts", symbionts);
    }

    @Override
    protected void endReport(PredictionResult result) throws IOException {
        File outFile = this.outputFile(".json");
        FileUtils.writeStringToFile(outFile, Jsoner.prettyPrint(this.document.toJson()), "UTF-8");
    }

    @Override
    protected void finish() {
    }

}

/**
 *
 */
package org.theseed.symbionts.reports;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;

import org.theseed.symbionts.records.ReferenceRecord;
import org.theseed.symbionts.scoring.FunctionSummary;
import org.theseed.symbionts.scoring.PredictionResult;
import org.theseed.symbionts.scoring.ScoredCandidate;

/**
 * Here the reports are produced in tab-delimited files.  The function summaries go in
 * "_functions.tsv" and the scored candidates in "_potential_symbionts.tsv".  Both files have an
 * extension of ".tsv" so they can be opened in Excel on the Mac.
 *
 */
public class TextPredictionReporter extends PredictionReporter {

    private static final String FUNCTION_HEADER = "Function\tFinal_Score_Sum\tTotal_RA_Pct\tMean_Confidence\t"
            + "Mean_Host_Match\tMean_Evidence_Weight\tTaxa_Count\tProbability\tDominant_Contributor";
    private static final String FUNCTION_FORMAT = "%s\t%.1f\t%.3f\t%.2f\t%.2f\t%.2f\t%d\t%.3f\t%s%n";
    private static final String SYMBIONT_HEADER = "Symbiont_Taxon\tPredicted_Function\tFinal_Score\tBase_Score\t"
            + "Host_Match_Weight\tHost_Match_Level\tEvidence_Level\tEvidence_Weight\tMatch_Level\t"
            + "Relative_Abundance_Pct\tDB_Host_Context\tDB_Description\tDB_Evidence";
    private static final String SYMBIONT_FORMAT = "%s\t%s\t%.1f\t%.1f\t%.2f\t%s\t%d\t%.2f\t%s\t%.4f\t%s\t%s\t%s%n";

    // FIELDS
    /** output stream for the function report */
    private PrintWriter functionStream;
    /** output stream for the symbiont report */
    private PrintWriter symbiontStream;

    @Override
    protected void startReport(PredictionResult result) throws IOException {
        File functionFile = this.outputFile("_functions.tsv");
        this.functionStream = new PrintWriter(functionFile, "UTF-8");
        File symbiontFile = this.outputFile("_potential_symbionts.tsv");
        this.symbiontStream = new PrintWriter(symbiontFile, "UTF-8");
    }

    @Override
    protected void writeFunctions(List<FunctionSummary> summaries) throws IOException {
        this.functionStream.println(FUNCTION_HEADER);
        for (FunctionSummary summary : summaries)
            this.functionStream.format(FUNCTION_FORMAT, summary.getFunction(), summary.getFinalScoreSum(),
                    summary.getTotalRelativeAbundancePct(), summary.getMeanConfidence(), summary.getMeanHostMatch(),
                    summary.getMeanEvidenceWeight(), summary.getTaxaCount(), summary.getProbability(),
                    summary.getDominantDescription());
    }

    @Override
    protected void writeSymbionts(List<ScoredCandidate> details) throws IOException {
        this.symbiontStream.println(SYMBIONT_HEADER);
        for (ScoredCandidate candidate : details) {
            ReferenceRecord record = candidate.getRecord();
            this.symbiontStream.format(SYMBIONT_FORMAT, candidate.getDisplayName(), candidate.getFunction(),
                    candidate.getFinalScore(), candidate.getBaseScore(), candidate.getHostMatchWeight(),
                    candidate.getHostMatchLevel(), candidate.getEvidenceLevel(), candidate.getEvidenceWeight(),
                    candidate.getMatch().getLevel(), candidate.getRelativeAbundancePct(), record.getHost(),
                    clean(shorten(record.getDescription())), clean(record.getEvidenceCitation()));
        }
    }

    @Override
    protected void endReport(PredictionResult result) throws IOException {
    }

    @Override
    protected void finish() {
        if (this.functionStream != null)
            this.functionStream.close();
        if (this.symbiontStream != null)
            this.symbiontStream.close();
    }

    /**
     * @return a string with tabs and line breaks converted to spaces
     *
     * @param text	string to convert
     */
    private static String clean(String text) {
        return text.replaceAll("[\\t\\r\\n]", " ");
    }

}

/**
 *
 */
package org.theseed.symbionts.reports;

import static j2html.TagCreator.*;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.theseed.symbionts.records.ReferenceRecord;
import org.theseed.symbionts.scoring.FunctionSummary;
import org.theseed.symbionts.scoring.PredictionResult;
import org.theseed.symbionts.scoring.ScoredCandidate;

import j2html.tags.DomContent;

/**
 * This class produces the prediction report as a single web page with a ".html" suffix.  The
 * page contains the run statistics, the function table, and the candidate table.
 *
 */
public class HtmlPredictionReporter extends PredictionReporter {

    // FIELDS
    /** sections of the web page */
    private List<DomContent> sections;

    /** probability below which a function is highlighted as weak */
    public static final double WEAK_PROBABILITY = 0.5;

    @Override
    protected void startReport(PredictionResult result) throws IOException {
        this.sections = new ArrayList<DomContent>();
        this.sections.add(h1("Insect Symbiont Function Prediction"));
        List<DomContent> detailRows = new ArrayList<DomContent>();
        Html.detailRow(detailRows, "Host", td(result.getHostName()));
        Html.detailRow(detailRows, "Prediction Mode", td(result.getMode()));
        Html.detailRow(detailRows, "Abundance Rows", Html.numCell(result.getTotalRows()));
        Html.detailRow(detailRows, "Mapped Rows", Html.numCell(result.getMappedRows()));
        Html.detailRow(detailRows, "Unmapped Rows", Html.numCell(result.getUnmappedRows()));
        Html.detailRow(detailRows, "Functions Predicted", Html.numCell(result.getFunctionCount()));
        Html.detailRow(detailRows, "Total Reads", Html.numCell(result.getTotalReads(), 0));
        this.sections.add(Html.formatTable("Run Summary", detailRows));
        if (! result.getWarnings().isEmpty())
            this.sections.add(join(h2("Warnings"), ul(each(result.getWarnings(), x -> li(x)))));
    }

    @Override
    protected void writeFunctions(List<FunctionSummary> summaries) throws IOException {
        List<DomContent> rows = new ArrayList<DomContent>(summaries.size() + 1);
        rows.add(tr(th("Function"), th("Score").withClass("num"), th("Abundance %").withClass("num"),
                th("Mean Confidence").withClass("num"), th("Mean Host Match").withClass("num"),
                th("Mean Evidence").withClass("num"), th("Taxa").withClass("num"),
                th("Probability").withClass("num"), th("Dominant Contributor")));
        for (FunctionSummary summary : summaries) {
            boolean strong = (summary.getProbability() >= WEAK_PROBABILITY);
            rows.add(tr(td(summary.getFunction()), Html.numCell(summary.getFinalScoreSum(), 1),
                    Html.numCell(summary.getTotalRelativeAbundancePct(), 3),
                    Html.numCell(summary.getMeanConfidence(), 2), Html.numCell(summary.getMeanHostMatch(), 2),
                    Html.numCell(summary.getMeanEvidenceWeight(), 2), Html.numCell(summary.getTaxaCount()),
                    Html.colorCell(strong, summary.getProbability(), 3), td(summary.getDominantDescription())));
        }
        this.sections.add(Html.formatTable("Predicted Functions", rows));
    }

    @Override
    protected void writeSymbionts(List<ScoredCandidate> details) throws IOException {
        List<DomContent> rows = new ArrayList<DomContent>(details.size() + 1);
        rows.add(tr(th("Symbiont"), th("Function"), th("Final Score").withClass("num"),
                th("Base Score").withClass("num"), th("Host Match"), th("Host Weight").withClass("num"),
                th("Evidence Level").withClass("num"), th("Evidence Weight").withClass("num"),
                th("Match Level"), th("Abundance %").withClass("num"), th("Record Host"),
                th("Description"), th("Evidence")));
        for (ScoredCandidate candidate : details) {
            ReferenceRecord record = candidate.getRecord();
            rows.add(tr(td(candidate.getDisplayName()), td(candidate.getFunction()),
                    Html.numCell(candidate.getFinalScore(), 1), Html.numCell(candidate.getBaseScore(), 1),
                    td(candidate.getHostMatchLevel().toString()), Html.numCell(candidate.getHostMatchWeight(), 2),
                    Html.numCell(candidate.getEvidenceLevel()), Html.numCell(candidate.getEvidenceWeight(), 2),
                    td(candidate.getMatch().getLevel().toString()),
                    Html.numCell(candidate.getRelativeAbundancePct(), 4), td(record.getHost()),
                    Html.textCell(shorten(record.getDescription())), Html.textCell(record.getEvidenceCitation())));
        }
        this.sections.add(Html.formatTable("Potential Symbionts", rows));
    }

    @Override
    protected void endReport(PredictionResult result) throws IOException {
        String page = Html.page("Symbiont Function Prediction", this.sections.toArray(new DomContent[0]));
        File outFile = this.outputFile(".html");
        FileUtils.writeStringToFile(outFile, page, "UTF-8");
    }

    @Override
    protected void finish() {
    }

}

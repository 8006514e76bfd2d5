/**
 *
 */
package org.theseed.symbionts.reports;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.theseed.symbionts.scoring.FunctionSummary;
import org.theseed.symbionts.scoring.PredictionResult;
import org.theseed.symbionts.scoring.ScoredCandidate;

/**
 * This is the base class for prediction report writers.  Each writer is created for an output
 * prefix, and the files it produces are named by adding a suffix to the prefix.  The client calls
 * "write" once for each prediction result and then closes the reporter.
 *
 */
public abstract class PredictionReporter implements AutoCloseable {

    // FIELDS
    /** output prefix (directory plus base name) */
    private File prefix;
    /** files written */
    private List<File> outputFiles;

    /** maximum length of a description in the reports */
    public static final int MAX_DESCRIPTION = 100;

    /**
     * output report format
     */
    public enum Type {
        /** tab-delimited text files */
        TEXT,
        /** a single HTML web page */
        HTML,
        /** a single JSON document */
        JSON
    }

    /**
     * Construct a reporter.
     */
    protected PredictionReporter() {
        this.prefix = null;
        this.outputFiles = new ArrayList<File>();
    }

    /**
     * Construct a report writer of the specified type.
     *
     * @param type		output format
     * @param prefix	output prefix
     *
     * @return a reporter object for the specified output
     */
    public static PredictionReporter create(Type type, File prefix) {
        PredictionReporter retVal;
        switch (type) {
        case TEXT -> retVal = new TextPredictionReporter();
        case HTML -> retVal = new HtmlPredictionReporter();
        case JSON -> retVal = new JsonPredictionReporter();
        default -> throw new IllegalArgumentException("Unsupported output format " + type + ".");
        }
        retVal.prefix = prefix;
        return retVal;
    }

    /**
     * Write a prediction result.
     *
     * @param result	prediction result to write
     *
     * @throws IOException
     */
    public void write(PredictionResult result) throws IOException {
        this.startReport(result);
        this.writeFunctions(result.getSummaries());
        this.writeSymbionts(result.getDetails());
        this.endReport(result);
    }

    /**
     * Start the report and write the run statistics.
     *
     * @param result	prediction result being written
     *
     * @throws IOException
     */
    protected abstract void startReport(PredictionResult result) throws IOException;

    /**
     * Write the function summaries.
     *
     * @param summaries		function summaries, highest score first
     *
     * @throws IOException
     */
    protected abstract void writeFunctions(List<FunctionSummary> summaries) throws IOException;

    /**
     * Write the scored candidates.
     *
     * @param details	scored candidates in report order
     *
     * @throws IOException
     */
    protected abstract void writeSymbionts(List<ScoredCandidate> details) throws IOException;

    /**
     * Finish the report.
     *
     * @param result	prediction result being written
     *
     * @throws IOException
     */
    protected abstract void endReport(PredictionResult result) throws IOException;

    /**
     * Release all resources held by this object.
     *
     * @throws IOException
     */
    protected abstract void finish() throws IOException;

    @Override
    public void close() {
        try {
            this.finish();
        } catch (IOException e) {
            throw new UncheckedIOException("Error closing prediction report.", e);
        }
    }

    /**
     * Compute the name of an output file and remember it.
     *
     * @param suffix	suffix to add to the output prefix
     *
     * @return the output file
     */
    protected File outputFile(String suffix) {
        File retVal = new File(this.prefix.getPath() + suffix);
        this.outputFiles.add(retVal);
        return retVal;
    }

    /**
     * @return the files written by this reporter
     */
    public List<File> getOutputFiles() {
        return this.outputFiles;
    }

    /**
     * @return a description shortened for display
     *
     * @param description	description to shorten
     */
    public static String shorten(String description) {
        String retVal = StringUtils.defaultString(description);
        if (retVal.length() > MAX_DESCRIPTION)
            retVal = retVal.substring(0, MAX_DESCRIPTION) + "...";
        return retVal;
    }

}

/**
 *
 */
package org.theseed.symbionts.scoring;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import org.theseed.symbionts.host.HostProfile;

/**
 * This object contains the output of a prediction run:  the function summaries, the scored
 * candidates in report order, the run statistics, and any warnings produced along the way.
 *
 */
public class PredictionResult {

    // FIELDS
    /** function summaries, highest score first */
    private final List<FunctionSummary> summaries;
    /** scored candidates in report order */
    private final List<ScoredCandidate> details;
    /** host profile used, or NULL if the run was general */
    private final HostProfile host;
    /** number of abundance rows */
    private final int totalRows;
    /** number of abundance rows with at least one match */
    private final int mappedRows;
    /** total abundance of the input table */
    private final double totalReads;
    /** warnings from the run */
    private final List<String> warnings;

    /** mode name for runs with a host */
    public static final String HOST_SPECIFIC_MODE = "host-specific";
    /** mode name for runs without a host */
    public static final String GENERAL_MODE = "general";

    /**
     * Construct a prediction result.
     *
     * @param summaries		function summaries, highest score first
     * @param details		scored candidates in report order
     * @param host			host profile used, or NULL if there was none
     * @param totalRows		number of abundance rows
     * @param mappedRows	number of abundance rows with at least one match
     * @param totalReads	total abundance of the input table
     */
    public PredictionResult(List<FunctionSummary> summaries, List<ScoredCandidate> details, HostProfile host,
            int totalRows, int mappedRows, double totalReads) {
        this.summaries = summaries;
        this.details = details;
        this.host = host;
        this.totalRows = totalRows;
        this.mappedRows = mappedRows;
        this.totalReads = totalReads;
        this.warnings = new ArrayList<String>();
    }

    /**
     * Add warnings to this result.
     *
     * @param messages	warning messages to add
     */
    public void addWarnings(Collection<String> messages) {
        this.warnings.addAll(messages);
    }

    /**
     * Add a warning to this result.
     *
     * @param message	warning message to add
     */
    public void addWarning(String message) {
        this.warnings.add(message);
    }

    /**
     * @return the function summaries, highest score first
     */
    public List<FunctionSummary> getSummaries() {
        return Collections.unmodifiableList(this.summaries);
    }

    /**
     * @return the scored candidates in report order
     */
    public List<ScoredCandidate> getDetails() {
        return Collections.unmodifiableList(this.details);
    }

    /**
     * @return the summary for the specified function, or NULL if the function was not predicted
     *
     * @param function	function of interest
     */
    public FunctionSummary getSummary(String function) {
        FunctionSummary retVal = null;
        for (FunctionSummary summary : this.summaries) {
            if (summary.getFunction().equals(function))
                retVal = summary;
        }
        return retVal;
    }

    /**
     * @return the host profile used, or NULL if the run was general
     */
    public HostProfile getHost() {
        return this.host;
    }

    /**
     * @return the name of the host used, or "None"
     */
    public String getHostName() {
        return (this.host == null ? "None" : this.host.getInputName());
    }

    /**
     * @return the prediction mode name
     */
    public String getMode() {
        return (this.host == null ? GENERAL_MODE : HOST_SPECIFIC_MODE);
    }

    /**
     * @return the number of abundance rows
     */
    public int getTotalRows() {
        return this.totalRows;
    }

    /**
     * @return the number of abundance rows with at least one match
     */
    public int getMappedRows() {
        return this.mappedRows;
    }

    /**
     * @return the number of abundance rows with no match
     */
    public int getUnmappedRows() {
        return this.totalRows - this.mappedRows;
    }

    /**
     * @return the number of distinct functions predicted
     */
    public int getFunctionCount() {
        return this.summaries.size();
    }

    /**
     * @return the total abundance of the input table
     */
    public double getTotalReads() {
        return this.totalReads;
    }

    /**
     * @return the warnings from the run
     */
    public List<String> getWarnings() {
        return Collections.unmodifiableList(this.warnings);
    }

}

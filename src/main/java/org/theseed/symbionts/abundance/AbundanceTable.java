/**
 *
 */
package org.theseed.symbionts.abundance;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.symbionts.utils.ParseFailureException;
import org.theseed.symbionts.utils.TabbedLineReader;

/**
 * This object contains the rows of a community abundance table and converts raw abundances to
 * relative-abundance percentages.  The percentages of all rows sum to 100.
 *
 * The input file is tab-delimited with headers.  The taxonomy label is taken from the "Taxon"
 * column (or the first column if there is none) and the abundance from the "Abundance" column
 * (or the second column if there is none).
 *
 */
public class AbundanceTable implements Iterable<AbundanceRow> {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(AbundanceTable.class);
    /** list of rows, in input order */
    private final List<AbundanceRow> rows;
    /** total abundance */
    private final double total;

    /**
     * Create an abundance table from a list of rows.
     *
     * @param rows	rows to put in the table
     */
    public AbundanceTable(List<AbundanceRow> rows) {
        this.rows = Collections.unmodifiableList(new ArrayList<AbundanceRow>(rows));
        this.total = rows.stream().mapToDouble(x -> x.getAbundance()).sum();
        if (! rows.isEmpty() && this.total <= 0.0)
            throw new IllegalArgumentException("Total abundance is zero:  relative abundance is undefined.");
    }

    /**
     * Load an abundance table from a tab-delimited file.
     *
     * @param inFile	input file name
     *
     * @return the abundance table read
     *
     * @throws IOException
     * @throws ParseFailureException
     */
    public static AbundanceTable load(File inFile) throws IOException, ParseFailureException {
        List<AbundanceRow> rows = new ArrayList<AbundanceRow>();
        try (TabbedLineReader inStream = new TabbedLineReader(inFile)) {
            int taxonCol = inStream.findColumn("Taxon", 0);
            int countCol = inStream.findColumn("Abundance", 1);
            for (TabbedLineReader.Line line : inStream) {
                String label = line.get(taxonCol);
                double abundance;
                try {
                    abundance = line.getDouble(countCol);
                } catch (NumberFormatException e) {
                    throw new ParseFailureException("Invalid abundance \"" + line.get(countCol) + "\" in line "
                            + line.getLineNumber() + " of " + inFile + ".");
                }
                if (! (abundance >= 0.0) || Double.isInfinite(abundance))
                    throw new ParseFailureException("Abundance must be a non-negative number in line "
                            + line.getLineNumber() + " of " + inFile + ".");
                rows.add(new AbundanceRow(label, abundance));
            }
        }
        log.info("{} rows read from abundance table {}.", rows.size(), inFile);
        if (! rows.isEmpty() && rows.stream().allMatch(x -> x.getAbundance() == 0.0))
            throw new ParseFailureException("Total abundance in " + inFile + " is zero.");
        return new AbundanceTable(rows);
    }

    /**
     * @return the relative abundance of a row, as a percentage of the table total
     *
     * @param row	row of interest
     */
    public double getRelativePct(AbundanceRow row) {
        return (this.total > 0.0 ? row.getAbundance() * 100.0 / this.total : 0.0);
    }

    /**
     * @return the total abundance
     */
    public double getTotal() {
        return this.total;
    }

    /**
     * @return the number of rows
     */
    public int size() {
        return this.rows.size();
    }

    /**
     * @return the list of rows
     */
    public List<AbundanceRow> getRows() {
        return this.rows;
    }

    @Override
    public Iterator<AbundanceRow> iterator() {
        return this.rows.iterator();
    }

}

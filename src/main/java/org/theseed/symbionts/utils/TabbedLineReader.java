/**
 *
 */
package org.theseed.symbionts.utils;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.NoSuchElementException;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * This class reads a tab-delimited file with a header line and iterates through the data lines.
 * Short lines are padded with empty strings and long lines are truncated, so every data line has
 * exactly as many fields as the header.  Blank lines are skipped.
 *
 */
public class TabbedLineReader implements Iterable<TabbedLineReader.Line>, AutoCloseable {

    // FIELDS
    /** underlying reader */
    private final BufferedReader reader;
    /** header labels */
    private final String[] labels;
    /** next line to return, or NULL at end-of-file */
    private Line nextLine;
    /** number of physical lines read */
    private int lineCount;

    /**
     * This represents a single data line.
     */
    public class Line {

        /** fields in the line */
        private final String[] fields;
        /** physical line number (1-based, the header is line 1) */
        private final int lineNum;

        private Line(String[] fields, int lineNum) {
            this.fields = fields;
            this.lineNum = lineNum;
        }

        /**
         * @return the trimmed value of the specified field
         *
         * @param idx	index (0-based) of the field
         */
        public String get(int idx) {
            return this.fields[idx].trim();
        }

        /**
         * @return the floating-point value of the specified field
         *
         * @param idx	index (0-based) of the field
         *
         * @throws NumberFormatException if the field is not numeric
         */
        public double getDouble(int idx) {
            return Double.parseDouble(this.get(idx));
        }

        /**
         * @return the physical line number of this line
         */
        public int getLineNumber() {
            return this.lineNum;
        }

        @Override
        public String toString() {
            return StringUtils.join(this.fields, '\t');
        }

    }

    /**
     * Open a tab-delimited file for input.
     *
     * @param inFile	file to read
     *
     * @throws IOException
     */
    public TabbedLineReader(File inFile) throws IOException {
        this(openFile(inFile));
    }

    /**
     * Open a tab-delimited stream for input.
     *
     * @param inStream	stream to read
     *
     * @throws IOException
     */
    public TabbedLineReader(InputStream inStream) throws IOException {
        this.reader = new BufferedReader(new InputStreamReader(inStream, StandardCharsets.UTF_8));
        this.lineCount = 0;
        String header = this.readPhysical();
        if (header == null)
            this.labels = new String[0];
        else
            this.labels = StringUtils.splitPreserveAllTokens(StringUtils.removeStart(header, "\uFEFF"), '\t');
        for (int i = 0; i < this.labels.length; i++)
            this.labels[i] = this.labels[i].trim();
        this.nextLine = this.readData();
    }

    /**
     * @return an input stream for the specified file
     *
     * @param inFile	file to open
     *
     * @throws IOException
     */
    private static InputStream openFile(File inFile) throws IOException {
        if (! inFile.canRead())
            throw new FileNotFoundException("Input file " + inFile + " not found or unreadable.");
        return FileUtils.openInputStream(inFile);
    }

    /**
     * @return the next physical line, or NULL at end-of-file
     *
     * @throws IOException
     */
    private String readPhysical() throws IOException {
        String retVal = this.reader.readLine();
        if (retVal != null)
            this.lineCount++;
        return retVal;
    }

    /**
     * @return the next non-blank data line, or NULL at end-of-file
     *
     * @throws IOException
     */
    private Line readData() throws IOException {
        Line retVal = null;
        String raw = this.readPhysical();
        while (raw != null && StringUtils.isBlank(raw))
            raw = this.readPhysical();
        if (raw != null) {
            String[] parts = StringUtils.splitPreserveAllTokens(raw, '\t');
            String[] fields = new String[this.labels.length];
            for (int i = 0; i < fields.length; i++)
                fields[i] = (i < parts.length ? parts[i] : "");
            retVal = new Line(fields, this.lineCount);
        }
        return retVal;
    }

    /**
     * @return the index of the column with the specified name (case-insensitive), or -1 if there is none
     *
     * @param name	column name to find
     */
    public int findColumn(String name) {
        int retVal = -1;
        for (int i = 0; retVal < 0 && i < this.labels.length; i++) {
            if (this.labels[i].equalsIgnoreCase(name))
                retVal = i;
        }
        return retVal;
    }

    /**
     * @return the index of the column with the specified name, or the default index if there is none
     *
     * @param name		column name to find
     * @param defaultIdx	index to use if the name is not found
     *
     * @throws ParseFailureException if the default index is out of range
     */
    public int findColumn(String name, int defaultIdx) throws ParseFailureException {
        int retVal = this.findColumn(name);
        if (retVal < 0) {
            if (defaultIdx >= this.labels.length)
                throw new ParseFailureException("Input has no \"" + name + "\" column and too few columns to default it.");
            retVal = defaultIdx;
        }
        return retVal;
    }

    /**
     * @return the number of fields in each line
     */
    public int size() {
        return this.labels.length;
    }

    /**
     * @return the header labels
     */
    public String[] getLabels() {
        return this.labels;
    }

    @Override
    public Iterator<Line> iterator() {
        return new Iterator<Line>() {

            @Override
            public boolean hasNext() {
                return TabbedLineReader.this.nextLine != null;
            }

            @Override
            public Line next() {
                Line retVal = TabbedLineReader.this.nextLine;
                if (retVal == null)
                    throw new NoSuchElementException("Attempt to read past end of tabbed file.");
                try {
                    TabbedLineReader.this.nextLine = TabbedLineReader.this.readData();
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
                return retVal;
            }

        };
    }

    @Override
    public void close() throws IOException {
        this.reader.close();
    }

}

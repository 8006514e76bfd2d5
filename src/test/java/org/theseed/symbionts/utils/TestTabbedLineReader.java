/**
 *
 */
package org.theseed.symbionts.utils;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

/**
 *
 */
class TestTabbedLineReader {

    @Test
    void testFileReader() throws IOException, ParseFailureException {
        try (TabbedLineReader inStream = new TabbedLineReader(new File("data", "insect_nodes.tsv"))) {
            assertThat(inStream.size(), equalTo(4));
            assertThat(inStream.findColumn("RANK"), equalTo(2));
            assertThat(inStream.findColumn("name"), equalTo(3));
            assertThat(inStream.findColumn("lineage"), equalTo(-1));
            assertThat(inStream.findColumn("lineage", 1), equalTo(1));
            assertThrows(ParseFailureException.class, () -> inStream.findColumn("lineage", 4));
            List<String> names = new ArrayList<String>();
            for (TabbedLineReader.Line line : inStream)
                names.add(line.get(3));
            assertThat(names.size(), equalTo(23));
            assertThat(names.get(0), equalTo("Insecta"));
            assertThat(names.get(22), equalTo("Apis mellifera"));
        }
    }

    @Test
    void testStreamReader() throws IOException {
        String data = "\uFEFFTaxon\tAbundance\tNote\n"
                + "g__Buchnera\t 12.5 \n"
                + "\n"
                + "   \n"
                + "g__Wolbachia\t3\tfirst\textra\n";
        try (TabbedLineReader inStream = new TabbedLineReader(new ByteArrayInputStream(data.getBytes(StandardCharsets.UTF_8)))) {
            assertThat(inStream.getLabels(), arrayContaining("Taxon", "Abundance", "Note"));
            List<TabbedLineReader.Line> lines = new ArrayList<TabbedLineReader.Line>();
            inStream.forEach(x -> lines.add(x));
            assertThat(lines.size(), equalTo(2));
            TabbedLineReader.Line line = lines.get(0);
            assertThat(line.get(0), equalTo("g__Buchnera"));
            assertThat(line.getDouble(1), closeTo(12.5, 1e-9));
            assertThat(line.get(2), equalTo(""));
            assertThat(line.getLineNumber(), equalTo(2));
            line = lines.get(1);
            assertThat(line.get(2), equalTo("first"));
            assertThat(line.getLineNumber(), equalTo(5));
        }
    }

    @Test
    void testMissingFile() {
        assertThrows(FileNotFoundException.class, () -> new TabbedLineReader(new File("data", "no_such_file.tsv")));
    }

}

/**
 *
 */
package org.theseed.symbionts;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.symbionts.host.HostProfile;
import org.theseed.symbionts.host.NodeTableHostTaxonomy;
import org.theseed.symbionts.utils.BaseProcessor;
import org.theseed.symbionts.utils.ParseFailureException;
import org.theseed.symbionts.utils.TabbedLineReader;

/**
 * This command displays the lineage of one or more insect hosts.  The host names can be given as
 * positional parameters or in the first column of a tab-delimited file with headers.  The output
 * is a tab-delimited report on the standard output showing the order, family, genus, and species
 * of each host.  Hosts not found in the taxonomy are shown with "N/A" values.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -i	name of a file containing host names (in addition to any positional names)
 *
 * --hostDb		host taxonomy node table (required)
 *
 */
public class HostQueryProcessor extends BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(HostQueryProcessor.class);
    /** host taxonomy */
    private NodeTableHostTaxonomy hostTaxonomy;
    /** list of host names to query */
    private List<String> queries;

    // COMMAND-LINE OPTIONS

    /** input file of host names */
    @Option(name = "-i", aliases = { "--input" }, metaVar = "hosts.tsv", usage = "file of host names (first column)")
    private File inFile;

    /** host taxonomy file */
    @Option(name = "--hostDb", metaVar = "insecta_nodes.tsv", usage = "host taxonomy node table", required = true)
    private File hostDbFile;

    /** host names */
    @Argument(index = 0, metaVar = "name1 name2 ...", usage = "host names to query")
    private List<String> names;

    @Override
    protected void setDefaults() {
        this.inFile = null;
        this.names = new ArrayList<String>();
    }

    @Override
    protected boolean validateParms() throws IOException, ParseFailureException {
        if (! this.hostDbFile.canRead())
            throw new FileNotFoundException("Host taxonomy file " + this.hostDbFile + " not found or unreadable.");
        this.queries = new ArrayList<String>(this.names);
        if (this.inFile != null) {
            if (! this.inFile.canRead())
                throw new FileNotFoundException("Host name file " + this.inFile + " not found or unreadable.");
            try (TabbedLineReader inStream = new TabbedLineReader(this.inFile)) {
                for (TabbedLineReader.Line line : inStream)
                    this.queries.add(line.get(0));
            }
        }
        if (this.queries.isEmpty())
            throw new ParseFailureException("No host names specified.");
        this.hostTaxonomy = new NodeTableHostTaxonomy(this.hostDbFile);
        return true;
    }

    @Override
    protected void runCommand() throws Exception {
        int found = 0;
        // Standard output is flushed but never closed.
        PrintWriter writer = new PrintWriter(System.out);
        writer.println("host\torder\tfamily\tgenus\tspecies");
        for (String name : this.queries) {
            HostProfile profile = this.hostTaxonomy.resolve(name);
            if (profile == null)
                writer.format("%s\tN/A\tN/A\tN/A\tN/A%n", name);
            else {
                writer.format("%s\t%s\t%s\t%s\t%s%n", name, HostProfile.unknown(profile.getOrder()),
                        HostProfile.unknown(profile.getFamily()), HostProfile.unknown(profile.getGenus()),
                        HostProfile.unknown(profile.getSpecies()));
                found++;
            }
        }
        writer.flush();
        log.info("{} of {} hosts found in taxonomy.", found, this.queries.size());
    }

}

/**
 *
 */
package org.theseed.symbionts;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.symbionts.abundance.AbundanceTable;
import org.theseed.symbionts.evidence.EvidenceClassifier;
import org.theseed.symbionts.host.FamilyDerivation;
import org.theseed.symbionts.host.HostContextResolver;
import org.theseed.symbionts.host.NodeTableHostTaxonomy;
import org.theseed.symbionts.records.RecordStore;
import org.theseed.symbionts.reports.PredictionReporter;
import org.theseed.symbionts.scoring.FunctionSummary;
import org.theseed.symbionts.scoring.PredictionResult;
import org.theseed.symbionts.scoring.SymbiontPredictor;
import org.theseed.symbionts.utils.BaseProcessor;
import org.theseed.symbionts.utils.ParseFailureException;

/**
 * This command predicts the functions of the symbionts in an insect microbiome sample.  Each
 * taxon in the abundance table is matched against the reference records, and the matches are
 * scored using the taxon's relative abundance, the closeness of the record's host to the sample's
 * host, and the strength of the record's supporting evidence.  The scores are then summarized by
 * function.
 *
 * The positional parameters are the name of the reference record file and the name of the
 * abundance table.  The reference record file is tab-delimited with headers, and must contain
 * "taxonomy", "host", and "function" columns.  The abundance table is tab-delimited with headers,
 * with the taxonomy label in the "Taxon" column (or the first column) and the abundance in the
 * "Abundance" column (or the second column).
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	output file prefix (default "isympred")
 *
 * --host			binomial name of the insect host
 * --hostDb			host taxonomy node table (required for host-specific weighting)
 * --deriveFamily	method for computing the host family of records that do not specify one
 * 					(NONE or LOOKUP, default NONE)
 * --format			output format (TEXT, HTML, or JSON, default TEXT)
 *
 */
public class PredictProcessor extends BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(PredictProcessor.class);
    /** host taxonomy, or NULL if there is none */
    private NodeTableHostTaxonomy hostTaxonomy;

    // COMMAND-LINE OPTIONS

    /** output file prefix */
    @Option(name = "-o", aliases = { "--output" }, metaVar = "out/sample1", usage = "output file name prefix")
    private File outPrefix;

    /** host species name */
    @Option(name = "--host", metaVar = "\"Acyrthosiphon pisum\"", usage = "binomial name of the insect host")
    private String hostName;

    /** host taxonomy file */
    @Option(name = "--hostDb", metaVar = "insecta_nodes.tsv", usage = "host taxonomy node table")
    private File hostDbFile;

    /** family derivation method */
    @Option(name = "--deriveFamily", usage = "method for computing missing record host families")
    private FamilyDerivation derivation;

    /** output format */
    @Option(name = "--format", usage = "output report format")
    private PredictionReporter.Type format;

    /** reference record file */
    @Argument(index = 0, metaVar = "records.tsv", usage = "reference record file", required = true)
    private File recordFile;

    /** abundance table file */
    @Argument(index = 1, metaVar = "abundance.tsv", usage = "taxon abundance table", required = true)
    private File abundanceFile;

    @Override
    protected void setDefaults() {
        this.outPrefix = new File("isympred");
        this.hostName = null;
        this.hostDbFile = null;
        this.derivation = FamilyDerivation.NONE;
        this.format = PredictionReporter.Type.TEXT;
    }

    @Override
    protected boolean validateParms() throws IOException, ParseFailureException {
        if (! this.recordFile.canRead())
            throw new FileNotFoundException("Reference record file " + this.recordFile + " not found or unreadable.");
        if (! this.abundanceFile.canRead())
            throw new FileNotFoundException("Abundance table " + this.abundanceFile + " not found or unreadable.");
        if (this.hostDbFile == null) {
            this.hostTaxonomy = null;
            if (this.derivation != FamilyDerivation.NONE)
                throw new ParseFailureException("Family derivation requires a host taxonomy (--hostDb).");
        } else if (! this.hostDbFile.canRead())
            throw new FileNotFoundException("Host taxonomy file " + this.hostDbFile + " not found or unreadable.");
        else
            this.hostTaxonomy = new NodeTableHostTaxonomy(this.hostDbFile);
        if (StringUtils.isBlank(this.outPrefix.getName()))
            throw new ParseFailureException("Output prefix must have a file name part.");
        File outDir = this.outPrefix.getAbsoluteFile().getParentFile();
        if (outDir != null && ! outDir.isDirectory()) {
            log.info("Creating output directory {}.", outDir);
            FileUtils.forceMkdir(outDir);
        }
        return true;
    }

    @Override
    protected void runCommand() throws Exception {
        // Load the inputs.
        RecordStore store = RecordStore.load(this.recordFile);
        AbundanceTable table = AbundanceTable.load(this.abundanceFile);
        // Set up the host context.
        HostContextResolver hostResolver = HostContextResolver.create(this.hostName, this.hostTaxonomy,
                this.derivation);
        log.info("Prediction mode is {}.", (hostResolver.isHostSpecific() ? "host-specific" : "general"));
        // Run the prediction.
        SymbiontPredictor predictor = new SymbiontPredictor(store, hostResolver, new EvidenceClassifier());
        PredictionResult result = predictor.predict(table);
        result.addWarnings(store.getWarnings());
        // Write the reports.
        try (PredictionReporter reporter = PredictionReporter.create(this.format, this.outPrefix)) {
            reporter.write(result);
            for (File outFile : reporter.getOutputFiles())
                log.info("Output written to {}.", outFile);
        }
        if (log.isInfoEnabled()) {
            log.info("{} functions predicted from {} of {} abundance rows.", result.getFunctionCount(),
                    result.getMappedRows(), result.getTotalRows());
            for (FunctionSummary summary : result.getSummaries())
                log.info("  {}: score {}, probability {}, dominant {}.", summary.getFunction(),
                        String.format("%.1f", summary.getFinalScoreSum()),
                        String.format("%.3f", summary.getProbability()), summary.getDominantDescription());
        }
        if (! result.getWarnings().isEmpty())
            log.warn("{} warnings issued during prediction.", result.getWarnings().size());
    }

}

/**
 *
 */
package org.theseed.symbionts.records;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.symbionts.taxonomy.TaxonLineage;
import org.theseed.symbionts.utils.ParseFailureException;
import org.theseed.symbionts.utils.TabbedLineReader;

/**
 * This is an in-memory reference record store.  Records are indexed by the genus and species of
 * their symbiont lineage.  A record whose lineage has no genus cannot be matched and is rejected
 * with a warning.
 *
 * The store can be loaded from a tab-delimited file with headers.  The "taxonomy", "host", and
 * "function" columns are required.  The optional columns are "host_order", "host_family",
 * "record_type", "genome_id", "journal", "description", "evidence" (the citation), and
 * "evidence_level".  A record with an empty required field is rejected with a warning.
 *
 */
public class RecordStore implements IRecordStore {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(RecordStore.class);
    /** list of accepted records, in input order */
    private final List<ReferenceRecord> records;
    /** map of lower-case species names to records */
    private final Map<String, List<ReferenceRecord>> speciesMap;
    /** map of lower-case genus names to records */
    private final Map<String, List<ReferenceRecord>> genusMap;
    /** list of warnings about rejected records */
    private final List<String> warnings;
    /** required column names */
    private static final String[] REQUIRED_COLUMNS = new String[] { "taxonomy", "host", "function" };
    /** pattern for a valid stored evidence level */
    private static final Pattern VALID_LEVEL = Pattern.compile("[1-5]");

    /**
     * Create an empty record store.
     */
    public RecordStore() {
        this.records = new ArrayList<ReferenceRecord>();
        this.speciesMap = new HashMap<String, List<ReferenceRecord>>();
        this.genusMap = new HashMap<String, List<ReferenceRecord>>();
        this.warnings = new ArrayList<String>();
    }

    /**
     * Add a record to this store.
     *
     * @param record	record to add
     *
     * @return TRUE if the record was accepted, FALSE if it was rejected
     */
    public boolean add(ReferenceRecord record) {
        boolean retVal = false;
        TaxonLineage lineage = record.getLineage();
        String genus = lineage.getGenus();
        if (genus == null)
            this.warn("Reference " + record + " rejected:  taxonomy \"" + record.getTaxonLabel() + "\" has no genus.");
        else {
            this.records.add(record);
            this.genusMap.computeIfAbsent(genus.toLowerCase(), x -> new ArrayList<ReferenceRecord>()).add(record);
            String species = lineage.getSpecies();
            if (species != null)
                this.speciesMap.computeIfAbsent(species.toLowerCase(), x -> new ArrayList<ReferenceRecord>()).add(record);
            retVal = true;
        }
        return retVal;
    }

    /**
     * Record a warning about a rejected record.
     *
     * @param message	warning message
     */
    private void warn(String message) {
        log.warn(message);
        this.warnings.add(message);
    }

    /**
     * Load a record store from a tab-delimited file.
     *
     * @param inFile	input file name
     *
     * @return the record store loaded
     *
     * @throws IOException
     * @throws ParseFailureException
     */
    public static RecordStore load(File inFile) throws IOException, ParseFailureException {
        RecordStore retVal = new RecordStore();
        log.info("Loading reference records from {}.", inFile);
        try (TabbedLineReader inStream = new TabbedLineReader(inFile)) {
            for (String required : REQUIRED_COLUMNS) {
                if (inStream.findColumn(required) < 0)
                    throw new ParseFailureException("Reference file " + inFile + " has no \"" + required + "\" column.");
            }
            int taxCol = inStream.findColumn("taxonomy");
            int hostCol = inStream.findColumn("host");
            int funCol = inStream.findColumn("function");
            int orderCol = inStream.findColumn("host_order");
            int familyCol = inStream.findColumn("host_family");
            int typeCol = inStream.findColumn("record_type");
            int genomeCol = inStream.findColumn("genome_id");
            int journalCol = inStream.findColumn("journal");
            int descCol = inStream.findColumn("description");
            int citeCol = inStream.findColumn("evidence");
            int levelCol = inStream.findColumn("evidence_level");
            if (levelCol < 0)
                log.warn("Reference file {} has no evidence_level column:  stored levels will not be used.", inFile);
            int lineCount = 0;
            for (TabbedLineReader.Line line : inStream) {
                lineCount++;
                String id = "line " + line.getLineNumber();
                ReferenceRecord.Builder builder = new ReferenceRecord.Builder(id)
                        .taxonLabel(line.get(taxCol)).host(line.get(hostCol)).function(line.get(funCol))
                        .hostOrder(optional(line, orderCol)).hostFamily(optional(line, familyCol))
                        .recordType(RecordType.parse(optional(line, typeCol)))
                        .genomeId(optional(line, genomeCol)).journal(optional(line, journalCol))
                        .description(optional(line, descCol)).evidenceCitation(optional(line, citeCol));
                String missing = builder.missingField();
                if (missing != null)
                    retVal.warn("Reference record at " + id + " rejected:  required field \"" + missing + "\" is empty.");
                else {
                    builder.evidenceLevel(retVal.parseLevel(id, optional(line, levelCol)));
                    retVal.add(builder.build());
                }
            }
            log.info("{} reference records read, {} accepted.  {} species keys and {} genus keys.",
                    lineCount, retVal.size(), retVal.speciesMap.size(), retVal.genusMap.size());
        }
        return retVal;
    }

    /**
     * @return the value of an optional column, or NULL if the column is not present
     *
     * @param line	input line
     * @param idx	column index, or -1 if the column is not present
     */
    private static String optional(TabbedLineReader.Line line, int idx) {
        return (idx < 0 ? null : line.get(idx));
    }

    /**
     * Parse a stored evidence level.  An invalid level is discarded with a warning.
     *
     * @param id		identifier of the record
     * @param value		evidence-level string, or NULL if there is none
     *
     * @return the evidence level, or NULL if none is available
     */
    private Integer parseLevel(String id, String value) {
        Integer retVal = null;
        String clean = ReferenceRecord.clean(value);
        if (clean != null) {
            if (! VALID_LEVEL.matcher(clean).matches())
                this.warn("Reference record at " + id + " has invalid evidence level \"" + clean + "\":  ignored.");
            else
                retVal = Integer.valueOf(clean);
        }
        return retVal;
    }

    @Override
    public List<ReferenceRecord> findSpecies(String species) {
        return this.find(this.speciesMap, species);
    }

    @Override
    public List<ReferenceRecord> findGenus(String genus) {
        return this.find(this.genusMap, genus);
    }

    /**
     * @return the records in the specified index for the specified key
     *
     * @param map	index map
     * @param key	key to find
     */
    private List<ReferenceRecord> find(Map<String, List<ReferenceRecord>> map, String key) {
        List<ReferenceRecord> retVal = null;
        if (key != null)
            retVal = map.get(key.toLowerCase());
        if (retVal == null)
            retVal = Collections.emptyList();
        else
            retVal = Collections.unmodifiableList(retVal);
        return retVal;
    }

    @Override
    public int size() {
        return this.records.size();
    }

    /**
     * @return the accepted records, in input order
     */
    public List<ReferenceRecord> getRecords() {
        return Collections.unmodifiableList(this.records);
    }

    /**
     * @return the warnings about rejected records
     */
    public List<String> getWarnings() {
        return Collections.unmodifiableList(this.warnings);
    }

}

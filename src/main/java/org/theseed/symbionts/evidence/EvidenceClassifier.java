/**
 *
 */
package org.theseed.symbionts.evidence;

import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.theseed.symbionts.records.RecordType;
import org.theseed.symbionts.records.ReferenceRecord;

/**
 * This object assigns an evidence level from 1 (weakest) to 5 (strongest) to a reference record
 * and converts the level to a scoring weight.
 *
 * If the record store supplied a level, that level is used.  Otherwise, if the record has a
 * record type, the level is derived from the record metadata:  one point for a symbiont record,
 * two points for a genome accession, and one point for publication in a high-impact journal,
 * clamped to the range 1 to 5.  A record with neither a stored level nor a record type gets the
 * default level of 2.
 *
 */
public class EvidenceClassifier {

    // FIELDS
    /** set of high-impact journal names (lower case) */
    private final Set<String> highImpactJournals;
    /** level used when there is no evidence information */
    public static final int DEFAULT_LEVEL = 2;
    /** minimum evidence level */
    public static final int MIN_LEVEL = 1;
    /** maximum evidence level */
    public static final int MAX_LEVEL = 5;
    /** weight for each evidence level */
    private static final Map<Integer, Double> LEVEL_WEIGHTS = Map.of(5, 1.5, 4, 1.3, 3, 1.15, 2, 1.0, 1, 0.8);
    /** default high-impact journal list */
    public static final Set<String> DEFAULT_JOURNALS = Set.of("nature", "science", "cell", "pnas",
            "proceedings of the national academy of sciences", "nature communications",
            "nature microbiology", "nature biotechnology", "science advances", "cell host & microbe",
            "isme journal", "microbiome", "mbio", "plos biology");

    /**
     * Construct an evidence classifier with the default high-impact journal list.
     */
    public EvidenceClassifier() {
        this(DEFAULT_JOURNALS);
    }

    /**
     * Construct an evidence classifier with a custom high-impact journal list.
     *
     * @param journals	names of the high-impact journals
     */
    public EvidenceClassifier(Set<String> journals) {
        this.highImpactJournals = journals.stream().map(x -> x.trim().toLowerCase())
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * @return the evidence level of a reference record
     *
     * @param record	record to classify
     */
    public int levelOf(ReferenceRecord record) {
        int retVal;
        if (record.getEvidenceLevel() != null)
            retVal = record.getEvidenceLevel();
        else if (record.getRecordType() != null)
            retVal = this.deriveLevel(record.getRecordType(), record.getGenomeId(), record.getJournal());
        else
            retVal = DEFAULT_LEVEL;
        return retVal;
    }

    /**
     * Compute an evidence level from record metadata.
     *
     * @param type		record type
     * @param genomeId	genome accession, or NULL if there is none
     * @param journal	journal of publication, or NULL if it is unknown
     *
     * @return the derived evidence level
     */
    public int deriveLevel(RecordType type, String genomeId, String journal) {
        int raw = 0;
        if (type == RecordType.SYMBIONT)
            raw += 1;
        if (genomeId != null && ! genomeId.isBlank())
            raw += 2;
        if (this.isHighImpact(journal))
            raw += 1;
        return Math.max(MIN_LEVEL, Math.min(MAX_LEVEL, raw));
    }

    /**
     * @return TRUE if the journal matches a high-impact journal exactly or begins with one (case-insensitive)
     *
     * @param journal	journal name to check, or NULL
     */
    public boolean isHighImpact(String journal) {
        boolean retVal = false;
        if (journal != null) {
            String lower = journal.trim().toLowerCase();
            retVal = this.highImpactJournals.stream().anyMatch(x -> lower.startsWith(x));
        }
        return retVal;
    }

    /**
     * @return the scoring weight for an evidence level
     *
     * @param level		evidence level
     *
     * @throws IllegalArgumentException if the level is out of range
     */
    public static double weightOf(int level) {
        Double retVal = LEVEL_WEIGHTS.get(level);
        if (retVal == null)
            throw new IllegalArgumentException("Evidence level " + level + " is out of range.");
        return retVal;
    }

}

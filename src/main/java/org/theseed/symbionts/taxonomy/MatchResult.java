/**
 *
 */
package org.theseed.symbionts.taxonomy;

import org.theseed.symbionts.abundance.AbundanceRow;
import org.theseed.symbionts.records.ReferenceRecord;

/**
 * This object describes a match between an abundance row and a reference record:  the rank at
 * which the two taxa agree and the resulting confidence weight.
 *
 */
public class MatchResult {

    // FIELDS
    /** matched abundance row */
    private final AbundanceRow row;
    /** matched reference record */
    private final ReferenceRecord record;
    /** match level */
    private final TaxonMatchLevel level;

    /**
     * Construct a match result.
     *
     * @param row		matched abundance row
     * @param record	matched reference record
     * @param level		rank at which they match
     */
    public MatchResult(AbundanceRow row, ReferenceRecord record, TaxonMatchLevel level) {
        this.row = row;
        this.record = record;
        this.level = level;
    }

    /**
     * @return the abundance row
     */
    public AbundanceRow getRow() {
        return this.row;
    }

    /**
     * @return the reference record
     */
    public ReferenceRecord getRecord() {
        return this.record;
    }

    /**
     * @return the match level
     */
    public TaxonMatchLevel getLevel() {
        return this.level;
    }

    /**
     * @return the taxonomic confidence weight
     */
    public double getWeight() {
        return this.level.getWeight();
    }

    /**
     * @return the display name of the matched taxon
     */
    public String getDisplayName() {
        return this.row.getLineage().getDisplayName(this.level);
    }

}

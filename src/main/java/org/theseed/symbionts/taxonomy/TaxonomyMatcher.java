/**
 *
 */
package org.theseed.symbionts.taxonomy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.theseed.symbionts.abundance.AbundanceRow;
import org.theseed.symbionts.records.IRecordStore;
import org.theseed.symbionts.records.ReferenceRecord;

/**
 * This object matches abundance rows against a reference record store.  A row whose species is
 * present in the store matches all the records for that species at the species level.  Otherwise,
 * a row whose genus is present matches all the records for that genus at the genus level.  Any
 * other row is unmatched.
 *
 */
public class TaxonomyMatcher {

    // FIELDS
    /** reference record store */
    private final IRecordStore store;

    /**
     * Construct a matcher for a record store.
     *
     * @param store		reference record store
     */
    public TaxonomyMatcher(IRecordStore store) {
        this.store = store;
    }

    /**
     * @return the match level for the specified lineage
     *
     * @param lineage	lineage to check
     */
    public TaxonMatchLevel levelOf(TaxonLineage lineage) {
        TaxonMatchLevel retVal = TaxonMatchLevel.UNMATCHED;
        if (! this.store.findSpecies(lineage.getSpecies()).isEmpty())
            retVal = TaxonMatchLevel.SPECIES;
        else if (! this.store.findGenus(lineage.getGenus()).isEmpty())
            retVal = TaxonMatchLevel.GENUS;
        return retVal;
    }

    /**
     * Match an abundance row against the record store.
     *
     * @param row	abundance row to match
     *
     * @return a list of the match results (empty if the row is unmatched)
     */
    public List<MatchResult> match(AbundanceRow row) {
        List<MatchResult> retVal;
        TaxonLineage lineage = row.getLineage();
        TaxonMatchLevel level = this.levelOf(lineage);
        List<ReferenceRecord> records;
        switch (level) {
        case SPECIES -> records = this.store.findSpecies(lineage.getSpecies());
        case GENUS -> records = this.store.findGenus(lineage.getGenus());
        default -> records = Collections.emptyList();
        }
        retVal = new ArrayList<MatchResult>(records.size());
        for (ReferenceRecord record : records)
            retVal.add(new MatchResult(row, record, level));
        return retVal;
    }

    /**
     * @return TRUE if the row's taxonomy label could not be parsed at all
     *
     * @param row	abundance row to check
     */
    public static boolean isMalformed(AbundanceRow row) {
        return row.getLineage().isEmpty();
    }

}

/**
 *
 */
package org.theseed.symbionts.records;

import java.util.List;

/**
 * This interface describes a read-only source of reference records indexed by symbiont species
 * and genus.  Lookups are case-insensitive and return an empty list when nothing is found.
 *
 */
public interface IRecordStore {

    /**
     * @return the records for the specified species binomial
     *
     * @param species	full species name
     */
    public List<ReferenceRecord> findSpecies(String species);

    /**
     * @return the records for the specified genus
     *
     * @param genus		genus name
     */
    public List<ReferenceRecord> findGenus(String genus);

    /**
     * @return the number of records available for matching
     */
    public int size();

}

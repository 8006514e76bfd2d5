/**
 *
 */
package org.theseed.symbionts.taxonomy;

/**
 * The rank at which an observed taxon matches a reference record, with the confidence weight for
 * each.  Only species and genus matches are scored; family and order are listed for completeness
 * of the rank scale and are never produced by the matcher.
 *
 */
public enum TaxonMatchLevel {
    SPECIES("Species", 1.0), GENUS("Genus", 0.6), FAMILY("Family", 0.0), ORDER("Order", 0.0),
    UNMATCHED("Unmatched", 0.0);

    /** display name */
    private final String label;
    /** confidence weight */
    private final double weight;

    private TaxonMatchLevel(String label, double weight) {
        this.label = label;
        this.weight = weight;
    }

    /**
     * @return the taxonomic confidence weight for this match level
     */
    public double getWeight() {
        return this.weight;
    }

    /**
     * @return TRUE if matches at this level are scored
     */
    public boolean isScored() {
        return this.weight > 0.0;
    }

    @Override
    public String toString() {
        return this.label;
    }

}

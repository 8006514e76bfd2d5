/**
 *
 */
package org.theseed.symbionts.abundance;

import org.theseed.symbionts.taxonomy.TaxonLineage;

/**
 * This object represents a single line of an abundance table:  a taxonomy label and the number of
 * reads (or other non-negative abundance measure) assigned to it.  The label is parsed once, on
 * construction.
 *
 */
public class AbundanceRow {

    // FIELDS
    /** taxonomy label */
    private final String taxonLabel;
    /** observed abundance */
    private final double abundance;
    /** parsed lineage */
    private final TaxonLineage lineage;

    /**
     * Create an abundance row.
     *
     * @param taxonLabel	hierarchical taxonomy label
     * @param abundance		observed abundance (must be non-negative)
     */
    public AbundanceRow(String taxonLabel, double abundance) {
        if (! (abundance >= 0.0) || Double.isInfinite(abundance))
            throw new IllegalArgumentException("Invalid abundance " + abundance + " for taxon \"" + taxonLabel + "\".");
        this.taxonLabel = (taxonLabel == null ? "" : taxonLabel.trim());
        this.abundance = abundance;
        this.lineage = TaxonLineage.parse(this.taxonLabel);
    }

    /**
     * @return the taxonomy label
     */
    public String getTaxonLabel() {
        return this.taxonLabel;
    }

    /**
     * @return the observed abundance
     */
    public double getAbundance() {
        return this.abundance;
    }

    /**
     * @return the parsed lineage
     */
    public TaxonLineage getLineage() {
        return this.lineage;
    }

    @Override
    public String toString() {
        return this.taxonLabel + " (" + this.abundance + ")";
    }

}

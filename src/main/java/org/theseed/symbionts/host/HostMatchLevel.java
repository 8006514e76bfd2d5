/**
 *
 */
package org.theseed.symbionts.host;

/**
 * The taxonomic distance between the user's host and the host declared by a reference record,
 * with the fixed scoring weight for each tier.
 *
 */
public enum HostMatchLevel {
    SPECIES("Species", 1.5), GENUS("Genus", 1.3), FAMILY("Family", 1.2), ORDER("Order", 1.1),
    GENERAL("General", 1.0), MISMATCH("Mismatch", 0.8);

    /** display name */
    private final String label;
    /** scoring weight */
    private final double weight;

    private HostMatchLevel(String label, double weight) {
        this.label = label;
        this.weight = weight;
    }

    /**
     * @return the scoring weight for this tier
     */
    public double getWeight() {
        return this.weight;
    }

    @Override
    public String toString() {
        return this.label;
    }

}

/**
 *
 */
package org.theseed.symbionts.host;

/**
 * This object describes the resolved taxonomy of an insect host:  the name supplied by the user
 * and the order, family, genus, and species found for it.  Unresolved ranks are NULL.
 *
 */
public class HostProfile {

    // FIELDS
    /** name supplied by the user */
    private final String inputName;
    /** host order */
    private final String order;
    /** host family */
    private final String family;
    /** host genus */
    private final String genus;
    /** host species */
    private final String species;

    /**
     * Construct a host profile.
     *
     * @param inputName		name supplied by the user
     * @param order			order name, or NULL if unknown
     * @param family		family name, or NULL if unknown
     * @param genus			genus name, or NULL if unknown
     * @param species		species name, or NULL if unknown
     */
    public HostProfile(String inputName, String order, String family, String genus, String species) {
        this.inputName = inputName;
        this.order = order;
        this.family = family;
        this.genus = genus;
        this.species = species;
    }

    /**
     * @return the name supplied by the user
     */
    public String getInputName() {
        return this.inputName;
    }

    /**
     * @return the host order, or NULL if it is unknown
     */
    public String getOrder() {
        return this.order;
    }

    /**
     * @return the host family, or NULL if it is unknown
     */
    public String getFamily() {
        return this.family;
    }

    /**
     * @return the host genus, or NULL if it is unknown
     */
    public String getGenus() {
        return this.genus;
    }

    /**
     * @return the host species, or NULL if it is unknown
     */
    public String getSpecies() {
        return this.species;
    }

    @Override
    public String toString() {
        return String.format("%s (order %s, family %s, genus %s)", this.inputName,
                unknown(this.order), unknown(this.family), unknown(this.genus));
    }

    /**
     * @return the specified name, or "N/A" if it is NULL
     *
     * @param name	name to display
     */
    public static String unknown(String name) {
        return (name == null ? "N/A" : name);
    }

}

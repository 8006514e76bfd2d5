/**
 *
 */
package org.theseed.symbionts.taxonomy;

import java.util.Arrays;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

/**
 * This object represents a parsed taxonomy label.  It is an ordered tuple with one optional name
 * for each rank from domain to species.  Missing or placeholder ranks are stored as NULL.
 *
 * Labels are semicolon-delimited.  Segments with a rank prefix ("o__Enterobacterales") are placed
 * at the indicated rank.  Segments without a prefix are placed positionally, starting at domain.
 * A label consisting of a single unprefixed name ("Buchnera aphidicola", "Wolbachia sp.") is
 * taken as a genus followed by an optional species epithet.
 * The species is always stored as a full binomial:  a bare epithet is completed with the genus
 * name, and placeholder epithets ("sp.", "unclassified", ...) are treated as missing.
 *
 */
public class TaxonLineage {

    // FIELDS
    /** names for each rank, indexed by ordinal */
    private final String[] names;
    /** original label */
    private final String label;
    /** pattern for a prefixed segment */
    private static final Pattern PREFIXED = Pattern.compile("([A-Za-z])__(.*)");
    /** values that denote a missing name */
    private static final Set<String> MISSING = Set.of("", "*", "unknown", "none", "null", "nan", "n/a", "na");
    /** words that mark a name as a placeholder */
    private static final String[] PLACEHOLDER_WORDS = new String[] { "unclassified", "uncultured",
            "unidentified", "unknown" };
    /** species epithets that denote an unnamed species */
    private static final Set<String> OPEN_EPITHETS = Set.of("sp", "sp.", "spp", "spp.");

    /**
     * Construct a lineage from an array of names.
     *
     * @param label		original label
     * @param names		array of names indexed by rank ordinal
     */
    private TaxonLineage(String label, String[] names) {
        this.label = label;
        this.names = names;
    }

    /**
     * Parse a taxonomy label.  This method never fails:  a malformed or empty label produces an
     * empty lineage.
     *
     * @param label		label to parse
     *
     * @return the lineage described by the label
     */
    public static TaxonLineage parse(String label) {
        String[] names = new String[TaxonRank.values().length];
        String rawSpecies = null;
        if (label != null) {
            String[] segments = StringUtils.split(label, ';');
            if (segments.length == 1 && ! PREFIXED.matcher(segments[0].trim()).matches()) {
                // A bare name is a genus optionally followed by a species epithet.
                String name = StringUtils.normalizeSpace(segments[0].replace('_', ' '));
                String genus = StringUtils.substringBefore(name, " ");
                if (! isPlaceholder(genus)) {
                    names[TaxonRank.GENUS.ordinal()] = genus;
                    if (name.contains(" "))
                        rawSpecies = name;
                }
                segments = new String[0];
            }
            int position = 0;
            for (String segment : segments) {
                String seg = segment.trim();
                TaxonRank rank = null;
                String value = seg;
                Matcher m = PREFIXED.matcher(seg);
                if (m.matches()) {
                    rank = TaxonRank.fromCode(m.group(1).charAt(0));
                    value = m.group(2);
                }
                if (rank == null) {
                    // Unprefixed segments are positional.
                    if (position < names.length)
                        rank = TaxonRank.values()[position];
                }
                if (rank != null) {
                    position = rank.ordinal() + 1;
                    value = StringUtils.normalizeSpace(value.replace('_', ' '));
                    if (rank == TaxonRank.SPECIES)
                        rawSpecies = value;
                    else if (! isPlaceholder(value))
                        names[rank.ordinal()] = value;
                }
            }
        }
        // The species needs the genus to be completed.
        String genus = names[TaxonRank.GENUS.ordinal()];
        if (genus != null && rawSpecies != null)
            names[TaxonRank.SPECIES.ordinal()] = completeSpecies(genus, rawSpecies);
        return new TaxonLineage(label, names);
    }

    /**
     * @return TRUE if the specified name is missing or is a placeholder rather than a real taxon name
     *
     * @param name	name to check
     */
    public static boolean isPlaceholder(String name) {
        boolean retVal = (name == null || MISSING.contains(name.trim().toLowerCase()));
        if (! retVal) {
            String lower = name.toLowerCase();
            for (int i = 0; ! retVal && i < PLACEHOLDER_WORDS.length; i++)
                retVal = lower.contains(PLACEHOLDER_WORDS[i]);
        }
        return retVal;
    }

    /**
     * Compute the full species binomial from a genus and a species-rank value.
     *
     * @param genus			genus name
     * @param rawSpecies	species-rank value (either an epithet or a binomial)
     *
     * @return the full binomial, or NULL if the species is a placeholder
     */
    private static String completeSpecies(String genus, String rawSpecies) {
        String retVal = null;
        if (! isPlaceholder(rawSpecies)) {
            String full = rawSpecies;
            if (! StringUtils.startsWithIgnoreCase(rawSpecies, genus + " "))
                full = genus + " " + rawSpecies;
            String epithet = StringUtils.substringAfterLast(full, " ");
            if (! OPEN_EPITHETS.contains(epithet.toLowerCase()))
                retVal = full;
        }
        return retVal;
    }

    /**
     * @return the name at the specified rank, or NULL if it is missing
     *
     * @param rank	rank of interest
     */
    public String get(TaxonRank rank) {
        return this.names[rank.ordinal()];
    }

    /**
     * @return the genus name, or NULL if it is missing
     */
    public String getGenus() {
        return this.get(TaxonRank.GENUS);
    }

    /**
     * @return the full species binomial, or NULL if it is missing
     */
    public String getSpecies() {
        return this.get(TaxonRank.SPECIES);
    }

    /**
     * @return TRUE if no rank is present
     */
    public boolean isEmpty() {
        return Arrays.stream(this.names).allMatch(x -> x == null);
    }

    /**
     * @return the most specific rank present, or NULL if the lineage is empty
     */
    public TaxonRank getLowestRank() {
        TaxonRank retVal = null;
        for (TaxonRank rank : TaxonRank.values()) {
            if (this.names[rank.ordinal()] != null)
                retVal = rank;
        }
        return retVal;
    }

    /**
     * @return the original label
     */
    public String getLabel() {
        return this.label;
    }

    /**
     * @return the name to display for a taxon matched at the specified level
     *
     * @param level		taxonomic match level
     */
    public String getDisplayName(TaxonMatchLevel level) {
        String retVal;
        if (level == TaxonMatchLevel.SPECIES && this.getSpecies() != null)
            retVal = this.getSpecies();
        else if (this.getGenus() != null)
            retVal = this.getGenus() + " (sp.)";
        else
            retVal = StringUtils.defaultString(this.label);
        return retVal;
    }

    @Override
    public String toString() {
        StringBuilder retVal = new StringBuilder();
        for (TaxonRank rank : TaxonRank.values()) {
            if (retVal.length() > 0)
                retVal.append("; ");
            retVal.append(rank.getCode()).append("__").append(StringUtils.defaultString(this.names[rank.ordinal()]));
        }
        return retVal.toString();
    }

}

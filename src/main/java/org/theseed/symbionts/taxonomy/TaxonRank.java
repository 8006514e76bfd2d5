/**
 *
 */
package org.theseed.symbionts.taxonomy;

/**
 * The ranks of a hierarchical taxonomy label, from the broadest to the most specific.  Each rank
 * has the one-letter code used in QIIME-style labels ("g__Buchnera").
 *
 */
public enum TaxonRank {
    DOMAIN('d'), PHYLUM('p'), CLASS('c'), ORDER('o'), FAMILY('f'), GENUS('g'), SPECIES('s');

    /** rank code letter */
    private final char code;

    private TaxonRank(char code) {
        this.code = code;
    }

    /**
     * @return the rank code letter
     */
    public char getCode() {
        return this.code;
    }

    /**
     * @return the rank with the specified code letter, or NULL if the code is not recognized
     *
     * @param code	code letter to check (case-insensitive); "k" (kingdom) is an alias for domain
     */
    public static TaxonRank fromCode(char code) {
        char lower = Character.toLowerCase(code);
        TaxonRank retVal = null;
        if (lower == 'k')
            retVal = DOMAIN;
        else {
            for (TaxonRank rank : TaxonRank.values()) {
                if (rank.code == lower)
                    retVal = rank;
            }
        }
        return retVal;
    }

}

/**
 *
 */
package org.theseed.symbionts.host;

import java.util.HashMap;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.symbionts.records.ReferenceRecord;

/**
 * This object computes the host-match tier between the user's host and the host declared by a
 * reference record.  The tiers are checked in priority order:  exact species, same genus, same
 * family, same order, and finally mismatch.  If there is no host profile, or the record is a
 * general record, the tier is always GENERAL.
 *
 * The record's genus is the first word of its host name.  Its family is the declared host family
 * or, if there is none and family derivation is enabled, the family found by looking up the
 * record's host name in the host taxonomy.  Derived families are cached, so an instance should
 * not be shared between threads.
 *
 */
public class HostContextResolver {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(HostContextResolver.class);
    /** host profile, or NULL if there is no host context */
    private final HostProfile profile;
    /** host taxonomy for family derivation, or NULL if there is none */
    private final IHostTaxonomy taxonomy;
    /** family derivation method */
    private final FamilyDerivation derivation;
    /** cache of derived record families (values may be NULL) */
    private final Map<String, String> familyCache;
    /** warning about the host resolution, or NULL if there was no problem */
    private String warning;

    /**
     * Construct a resolver for a known host profile.
     *
     * @param profile		host profile, or NULL for no host context
     * @param taxonomy		host taxonomy for family derivation, or NULL if there is none
     * @param derivation	family derivation method
     */
    public HostContextResolver(HostProfile profile, IHostTaxonomy taxonomy, FamilyDerivation derivation) {
        this.profile = profile;
        this.taxonomy = taxonomy;
        this.derivation = (taxonomy == null ? FamilyDerivation.NONE : derivation);
        this.familyCache = new HashMap<String, String>();
        this.warning = null;
    }

    /**
     * @return a resolver with no host context
     */
    public static HostContextResolver neutral() {
        return new HostContextResolver(null, null, FamilyDerivation.NONE);
    }

    /**
     * Create a resolver for a named host.  If the host cannot be resolved, the resolver has no
     * host context and carries a warning.
     *
     * @param hostName		name of the host, or NULL if there is none
     * @param taxonomy		host taxonomy, or NULL if there is none
     * @param derivation	family derivation method
     *
     * @return a resolver for the named host
     */
    public static HostContextResolver create(String hostName, IHostTaxonomy taxonomy, FamilyDerivation derivation) {
        HostContextResolver retVal;
        String name = StringUtils.normalizeSpace(hostName);
        if (StringUtils.isEmpty(name))
            retVal = new HostContextResolver(null, taxonomy, derivation);
        else if (taxonomy == null) {
            retVal = new HostContextResolver(null, null, derivation);
            retVal.warn("Host \"" + name + "\" specified without a host taxonomy:  host-specific weighting disabled.");
        } else {
            HostProfile profile = taxonomy.resolve(name);
            retVal = new HostContextResolver(profile, taxonomy, derivation);
            if (profile == null)
                retVal.warn("Host \"" + name + "\" not found in host taxonomy:  host-specific weighting disabled.");
            else
                log.info("Host context is {}.", profile);
        }
        return retVal;
    }

    /**
     * Record a warning about the host resolution.
     *
     * @param message	warning message
     */
    private void warn(String message) {
        log.warn(message);
        this.warning = message;
    }

    /**
     * @return the host-match tier for a reference record
     *
     * @param record	reference record to check
     */
    public HostMatchLevel match(ReferenceRecord record) {
        HostMatchLevel retVal;
        if (this.profile == null || record.isGeneralHost())
            retVal = HostMatchLevel.GENERAL;
        else {
            String recordHost = StringUtils.normalizeSpace(record.getHost());
            if (this.isSpecies(recordHost))
                retVal = HostMatchLevel.SPECIES;
            else if (same(StringUtils.substringBefore(recordHost, " "), this.profileGenus()))
                retVal = HostMatchLevel.GENUS;
            else if (same(this.recordFamily(record), this.profile.getFamily()))
                retVal = HostMatchLevel.FAMILY;
            else if (same(record.getHostOrder(), this.profile.getOrder()))
                retVal = HostMatchLevel.ORDER;
            else
                retVal = HostMatchLevel.MISMATCH;
        }
        return retVal;
    }

    /**
     * @return TRUE if the record host is the profile's species
     *
     * @param recordHost	normalized record host name
     */
    private boolean isSpecies(String recordHost) {
        String input = StringUtils.normalizeSpace(this.profile.getInputName());
        return same(recordHost, this.profile.getSpecies()) || same(recordHost, input);
    }

    /**
     * @return the genus of the profile host, or NULL if it is unknown
     */
    private String profileGenus() {
        String retVal = this.profile.getGenus();
        if (retVal == null) {
            String species = StringUtils.defaultIfBlank(this.profile.getSpecies(), this.profile.getInputName());
            retVal = StringUtils.substringBefore(StringUtils.normalizeSpace(species), " ");
        }
        return retVal;
    }

    /**
     * @return the host family for a reference record, or NULL if it is unknown
     *
     * @param record	reference record of interest
     */
    private String recordFamily(ReferenceRecord record) {
        String retVal = record.getHostFamily();
        if (retVal == null && this.derivation == FamilyDerivation.LOOKUP) {
            String host = record.getHost();
            if (this.familyCache.containsKey(host))
                retVal = this.familyCache.get(host);
            else {
                HostProfile recordProfile = this.taxonomy.resolve(host);
                if (recordProfile != null)
                    retVal = recordProfile.getFamily();
                this.familyCache.put(host, retVal);
            }
        }
        return retVal;
    }

    /**
     * @return TRUE if both names are present and equal (case-insensitive)
     *
     * @param a		first name
     * @param b		second name
     */
    private static boolean same(String a, String b) {
        return ! StringUtils.isBlank(a) && ! StringUtils.isBlank(b) && a.trim().equalsIgnoreCase(b.trim());
    }

    /**
     * @return the host profile, or NULL if there is no host context
     */
    public HostProfile getProfile() {
        return this.profile;
    }

    /**
     * @return TRUE if host-specific weighting is active
     */
    public boolean isHostSpecific() {
        return this.profile != null;
    }

    /**
     * @return the warning about the host resolution, or NULL if there was none
     */
    public String getWarning() {
        return this.warning;
    }

}

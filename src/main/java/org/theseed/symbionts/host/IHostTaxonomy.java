/**
 *
 */
package org.theseed.symbionts.host;

/**
 * This interface describes a read-only insect taxonomy lookup.  Given a host name, it returns the
 * order, family, genus, and species of the host.
 *
 */
public interface IHostTaxonomy {

    /**
     * @return the profile of the named host, or NULL if the name is not found
     *
     * @param name	host name (usually a species binomial)
     */
    public HostProfile resolve(String name);

}

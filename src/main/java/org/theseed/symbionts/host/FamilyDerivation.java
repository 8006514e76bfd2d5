/**
 *
 */
package org.theseed.symbionts.host;

/**
 * Method for finding the host family of a reference record that does not declare one.
 *
 */
public enum FamilyDerivation {
    /** records without a host family never match at the family tier */
    NONE,
    /** the record's host name is looked up in the host taxonomy */
    LOOKUP;
}

/**
 *
 */
package org.theseed.symbionts.records;

/**
 * Type of a curated reference record.  Records describing a confirmed symbiont relationship carry
 * more weight than other literature records.
 *
 */
public enum RecordType {
    SYMBIONT, OTHER;

    /**
     * @return the record type for a record-type string, or NULL if the string is empty
     *
     * @param value		record-type string from the record store
     */
    public static RecordType parse(String value) {
        RecordType retVal = null;
        if (value != null && ! value.isBlank())
            retVal = (value.trim().equalsIgnoreCase("symbiont") ? SYMBIONT : OTHER);
        return retVal;
    }

}

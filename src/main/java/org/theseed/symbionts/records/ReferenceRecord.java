/**
 *
 */
package org.theseed.symbionts.records;

import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.theseed.symbionts.taxonomy.TaxonLineage;

/**
 * This object represents a curated reference record linking a symbiont taxon to a biological
 * function in an insect host.  Records are immutable and are built using the nested builder.
 * The taxonomy label, host, and function are required.  All other fields are optional and are
 * NULL when absent.
 *
 */
public class ReferenceRecord {

    // FIELDS
    /** identifying string for messages (usually the source line number) */
    private final String id;
    /** symbiont taxonomy label */
    private final String taxonLabel;
    /** parsed symbiont lineage */
    private final TaxonLineage lineage;
    /** function tag */
    private final String function;
    /** host species name, or "General" */
    private final String host;
    /** host order */
    private final String hostOrder;
    /** host family */
    private final String hostFamily;
    /** record type */
    private final RecordType recordType;
    /** genome accession */
    private final String genomeId;
    /** journal of publication */
    private final String journal;
    /** function description */
    private final String description;
    /** evidence citation (usually a DOI) */
    private final String evidenceCitation;
    /** stored evidence level, or NULL if the store does not have one */
    private final Integer evidenceLevel;
    /** host name denoting a record with no host specificity */
    public static final String GENERAL_HOST = "General";
    /** values that denote a missing field */
    private static final Set<String> SENTINELS = Set.of("*", "n/a", "na", "none", "null", "nan");

    /**
     * This class is used to build reference records.
     */
    public static class Builder {

        private String id;
        private String taxonLabel;
        private String function;
        private String host;
        private String hostOrder;
        private String hostFamily;
        private RecordType recordType;
        private String genomeId;
        private String journal;
        private String description;
        private String evidenceCitation;
        private Integer evidenceLevel;

        public Builder(String id) {
            this.id = id;
        }

        public Builder taxonLabel(String taxonLabel) {
            this.taxonLabel = clean(taxonLabel);
            return this;
        }

        public Builder function(String function) {
            this.function = clean(function);
            return this;
        }

        public Builder host(String host) {
            this.host = clean(host);
            return this;
        }

        public Builder hostOrder(String hostOrder) {
            this.hostOrder = clean(hostOrder);
            return this;
        }

        public Builder hostFamily(String hostFamily) {
            this.hostFamily = clean(hostFamily);
            return this;
        }

        public Builder recordType(RecordType recordType) {
            this.recordType = recordType;
            return this;
        }

        public Builder genomeId(String genomeId) {
            this.genomeId = clean(genomeId);
            return this;
        }

        public Builder journal(String journal) {
            this.journal = clean(journal);
            return this;
        }

        public Builder description(String description) {
            this.description = clean(description);
            return this;
        }

        public Builder evidenceCitation(String evidenceCitation) {
            this.evidenceCitation = clean(evidenceCitation);
            return this;
        }

        public Builder evidenceLevel(Integer evidenceLevel) {
            this.evidenceLevel = evidenceLevel;
            return this;
        }

        /**
         * @return the name of the first missing required field, or NULL if all are present
         */
        public String missingField() {
            String retVal = null;
            if (this.taxonLabel == null)
                retVal = "taxonomy";
            else if (this.host == null)
                retVal = "host";
            else if (this.function == null)
                retVal = "function";
            return retVal;
        }

        /**
         * @return the reference record built
         *
         * @throws IllegalStateException if a required field is missing
         */
        public ReferenceRecord build() {
            String missing = this.missingField();
            if (missing != null)
                throw new IllegalStateException("Reference record " + this.id + " is missing required field \"" + missing + "\".");
            if (this.evidenceLevel != null && (this.evidenceLevel < 1 || this.evidenceLevel > 5))
                throw new IllegalStateException("Reference record " + this.id + " has invalid evidence level " + this.evidenceLevel + ".");
            return new ReferenceRecord(this);
        }

    }

    private ReferenceRecord(Builder builder) {
        this.id = builder.id;
        this.taxonLabel = builder.taxonLabel;
        this.lineage = TaxonLineage.parse(builder.taxonLabel);
        this.function = builder.function;
        this.host = builder.host;
        this.hostOrder = builder.hostOrder;
        this.hostFamily = builder.hostFamily;
        this.recordType = builder.recordType;
        this.genomeId = builder.genomeId;
        this.journal = builder.journal;
        this.description = builder.description;
        this.evidenceCitation = builder.evidenceCitation;
        this.evidenceLevel = builder.evidenceLevel;
    }

    /**
     * @return a field value with sentinels converted to NULL and whitespace trimmed
     *
     * @param value		raw field value
     */
    public static String clean(String value) {
        String retVal = StringUtils.trimToNull(value);
        if (retVal != null && SENTINELS.contains(retVal.toLowerCase()))
            retVal = null;
        return retVal;
    }

    /**
     * @return TRUE if this record has no host specificity
     */
    public boolean isGeneralHost() {
        return GENERAL_HOST.equalsIgnoreCase(this.host);
    }

    /**
     * @return the identifying string for this record
     */
    public String getId() {
        return this.id;
    }

    /**
     * @return the symbiont taxonomy label
     */
    public String getTaxonLabel() {
        return this.taxonLabel;
    }

    /**
     * @return the parsed symbiont lineage
     */
    public TaxonLineage getLineage() {
        return this.lineage;
    }

    /**
     * @return the function tag
     */
    public String getFunction() {
        return this.function;
    }

    /**
     * @return the host name
     */
    public String getHost() {
        return this.host;
    }

    /**
     * @return the host order, or NULL if it is unknown
     */
    public String getHostOrder() {
        return this.hostOrder;
    }

    /**
     * @return the host family, or NULL if it is unknown
     */
    public String getHostFamily() {
        return this.hostFamily;
    }

    /**
     * @return the record type, or NULL if it is unknown
     */
    public RecordType getRecordType() {
        return this.recordType;
    }

    /**
     * @return the genome accession, or NULL if there is none
     */
    public String getGenomeId() {
        return this.genomeId;
    }

    /**
     * @return the journal name, or NULL if it is unknown
     */
    public String getJournal() {
        return this.journal;
    }

    /**
     * @return the function description (empty if there is none)
     */
    public String getDescription() {
        return StringUtils.defaultString(this.description);
    }

    /**
     * @return the evidence citation (empty if there is none)
     */
    public String getEvidenceCitation() {
        return StringUtils.defaultString(this.evidenceCitation);
    }

    /**
     * @return the stored evidence level, or NULL if the record store did not supply one
     */
    public Integer getEvidenceLevel() {
        return this.evidenceLevel;
    }

    @Override
    public String toString() {
        return "record " + this.id + " (" + this.lineage.getDisplayName(null) + " -> " + this.function + " in " + this.host + ")";
    }

}

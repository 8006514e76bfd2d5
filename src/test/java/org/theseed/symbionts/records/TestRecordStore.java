/**
 *
 */
package org.theseed.symbionts.records;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.theseed.symbionts.evidence.EvidenceClassifier;
import org.theseed.symbionts.utils.ParseFailureException;

/**
 *
 */
class TestRecordStore {

    @Test
    void testLoad() throws IOException, ParseFailureException {
        RecordStore store = RecordStore.load(new File("data", "records.tsv"));
        assertThat(store.size(), equalTo(7));
        List<String> warnings = store.getWarnings();
        assertThat(warnings.size(), equalTo(3));
        assertThat(warnings.get(0), containsString("line 6"));
        assertThat(warnings.get(0), containsString("function"));
        assertThat(warnings.get(1), containsString("line 8"));
        assertThat(warnings.get(2), containsString("no genus"));
        List<ReferenceRecord> buchnera = store.findSpecies("buchnera APHIDICOLA");
        assertThat(buchnera.size(), equalTo(2));
        ReferenceRecord record = buchnera.get(0);
        assertThat(record.getFunction(), equalTo("Amino acid provisioning"));
        assertThat(record.getHost(), equalTo("Acyrthosiphon pisum"));
        assertThat(record.getHostOrder(), equalTo("Hemiptera"));
        assertThat(record.getHostFamily(), equalTo("Aphididae"));
        assertThat(record.getRecordType(), equalTo(RecordType.SYMBIONT));
        assertThat(record.getGenomeId(), equalTo("GCF_000009605.1"));
        assertThat(record.getJournal(), equalTo("Nature"));
        assertThat(record.getEvidenceCitation(), equalTo("doi:10.1038/35024074"));
        assertThat(record.getEvidenceLevel(), equalTo(5));
        assertThat(record.isGeneralHost(), equalTo(false));
        record = buchnera.get(1);
        assertThat(record.getFunction(), equalTo("Vitamin provisioning"));
        assertThat(record.getEvidenceLevel(), nullValue());
        assertThat(store.findGenus("Buchnera").size(), equalTo(2));
        List<ReferenceRecord> wolbachia = store.findGenus("wolbachia");
        assertThat(wolbachia.size(), equalTo(1));
        record = wolbachia.get(0);
        assertThat(record.isGeneralHost(), equalTo(true));
        assertThat(record.getHostOrder(), nullValue());
        assertThat(record.getHostFamily(), nullValue());
        assertThat(record.getGenomeId(), nullValue());
        // The invalid evidence level is discarded.
        record = store.findSpecies("Portiera aleyrodidarum").get(0);
        assertThat(record.getEvidenceLevel(), nullValue());
        // Sentinel values are absent.
        record = store.findSpecies("Serratia symbiotica").get(0);
        assertThat(record.getHostOrder(), nullValue());
        assertThat(record.getRecordType(), nullValue());
        assertThat(record.getDescription(), equalTo("Co-obligate symbiont."));
        assertThat(record.getEvidenceCitation(), equalTo(""));
        assertThat(store.findSpecies("Sodalis praecaptivus"), empty());
        assertThat(store.findSpecies(null), empty());
        assertThat(store.findGenus("Arsenophonus"), empty());
        assertThat(store.getRecords().get(0).getId(), equalTo("line 2"));
    }

    @Test
    void testMissingEvidenceColumn() throws IOException, ParseFailureException {
        RecordStore store = RecordStore.load(new File("data", "records_nolevel.tsv"));
        assertThat(store.size(), equalTo(2));
        assertThat(store.getWarnings(), empty());
        EvidenceClassifier classifier = new EvidenceClassifier();
        for (ReferenceRecord record : store.getRecords()) {
            assertThat(record.getEvidenceLevel(), nullValue());
            assertThat(record.getHostOrder(), nullValue());
            assertThat(record.getHostFamily(), nullValue());
            assertThat(classifier.levelOf(record), equalTo(2));
            assertThat(EvidenceClassifier.weightOf(classifier.levelOf(record)), closeTo(1.0, 1e-9));
        }
        assertThat(store.findGenus("Wolbachia").get(0).isGeneralHost(), equalTo(true));
    }

    @Test
    void testMissingColumn() {
        assertThrows(ParseFailureException.class, () -> RecordStore.load(new File("data", "records_nofunction.tsv")));
    }

    @Test
    void testBuilder() {
        ReferenceRecord.Builder builder = new ReferenceRecord.Builder("x1").taxonLabel("g__Sodalis")
                .host("  N/A ").function("Thiamine synthesis");
        assertThat(builder.missingField(), equalTo("host"));
        assertThrows(IllegalStateException.class, () -> builder.build());
        builder.host("Glossina morsitans").evidenceLevel(6);
        assertThrows(IllegalStateException.class, () -> builder.build());
        ReferenceRecord record = builder.evidenceLevel(3).build();
        assertThat(record.getEvidenceLevel(), equalTo(3));
        assertThat(record.getLineage().getGenus(), equalTo("Sodalis"));
        assertThat(record.getDescription(), equalTo(""));
        assertThat(ReferenceRecord.clean(" none "), nullValue());
        assertThat(ReferenceRecord.clean("*"), nullValue());
        assertThat(ReferenceRecord.clean(" Hemiptera "), equalTo("Hemiptera"));
        assertThat(RecordType.parse("SYMBIONT"), equalTo(RecordType.SYMBIONT));
        assertThat(RecordType.parse("pathogen"), equalTo(RecordType.OTHER));
        assertThat(RecordType.parse(" "), nullValue());
    }

}

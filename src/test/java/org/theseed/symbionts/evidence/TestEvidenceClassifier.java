/**
 *
 */
package org.theseed.symbionts.evidence;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Set;

import org.junit.jupiter.api.Test;
import org.theseed.symbionts.records.RecordType;
import org.theseed.symbionts.records.ReferenceRecord;

/**
 *
 */
class TestEvidenceClassifier {

    @Test
    void testWeights() {
        assertThat(EvidenceClassifier.weightOf(5), closeTo(1.5, 1e-9));
        assertThat(EvidenceClassifier.weightOf(4), closeTo(1.3, 1e-9));
        assertThat(EvidenceClassifier.weightOf(3), closeTo(1.15, 1e-9));
        assertThat(EvidenceClassifier.weightOf(2), closeTo(1.0, 1e-9));
        assertThat(EvidenceClassifier.weightOf(1), closeTo(0.8, 1e-9));
        assertThrows(IllegalArgumentException.class, () -> EvidenceClassifier.weightOf(0));
        assertThrows(IllegalArgumentException.class, () -> EvidenceClassifier.weightOf(6));
    }

    @Test
    void testDerivation() {
        EvidenceClassifier classifier = new EvidenceClassifier();
        assertThat(classifier.deriveLevel(RecordType.SYMBIONT, "GCF_000009605.1", "Nature"), equalTo(4));
        assertThat(classifier.deriveLevel(RecordType.SYMBIONT, "GCF_000009605.1", "Journal of Bacteriology"), equalTo(3));
        assertThat(classifier.deriveLevel(RecordType.OTHER, "GCF_000009605.1", null), equalTo(2));
        assertThat(classifier.deriveLevel(RecordType.SYMBIONT, null, null), equalTo(1));
        assertThat(classifier.deriveLevel(RecordType.OTHER, "", "Cell Host & Microbe"), equalTo(1));
        assertThat(classifier.deriveLevel(RecordType.OTHER, null, null), equalTo(1));
        assertThat(classifier.isHighImpact("nature microbiology"), equalTo(true));
        assertThat(classifier.isHighImpact("Proceedings of the National Academy of Sciences USA"), equalTo(true));
        assertThat(classifier.isHighImpact(" ISME Journal"), equalTo(true));
        assertThat(classifier.isHighImpact("Insect Molecular Biology"), equalTo(false));
        assertThat(classifier.isHighImpact(null), equalTo(false));
        classifier = new EvidenceClassifier(Set.of("Insect Molecular Biology"));
        assertThat(classifier.isHighImpact("insect molecular biology"), equalTo(true));
        assertThat(classifier.isHighImpact("Nature"), equalTo(false));
    }

    @Test
    void testLevels() {
        EvidenceClassifier classifier = new EvidenceClassifier();
        ReferenceRecord.Builder builder = new ReferenceRecord.Builder("e1").taxonLabel("g__Buchnera;s__aphidicola")
                .host("Acyrthosiphon pisum").function("Amino acid provisioning");
        // No stored level and no metadata gives the default.
        assertThat(classifier.levelOf(builder.build()), equalTo(EvidenceClassifier.DEFAULT_LEVEL));
        // Metadata is used when there is no stored level.
        builder.recordType(RecordType.SYMBIONT).genomeId("GCF_000009605.1").journal("Science");
        assertThat(classifier.levelOf(builder.build()), equalTo(4));
        // A stored level always wins.
        builder.evidenceLevel(1);
        assertThat(classifier.levelOf(builder.build()), equalTo(1));
        builder.evidenceLevel(5);
        assertThat(classifier.levelOf(builder.build()), equalTo(5));
    }

}

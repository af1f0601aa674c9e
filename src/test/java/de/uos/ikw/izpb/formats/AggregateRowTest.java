package de.uos.ikw.izpb.formats;

import de.uos.ikw.izpb.schemas.AggregateRecord;
import de.uos.ikw.izpb.schemas.ConnotationMeans;
import de.uos.ikw.izpb.schemas.GenderLabel;
import de.uos.ikw.izpb.schemas.Granularity;
import de.uos.ikw.izpb.schemas.MentionKind;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AggregateRowTest {

    private static AggregateRecord record() {
        Map<MentionKind, Map<GenderLabel, Integer>> counts = new EnumMap<>(MentionKind.class);
        counts.put(MentionKind.PER, new EnumMap<>(Map.of(GenderLabel.FEMALE, 2)));
        counts.put(MentionKind.PRN, new EnumMap<>(Map.of(GenderLabel.MALE, 3, GenderLabel.UNDETERMINED, 4,
                GenderLabel.AMBIGUOUS, 1)));
        Map<GenderLabel, ConnotationMeans> descriptors = new EnumMap<>(GenderLabel.class);
        descriptors.put(GenderLabel.FEMALE, new ConnotationMeans(6.5, 4.0, 3.0, 2.0, 2, 1));
        descriptors.put(GenderLabel.UNDETERMINED, new ConnotationMeans(Double.NaN, Double.NaN, Double.NaN,
                Double.NaN, 0, 5));
        return new AggregateRecord(Granularity.ARTICLE, "a1", "Titel", 1, 100, 0, counts, Map.of(), descriptors, 3,
                Map.of("binary", 2), null);
    }

    @Test
    void undeterminedPrnsHaveTheirOwnColumn() {
        AggregateRow row = AggregateRow.of(record());

        assertThat(row.prnMale()).isEqualTo(3);
        assertThat(row.prnUndetermined()).isEqualTo(4);
        assertThat(row.prnAmbiguous()).isEqualTo(1);
        assertThat(row.perFemale()).isEqualTo(2);
    }

    @Test
    void descriptorColumnsCarryCountsAndNorms() {
        AggregateRow row = AggregateRow.of(record());

        assertThat(row.femaleDescriptors()).isEqualTo(3);
        assertThat(row.undeterminedDescriptors()).isEqualTo(5);
        assertThat(row.maleDescriptors()).isZero();
        assertThat(row.numNegations()).isEqualTo(3);
        assertThat(row.femaleDescriptorValence()).isEqualTo("6.5");
        assertThat(row.femaleDescriptorNoScore()).isEqualTo(1);
        assertThat(row.maleDescriptorValence()).isEmpty();
        assertThat(row.inferredGender()).isEmpty();
        assertThat(row.binary()).isEqualTo(2);
    }
}

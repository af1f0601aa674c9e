package de.uos.ikw.izpb.formats;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import de.uos.ikw.izpb.schemas.AggregateRecord;
import de.uos.ikw.izpb.schemas.ConnotationMeans;
import de.uos.ikw.izpb.schemas.GenderLabel;
import de.uos.ikw.izpb.schemas.MentionKind;

import static de.uos.ikw.izpb.util.AuxiliarFunctions.formatDouble;

/**
 * Flat table layout of an AggregateRecord. Column names follow the stats table consumed by the
 * evaluation notebooks; missing values (NaN means, undefined ratios) are written as empty cells.
 */
@JsonPropertyOrder({"key", "name", "num_articles", "token_num", "num_slashes",
        "num_PER_F", "num_PER_M", "num_PER_NA", "num_PER_AMB",
        "num_PRN_F", "num_PRN_M", "num_PRN_NA", "num_PRN_AMB",
        "prop_F", "prop_M", "prop_NA", "prop_AMB", "female_share",
        "F_VAL", "F_AROU", "F_IMA", "F_CONC", "M_VAL", "M_AROU", "M_IMA", "M_CONC",
        "num_scored_F", "num_scored_M", "num_noGLEAN_F", "num_noGLEAN_M",
        "num_DESCR_F", "num_DESCR_M", "num_DESCR_NA", "num_DESCR_AMB", "num_NEG",
        "DESCR_F_VAL", "DESCR_F_AROU", "DESCR_F_IMA", "DESCR_F_CONC",
        "DESCR_M_VAL", "DESCR_M_AROU", "DESCR_M_IMA", "DESCR_M_CONC",
        "num_noGLEAN_DESCR_F", "num_noGLEAN_DESCR_M",
        "binary", "gender_incl", "neopronouns", "different_gender_conceptions", "inferred_gender"})
public record AggregateRow(
        String key,
        String name,
        @JsonProperty("num_articles") int numArticles,
        @JsonProperty("token_num") long numTokens,
        @JsonProperty("num_slashes") int numSlashes,
        @JsonProperty("num_PER_F") int perFemale,
        @JsonProperty("num_PER_M") int perMale,
        @JsonProperty("num_PER_NA") int perUndetermined,
        @JsonProperty("num_PER_AMB") int perAmbiguous,
        @JsonProperty("num_PRN_F") int prnFemale,
        @JsonProperty("num_PRN_M") int prnMale,
        @JsonProperty("num_PRN_NA") int prnUndetermined,
        @JsonProperty("num_PRN_AMB") int prnAmbiguous,
        @JsonProperty("prop_F") String propFemale,
        @JsonProperty("prop_M") String propMale,
        @JsonProperty("prop_NA") String propUndetermined,
        @JsonProperty("prop_AMB") String propAmbiguous,
        @JsonProperty("female_share") String femaleShare,
        @JsonProperty("F_VAL") String femaleValence,
        @JsonProperty("F_AROU") String femaleArousal,
        @JsonProperty("F_IMA") String femaleImageability,
        @JsonProperty("F_CONC") String femaleConcreteness,
        @JsonProperty("M_VAL") String maleValence,
        @JsonProperty("M_AROU") String maleArousal,
        @JsonProperty("M_IMA") String maleImageability,
        @JsonProperty("M_CONC") String maleConcreteness,
        @JsonProperty("num_scored_F") long femaleScored,
        @JsonProperty("num_scored_M") long maleScored,
        @JsonProperty("num_noGLEAN_F") int femaleNoScore,
        @JsonProperty("num_noGLEAN_M") int maleNoScore,
        @JsonProperty("num_DESCR_F") long femaleDescriptors,
        @JsonProperty("num_DESCR_M") long maleDescriptors,
        @JsonProperty("num_DESCR_NA") long undeterminedDescriptors,
        @JsonProperty("num_DESCR_AMB") long ambiguousDescriptors,
        @JsonProperty("num_NEG") int numNegations,
        @JsonProperty("DESCR_F_VAL") String femaleDescriptorValence,
        @JsonProperty("DESCR_F_AROU") String femaleDescriptorArousal,
        @JsonProperty("DESCR_F_IMA") String femaleDescriptorImageability,
        @JsonProperty("DESCR_F_CONC") String femaleDescriptorConcreteness,
        @JsonProperty("DESCR_M_VAL") String maleDescriptorValence,
        @JsonProperty("DESCR_M_AROU") String maleDescriptorArousal,
        @JsonProperty("DESCR_M_IMA") String maleDescriptorImageability,
        @JsonProperty("DESCR_M_CONC") String maleDescriptorConcreteness,
        @JsonProperty("num_noGLEAN_DESCR_F") int femaleDescriptorNoScore,
        @JsonProperty("num_noGLEAN_DESCR_M") int maleDescriptorNoScore,
        int binary,
        @JsonProperty("gender_incl") int genderInclusive,
        int neopronouns,
        @JsonProperty("different_gender_conceptions") int differentGenderConceptions,
        @JsonProperty("inferred_gender") String inferredGender
) {

    public static AggregateRow of(AggregateRecord record) {
        ConnotationMeans female = record.connotation(GenderLabel.FEMALE);
        ConnotationMeans male = record.connotation(GenderLabel.MALE);
        ConnotationMeans femaleDescriptors = record.descriptorConnotation(GenderLabel.FEMALE);
        ConnotationMeans maleDescriptors = record.descriptorConnotation(GenderLabel.MALE);
        return new AggregateRow(
                record.key(),
                record.name(),
                record.numArticles(),
                record.numTokens(),
                record.numSlashes(),
                record.count(MentionKind.PER, GenderLabel.FEMALE),
                record.count(MentionKind.PER, GenderLabel.MALE),
                record.count(MentionKind.PER, GenderLabel.UNDETERMINED),
                record.count(MentionKind.PER, GenderLabel.AMBIGUOUS),
                record.count(MentionKind.PRN, GenderLabel.FEMALE),
                record.count(MentionKind.PRN, GenderLabel.MALE),
                record.count(MentionKind.PRN, GenderLabel.UNDETERMINED),
                record.count(MentionKind.PRN, GenderLabel.AMBIGUOUS),
                formatDouble(record.proportion(GenderLabel.FEMALE)),
                formatDouble(record.proportion(GenderLabel.MALE)),
                formatDouble(record.proportion(GenderLabel.UNDETERMINED)),
                formatDouble(record.proportion(GenderLabel.AMBIGUOUS)),
                formatDouble(record.femaleShare()),
                formatDouble(female.valence()),
                formatDouble(female.arousal()),
                formatDouble(female.imageability()),
                formatDouble(female.concreteness()),
                formatDouble(male.valence()),
                formatDouble(male.arousal()),
                formatDouble(male.imageability()),
                formatDouble(male.concreteness()),
                female.scored(),
                male.scored(),
                female.noScore(),
                male.noScore(),
                record.numDescriptors(GenderLabel.FEMALE),
                record.numDescriptors(GenderLabel.MALE),
                record.numDescriptors(GenderLabel.UNDETERMINED),
                record.numDescriptors(GenderLabel.AMBIGUOUS),
                record.numNegations(),
                formatDouble(femaleDescriptors.valence()),
                formatDouble(femaleDescriptors.arousal()),
                formatDouble(femaleDescriptors.imageability()),
                formatDouble(femaleDescriptors.concreteness()),
                formatDouble(maleDescriptors.valence()),
                formatDouble(maleDescriptors.arousal()),
                formatDouble(maleDescriptors.imageability()),
                formatDouble(maleDescriptors.concreteness()),
                femaleDescriptors.noScore(),
                maleDescriptors.noScore(),
                record.beyondBinary().getOrDefault("binary", 0),
                record.beyondBinary().getOrDefault("gender_incl", 0),
                record.beyondBinary().getOrDefault("neopronouns", 0),
                record.beyondBinary().getOrDefault("different_gender_conceptions", 0),
                record.authorGender() == null ? "" : record.authorGender().label()
        );
    }
}

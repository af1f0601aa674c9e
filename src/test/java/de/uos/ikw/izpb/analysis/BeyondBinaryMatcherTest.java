package de.uos.ikw.izpb.analysis;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static de.uos.ikw.izpb.analysis.BeyondBinaryMatcher.BeyondBinaryPattern.BINARY;
import static de.uos.ikw.izpb.analysis.BeyondBinaryMatcher.BeyondBinaryPattern.DIFFERENT_GENDER_CONCEPTIONS;
import static de.uos.ikw.izpb.analysis.BeyondBinaryMatcher.BeyondBinaryPattern.GENDER_INCL;
import static de.uos.ikw.izpb.analysis.BeyondBinaryMatcher.BeyondBinaryPattern.NEOPRONOUNS;
import static org.assertj.core.api.Assertions.assertThat;

class BeyondBinaryMatcherTest {

    private final BeyondBinaryMatcher matcher = new BeyondBinaryMatcher();

    @Test
    void binaryPairForms() {
        assertThat(BINARY.matches("LehrerInnen")).isTrue();
        assertThat(BINARY.matches("Lehrer/innen")).isTrue();
        assertThat(BINARY.matches("Lehrer/-innen")).isTrue();
        assertThat(BINARY.matches("Lehrer(in)")).isTrue();
        assertThat(BINARY.matches("Lehrerinnen")).isFalse();
        assertThat(BINARY.matches("Lehrer*innen")).isFalse();
    }

    @Test
    void genderInclusiveForms() {
        assertThat(GENDER_INCL.matches("Lehrer*innen")).isTrue();
        assertThat(GENDER_INCL.matches("Lehrer_innen,")).isTrue();
        assertThat(GENDER_INCL.matches("Lehrer:in")).isTrue();
        assertThat(GENDER_INCL.matches("Beispiel:")).isFalse();
        assertThat(GENDER_INCL.matches("lehrer*innen")).isFalse();
    }

    @Test
    void neopronounsMatchWholeWordsOnly() {
        assertThat(NEOPRONOUNS.matches("Xier")).isTrue();
        assertThat(NEOPRONOUNS.matches("hen,")).isTrue();
        assertThat(NEOPRONOUNS.matches("(dey)")).isTrue();
        assertThat(NEOPRONOUNS.matches("sie*er")).isTrue();
        assertThat(NEOPRONOUNS.matches("sie")).isFalse();
        assertThat(NEOPRONOUNS.matches("Henne")).isFalse();
    }

    @Test
    void differentGenderConceptions() {
        assertThat(DIFFERENT_GENDER_CONCEPTIONS.matches("Transgender")).isTrue();
        assertThat(DIFFERENT_GENDER_CONCEPTIONS.matches("intergeschlechtlich")).isTrue();
        assertThat(DIFFERENT_GENDER_CONCEPTIONS.matches("nicht-binär")).isTrue();
        assertThat(DIFFERENT_GENDER_CONCEPTIONS.matches("LGBTQIA+")).isTrue();
        assertThat(DIFFERENT_GENDER_CONCEPTIONS.matches("international")).isFalse();
    }

    @Test
    void collectsMatchingChunksPerPattern() {
        Map<String, List<String>> matches = matcher.match("Xier fragt Lehrer*innen und Schüler/innen, LehrerInnen auch.");

        assertThat(matches).containsOnlyKeys("binary", "gender_incl", "neopronouns", "different_gender_conceptions");
        assertThat(matches.get("binary")).containsExactly("Schüler/innen,", "LehrerInnen");
        assertThat(matches.get("gender_incl")).containsExactly("Lehrer*innen");
        assertThat(matches.get("neopronouns")).containsExactly("Xier");
        assertThat(matches.get("different_gender_conceptions")).isEmpty();
    }

    @Test
    void stripsEdgePunctuation() {
        assertThat(BeyondBinaryMatcher.stripPunctuation("„xier“,")).isEqualTo("xier");
        assertThat(BeyondBinaryMatcher.stripPunctuation("(hen)")).isEqualTo("hen");
    }
}

package de.uos.ikw.izpb.analysis;

import de.uos.ikw.izpb.lexicon.PrnTable;
import de.uos.ikw.izpb.schemas.Author;
import de.uos.ikw.izpb.schemas.GenderLabel;
import de.uos.ikw.izpb.schemas.PrnEntry;
import de.uos.ikw.izpb.schemas.Resolution;
import de.uos.ikw.izpb.schemas.ResolutionSource;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static de.uos.ikw.izpb.schemas.GenderLabel.AMBIGUOUS;
import static de.uos.ikw.izpb.schemas.GenderLabel.FEMALE;
import static de.uos.ikw.izpb.schemas.GenderLabel.MALE;
import static de.uos.ikw.izpb.schemas.GenderLabel.UNDETERMINED;
import static org.assertj.core.api.Assertions.assertThat;

class AuthorGenderInferenceTest {

    private final AuthorGenderInference inference = new AuthorGenderInference(new PrnTable(List.of(
            new PrnEntry("Lehrerin", FEMALE, ""),
            new PrnEntry("Lehrer", MALE, ""),
            new PrnEntry("Politologin", FEMALE, ""),
            new PrnEntry("Schüler", AMBIGUOUS, ""))));

    @Test
    void pronounsOfTheBiography() {
        assertThat(inference.pronounSignal("Sie unterrichtet an ihrer Schule.")).isEqualTo(FEMALE);
        assertThat(inference.pronounSignal("Seine Forschung gilt Wahlen.")).isEqualTo(MALE);
        assertThat(inference.pronounSignal("Er schreibt mit ihr zusammen.")).isEqualTo(AMBIGUOUS);
        assertThat(inference.pronounSignal("Studium in Bonn.")).isEqualTo(UNDETERMINED);
        assertThat(inference.pronounSignal(null)).isEqualTo(UNDETERMINED);
    }

    @Test
    void genderedNounsOfTheBiography() {
        assertThat(inference.prnSignal("Politologin und Lehrerin in Berlin")).isEqualTo(FEMALE);
        assertThat(inference.prnSignal("Lehrer in Bonn")).isEqualTo(MALE);
        assertThat(inference.prnSignal("Betreut Schüler in Bonn")).isEqualTo(UNDETERMINED);
    }

    @Test
    void combinesSignals() {
        assertThat(AuthorGenderInference.combine(FEMALE, UNDETERMINED, UNDETERMINED)).isEqualTo(FEMALE);
        assertThat(AuthorGenderInference.combine(FEMALE, FEMALE, FEMALE)).isEqualTo(FEMALE);
        assertThat(AuthorGenderInference.combine(AMBIGUOUS, MALE, UNDETERMINED)).isEqualTo(MALE);
        assertThat(AuthorGenderInference.combine(FEMALE, MALE, UNDETERMINED)).isEqualTo(AMBIGUOUS);
        assertThat(AuthorGenderInference.combine(UNDETERMINED, UNDETERMINED, AMBIGUOUS)).isEqualTo(AMBIGUOUS);
        assertThat(AuthorGenderInference.combine(UNDETERMINED, UNDETERMINED, UNDETERMINED)).isEqualTo(UNDETERMINED);
    }

    @Test
    void usesTheKnowledgeBaseAnswerOfTheNormalizedName() {
        Author anna = new Author("au-1", " Anna  Beispiel", "Anna Beispiel ist Lehrerin. Sie lebt in Berlin.");
        Author bernd = new Author("au-2", "Bernd Muster", "Studium in Bonn.");
        Map<String, Resolution> resolutions = Map.of(
                "Anna Beispiel", new Resolution(FEMALE, ResolutionSource.KNOWLEDGE_BASE, 1.0, "Q1:f"),
                "Bernd Muster", new Resolution(MALE, ResolutionSource.KNOWLEDGE_BASE, 1.0, "Q2:m"));

        List<AuthorGenderInference.AuthorGender> genders = inference.infer(List.of(anna, bernd), resolutions);

        assertThat(genders.get(0)).isEqualTo(new AuthorGenderInference.AuthorGender(anna, FEMALE, FEMALE, FEMALE, FEMALE));
        assertThat(genders.get(1).pronouns()).isEqualTo(UNDETERMINED);
        assertThat(genders.get(1).combined()).isEqualTo(MALE);
    }

    @Test
    void authorsWithoutAnySignalAreUndetermined() {
        Author author = new Author("au-3", "N. N.", "");

        assertThat(inference.infer(List.of(author), Map.of()).get(0).combined()).isEqualTo(UNDETERMINED);
    }
}

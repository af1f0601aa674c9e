package de.uos.ikw.izpb.analysis;

import de.uos.ikw.izpb.lexicon.PrnTable;
import de.uos.ikw.izpb.lucene.TextTokenizer;
import de.uos.ikw.izpb.nlp.DependencyParser;
import de.uos.ikw.izpb.nlp.DependencyParser.ParsedToken;
import de.uos.ikw.izpb.nlp.PersonRecognizer;
import de.uos.ikw.izpb.schemas.Article;
import de.uos.ikw.izpb.schemas.ArticleAnalysis;
import de.uos.ikw.izpb.schemas.Descriptor;
import de.uos.ikw.izpb.schemas.GenderLabel;
import de.uos.ikw.izpb.schemas.Mention;
import de.uos.ikw.izpb.schemas.MentionKind;
import de.uos.ikw.izpb.schemas.PrnEntry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class MentionExtractorTest {

    private static final PrnTable PRN_TABLE = new PrnTable(List.of(
            new PrnEntry("Lehrer", GenderLabel.MALE, ""),
            new PrnEntry("Lehrerin", GenderLabel.FEMALE, ""),
            new PrnEntry("Kanzlerin", GenderLabel.FEMALE, ""),
            new PrnEntry("Bundeskanzler", GenderLabel.MALE, ""),
            new PrnEntry("Schüler", GenderLabel.AMBIGUOUS, "")));

    /**
     * Recognizes the given names wherever they occur.
     */
    private static PersonRecognizer recognizing(String... names) {
        return text -> {
            List<PersonRecognizer.PersonSpan> spans = new ArrayList<>();
            for (String name : names) {
                int begin = text.indexOf(name);
                if (begin >= 0) {
                    spans.add(new PersonRecognizer.PersonSpan(begin, begin + name.length(), name));
                }
            }
            return spans;
        };
    }

    private static Article article(String... paragraphs) {
        return new Article("art-1", paragraphs[0], "vol-1", List.of("au-1"), List.of(paragraphs));
    }

    @Test
    void findsNamesAndPeopleReferencingNounsInTextOrder() {
        MentionExtractor extractor = new MentionExtractor(recognizing("Maria Schmidt"), PRN_TABLE);

        ArticleAnalysis analysis = extractor.extract(article("Bildung", "Die Lehrerin Maria Schmidt und der Lehrer"));

        assertThat(analysis.mentions())
                .extracting(Mention::paragraph, Mention::kind, Mention::surface, Mention::begin, Mention::end)
                .containsExactly(
                        tuple(1, MentionKind.PRN, "Lehrerin", 4, 12),
                        tuple(1, MentionKind.PER, "Maria Schmidt", 13, 26),
                        tuple(1, MentionKind.PRN, "Lehrer", 35, 41));
        assertThat(analysis.numTokens()).isEqualTo(8);
    }

    @Test
    void nounsInsideAPersonNameAreNotCounted() {
        MentionExtractor extractor = new MentionExtractor(recognizing("Bundeskanzler Scholz"), PRN_TABLE);

        ArticleAnalysis analysis = extractor.extract(article("Bundeskanzler Scholz und die Kanzlerin"));

        assertThat(analysis.mentions()).extracting(Mention::kind, Mention::lemma).containsExactly(
                tuple(MentionKind.PER, "Bundeskanzler Scholz"),
                tuple(MentionKind.PRN, "Kanzlerin"));
    }

    @Test
    void genderFormStemsAreNotMaleNouns() {
        MentionExtractor extractor = new MentionExtractor(recognizing(), PRN_TABLE);

        ArticleAnalysis analysis = extractor.extract(article("Lehrer*innen und Lehrer:innen fragen Schüler/innen"));

        assertThat(analysis.mentions()).isEmpty();
        assertThat(analysis.numSlashes()).isEqualTo(1);
        assertThat(analysis.beyondBinaryCounts()).containsEntry("gender_incl", 2).containsEntry("binary", 1);
    }

    @Test
    void pairFormsAreNotMaleNouns() {
        MentionExtractor extractor = new MentionExtractor(recognizing(), PRN_TABLE);

        ArticleAnalysis analysis = extractor.extract(article(
                "Lehrer/innen, Lehrer(innen), Lehrer / innen und LehrerInnen loben den Lehrer"));

        assertThat(analysis.mentions()).extracting(Mention::surface, Mention::lemma)
                .containsExactly(tuple("Lehrer", "Lehrer"));
        assertThat(analysis.mentions().get(0).begin()).isGreaterThan(40);
        assertThat(analysis.numSlashes()).isEqualTo(2);
    }

    @Test
    void descriptorsOfTheParagraphMentionsAreCollected() {
        String sentence = "Die kluge Lehrerin lacht nicht.";
        DependencyParser parser = text -> !text.equals(sentence) ? List.of() : List.of(List.of(
                new ParsedToken(1, 0, 3, "Die", "DET", 3, "det"),
                new ParsedToken(2, 4, 9, "kluge", "ADJ", 3, "amod"),
                new ParsedToken(3, 10, 18, "Lehrerin", "NOUN", 4, "nsubj"),
                new ParsedToken(4, 19, 24, "lacht", "VERB", 0, "root"),
                new ParsedToken(5, 25, 30, "nicht", "PART", 4, "advmod"),
                new ParsedToken(6, 30, 31, ".", "PUNCT", 4, "punct")));
        MentionExtractor extractor = new MentionExtractor(recognizing(), PRN_TABLE, new DescriptorExtractor(parser));

        ArticleAnalysis analysis = extractor.extract(article("Bildung", sentence));

        assertThat(analysis.descriptors()).extracting(Descriptor::word, Descriptor::paragraph)
                .containsExactly(tuple("kluge", 1), tuple("lacht", 1));
        assertThat(analysis.descriptors().get(0).targets()).containsExactlyElementsOf(analysis.mentions());
        assertThat(analysis.numNegations()).isEqualTo(1);
    }

    @Test
    void withoutAParserNoDescriptorsAreFound() {
        MentionExtractor extractor = new MentionExtractor(recognizing(), PRN_TABLE);

        ArticleAnalysis analysis = extractor.extract(article("Die kluge Lehrerin lacht nicht."));

        assertThat(analysis.mentions()).hasSize(1);
        assertThat(analysis.descriptors()).isEmpty();
        assertThat(analysis.numNegations()).isZero();
    }

    @Test
    void inflectedNounsResolveToTheirLemma() {
        MentionExtractor extractor = new MentionExtractor(recognizing(), PRN_TABLE);

        ArticleAnalysis analysis = extractor.extract(article("Die Hefte des Lehrers"));

        assertThat(analysis.mentions()).extracting(Mention::surface, Mention::lemma)
                .containsExactly(tuple("Lehrers", "Lehrer"));
    }

    @Test
    void lowerCaseTokensAreIgnored() {
        MentionExtractor extractor = new MentionExtractor(recognizing(), PRN_TABLE);

        assertThat(extractor.extract(article("die lehrerin")).mentions()).isEmpty();
    }

    @Test
    void detectsGenderFormStems() {
        String text = "Lehrer*innen Lehrer* Lehrer Lehrer(innen)";

        assertThat(MentionExtractor.isGenderFormStem(text, new TextTokenizer.Token("Lehrer", 0, 6, 0))).isTrue();
        assertThat(MentionExtractor.isGenderFormStem(text, new TextTokenizer.Token("Lehrer", 13, 19, 2))).isFalse();
        assertThat(MentionExtractor.isGenderFormStem(text, new TextTokenizer.Token("Lehrer", 21, 27, 3))).isFalse();
        assertThat(MentionExtractor.isGenderFormStem(text, new TextTokenizer.Token("Lehrer", 28, 34, 4))).isTrue();
    }
}

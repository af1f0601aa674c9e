package de.uos.ikw.izpb.analysis;

import de.uos.ikw.izpb.lexicon.ConnotationLexicon;
import de.uos.ikw.izpb.schemas.AggregateRecord;
import de.uos.ikw.izpb.schemas.Article;
import de.uos.ikw.izpb.schemas.ArticleAnalysis;
import de.uos.ikw.izpb.schemas.ConnotationMeans;
import de.uos.ikw.izpb.schemas.ConnotationScore;
import de.uos.ikw.izpb.schemas.Descriptor;
import de.uos.ikw.izpb.schemas.GenderLabel;
import de.uos.ikw.izpb.schemas.Granularity;
import de.uos.ikw.izpb.schemas.Mention;
import de.uos.ikw.izpb.schemas.MentionKind;
import de.uos.ikw.izpb.schemas.Resolution;
import de.uos.ikw.izpb.schemas.ResolutionSource;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class StatisticsAggregatorTest {

    private static final ConnotationLexicon LEXICON = new ConnotationLexicon(List.of(
            new ConnotationScore("Lehrerin", 6.0, 3.0, 5.0, 4.0),
            new ConnotationScore("Politiker", 3.0, 5.0, 4.0, 3.0),
            new ConnotationScore("klug", 6.5, 4.0, 3.0, 2.0)));

    private final StatisticsAggregator aggregator = new StatisticsAggregator(LEXICON);

    private static Mention mention(String articleId, MentionKind kind, String lemma, GenderLabel label) {
        Mention mention = new Mention(articleId, 1, 0, lemma.length(), lemma, lemma, kind);
        mention.setResolution(new Resolution(label, kind == MentionKind.PRN ? ResolutionSource.PRN_LIST
                : ResolutionSource.KNOWLEDGE_BASE, 1.0, ""));
        return mention;
    }

    private static ArticleAnalysis analysis(String id, String volumeId, List<String> authorIds, List<Mention> mentions,
                                            int numTokens, int numSlashes, int numBinary) {
        Article article = new Article(id, "Titel " + id, volumeId, authorIds, List.of("Titel " + id));
        Map<String, List<String>> beyondBinary = BeyondBinaryMatcher.empty();
        for (int i = 0; i < numBinary; i++) {
            beyondBinary.get("binary").add("Lehrer/innen");
        }
        return new ArticleAnalysis(article, mentions, numTokens, numSlashes, beyondBinary);
    }

    private static ArticleAnalysis mixedArticle() {
        List<Mention> mentions = new ArrayList<>();
        mentions.add(mention("a1", MentionKind.PER, "Maria Schmidt", GenderLabel.FEMALE));
        mentions.add(mention("a1", MentionKind.PRN, "Lehrerin", GenderLabel.FEMALE));
        mentions.add(mention("a1", MentionKind.PRN, "Politiker", GenderLabel.MALE));
        mentions.add(mention("a1", MentionKind.PRN, "Bundeskanzler", GenderLabel.MALE));
        mentions.add(mention("a1", MentionKind.PER, "Kim Doe", GenderLabel.UNDETERMINED));
        mentions.add(mention("a1", MentionKind.PRN, "Schüler", GenderLabel.AMBIGUOUS));
        return analysis("a1", "vol-1", List.of("au-1", "au-2"), mentions, 120, 2, 1);
    }

    @Test
    void countsMentionsPerKindAndLabel() {
        AggregateRecord record = aggregator.byArticle(List.of(mixedArticle())).get(0);

        assertThat(record.granularity()).isEqualTo(Granularity.ARTICLE);
        assertThat(record.key()).isEqualTo("a1");
        assertThat(record.count(MentionKind.PER, GenderLabel.FEMALE)).isEqualTo(1);
        assertThat(record.count(MentionKind.PRN, GenderLabel.MALE)).isEqualTo(2);
        assertThat(record.count(MentionKind.PER, GenderLabel.UNDETERMINED)).isEqualTo(1);
        assertThat(record.count(MentionKind.PRN, GenderLabel.AMBIGUOUS)).isEqualTo(1);
        assertThat(record.total()).isEqualTo(6);
        assertThat(record.proportion(GenderLabel.FEMALE)).isCloseTo(2.0 / 6.0, within(1e-9));
        assertThat(record.femaleShare()).isEqualTo(0.5);
        assertThat(record.numTokens()).isEqualTo(120);
        assertThat(record.numSlashes()).isEqualTo(2);
        assertThat(record.beyondBinary()).containsEntry("binary", 1).containsEntry("neopronouns", 0);
    }

    @Test
    void connotationMeansOnlyUseScoredMentions() {
        AggregateRecord record = aggregator.byArticle(List.of(mixedArticle())).get(0);

        ConnotationMeans female = record.connotation(GenderLabel.FEMALE);
        assertThat(female.valence()).isEqualTo(6.0);
        assertThat(female.arousal()).isEqualTo(3.0);
        assertThat(female.scored()).isEqualTo(1);
        assertThat(female.noScore()).isEqualTo(1);

        ConnotationMeans male = record.connotation(GenderLabel.MALE);
        assertThat(male.valence()).isEqualTo(3.0);
        assertThat(male.concreteness()).isEqualTo(3.0);
        assertThat(male.scored()).isEqualTo(1);
        assertThat(male.noScore()).isEqualTo(1);
    }

    @Test
    void articlesWithoutMentionsHaveUndefinedRatios() {
        AggregateRecord record = aggregator.byArticle(List.of(
                analysis("a2", "vol-1", List.of("au-1"), List.of(), 40, 0, 0))).get(0);

        assertThat(record.total()).isZero();
        assertThat(record.femaleShare()).isNaN();
        assertThat(record.proportion(GenderLabel.MALE)).isNaN();
        assertThat(record.connotation(GenderLabel.FEMALE).valence()).isNaN();
        assertThat(record.connotation(GenderLabel.FEMALE).scored()).isZero();
    }

    @Test
    void groupsArticlesByVolume() {
        List<ArticleAnalysis> analyses = List.of(mixedArticle(),
                analysis("a2", "vol-1", List.of("au-1"), List.of(), 40, 0, 2),
                analysis("a3", null, List.of(), List.of(), 10, 0, 0));

        List<AggregateRecord> records = aggregator.byVolume(analyses, Map.of("vol-1", "Bildung"));

        assertThat(records).hasSize(1);
        assertThat(records.get(0).name()).isEqualTo("Bildung");
        assertThat(records.get(0).numArticles()).isEqualTo(2);
        assertThat(records.get(0).numTokens()).isEqualTo(160);
        assertThat(records.get(0).beyondBinary()).containsEntry("binary", 3);
    }

    @Test
    void articlesCountForEachOfTheirAuthors() {
        List<ArticleAnalysis> analyses = List.of(mixedArticle(),
                analysis("a2", "vol-1", List.of("au-1"), List.of(), 40, 0, 0));

        List<AggregateRecord> records = aggregator.byAuthor(analyses, Map.of("au-1", "Anna Beispiel"),
                Map.of("au-1", GenderLabel.FEMALE));

        assertThat(records).extracting(AggregateRecord::key).containsExactly("au-1", "au-2");
        assertThat(records.get(0).numArticles()).isEqualTo(2);
        assertThat(records.get(0).authorGender()).isEqualTo(GenderLabel.FEMALE);
        assertThat(records.get(1).numArticles()).isEqualTo(1);
        assertThat(records.get(1).name()).isEmpty();
        assertThat(records.get(1).authorGender()).isNull();
        assertThat(records.get(1).count(GenderLabel.MALE)).isEqualTo(2);
    }

    @Test
    void descriptorNormsAreAveragedPerDescribedMention() {
        Mention lehrerin = mention("a4", MentionKind.PRN, "Lehrerin", GenderLabel.FEMALE);
        Mention politiker = mention("a4", MentionKind.PRN, "Politiker", GenderLabel.MALE);
        Mention kim = mention("a4", MentionKind.PER, "Kim Doe", GenderLabel.UNDETERMINED);
        List<Descriptor> descriptors = List.of(
                new Descriptor("klugen", 1, List.of(lehrerin, politiker)),
                new Descriptor("lacht", 1, List.of(kim)),
                new Descriptor("schweigt", 1, List.of(politiker)));
        Article article = new Article("a4", "Titel a4", "vol-1", List.of(), List.of("Titel a4"));
        ArticleAnalysis analysis = new ArticleAnalysis(article, List.of(lehrerin, politiker, kim), 30, 0,
                BeyondBinaryMatcher.empty(), descriptors, 2);

        AggregateRecord record = aggregator.byArticle(List.of(analysis)).get(0);

        ConnotationMeans female = record.descriptorConnotation(GenderLabel.FEMALE);
        assertThat(female.valence()).isEqualTo(6.5);
        assertThat(female.scored()).isEqualTo(1);
        assertThat(female.noScore()).isZero();
        ConnotationMeans male = record.descriptorConnotation(GenderLabel.MALE);
        assertThat(male.concreteness()).isEqualTo(2.0);
        assertThat(male.scored()).isEqualTo(1);
        assertThat(male.noScore()).isEqualTo(1);
        assertThat(record.numDescriptors(GenderLabel.MALE)).isEqualTo(2);
        assertThat(record.numDescriptors(GenderLabel.UNDETERMINED)).isEqualTo(1);
        assertThat(record.numDescriptors(GenderLabel.AMBIGUOUS)).isZero();
        assertThat(record.numNegations()).isEqualTo(2);
        assertThat(record.connotation(GenderLabel.FEMALE).valence()).isEqualTo(6.0);
    }

    @Test
    void articlesWithoutDescriptorsHaveNoDescriptorNorms() {
        AggregateRecord record = aggregator.byArticle(List.of(mixedArticle())).get(0);

        assertThat(record.descriptorConnotation(GenderLabel.FEMALE).valence()).isNaN();
        assertThat(record.numDescriptors(GenderLabel.FEMALE)).isZero();
        assertThat(record.numNegations()).isZero();
    }

    @Test
    void recomputingGivesTheSameRecord() {
        List<ArticleAnalysis> analyses = List.of(mixedArticle());

        assertThat(aggregator.byArticle(analyses)).isEqualTo(aggregator.byArticle(analyses));
    }
}

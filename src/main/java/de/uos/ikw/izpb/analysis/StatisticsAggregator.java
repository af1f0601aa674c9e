package de.uos.ikw.izpb.analysis;

import de.uos.ikw.izpb.lexicon.ConnotationLexicon;
import de.uos.ikw.izpb.schemas.AggregateRecord;
import de.uos.ikw.izpb.schemas.ArticleAnalysis;
import de.uos.ikw.izpb.schemas.ConnotationMeans;
import de.uos.ikw.izpb.schemas.ConnotationScore;
import de.uos.ikw.izpb.schemas.Descriptor;
import de.uos.ikw.izpb.schemas.GenderLabel;
import de.uos.ikw.izpb.schemas.Granularity;
import de.uos.ikw.izpb.schemas.Mention;
import de.uos.ikw.izpb.schemas.MentionKind;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Aggregates resolved article analyses per article, volume and author.
 * An article with several authors counts for each of them.
 */
public class StatisticsAggregator {
    private static final Logger logger = LoggerFactory.getLogger(StatisticsAggregator.class);

    private final ConnotationLexicon lexicon;

    public StatisticsAggregator(ConnotationLexicon lexicon) {
        this.lexicon = lexicon;
    }

    public List<AggregateRecord> byArticle(List<ArticleAnalysis> analyses) {
        List<AggregateRecord> records = new ArrayList<>(analyses.size());
        for (ArticleAnalysis analysis : analyses) {
            records.add(aggregate(Granularity.ARTICLE, analysis.article().id(), analysis.article().title(),
                    List.of(analysis), null));
        }
        return records;
    }

    /**
     * @param volumeTitles Title by volume id; volumes without title get an empty name.
     */
    public List<AggregateRecord> byVolume(List<ArticleAnalysis> analyses, Map<String, String> volumeTitles) {
        Map<String, List<ArticleAnalysis>> groups = new LinkedHashMap<>();
        for (ArticleAnalysis analysis : analyses) {
            String volumeId = analysis.article().volumeId();
            if (volumeId == null || volumeId.isBlank()) {
                logger.debug("Article {} has no volume", analysis.article().id());
                continue;
            }
            groups.computeIfAbsent(volumeId, k -> new ArrayList<>()).add(analysis);
        }
        List<AggregateRecord> records = new ArrayList<>(groups.size());
        groups.forEach((volumeId, group) -> records.add(aggregate(Granularity.VOLUME, volumeId,
                volumeTitles.getOrDefault(volumeId, ""), group, null)));
        return records;
    }

    /**
     * @param authorNames   Name by author id.
     * @param authorGenders Inferred gender by author id; may miss authors.
     */
    public List<AggregateRecord> byAuthor(List<ArticleAnalysis> analyses, Map<String, String> authorNames,
                                          Map<String, GenderLabel> authorGenders) {
        Map<String, List<ArticleAnalysis>> groups = new LinkedHashMap<>();
        for (ArticleAnalysis analysis : analyses) {
            for (String authorId : analysis.article().authorIds()) {
                groups.computeIfAbsent(authorId, k -> new ArrayList<>()).add(analysis);
            }
        }
        List<AggregateRecord> records = new ArrayList<>(groups.size());
        groups.forEach((authorId, group) -> records.add(aggregate(Granularity.AUTHOR, authorId,
                authorNames.getOrDefault(authorId, ""), group, authorGenders.get(authorId))));
        return records;
    }

    public AggregateRecord aggregate(Granularity granularity, String key, String name, List<ArticleAnalysis> group,
                                     GenderLabel authorGender) {
        long numTokens = 0;
        int numSlashes = 0;
        Map<MentionKind, Map<GenderLabel, Integer>> counts = new EnumMap<>(MentionKind.class);
        for (MentionKind kind : MentionKind.values()) {
            counts.put(kind, new EnumMap<>(GenderLabel.class));
        }
        Map<String, Integer> beyondBinary = new LinkedHashMap<>();
        Map<GenderLabel, ConnotationAccumulator> connotation = new EnumMap<>(GenderLabel.class);
        connotation.put(GenderLabel.FEMALE, new ConnotationAccumulator());
        connotation.put(GenderLabel.MALE, new ConnotationAccumulator());
        Map<GenderLabel, ConnotationAccumulator> descriptorConnotation = new EnumMap<>(GenderLabel.class);
        for (GenderLabel label : GenderLabel.values()) {
            descriptorConnotation.put(label, new ConnotationAccumulator());
        }
        int numNegations = 0;

        for (ArticleAnalysis analysis : group) {
            numTokens += analysis.numTokens();
            numSlashes += analysis.numSlashes();
            analysis.beyondBinaryCounts().forEach((pattern, count) -> beyondBinary.merge(pattern, count, Integer::sum));

            for (Mention mention : analysis.mentions()) {
                GenderLabel label = mention.gender();
                counts.get(mention.kind()).merge(label, 1, Integer::sum);
                ConnotationAccumulator accumulator = connotation.get(label);
                if (accumulator != null) {
                    accumulator.add(lexicon.score(mention.lemma()));
                }
            }

            numNegations += analysis.numNegations();
            for (Descriptor descriptor : analysis.descriptors()) {
                Optional<ConnotationScore> score = lexicon.scoreInflected(descriptor.word());
                for (Mention target : descriptor.targets()) {
                    descriptorConnotation.get(target.gender()).add(score);
                }
            }
        }

        Map<GenderLabel, ConnotationMeans> means = new EnumMap<>(GenderLabel.class);
        connotation.forEach((label, accumulator) -> means.put(label, accumulator.means()));
        Map<GenderLabel, ConnotationMeans> descriptorMeans = new EnumMap<>(GenderLabel.class);
        descriptorConnotation.forEach((label, accumulator) -> descriptorMeans.put(label, accumulator.means()));
        return new AggregateRecord(granularity, key, name, group.size(), numTokens, numSlashes, counts, means,
                descriptorMeans, numNegations, beyondBinary, authorGender);
    }

    /**
     * Mean norms of the scored words of one gender; words without a lexicon entry are only counted.
     */
    private static class ConnotationAccumulator {
        private final SummaryStatistics valence = new SummaryStatistics();
        private final SummaryStatistics arousal = new SummaryStatistics();
        private final SummaryStatistics imageability = new SummaryStatistics();
        private final SummaryStatistics concreteness = new SummaryStatistics();
        private int noScore;

        private void add(Optional<ConnotationScore> score) {
            if (score.isEmpty()) {
                noScore++;
                return;
            }
            valence.addValue(score.get().valence());
            arousal.addValue(score.get().arousal());
            imageability.addValue(score.get().imageability());
            concreteness.addValue(score.get().concreteness());
        }

        private ConnotationMeans means() {
            return new ConnotationMeans(valence.getMean(), arousal.getMean(), imageability.getMean(),
                    concreteness.getMean(), valence.getN(), noScore);
        }
    }
}

package de.uos.ikw.izpb.schemas;

import java.util.Map;

/**
 * Statistics of one grouping key (an article, a volume or an author). Fully derived from the
 * mentions and their descriptors; recomputing it from the same input yields the same record.
 * connotation holds the norms of the mention lemmas, descriptorConnotation those of the words
 * describing the mentions, one value per described mention.
 */
public record AggregateRecord(
        Granularity granularity,
        String key,
        String name,
        int numArticles,
        long numTokens,
        int numSlashes,
        Map<MentionKind, Map<GenderLabel, Integer>> counts,
        Map<GenderLabel, ConnotationMeans> connotation,
        Map<GenderLabel, ConnotationMeans> descriptorConnotation,
        int numNegations,
        Map<String, Integer> beyondBinary,
        GenderLabel authorGender
) {

    public int count(MentionKind kind, GenderLabel label) {
        Map<GenderLabel, Integer> kindCounts = counts.get(kind);
        return kindCounts == null ? 0 : kindCounts.getOrDefault(label, 0);
    }

    public int count(GenderLabel label) {
        int count = 0;
        for (MentionKind kind : MentionKind.values()) {
            count += count(kind, label);
        }
        return count;
    }

    public int total() {
        int total = 0;
        for (GenderLabel label : GenderLabel.values()) {
            total += count(label);
        }
        return total;
    }

    /**
     * Share of all mentions carrying the given label, NaN without mentions.
     */
    public double proportion(GenderLabel label) {
        int total = total();
        return total == 0 ? Double.NaN : (double) count(label) / total;
    }

    /**
     * F / (F + M); undetermined and ambiguous mentions are not part of the ratio. NaN when F + M = 0.
     */
    public double femaleShare() {
        int female = count(GenderLabel.FEMALE);
        int binary = female + count(GenderLabel.MALE);
        return binary == 0 ? Double.NaN : (double) female / binary;
    }

    public ConnotationMeans connotation(GenderLabel label) {
        return connotation.getOrDefault(label, ConnotationMeans.empty());
    }

    public ConnotationMeans descriptorConnotation(GenderLabel label) {
        return descriptorConnotation.getOrDefault(label, ConnotationMeans.empty());
    }

    /**
     * Descriptor occurrences of mentions with the given label, scored or not.
     */
    public long numDescriptors(GenderLabel label) {
        ConnotationMeans means = descriptorConnotation(label);
        return means.scored() + means.noScore();
    }
}

package de.uos.ikw.izpb.schemas;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of analysing a single article: its mentions plus the per-article counts that do not
 * depend on gender resolution.
 * numTokens [int]                             : number of tokens over all paragraphs.
 * numSlashes [int]                            : slash forms ("/innen") removed during normalization.
 * beyondBinary [Map<String, List<String>>]   : matched text chunks per beyond-binary pattern.
 * descriptors [List<Descriptor>]              : words describing the mentions.
 * numNegations [int]                          : negated verbs and adjectives.
 */
public record ArticleAnalysis(Article article, List<Mention> mentions, int numTokens, int numSlashes,
                              Map<String, List<String>> beyondBinary, List<Descriptor> descriptors,
                              int numNegations) {

    public ArticleAnalysis {
        mentions = List.copyOf(mentions);
        Map<String, List<String>> copy = new LinkedHashMap<>();
        beyondBinary.forEach((pattern, matches) -> copy.put(pattern, List.copyOf(matches)));
        beyondBinary = copy;
        descriptors = List.copyOf(descriptors);
    }

    /**
     * Analysis without descriptors (no dependency parse).
     */
    public ArticleAnalysis(Article article, List<Mention> mentions, int numTokens, int numSlashes,
                           Map<String, List<String>> beyondBinary) {
        this(article, mentions, numTokens, numSlashes, beyondBinary, List.of(), 0);
    }

    public Map<String, Integer> beyondBinaryCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        beyondBinary.forEach((pattern, matches) -> counts.put(pattern, matches.size()));
        return counts;
    }
}

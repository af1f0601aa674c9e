package de.uos.ikw.izpb.analysis;

import de.uos.ikw.izpb.formats.OccurrenceRow;
import de.uos.ikw.izpb.schemas.ArticleAnalysis;
import de.uos.ikw.izpb.schemas.Descriptor;
import de.uos.ikw.izpb.schemas.GenderLabel;
import de.uos.ikw.izpb.schemas.Mention;
import de.uos.ikw.izpb.schemas.MentionKind;

import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Occurrence lists over the whole corpus: PER names and PRN lemmas per gender label
 * ("per_female", "prn_male", ...), descriptors per gender label of the described mention
 * ("descr_female", ...) and beyond-binary matches per pattern ("matches-binary"), the latter as
 * "chunk {article id}".
 */
public class OccurrenceTables {

    private static final Map<GenderLabel, String> SUFFIXES = Map.of(
            GenderLabel.FEMALE, "female",
            GenderLabel.MALE, "male",
            GenderLabel.AMBIGUOUS, "amb",
            GenderLabel.UNDETERMINED, "ud");

    /**
     * @return Table name to rows, rows sorted by descending count and then by word.
     */
    public static Map<String, List<OccurrenceRow>> build(List<ArticleAnalysis> analyses) {
        Map<String, Map<String, Integer>> counts = new LinkedHashMap<>();
        for (MentionKind kind : MentionKind.values()) {
            for (GenderLabel label : GenderLabel.values()) {
                if (kind == MentionKind.PRN && label == GenderLabel.UNDETERMINED) {
                    continue;
                }
                counts.put(tableName(kind, label), new HashMap<>());
            }
        }
        for (GenderLabel label : GenderLabel.values()) {
            counts.put(descriptorTableName(label), new HashMap<>());
        }
        for (ArticleAnalysis analysis : analyses) {
            for (Mention mention : analysis.mentions()) {
                Map<String, Integer> table = counts.get(tableName(mention.kind(), mention.gender()));
                if (table != null) {
                    String word = mention.kind() == MentionKind.PER ? mention.lemma() : mention.surface();
                    table.merge(word, 1, Integer::sum);
                }
            }
            for (Descriptor descriptor : analysis.descriptors()) {
                for (Mention target : descriptor.targets()) {
                    counts.get(descriptorTableName(target.gender())).merge(descriptor.word(), 1, Integer::sum);
                }
            }
            analysis.beyondBinary().forEach((pattern, chunks) -> {
                Map<String, Integer> table = counts.computeIfAbsent("matches-" + pattern, k -> new HashMap<>());
                for (String chunk : chunks) {
                    table.merge(chunk + " {" + analysis.article().id() + "}", 1, Integer::sum);
                }
            });
        }

        Map<String, List<OccurrenceRow>> tables = new LinkedHashMap<>();
        counts.forEach((name, table) -> tables.put(name, table.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .map(e -> new OccurrenceRow(e.getKey(), e.getValue()))
                .toList()));
        return tables;
    }

    static String tableName(MentionKind kind, GenderLabel label) {
        return kind.name().toLowerCase(Locale.ROOT) + "_" + SUFFIXES.get(label);
    }

    static String descriptorTableName(GenderLabel label) {
        return "descr_" + SUFFIXES.get(label);
    }
}

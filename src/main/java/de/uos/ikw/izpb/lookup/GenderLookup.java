package de.uos.ikw.izpb.lookup;

import de.uos.ikw.izpb.schemas.GenderLabel;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Resolves the gender of a person from its name.
 */
public abstract class GenderLookup {

    /* Names with more tokens than this are not looked up */
    public static final int MAX_NAME_TOKENS = 12;

    /**
     * @param name Normalized person name.
     * @return Label with the evidence it is based on; UNDETERMINED when the name is not found.
     * @throws LookupException when the knowledge base cannot be queried.
     */
    public abstract LookupResult lookup(String name) throws LookupException;

    /**
     * Trims a name, removes double quotation marks and collapses whitespace runs.
     */
    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String unquoted = name.replaceAll("[\"„“”«»]", "").strip();
        if (unquoted.isEmpty()) {
            return "";
        }
        return String.join(" ", unquoted.split("\\s+"));
    }

    public static int numTokens(String name) {
        return name.isBlank() ? 0 : name.strip().split("\\s+").length;
    }

    /**
     * Decides the label of a name from its candidates: the label when all of them agree,
     * AMBIGUOUS when they disagree, UNDETERMINED without candidates.
     */
    public static LookupResult decide(List<KnowledgeBaseCandidate> candidates) {
        if (candidates.isEmpty()) {
            return LookupResult.notFound("no match");
        }
        Map<GenderLabel, Long> votes = candidates.stream()
                .collect(Collectors.groupingBy(KnowledgeBaseCandidate::gender,
                        () -> new EnumMap<>(GenderLabel.class), Collectors.counting()));
        String detail = candidates.stream()
                .map(c -> c.item() + ":" + c.gender().indicator())
                .distinct()
                .sorted()
                .collect(Collectors.joining(" "));

        if (votes.size() > 1) {
            long majority = votes.values().stream().mapToLong(Long::longValue).max().orElse(0);
            return new LookupResult(GenderLabel.AMBIGUOUS, candidates.size(),
                    (double) majority / candidates.size(), detail);
        }
        GenderLabel label = votes.keySet().iterator().next();
        return new LookupResult(label, candidates.size(), 1.0, detail);
    }
}

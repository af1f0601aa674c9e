package de.uos.ikw.izpb.lookup;

import de.uos.ikw.izpb.formats.SparqlResponse;
import de.uos.ikw.izpb.schemas.GenderLabel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Looks up the gender (P21) of humans (P31 = Q5) on Wikidata.
 * <p>
 * A name is first matched against the given name (P735, P1449, P742) and family name (P734)
 * statements of the items. If that gives no match or disagreeing genders, the full name is
 * matched against the German and English labels and aliases. If neither finds anything and the
 * name ends in "s", the name is retried without it (possessive, "Merkels").
 */
public class WikidataGenderLookup extends GenderLookup {
    private static final Logger logger = LoggerFactory.getLogger(WikidataGenderLookup.class);

    private static final String ENTITY_PREFIX = "http://www.wikidata.org/entity/";
    private static final Set<String> FEMALE_VALUES = Set.of("Q6581072", "Q1052281");
    private static final Set<String> MALE_VALUES = Set.of("Q6581097", "Q2449503");

    private static final String NAME_PARTS_QUERY = "SELECT ?item ?itemLabel ?gender ?genderLabel WHERE {\n"
            + "  ?item wdt:P31 wd:Q5 .\n"
            + "  VALUES ?surname { %s }\n"
            + "  ?item wdt:P734 ?surnameItem .\n"
            + "  ?surnameItem rdfs:label|skos:altLabel ?surname .\n"
            + "  VALUES ?p { wdt:P735 wdt:P1449 wdt:P742 }\n"
            + "  VALUES ?name { %s }\n"
            + "  ?item ?p ?nameItem .\n"
            + "  ?nameItem rdfs:label|skos:altLabel ?name .\n"
            + "  ?item wdt:P21 ?gender .\n"
            + "  SERVICE wikibase:label { bd:serviceParam wikibase:language \"[AUTO_LANGUAGE],de\". }\n"
            + "}\n"
            + "LIMIT 100";

    private static final String LABEL_QUERY = "SELECT ?item ?itemLabel ?gender ?genderLabel WHERE {\n"
            + "  ?item wdt:P31 wd:Q5 .\n"
            + "  VALUES ?prefLabel { %s }\n"
            + "  ?item rdfs:label|skos:altLabel ?prefLabel .\n"
            + "  ?item wdt:P21 ?gender .\n"
            + "  SERVICE wikibase:label { bd:serviceParam wikibase:language \"[AUTO_LANGUAGE],de\". }\n"
            + "}\n"
            + "LIMIT 100";

    private final SparqlClient client;
    private final int retries;
    private final long retryDelayMillis;

    /**
     * @param client           Client of the query service.
     * @param retries          Additional attempts after a failed query.
     * @param retryDelayMillis Pause before each additional attempt.
     */
    public WikidataGenderLookup(SparqlClient client, int retries, long retryDelayMillis) {
        this.client = client;
        this.retries = retries;
        this.retryDelayMillis = retryDelayMillis;
    }

    @Override
    public LookupResult lookup(String name) throws LookupException {
        String normalized = normalize(name);
        if (normalized.isEmpty()) {
            return LookupResult.notFound("empty name");
        }
        String[] tokens = normalized.split(" ");
        if (tokens.length > MAX_NAME_TOKENS) {
            logger.info("Not looked up, name exceeds {} tokens: {}", MAX_NAME_TOKENS, normalized);
            return LookupResult.notFound("name too long");
        }

        List<KnowledgeBaseCandidate> candidates = tokens.length > 1
                ? candidates(query(namePartsQuery(tokens)))
                : List.of();
        LookupResult result = decide(candidates);

        if (candidates.isEmpty() || result.label() == GenderLabel.AMBIGUOUS) {
            candidates = candidates(query(labelQuery(normalized)));
            result = decide(candidates);
        }

        if (candidates.isEmpty() && normalized.length() > 1 && normalized.endsWith("s")) {
            return lookup(normalized.substring(0, normalized.length() - 1));
        }
        if (candidates.isEmpty()) {
            logger.info("Named entity not found: {}", normalized);
        } else if (result.label() == GenderLabel.AMBIGUOUS) {
            logger.info("Gender ambiguous: {} ({})", normalized, result.detail());
        }
        return result;
    }

    /**
     * Query on the name statements: every token but the first may be the family name, every token
     * but the last a given name. Family names with particles ("von der Leyen") are tried as a whole.
     */
    static String namePartsQuery(String[] tokens) {
        Set<String> surnames = new LinkedHashSet<>(Arrays.asList(tokens).subList(1, tokens.length));
        int n = tokens.length;
        if (n > 2 && isLowerCase(tokens[n - 2])) {
            String compound = tokens[n - 2] + " " + tokens[n - 1];
            if (n > 3 && isLowerCase(tokens[n - 3])) {
                compound = tokens[n - 3] + " " + compound;
            }
            surnames.add(compound);
        }
        Set<String> givenNames = new LinkedHashSet<>(Arrays.asList(tokens).subList(0, n - 1));
        return String.format(NAME_PARTS_QUERY, literals(surnames, List.of("de")), literals(givenNames, List.of("de")));
    }

    static String labelQuery(String name) {
        return String.format(LABEL_QUERY, literals(List.of(name), List.of("de", "en")));
    }

    private static String literals(Iterable<String> values, List<String> languages) {
        List<String> literals = new ArrayList<>();
        for (String value : values) {
            String escaped = value.replace("\\", "").replace("\"", "");
            for (String language : languages) {
                literals.add("\"" + escaped + "\"@" + language);
            }
        }
        return String.join(" ", literals);
    }

    private static boolean isLowerCase(String token) {
        return !token.isEmpty() && Character.isLowerCase(token.codePointAt(0));
    }

    private SparqlResponse query(String sparql) throws LookupException {
        LookupException failure = null;
        for (int attempt = 0; attempt <= retries; attempt++) {
            if (attempt > 0) {
                logger.debug("Retrying query in {} ms (attempt {} of {})", retryDelayMillis, attempt + 1, retries + 1);
                pause();
            }
            try {
                return client.query(sparql);
            } catch (LookupException e) {
                failure = e;
            }
        }
        throw failure;
    }

    private void pause() throws LookupException {
        if (retryDelayMillis <= 0) {
            return;
        }
        try {
            Thread.sleep(retryDelayMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LookupException("Interrupted while waiting to retry", e);
        }
    }

    static List<KnowledgeBaseCandidate> candidates(SparqlResponse response) {
        List<KnowledgeBaseCandidate> candidates = new ArrayList<>();
        for (Map<String, SparqlResponse.Binding> binding : response.bindings()) {
            String item = entityId(binding.get("item"));
            String genderValue = entityId(binding.get("gender"));
            if (item == null || genderValue == null) {
                continue;
            }
            String label = value(binding.get("itemLabel"));
            GenderLabel gender = mapGender(genderValue);
            if (gender == GenderLabel.UNDETERMINED) {
                logger.info("Gender value outside female/male for {} ({}): {} {}", label, item, genderValue,
                        value(binding.get("genderLabel")));
            }
            candidates.add(new KnowledgeBaseCandidate(item, label, genderValue, gender));
        }
        // one item can be matched through several names
        return candidates.stream()
                .collect(Collectors.toMap(KnowledgeBaseCandidate::item, c -> c, (a, b) -> a,
                        LinkedHashMap::new))
                .values().stream().toList();
    }

    static GenderLabel mapGender(String genderValue) {
        if (FEMALE_VALUES.contains(genderValue)) {
            return GenderLabel.FEMALE;
        }
        if (MALE_VALUES.contains(genderValue)) {
            return GenderLabel.MALE;
        }
        return GenderLabel.UNDETERMINED;
    }

    private static String entityId(SparqlResponse.Binding binding) {
        String value = value(binding);
        if (value == null) {
            return null;
        }
        return value.startsWith(ENTITY_PREFIX) ? value.substring(ENTITY_PREFIX.length()) : value;
    }

    private static String value(SparqlResponse.Binding binding) {
        return binding == null ? null : binding.value();
    }
}

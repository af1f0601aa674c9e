package de.uos.ikw.izpb.formats;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/**
 * Defines the SPARQL 1.1 JSON results format returned by the Wikidata query service.
 * Every binding maps a variable name (item, gender, genderLabel, ...) to its value.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SparqlResponse(Results results) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static record Results(List<Map<String, Binding>> bindings) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static record Binding(String type, String value) {}

    public List<Map<String, Binding>> bindings() {
        if (results == null || results.bindings() == null) {
            return List.of();
        }
        return results.bindings();
    }
}

package de.uos.ikw.izpb.formats;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Row of a PRN list: gender indicator ("f", "m" or "a"), noun and where it was taken from.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"gender", "lemma", "source_url"})
public record PrnRow(
        String gender,
        String lemma,
        @JsonProperty("source_url") String sourceUrl
) {}

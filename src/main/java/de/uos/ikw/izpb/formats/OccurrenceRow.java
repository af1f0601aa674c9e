package de.uos.ikw.izpb.formats;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"word", "num_occurrences"})
public record OccurrenceRow(String word, @JsonProperty("num_occurrences") int numOccurrences) {}

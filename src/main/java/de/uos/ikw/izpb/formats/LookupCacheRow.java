package de.uos.ikw.izpb.formats;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Persisted knowledge base answer for one normalized name.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"name", "gender", "candidates", "agreement", "detail"})
public record LookupCacheRow(String name, String gender, int candidates, double agreement, String detail) {}

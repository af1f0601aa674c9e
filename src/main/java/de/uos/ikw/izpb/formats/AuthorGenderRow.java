package de.uos.ikw.izpb.formats;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Author's inferred gender (AIG) with the three signals it was combined from.
 */
@JsonPropertyOrder({"uuid", "author", "inferred_gender_wd", "inferred_gender_ppn", "inferred_gender_prn",
        "inferred_gender"})
public record AuthorGenderRow(
        String uuid,
        String author,
        @JsonProperty("inferred_gender_wd") String knowledgeBase,
        @JsonProperty("inferred_gender_ppn") String pronouns,
        @JsonProperty("inferred_gender_prn") String prns,
        @JsonProperty("inferred_gender") String combined
) {}

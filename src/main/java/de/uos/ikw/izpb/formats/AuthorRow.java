package de.uos.ikw.izpb.formats;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Defines the izpb-corpus_authors.csv structure. The scraper's own gender guesses
 * (inferred_gender_*) are ignored; author gender is inferred again by the analysis.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuthorRow(String uuid, String author, String info) {}

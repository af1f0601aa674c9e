package de.uos.ikw.izpb.schemas;

/**
 * Entry of the people-referencing noun list.
 * lemma [String]        : noun form as it appears in text (singular and plural forms are separate entries).
 * gender [GenderLabel]  : FEMALE, MALE or AMBIGUOUS (mixed-gender groups).
 * sourceUrl [String]    : provenance, "; "-separated when several dictionary pages contributed.
 */
public record PrnEntry(String lemma, GenderLabel gender, String sourceUrl) {}

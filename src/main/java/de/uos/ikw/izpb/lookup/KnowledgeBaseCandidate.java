package de.uos.ikw.izpb.lookup;

import de.uos.ikw.izpb.schemas.GenderLabel;

/**
 * Knowledge base item matching a name.
 * item [String]        : item identifier (Wikidata Q-id).
 * label [String]       : item label.
 * genderValue [String] : raw value of the gender property.
 * gender [GenderLabel] : genderValue mapped to a label (UNDETERMINED for values outside female/male).
 */
public record KnowledgeBaseCandidate(String item, String label, String genderValue, GenderLabel gender) {}

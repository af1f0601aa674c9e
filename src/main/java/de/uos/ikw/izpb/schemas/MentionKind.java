package de.uos.ikw.izpb.schemas;

/**
 * PER: named person found by named-entity recognition.
 * PRN: people-referencing noun found in the PRN list.
 */
public enum MentionKind {
    PER,
    PRN
}

package de.uos.ikw.izpb.lexicon;

/**
 * What the PRN compiler does with a form classified as both female and male.
 * AMBIGUOUS keeps it with indicator "a", DROP removes it from the list.
 */
public enum CollisionPolicy {
    AMBIGUOUS,
    DROP
}

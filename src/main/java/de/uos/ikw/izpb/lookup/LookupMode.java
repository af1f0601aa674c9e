package de.uos.ikw.izpb.lookup;

/**
 * LIVE queries Wikidata, CACHED does the same but persists the answers across runs, FIXTURE
 * answers from a static table only.
 */
public enum LookupMode {
    LIVE,
    CACHED,
    FIXTURE
}

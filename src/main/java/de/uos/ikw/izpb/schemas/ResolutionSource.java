package de.uos.ikw.izpb.schemas;

public enum ResolutionSource {
    PRN_LIST,
    KNOWLEDGE_BASE,
    LOOKUP_ERROR,
    NOT_RESOLVED
}

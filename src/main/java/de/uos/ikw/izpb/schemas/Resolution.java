package de.uos.ikw.izpb.schemas;

/**
 * Outcome of resolving the gender of one mention.
 * confidence [double] : share of the evidence supporting the label (1.0 for list lookups).
 * detail [String]     : free text for the audit trail (matched lemma, knowledge base items, error).
 */
public record Resolution(GenderLabel label, ResolutionSource source, double confidence, String detail) {

    public static Resolution undetermined(ResolutionSource source, String detail) {
        return new Resolution(GenderLabel.UNDETERMINED, source, 0.0, detail);
    }
}

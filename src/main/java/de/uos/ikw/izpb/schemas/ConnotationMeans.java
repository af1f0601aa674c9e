package de.uos.ikw.izpb.schemas;

/**
 * Mean affect norms over the scored mentions of one gender.
 * Means are NaN when no mention could be scored; noScore counts the mentions without a lexicon entry.
 */
public record ConnotationMeans(double valence, double arousal, double imageability, double concreteness,
                               long scored, int noScore) {

    public static ConnotationMeans empty() {
        return new ConnotationMeans(Double.NaN, Double.NaN, Double.NaN, Double.NaN, 0, 0);
    }
}

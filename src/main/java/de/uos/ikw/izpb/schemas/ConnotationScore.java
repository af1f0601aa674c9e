package de.uos.ikw.izpb.schemas;

/**
 * Affect norms of one word (GLEAN).
 */
public record ConnotationScore(String word, double valence, double arousal, double imageability,
                               double concreteness) {

    public double[] values() {
        return new double[]{valence, arousal, imageability, concreteness};
    }
}

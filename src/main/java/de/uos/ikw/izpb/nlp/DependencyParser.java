package de.uos.ikw.izpb.nlp;

import java.util.List;
import java.util.Set;

/**
 * Dependency parsing of a paragraph, sentence by sentence.
 */
@FunctionalInterface
public interface DependencyParser {

    /**
     * Token of a parsed sentence.
     * index    : 1-based position in the sentence.
     * begin/end: character offsets into the parsed text.
     * pos      : universal part-of-speech tag (STTS tags are understood as well).
     * head     : index of the governing token, 0 for the root and -1 when the token is not attached.
     * relation : universal dependency relation to the head ("amod", "nsubj", "conj", ...).
     */
    record ParsedToken(int index, int begin, int end, String word, String pos, int head, String relation) {

        private static final Set<String> NOUNS = Set.of("NOUN", "PROPN", "NN", "NE");
        private static final Set<String> ADJECTIVES = Set.of("ADJ", "ADJA", "ADJD");

        public boolean isNoun() {
            return NOUNS.contains(pos);
        }

        public boolean isAdjective() {
            return ADJECTIVES.contains(pos);
        }

        public boolean isVerb() {
            return "VERB".equals(pos) || pos.startsWith("VV");
        }

        public boolean isAuxiliary() {
            return "AUX".equals(pos) || pos.startsWith("VA") || pos.startsWith("VM");
        }

        public boolean isAdverb() {
            return "ADV".equals(pos) || "ADJD".equals(pos);
        }

        /**
         * Relation without its subtype ("nsubj:pass" gives "nsubj").
         */
        public String baseRelation() {
            int colon = relation.indexOf(':');
            return colon < 0 ? relation : relation.substring(0, colon);
        }
    }

    /**
     * @param text Normalized paragraph.
     * @return Tokens of every sentence, in text order.
     */
    List<List<ParsedToken>> parse(String text);
}

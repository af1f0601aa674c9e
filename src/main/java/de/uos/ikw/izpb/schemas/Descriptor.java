package de.uos.ikw.izpb.schemas;

import java.util.List;

/**
 * Word describing one or more mentions: an attributive adjective ("die kluge Lehrerin"), a
 * predicate ("die Lehrerin ist klug") or the verb of which the mentions are the subject, with its
 * adverbs. Conjoined mentions share the descriptor ("die Lehrerin und der Lehrer lachen").
 * word is lower-cased; a separable verb particle is prefixed to its verb ("nimmt ... teil" gives "teilnimmt").
 * The targets are the mention objects themselves, so their resolved gender is read at aggregation time.
 */
public record Descriptor(String word, int paragraph, List<Mention> targets) {

    public Descriptor {
        targets = List.copyOf(targets);
    }
}

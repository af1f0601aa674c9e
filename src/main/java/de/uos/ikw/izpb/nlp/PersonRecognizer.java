package de.uos.ikw.izpb.nlp;

import java.util.List;

/**
 * Named-entity recognition restricted to persons.
 */
@FunctionalInterface
public interface PersonRecognizer {

    /**
     * Person name found in a text.
     * begin/end are character offsets into the recognized text.
     */
    record PersonSpan(int begin, int end, String text) {}

    /**
     * @param text Normalized paragraph.
     * @return Person spans ordered by begin offset.
     */
    List<PersonSpan> recognize(String text);
}

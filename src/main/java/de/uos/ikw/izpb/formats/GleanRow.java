package de.uos.ikw.izpb.formats;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Row of the GLEAN norm values file (';'-separated, columns bound by position in this order).
 * A norm is null when its cell is empty.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"word", "arousal", "valence", "imageability", "concreteness"})
public record GleanRow(String word, Double arousal, Double valence, Double imageability, Double concreteness) {

    @JsonIgnore
    public boolean isComplete() {
        return word != null && !word.isBlank()
                && arousal != null && valence != null && imageability != null && concreteness != null;
    }
}

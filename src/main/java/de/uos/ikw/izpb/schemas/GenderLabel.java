package de.uos.ikw.izpb.schemas;

import java.util.Locale;

/**
 * Gender assigned to a person mention.
 * UNDETERMINED means no gender signal was found, AMBIGUOUS means the signals conflict or the
 * reference is usable for mixed-gender groups.
 */
public enum GenderLabel {
    FEMALE("f"),
    MALE("m"),
    UNDETERMINED("u"),
    AMBIGUOUS("a");

    private final String indicator;

    GenderLabel(String indicator) {
        this.indicator = indicator;
    }

    /**
     * Short indicator used in the PRN lists ("f", "m", "a").
     */
    public String indicator() {
        return indicator;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isBinary() {
        return this == FEMALE || this == MALE;
    }

    /**
     * Parses a PRN list indicator. Only "f", "m" and "a" are valid in a PRN list.
     *
     * @return the label, or null for an unknown indicator.
     */
    public static GenderLabel fromIndicator(String indicator) {
        if (indicator == null) {
            return null;
        }
        switch (indicator.strip().toLowerCase(Locale.ROOT)) {
            case "f":
            case "w":
                return FEMALE;
            case "m":
                return MALE;
            case "a":
                return AMBIGUOUS;
            default:
                return null;
        }
    }

    public static GenderLabel fromLabel(String label) {
        return valueOf(label.strip().toUpperCase(Locale.ROOT));
    }
}

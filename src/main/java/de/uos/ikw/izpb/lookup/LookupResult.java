package de.uos.ikw.izpb.lookup;

import de.uos.ikw.izpb.schemas.GenderLabel;

/**
 * Answer of a gender lookup.
 * candidates [int]   : number of matching items with a gender.
 * agreement [double] : share of the candidates supporting label.
 */
public record LookupResult(GenderLabel label, int candidates, double agreement, String detail) {

    public static LookupResult notFound(String detail) {
        return new LookupResult(GenderLabel.UNDETERMINED, 0, 0.0, detail);
    }
}

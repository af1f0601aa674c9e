package de.uos.ikw.izpb.lookup;

import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import de.uos.ikw.izpb.formats.LookupCacheRow;
import de.uos.ikw.izpb.schemas.GenderLabel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static de.uos.ikw.izpb.util.AuxiliarFunctions.exists;
import static de.uos.ikw.izpb.util.ObjectReaderUtils.readAllRows;

/**
 * Answers from a static name to gender table, for offline runs and tests. Unknown names are
 * UNDETERMINED.
 */
public class FixtureGenderLookup extends GenderLookup {
    private static final Logger logger = LoggerFactory.getLogger(FixtureGenderLookup.class);

    public static final CsvSchema FIXTURE_SCHEMA = CsvSchema.emptySchema().withHeader();

    private final Map<String, GenderLabel> genders = new HashMap<>();

    public FixtureGenderLookup(Map<String, GenderLabel> genders) {
        genders.forEach((name, gender) -> this.genders.put(normalize(name), gender));
    }

    /**
     * Reads a table with the columns name and gender (female, male, ambiguous, undetermined).
     */
    public static FixtureGenderLookup load(Path path) {
        Map<String, GenderLabel> genders = new HashMap<>();
        if (!exists(path)) {
            logger.warn("Lookup fixture {} not found, every name is undetermined", path);
            return new FixtureGenderLookup(genders);
        }
        try {
            for (LookupCacheRow row : readAllRows(path, FIXTURE_SCHEMA, LookupCacheRow.class)) {
                try {
                    genders.put(row.name(), GenderLabel.fromLabel(row.gender()));
                } catch (IllegalArgumentException | NullPointerException e) {
                    logger.warn("Skipped fixture entry {}: unknown gender '{}'", row.name(), row.gender());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("IOException while reading " + path, e);
        }
        return new FixtureGenderLookup(genders);
    }

    @Override
    public LookupResult lookup(String name) {
        GenderLabel gender = genders.get(normalize(name));
        if (gender == null) {
            return LookupResult.notFound("not in fixture");
        }
        return new LookupResult(gender, 1, 1.0, "fixture");
    }
}

package de.uos.ikw.izpb.lexicon;

import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import de.uos.ikw.izpb.formats.PrnRow;
import de.uos.ikw.izpb.schemas.GenderLabel;
import de.uos.ikw.izpb.schemas.PrnEntry;
import de.uos.ikw.izpb.util.MissingInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static de.uos.ikw.izpb.util.AuxiliarFunctions.exists;
import static de.uos.ikw.izpb.util.ObjectReaderUtils.readAllRows;

/**
 * People-referencing nouns by lemma. Built from the compiled list with the manually adjusted list
 * laid over it: an adjusted entry replaces the compiled entry of the same lemma.
 */
public class PrnTable {
    private static final Logger logger = LoggerFactory.getLogger(PrnTable.class);

    public static final CsvSchema PRN_SCHEMA = CsvSchema.emptySchema().withHeader().withComments();

    /* Inflectional endings removed when a token is not a lemma itself, longest first */
    private static final List<String> SUFFIXES = List.of("es", "en", "s", "n");

    private final Map<String, PrnEntry> entries = new TreeMap<>();

    public PrnTable() {}

    public PrnTable(Collection<PrnEntry> entries) {
        overlay(entries);
    }

    /**
     * Loads the compiled list and, when given, the adjusted list.
     *
     * @param compiled Compiled PRN list; required.
     * @param adjusted Manually adjusted list; may be null. A missing adjusted list is only warned about.
     */
    public static PrnTable load(Path compiled, Path adjusted) {
        if (!exists(compiled)) {
            throw new MissingInputException("PRN list", compiled);
        }
        PrnTable table = new PrnTable(read(compiled));
        int numCompiled = table.size();
        if (adjusted != null) {
            if (exists(adjusted)) {
                List<PrnEntry> manual = read(adjusted);
                table.overlay(manual);
                logger.info("Loaded {} compiled and {} adjusted PRNs ({} after merging)", numCompiled, manual.size(), table.size());
            } else {
                logger.warn("Adjusted PRN list {} not found, using the compiled list only", adjusted);
            }
        }
        return table;
    }

    /**
     * Reads a PRN list. Rows with an unknown gender indicator or without lemma are skipped.
     */
    public static List<PrnEntry> read(Path path) {
        List<PrnRow> rows;
        try {
            rows = readAllRows(path, PRN_SCHEMA, PrnRow.class);
        } catch (IOException e) {
            throw new UncheckedIOException("IOException while reading PRN list " + path, e);
        }
        List<PrnEntry> entries = new ArrayList<>(rows.size());
        for (PrnRow row : rows) {
            GenderLabel gender = GenderLabel.fromIndicator(row.gender());
            if (gender == null) {
                logger.warn("Skipped PRN {} in {}: unknown gender indicator '{}'", row.lemma(), path, row.gender());
                continue;
            }
            if (row.lemma() == null || row.lemma().isBlank()) {
                continue;
            }
            entries.add(new PrnEntry(row.lemma().strip(), gender, row.sourceUrl() == null ? "" : row.sourceUrl()));
        }
        return entries;
    }

    /**
     * Adds the entries, replacing any entry with the same lemma.
     */
    public void overlay(Collection<PrnEntry> overlay) {
        for (PrnEntry entry : overlay) {
            entries.put(entry.lemma(), entry);
        }
    }

    public Optional<PrnEntry> get(String lemma) {
        return Optional.ofNullable(entries.get(lemma));
    }

    /**
     * Looks a token up, first as is and then without an inflectional ending (-es, -en, -s, -n).
     */
    public Optional<PrnEntry> match(String token) {
        PrnEntry entry = entries.get(token);
        if (entry != null) {
            return Optional.of(entry);
        }
        for (String suffix : SUFFIXES) {
            if (token.length() > suffix.length() + 1 && token.endsWith(suffix)) {
                entry = entries.get(token.substring(0, token.length() - suffix.length()));
                if (entry != null) {
                    return Optional.of(entry);
                }
            }
        }
        return Optional.empty();
    }

    public int size() {
        return entries.size();
    }

    public Collection<PrnEntry> entries() {
        return Collections.unmodifiableCollection(entries.values());
    }
}

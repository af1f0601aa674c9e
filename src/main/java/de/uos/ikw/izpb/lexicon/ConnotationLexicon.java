package de.uos.ikw.izpb.lexicon;

import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import de.uos.ikw.izpb.formats.GleanRow;
import de.uos.ikw.izpb.schemas.ConnotationScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static de.uos.ikw.izpb.util.AuxiliarFunctions.exists;
import static de.uos.ikw.izpb.util.ObjectReaderUtils.CSV_MAPPER;
import static de.uos.ikw.izpb.util.ObjectReaderUtils.readAllRows;

/**
 * GLEAN affect norms (valence, arousal, imageability, concreteness) by word.
 */
public class ConnotationLexicon {
    private static final Logger logger = LoggerFactory.getLogger(ConnotationLexicon.class);

    /* Columns are bound by position, the header row is skipped whatever it says */
    public static final CsvSchema GLEAN_SCHEMA = CSV_MAPPER.schemaFor(GleanRow.class)
            .withColumnSeparator(';')
            .withSkipFirstDataRow(true);

    private static final String[] INFLECTIONS = {"em", "en", "er", "es", "e"};

    private final Map<String, ConnotationScore> exact = new HashMap<>();
    private final Map<String, ConnotationScore> lowerCased = new HashMap<>();

    public ConnotationLexicon(Collection<ConnotationScore> scores) {
        for (ConnotationScore score : scores) {
            exact.putIfAbsent(score.word(), score);
            lowerCased.putIfAbsent(score.word().toLowerCase(Locale.GERMAN), score);
        }
    }

    public static ConnotationLexicon empty() {
        return new ConnotationLexicon(List.of());
    }

    /**
     * Loads the norms file. A missing file gives an empty lexicon: nothing can be scored.
     */
    public static ConnotationLexicon load(Path path) {
        if (!exists(path)) {
            logger.warn("Connotation lexicon {} not found, no mention will be scored", path);
            return empty();
        }
        try {
            List<ConnotationScore> scores = new ArrayList<>();
            int incomplete = 0;
            for (GleanRow row : readAllRows(path, GLEAN_SCHEMA, GleanRow.class)) {
                if (!row.isComplete()) {
                    logger.warn("Skipped GLEAN row with missing values: {}", row);
                    incomplete++;
                    continue;
                }
                scores.add(new ConnotationScore(row.word().strip(), row.valence(), row.arousal(),
                        row.imageability(), row.concreteness()));
            }
            logger.info("Loaded {} GLEAN norms from {} ({} incomplete rows skipped)", scores.size(), path, incomplete);
            return new ConnotationLexicon(scores);
        } catch (IOException e) {
            throw new UncheckedIOException("IOException while reading " + path, e);
        }
    }

    /**
     * Norms of a lemma: exact match first, then case-insensitive.
     */
    public Optional<ConnotationScore> score(String lemma) {
        if (lemma == null) {
            return Optional.empty();
        }
        ConnotationScore score = exact.get(lemma);
        if (score == null) {
            score = lowerCased.get(lemma.toLowerCase(Locale.GERMAN));
        }
        return Optional.ofNullable(score);
    }

    /**
     * Norms of an uninflected word form. Descriptors are not lemmatized, so an adjective like
     * "kluge" is looked up as is and then without its ending ("klug").
     */
    public Optional<ConnotationScore> scoreInflected(String word) {
        Optional<ConnotationScore> score = score(word);
        if (score.isPresent() || word == null) {
            return score;
        }
        for (String ending : INFLECTIONS) {
            if (word.length() > ending.length() + 2 && word.endsWith(ending)) {
                score = score(word.substring(0, word.length() - ending.length()));
                if (score.isPresent()) {
                    return score;
                }
            }
        }
        return Optional.empty();
    }

    public int size() {
        return exact.size();
    }
}

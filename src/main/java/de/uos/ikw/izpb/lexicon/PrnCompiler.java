package de.uos.ikw.izpb.lexicon;

import de.uos.ikw.izpb.analysis.AnalysisConfig;
import de.uos.ikw.izpb.formats.PrnRow;
import de.uos.ikw.izpb.formats.WikiPage;
import de.uos.ikw.izpb.schemas.GenderLabel;
import de.uos.ikw.izpb.schemas.PrnEntry;
import de.uos.ikw.izpb.util.MissingInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

import static de.uos.ikw.izpb.util.AuxiliarFunctions.createFolder;
import static de.uos.ikw.izpb.util.AuxiliarFunctions.exists;
import static de.uos.ikw.izpb.util.ObjectReaderUtils.writeAllRows;

/**
 * Compiles the list of people-referencing nouns (PRNs) from a German Wiktionary dump.
 * Pages are streamed, split into dictionary entries and classified by the PrnRule list. The
 * compiled list only depends on the set of pages, not on their order in the dump.
 */
public class PrnCompiler {
    private static final Logger logger = LoggerFactory.getLogger(PrnCompiler.class);

    public static final String SOURCE_URL_PREFIX = "https://de.wiktionary.org/w/index.php?title=";
    private static final int MAIN_NAMESPACE = 0;

    private final CollisionPolicy collisions;
    private final DictionaryEntryParser parser = new DictionaryEntryParser();
    private final WiktionaryDumpReader dumpReader = new WiktionaryDumpReader();

    private final Map<String, Set<GenderLabel>> genders = new TreeMap<>();
    private final Map<String, Set<String>> sources = new TreeMap<>();
    private final Map<GenderLabel, List<String>> singulars = new EnumMap<>(GenderLabel.class);
    private final Map<GenderLabel, List<String>> plurals = new EnumMap<>(GenderLabel.class);
    private int numPages;
    private int numClassified;

    public PrnCompiler(CollisionPolicy collisions) {
        this.collisions = collisions;
        reset();
    }

    /**
     * Compiles the PRN list of a whole dump.
     *
     * @param dump Path to a .xml or .xml.bz2 dump.
     * @return PRN entries sorted by lemma.
     */
    public List<PrnEntry> compile(Path dump) throws IOException {
        if (!exists(dump)) {
            throw new MissingInputException("Wiktionary dump", dump);
        }
        reset();
        dumpReader.read(dump, this::accept);
        logger.info("Read {} pages, {} entries classified as PRN", numPages, numClassified);
        return entries();
    }

    /**
     * Adds the PRNs of one page. Pages outside the main namespace are ignored.
     */
    public void accept(WikiPage page) {
        numPages++;
        if (page.ns() != MAIN_NAMESPACE || page.title() == null) {
            return;
        }
        List<DictionaryEntry> entries;
        try {
            entries = parser.parse(page.wikitext());
        } catch (RuntimeException e) {
            logger.debug("Dropped page {}: {}", page.title(), e.getMessage());
            return;
        }
        for (DictionaryEntry entry : entries) {
            PrnRule.Outcome outcome = PrnRule.classify(entry);
            if (outcome.verdict() != PrnRule.Verdict.CLASSIFY) {
                continue;
            }
            numClassified++;
            for (PrnRule.GenderedForm form : outcome.forms()) {
                add(form, page.title());
            }
        }
    }

    private void add(PrnRule.GenderedForm form, String pageTitle) {
        String lemma = form.form().strip();
        genders.computeIfAbsent(lemma, k -> EnumSet.noneOf(GenderLabel.class)).add(form.gender());
        sources.computeIfAbsent(lemma, k -> new TreeSet<>()).add(pageTitle);
        (form.plural() ? plurals : singulars).get(form.gender()).add(lemma);
    }

    /**
     * @return Compiled entries sorted by lemma, collisions handled by the collision policy.
     */
    public List<PrnEntry> entries() {
        List<PrnEntry> entries = new ArrayList<>();
        for (Map.Entry<String, Set<GenderLabel>> entry : genders.entrySet()) {
            GenderLabel gender;
            if (entry.getValue().size() == 1) {
                gender = entry.getValue().iterator().next();
            } else if (collisions == CollisionPolicy.AMBIGUOUS) {
                gender = GenderLabel.AMBIGUOUS;
            } else {
                continue;
            }
            String sourceUrl = sources.get(entry.getKey()).stream()
                    .map(title -> SOURCE_URL_PREFIX + title)
                    .collect(Collectors.joining("; "));
            entries.add(new PrnEntry(entry.getKey(), gender, sourceUrl));
        }
        return entries;
    }

    public static void write(Path path, List<PrnEntry> entries) throws IOException {
        if (path.toAbsolutePath().getParent() != null) {
            createFolder(path.toAbsolutePath().getParent());
        }
        List<PrnRow> rows = entries.stream()
                .map(entry -> new PrnRow(entry.gender().indicator(), entry.lemma(), entry.sourceUrl()))
                .toList();
        writeAllRows(path, PrnRow.class, rows);
    }

    /**
     * Logs totals, singular and plural counts, unique forms within and across genders.
     */
    public void logStatistics() {
        Map<GenderLabel, Set<String>> unique = new EnumMap<>(GenderLabel.class);
        Set<String> all = new HashSet<>();
        int total = 0;
        for (GenderLabel gender : List.of(GenderLabel.FEMALE, GenderLabel.MALE)) {
            Set<String> forms = new HashSet<>(singulars.get(gender));
            forms.addAll(plurals.get(gender));
            unique.put(gender, forms);
            all.addAll(forms);
            total += singulars.get(gender).size() + plurals.get(gender).size();
        }

        logger.info("==== prn list statistics ====");
        logger.info("total {}, unique {}, collisions {}", total, all.size(),
                genders.values().stream().filter(g -> g.size() > 1).count());
        for (GenderLabel gender : List.of(GenderLabel.FEMALE, GenderLabel.MALE)) {
            Set<String> other = unique.get(gender == GenderLabel.FEMALE ? GenderLabel.MALE : GenderLabel.FEMALE);
            Set<String> singular = new HashSet<>(singulars.get(gender));
            Set<String> plural = new HashSet<>(plurals.get(gender));
            logger.info("{}: total {}, unique within gender {}, unique across gender {}", gender.label(),
                    singulars.get(gender).size() + plurals.get(gender).size(), unique.get(gender).size(),
                    unique.get(gender).stream().filter(f -> !other.contains(f)).count());
            logger.info("{}: singular {} ({} unique, {} across gender), plural {} ({} unique, {} across gender)",
                    gender.label(),
                    singulars.get(gender).size(), singular.size(), singular.stream().filter(f -> !other.contains(f)).count(),
                    plurals.get(gender).size(), plural.size(), plural.stream().filter(f -> !other.contains(f)).count());
        }
    }

    private void reset() {
        genders.clear();
        sources.clear();
        for (GenderLabel gender : GenderLabel.values()) {
            singulars.put(gender, new ArrayList<>());
            plurals.put(gender, new ArrayList<>());
        }
        numPages = 0;
        numClassified = 0;
    }

    public static void main(String[] args) {
        AnalysisConfig config = AnalysisConfig.load(args);
        AnalysisConfig.Compiler settings = config.compiler();
        PrnCompiler compiler = new PrnCompiler(settings.collisions());
        try {
            List<PrnEntry> entries = compiler.compile(settings.dump());
            write(settings.output(), entries);
            compiler.logStatistics();
            logger.info("Wrote {} PRNs to {}", entries.size(), settings.output());
        } catch (MissingInputException e) {
            logger.error(e.getMessage());
            System.exit(1);
        } catch (IOException e) {
            logger.error("IOException while compiling the PRN list from {}", settings.dump(), e);
            System.exit(1);
        }
    }
}

package de.uos.ikw.izpb.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import de.uos.ikw.izpb.formats.ArticleRow;
import de.uos.ikw.izpb.formats.AuthorRow;
import de.uos.ikw.izpb.formats.VolumeRow;
import de.uos.ikw.izpb.schemas.Article;
import de.uos.ikw.izpb.schemas.Author;
import de.uos.ikw.izpb.schemas.Volume;
import de.uos.ikw.izpb.util.MissingInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

import static de.uos.ikw.izpb.util.AuxiliarFunctions.exists;
import static de.uos.ikw.izpb.util.ObjectReaderUtils.readAllRows;

/**
 * Read-only access to the corpus written by the scraper. Rows with an id seen before are
 * dropped (the first occurrence wins) before any join.
 */
public class CorpusRepository {
    private static final Logger logger = LoggerFactory.getLogger(CorpusRepository.class);

    /* Global variables (paths):
    ARTICLES_FILENAME  [String] : articles table, one row per article.
    AUTHORS_FILENAME   [String] : authors table.
    VOLUMES_FILENAME   [String] : volumes (issues) table.
    ARTICLES_FOLDER    [String] : folder with one <uuid>.json file per article.
     */
    public static final String ARTICLES_FILENAME = "izpb-corpus_articles.csv";
    public static final String AUTHORS_FILENAME = "izpb-corpus_authors.csv";
    public static final String VOLUMES_FILENAME = "izpb-corpus_volumes.csv";
    public static final String ARTICLES_FOLDER = "articles";

    public static final CsvSchema CORPUS_SCHEMA = CsvSchema.emptySchema().withHeader();
    public static final ObjectReader ARTICLE_READER = JsonMapper.builder().findAndAddModules().build().readerFor(JsonNode.class);

    /* Articles whose title matches are bibliographies or imprints */
    public static final Pattern BACK_MATTER = Pattern.compile(
            ".*Literatur(angaben|hinweise|verzeichnis)?.*|Literatur und Internetadressen|.*Quellen.*|.*Impressum.*");

    private final Path corpusPath;
    private final Map<String, ArticleRow> articles;
    private final Map<String, Author> authors;
    private final Map<String, Volume> volumes;

    public CorpusRepository(Path corpusPath, Collection<ArticleRow> articles, Collection<Author> authors,
                            Collection<Volume> volumes) {
        this.corpusPath = corpusPath;
        this.articles = deduplicate(articles, ArticleRow::uuid, "article");
        this.authors = deduplicate(authors, Author::id, "author");
        this.volumes = deduplicate(volumes, Volume::id, "volume");
    }

    /**
     * Reads the corpus tables. The articles table and folder are required, authors and volumes
     * tables are optional.
     */
    public static CorpusRepository load(Path corpusPath) {
        Path articlesFile = corpusPath.resolve(ARTICLES_FILENAME);
        if (!exists(articlesFile)) {
            throw new MissingInputException("Articles table", articlesFile);
        }
        if (!exists(corpusPath.resolve(ARTICLES_FOLDER))) {
            throw new MissingInputException("Articles folder", corpusPath.resolve(ARTICLES_FOLDER));
        }
        try {
            List<ArticleRow> articleRows = readAllRows(articlesFile, CORPUS_SCHEMA, ArticleRow.class);

            List<Author> authors = new ArrayList<>();
            Path authorsFile = corpusPath.resolve(AUTHORS_FILENAME);
            if (exists(authorsFile)) {
                for (AuthorRow row : readAllRows(authorsFile, CORPUS_SCHEMA, AuthorRow.class)) {
                    authors.add(new Author(row.uuid(), row.author(), row.info() == null ? "" : row.info()));
                }
            } else {
                logger.warn("Authors table {} not found", authorsFile);
            }

            List<Volume> volumes = new ArrayList<>();
            Path volumesFile = corpusPath.resolve(VOLUMES_FILENAME);
            if (exists(volumesFile)) {
                for (VolumeRow row : readAllRows(volumesFile, CORPUS_SCHEMA, VolumeRow.class)) {
                    volumes.add(new Volume(row.uuid(), row.title(), parseDate(row.published())));
                }
            } else {
                logger.warn("Volumes table {} not found", volumesFile);
            }

            CorpusRepository repository = new CorpusRepository(corpusPath, articleRows, authors, volumes);
            logger.info("Corpus {}: {} articles, {} authors, {} volumes", corpusPath,
                    repository.articles.size(), repository.authors.size(), repository.volumes.size());
            return repository;
        } catch (IOException e) {
            throw new UncheckedIOException("IOException while reading corpus " + corpusPath, e);
        }
    }

    private static <T> Map<String, T> deduplicate(Collection<T> rows, Function<T, String> id, String what) {
        Map<String, T> unique = new LinkedHashMap<>();
        for (T row : rows) {
            String key = id.apply(row);
            if (key == null || key.isBlank()) {
                logger.warn("Skipped {} without id", what);
                continue;
            }
            if (unique.putIfAbsent(key.strip(), row) != null) {
                logger.debug("Dropped duplicate {} {}", what, key);
            }
        }
        return unique;
    }

    public List<String> articleIds() {
        return List.copyOf(articles.keySet());
    }

    public Collection<Author> authors() {
        return authors.values();
    }

    public Collection<Volume> volumes() {
        return volumes.values();
    }

    public Optional<Author> author(String id) {
        return Optional.ofNullable(authors.get(id));
    }

    public Optional<Volume> volume(String id) {
        return Optional.ofNullable(volumes.get(id));
    }

    /**
     * Resolves an article id given in full or as a unique prefix.
     *
     * @throws IllegalArgumentException when no id or more than one id matches.
     */
    public String resolveArticleId(String idOrPrefix) {
        return resolve(articles.keySet(), idOrPrefix);
    }

    public static String resolve(Collection<String> ids, String idOrPrefix) {
        if (ids.contains(idOrPrefix)) {
            return idOrPrefix;
        }
        List<String> matches = ids.stream().filter(id -> id.startsWith(idOrPrefix)).toList();
        if (matches.isEmpty()) {
            throw new IllegalArgumentException("No id matches " + idOrPrefix);
        }
        if (matches.size() > 1) {
            throw new IllegalArgumentException("Id prefix " + idOrPrefix + " is ambiguous: " + matches);
        }
        return matches.get(0);
    }

    /**
     * Loads the text of an article.
     *
     * @return The article, empty when its file is missing or malformed or when it is back matter
     * (bibliography, imprint).
     */
    public Optional<Article> article(String id) {
        ArticleRow row = articles.get(id);
        if (row == null) {
            return Optional.empty();
        }
        Path file = corpusPath.resolve(ARTICLES_FOLDER).resolve(id + ".json");
        if (!exists(file)) {
            logger.warn("Skipped article {}: {} not found", id, file);
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = ARTICLE_READER.readValue(file.toFile());
        } catch (IOException e) {
            logger.warn("Skipped article {}: {}", id, e.getMessage());
            return Optional.empty();
        }
        if (root == null || !root.isObject() || root.isEmpty()) {
            logger.warn("Skipped article {}: no content", id);
            return Optional.empty();
        }

        String title = removeSoftHyphens(root.fieldNames().next());
        if (BACK_MATTER.matcher(title).lookingAt()) {
            logger.info("Skipped article {}: bibliography or imprint ({})", id, title);
            return Optional.empty();
        }
        List<String> paragraphs = new ArrayList<>();
        paragraphs.add(title);
        root.elements().forEachRemaining(node -> flatten(node, paragraphs));

        return Optional.of(new Article(id, title, row.volumeUuid(), parseAuthorIds(row.authorUuids()), paragraphs));
    }

    /**
     * Flattens the heading hierarchy in document order: texts as they are, nested sections as
     * their heading followed by their content.
     */
    static void flatten(JsonNode node, List<String> paragraphs) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isTextual()) {
            paragraphs.add(removeSoftHyphens(node.asText()));
        } else if (node.isArray()) {
            node.elements().forEachRemaining(child -> flatten(child, paragraphs));
        } else if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                paragraphs.add(removeSoftHyphens(field.getKey()));
                flatten(field.getValue(), paragraphs);
            }
        }
    }

    /**
     * Parses the author list as written by the scraper ("['a', 'b']"); JSON arrays and plain
     * comma separated lists are accepted too.
     */
    static List<String> parseAuthorIds(String authorUuids) {
        if (authorUuids == null || authorUuids.isBlank()) {
            return List.of();
        }
        String inner = authorUuids.strip();
        if (inner.startsWith("[") && inner.endsWith("]")) {
            inner = inner.substring(1, inner.length() - 1);
        }
        return Arrays.stream(inner.split(","))
                .map(id -> id.strip().replaceAll("^['\"]|['\"]$", "").strip())
                .filter(id -> !id.isEmpty())
                .distinct()
                .toList();
    }

    static LocalDate parseDate(String published) {
        if (published == null || published.length() < 10) {
            return null;
        }
        try {
            return LocalDate.parse(published.strip().substring(0, 10));
        } catch (DateTimeParseException e) {
            logger.debug("Unparseable publication date '{}'", published);
            return null;
        }
    }

    private static String removeSoftHyphens(String text) {
        return text.replace("\u00AD", "");
    }
}

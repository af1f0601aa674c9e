package de.uos.ikw.izpb.analysis;

import de.uos.ikw.izpb.lexicon.ConnotationLexicon;
import de.uos.ikw.izpb.lexicon.PrnTable;
import de.uos.ikw.izpb.lookup.CachedGenderLookup;
import de.uos.ikw.izpb.lookup.FixtureGenderLookup;
import de.uos.ikw.izpb.lookup.GenderLookup;
import de.uos.ikw.izpb.lookup.SparqlClient;
import de.uos.ikw.izpb.lookup.WikidataGenderLookup;
import de.uos.ikw.izpb.nlp.CoreNlpDependencyParser;
import de.uos.ikw.izpb.nlp.CoreNlpPersonRecognizer;
import de.uos.ikw.izpb.nlp.DependencyParser;
import de.uos.ikw.izpb.nlp.PersonRecognizer;
import de.uos.ikw.izpb.schemas.AggregateRecord;
import de.uos.ikw.izpb.schemas.Article;
import de.uos.ikw.izpb.schemas.ArticleAnalysis;
import de.uos.ikw.izpb.schemas.Author;
import de.uos.ikw.izpb.schemas.GenderLabel;
import de.uos.ikw.izpb.schemas.Granularity;
import de.uos.ikw.izpb.schemas.Mention;
import de.uos.ikw.izpb.schemas.Resolution;
import de.uos.ikw.izpb.schemas.Volume;
import de.uos.ikw.izpb.util.MissingInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Gender depiction analysis of the corpus:
 * 1) Load the PRN list, the connotation lexicon and the corpus tables.
 * 2) Extract the mentions of every article.
 * 3) Resolve the gender of all mentions (PRN list, knowledge base).
 * 4) Infer the gender of the authors.
 * 5) Aggregate per article, volume and author and write the result tables.
 */
public class AnalysisPipeline {
    private static final Logger logger = LoggerFactory.getLogger(AnalysisPipeline.class);

    private final AnalysisConfig config;
    private final PersonRecognizer recognizer;
    private final DependencyParser parser;
    private final GenderLookup lookup;

    /**
     * Everything the analysis computed, as written to the result tables.
     */
    public record AnalysisResult(List<ArticleAnalysis> articles, Map<Granularity, List<AggregateRecord>> statistics,
                                 List<AuthorGenderInference.AuthorGender> authors) {}

    public AnalysisPipeline(AnalysisConfig config, PersonRecognizer recognizer, DependencyParser parser,
                            GenderLookup lookup) {
        this.config = config;
        this.recognizer = recognizer;
        this.parser = parser;
        this.lookup = lookup;
    }

    /**
     * Pipeline without descriptor extraction.
     */
    public AnalysisPipeline(AnalysisConfig config, PersonRecognizer recognizer, GenderLookup lookup) {
        this(config, recognizer, text -> List.of(), lookup);
    }

    public AnalysisResult run() throws IOException {
        // 1)
        PrnTable prnTable = PrnTable.load(config.lexicon().prnList(), config.lexicon().prnListAdjusted());
        ConnotationLexicon lexicon = ConnotationLexicon.load(config.lexicon().glean());
        CorpusRepository corpus = CorpusRepository.load(config.corpus().path());

        // 2)
        MentionExtractor extractor = new MentionExtractor(recognizer, prnTable, new DescriptorExtractor(parser));
        List<String> articleIds = selectArticles(corpus);
        List<ArticleAnalysis> analyses = new ArrayList<>();
        for (int n = 0; n < articleIds.size(); n++) {
            String id = articleIds.get(n);
            logger.info("Article {} / {}: {}", n + 1, articleIds.size(), id);
            Optional<Article> article = corpus.article(id);
            if (article.isEmpty()) {
                continue;
            }
            try {
                analyses.add(extractor.extract(article.get()));
            } catch (RuntimeException e) {
                logger.warn("Skipped article {}: extraction failed", id, e);
            }
        }

        // 3)
        PoolResolution pool = new PoolResolution(lookup, config.lookup().workers(), budgetPerName(config.lookup()),
                Duration.ofSeconds(config.lookup().graceSeconds()));
        GenderResolver resolver = new GenderResolver(prnTable, pool);
        List<Mention> mentions = analyses.stream().flatMap(a -> a.mentions().stream()).toList();
        resolver.resolve(mentions);
        logger.info("Resolved {} mentions in {} articles", mentions.size(), analyses.size());

        // 4)
        List<Author> authors = new ArrayList<>(corpus.authors());
        Map<String, Resolution> authorResolutions = resolver.resolveNames(authors.stream().map(Author::name).toList());
        List<AuthorGenderInference.AuthorGender> authorGenders =
                new AuthorGenderInference(prnTable).infer(authors, authorResolutions);

        // 5)
        Map<String, String> volumeTitles = new HashMap<>();
        for (Volume volume : corpus.volumes()) {
            volumeTitles.put(volume.id(), volume.title() == null ? "" : volume.title());
        }
        Map<String, String> authorNames = new HashMap<>();
        Map<String, GenderLabel> combinedGenders = new LinkedHashMap<>();
        for (AuthorGenderInference.AuthorGender gender : authorGenders) {
            authorNames.put(gender.author().id(), gender.author().name());
            combinedGenders.put(gender.author().id(), gender.combined());
        }

        StatisticsAggregator aggregator = new StatisticsAggregator(lexicon);
        Map<Granularity, List<AggregateRecord>> statistics = new EnumMap<>(Granularity.class);
        statistics.put(Granularity.ARTICLE, aggregator.byArticle(analyses));
        statistics.put(Granularity.VOLUME, aggregator.byVolume(analyses, volumeTitles));
        statistics.put(Granularity.AUTHOR, aggregator.byAuthor(analyses, authorNames, combinedGenders));

        ResultWriter writer = new ResultWriter(config.output());
        for (Map.Entry<Granularity, List<AggregateRecord>> entry : statistics.entrySet()) {
            writer.writeStatistics(entry.getKey(), entry.getValue());
        }
        writer.writeMentions(analyses);
        writer.writeOccurrences(OccurrenceTables.build(analyses));
        writer.writeAuthorGenders(authorGenders);

        if (lookup instanceof CachedGenderLookup) {
            ((CachedGenderLookup) lookup).save(config.lookup().cache());
        }
        return new AnalysisResult(analyses, statistics, authorGenders);
    }

    private List<String> selectArticles(CorpusRepository corpus) {
        if (config.corpus().articles().isEmpty()) {
            return corpus.articleIds();
        }
        return config.corpus().articles().stream().map(corpus::resolveArticleId).toList();
    }

    /**
     * Worst case of one name: two queries and the possessive retry, each with all its attempts.
     */
    static Duration budgetPerName(AnalysisConfig.Lookup settings) {
        long perQuery = (long) settings.timeoutSeconds() * (settings.retries() + 1)
                + (long) settings.retryDelaySeconds() * settings.retries();
        return Duration.ofSeconds(4 * perQuery);
    }

    /**
     * Creates the lookup selected by lookup.mode.
     */
    public static GenderLookup createLookup(AnalysisConfig.Lookup settings) {
        switch (settings.mode()) {
            case FIXTURE:
                return FixtureGenderLookup.load(settings.fixture());
            case LIVE:
                return wikidata(settings);
            case CACHED:
            default:
                CachedGenderLookup cached = new CachedGenderLookup(wikidata(settings));
                try {
                    cached.load(settings.cache());
                } catch (IOException e) {
                    throw new UncheckedIOException("IOException while reading lookup cache " + settings.cache(), e);
                }
                return cached;
        }
    }

    private static GenderLookup wikidata(AnalysisConfig.Lookup settings) {
        SparqlClient client = new SparqlClient(settings.endpoint(), settings.userAgent(),
                Duration.ofSeconds(settings.timeoutSeconds()));
        return new WikidataGenderLookup(client, settings.retries(), settings.retryDelaySeconds() * 1000L);
    }

    public static PersonRecognizer createRecognizer(AnalysisConfig.Ner settings) {
        if (!settings.enabled()) {
            logger.warn("Named-entity recognition disabled, only PRNs are extracted");
            return text -> List.of();
        }
        return new CoreNlpPersonRecognizer(settings.properties());
    }

    public static DependencyParser createParser(AnalysisConfig.Ner settings) {
        if (!settings.enabled() || !settings.descriptors()) {
            logger.warn("Dependency parsing disabled, no descriptors are extracted");
            return text -> List.of();
        }
        return new CoreNlpDependencyParser(settings.properties());
    }

    /**
     * Runs the analysis with the settings given by the arguments.
     *
     * @return Exit status: 0 on success, 1 when the run was aborted.
     */
    static int execute(String[] args) {
        long start = System.currentTimeMillis();
        try {
            AnalysisConfig config = AnalysisConfig.load(args);
            AnalysisPipeline pipeline = new AnalysisPipeline(config, createRecognizer(config.ner()),
                    createParser(config.ner()), createLookup(config.lookup()));
            AnalysisResult result = pipeline.run();
            logger.info("Analysed {} articles in {} seconds", result.articles().size(),
                    (System.currentTimeMillis() - start) * 0.001);
            return 0;
        } catch (MissingInputException e) {
            logger.error(e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            logger.error("Invalid settings: {}", e.getMessage());
            return 1;
        } catch (IOException | UncheckedIOException e) {
            logger.error("Analysis failed", e);
            return 1;
        }
    }

    public static void main(String[] args) {
        int status = execute(args);
        if (status != 0) {
            System.exit(status);
        }
    }
}

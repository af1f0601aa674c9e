package de.uos.ikw.izpb.analysis;

import de.uos.ikw.izpb.lexicon.CollisionPolicy;
import de.uos.ikw.izpb.lookup.LookupMode;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

/**
 * Settings of the analysis and of the PRN compiler, read from izpb.properties.
 * Every key can be overridden with a system property prefixed by "izpb." (-Dizpb.lookup.mode=fixture).
 */
public record AnalysisConfig(Corpus corpus, Lexicon lexicon, Lookup lookup, Ner ner, Compiler compiler,
                             Output output) {

    public static final String RESOURCE = "izpb.properties";
    public static final String OVERRIDE_PREFIX = "izpb.";

    /**
     * corpus.path      : folder with the scraper tables and the articles/ folder.
     * corpus.articles  : optional comma separated article ids (or unique id prefixes) to analyse.
     */
    public record Corpus(Path path, List<String> articles) {}

    public record Lexicon(Path prnList, Path prnListAdjusted, Path glean) {}

    /**
     * graceSeconds : time the lookup pool gets on top of the per-name budget of its largest slice.
     */
    public record Lookup(LookupMode mode, String endpoint, String userAgent, int workers, int timeoutSeconds,
                         int retries, int retryDelaySeconds, int graceSeconds, Path cache, Path fixture) {}

    /**
     * enabled    : when false no named entities are recognized (PRNs only).
     * properties : CoreNLP language settings on the classpath.
     * descriptors: when true paragraphs are dependency parsed to find the words describing mentions.
     */
    public record Ner(boolean enabled, String properties, boolean descriptors) {}

    public record Compiler(Path dump, Path output, CollisionPolicy collisions) {}

    public record Output(Path path, String suffix) {

        public Path file(String name) {
            return path.resolve(name + suffix + ".csv");
        }
    }

    /**
     * Loads the settings from the file given as first argument, or from izpb.properties on the
     * classpath, and applies the system property overrides.
     */
    public static AnalysisConfig load(String[] args) {
        Properties properties = new Properties();
        if (args != null && args.length > 0) {
            Path path = Paths.get(args[0]);
            try (InputStream stream = Files.newInputStream(path)) {
                properties.load(stream);
            } catch (IOException e) {
                throw new UncheckedIOException("IOException while reading settings " + path, e);
            }
        } else {
            try (InputStream stream = AnalysisConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
                if (stream == null) {
                    throw new IllegalStateException(RESOURCE + " not found on the classpath");
                }
                properties.load(stream);
            } catch (IOException e) {
                throw new UncheckedIOException("IOException while reading " + RESOURCE, e);
            }
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith(OVERRIDE_PREFIX)) {
                properties.setProperty(key.substring(OVERRIDE_PREFIX.length()), System.getProperty(key));
            }
        }
        return from(properties);
    }

    public static AnalysisConfig from(Properties properties) {
        return new AnalysisConfig(
                new Corpus(
                        path(properties, "corpus.path", "data/corpus"),
                        list(properties, "corpus.articles")),
                new Lexicon(
                        path(properties, "lexicon.prnList", "analysis/prn_list.csv"),
                        optionalPath(properties, "lexicon.prnListAdjusted"),
                        path(properties, "lexicon.glean", "data/meta/glean.csv")),
                new Lookup(
                        LookupMode.valueOf(string(properties, "lookup.mode", "cached").toUpperCase(Locale.ROOT)),
                        string(properties, "lookup.endpoint", "https://query.wikidata.org/sparql"),
                        string(properties, "lookup.userAgent", "izpb-gender-analysis/1.0"),
                        integer(properties, "lookup.workers", 4),
                        integer(properties, "lookup.timeoutSeconds", 30),
                        integer(properties, "lookup.retries", 1),
                        integer(properties, "lookup.retryDelaySeconds", 60),
                        integer(properties, "lookup.graceSeconds", 60),
                        path(properties, "lookup.cache", "analysis/wikidata_cache.csv"),
                        path(properties, "lookup.fixture", "analysis/wikidata_fixture.csv")),
                new Ner(
                        Boolean.parseBoolean(string(properties, "ner.enabled", "true")),
                        string(properties, "ner.properties", "StanfordCoreNLP-german.properties"),
                        Boolean.parseBoolean(string(properties, "ner.descriptors", "true"))),
                new Compiler(
                        path(properties, "compiler.dump", "data/meta/dewiktionary-pages-articles-multistream.xml.bz2"),
                        path(properties, "compiler.output", "analysis/prn_list.csv"),
                        CollisionPolicy.valueOf(string(properties, "compiler.collisions", "ambiguous").toUpperCase(Locale.ROOT))),
                new Output(
                        path(properties, "output.path", "analysis/results"),
                        string(properties, "output.suffix", ""))
        );
    }

    private static String string(Properties properties, String key, String defaultValue) {
        String value = properties.getProperty(key);
        return value == null ? defaultValue : value.strip();
    }

    private static int integer(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Setting " + key + " must be an integer, got '" + value + "'", e);
        }
    }

    private static Path path(Properties properties, String key, String defaultValue) {
        return Paths.get(string(properties, key, defaultValue));
    }

    private static Path optionalPath(Properties properties, String key) {
        String value = string(properties, key, "");
        return value.isEmpty() ? null : Paths.get(value);
    }

    private static List<String> list(Properties properties, String key) {
        String value = string(properties, key, "");
        if (value.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(value.split(",")).map(String::strip).filter(s -> !s.isEmpty()).toList();
    }
}

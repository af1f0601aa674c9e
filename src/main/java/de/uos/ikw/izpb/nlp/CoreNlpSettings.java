package de.uos.ikw.izpb.nlp;

import edu.stanford.nlp.pipeline.StanfordCoreNLP;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Builds CoreNLP pipelines from the language settings shipped with the models jar.
 */
class CoreNlpSettings {
    private static final Logger logger = LoggerFactory.getLogger(CoreNlpSettings.class);

    static StanfordCoreNLP pipeline(String propertiesResource, String annotators) {
        Properties properties = new Properties();
        try (InputStream stream = CoreNlpSettings.class.getClassLoader().getResourceAsStream(propertiesResource)) {
            if (stream == null) {
                throw new IllegalStateException("CoreNLP settings " + propertiesResource
                        + " not found on the classpath, build with -Pgerman-models");
            }
            properties.load(stream);
        } catch (IOException e) {
            throw new UncheckedIOException("IOException while reading " + propertiesResource, e);
        }
        properties.setProperty("annotators", annotators);
        logger.info("Loading CoreNLP pipeline ({})", annotators);
        return new StanfordCoreNLP(properties);
    }
}

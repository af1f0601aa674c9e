package de.uos.ikw.izpb.nlp;

import edu.stanford.nlp.pipeline.CoreDocument;
import edu.stanford.nlp.pipeline.CoreEntityMention;
import edu.stanford.nlp.pipeline.StanfordCoreNLP;
import edu.stanford.nlp.util.Pair;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Person recognizer backed by Stanford CoreNLP with its German models. The models jar must be on
 * the classpath (german-models profile).
 */
public class CoreNlpPersonRecognizer implements PersonRecognizer {
    public static final String DEFAULT_PROPERTIES = "StanfordCoreNLP-german.properties";
    private static final String ANNOTATORS = "tokenize,ssplit,mwt,pos,ner";
    private static final Set<String> PERSON_TYPES = Set.of("PER", "PERSON", "I-PER", "B-PER");

    private final StanfordCoreNLP pipeline;

    public CoreNlpPersonRecognizer() {
        this(DEFAULT_PROPERTIES);
    }

    /**
     * @param propertiesResource Classpath resource with the CoreNLP language settings.
     */
    public CoreNlpPersonRecognizer(String propertiesResource) {
        this.pipeline = CoreNlpSettings.pipeline(propertiesResource, ANNOTATORS);
    }

    @Override
    public List<PersonSpan> recognize(String text) {
        if (text.isBlank()) {
            return List.of();
        }
        CoreDocument document = new CoreDocument(text);
        pipeline.annotate(document);

        List<PersonSpan> spans = new ArrayList<>();
        for (CoreEntityMention entity : document.entityMentions()) {
            if (!PERSON_TYPES.contains(entity.entityType())) {
                continue;
            }
            Pair<Integer, Integer> offsets = entity.charOffsets();
            spans.add(new PersonSpan(offsets.first(), offsets.second(), entity.text()));
        }
        spans.sort(Comparator.comparingInt(PersonSpan::begin));
        return spans;
    }
}

package de.uos.ikw.izpb.analysis;

import de.uos.ikw.izpb.lexicon.PrnTable;
import de.uos.ikw.izpb.lucene.TextTokenizer;
import de.uos.ikw.izpb.nlp.PersonRecognizer;
import de.uos.ikw.izpb.schemas.Article;
import de.uos.ikw.izpb.schemas.ArticleAnalysis;
import de.uos.ikw.izpb.schemas.Descriptor;
import de.uos.ikw.izpb.schemas.Mention;
import de.uos.ikw.izpb.schemas.MentionKind;
import de.uos.ikw.izpb.schemas.PrnEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static de.uos.ikw.izpb.util.AuxiliarFunctions.normalizeText;

/**
 * Finds the person mentions of an article, paragraph by paragraph:
 * PER mentions are the person names found by the recognizer, PRN mentions the capitalized tokens
 * found in the PRN table. A PRN token inside a person name is part of the name and not counted.
 */
public class MentionExtractor {
    private static final Logger logger = LoggerFactory.getLogger(MentionExtractor.class);

    public static final Comparator<Mention> MENTION_ORDER = Comparator.comparingInt(Mention::paragraph)
            .thenComparingInt(Mention::begin)
            .thenComparing(Mention::kind);

    private static final String GENDER_SEPARATORS = "*_:(";

    private final PersonRecognizer recognizer;
    private final PrnTable prnTable;
    private final TextTokenizer tokenizer = new TextTokenizer();
    private final TextPreprocessor preprocessor = new TextPreprocessor();
    private final BeyondBinaryMatcher beyondBinaryMatcher = new BeyondBinaryMatcher();
    private final DescriptorExtractor descriptorExtractor;

    public MentionExtractor(PersonRecognizer recognizer, PrnTable prnTable, DescriptorExtractor descriptorExtractor) {
        this.recognizer = recognizer;
        this.prnTable = prnTable;
        this.descriptorExtractor = descriptorExtractor;
    }

    /**
     * Extractor that finds no descriptors.
     */
    public MentionExtractor(PersonRecognizer recognizer, PrnTable prnTable) {
        this(recognizer, prnTable, new DescriptorExtractor(text -> List.of()));
    }

    public ArticleAnalysis extract(Article article) {
        List<Mention> mentions = new ArrayList<>();
        List<Descriptor> descriptors = new ArrayList<>();
        Map<String, List<String>> beyondBinary = BeyondBinaryMatcher.empty();
        int numTokens = 0;
        int numSlashes = 0;
        int numNegations = 0;

        for (int i = 0; i < article.paragraphs().size(); i++) {
            String raw = article.paragraphs().get(i);
            beyondBinaryMatcher.match(raw).forEach((pattern, chunks) -> beyondBinary.get(pattern).addAll(chunks));

            TextPreprocessor.Preprocessed preprocessed = preprocessor.apply(raw);
            numSlashes += preprocessed.numSlashes();
            String text = preprocessed.text();
            if (text.isBlank()) {
                continue;
            }

            List<TextTokenizer.Token> tokens = tokenizer.tokenize(text);
            numTokens += tokens.size();
            List<Mention> paragraphMentions = extract(article.id(), i, preprocessed, tokens);
            mentions.addAll(paragraphMentions);

            DescriptorExtractor.Extracted extracted = descriptorExtractor.extract(i, text, paragraphMentions);
            descriptors.addAll(extracted.descriptors());
            numNegations += extracted.numNegations();
        }
        mentions.sort(MENTION_ORDER);
        logger.debug("Article {}: {} tokens, {} mentions, {} descriptors", article.id(), numTokens, mentions.size(),
                descriptors.size());
        return new ArticleAnalysis(article, mentions, numTokens, numSlashes, beyondBinary, descriptors, numNegations);
    }

    private List<Mention> extract(String articleId, int paragraph, TextPreprocessor.Preprocessed preprocessed,
                                  List<TextTokenizer.Token> tokens) {
        String text = preprocessed.text();
        List<Mention> mentions = new ArrayList<>();
        for (PersonRecognizer.PersonSpan span : recognizer.recognize(text)) {
            String name = normalizeText(span.text());
            if (!name.isEmpty()) {
                mentions.add(new Mention(articleId, paragraph, span.begin(), span.end(), span.text(), name, MentionKind.PER));
            }
        }
        int numPersons = mentions.size();

        for (TextTokenizer.Token token : tokens) {
            if (!token.isCapitalized() || isGenderFormStem(text, token) || preprocessed.isPairFormEnd(token.end())) {
                continue;
            }
            Optional<PrnEntry> entry = prnTable.match(token.text());
            if (entry.isEmpty()) {
                continue;
            }
            boolean insidePerson = mentions.subList(0, numPersons).stream()
                    .anyMatch(person -> person.overlaps(token.begin(), token.end()));
            if (!insidePerson) {
                mentions.add(new Mention(articleId, paragraph, token.begin(), token.end(), token.text(),
                        entry.get().lemma(), MentionKind.PRN));
            }
        }
        return mentions;
    }

    /**
     * The tokenizer splits "Lehrer*innen" or "Lehrer(innen)" into "Lehrer" and "innen"; such a stem is
     * not a male PRN. Slash forms are recognized by the preprocessor, before the slash is removed.
     */
    static boolean isGenderFormStem(String text, TextTokenizer.Token token) {
        if (token.end() + 1 >= text.length()) {
            return false;
        }
        char separator = text.charAt(token.end());
        return GENDER_SEPARATORS.indexOf(separator) >= 0 && Character.isLetter(text.charAt(token.end() + 1));
    }
}

package de.uos.ikw.izpb.analysis;

import de.uos.ikw.izpb.nlp.DependencyParser;
import de.uos.ikw.izpb.nlp.DependencyParser.ParsedToken;
import de.uos.ikw.izpb.schemas.Descriptor;
import de.uos.ikw.izpb.schemas.Mention;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Finds the words describing the mentions of a paragraph in its dependency parse:
 * 1) attributive adjectives of a noun (amod),
 * 2) the predicate of which a noun is the subject (nsubj), an adjective ("ist klug") or a verb,
 *    the verb together with its separable particle and its adverbs.
 * Conjoined nouns share the descriptor, conjoined descriptors describe the same nouns.
 * Negations of verbs and adjectives are counted.
 */
public class DescriptorExtractor {
    private static final Logger logger = LoggerFactory.getLogger(DescriptorExtractor.class);

    private static final Set<String> NEGATIONS = Set.of("nicht", "nie", "niemals");

    private final DependencyParser parser;

    /**
     * Descriptors of a paragraph and the number of negations in it.
     */
    public record Extracted(List<Descriptor> descriptors, int numNegations) {}

    public DescriptorExtractor(DependencyParser parser) {
        this.parser = parser;
    }

    /**
     * @param paragraph Index of the paragraph in its article.
     * @param text      Normalized paragraph, the text the mention offsets refer to.
     * @param mentions  Mentions found in this paragraph.
     */
    public Extracted extract(int paragraph, String text, List<Mention> mentions) {
        List<Descriptor> descriptors = new ArrayList<>();
        int numNegations = 0;

        for (List<ParsedToken> sentence : parser.parse(text)) {
            Map<Integer, ParsedToken> byIndex = new HashMap<>();
            Map<Integer, List<ParsedToken>> children = new HashMap<>();
            for (ParsedToken token : sentence) {
                byIndex.put(token.index(), token);
                children.computeIfAbsent(token.head(), k -> new ArrayList<>()).add(token);
            }

            for (ParsedToken token : sentence) {
                ParsedToken head = byIndex.get(token.head());
                if (isNegation(token, head)) {
                    numNegations++;
                    continue;
                }

                List<ParsedToken> targets;
                ParsedToken descriptor;
                if ("amod".equals(token.baseRelation()) && token.isAdjective() && head != null && head.isNoun()) {
                    targets = conjoined(head, children, ParsedToken::isNoun);
                    descriptor = token;
                } else if ("nsubj".equals(token.baseRelation()) && token.isNoun() && head != null
                        && (head.isVerb() || head.isAdjective() || head.isAdverb())) {
                    targets = conjoined(token, children, ParsedToken::isNoun);
                    descriptor = head;
                } else {
                    continue;
                }

                List<Mention> described = mentionsAt(targets, mentions);
                if (described.isEmpty()) {
                    continue;
                }
                for (String word : descriptorWords(descriptor, children)) {
                    logger.trace("Descriptor '{}' of {}", word, described);
                    descriptors.add(new Descriptor(word, paragraph, described));
                }
            }
        }
        return new Extracted(descriptors, numNegations);
    }

    static boolean isNegation(ParsedToken token, ParsedToken head) {
        return NEGATIONS.contains(lower(token.word()))
                && ("advmod".equals(token.baseRelation()) || "neg".equals(token.baseRelation()))
                && head != null && (head.isVerb() || head.isAuxiliary() || head.isAdjective());
    }

    /**
     * The token followed by everything conjoined to it that satisfies the predicate.
     */
    private static List<ParsedToken> conjoined(ParsedToken first, Map<Integer, List<ParsedToken>> children,
                                               Predicate<ParsedToken> predicate) {
        List<ParsedToken> tokens = new ArrayList<>();
        Deque<ParsedToken> pending = new ArrayDeque<>();
        pending.add(first);
        while (!pending.isEmpty()) {
            ParsedToken token = pending.poll();
            tokens.add(token);
            for (ParsedToken child : children.getOrDefault(token.index(), List.of())) {
                if ("conj".equals(child.baseRelation()) && predicate.test(child)) {
                    pending.add(child);
                }
            }
        }
        return tokens;
    }

    private static List<String> descriptorWords(ParsedToken descriptor, Map<Integer, List<ParsedToken>> children) {
        List<String> words = new ArrayList<>();
        List<ParsedToken> adverbs = new ArrayList<>();
        for (ParsedToken token : conjoined(descriptor, children,
                t -> t.isAdjective() || t.isAdverb() || t.isVerb())) {
            words.add(word(token, children));
            if (!token.isVerb()) {
                continue;
            }
            for (ParsedToken child : children.getOrDefault(token.index(), List.of())) {
                if ("advmod".equals(child.baseRelation()) && (child.isAdverb() || child.isAdjective())
                        && !NEGATIONS.contains(lower(child.word()))) {
                    adverbs.add(child);
                }
            }
        }
        for (ParsedToken adverb : adverbs) {
            words.add(lower(adverb.word()));
        }
        return words;
    }

    /**
     * Lower-cased word; a verb gets its separable particle ("nimmt ... teil" gives "teilnimmt").
     */
    private static String word(ParsedToken token, Map<Integer, List<ParsedToken>> children) {
        String word = lower(token.word());
        if (token.isVerb()) {
            for (ParsedToken child : children.getOrDefault(token.index(), List.of())) {
                if ("compound:prt".equals(child.relation())) {
                    return lower(child.word()) + word;
                }
            }
        }
        return word;
    }

    private static List<Mention> mentionsAt(List<ParsedToken> tokens, List<Mention> mentions) {
        Set<Mention> described = new LinkedHashSet<>();
        for (ParsedToken token : tokens) {
            for (Mention mention : mentions) {
                if (mention.overlaps(token.begin(), token.end())) {
                    described.add(mention);
                }
            }
        }
        return new ArrayList<>(described);
    }

    private static String lower(String word) {
        return word.toLowerCase(Locale.GERMAN);
    }
}

package de.uos.ikw.izpb.analysis;

import de.uos.ikw.izpb.lexicon.PrnTable;
import de.uos.ikw.izpb.lucene.TextTokenizer;
import de.uos.ikw.izpb.schemas.Author;
import de.uos.ikw.izpb.schemas.GenderLabel;
import de.uos.ikw.izpb.schemas.PrnEntry;
import de.uos.ikw.izpb.schemas.Resolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static de.uos.ikw.izpb.lookup.GenderLookup.normalize;

/**
 * Infers the gender of authors (AIG) from the knowledge base entry of their name and from the
 * pronouns and PRNs of their biographical note.
 */
public class AuthorGenderInference {
    private static final Logger logger = LoggerFactory.getLogger(AuthorGenderInference.class);

    private static final Set<String> FEMALE_PRONOUNS = Set.of("sie", "ihr", "ihre", "ihrer", "ihren", "ihrem", "ihres");
    private static final Set<String> MALE_PRONOUNS = Set.of("er", "sein", "seine", "seiner", "seinen", "seinem",
            "seines", "ihn", "ihm");

    /**
     * Signals and combined label of one author.
     */
    public record AuthorGender(Author author, GenderLabel knowledgeBase, GenderLabel pronouns, GenderLabel prns,
                               GenderLabel combined) {}

    private final PrnTable prnTable;
    private final TextTokenizer tokenizer = new TextTokenizer();

    public AuthorGenderInference(PrnTable prnTable) {
        this.prnTable = prnTable;
    }

    /**
     * @param authors     Authors to infer the gender of.
     * @param resolutions Knowledge base resolutions by normalized author name.
     */
    public List<AuthorGender> infer(Collection<Author> authors, Map<String, Resolution> resolutions) {
        List<AuthorGender> genders = new ArrayList<>(authors.size());
        for (Author author : authors) {
            Resolution resolution = resolutions.get(normalize(author.name()));
            GenderLabel knowledgeBase = resolution == null ? GenderLabel.UNDETERMINED : resolution.label();
            genders.add(infer(author, knowledgeBase));
        }
        return genders;
    }

    public AuthorGender infer(Author author, GenderLabel knowledgeBase) {
        GenderLabel pronouns = pronounSignal(author.info());
        GenderLabel prns = prnSignal(author.info());
        GenderLabel combined = combine(knowledgeBase, pronouns, prns);
        if (combined == GenderLabel.AMBIGUOUS) {
            logger.info("AIG conflict for {}: knowledge base {}, pronouns {}, PRNs {}", author.name(),
                    knowledgeBase.label(), pronouns.label(), prns.label());
        } else {
            logger.debug("AIG for {}: {}", author.name(), combined.label());
        }
        return new AuthorGender(author, knowledgeBase, pronouns, prns, combined);
    }

    GenderLabel pronounSignal(String info) {
        Set<GenderLabel> found = EnumSet.noneOf(GenderLabel.class);
        for (TextTokenizer.Token token : tokenizer.tokenize(info == null ? "" : info)) {
            String word = token.text().toLowerCase(Locale.GERMAN);
            if (FEMALE_PRONOUNS.contains(word)) {
                found.add(GenderLabel.FEMALE);
            } else if (MALE_PRONOUNS.contains(word)) {
                found.add(GenderLabel.MALE);
            }
        }
        return fromSignals(found);
    }

    GenderLabel prnSignal(String info) {
        Set<GenderLabel> found = EnumSet.noneOf(GenderLabel.class);
        for (TextTokenizer.Token token : tokenizer.tokenize(info == null ? "" : info)) {
            if (!token.isCapitalized()) {
                continue;
            }
            Optional<PrnEntry> entry = prnTable.match(token.text());
            if (entry.isPresent() && entry.get().gender().isBinary()) {
                found.add(entry.get().gender());
            }
        }
        return fromSignals(found);
    }

    /**
     * Combines the signals: undetermined signals (and an ambiguous knowledge base answer) carry
     * no information, agreeing signals give their label, conflicting signals give AMBIGUOUS.
     */
    static GenderLabel combine(GenderLabel knowledgeBase, GenderLabel pronouns, GenderLabel prns) {
        Set<GenderLabel> signals = EnumSet.noneOf(GenderLabel.class);
        if (knowledgeBase.isBinary()) {
            signals.add(knowledgeBase);
        }
        for (GenderLabel signal : List.of(pronouns, prns)) {
            if (signal != GenderLabel.UNDETERMINED) {
                signals.add(signal);
            }
        }
        return fromSignals(signals);
    }

    private static GenderLabel fromSignals(Set<GenderLabel> signals) {
        if (signals.isEmpty()) {
            return GenderLabel.UNDETERMINED;
        }
        if (signals.size() > 1) {
            return GenderLabel.AMBIGUOUS;
        }
        return signals.iterator().next();
    }
}

package de.uos.ikw.izpb.lexicon;

import de.uos.ikw.izpb.schemas.GenderLabel;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static de.uos.ikw.izpb.lexicon.DictionaryEntryParser.links;

/**
 * Ordered rules deciding whether a dictionary entry is a people-referencing noun and which
 * gendered forms it contributes. Rules are applied in declaration order; the first rule that
 * rejects or classifies an entry decides, entries no rule classifies are not PRNs.
 */
public enum PrnRule {

    GERMAN_COMMON_NOUN {
        @Override
        public Outcome apply(DictionaryEntry entry) {
            boolean accepted = "Deutsch".equals(entry.language())
                    && "Substantiv".equals(entry.mainPartOfSpeech())
                    && !entry.partsOfSpeech().contains("Nachname");
            return accepted ? Outcome.abstain() : Outcome.reject();
        }
    },

    NOT_AN_ANIMAL {
        @Override
        public Outcome apply(DictionaryEntry entry) {
            // hyponyms are only consulted for entries without hypernyms
            String related = entry.paragraph("Oberbegriffe");
            if (related == null) {
                related = entry.paragraph("Unterbegriffe");
            }
            if (related != null) {
                String lowered = related.toLowerCase(Locale.GERMAN);
                for (String keyword : ANIMAL_KEYWORDS) {
                    if (lowered.contains(keyword)) {
                        return Outcome.reject();
                    }
                }
            }
            return Outcome.abstain();
        }
    },

    HAS_FEMININE_FORMS {
        @Override
        public Outcome apply(DictionaryEntry entry) {
            String feminine = entry.paragraph("Weibliche Wortformen");
            if (feminine == null || entry.paragraph("Männliche Wortformen") != null) {
                return Outcome.abstain();
            }
            return Outcome.classify(headwordForms(entry, GenderLabel.MALE),
                    linkedForms(feminine, GenderLabel.FEMALE));
        }
    },

    HAS_MASCULINE_FORMS {
        @Override
        public Outcome apply(DictionaryEntry entry) {
            String masculine = entry.paragraph("Männliche Wortformen");
            if (masculine == null || entry.paragraph("Weibliche Wortformen") != null) {
                return Outcome.abstain();
            }
            return Outcome.classify(headwordForms(entry, GenderLabel.FEMALE),
                    linkedForms(masculine, GenderLabel.MALE));
        }
    },

    PERSON_DEFINITION {
        @Override
        public Outcome apply(DictionaryEntry entry) {
            String meanings = entry.paragraph("Bedeutungen");
            if (meanings == null) {
                return Outcome.abstain();
            }
            String lowered = meanings.toLowerCase(Locale.GERMAN);
            boolean female = FEMALE_DEFINITIONS.stream().anyMatch(lowered::contains);
            boolean male = MALE_DEFINITIONS.stream().anyMatch(lowered::contains);
            if (female == male) {
                return Outcome.abstain();
            }
            return Outcome.classify(headwordForms(entry, female ? GenderLabel.FEMALE : GenderLabel.MALE), List.of());
        }
    };

    static final List<String> ANIMAL_KEYWORDS = List.of("tier", "vogel", "stute", "hengst", "pferd", "fabelwesen");
    static final List<String> FEMALE_DEFINITIONS = List.of("weibliche person", "weiblicher mensch");
    static final List<String> MALE_DEFINITIONS = List.of("männliche person", "männlicher mensch");

    public abstract Outcome apply(DictionaryEntry entry);

    /**
     * Runs all rules in order.
     *
     * @return The classifying outcome, or a rejection when no rule classifies the entry.
     */
    public static Outcome classify(DictionaryEntry entry) {
        for (PrnRule rule : values()) {
            Outcome outcome = rule.apply(entry);
            if (outcome.verdict() != Verdict.ABSTAIN) {
                return outcome;
            }
        }
        return Outcome.reject();
    }

    /**
     * Noun forms are written with a capital letter; empty forms, lower-case words and suffixes ("-in") are not forms.
     */
    static boolean isForm(String form) {
        return form != null && !form.isEmpty() && Character.isUpperCase(form.codePointAt(0));
    }

    private static List<GenderedForm> headwordForms(DictionaryEntry entry, GenderLabel gender) {
        List<GenderedForm> forms = new ArrayList<>();
        if (isForm(entry.headword())) {
            forms.add(new GenderedForm(entry.headword(), gender, false));
        }
        for (String plural : entry.nominativePlurals()) {
            if (isForm(plural)) {
                forms.add(new GenderedForm(plural, gender, true));
            }
        }
        return forms;
    }

    private static List<GenderedForm> linkedForms(String paragraph, GenderLabel gender) {
        return links(paragraph).stream()
                .filter(PrnRule::isForm)
                .map(form -> new GenderedForm(form, gender, false))
                .toList();
    }

    public enum Verdict {
        REJECT,
        ABSTAIN,
        CLASSIFY
    }

    /**
     * Noun form with the gender it refers to. plural is set for inflection table forms.
     */
    public record GenderedForm(String form, GenderLabel gender, boolean plural) {}

    public record Outcome(Verdict verdict, List<GenderedForm> forms) {

        public Outcome {
            forms = List.copyOf(forms);
        }

        static Outcome reject() {
            return new Outcome(Verdict.REJECT, List.of());
        }

        static Outcome abstain() {
            return new Outcome(Verdict.ABSTAIN, List.of());
        }

        static Outcome classify(List<GenderedForm> headwordForms, List<GenderedForm> linkedForms) {
            List<GenderedForm> forms = new ArrayList<>(headwordForms);
            forms.addAll(linkedForms);
            return new Outcome(Verdict.CLASSIFY, forms);
        }
    }
}

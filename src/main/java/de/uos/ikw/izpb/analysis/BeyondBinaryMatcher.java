package de.uos.ikw.izpb.analysis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Finds writing forms that go beyond the female/male pair form ("Lehrerinnen und Lehrer").
 * Patterns are applied to each whitespace-delimited chunk of a paragraph.
 */
public class BeyondBinaryMatcher {

    public enum BeyondBinaryPattern {
        /* Forms covering women and men only: LehrerInnen, Lehrer/innen, Lehrer(in) */
        BINARY("binary", "[A-Z]\\S*((Innen|In|eR)|/-?(in|innen|r)|\\((in|innen|r)\\))(?!\\w)", false, false),
        /* Gender-inclusive forms: Lehrer*innen, Lehrer_innen, Lehrer:innen */
        GENDER_INCL("gender_incl", "[A-Z]\\S*(\\*|_|:)(innen|in|r)(?!\\w)", false, false),
        NEOPRONOUNS("neopronouns", "^((hän|hen|ham)|(they|them)|(dey|demm)|(sie?(\\*|_|:)?er)|xier)$", true, true),
        DIFFERENT_GENDER_CONCEPTIONS("different_gender_conceptions",
                "((trans\\*?-?(\\*|gender|geschlechtlich(keit)?|ident|sexuell|sexualität|(-| )?mann|(-| )?frau|(-| )?person)|\\btrans\\b)"
                        + "|(inter-?(\\*|geschlechtlich(keit)?|sex|sexuell|sexualität)|\\binter\\b)"
                        + "|(nicht-?binär|non-?binary|enby|gender-?fluid|poly-?gender)"
                        + "|(hetero-?normativität|hetero-?normativ|lgbtq?i?a?(2s)?\\+?|lsbtt?i?a?q?\\+|(gender.?)?queer))",
                true, false);

        private final String columnName;
        private final Pattern pattern;
        private final boolean lowerCase;
        private final boolean wholeWord;

        BeyondBinaryPattern(String columnName, String regex, boolean lowerCase, boolean wholeWord) {
            this.columnName = columnName;
            this.pattern = Pattern.compile(regex, Pattern.UNICODE_CHARACTER_CLASS);
            this.lowerCase = lowerCase;
            this.wholeWord = wholeWord;
        }

        public String columnName() {
            return columnName;
        }

        public boolean matches(String chunk) {
            String candidate = lowerCase ? chunk.toLowerCase(Locale.GERMAN) : chunk;
            if (wholeWord) {
                candidate = stripPunctuation(candidate);
            }
            return pattern.matcher(candidate).find();
        }
    }

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[.,;!?\"'„“”‚‘()\\[\\]]+|[.,;!?\"'„“”‚‘()\\[\\]]+$");

    /**
     * @return Matching chunks per pattern column name, every pattern present (possibly with no match).
     */
    public Map<String, List<String>> match(String paragraph) {
        Map<String, List<String>> matches = empty();
        for (String chunk : WHITESPACE.split(paragraph.strip())) {
            if (chunk.isEmpty()) {
                continue;
            }
            for (BeyondBinaryPattern pattern : BeyondBinaryPattern.values()) {
                if (pattern.matches(chunk)) {
                    matches.get(pattern.columnName()).add(chunk);
                }
            }
        }
        return matches;
    }

    public static Map<String, List<String>> empty() {
        Map<String, List<String>> matches = new LinkedHashMap<>();
        for (BeyondBinaryPattern pattern : BeyondBinaryPattern.values()) {
            matches.put(pattern.columnName(), new ArrayList<>());
        }
        return matches;
    }

    static String stripPunctuation(String chunk) {
        return EDGE_PUNCTUATION.matcher(chunk).replaceAll("");
    }
}

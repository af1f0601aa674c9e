package de.uos.ikw.izpb.analysis;

import java.text.Normalizer;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Removes artefacts of the scraped text that disturb tokenization and entity recognition:
 * en-dashes become hyphens, line breaks are dropped and slash forms ("Lehrer/innen",
 * "und/oder") lose the part after the slash.
 */
public class TextPreprocessor {
    private static final Pattern EN_DASHES = Pattern.compile("–+");
    private static final Pattern LINE_BREAKS = Pattern.compile("[\\r\\n]+");
    private static final Pattern SLASH_FORM = Pattern.compile(" ?/ ?(-?[A-Za-z]+)");
    private static final Pattern PAIR_SUFFIX = Pattern.compile("-?(in|innen|r)");

    /**
     * Normalized paragraph and the number of slash forms removed from it.
     * pairFormEnds holds the offsets (in text) where a word ends that lost a pair suffix
     * ("Lehrer/innen" leaves "Lehrer"); such a word refers to women and men alike.
     */
    public record Preprocessed(String text, int numSlashes, Set<Integer> pairFormEnds) {

        public boolean isPairFormEnd(int offset) {
            return pairFormEnds.contains(offset);
        }
    }

    public Preprocessed apply(String paragraph) {
        String text = Normalizer.normalize(paragraph, Normalizer.Form.NFC);
        text = EN_DASHES.matcher(text).replaceAll("-");
        text = LINE_BREAKS.matcher(text).replaceAll("");

        Matcher slashes = SLASH_FORM.matcher(text);
        StringBuilder stripped = new StringBuilder(text.length());
        Set<Integer> pairFormEnds = new TreeSet<>();
        int numSlashes = 0;
        while (slashes.find()) {
            numSlashes++;
            slashes.appendReplacement(stripped, "");
            boolean afterWord = slashes.start() > 0 && Character.isLetter(text.charAt(slashes.start() - 1));
            if (afterWord && PAIR_SUFFIX.matcher(slashes.group(1)).matches()) {
                pairFormEnds.add(stripped.length());
            }
        }
        slashes.appendTail(stripped);
        return new Preprocessed(stripped.toString(), numSlashes, Collections.unmodifiableSet(pairFormEnds));
    }
}

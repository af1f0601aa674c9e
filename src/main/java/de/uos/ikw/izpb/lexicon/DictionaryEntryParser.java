package de.uos.ikw.izpb.lexicon;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Minimal parser for the German Wiktionary page layout:
 * <pre>
 * == Lehrer ({{Sprache|Deutsch}}) ==
 * === {{Wortart|Substantiv|Deutsch}}, {{m}} ===
 * {{Deutsch Substantiv Übersicht
 * |Nominativ Plural=Lehrer
 * }}
 * {{Weibliche Wortformen}}
 * :[1] [[Lehrerin]]
 * </pre>
 */
public class DictionaryEntryParser {
    private static final Pattern LANGUAGE_HEADING = Pattern.compile("^==\\s*(.+?)\\s*\\(\\{\\{Sprache\\|([^}|]+)}}\\)\\s*==\\s*$");
    private static final Pattern POS_HEADING = Pattern.compile("^===([^=].*?)===\\s*$");
    private static final Pattern WORTART = Pattern.compile("\\{\\{Wortart\\|([^|}]+)");
    private static final Pattern PARAGRAPH_START = Pattern.compile("^\\{\\{([^|{}]+)}}\\s*$");
    private static final Pattern FLEXION_START = Pattern.compile("^\\{\\{Deutsch Substantiv Übersicht");
    private static final Pattern LINK = Pattern.compile("\\[\\[([^\\[\\]|#]+)(?:[|#][^\\[\\]]*)?]]");

    /**
     * Splits the wikitext of a page into its part-of-speech sections.
     *
     * @param wikitext Page source.
     * @return One entry per part-of-speech section of every language section, in page order.
     */
    public List<DictionaryEntry> parse(String wikitext) {
        List<DictionaryEntry> entries = new ArrayList<>();
        Builder current = null;
        String headword = null;
        String language = null;
        String paragraph = null;
        StringBuilder flexion = null;

        for (String rawLine : wikitext.split("\\r?\\n")) {
            String line = rawLine.strip();

            if (flexion != null) {
                flexion.append(line).append('\n');
                if (line.endsWith("}}")) {
                    current.flexion.putAll(parseTemplateArguments(flexion.toString()));
                    flexion = null;
                }
                continue;
            }

            Matcher languageMatcher = LANGUAGE_HEADING.matcher(line);
            if (languageMatcher.matches()) {
                addIfPresent(entries, current);
                current = null;
                paragraph = null;
                headword = languageMatcher.group(1);
                language = languageMatcher.group(2).strip();
                continue;
            }
            if (line.startsWith("==") && !line.startsWith("===")) {
                // other level-2 heading, the language section is over
                addIfPresent(entries, current);
                current = null;
                headword = null;
                paragraph = null;
                continue;
            }

            Matcher posMatcher = POS_HEADING.matcher(line);
            if (posMatcher.matches() && headword != null) {
                addIfPresent(entries, current);
                current = new Builder(headword, language);
                Matcher wortart = WORTART.matcher(posMatcher.group(1));
                while (wortart.find()) {
                    current.partsOfSpeech.add(wortart.group(1).strip());
                }
                paragraph = null;
                continue;
            }
            if (current == null) {
                continue;
            }
            if (line.startsWith("==")) {
                // translations and the like
                paragraph = null;
                continue;
            }
            if (FLEXION_START.matcher(line).find()) {
                paragraph = null;
                flexion = new StringBuilder(line).append('\n');
                if (line.endsWith("}}")) {
                    current.flexion.putAll(parseTemplateArguments(flexion.toString()));
                    flexion = null;
                }
                continue;
            }

            Matcher paragraphMatcher = PARAGRAPH_START.matcher(line);
            if (paragraphMatcher.matches()) {
                paragraph = paragraphMatcher.group(1).strip();
                current.paragraphs.putIfAbsent(paragraph, "");
                continue;
            }
            if (line.isEmpty()) {
                paragraph = null;
                continue;
            }
            if (paragraph != null) {
                String previous = current.paragraphs.get(paragraph);
                current.paragraphs.put(paragraph, previous.isEmpty() ? line : previous + "\n" + line);
            }
        }
        addIfPresent(entries, current);
        return entries;
    }

    /**
     * Targets of the wiki links of a text ("[[Lehrerin]]" -> "Lehrerin"), links into other namespaces excluded.
     */
    public static List<String> links(String text) {
        List<String> links = new ArrayList<>();
        if (text == null) {
            return links;
        }
        Matcher matcher = LINK.matcher(text);
        while (matcher.find()) {
            String target = matcher.group(1).strip();
            if (!target.contains(":")) {
                links.add(target);
            }
        }
        return links;
    }

    private static Map<String, String> parseTemplateArguments(String template) {
        Map<String, String> arguments = new LinkedHashMap<>();
        String body = template.strip();
        body = body.substring(2, body.length() - 2);
        for (String argument : body.split("\\|")) {
            int equals = argument.indexOf('=');
            if (equals <= 0) {
                continue;
            }
            String key = argument.substring(0, equals).strip();
            String value = argument.substring(equals + 1).strip();
            if (!value.isEmpty()) {
                arguments.put(key, value);
            }
        }
        return arguments;
    }

    private static void addIfPresent(List<DictionaryEntry> entries, Builder builder) {
        if (builder != null) {
            entries.add(builder.build());
        }
    }

    private static class Builder {
        private final String headword;
        private final String language;
        private final List<String> partsOfSpeech = new ArrayList<>();
        private final Map<String, String> paragraphs = new LinkedHashMap<>();
        private final Map<String, String> flexion = new LinkedHashMap<>();

        private Builder(String headword, String language) {
            this.headword = headword;
            this.language = language;
        }

        private DictionaryEntry build() {
            return new DictionaryEntry(headword, language, partsOfSpeech, paragraphs, flexion);
        }
    }
}

package de.uos.ikw.izpb.lexicon;

import java.util.List;
import java.util.Map;

/**
 * One part-of-speech section of a Wiktionary page.
 * headword [String]              : title of the language section (usually the page title).
 * language [String]              : language of the section, e.g. "Deutsch".
 * partsOfSpeech [List<String>]   : Wortart values of the section heading, main part of speech first.
 * paragraphs [Map<String,String>]: text of the named paragraphs ("Bedeutungen", "Weibliche Wortformen", ...).
 * flexion [Map<String,String>]   : inflection table values ("Nominativ Plural" -> "Lehrer").
 */
public record DictionaryEntry(String headword, String language, List<String> partsOfSpeech,
                              Map<String, String> paragraphs, Map<String, String> flexion) {

    public DictionaryEntry {
        partsOfSpeech = List.copyOf(partsOfSpeech);
        paragraphs = Map.copyOf(paragraphs);
        flexion = Map.copyOf(flexion);
    }

    public String mainPartOfSpeech() {
        return partsOfSpeech.isEmpty() ? "" : partsOfSpeech.get(0);
    }

    /**
     * @return Text of the paragraph, null when the section has no such paragraph or it is empty.
     */
    public String paragraph(String name) {
        String text = paragraphs.get(name);
        return text == null || text.isBlank() ? null : text;
    }

    public List<String> nominativePlurals() {
        return flexion.entrySet().stream()
                .filter(e -> e.getKey().startsWith("Nominativ Plural"))
                .map(Map.Entry::getValue)
                .sorted()
                .toList();
    }
}

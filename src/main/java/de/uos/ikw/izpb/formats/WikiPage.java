package de.uos.ikw.izpb.formats;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlText;

/**
 * Defines the <page> element of a MediaWiki XML dump. Only the title, the namespace and the
 * wikitext of the (single) exported revision are considered.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WikiPage(String title, int ns, Revision revision) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static record Revision(Text text) {}

    /**
     * <text bytes="..." xml:space="preserve">wikitext</text>
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Text {
        @JacksonXmlText
        public String value;

        public Text() {}

        public Text(String value) {
            this.value = value;
        }
    }

    public String wikitext() {
        if (revision == null || revision.text() == null || revision.text().value == null) {
            return "";
        }
        return revision.text().value;
    }
}

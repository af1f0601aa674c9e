package de.uos.ikw.izpb.schemas;

import java.util.List;

/**
 * Ingested article. paragraphs holds the title first, then headings and paragraphs in document order.
 */
public record Article(String id, String title, String volumeId, List<String> authorIds, List<String> paragraphs) {

    public Article {
        authorIds = List.copyOf(authorIds);
        paragraphs = List.copyOf(paragraphs);
    }

    public String text() {
        return String.join("\n", paragraphs);
    }
}

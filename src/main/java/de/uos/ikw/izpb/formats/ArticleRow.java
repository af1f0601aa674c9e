package de.uos.ikw.izpb.formats;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Defines the izpb-corpus_articles.csv structure written by the scraper.
 * For the analysis only the following fields are considered:
 * - uuid of the article, i.e. its identifier (also the name of its JSON file).
 * - title of the article.
 * - author_uuids, a list rendered as text ("['a', 'b']"), empty for articles without author.
 * - volume_uuid of the issue the article belongs to.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ArticleRow(
        String uuid,
        String title,
        @JsonProperty("author_uuids") String authorUuids,
        @JsonProperty("volume_uuid") String volumeUuid
) {}

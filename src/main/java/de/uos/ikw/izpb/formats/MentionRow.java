package de.uos.ikw.izpb.formats;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import de.uos.ikw.izpb.schemas.Mention;
import de.uos.ikw.izpb.schemas.Resolution;

/**
 * One line of the mentions table, the audit trail of every resolved mention.
 */
@JsonPropertyOrder({"article", "paragraph", "begin", "end", "kind", "surface", "lemma", "gender", "source",
        "confidence", "detail"})
public record MentionRow(
        String article,
        int paragraph,
        int begin,
        int end,
        String kind,
        String surface,
        String lemma,
        String gender,
        String source,
        double confidence,
        String detail
) {

    public static MentionRow of(Mention mention) {
        Resolution resolution = mention.resolution();
        return new MentionRow(mention.articleId(), mention.paragraph(), mention.begin(), mention.end(),
                mention.kind().name(), mention.surface(), mention.lemma(), mention.gender().label(),
                resolution == null ? "" : resolution.source().name(),
                resolution == null ? 0.0 : resolution.confidence(),
                resolution == null ? "" : resolution.detail());
    }
}

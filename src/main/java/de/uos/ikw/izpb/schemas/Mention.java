package de.uos.ikw.izpb.schemas;

import java.util.Objects;

/**
 * Occurrence of a person reference within an article.
 * Offsets refer to the normalized text of the paragraph the mention was found in.
 * Only the resolution is set after construction (by the gender resolver).
 */
public class Mention {
    private final String articleId;
    private final int paragraph;
    private final int begin;
    private final int end;
    private final String surface;
    private final String lemma;
    private final MentionKind kind;
    private Resolution resolution;

    public Mention(String articleId, int paragraph, int begin, int end, String surface, String lemma,
                   MentionKind kind) {
        this.articleId = Objects.requireNonNull(articleId);
        this.paragraph = paragraph;
        this.begin = begin;
        this.end = end;
        this.surface = surface;
        this.lemma = lemma;
        this.kind = kind;
    }

    public String articleId() {
        return articleId;
    }

    public int paragraph() {
        return paragraph;
    }

    public int begin() {
        return begin;
    }

    public int end() {
        return end;
    }

    public String surface() {
        return surface;
    }

    public String lemma() {
        return lemma;
    }

    public MentionKind kind() {
        return kind;
    }

    public Resolution resolution() {
        return resolution;
    }

    public void setResolution(Resolution resolution) {
        this.resolution = resolution;
    }

    /**
     * Gender label of the mention, UNDETERMINED while it has not been resolved.
     */
    public GenderLabel gender() {
        return resolution == null ? GenderLabel.UNDETERMINED : resolution.label();
    }

    public boolean overlaps(int otherBegin, int otherEnd) {
        return begin < otherEnd && otherBegin < end;
    }

    public String toString() {
        return kind + "[" + paragraph + ":" + begin + "-" + end + "] " + surface + " (" + gender().label() + ")";
    }
}

package de.uos.ikw.izpb.schemas;

/**
 * Author of one or more articles. info is the biographical note shown next to the article.
 */
public record Author(String id, String name, String info) {}

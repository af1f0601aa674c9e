package de.uos.ikw.izpb.schemas;

public enum Granularity {
    ARTICLE("articles"),
    VOLUME("volumes"),
    AUTHOR("authors");

    private final String tableName;

    Granularity(String tableName) {
        this.tableName = tableName;
    }

    public String tableName() {
        return tableName;
    }
}

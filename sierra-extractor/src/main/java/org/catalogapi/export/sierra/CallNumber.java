package org.catalogapi.export.sierra;

/**
 * A call number display string with the classification scheme it follows.
 */
public record CallNumber(String display, String type) {
    public static final String LC = "lc";
    public static final String DEWEY = "dewey";
    public static final String SUDOC = "sudoc";
    public static final String OTHER = "other";
}

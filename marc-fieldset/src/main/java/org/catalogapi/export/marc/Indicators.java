package org.catalogapi.export.marc;

/**
 * The two indicator positions of a variable field. Either may be absent (null).
 */
public record Indicators(Character first, Character second) {

    public static final Indicators NONE = new Indicators(null, null);

    public static Indicators of(char first, char second) {
        return new Indicators(first, second);
    }

    /**
     * @param num 1 or 2
     */
    public Character get(int num) {
        switch (num) {
            case 1:
                return first;
            case 2:
                return second;
            default:
                throw new IllegalArgumentException("Indicator number must be 1 or 2, got: " + num);
        }
    }

    public boolean isNone() {
        return first == null && second == null;
    }
}

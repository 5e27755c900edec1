package org.catalogapi.export.pipeline.ir;

/**
 * Stable identifier of a source record in an index, in the form
 * {@code "{prefix}.{resourceType}.{nativeId}"}.
 */
public record RecordIdentifier(String prefix, String resourceType, String nativeId) {

    public RecordIdentifier {
        requirePart(prefix, "prefix");
        requirePart(resourceType, "resourceType");
        if (nativeId == null || nativeId.isEmpty()) {
            throw new IllegalArgumentException("nativeId must not be empty");
        }
    }

    public static String qualified(String prefix, String resourceType, String nativeId) {
        return new RecordIdentifier(prefix, resourceType, nativeId).toString();
    }

    /**
     * Splits on the first two dots; the native id may itself contain dots.
     */
    public static RecordIdentifier parse(String qualified) {
        var parts = qualified.split("\\.", 3);
        if (parts.length != 3) {
            throw new IllegalArgumentException("Not a qualified record identifier: " + qualified);
        }
        return new RecordIdentifier(parts[0], parts[1], parts[2]);
    }

    private static void requirePart(String part, String name) {
        if (part == null || part.isEmpty() || part.contains(".")) {
            throw new IllegalArgumentException(name + " must be non-empty and contain no dots, got: " + part);
        }
    }

    @Override
    public String toString() {
        return prefix + "." + resourceType + "." + nativeId;
    }
}

package org.catalogapi.export.marc;

/**
 * Anything that filters can look at: a {@link Field} or a {@link Subfield}.
 */
public interface MarcElement {

    String getTag();

    /** The raw data payload, or null for variable fields, which carry subfields instead. */
    String getData();

    default boolean hasData() {
        return getData() != null;
    }
}

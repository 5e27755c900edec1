package org.catalogapi.export.marc;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * A tagged component of a variable field.
 *
 * Subfields are shared by reference between a field and any filtered views of it, so
 * {@link #setData(String)} is visible through every view holding this subfield.
 * Equality is identity.
 */
@Getter
@ToString
public class Subfield implements MarcElement {
    private final String tag;

    @Setter
    private String data;

    public Subfield(char tag, String data) {
        this(String.valueOf(tag), data);
    }

    public Subfield(String tag, String data) {
        if (tag == null || tag.length() != 1) {
            throw new IllegalArgumentException("Subfield tag must be a single character, got: " + tag);
        }
        this.tag = tag;
        this.data = data == null ? "" : data;
    }
}

package org.catalogapi.export.sierra;

import org.catalogapi.export.marc.Fieldset;

/**
 * A bib record's MARC fields (leader, control and variable fields, in that order) and its
 * fixed fields.
 */
public record ExtractedBib(Fieldset fieldset, FixedFieldMap fixedFields) {

    public String recordId() {
        return fixedFields.getString(BibExtractor.RECORD_ID);
    }
}

package org.catalogapi.export.sierra.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A Sierra variable-length field. MARC fields have a marc tag; Sierra-only fields (item
 * barcodes, notes) are identified by their one-character field type code.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VarFieldRow {
    /**
     * Sierra field group tag, e.g. 'b' for barcode or 'c' for call number
     */
    private String varfieldTypeCode;

    /**
     * Three-character MARC tag, blank or null for non-MARC fields
     */
    private String marcTag;

    private Character marcInd1;
    private Character marcInd2;
    private int occNum;

    /**
     * Field content with subfields delimited by '|', e.g. "|aStuff|bMore stuff"
     */
    private String fieldContent;
}

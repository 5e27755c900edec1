package org.catalogapi.export.sierra.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A MARC 00X control field as stored by Sierra.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ControlFieldRow {
    /**
     * The last digit of the MARC tag, e.g. 7 for 007
     */
    private int controlNum;

    private int occNum;

    /**
     * Raw field data
     */
    private String data;
}

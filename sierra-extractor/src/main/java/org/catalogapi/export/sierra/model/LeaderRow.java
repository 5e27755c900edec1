package org.catalogapi.export.sierra.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The coded leader values Sierra stores for a bib record. Each code is a single character.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaderRow {
    private String recordStatusCode;
    private String recordTypeCode;
    private String bibLevelCode;
    private String controlTypeCode;
    private String charEncodingSchemeCode;
    private String encodingLevelCode;
    private String descriptiveCatFormCode;
    private String multipartLevelCode;
}

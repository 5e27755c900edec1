package org.catalogapi.export.sierra.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A code with its display name, as Sierra stores locations, statuses, languages and other
 * lookup properties.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CodedProperty {
    private String code;
    private String name;

    public static CodedProperty of(String code, String name) {
        return new CodedProperty(code, name);
    }
}

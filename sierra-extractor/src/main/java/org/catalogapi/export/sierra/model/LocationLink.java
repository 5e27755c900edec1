package org.catalogapi.export.sierra.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Link from a bib to one of its locations. The location itself may be missing when the link
 * points at a location code that no longer exists.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LocationLink {
    private int displayOrder;
    private CodedProperty location;
}

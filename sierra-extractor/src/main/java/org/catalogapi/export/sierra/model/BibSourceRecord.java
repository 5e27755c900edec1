package org.catalogapi.export.sierra.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A Sierra bib record with its related rows already fetched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BibSourceRecord {

    private RecordMetadata metadata;

    private Instant catalogingDate;

    private CodedProperty bibLevel;

    private CodedProperty material;

    private CodedProperty language;

    private CodedProperty country;

    /**
     * BCODE3
     */
    private String suppressCode;

    private boolean suppressed;

    @Builder.Default
    private List<LocationLink> locations = new ArrayList<>();

    /**
     * Attached items, in the order Sierra lists them
     */
    @Builder.Default
    private List<ItemSourceRecord> items = new ArrayList<>();
}

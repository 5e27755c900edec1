package org.catalogapi.export.sierra.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Data Sierra keeps for every record regardless of type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordMetadata {

    /**
     * One-character record type: 'b' for bibs, 'i' for items
     */
    private String recordTypeCode;

    /**
     * The numeric part of the record number, without the check digit
     */
    private long recordNum;

    private Instant creationDate;
    private Instant lastUpdatedDate;

    /**
     * Set when the record has been deleted in Sierra
     */
    private Instant deletionDate;

    /**
     * Only bibs have a leader; may be absent even for those
     */
    private LeaderRow leader;

    @Builder.Default
    private List<ControlFieldRow> controlFields = new ArrayList<>();

    @Builder.Default
    private List<VarFieldRow> varFields = new ArrayList<>();
}

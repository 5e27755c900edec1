package org.catalogapi.export.sierra;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.catalogapi.export.marc.Field;
import org.catalogapi.export.marc.Fieldset;
import org.catalogapi.export.marc.Indicators;
import org.catalogapi.export.sierra.model.BibSourceRecord;
import org.catalogapi.export.sierra.model.CodedProperty;
import org.catalogapi.export.sierra.model.ControlFieldRow;
import org.catalogapi.export.sierra.model.LeaderRow;
import org.catalogapi.export.sierra.model.LocationLink;
import org.catalogapi.export.sierra.model.VarFieldRow;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns a Sierra bib record into a {@link Fieldset} (leader, control fields, variable fields)
 * and a {@link FixedFieldMap} of the bib's fixed fields.
 *
 * Stateless; one instance can be shared.
 */
@Slf4j
public class BibExtractor {
    public static final String RECORD_ID = "record_id";
    public static final String DATE_CATALOGED = "date_cataloged";
    public static final String DATE_CREATED = "date_created";
    public static final String DATE_LAST_UPDATED = "date_last_updated";
    public static final String BIB_TYPE_CODE = "bib_type_code";
    public static final String BIB_TYPE_NAME = "bib_type_name";
    public static final String MAT_TYPE_CODE = "mat_type_code";
    public static final String MAT_TYPE_NAME = "mat_type_name";
    public static final String LANGUAGE_CODE = "language_code";
    public static final String LANGUAGE_NAME = "language_name";
    public static final String SUPPRESS_CODE = "suppress_code";
    public static final String COUNTRY_CODE = "country_code";
    public static final String COUNTRY_NAME = "country_name";
    public static final String IS_SUPPRESSED = "is_suppressed";
    public static final String LOCATIONS = "locations";

    private static final String BLANK = " ";

    public ExtractedBib extract(BibSourceRecord bib) {
        if (bib == null || bib.getMetadata() == null) {
            throw new ExtractionException("Bib record has no record metadata");
        }
        var recordId = RecordNumbers.format(bib.getMetadata(), false);
        log.debug("Extracting bib {}", recordId);

        var fields = new ArrayList<Field>();
        fields.add(extractLeader(bib, recordId));
        fields.addAll(extractControlFields(bib.getMetadata().getControlFields()));
        fields.addAll(extractVarFields(bib.getMetadata().getVarFields(), recordId));
        return new ExtractedBib(new Fieldset(fields), extractFixedFields(bib, recordId));
    }

    /**
     * Builds the LDR field. A bib without a leader row still gets one, with blank codes except
     * for the bib level, which is taken from the bib's properties when known.
     */
    Field extractLeader(BibSourceRecord bib, String recordId) {
        var ldr = bib.getMetadata().getLeader();
        if (ldr == null) {
            log.warn("Bib {} has no leader; building one from fixed fields", recordId);
            var bibLevel = bib.getBibLevel() != null ? code(bib.getBibLevel().getCode()) : BLANK;
            ldr = LeaderRow.builder()
                .recordStatusCode(BLANK)
                .recordTypeCode(BLANK)
                .bibLevelCode(bibLevel)
                .controlTypeCode(BLANK)
                .charEncodingSchemeCode(BLANK)
                .encodingLevelCode(BLANK)
                .descriptiveCatFormCode(BLANK)
                .multipartLevelCode(BLANK)
                .build();
        }
        var data = "#####"
            + code(ldr.getRecordStatusCode())
            + code(ldr.getRecordTypeCode())
            + code(ldr.getBibLevelCode())
            + code(ldr.getControlTypeCode())
            + code(ldr.getCharEncodingSchemeCode())
            + "22#####"
            + code(ldr.getEncodingLevelCode())
            + code(ldr.getDescriptiveCatFormCode())
            + code(ldr.getMultipartLevelCode())
            + "4500";
        return Field.control(Field.LEADER_TAG, data, 0);
    }

    List<Field> extractControlFields(List<ControlFieldRow> rows) {
        var fields = new ArrayList<Field>();
        if (rows == null) {
            return fields;
        }
        for (var row : rows) {
            fields.add(Field.control("00" + row.getControlNum(), row.getData(), row.getOccNum()));
        }
        return fields;
    }

    List<Field> extractVarFields(List<VarFieldRow> rows, String recordId) {
        var fields = new ArrayList<Field>();
        if (rows == null) {
            return fields;
        }
        for (var row : rows) {
            var tag = row.getMarcTag();
            if (!isMarcTag(tag)) {
                log.atTrace().setMessage("Skipping non-MARC varfield type {} on bib {}")
                    .addArgument(row::getVarfieldTypeCode)
                    .addArgument(recordId)
                    .log();
                continue;
            }
            var content = row.getFieldContent() == null ? "" : row.getFieldContent();
            if (Integer.parseInt(tag) < 10) {
                fields.add(Field.control(tag, content, row.getOccNum()));
            } else {
                var indicators = new Indicators(row.getMarcInd1(), row.getMarcInd2());
                fields.add(Field.variable(tag, indicators, SierraContent.splitSubfields(content), row.getOccNum()));
            }
        }
        return fields;
    }

    FixedFieldMap extractFixedFields(BibSourceRecord bib, String recordId) {
        var metadata = bib.getMetadata();
        var bibLevel = required(bib.getBibLevel(), "bib level", recordId);
        var material = required(bib.getMaterial(), "material type", recordId);
        var language = required(bib.getLanguage(), "language", recordId);
        var country = required(bib.getCountry(), "country", recordId);

        return FixedFieldMap.builder()
            .put(RECORD_ID, recordId)
            .put(DATE_CATALOGED, bib.getCatalogingDate())
            .put(DATE_CREATED, metadata.getCreationDate())
            .put(DATE_LAST_UPDATED, metadata.getLastUpdatedDate())
            .put(BIB_TYPE_CODE, bibLevel.getCode())
            .put(BIB_TYPE_NAME, bibLevel.getName())
            .put(MAT_TYPE_CODE, material.getCode())
            .put(MAT_TYPE_NAME, material.getName())
            .put(LANGUAGE_CODE, language.getCode())
            .put(LANGUAGE_NAME, language.getName())
            .put(SUPPRESS_CODE, bib.getSuppressCode())
            .put(COUNTRY_CODE, country.getCode())
            .put(COUNTRY_NAME, country.getName())
            .put(IS_SUPPRESSED, bib.isSuppressed())
            .put(LOCATIONS, extractLocations(bib.getLocations(), recordId))
            .build();
    }

    private List<Map<String, String>> extractLocations(List<LocationLink> links, String recordId) {
        var locations = new ArrayList<Map<String, String>>();
        if (links == null) {
            return locations;
        }
        var ordered = new ArrayList<>(links);
        ordered.sort(Comparator.comparingInt(LocationLink::getDisplayOrder));
        for (var link : ordered) {
            var location = link.getLocation();
            if (location == null) {
                log.warn("Bib {} links to a location that does not exist; skipping it", recordId);
                continue;
            }
            var entry = new LinkedHashMap<String, String>();
            entry.put("code", location.getCode());
            entry.put("name", location.getName());
            locations.add(Collections.unmodifiableMap(entry));
        }
        return locations;
    }

    private static CodedProperty required(CodedProperty property, String what, String recordId) {
        if (property == null) {
            throw new ExtractionException("Bib " + recordId + " has no " + what);
        }
        return property;
    }

    private static boolean isMarcTag(String tag) {
        return tag != null && tag.length() == 3 && tag.chars().allMatch(Character::isDigit);
    }

    private static String code(String value) {
        return value == null || value.isEmpty() ? BLANK : value;
    }
}

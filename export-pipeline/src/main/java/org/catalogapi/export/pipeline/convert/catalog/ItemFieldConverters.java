package org.catalogapi.export.pipeline.convert.catalog;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.catalogapi.export.pipeline.convert.BibItemInput;
import org.catalogapi.export.pipeline.convert.ConverterTable;
import org.catalogapi.export.pipeline.convert.FieldConverter;
import org.catalogapi.export.sierra.FixedFieldMap;
import org.catalogapi.export.sierra.ItemExtractor;

/**
 * Item-level converters for the intermediate record. Each runs once per attached item.
 */
public final class ItemFieldConverters {
    public static final String RECORD_ID = "record_id";
    public static final String BARCODE = "barcode";
    public static final String LOCATION = "location";
    public static final String CALLNUMBER = "callnumber";
    public static final String VOLUME = "volume";
    public static final String STATUS = "status";
    public static final String PUBLIC_NOTES = "public_notes";

    private ItemFieldConverters() {}

    public static ConverterTable<BibItemInput> table() {
        return ConverterTable.<BibItemInput>builder()
            .put(RECORD_ID, FieldConverter.of(input -> input.item().getString(ItemExtractor.RECORD_ID)))
            .put(BARCODE, FieldConverter.of(input -> firstOf(input.item(), ItemExtractor.BARCODES)))
            .put(LOCATION, FieldConverter.of(ItemFieldConverters::location))
            .put(CALLNUMBER, FieldConverter.of(ItemFieldConverters::callNumber))
            .put(VOLUME, FieldConverter.of(input -> firstOf(input.item(), ItemExtractor.VOLUMES)))
            .put(STATUS, FieldConverter.of(ItemFieldConverters::status))
            .put(PUBLIC_NOTES, FieldConverter.of(input -> new ArrayList<>(input.item().<String>getList(ItemExtractor.PUBLIC_ITEM_NOTES))))
            .build();
    }

    static Map<String, Object> location(BibItemInput input) {
        var location = new LinkedHashMap<String, Object>();
        location.put("code", input.item().get(ItemExtractor.LOCATION_CODE));
        location.put("name", input.item().get(ItemExtractor.LOCATION_NAME));
        return location;
    }

    static Map<String, Object> callNumber(BibItemInput input) {
        var callNumber = new LinkedHashMap<String, Object>();
        callNumber.put("display", input.item().get(ItemExtractor.CALLNUMBER));
        callNumber.put("type", input.item().get(ItemExtractor.CALLNUMBER_TYPE));
        return callNumber;
    }

    static Map<String, Object> status(BibItemInput input) {
        var status = new LinkedHashMap<String, Object>();
        status.put("code", input.item().get(ItemExtractor.STATUS_CODE));
        status.put("name", input.item().get(ItemExtractor.STATUS_NAME));
        status.put("is_checked_out", input.item().get(ItemExtractor.DUE_DATE) != null);
        return status;
    }

    private static String firstOf(FixedFieldMap item, String key) {
        List<String> values = item.getList(key);
        return values.isEmpty() ? null : values.get(0);
    }
}

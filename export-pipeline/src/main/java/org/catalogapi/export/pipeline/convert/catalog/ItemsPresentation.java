package org.catalogapi.export.pipeline.convert.catalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.catalogapi.export.pipeline.ConversionException;
import org.catalogapi.export.pipeline.convert.ConvertedRecord;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Renders attached items as compact JSON for the index: the first {@link #PRIMARY_COUNT} go in
 * the primary list, the rest in the overflow list.
 */
public final class ItemsPresentation {
    public static final int PRIMARY_COUNT = 3;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"i", "b", "c", "l"})
    record ItemSummary(
        @JsonProperty("i") String id,
        @JsonProperty("b") String barcode,
        @JsonProperty("c") String callNumber,
        @JsonProperty("l") String locationCode
    ) {}

    private ItemsPresentation() {}

    public static List<String> primary(List<ConvertedRecord> items) {
        return render(items.subList(0, Math.min(PRIMARY_COUNT, items.size())));
    }

    /** Items after the first few; null when there are none. */
    public static List<String> overflow(List<ConvertedRecord> items) {
        if (items.size() <= PRIMARY_COUNT) {
            return null;
        }
        return render(items.subList(PRIMARY_COUNT, items.size()));
    }

    public static boolean hasOverflow(List<ConvertedRecord> items) {
        return items.size() > PRIMARY_COUNT;
    }

    private static List<String> render(List<ConvertedRecord> items) {
        var rendered = new ArrayList<String>(items.size());
        for (var item : items) {
            try {
                rendered.add(MAPPER.writeValueAsString(summarize(item)));
            } catch (JsonProcessingException e) {
                throw new ConversionException("Could not render item " + item.getString(ItemFieldConverters.RECORD_ID)
                    + " as JSON", e);
            }
        }
        return rendered;
    }

    static ItemSummary summarize(ConvertedRecord item) {
        return new ItemSummary(
            recordNumber(item.getString(ItemFieldConverters.RECORD_ID)),
            item.getString(ItemFieldConverters.BARCODE),
            part(item, ItemFieldConverters.CALLNUMBER, "display"),
            part(item, ItemFieldConverters.LOCATION, "code"));
    }

    /** Numeric portion of a III record number, e.g. "1000001" for "i1000001". */
    static String recordNumber(String recordId) {
        if (recordId == null) {
            return null;
        }
        int start = 0;
        while (start < recordId.length() && !Character.isDigit(recordId.charAt(start))) {
            start++;
        }
        return recordId.substring(start);
    }

    static String part(ConvertedRecord item, String name, String key) {
        var value = item.get(name);
        if (!(value instanceof Map)) {
            return null;
        }
        var part = ((Map<?, ?>) value).get(key);
        return part == null ? null : part.toString();
    }
}

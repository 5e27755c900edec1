package org.catalogapi.export.sierra;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.catalogapi.export.sierra.model.BibSourceRecord;
import org.catalogapi.export.sierra.model.CheckoutRow;
import org.catalogapi.export.sierra.model.CodedProperty;
import org.catalogapi.export.sierra.model.ItemSourceRecord;
import org.catalogapi.export.sierra.model.VarFieldRow;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns a Sierra item record into a flat {@link FixedFieldMap}: call number, current checkout,
 * fixed attributes and the Sierra-only varfields grouped by type.
 *
 * Every key is always present. Checkout keys are null when the item is not checked out and the
 * call number keys are null when neither the item nor its bib has one.
 */
@Slf4j
public class ItemExtractor {
    public static final String RECORD_ID = "record_id";
    public static final String CALLNUMBER = "callnumber";
    public static final String CALLNUMBER_TYPE = "callnumber_type";
    public static final String DUE_DATE = "due_date";
    public static final String LOCATION_CODE = "location_code";
    public static final String LOCATION_NAME = "location_name";
    public static final String STATUS_CODE = "status_code";
    public static final String STATUS_NAME = "status_name";
    public static final String BARCODES = "barcodes";
    public static final String VOLUMES = "volumes";
    public static final String PUBLIC_ITEM_NOTES = "public_item_notes";

    static final String NO_LOCATION_CODE = "none";
    static final String NO_LOCATION_NAME = "None";

    /** Sierra varfield type code to output key. */
    private static final Map<String, String> VARFIELD_GROUPS;
    static {
        var groups = new LinkedHashMap<String, String>();
        groups.put("b", BARCODES);
        groups.put("v", VOLUMES);
        groups.put("m", "messages");
        groups.put("x", "x_notes");
        groups.put("n", "n_notes");
        groups.put("p", PUBLIC_ITEM_NOTES);
        VARFIELD_GROUPS = groups;
    }

    public FixedFieldMap extract(ItemSourceRecord item) {
        return extract(item, null);
    }

    /**
     * @param owningBib bib to fall back on for the call number when the item has no linked bib
     *                  of its own; may be null
     */
    public FixedFieldMap extract(ItemSourceRecord item, BibSourceRecord owningBib) {
        if (item == null || item.getMetadata() == null) {
            throw new ExtractionException("Item record has no record metadata");
        }
        var recordId = RecordNumbers.format(item.getMetadata(), false);
        log.debug("Extracting item {}", recordId);

        var builder = FixedFieldMap.builder();
        putCheckout(builder, item.getCheckouts());
        putCallNumber(builder, item, owningBib);
        putFixedFields(builder, item, recordId);
        putVarFields(builder, item.getMetadata().getVarFields());
        return builder.build();
    }

    private void putCheckout(FixedFieldMap.Builder builder, List<CheckoutRow> checkouts) {
        var checkout = checkouts == null || checkouts.isEmpty() ? new CheckoutRow() : checkouts.get(0);
        builder.put(DUE_DATE, checkout.getDueDate())
            .put("checkout_date", checkout.getCheckoutDate())
            .put("overdue_date", checkout.getOverdueDate())
            .put("recall_date", checkout.getRecallDate())
            .put("loan_rule", checkout.getLoanRule())
            .put("renewal_count", checkout.getRenewalCount())
            .put("overdue_count", checkout.getOverdueCount());
    }

    private void putCallNumber(FixedFieldMap.Builder builder, ItemSourceRecord item, BibSourceRecord owningBib) {
        var callNumber = resolveCallNumber(item, owningBib);
        builder.put(CALLNUMBER, callNumber == null ? null : callNumber.display())
            .put(CALLNUMBER_TYPE, callNumber == null ? null : callNumber.type());
    }

    /**
     * The item's first call number, else the first one on its bib, else null.
     */
    CallNumber resolveCallNumber(ItemSourceRecord item, BibSourceRecord owningBib) {
        var itemCallNumbers = CallNumberResolver.callNumbers(item.getMetadata());
        if (!itemCallNumbers.isEmpty()) {
            return itemCallNumbers.get(0);
        }
        var bib = item.getLinkedBib() != null ? item.getLinkedBib() : owningBib;
        if (bib != null) {
            var bibCallNumbers = CallNumberResolver.callNumbers(bib.getMetadata());
            if (!bibCallNumbers.isEmpty()) {
                return bibCallNumbers.get(0);
            }
        }
        return null;
    }

    private void putFixedFields(FixedFieldMap.Builder builder, ItemSourceRecord item, String recordId) {
        var metadata = item.getMetadata();
        var location = item.getLocation();
        var status = required(item.getStatus(), "item status", recordId);
        var itype = required(item.getItype(), "itype", recordId);

        builder.put(RECORD_ID, recordId)
            .put("date_created", metadata.getCreationDate())
            .put("date_last_updated", metadata.getLastUpdatedDate())
            .put("copy_number", item.getCopyNumber())
            .put("last_checkin", item.getLastCheckin())
            .put(LOCATION_CODE, location == null ? NO_LOCATION_CODE : location.getCode())
            .put(LOCATION_NAME, location == null ? NO_LOCATION_NAME : location.getName())
            .put("gift_stats", item.getGiftStats())
            .put("suppress_code", item.getSuppressCode())
            .put("last_checkin_stat_group", item.getCheckinStatGroup())
            .put("last_checkout_stat_group", item.getCheckoutStatGroup())
            .put(STATUS_CODE, status.getCode())
            .put(STATUS_NAME, status.getName())
            .put("itype_code", itype.getCode())
            .put("itype_name", itype.getName())
            .put("price", item.getPrice())
            .put("checkout_total", item.getCheckoutTotal())
            .put("last_ytd_checkout_total", item.getLastYtdCheckoutTotal())
            .put("ytd_checkout_total", item.getYtdCheckoutTotal())
            .put("internal_use_count", item.getInternalUseCount())
            .put("copy_use_count", item.getCopyUseCount())
            .put("iuse3_count", item.getUse3Count())
            .put("imessage_code", item.getItemMessageCode())
            .put("opac_message_code", item.getOpacMessageCode());
    }

    private void putVarFields(FixedFieldMap.Builder builder, List<VarFieldRow> rows) {
        var ordered = rows == null ? new ArrayList<VarFieldRow>() : new ArrayList<>(rows);
        ordered.sort(Comparator.comparingInt(VarFieldRow::getOccNum));
        VARFIELD_GROUPS.forEach((typeCode, key) -> builder.put(key, ordered.stream()
            .filter(vf -> typeCode.equals(vf.getVarfieldTypeCode()))
            .map(VarFieldRow::getFieldContent)
            .collect(Collectors.toList())));
    }

    private static CodedProperty required(CodedProperty property, String what, String recordId) {
        if (property == null) {
            throw new ExtractionException("Item " + recordId + " has no " + what);
        }
        return property;
    }
}

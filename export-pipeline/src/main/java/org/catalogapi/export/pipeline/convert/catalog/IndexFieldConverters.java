package org.catalogapi.export.pipeline.convert.catalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.catalogapi.export.pipeline.convert.BibToIntermediateConverter;
import org.catalogapi.export.pipeline.convert.ConvertedRecord;
import org.catalogapi.export.pipeline.convert.ConverterTable;
import org.catalogapi.export.pipeline.convert.FieldConverter;
import org.catalogapi.export.pipeline.convert.ParserSet;
import org.catalogapi.export.pipeline.ir.PersonName;

/**
 * Converters from an intermediate record to an index document. Author-derived fields fall back
 * to empty values when the record has no personal author.
 */
public final class IndexFieldConverters {
    public static final String ID = "id";
    public static final String AUTHOR_SEARCH_FULLNAME_FORMS = "person_author_search_fullname_forms";
    public static final String AUTHOR_SEARCH_BESTNAME = "person_author_search_bestname";
    public static final String AUTHOR_DISPLAY = "person_author_display";
    public static final String AUTHOR_FACET = "person_author_facet";
    public static final String CALLNUMBERS_DISPLAY = "callnumbers_display";
    public static final String CALLNUMBERS_NORMALIZED = "callnumbers_normalized";
    public static final String ITEMS_JSON = "items_json";
    public static final String MORE_ITEMS_JSON = "more_items_json";
    public static final String HAS_MORE_ITEMS = "has_more_items";

    private IndexFieldConverters() {}

    public static ConverterTable<ConvertedRecord> table() {
        return ConverterTable.<ConvertedRecord>builder()
            .put(ID, FieldConverter.of(record -> record.getString(BibFieldConverters.RECORD_ID)))
            .put(AUTHOR_SEARCH_FULLNAME_FORMS, IndexFieldConverters::authorSearchForms)
            .put(AUTHOR_SEARCH_BESTNAME, FieldConverter.of(IndexFieldConverters::authorBestName))
            .put(AUTHOR_DISPLAY, IndexFieldConverters::authorDisplay)
            .put(AUTHOR_FACET, IndexFieldConverters::authorFacet)
            .put(CALLNUMBERS_DISPLAY, FieldConverter.of(IndexFieldConverters::callNumbersDisplay))
            .put(CALLNUMBERS_NORMALIZED, IndexFieldConverters::callNumbersNormalized)
            .put(ITEMS_JSON, FieldConverter.of(record -> ItemsPresentation.primary(items(record))))
            .put(MORE_ITEMS_JSON, FieldConverter.of(record -> ItemsPresentation.overflow(items(record))))
            .put(HAS_MORE_ITEMS, FieldConverter.of(record -> ItemsPresentation.hasOverflow(items(record))))
            .build();
    }

    /** Straight, inverted and full forms, without duplicates. */
    static List<String> authorSearchForms(ConvertedRecord record, ParserSet parsers) {
        var author = author(record);
        var forms = new ArrayList<String>();
        if (author == null) {
            return forms;
        }
        var names = parsers.personNames();
        for (var form : List.of(names.nameStraight(author), names.nameInverted(author), names.fullName(author))) {
            if (!form.isEmpty() && !forms.contains(form)) {
                forms.add(form);
            }
        }
        return forms;
    }

    /** The surname when there is one, otherwise the forename followed by any titles. */
    static String authorBestName(ConvertedRecord record) {
        var author = author(record);
        if (author == null) {
            return "";
        }
        if (!author.getSurname().isEmpty()) {
            return author.getSurname();
        }
        var parts = new ArrayList<String>();
        parts.add(author.getForename());
        parts.addAll(author.getTitles());
        return String.join(" ", parts).strip();
    }

    static String authorDisplay(ConvertedRecord record, ParserSet parsers) {
        var author = author(record);
        return author == null ? "" : parsers.personNames().fullName(author);
    }

    /** "Surname, Forename (dates)". */
    static String authorFacet(ConvertedRecord record, ParserSet parsers) {
        var author = author(record);
        if (author == null) {
            return "";
        }
        var facet = parsers.personNames().nameInverted(author);
        if (!author.getFullDates().isEmpty()) {
            facet = facet + " (" + author.getFullDates() + ")";
        }
        return facet;
    }

    /** One display call number per item, in item order; "" for an item without one. */
    static List<String> callNumbersDisplay(ConvertedRecord record) {
        var displays = new ArrayList<String>();
        for (var item : items(record)) {
            displays.add(Objects.requireNonNullElse(ItemsPresentation.part(item, ItemFieldConverters.CALLNUMBER, "display"), ""));
        }
        return displays;
    }

    static List<String> callNumbersNormalized(ConvertedRecord record, ParserSet parsers) {
        var normalized = new ArrayList<String>();
        for (var item : items(record)) {
            var display = ItemsPresentation.part(item, ItemFieldConverters.CALLNUMBER, "display");
            var type = ItemsPresentation.part(item, ItemFieldConverters.CALLNUMBER, "type");
            normalized.add(parsers.callNumbers().forSort(display, type));
        }
        return normalized;
    }

    private static PersonName author(ConvertedRecord record) {
        return record.get(BibFieldConverters.PERSON_AUTHOR, PersonName.class);
    }

    private static List<ConvertedRecord> items(ConvertedRecord record) {
        return record.getList(BibToIntermediateConverter.ITEMS);
    }
}

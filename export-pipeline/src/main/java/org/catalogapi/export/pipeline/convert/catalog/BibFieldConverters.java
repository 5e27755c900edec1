package org.catalogapi.export.pipeline.convert.catalog;

import java.util.List;
import java.util.stream.Collectors;

import org.catalogapi.export.marc.MarcFilters;
import org.catalogapi.export.pipeline.convert.BibInput;
import org.catalogapi.export.pipeline.convert.ConverterTable;
import org.catalogapi.export.pipeline.convert.FieldConverter;
import org.catalogapi.export.pipeline.convert.ParserSet;
import org.catalogapi.export.pipeline.ir.PersonName;

/**
 * Bib-level converters for the intermediate record.
 */
public final class BibFieldConverters {
    public static final String RECORD_ID = "record_id";
    public static final String PERSON_AUTHOR = "person_author";
    public static final String CONTRIBUTORS = "contributors";

    static final String MAIN_PERSONAL_NAME_TAG = "100";
    static final String ADDED_PERSONAL_NAME_TAG = "700";

    private BibFieldConverters() {}

    public static ConverterTable<BibInput> table() {
        return ConverterTable.<BibInput>builder()
            .put(RECORD_ID, FieldConverter.of(input -> input.bib().recordId()))
            .put(PERSON_AUTHOR, BibFieldConverters::personAuthor)
            .put(CONTRIBUTORS, BibFieldConverters::contributors)
            .build();
    }

    /**
     * The first 100 field, parsed. Null when the bib has no personal author.
     */
    static PersonName personAuthor(BibInput input, ParserSet parsers) {
        return input.bib().fieldset()
            .fieldsWhere(MarcFilters.tagEquals(MAIN_PERSONAL_NAME_TAG))
            .first()
            .map(field -> parsers.personNames().parse(field))
            .orElse(null);
    }

    static List<PersonName> contributors(BibInput input, ParserSet parsers) {
        return input.bib().fieldset()
            .fieldsWhere(MarcFilters.tagEquals(ADDED_PERSONAL_NAME_TAG))
            .stream()
            .map(field -> parsers.personNames().parse(field))
            .collect(Collectors.toList());
    }
}

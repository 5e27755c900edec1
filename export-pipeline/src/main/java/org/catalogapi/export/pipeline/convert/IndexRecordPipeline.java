package org.catalogapi.export.pipeline.convert;

import org.catalogapi.export.pipeline.ConversionException;
import org.catalogapi.export.pipeline.convert.catalog.BibFieldConverters;
import org.catalogapi.export.pipeline.convert.catalog.IndexFieldConverters;
import org.catalogapi.export.pipeline.convert.catalog.ItemFieldConverters;
import org.catalogapi.export.sierra.BibExtractor;
import org.catalogapi.export.sierra.ItemExtractor;
import org.catalogapi.export.sierra.RecordNumbers;
import org.catalogapi.export.sierra.model.BibSourceRecord;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Both conversion stages for one bib. A record that fails the intermediate stage never reaches
 * the index stage; either failure surfaces as a {@link ConversionException} naming the record
 * and the stage.
 */
@Slf4j
@RequiredArgsConstructor
public class IndexRecordPipeline {
    public static final String INTERMEDIATE_STAGE = "intermediate";
    public static final String INDEX_STAGE = "index";

    private final BibToIntermediateConverter intermediateConverter;
    private final IntermediateToIndexConverter indexConverter;

    /**
     * The catalog tables with the default parsers. Every call builds fresh tables.
     */
    public static IndexRecordPipeline defaults() {
        var parsers = ParserSet.defaults();
        var intermediate = new BibToIntermediateConverter(
            new BibExtractor(),
            new ItemExtractor(),
            new RecordConverter<>(BibFieldConverters.table(), parsers),
            new RecordConverter<>(ItemFieldConverters.table(), parsers));
        var index = new IntermediateToIndexConverter(new RecordConverter<>(IndexFieldConverters.table(), parsers));
        return new IndexRecordPipeline(intermediate, index);
    }

    public ConvertedRecord convert(BibSourceRecord bib) {
        var recordId = identify(bib);
        ConvertedRecord intermediate;
        try {
            intermediate = intermediateConverter.convert(bib);
        } catch (RuntimeException e) {
            throw new ConversionException(recordId, INTERMEDIATE_STAGE, e.getMessage(), e);
        }
        log.trace("Intermediate record for {}: {}", recordId, intermediate);
        try {
            return indexConverter.convert(intermediate);
        } catch (RuntimeException e) {
            throw new ConversionException(recordId, INDEX_STAGE, e.getMessage(), e);
        }
    }

    /** III record number of the bib, or "unknown" when the bib has no metadata. */
    public static String identify(BibSourceRecord bib) {
        if (bib == null || bib.getMetadata() == null) {
            return "unknown";
        }
        return RecordNumbers.format(bib.getMetadata(), false);
    }
}

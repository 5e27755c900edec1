package org.catalogapi.export.pipeline.convert;

import lombok.RequiredArgsConstructor;

/**
 * Stage two: one completed intermediate record becomes one index document.
 */
@RequiredArgsConstructor
public class IntermediateToIndexConverter {
    private final RecordConverter<ConvertedRecord> indexConverter;

    public ConvertedRecord convert(ConvertedRecord intermediate) {
        return indexConverter.convert(intermediate);
    }
}

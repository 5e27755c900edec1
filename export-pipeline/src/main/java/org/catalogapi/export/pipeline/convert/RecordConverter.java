package org.catalogapi.export.pipeline.convert;

import java.util.LinkedHashMap;

import org.catalogapi.export.pipeline.ConversionException;

import lombok.Getter;

/**
 * Applies every converter in a {@link ConverterTable} to the same input.
 *
 * The table and parsers are fixed at construction and only read afterwards, so one instance can
 * serve concurrent conversions.
 */
public class RecordConverter<I> {
    @Getter
    private final ConverterTable<I> table;
    private final ParserSet parsers;

    public RecordConverter(ConverterTable<I> table, ParserSet parsers) {
        this.table = table;
        this.parsers = parsers;
    }

    public ConvertedRecord convert(I input) {
        var output = new LinkedHashMap<String, Object>();
        for (var entry : table.asMap().entrySet()) {
            try {
                output.put(entry.getKey(), entry.getValue().convert(input, parsers));
            } catch (ConversionException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ConversionException("Converter for '" + entry.getKey() + "' failed: " + e.getMessage(), e);
            }
        }
        return new ConvertedRecord(output);
    }
}

package org.catalogapi.export.pipeline.convert;

import org.catalogapi.export.pipeline.convert.parsers.CallNumberNormalizer;
import org.catalogapi.export.pipeline.convert.parsers.PersonNameParser;

/**
 * The parsers a {@link FieldConverter} may use. Built once with its converter table and shared
 * read-only by every conversion; string utilities live in
 * {@link org.catalogapi.export.pipeline.convert.parsers.TextParsers}.
 */
public record ParserSet(PersonNameParser personNames, CallNumberNormalizer callNumbers) {

    public static ParserSet defaults() {
        return new ParserSet(new PersonNameParser(), new CallNumberNormalizer());
    }
}

package org.catalogapi.export.pipeline.convert;

import java.util.function.Function;

/**
 * Computes one output field from the whole input record. A converter only sees its input, never
 * what other converters in the same table produced.
 */
@FunctionalInterface
public interface FieldConverter<I> {

    Object convert(I input, ParserSet parsers);

    /** Adapts a converter that needs no parsers. */
    static <I> FieldConverter<I> of(Function<? super I, ?> function) {
        return (input, parsers) -> function.apply(input);
    }
}

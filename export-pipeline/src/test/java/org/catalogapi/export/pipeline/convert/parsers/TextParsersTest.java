package org.catalogapi.export.pipeline.convert.parsers;

import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TextParsersTest {

    static Stream<Arguments> commaInMiddle() {
        return Stream.of(
            Arguments.of("First, Last", true),
            Arguments.of("First,Last", true),
            Arguments.of("First,Last,", true),
            Arguments.of("First, Last, Something Else", true),
            Arguments.of(", Last, First", true),
            Arguments.of("First,", false),
            Arguments.of("First", false),
            Arguments.of("First Last", false),
            Arguments.of("First, ", false),
            Arguments.of(", Last", false),
            Arguments.of(",Last", false)
        );
    }

    @ParameterizedTest
    @MethodSource("commaInMiddle")
    void hasCommaInMiddle(String data, boolean expected) {
        assertEquals(expected, TextParsers.hasCommaInMiddle(data));
    }

    @Test
    void normalizeWhitespaceTrimsAndCollapses() {
        assertEquals("test data", TextParsers.normalizeWhitespace(" test data"));
        assertEquals("test data", TextParsers.normalizeWhitespace("test  data "));
        assertEquals("test data test", TextParsers.normalizeWhitespace(" test data  test  "));
    }

    static Stream<Arguments> punctuation() {
        return Stream.of(
            Arguments.of("test : data", "test: data"),
            Arguments.of("test / data", "test / data"),
            Arguments.of("test : data / data", "test: data / data"),
            Arguments.of("test . ; : data / data", "test: data / data"),
            Arguments.of("test .;: data / data", "test: data / data"),
            Arguments.of("test . ; : / data / data", "test / data / data"),
            Arguments.of(".:;test / data", ";test / data"),
            Arguments.of("test / data.:;", "test / data;")
        );
    }

    @ParameterizedTest
    @MethodSource("punctuation")
    void normalizePunctuation(String data, String expected) {
        assertEquals(expected, TextParsers.normalizePunctuation(data));
    }

    static Stream<Arguments> brackets() {
        return Stream.of(
            Arguments.of("Test data [inner]", true, null, null, null, "Test data inner"),
            Arguments.of("Test data-[inner]", true, null, null, null, "Test data-inner"),
            Arguments.of("Test data[inner]", true, null, null, null, "Test datainner"),
            Arguments.of("[First] test [Middle] data [Last]", true, null, null, null, "First test Middle data Last"),
            Arguments.of("Test data [inner]", true, null, "inner", null, "Test data"),
            Arguments.of("Test data-[inner]", true, null, "inner", null, "Test data-"),
            Arguments.of("[Inner] test data", true, null, "Inner", null, "test data"),
            Arguments.of("[First] test [Middle] [Middle] data [Last]", true, null, "(Middle|Last)", null, "First test data"),
            Arguments.of("Test data [inner]", false, null, null, null, "Test data"),
            Arguments.of("[First] test [Middle] data [Last]", false, null, null, null, "test data"),
            Arguments.of("Test data[inner]", false, "inner", null, null, "Test datainner"),
            Arguments.of("[First] test [Middle] [Middle] data [Last]", false, "(Middle|Last)", null, null,
                "test Middle Middle data Last"),
            Arguments.of("Test data-[inner]", true, null, null, "inner", "Test data-[inner]"),
            Arguments.of("[First] test [Middle] data [Last]", true, null, null, "(Middle|Last)",
                "First test [Middle] data [Last]")
        );
    }

    @ParameterizedTest
    @MethodSource("brackets")
    void stripBrackets(String data, boolean keepInner, String toKeep, String toRemove, String toProtect,
                       String expected) {
        assertEquals(expected, TextParsers.stripBrackets(data, keepInner, toKeep, toRemove, toProtect));
    }

    static Stream<Arguments> periods() {
        return Stream.of(
            Arguments.of("No periods, no changes", "No periods, no changes"),
            Arguments.of("Remove ending period.", "Remove ending period"),
            Arguments.of("Remove ending period from numeric ordinal 1.", "Remove ending period from numeric ordinal 1"),
            Arguments.of("Remove ending period from alphabetic ordinal 21st.", "Remove ending period from alphabetic ordinal 21st"),
            Arguments.of("Remove ending period from Roman Numeral XII.", "Remove ending period from Roman Numeral XII"),
            Arguments.of("Protect ending period from abbreviation eds.", "Protect ending period from abbreviation eds."),
            Arguments.of("Protect ending period from initial J.", "Protect ending period from initial J."),
            Arguments.of("Lowercase initials do not count, j.", "Lowercase initials do not count, j"),
            Arguments.of("Remove inner period. Dude", "Remove inner period Dude"),
            Arguments.of("Protect period inside a word, like 1.1", "Protect period inside a word, like 1.1"),
            Arguments.of("Protect inner period from numeric ordinal 1. Dude", "Protect inner period from numeric ordinal 1. Dude"),
            Arguments.of("Protect inner period from alphabetic ordinal 21st. Dude", "Protect inner period from alphabetic ordinal 21st. Dude"),
            Arguments.of("Protect inner period from Roman Numeral XII. Dude", "Protect inner period from Roman Numeral XII. Dude"),
            Arguments.of("Protect inner period from abbreviation eds. Dude", "Protect inner period from abbreviation eds. Dude"),
            Arguments.of("Protect inner period from inital J. Dude", "Protect inner period from inital J. Dude"),
            Arguments.of("J.R.R. Tolkien", "J.R.R. Tolkien"),
            Arguments.of("Tolkien, J.R.R.", "Tolkien, J.R.R."),
            Arguments.of("Tolkien, J.R.R..", "Tolkien, J.R.R.")
        );
    }

    @ParameterizedTest
    @MethodSource("periods")
    void protectPeriodsHidesNonStructuralPeriods(String data, String expected) {
        assertEquals(expected, TextParsers.protectPeriodsAndDo(data, s -> s.replace(".", "")));
    }

    static Stream<Arguments> ends() {
        return Stream.of(
            Arguments.of("do not strip inner whitespace", "do not strip inner whitespace"),
            Arguments.of("do not strip, inner punctuation", "do not strip, inner punctuation"),
            Arguments.of(" strip whitespace ", "strip whitespace"),
            Arguments.of("strip repeated punctuation marks at end...", "strip repeated punctuation marks at end"),
            Arguments.of("strip multiple different punctuation marks at end./", "strip multiple different punctuation marks at end"),
            Arguments.of("strip w then p then w : ", "strip w then p then w"),
            Arguments.of("(strip full parens)", "strip full parens"),
            Arguments.of("(strip full parens with punctuation after).", "strip full parens with punctuation after"),
            Arguments.of("(strip full parens with punctuation before.)", "strip full parens with punctuation before"),
            Arguments.of("(strip full parens with punctuation before and after.) :", "strip full parens with punctuation before and after"),
            Arguments.of("do not strip (partial parens)", "do not strip (partial parens)"),
            Arguments.of("do not strip (partial parens) :", "do not strip (partial parens)")
        );
    }

    @ParameterizedTest
    @MethodSource("ends")
    void stripEnds(String data, String expected) {
        assertEquals(expected, TextParsers.stripEnds(data));
    }

    static Stream<Arguments> ellipses() {
        return Stream.of(
            Arguments.of("...", ""),
            Arguments.of("something..", "something.."),
            Arguments.of("A big ... something", "A big something"),
            Arguments.of("A big...something", "A big something"),
            Arguments.of("A big something. ...", "A big something."),
            Arguments.of("A big something ... .", "A big something."),
            Arguments.of("A big something ....", "A big something."),
            Arguments.of("...something", "something"),
            Arguments.of("A big ... something...", "A big something")
        );
    }

    @ParameterizedTest
    @MethodSource("ellipses")
    void stripEllipses(String data, String expected) {
        assertEquals(expected, TextParsers.stripEllipses(data));
    }

    @Test
    void cleanAppliesEveryStep() {
        assertEquals("This is an example of a title: subtitle / ed. by John Doe",
            TextParsers.clean("This is an example of a title : subtitle / ed. by John Doe."));
        assertEquals("Some test data that we have (whatever whatever)",
            TextParsers.clean("Some test data ... that we have (whatever [whatever])."));
    }
}

package org.catalogapi.export.pipeline.convert.parsers;

import java.util.List;
import java.util.stream.Stream;

import org.catalogapi.export.marc.MarcNotation;
import org.catalogapi.export.pipeline.ir.PersonName;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class PersonNameParserTest {

    private final PersonNameParser parser = new PersonNameParser();

    static Stream<Arguments> names() {
        return Stream.of(
            Arguments.of("100 0#$aThomale, Jason,$d1979-", "Jason", "Thomale", ""),
            Arguments.of("100 1#$aThomale, Jason,$d1979-", "Jason", "Thomale", ""),
            Arguments.of("100 3#$aThomale, Jason,$d1979-", "Jason", "Thomale", ""),
            Arguments.of("100 0#$aJohn,$cthe Baptist, Saint.", "John", "", ""),
            Arguments.of("100 0#$aJohn$bII Comnenus,$cEmperor of the East,$d1088-1143.", "John II Comnenus", "", ""),
            Arguments.of("100 1#$aByron, George Gordon Byron,$cBaron,$d1788-1824.", "George Gordon Byron", "Byron", ""),
            Arguments.of("100 1#$aJoannes Aegidius, Zamorensis,$d1240 or 41-ca. 1316.", "Zamorensis", "Joannes Aegidius", ""),
            Arguments.of("600 30$aMorton family.", "", "Morton", "Morton family"),
            Arguments.of("600 20$aMorton family.", "", "Morton", "Morton family")
        );
    }

    @ParameterizedTest
    @MethodSource("names")
    void personName(String line, String forename, String surname, String familyName) {
        var name = parser.personName(MarcNotation.parseField(line));
        assertEquals(forename, name.getForename());
        assertEquals(surname, name.getSurname());
        assertEquals(familyName, name.getFamilyName());
    }

    static Stream<Arguments> titles() {
        return Stream.of(
            Arguments.of("100 0#$aJohn Paul$bII,$cPope,$d1920-", List.of("Pope")),
            Arguments.of("100 0#$aJohn$bII Comnenus,$cEmperor of the East,$d1088-1143.", List.of("Emperor of the East")),
            Arguments.of("100 0#$aJohn,$cthe Baptist, Saint.", List.of("the Baptist", "Saint")),
            Arguments.of("100 0#$aJohn,$cthe Baptist,$cSaint.", List.of("the Baptist", "Saint")),
            Arguments.of("100 1#$aWard, Humphrey,$cMrs.,$d1851-1920.", List.of("Mrs."))
        );
    }

    @ParameterizedTest
    @MethodSource("titles")
    void personTitles(String line, List<String> expected) {
        assertEquals(expected, parser.personTitles(MarcNotation.parseField(line)));
    }

    static Stream<Arguments> dates() {
        return Stream.of(
            Arguments.of("100 1#$aRodgers, Martha Lucile,$d1947-", 1947, "", null, "", PersonName.DATES_LIVED, "1947-"),
            Arguments.of("100 1#$aLuckombe, Philip,$dd. 1803.", null, "", 1803, "", PersonName.DATES_LIVED, "d. 1803"),
            Arguments.of("100 1#$aMalalas, John,$dca. 491-ca. 578.", 491, PersonName.CIRCA, 578, PersonName.CIRCA,
                PersonName.DATES_LIVED, "ca. 491-ca. 578"),
            Arguments.of("100 1#$aLevi, James,$dfl. 1706-1739.", 1706, "", 1739, "", PersonName.DATES_FLOURISHED,
                "fl. 1706-1739"),
            Arguments.of("100 1#$aJoannes Aegidius, Zamorensis,$d1240 or 41-ca. 1316.", 1240, PersonName.UNSURE, 1316,
                PersonName.CIRCA, PersonName.DATES_LIVED, "1240 or 41-ca. 1316"),
            Arguments.of("100 0#$aJoannes,$cActuarius,$d13th/14th cent.", 1200, "", 1399, "",
                PersonName.APPROXIMATE_CENTURIES, "13th/14th cent."),
            Arguments.of("100 0#$aTest,$cTest,$d14th/13th cent. BCE", -1400, "", -1301, "",
                PersonName.APPROXIMATE_CENTURIES, "14th/13th cent. BCE"),
            Arguments.of("100 0#$aPiri Reis,$dd. 1554?", null, "", 1554, PersonName.UNSURE, PersonName.DATES_LIVED,
                "d. 1554?"),
            Arguments.of("800 1#$aDangerfield, Rodney,$d1921-", 1921, "", null, "", PersonName.DATES_LIVED, "1921-"),
            Arguments.of("100 1#$aSmith, John,$d1882 Aug. 5-", 1882, "", null, "", PersonName.DATES_LIVED, "1882 Aug. 5-"),
            Arguments.of("100 1#$aSmith, John,$dsomething weird!", null, "", null, "", PersonName.UNKNOWN_DATE_TYPES,
                "something weird!")
        );
    }

    @ParameterizedTest
    @MethodSource("dates")
    void personDates(String line, Integer start, String startQualifier, Integer end, String endQualifier,
                     String dateType, String fullDates) {
        var dates = parser.personDates(MarcNotation.parseField(line));
        assertEquals(start, dates.getStartDate());
        assertEquals(startQualifier, dates.getStartDateQualifier());
        assertEquals(end, dates.getEndDate());
        assertEquals(endQualifier, dates.getEndDateQualifier());
        assertEquals(dateType, dates.getDateType());
        assertEquals(fullDates, dates.getFullDates());
    }

    @Test
    void parseCollectsEveryPart() {
        var name = parser.parse(MarcNotation.parseField(
            "100 1#$aByron, George Gordon Byron,$cBaron,$d1788-1824,$eauthor."));

        assertEquals("Byron", name.getSurname());
        assertEquals("George Gordon Byron", name.getForename());
        assertEquals(List.of("Baron"), name.getTitles());
        assertEquals("1788-1824", name.getFullDates());
        assertEquals(1788, name.getStartDate());
        assertEquals(1824, name.getEndDate());
        assertEquals("author", name.getRelationToWork());
        assertEquals("Byron, George Gordon Byron, Baron, 1788-1824", name.getAuthorizedHeading());
    }

    @Test
    void emptyDatesLeaveDefaults() {
        var dates = parser.personDates(MarcNotation.parseField("100 1#$aSmith, John."));
        assertNull(dates.getStartDate());
        assertEquals("", dates.getDateType());
        assertEquals("", dates.getFullDates());
    }

    static Stream<Arguments> formatted() {
        return Stream.of(
            Arguments.of("First", "Last", List.of(), "", "First Last", "Last, First", "First Last"),
            Arguments.of("First", "", List.of(), "", "First", "First", "First"),
            Arguments.of("", "Last", List.of(), "", "Last", "Last", "Last"),
            Arguments.of("", "", List.of(), "", "", "", ""),
            Arguments.of("First", "Last", List.of("Sir", "Baron"), "", "First Last", "Last, First",
                "First Last, Sir, Baron"),
            Arguments.of("First", "Last", List.of(), "1900-2000", "First Last", "Last, First",
                "First Last (1900-2000)"),
            Arguments.of("First", "Last", List.of("Sir"), "1900-2000", "First Last", "Last, First",
                "First Last, Sir (1900-2000)")
        );
    }

    @ParameterizedTest
    @MethodSource("formatted")
    void formatsNames(String forename, String surname, List<String> titles, String dates,
                      String straight, String inverted, String full) {
        var name = PersonName.builder().forename(forename).surname(surname).titles(titles).fullDates(dates).build();
        assertEquals(straight, parser.nameStraight(name));
        assertEquals(inverted, parser.nameInverted(name));
        assertEquals(full, parser.fullName(name));
    }
}

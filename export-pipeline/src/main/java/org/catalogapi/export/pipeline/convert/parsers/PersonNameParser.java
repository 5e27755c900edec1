package org.catalogapi.export.pipeline.convert.parsers;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.catalogapi.export.marc.Field;
import org.catalogapi.export.pipeline.ir.PersonName;

import static org.catalogapi.export.pipeline.convert.parsers.TextParsers.*;

/**
 * Parses personal-name headings (MARC 100, 600, 700, 800 and friends) and formats the parsed
 * names for display and search.
 */
public class PersonNameParser {
    private static final Pattern FAMILY = Pattern.compile("^(.+?)\\s+family$", Pattern.CASE_INSENSITIVE);
    private static final Pattern CENTURIES = Pattern.compile(
        "^(\\d+)(?:st|nd|rd|th)(?:\\s*/\\s*(\\d+)(?:st|nd|rd|th))?\\s+cent\\.?(\\s+B\\.?C\\.?(?:E\\.?)?)?$");
    private static final Pattern DATE_PART = Pattern.compile(
        "^(ca\\.\\s*)?(\\d{1,4})(\\?)?(\\s+or\\s+\\d{1,4}\\??)?(?:\\s.*)?$");
    private static final Pattern FLOURISHED = Pattern.compile("^fl\\.\\s*");
    private static final Pattern DIED = Pattern.compile("^d\\.\\s*");
    private static final Pattern BORN = Pattern.compile("^b\\.\\s*");

    /**
     * Everything in the heading: name, titles, dates and the other subfields.
     */
    public PersonName parse(Field field) {
        var builder = PersonName.builder();
        applyName(builder, field);
        applyDates(builder, field);
        return builder
            .titles(personTitles(field))
            .fullerFormOfName(joinCleaned(field, "q"))
            .relationToWork(joinCleaned(field, "e"))
            .attributionQualifier(joinCleaned(field, "j"))
            .affiliation(joinCleaned(field, "u"))
            .authorizedHeading(authorizedHeading(field))
            .build();
    }

    /**
     * Forename, surname and family name only.
     */
    public PersonName personName(Field field) {
        var builder = PersonName.builder();
        applyName(builder, field);
        return builder.build();
    }

    private void applyName(PersonName.PersonNameBuilder builder, Field field) {
        var name = protectPeriodsAndDo(joinRaw(field, "a"), TextParsers::stripEnds);
        var numeration = stripEnds(joinRaw(field, "b"));

        var familyMatcher = FAMILY.matcher(name);
        if (familyMatcher.matches()) {
            builder.surname(familyMatcher.group(1)).familyName(name);
            return;
        }
        String forename;
        if (hasCommaInMiddle(name)) {
            int comma = name.indexOf(',');
            builder.surname(stripEnds(name.substring(0, comma)));
            forename = stripEnds(name.substring(comma + 1));
        } else if (field.getIndicator(1) != null && field.getIndicator(1) == '0') {
            forename = name;
        } else {
            builder.surname(name);
            forename = "";
        }
        if (!numeration.isEmpty()) {
            forename = forename.isEmpty() ? numeration : forename + " " + numeration;
        }
        builder.forename(normalizeWhitespace(forename));
    }

    /**
     * Titles from every $c, split on commas, in order.
     */
    public List<String> personTitles(Field field) {
        var titles = new ArrayList<String>();
        for (var data : field.getSubfieldData("c")) {
            for (var part : data.split(",")) {
                var title = protectPeriodsAndDo(part, TextParsers::stripEnds);
                if (!title.isEmpty()) {
                    titles.add(normalizeWhitespace(title));
                }
            }
        }
        return titles;
    }

    /**
     * Dates from $d only; the other name parts are left at their defaults.
     */
    public PersonName personDates(Field field) {
        var builder = PersonName.builder();
        applyDates(builder, field);
        return builder.build();
    }

    private void applyDates(PersonName.PersonNameBuilder builder, Field field) {
        var fullDates = protectPeriodsAndDo(joinRaw(field, "d"), TextParsers::stripEnds);
        builder.fullDates(fullDates);
        if (fullDates.isEmpty()) {
            return;
        }

        var centuries = CENTURIES.matcher(fullDates);
        if (centuries.matches()) {
            applyCenturies(builder, centuries);
            return;
        }

        var dateType = PersonName.DATES_LIVED;
        var rest = fullDates;
        var flourished = FLOURISHED.matcher(rest);
        if (flourished.find()) {
            dateType = PersonName.DATES_FLOURISHED;
            rest = rest.substring(flourished.end());
        }

        String startPart;
        String endPart;
        var died = DIED.matcher(rest);
        var born = BORN.matcher(rest);
        if (died.find()) {
            startPart = "";
            endPart = rest.substring(died.end());
        } else if (born.find()) {
            startPart = rest.substring(born.end());
            endPart = "";
        } else {
            int dash = rest.indexOf('-');
            startPart = dash < 0 ? rest : rest.substring(0, dash);
            endPart = dash < 0 ? "" : rest.substring(dash + 1);
        }

        var start = startPart.isBlank() ? null : DATE_PART.matcher(startPart.strip());
        var end = endPart.isBlank() ? null : DATE_PART.matcher(endPart.strip());
        if ((start == null && end == null) || (start != null && !start.matches()) || (end != null && !end.matches())) {
            builder.dateType(PersonName.UNKNOWN_DATE_TYPES);
            return;
        }
        builder.dateType(dateType);
        if (start != null) {
            builder.startDate(Integer.parseInt(start.group(2))).startDateQualifier(qualifier(start));
        }
        if (end != null) {
            builder.endDate(Integer.parseInt(end.group(2))).endDateQualifier(qualifier(end));
        }
    }

    /**
     * Century n CE is (n-1)*100 through n*100-1. Century n BCE is -(n*100) through
     * -((n-1)*100+1). A BCE range keeps to the bounds of its first century.
     */
    private static void applyCenturies(PersonName.PersonNameBuilder builder, Matcher centuries) {
        int first = Integer.parseInt(centuries.group(1));
        int last = centuries.group(2) == null ? first : Integer.parseInt(centuries.group(2));
        boolean bce = centuries.group(3) != null;
        builder.dateType(PersonName.APPROXIMATE_CENTURIES);
        if (bce) {
            builder.startDate(-(first * 100)).endDate(-((first - 1) * 100 + 1));
        } else {
            builder.startDate((first - 1) * 100).endDate(last * 100 - 1);
        }
    }

    private static String qualifier(Matcher datePart) {
        if (datePart.group(1) != null) {
            return PersonName.CIRCA;
        }
        if (datePart.group(3) != null || datePart.group(4) != null) {
            return PersonName.UNSURE;
        }
        return "";
    }

    /** "Forename Surname". */
    public String nameStraight(PersonName name) {
        return joinNonEmpty(" ", name.getForename(), name.getSurname());
    }

    /** "Surname, Forename". */
    public String nameInverted(PersonName name) {
        return joinNonEmpty(", ", name.getSurname(), name.getForename());
    }

    /** "Forename Surname, Title, Title (dates)". */
    public String fullName(PersonName name) {
        var sb = new StringBuilder(nameStraight(name));
        if (name.getTitles() != null && !name.getTitles().isEmpty()) {
            sb.append(", ").append(String.join(", ", name.getTitles()));
        }
        if (name.getFullDates() != null && !name.getFullDates().isEmpty()) {
            sb.append(" (").append(name.getFullDates()).append(')');
        }
        return sb.toString();
    }

    private static String joinNonEmpty(String delimiter, String... parts) {
        var sb = new StringBuilder();
        for (var part : parts) {
            if (part != null && !part.isEmpty()) {
                if (sb.length() > 0) {
                    sb.append(delimiter);
                }
                sb.append(part);
            }
        }
        return sb.toString();
    }

    private static String joinRaw(Field field, String subfieldTag) {
        return String.join(" ", field.getSubfieldData(subfieldTag));
    }

    private static String joinCleaned(Field field, String subfieldTag) {
        return field.getSubfieldData(subfieldTag).stream()
            .map(d -> protectPeriodsAndDo(d, TextParsers::stripEnds))
            .filter(d -> !d.isEmpty())
            .collect(Collectors.joining(", "));
    }

    private static String authorizedHeading(Field field) {
        var heading = field.getSubfields().stream()
            .filter(sf -> "abcdq".contains(sf.getTag()))
            .map(sf -> sf.getData())
            .collect(Collectors.joining(" "));
        return protectPeriodsAndDo(normalizeWhitespace(heading), TextParsers::stripEnds);
    }
}

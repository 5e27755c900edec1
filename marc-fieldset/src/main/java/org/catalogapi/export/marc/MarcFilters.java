package org.catalogapi.export.marc;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Predicate factories for {@link Fieldset} and {@link Field} filtering.
 *
 * Tag and data filters work on fields and subfields alike. Data filters need an element with a
 * data payload (a subfield or a control field); using one on a variable field is a programming
 * error and throws. Indicator filters only make sense for fields.
 */
public final class MarcFilters {

    private MarcFilters() {}

    public static <T extends MarcElement> Predicate<T> tagEquals(String tag) {
        return element -> element.getTag().equals(tag);
    }

    public static <T extends MarcElement> Predicate<T> tagIn(String... tags) {
        return tagIn(List.of(tags));
    }

    public static <T extends MarcElement> Predicate<T> tagIn(Collection<String> tags) {
        var copy = List.copyOf(tags);
        return element -> copy.contains(element.getTag());
    }

    /** Regex search anywhere in the tag, not a full match. */
    public static <T extends MarcElement> Predicate<T> tagMatches(String regex) {
        var pattern = Pattern.compile(regex);
        return element -> pattern.matcher(element.getTag()).find();
    }

    public static <T extends MarcElement> Predicate<T> dataEquals(String data) {
        return element -> requireData(element).equals(data);
    }

    /** Regex search anywhere in the data. */
    public static <T extends MarcElement> Predicate<T> dataMatches(String regex) {
        var pattern = Pattern.compile(regex);
        return element -> pattern.matcher(requireData(element)).find();
    }

    public static <T extends MarcElement> Predicate<T> tagInAndDataEquals(Collection<String> tags, String data) {
        Predicate<T> tagTest = tagIn(tags);
        return tagTest.and(dataEquals(data));
    }

    public static <T extends MarcElement> Predicate<T> tagInAndDataMatches(Collection<String> tags, String regex) {
        Predicate<T> tagTest = tagIn(tags);
        return tagTest.and(dataMatches(regex));
    }

    public static Predicate<Field> indicatorEquals(int num, Character value) {
        checkIndicatorNum(num);
        return field -> Objects.equals(field.getIndicator(num), value);
    }

    /** False for fields that have no indicator in that position. */
    public static Predicate<Field> indicatorIn(int num, Collection<Character> values) {
        checkIndicatorNum(num);
        var copy = List.copyOf(values);
        return field -> {
            var ind = field.getIndicator(num);
            return ind != null && copy.contains(ind);
        };
    }

    public static Predicate<Field> fieldHasAnySubfieldWhere(Predicate<? super Subfield> subfieldTest) {
        return field -> field.getSubfields().stream().anyMatch(subfieldTest);
    }

    private static void checkIndicatorNum(int num) {
        if (num != 1 && num != 2) {
            throw new IllegalArgumentException("Indicator number must be 1 or 2, got: " + num);
        }
    }

    private static String requireData(MarcElement element) {
        if (!element.hasData()) {
            throw new IllegalArgumentException("Element with tag " + element.getTag() + " has no data to filter on");
        }
        return element.getData();
    }
}

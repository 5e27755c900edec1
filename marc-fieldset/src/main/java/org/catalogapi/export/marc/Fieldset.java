package org.catalogapi.export.marc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * An ordered collection of {@link Field}s.
 *
 * Field-level filters return a new Fieldset referencing the same Field objects. Subfield-level
 * filters return shallow copies of each field whose subfield lists still reference the original
 * {@link Subfield} objects, so a filter followed by {@link #replaceSubfieldData} changes the
 * subfields of the Fieldset the filter was applied to.
 */
public final class Fieldset implements Iterable<Field> {
    private static final Fieldset EMPTY = new Fieldset(List.of());

    private final List<Field> fields;

    public Fieldset(List<Field> fields) {
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public static Fieldset of(Field... fields) {
        return new Fieldset(List.of(fields));
    }

    public static Fieldset empty() {
        return EMPTY;
    }

    public Fieldset fieldsWhere(Predicate<? super Field> predicate) {
        return new Fieldset(fields.stream().filter(predicate).collect(Collectors.toList()));
    }

    public Fieldset fieldsWhereNot(Predicate<? super Field> predicate) {
        return fieldsWhere(predicate.negate());
    }

    public Fieldset subfieldsWhere(Predicate<? super Subfield> predicate) {
        return new Fieldset(fields.stream().map(f -> f.subfieldsWhere(predicate)).collect(Collectors.toList()));
    }

    public Fieldset subfieldsWhereNot(Predicate<? super Subfield> predicate) {
        return subfieldsWhere(predicate.negate());
    }

    /**
     * Replaces subfield data in place across every field.
     *
     * @return this fieldset
     */
    public Fieldset replaceSubfieldData(UnaryOperator<String> replacement) {
        fields.forEach(f -> f.replaceSubfieldData(replacement));
        return this;
    }

    public <T> List<List<SubfieldChange<T>>> doForEachSubfield(Function<? super Subfield, T> action) {
        return fields.stream().map(f -> f.doForEachSubfield(action)).collect(Collectors.toList());
    }

    public List<String> getSubfieldsAsStrings() {
        return getSubfieldsAsStrings(" ");
    }

    public List<String> getSubfieldsAsStrings(String delimiter) {
        return fields.stream().map(f -> f.getSubfieldsAsString(delimiter)).collect(Collectors.toList());
    }

    public Fieldset getSorted() {
        return getSorted(List.of("tag"), false);
    }

    /**
     * Stable sort by the named attributes: tag, data, occurrence, ind1, ind2. Names outside that
     * set add no ordering. Missing values sort first.
     */
    public Fieldset getSorted(List<String> keys, boolean reverse) {
        Comparator<Field> comparator = null;
        for (var key : keys) {
            var next = comparatorFor(key);
            if (next != null) {
                comparator = comparator == null ? next : comparator.thenComparing(next);
            }
        }
        if (comparator == null) {
            return new Fieldset(fields);
        }
        var sorted = new ArrayList<>(fields);
        sorted.sort(reverse ? comparator.reversed() : comparator);
        return new Fieldset(sorted);
    }

    private static Comparator<Field> comparatorFor(String key) {
        switch (key) {
            case "tag":
                return Comparator.comparing(Field::getTag);
            case "data":
                return Comparator.comparing(Field::getData, Comparator.nullsFirst(Comparator.<String>naturalOrder()));
            case "occurrence":
                return Comparator.comparingInt(Field::getOccurrence);
            case "ind1":
                return Comparator.comparing((Field f) -> f.getIndicator(1), Comparator.nullsFirst(Comparator.<Character>naturalOrder()));
            case "ind2":
                return Comparator.comparing((Field f) -> f.getIndicator(2), Comparator.nullsFirst(Comparator.<Character>naturalOrder()));
            default:
                return null;
        }
    }

    public Fieldset concat(Fieldset other) {
        var all = new ArrayList<Field>(fields.size() + other.size());
        all.addAll(fields);
        all.addAll(other.fields);
        return new Fieldset(all);
    }

    public Optional<Field> first() {
        return fields.isEmpty() ? Optional.empty() : Optional.of(fields.get(0));
    }

    public Field get(int index) {
        return fields.get(index);
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public List<Field> asList() {
        return fields;
    }

    public Stream<Field> stream() {
        return fields.stream();
    }

    @Override
    public Iterator<Field> iterator() {
        return fields.iterator();
    }

    @Override
    public String toString() {
        return fields.stream().map(Field::toString).collect(Collectors.joining("\n"));
    }
}

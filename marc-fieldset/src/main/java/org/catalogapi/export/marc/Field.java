package org.catalogapi.export.marc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

import lombok.Getter;

/**
 * One MARC-style field.
 *
 * Control fields (the leader, "LDR", and numeric tags below 010) carry a data payload and have
 * no indicators or subfields. Every other field carries indicators and an ordered list of
 * subfields and never a data payload. Use {@link #control} and {@link #variable} to build them.
 *
 * The subfield list of a field is fixed once built, but the {@link Subfield} objects in it are
 * shared with any view derived from this field by {@link #subfieldsWhere}.
 */
@Getter
public final class Field implements MarcElement {
    public static final String LEADER_TAG = "LDR";

    private final String tag;
    private final String data;
    private final Indicators indicators;
    private final List<Subfield> subfields;
    /** Disambiguates repeated tags for ordering. Not a unique key. */
    private final int occurrence;

    private Field(String tag, String data, Indicators indicators, List<Subfield> subfields, int occurrence) {
        if (tag == null || tag.length() != 3) {
            throw new IllegalArgumentException("Field tag must be three characters, got: " + tag);
        }
        if (occurrence < 0) {
            throw new IllegalArgumentException("Occurrence must not be negative, got: " + occurrence);
        }
        this.tag = tag;
        this.data = data;
        this.indicators = indicators;
        this.subfields = Collections.unmodifiableList(new ArrayList<>(subfields));
        this.occurrence = occurrence;
    }

    public static Field control(String tag, String data, int occurrence) {
        if (!isControlTag(tag)) {
            throw new IllegalArgumentException("Tag " + tag + " is not a control field tag");
        }
        return new Field(tag, data == null ? "" : data, Indicators.NONE, List.of(), occurrence);
    }

    public static Field variable(String tag, Indicators indicators, List<Subfield> subfields, int occurrence) {
        if (isControlTag(tag)) {
            throw new IllegalArgumentException("Tag " + tag + " is a control field tag");
        }
        return new Field(tag, null, indicators == null ? Indicators.NONE : indicators, subfields, occurrence);
    }

    /**
     * True for "LDR" and for numeric tags 000-009.
     */
    public static boolean isControlTag(String tag) {
        if (LEADER_TAG.equals(tag)) {
            return true;
        }
        if (tag == null || tag.length() != 3 || !tag.chars().allMatch(Character::isDigit)) {
            return false;
        }
        return Integer.parseInt(tag) < 10;
    }

    public boolean isControlField() {
        return data != null;
    }

    public Character getIndicator(int num) {
        return indicators.get(num);
    }

    /**
     * A shallow copy of this field holding only the matching subfields. The copy keeps its
     * place even when nothing matches; its subfield list is then empty.
     */
    public Field subfieldsWhere(Predicate<? super Subfield> predicate) {
        if (isControlField()) {
            return this;
        }
        var matching = subfields.stream().filter(predicate).collect(Collectors.toList());
        return new Field(tag, null, indicators, matching, occurrence);
    }

    public Field subfieldsWhereNot(Predicate<? super Subfield> predicate) {
        return subfieldsWhere(predicate.negate());
    }

    /**
     * Replaces the data of every subfield in this field, in place.
     *
     * @return this field
     */
    public Field replaceSubfieldData(UnaryOperator<String> replacement) {
        subfields.forEach(sf -> sf.setData(replacement.apply(sf.getData())));
        return this;
    }

    /**
     * Runs the action on each subfield in order and reports what it saw before and after.
     */
    public <T> List<SubfieldChange<T>> doForEachSubfield(Function<? super Subfield, T> action) {
        var changes = new ArrayList<SubfieldChange<T>>(subfields.size());
        for (var sf : subfields) {
            var before = sf.getData();
            var result = action.apply(sf);
            changes.add(new SubfieldChange<>(sf.getTag(), before, result, sf.getData()));
        }
        return changes;
    }

    public List<String> getSubfieldData(String subfieldTag) {
        return subfields.stream()
            .filter(sf -> sf.getTag().equals(subfieldTag))
            .map(Subfield::getData)
            .collect(Collectors.toList());
    }

    public String getSubfieldsAsString() {
        return getSubfieldsAsString(" ");
    }

    public String getSubfieldsAsString(String delimiter) {
        return subfields.stream().map(Subfield::getData).collect(Collectors.joining(delimiter));
    }

    @Override
    public String toString() {
        if (isControlField()) {
            return tag + " " + data;
        }
        var sb = new StringBuilder(tag).append(' ')
            .append(indicatorText(indicators.first()))
            .append(indicatorText(indicators.second()));
        subfields.forEach(sf -> sb.append('$').append(sf.getTag()).append(sf.getData()));
        return sb.toString();
    }

    private static char indicatorText(Character ind) {
        return ind == null || ind == ' ' ? '#' : ind;
    }
}

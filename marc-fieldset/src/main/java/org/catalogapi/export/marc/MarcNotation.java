package org.catalogapi.export.marc;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

/**
 * Reads fields written in the mnemonic form used by MARC documentation, for example
 * {@code 100 1#$aAuthor Name,$d1900-2000} or {@code 007 cr}. A '#' indicator is a blank.
 */
public final class MarcNotation {

    private MarcNotation() {}

    public static Field parseField(String line) {
        return parseField(line, 0);
    }

    public static Field parseField(String line, int occurrence) {
        if (line == null || line.length() < 3) {
            throw new IllegalArgumentException("Not a MARC field line: " + line);
        }
        var tag = line.substring(0, 3);
        if (Field.isControlTag(tag)) {
            return Field.control(tag, line.length() > 4 ? line.substring(4) : "", occurrence);
        }
        if (line.length() < 6) {
            throw new IllegalArgumentException("Variable field line has no indicators: " + line);
        }
        var indicators = Indicators.of(blank(line.charAt(4)), blank(line.charAt(5)));
        var subfields = new ArrayList<Subfield>();
        var parts = line.substring(6).split("\\$", -1);
        for (int i = 1; i < parts.length; i++) {
            if (!parts[i].isEmpty()) {
                subfields.add(new Subfield(parts[i].charAt(0), parts[i].substring(1)));
            }
        }
        return Field.variable(tag, indicators, subfields, occurrence);
    }

    /**
     * Parses one field per line. Occurrence numbers count up per tag in line order.
     */
    public static Fieldset parseFieldset(List<String> lines) {
        var seen = new HashMap<String, Integer>();
        var fields = new ArrayList<Field>(lines.size());
        for (var line : lines) {
            var tag = line.length() >= 3 ? line.substring(0, 3) : line;
            int occurrence = seen.merge(tag, 1, Integer::sum) - 1;
            fields.add(parseField(line, occurrence));
        }
        return new Fieldset(fields);
    }

    private static char blank(char ind) {
        return ind == '#' ? ' ' : ind;
    }
}

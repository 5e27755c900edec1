package org.catalogapi.export.sierra;

import java.util.ArrayList;
import java.util.List;

import org.catalogapi.export.marc.Subfield;

/**
 * Sierra stores subfields inline: {@code |aStuff|bMore stuff}. Anything before the first '|'
 * is not part of any subfield.
 */
final class SierraContent {
    static final String DELIMITER = "|";

    private SierraContent() {}

    static List<Subfield> splitSubfields(String content) {
        var subfields = new ArrayList<Subfield>();
        if (content == null || !content.contains(DELIMITER)) {
            return subfields;
        }
        var parts = content.split("\\|", -1);
        for (int i = 1; i < parts.length; i++) {
            if (!parts[i].isEmpty()) {
                subfields.add(new Subfield(parts[i].charAt(0), parts[i].substring(1)));
            }
        }
        return subfields;
    }
}

package org.catalogapi.export.pipeline.convert.parsers;

import java.util.Locale;

import org.catalogapi.export.sierra.CallNumber;

import lombok.extern.slf4j.Slf4j;
import org.marc4j.callnum.DeweyCallNumber;
import org.marc4j.callnum.LCCallNumber;

/**
 * Builds sort keys for call numbers using marc4j's LC and Dewey parsers. A call number neither
 * parser accepts sorts by its lower-cased, whitespace-normalized text.
 */
@Slf4j
public class CallNumberNormalizer {

    public String forSort(String display) {
        return forSort(display, null);
    }

    /**
     * @param type scheme hint such as {@link CallNumber#DEWEY}; may be null
     */
    public String forSort(String display, String type) {
        if (display == null || display.isBlank()) {
            return "";
        }
        var callNumber = display.strip();
        if (CallNumber.DEWEY.equals(type)) {
            var dewey = new DeweyCallNumber(callNumber);
            if (dewey.isValid()) {
                return dewey.getShelfKey();
            }
        }
        var lc = new LCCallNumber(callNumber);
        if (lc.isValid()) {
            return lc.getShelfKey();
        }
        var dewey = new DeweyCallNumber(callNumber);
        if (dewey.isValid()) {
            return dewey.getShelfKey();
        }
        log.debug("Call number '{}' is neither LC nor Dewey; sorting by text", callNumber);
        return TextParsers.normalizeWhitespace(callNumber).toLowerCase(Locale.ROOT);
    }
}

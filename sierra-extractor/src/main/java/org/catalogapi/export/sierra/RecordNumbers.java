package org.catalogapi.export.sierra;

import org.catalogapi.export.sierra.model.RecordMetadata;

/**
 * Formats III record numbers such as {@code b1234567} or, with the check digit, {@code b12345678}.
 */
public final class RecordNumbers {

    private RecordNumbers() {}

    public static String format(RecordMetadata metadata, boolean includeCheckDigit) {
        return format(metadata.getRecordTypeCode(), metadata.getRecordNum(), includeCheckDigit);
    }

    public static String format(String recordTypeCode, long recordNum, boolean includeCheckDigit) {
        var number = Long.toString(recordNum);
        return recordTypeCode + number + (includeCheckDigit ? checkDigit(number) : "");
    }

    /**
     * Mod-11 check digit: digits are weighted 2, 3, 4... from the right; a remainder of 10 is 'x'.
     */
    public static String checkDigit(String digits) {
        int sum = 0;
        int weight = 2;
        for (int i = digits.length() - 1; i >= 0; i--) {
            sum += Character.digit(digits.charAt(i), 10) * weight;
            weight++;
        }
        int remainder = sum % 11;
        return remainder == 10 ? "x" : Integer.toString(remainder);
    }
}

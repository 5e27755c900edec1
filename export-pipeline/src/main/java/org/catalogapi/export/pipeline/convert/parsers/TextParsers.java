package org.catalogapi.export.pipeline.convert.parsers;

import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * String clean-up used when turning catalog data into display and search values.
 */
public final class TextParsers {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern PUNCTUATION_RUN = Pattern.compile("(?:\\s*[.;:/])+");
    private static final Pattern BRACKETED = Pattern.compile("\\[([^\\]]*)\\]");
    private static final Pattern COMMA_IN_MIDDLE = Pattern.compile("[^,\\s]\\s*,\\s*[^,\\s]");
    private static final Pattern ELLIPSIS = Pattern.compile("\\s*\\.\\.\\.\\s*");
    private static final Pattern SPACE_BEFORE_PERIOD = Pattern.compile("\\s+\\.(?=\\s|$)");
    private static final Pattern ENDS = Pattern.compile("^[\\s.,;:/=]+|[\\s.,;:/=]+$");

    private static final Pattern NUMERIC = Pattern.compile("\\d+");
    private static final Pattern ALPHA_ORDINAL = Pattern.compile("\\d+(?:st|nd|rd|th)");
    private static final Pattern ROMAN_NUMERAL = Pattern.compile("[IVXLCDM]+");
    private static final Pattern CAPITAL_INITIAL = Pattern.compile("[A-Z]");

    /** Abbreviations whose trailing period is never structural. */
    private static final Set<String> ABBREVIATIONS = Set.of(
        "eds", "ed", "ca", "fl", "cent", "approx", "etc", "vol", "vols", "no", "nos", "pt", "pts",
        "Mrs", "Mr", "Ms", "Dr", "St", "Ste", "Jr", "Sr", "Bp", "Abp", "Capt", "Col", "Gen", "Lt",
        "Rev", "Hon", "Prof", "Sir", "Bart", "Kt", "Jan", "Feb", "Mar", "Apr", "Jun", "Jul", "Aug",
        "Sept", "Sep", "Oct", "Nov", "Dec"
    );

    /** Stands in for a protected period while a parsing function runs. */
    private static final char PROTECTED_PERIOD = '\uE000';

    private TextParsers() {}

    public static String normalizeWhitespace(String data) {
        return WHITESPACE.matcher(data.strip()).replaceAll(" ");
    }

    /**
     * Collapses each run of . ; : / marks (and the whitespace inside and before it) to its last
     * mark. A slash keeps the whitespace in front of it.
     */
    public static String normalizePunctuation(String data) {
        var matcher = PUNCTUATION_RUN.matcher(data);
        var sb = new StringBuilder();
        while (matcher.find()) {
            var run = matcher.group();
            var mark = run.charAt(run.length() - 1);
            String replacement;
            if (mark == '/') {
                int start = run.length() - 1;
                while (start > 0 && Character.isWhitespace(run.charAt(start - 1))) {
                    start--;
                }
                replacement = run.substring(start);
            } else {
                replacement = String.valueOf(mark);
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    public static String stripBrackets(String data) {
        return stripBrackets(data, true, null, null, null);
    }

    /**
     * Removes square brackets. For each bracketed section: if its content matches
     * {@code toProtect} the brackets stay; else if it matches {@code toRemove} the whole section
     * goes; else if {@code keepInner} is set or the content matches {@code toKeep} only the
     * brackets go; otherwise the whole section goes. Any regex may be null.
     */
    public static String stripBrackets(String data, boolean keepInner, String toKeep, String toRemove,
                                       String toProtect) {
        var keep = toKeep == null ? null : Pattern.compile(toKeep);
        var remove = toRemove == null ? null : Pattern.compile(toRemove);
        var protect = toProtect == null ? null : Pattern.compile(toProtect);

        var matcher = BRACKETED.matcher(data);
        var sb = new StringBuilder();
        while (matcher.find()) {
            var inner = matcher.group(1);
            String replacement;
            if (protect != null && protect.matcher(inner).find()) {
                replacement = matcher.group();
            } else if (remove != null && remove.matcher(inner).find()) {
                replacement = "";
            } else if (keepInner || (keep != null && keep.matcher(inner).find())) {
                replacement = inner;
            } else {
                replacement = "";
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return normalizeWhitespace(sb.toString());
    }

    /**
     * Hides non-structural periods (abbreviations, initials, decimals, inner ordinals and
     * Roman numerals) from {@code action}, runs it, and puts them back.
     */
    public static String protectPeriodsAndDo(String data, UnaryOperator<String> action) {
        var chars = data.toCharArray();
        for (int i = 0; i < chars.length; i++) {
            if (chars[i] == '.' && isProtectedPeriod(data, i)) {
                chars[i] = PROTECTED_PERIOD;
            }
        }
        var result = action.apply(new String(chars));
        return result.replace(PROTECTED_PERIOD, '.');
    }

    private static boolean isProtectedPeriod(String data, int index) {
        if (index + 1 < data.length() && !Character.isWhitespace(data.charAt(index + 1))) {
            return true;
        }
        int start = index;
        while (start > 0 && Character.isLetterOrDigit(data.charAt(start - 1))) {
            start--;
        }
        var word = data.substring(start, index);
        if (word.isEmpty()) {
            return false;
        }
        if (CAPITAL_INITIAL.matcher(word).matches() || ABBREVIATIONS.contains(word)) {
            return true;
        }
        boolean inner = !data.substring(index + 1).isBlank();
        return inner && (NUMERIC.matcher(word).matches()
            || ALPHA_ORDINAL.matcher(word).matches()
            || ROMAN_NUMERAL.matcher(word).matches());
    }

    /**
     * Strips whitespace and . , ; : / = from both ends, and unwraps parentheses that enclose
     * the whole string.
     */
    public static String stripEnds(String data) {
        var result = ENDS.matcher(data).replaceAll("");
        while (result.startsWith("(") && closingParenIndex(result) == result.length() - 1) {
            result = ENDS.matcher(result.substring(1, result.length() - 1)).replaceAll("");
        }
        return result;
    }

    private static int closingParenIndex(String data) {
        int depth = 0;
        for (int i = 0; i < data.length(); i++) {
            var c = data.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    public static String stripEllipses(String data) {
        var result = ELLIPSIS.matcher(data).replaceAll(" ");
        result = SPACE_BEFORE_PERIOD.matcher(result).replaceAll(".");
        return result.strip();
    }

    /**
     * Full clean-up for display: ellipses, brackets, punctuation runs, trailing punctuation and
     * whitespace.
     */
    public static String clean(String data) {
        var result = stripEllipses(data);
        result = stripBrackets(result);
        result = normalizePunctuation(result);
        result = stripEnds(result);
        return normalizeWhitespace(result);
    }

    /** True if a comma separates two words somewhere in the string. */
    public static boolean hasCommaInMiddle(String data) {
        return COMMA_IN_MIDDLE.matcher(data).find();
    }
}

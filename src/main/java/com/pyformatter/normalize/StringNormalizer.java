package com.pyformatter.normalize;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.pyformatter.tree.Trees;

/**
 * Normalizes string literals: prefix letters, quote style and the case of escape sequences.
 * All methods take the full literal text (prefix and quotes included) and return the new text.
 */
public final class StringNormalizer {

    private static final Pattern F_STRING_FIELD =
            Pattern.compile("(?:(?<!\\{)|^)\\{([^{].*?)\\}(?:(?!\\})|$)");

    private static final Pattern UNICODE_ESCAPE = Pattern.compile(
            "(\\\\+)(u[a-fA-F0-9]{4}|U[a-fA-F0-9]{8}|x[a-fA-F0-9]{2}|N\\{[^}]+\\})");

    private StringNormalizer() {
    }

    /**
     * Lowercases {@code F} and {@code B}, drops {@code u}/{@code U} and keeps the raw marker as
     * written. In two-letter prefixes the raw marker moves to the front ({@code bR} becomes
     * {@code Rb}).
     */
    public static String normalizePrefix(String value) {
        int length = Trees.stringPrefixLength(value);
        String prefix = value.substring(0, length)
                .replace("F", "f")
                .replace("B", "b")
                .replace("U", "")
                .replace("u", "");
        if (prefix.length() == 2 && (prefix.charAt(1) == 'r' || prefix.charAt(1) == 'R')) {
            prefix = prefix.substring(1) + prefix.charAt(0);
        }
        return prefix + value.substring(length);
    }

    /**
     * Prefers double quotes unless that would need more escapes than the current form. Escapes
     * that become unnecessary are removed. Triple-double-quoted strings are left alone.
     */
    public static String normalizeQuotes(String value) {
        int prefixLength = Trees.stringPrefixLength(value);
        String literal = value.substring(prefixLength);
        String origQuote;
        String newQuote;
        if (literal.startsWith("\"\"\"")) {
            return value;
        } else if (literal.startsWith("'''")) {
            origQuote = "'''";
            newQuote = "\"\"\"";
        } else if (literal.startsWith("\"")) {
            origQuote = "\"";
            newQuote = "'";
        } else {
            origQuote = "'";
            newQuote = "\"";
        }
        String prefix = value.substring(0, prefixLength);
        if (value.length() < prefixLength + 2 * origQuote.length()) {
            return value;
        }
        String body = value.substring(prefixLength + origQuote.length(), value.length() - origQuote.length());
        String current = value;
        String newBody;
        String lowerPrefix = prefix.toLowerCase(Locale.ROOT);
        if (lowerPrefix.contains("r")) {
            if (count(body, newQuote) != count(body, "\\" + newQuote)) {
                // an unescaped quote of the other kind cannot be escaped in a raw string
                return value;
            }
            newBody = body;
        } else {
            newBody = subTwice(escapedQuote(newQuote), "$1$2" + Matcher.quoteReplacement(newQuote), body);
            if (!body.equals(newBody)) {
                body = newBody;
                current = prefix + origQuote + body + origQuote;
            }
            newBody = subTwice(escapedQuote(origQuote), "$1$2" + Matcher.quoteReplacement(origQuote), newBody);
            newBody = subTwice(unescapedQuote(newQuote), "$1\\\\" + Matcher.quoteReplacement(newQuote), newBody);
        }
        if (lowerPrefix.contains("f")) {
            Matcher fields = F_STRING_FIELD.matcher(newBody);
            while (fields.find()) {
                if (fields.group(1).contains("\\")) {
                    // replacement fields may not gain backslashes
                    return current;
                }
            }
        }
        if (newQuote.equals("\"\"\"") && newBody.endsWith("\"")) {
            newBody = newBody.substring(0, newBody.length() - 1) + "\\\"";
        }
        int origEscapeCount = count(body, "\\");
        int newEscapeCount = count(newBody, "\\");
        if (newEscapeCount > origEscapeCount) {
            return current;
        }
        if (newEscapeCount == origEscapeCount && origQuote.equals("\"")) {
            return current;
        }
        return prefix + newQuote + newBody + newQuote;
    }

    /**
     * Lowercases the hex digits of {@code \x}, {@code &#92;u} and {@code \U} escapes and uppercases
     * the names in {@code \N{...}} escapes. Raw and bytes literals are returned unchanged.
     */
    public static String normalizeUnicodeEscapeSequences(String value) {
        String prefix = value.substring(0, Trees.stringPrefixLength(value)).toLowerCase(Locale.ROOT);
        if (prefix.contains("r") || prefix.contains("b")) {
            return value;
        }
        Matcher matcher = UNICODE_ESCAPE.matcher(value);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String backslashes = matcher.group(1);
            String body = matcher.group(2);
            String replacement;
            if (backslashes.length() % 2 == 0) {
                replacement = backslashes + body;
            } else if (body.charAt(0) == 'N') {
                replacement = backslashes + "N{" + body.substring(2, body.length() - 1).toUpperCase(Locale.ROOT) + "}";
            } else {
                replacement = backslashes + body.charAt(0) + body.substring(1).toLowerCase(Locale.ROOT);
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static Pattern escapedQuote(String quote) {
        return Pattern.compile("([^\\\\]|^)\\\\((?:\\\\\\\\)*)" + Pattern.quote(quote));
    }

    private static Pattern unescapedQuote(String quote) {
        return Pattern.compile("(([^\\\\]|^)(\\\\\\\\)*)" + Pattern.quote(quote));
    }

    // Matches may overlap, so a single pass can leave some behind.
    private static String subTwice(Pattern pattern, String replacement, String text) {
        String once = pattern.matcher(text).replaceAll(replacement);
        return pattern.matcher(once).replaceAll(replacement);
    }

    private static int count(String text, String needle) {
        int count = 0;
        int index = text.indexOf(needle);
        while (index >= 0) {
            count++;
            index = text.indexOf(needle, index + needle.length());
        }
        return count;
    }
}

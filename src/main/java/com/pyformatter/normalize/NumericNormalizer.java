package com.pyformatter.normalize;

import java.util.Locale;

/**
 * Normalizes numeric literals: lowercase prefixes, exponents and suffixes, uppercase hex
 * digits, and explicit zeros around the decimal point.
 */
public final class NumericNormalizer {

    private NumericNormalizer() {
    }

    public static String normalize(String literal) {
        String text = literal.toLowerCase(Locale.ROOT);
        if (text.startsWith("0b") || text.startsWith("0o")) {
            return text;
        }
        if (text.startsWith("0x")) {
            return formatHex(text);
        }
        if (text.contains("e")) {
            return formatScientific(text);
        }
        if (text.endsWith("j")) {
            return formatFloatOrInt(text.substring(0, text.length() - 1)) + "j";
        }
        return formatFloatOrInt(text);
    }

    private static String formatHex(String text) {
        return text.substring(0, 2) + text.substring(2).toUpperCase(Locale.ROOT);
    }

    private static String formatScientific(String text) {
        int e = text.indexOf('e');
        String before = text.substring(0, e);
        String after = text.substring(e + 1);
        String sign = "";
        if (after.startsWith("-")) {
            after = after.substring(1);
            sign = "-";
        } else if (after.startsWith("+")) {
            after = after.substring(1);
        }
        return formatFloatOrInt(before) + "e" + sign + after;
    }

    private static String formatFloatOrInt(String text) {
        int dot = text.indexOf('.');
        if (dot < 0) {
            return text;
        }
        String before = text.substring(0, dot);
        String after = text.substring(dot + 1);
        return (before.isEmpty() ? "0" : before) + "." + (after.isEmpty() ? "0" : after);
    }
}

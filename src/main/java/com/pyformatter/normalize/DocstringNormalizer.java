package com.pyformatter.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.pyformatter.tree.Trees;

/**
 * Re-indents docstrings and trims the whitespace around their text.
 */
public final class DocstringNormalizer {
    private static final Pattern BACKSLASH_NEWLINE = Pattern.compile("\\\\\\s*\n");

    private DocstringNormalizer() {
    }

    /**
     * Formats the docstring literal {@code value} for a body at {@code depth}.
     *
     * @param normalizeStrings whether prefix and quotes are normalized first
     * @return the new literal, or {@code value} itself when it contains a line continuation
     */
    public static String format(String value, int depth, int lineLength, boolean normalizeStrings) {
        if (BACKSLASH_NEWLINE.matcher(value).find()) {
            return value;
        }
        String docstring = value;
        if (normalizeStrings) {
            docstring = StringNormalizer.normalizeQuotes(StringNormalizer.normalizePrefix(docstring));
        }
        int prefixLength = Trees.stringPrefixLength(docstring);
        String prefix = docstring.substring(0, prefixLength);
        String literal = docstring.substring(prefixLength);
        char quoteChar = literal.charAt(0);
        int quoteLength = Trees.hasTripleQuotes(literal) ? 3 : 1;
        String body = literal.substring(quoteLength, literal.length() - quoteLength);
        boolean startedEmpty = body.isEmpty();
        String indent = "    ".repeat(depth);

        if (body.indexOf('\n') >= 0) {
            String fixed = fixDocstring(body, indent);
            String[] fixedLines = fixed.split("\n", -1);
            boolean closingOnOwnLine = fixedLines.length > 1 && fixedLines[fixedLines.length - 1].isBlank();
            body = stripTrailing(stripLeadingSpaces(fixed));
            if (closingOnOwnLine) {
                body = body + "\n" + indent;
            }
        } else {
            body = body.strip();
        }

        if (!body.isEmpty()) {
            if (body.charAt(0) == quoteChar) {
                body = " " + body;
            }
            if (body.charAt(body.length() - 1) == quoteChar) {
                body = body + " ";
            }
            if (body.charAt(body.length() - 1) == '\\') {
                int backslashes = body.length() - stripTrailingBackslashes(body).length();
                if (backslashes % 2 == 1) {
                    body = body + " ";
                }
            }
        } else if (!startedEmpty) {
            body = " ";
        }

        String quote = String.valueOf(quoteChar).repeat(quoteLength);
        if (quoteLength == 3) {
            String[] lines = body.split("\n", -1);
            int lastLineLength = body.isEmpty() ? indent.length() : lines[lines.length - 1].length();
            if (lines.length > 1 && lastLineLength + quoteLength > lineLength) {
                return prefix + quote + body + "\n" + indent + quote;
            }
        }
        return prefix + quote + body + quote;
    }

    /**
     * Removes the common indentation of all lines but the first and re-indents them with
     * {@code indent}. Whitespace-only lines become empty, except the last one which keeps the
     * indentation for the closing quotes.
     */
    static String fixDocstring(String docstring, String indent) {
        if (docstring.isEmpty()) {
            return docstring;
        }
        List<String> lines = linesWithLeadingTabsExpanded(docstring);
        int common = Integer.MAX_VALUE;
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i);
            String stripped = line.stripLeading();
            if (!stripped.isEmpty()) {
                common = Math.min(common, line.length() - stripped.length());
            }
        }
        List<String> trimmed = new ArrayList<>();
        trimmed.add(lines.get(0).strip());
        if (common < Integer.MAX_VALUE) {
            int lastIndex = lines.size() - 1;
            for (int i = 1; i < lines.size(); i++) {
                String line = lines.get(i);
                String strippedLine = line.length() > common ? stripTrailing(line.substring(common)) : "";
                if (!strippedLine.isEmpty() || i == lastIndex) {
                    trimmed.add(indent + strippedLine);
                } else {
                    trimmed.add("");
                }
            }
        }
        return String.join("\n", trimmed);
    }

    static List<String> linesWithLeadingTabsExpanded(String text) {
        List<String> lines = new ArrayList<>();
        String[] raw = text.split("\n", -1);
        for (String line : raw) {
            String stripped = line.stripLeading();
            if (stripped.isEmpty() || stripped.length() == line.length()) {
                lines.add(line);
            } else {
                int prefixLength = line.length() - stripped.length();
                lines.add(expandTabs(line.substring(0, prefixLength)) + stripped);
            }
        }
        return lines;
    }

    private static String expandTabs(String whitespace) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < whitespace.length(); i++) {
            char c = whitespace.charAt(i);
            if (c == '\t') {
                int spaces = 8 - out.length() % 8;
                out.append(" ".repeat(spaces));
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    private static String stripLeadingSpaces(String text) {
        int i = 0;
        while (i < text.length() && text.charAt(i) == ' ') {
            i++;
        }
        return text.substring(i);
    }

    private static String stripTrailing(String text) {
        int end = text.length();
        while (end > 0 && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }

    private static String stripTrailingBackslashes(String text) {
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == '\\') {
            end--;
        }
        return text.substring(0, end);
    }
}

package com.pyformatter.tokenize;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import com.pyformatter.api.error.SourceSyntaxException;
import com.pyformatter.util.LoggerUtil;

/**
 * Converts Python source text into tokens. Every character of the input is either part of a
 * token or lies in the gap between two tokens (whitespace and backslash continuations), so the
 * original text can always be rebuilt from the token spans.
 * <p>
 * The input is expected to use {@code \n} line endings; callers normalize other styles first.
 */
public class Tokenizer {
    private static final Logger logger = LoggerUtil.getLogger(Tokenizer.class);

    private static final int TAB_SIZE = 8;
    private static final int MAX_BRACKET_DEPTH = 200;
    private static final int MAX_INDENT_DEPTH = 100;

    private static final String[] OPERATORS = {
            "**=", "//=", ">>=", "<<=", "...",
            "**", "//", ">>", "<<", "<=", ">=", "==", "!=", "->", "+=", "-=", "*=", "/=", "%=",
            "&=", "|=", "^=", "@=", ":=",
            "+", "-", "*", "/", "%", "&", "|", "^", "~", "<", ">", "(", ")", "[", "]", "{", "}",
            ",", ":", ";", ".", "=", "@"
    };

    private static final Set<String> STRING_PREFIXES = Set.of(
            "r", "u", "b", "f", "br", "rb", "fr", "rf");

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private final Deque<Character> brackets = new ArrayDeque<>();

    private int pos;
    private int line = 1;
    private int lineStart;
    private boolean atLineStart = true;
    private boolean logicalLineHasContent;
    private SourceSyntaxException unclosedBracket;

    private Tokenizer(String source) {
        this.source = source;
        this.indents.push(0);
    }

    /**
     * Result of {@link #scan(String)}: the tokens and the error for a bracket still open at the
     * end of the source, if any.
     */
    public static final class Result {
        private final List<Token> tokens;
        private final SourceSyntaxException unclosedBracket;

        private Result(List<Token> tokens, SourceSyntaxException unclosedBracket) {
            this.tokens = tokens;
            this.unclosedBracket = unclosedBracket;
        }

        public List<Token> getTokens() {
            return tokens;
        }

        /**
         * The "EOF in multi-line statement" error, or null when every bracket was closed.
         */
        public SourceSyntaxException getUnclosedBracket() {
            return unclosedBracket;
        }
    }

    /**
     * Tokenizes the whole source.
     *
     * @throws SourceSyntaxException when the text is not valid Python at the lexical level
     */
    public static List<Token> tokenize(String source) throws SourceSyntaxException {
        Result result = scan(source);
        if (result.getUnclosedBracket() != null) {
            throw result.getUnclosedBracket();
        }
        return result.getTokens();
    }

    /**
     * Tokenizes the whole source, running on to the end when a bracket is never closed. In that
     * case the stream still ends with NEWLINE, DEDENT and ENDMARKER tokens so a parser can point
     * at the first token that breaks the grammar, and the bracket error is handed back instead
     * of thrown.
     *
     * @throws SourceSyntaxException for any other lexical error
     */
    public static Result scan(String source) throws SourceSyntaxException {
        Tokenizer tokenizer = new Tokenizer(source.replace("\r\n", "\n").replace('\r', '\n'));
        tokenizer.run();
        logger.finest(() -> "Produced " + tokenizer.tokens.size() + " tokens");
        return new Result(tokenizer.tokens, tokenizer.unclosedBracket);
    }

    private void run() throws SourceSyntaxException {
        int n = source.length();
        while (pos < n) {
            if (atLineStart && brackets.isEmpty()) {
                if (!readIndentation()) {
                    continue;
                }
            }
            if (pos >= n) {
                break;
            }
            char c = source.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\f') {
                pos++;
            } else if (c == '#') {
                readComment();
            } else if (c == '\n') {
                boolean logical = brackets.isEmpty() && logicalLineHasContent;
                emit(logical ? TokenType.NEWLINE : TokenType.NL, pos, pos + 1);
                pos++;
                newLine();
                if (brackets.isEmpty()) {
                    atLineStart = true;
                    logicalLineHasContent = false;
                }
            } else if (c == '\\') {
                if (pos + 1 < n && source.charAt(pos + 1) == '\n') {
                    pos += 2;
                    newLine();
                } else if (pos + 1 >= n) {
                    throw error("unexpected EOF after line continuation character");
                } else {
                    throw error("unexpected character after line continuation character");
                }
            } else if (isIdentifierStart(c)) {
                readNameOrString();
            } else if (Character.isDigit(c) || (c == '.' && pos + 1 < n && Character.isDigit(source.charAt(pos + 1)))) {
                readNumber();
            } else if (c == '"' || c == '\'') {
                readString(pos, pos);
            } else {
                readOperator();
            }
        }
        finish();
    }

    /**
     * Measures indentation at the start of a line and emits INDENT/DEDENT tokens.
     *
     * @return false when the line was blank or comment-only and has been consumed
     */
    private boolean readIndentation() throws SourceSyntaxException {
        int start = pos;
        int column = 0;
        int n = source.length();
        while (pos < n) {
            char c = source.charAt(pos);
            if (c == ' ') {
                column++;
            } else if (c == '\t') {
                column = (column / TAB_SIZE + 1) * TAB_SIZE;
            } else if (c == '\f') {
                column = 0;
            } else {
                break;
            }
            pos++;
        }
        if (pos >= n) {
            return true;
        }
        char c = source.charAt(pos);
        if (c == '#') {
            readComment();
            return false;
        }
        if (c == '\n') {
            emit(TokenType.NL, pos, pos + 1);
            pos++;
            newLine();
            return false;
        }
        if (c == '\\' && pos + 1 < n && source.charAt(pos + 1) == '\n') {
            // A continuation on an otherwise empty line joins with the next physical line.
            pos += 2;
            newLine();
            return false;
        }
        atLineStart = false;
        int current = indents.peek();
        if (column > current) {
            if (indents.size() > MAX_INDENT_DEPTH) {
                throw error("too many levels of indentation");
            }
            indents.push(column);
            tokens.add(new Token(TokenType.INDENT, source.substring(start, pos), line, 0, start, pos));
        } else {
            while (column < indents.peek()) {
                indents.pop();
                tokens.add(new Token(TokenType.DEDENT, "", line, pos - lineStart, pos, pos));
            }
            if (column != indents.peek()) {
                throw error("unindent does not match any outer indentation level");
            }
        }
        return true;
    }

    private void readComment() {
        int end = source.indexOf('\n', pos);
        if (end < 0) {
            end = source.length();
        }
        emit(TokenType.COMMENT, pos, end);
        pos = end;
    }

    private void readNameOrString() throws SourceSyntaxException {
        int start = pos;
        int n = source.length();
        pos++;
        while (pos < n && isIdentifierPart(source.charAt(pos))) {
            pos++;
        }
        String word = source.substring(start, pos);
        if (pos < n && (source.charAt(pos) == '"' || source.charAt(pos) == '\'')
                && STRING_PREFIXES.contains(word.toLowerCase())) {
            readString(start, pos);
            return;
        }
        emit(TokenType.NAME, start, pos);
    }

    private void readString(int start, int quotePos) throws SourceSyntaxException {
        int n = source.length();
        char quote = source.charAt(quotePos);
        int startLine = line;
        int startColumn = start - lineStart;
        boolean triple = quotePos + 2 < n
                && source.charAt(quotePos + 1) == quote
                && source.charAt(quotePos + 2) == quote;
        int i = quotePos + (triple ? 3 : 1);
        while (true) {
            if (i >= n) {
                throw new SourceSyntaxException(triple
                        ? "EOF while scanning triple-quoted string literal"
                        : "EOL while scanning string literal", startLine, startColumn);
            }
            char c = source.charAt(i);
            if (c == '\\') {
                if (i + 1 < n && source.charAt(i + 1) == '\n') {
                    newLineAt(i + 2);
                }
                i += 2;
                continue;
            }
            if (c == '\n') {
                if (!triple) {
                    throw new SourceSyntaxException("EOL while scanning string literal", startLine, startColumn);
                }
                newLineAt(i + 1);
                i++;
                continue;
            }
            if (c == quote) {
                if (!triple) {
                    i++;
                    break;
                }
                if (i + 2 < n && source.charAt(i + 1) == quote && source.charAt(i + 2) == quote) {
                    i += 3;
                    break;
                }
            }
            i++;
        }
        tokens.add(new Token(TokenType.STRING, source.substring(start, i), startLine, startColumn, start, i));
        logicalLineHasContent = true;
        pos = i;
    }

    private void readNumber() throws SourceSyntaxException {
        int start = pos;
        int n = source.length();
        char c = source.charAt(pos);
        if (c == '0' && pos + 1 < n && "xXoObB".indexOf(source.charAt(pos + 1)) >= 0) {
            char kind = Character.toLowerCase(source.charAt(pos + 1));
            pos += 2;
            while (pos < n && isRadixDigit(kind, source.charAt(pos))) {
                pos++;
            }
        } else {
            skipDigits();
            if (pos < n && source.charAt(pos) == '.') {
                pos++;
                skipDigits();
            }
            if (pos < n && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
                int mark = pos;
                pos++;
                if (pos < n && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                    pos++;
                }
                if (pos < n && Character.isDigit(source.charAt(pos))) {
                    skipDigits();
                } else {
                    pos = mark;
                }
            }
            if (pos < n && (source.charAt(pos) == 'j' || source.charAt(pos) == 'J')) {
                pos++;
            }
        }
        if (pos < n && (source.charAt(pos) == 'l' || source.charAt(pos) == 'L')) {
            throw error("Python 2 long integer literals are not supported");
        }
        emit(TokenType.NUMBER, start, pos);
    }

    private void skipDigits() {
        int n = source.length();
        while (pos < n && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
    }

    private static boolean isRadixDigit(char kind, char c) {
        if (c == '_') {
            return true;
        }
        return switch (kind) {
            case 'x' -> Character.digit(c, 16) >= 0;
            case 'o' -> c >= '0' && c <= '7';
            default -> c == '0' || c == '1';
        };
    }

    private void readOperator() throws SourceSyntaxException {
        for (String op : OPERATORS) {
            if (source.startsWith(op, pos)) {
                trackBracket(op);
                emit(TokenType.OP, pos, pos + op.length());
                pos += op.length();
                return;
            }
        }
        throw error("invalid character '" + source.charAt(pos) + "'");
    }

    private void trackBracket(String op) throws SourceSyntaxException {
        char c = op.charAt(0);
        if (op.length() != 1) {
            return;
        }
        if (c == '(' || c == '[' || c == '{') {
            if (brackets.size() >= MAX_BRACKET_DEPTH) {
                throw error("too many nested parentheses");
            }
            brackets.push(c);
        } else if (c == ')' || c == ']' || c == '}') {
            if (brackets.isEmpty()) {
                throw error("unmatched '" + c + "'");
            }
            char open = brackets.pop();
            if ((open == '(' && c != ')') || (open == '[' && c != ']') || (open == '{' && c != '}')) {
                throw error("closing parenthesis '" + c + "' does not match opening parenthesis '" + open + "'");
            }
        }
    }

    private void finish() throws SourceSyntaxException {
        if (!brackets.isEmpty()) {
            unclosedBracket = error("EOF in multi-line statement");
        }
        int end = source.length();
        if (logicalLineHasContent) {
            tokens.add(new Token(TokenType.NEWLINE, "", line, end - lineStart, end, end));
        }
        while (indents.size() > 1) {
            indents.pop();
            tokens.add(new Token(TokenType.DEDENT, "", line, end - lineStart, end, end));
        }
        tokens.add(new Token(TokenType.ENDMARKER, "", line, end - lineStart, end, end));
    }

    private void emit(TokenType type, int start, int end) {
        tokens.add(new Token(type, source.substring(start, end), line, start - lineStart, start, end));
        if (type != TokenType.COMMENT && type != TokenType.NL && type != TokenType.NEWLINE) {
            logicalLineHasContent = true;
        }
    }

    private void newLine() {
        line++;
        lineStart = pos;
    }

    private void newLineAt(int offset) {
        line++;
        lineStart = offset;
    }

    private SourceSyntaxException error(String message) {
        return new SourceSyntaxException("Cannot tokenize: " + message, line, pos - lineStart);
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isLetter(c) || (c > 127 && Character.isUnicodeIdentifierStart(c));
    }

    private static boolean isIdentifierPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c) || (c > 127 && Character.isUnicodeIdentifierPart(c));
    }
}

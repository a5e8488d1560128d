package com.pyformatter.tokenize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.pyformatter.api.error.SourceSyntaxException;

class TokenizerTest {

    private static List<TokenType> types(String source) throws SourceSyntaxException {
        return Tokenizer.tokenize(source).stream().map(Token::getType).collect(Collectors.toList());
    }

    @Test
    void simpleAssignment() throws SourceSyntaxException {
        List<Token> tokens = Tokenizer.tokenize("x = 1\n");
        assertEquals(List.of(TokenType.NAME, TokenType.OP, TokenType.NUMBER, TokenType.NEWLINE, TokenType.ENDMARKER),
                tokens.stream().map(Token::getType).collect(Collectors.toList()));
        assertEquals("x", tokens.get(0).getValue());
        assertEquals(1, tokens.get(0).getLine());
        assertEquals(0, tokens.get(0).getColumn());
        assertEquals(4, tokens.get(2).getColumn());
    }

    @Test
    void indentationProducesIndentAndDedent() throws SourceSyntaxException {
        List<TokenType> types = types("if x:\n    y\nz\n");
        assertEquals(List.of(
                TokenType.NAME, TokenType.NAME, TokenType.OP, TokenType.NEWLINE,
                TokenType.INDENT, TokenType.NAME, TokenType.NEWLINE,
                TokenType.DEDENT, TokenType.NAME, TokenType.NEWLINE,
                TokenType.ENDMARKER), types);
    }

    @Test
    void newlinesInsideBracketsAreNonLogical() throws SourceSyntaxException {
        List<TokenType> types = types("f(a,\n  b)\n");
        assertEquals(1, types.stream().filter(t -> t == TokenType.NEWLINE).count());
        assertTrue(types.contains(TokenType.NL));
    }

    @Test
    void commentsAndBlankLinesAreKept() throws SourceSyntaxException {
        List<Token> tokens = Tokenizer.tokenize("# hello\n\nx = 1  # trailing\n");
        assertEquals(TokenType.COMMENT, tokens.get(0).getType());
        assertEquals("# hello", tokens.get(0).getValue());
        assertTrue(tokens.stream().anyMatch(t -> t.getType() == TokenType.COMMENT && t.getValue().equals("# trailing")));
    }

    @Test
    void stringPrefixesAndTripleQuotes() throws SourceSyntaxException {
        List<Token> tokens = Tokenizer.tokenize("s = rb'a\\'b' + f\"\"\"x\ny\"\"\"\n");
        List<String> strings = tokens.stream()
                .filter(t -> t.getType() == TokenType.STRING)
                .map(Token::getValue)
                .collect(Collectors.toList());
        assertEquals(List.of("rb'a\\'b'", "f\"\"\"x\ny\"\"\""), strings);
    }

    @Test
    void numbersInAllRadixes() throws SourceSyntaxException {
        List<String> numbers = Tokenizer.tokenize("a = 0xFF + 0o17 + 0b1_0 + 1.5e-3 + 10j + .5\n").stream()
                .filter(t -> t.getType() == TokenType.NUMBER)
                .map(Token::getValue)
                .collect(Collectors.toList());
        assertEquals(List.of("0xFF", "0o17", "0b1_0", "1.5e-3", "10j", ".5"), numbers);
    }

    @Test
    void longestOperatorWins() throws SourceSyntaxException {
        List<String> ops = Tokenizer.tokenize("x **= y // z\n").stream()
                .filter(t -> t.getType() == TokenType.OP)
                .map(Token::getValue)
                .collect(Collectors.toList());
        assertEquals(List.of("**=", "//"), ops);
    }

    @Test
    void backslashContinuationJoinsLines() throws SourceSyntaxException {
        List<TokenType> types = types("x = 1 + \\\n    2\n");
        assertEquals(1, types.stream().filter(t -> t == TokenType.NEWLINE).count());
        assertTrue(types.stream().noneMatch(t -> t == TokenType.INDENT));
    }

    @Test
    void unterminatedStringIsSyntaxError() {
        SourceSyntaxException e = assertThrows(SourceSyntaxException.class, () -> Tokenizer.tokenize("x = 'abc\n"));
        assertEquals(1, e.getLine());
    }

    @Test
    void unmatchedBracketIsSyntaxError() {
        assertThrows(SourceSyntaxException.class, () -> Tokenizer.tokenize("x = (1, 2\n"));
        assertThrows(SourceSyntaxException.class, () -> Tokenizer.tokenize("x = 1)\n"));
        assertThrows(SourceSyntaxException.class, () -> Tokenizer.tokenize("x = (1]\n"));
    }

    @Test
    void inconsistentDedentIsSyntaxError() {
        assertThrows(SourceSyntaxException.class, () -> Tokenizer.tokenize("if x:\n        a\n    b\n"));
    }

    @Test
    void missingFinalNewlineStillEndsLogicalLine() throws SourceSyntaxException {
        List<TokenType> types = types("x");
        assertEquals(List.of(TokenType.NAME, TokenType.NEWLINE, TokenType.ENDMARKER), types);
    }
}

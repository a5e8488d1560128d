package com.pyformatter.lines;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.pyformatter.api.FormatOptions;
import com.pyformatter.api.error.SourceSyntaxException;
import com.pyformatter.tree.TreeBuilder;

class LineGeneratorTest {

    private static List<Line> generate(String source, FormatOptions options) throws SourceSyntaxException {
        return new LineGenerator(options).generate(TreeBuilder.parse(source));
    }

    private static List<String> render(String source) throws SourceSyntaxException {
        return generate(source, FormatOptions.defaults()).stream()
                .map(Line::toString)
                .collect(Collectors.toList());
    }

    @Test
    void oneLinePerStatementWithNormalizedWhitespace() throws SourceSyntaxException {
        assertEquals(List.of("x = 1\n", "if a:\n", "    b(c, d)\n"),
                render("x=1\nif a :\n  b( c,d )\n"));
    }

    @Test
    void semicolonsSplitStatements() throws SourceSyntaxException {
        assertEquals(List.of("a = 1\n", "b = 2\n"), render("a = 1; b = 2\n"));
    }

    @Test
    void compoundBodiesOnTheHeaderLineMoveDown() throws SourceSyntaxException {
        assertEquals(List.of("while x:\n", "    y()\n"), render("while x: y()\n"));
    }

    @Test
    void trailingCommentsStayAttached() throws SourceSyntaxException {
        List<Line> lines = generate("x = 1  # one\n", FormatOptions.defaults());
        assertEquals(1, lines.size());
        assertEquals("x = 1  # one\n", lines.get(0).toString());
    }

    @Test
    void standaloneCommentsGetTheirOwnLine() throws SourceSyntaxException {
        List<Line> lines = generate("#comment\nx = 1\n", FormatOptions.defaults());
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).isComment());
        assertEquals("# comment\n", lines.get(0).toString());
    }

    @Test
    void stringQuotesAreNormalized() throws SourceSyntaxException {
        assertEquals(List.of("s = \"hello\"\n"), render("s = 'hello'\n"));
        assertEquals(List.of("s = 'say \"hi\"'\n"), render("s = 'say \"hi\"'\n"));
    }

    @Test
    void skipStringNormalizationKeepsQuotes() throws SourceSyntaxException {
        FormatOptions options = FormatOptions.builder().skipStringNormalization(true).build();
        assertEquals("s = 'hello'\n", generate("s = 'hello'\n", options).get(0).toString());
    }

    @Test
    void numericLiteralsAreNormalized() throws SourceSyntaxException {
        assertEquals(List.of("x = 0xABCDEF + 1e5 + 10j\n"), render("x = 0XabcDEF + 1E5 + 10J\n"));
    }

    @Test
    void redundantParenthesesAroundReturnValueDisappear() throws SourceSyntaxException {
        assertEquals(List.of("def f():\n", "    return 1\n"), render("def f():\n    return (1)\n"));
    }

    @Test
    void magicTrailingCommaIsRecorded() throws SourceSyntaxException {
        Line withComma = generate("f(a, b,)\n", FormatOptions.defaults()).get(0);
        assertNotNull(withComma.getMagicTrailingComma());

        Line withoutComma = generate("f(a, b)\n", FormatOptions.defaults()).get(0);
        assertNull(withoutComma.getMagicTrailingComma());
    }

    @Test
    void skippingMagicTrailingCommaIgnoresIt() throws SourceSyntaxException {
        FormatOptions options = FormatOptions.builder().skipMagicTrailingComma(true).build();
        Line line = generate("f(a, b,)\n", options).get(0);
        assertNull(line.getMagicTrailingComma());
    }

    @Test
    void depthFollowsIndentation() throws SourceSyntaxException {
        List<Line> lines = generate("class A:\n    def f(self):\n        pass\n", FormatOptions.defaults());
        assertEquals(List.of(0, 1, 2), lines.stream().map(Line::getDepth).collect(Collectors.toList()));
        assertTrue(lines.get(0).isClass());
        assertTrue(lines.get(1).isDef());
        assertTrue(lines.get(2).isFlowControlOrPass());
    }
}

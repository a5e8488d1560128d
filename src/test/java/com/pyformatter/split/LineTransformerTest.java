package com.pyformatter.split;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.pyformatter.api.Feature;
import com.pyformatter.api.FormatOptions;
import com.pyformatter.api.error.SourceSyntaxException;
import com.pyformatter.lines.Line;
import com.pyformatter.lines.LineGenerator;
import com.pyformatter.tree.TreeBuilder;

class LineTransformerTest {

    private static final Set<Feature> NO_FEATURES = EnumSet.noneOf(Feature.class);

    private static List<Line> lines(String source, FormatOptions options) throws SourceSyntaxException {
        return new LineGenerator(options).generate(TreeBuilder.parse(source));
    }

    private static List<String> split(String source, int lineLength) throws SourceSyntaxException {
        FormatOptions options = FormatOptions.builder().lineLength(lineLength).build();
        Line line = lines(source, options).get(0);
        return LineTransformer.transform(line, options, NO_FEATURES).stream()
                .map(Line::toString)
                .collect(Collectors.toList());
    }

    @Test
    void shortLineIsReturnedAsIs() throws SourceSyntaxException {
        FormatOptions options = FormatOptions.defaults();
        Line line = lines("foo(a, b)\n", options).get(0);
        List<Line> result = LineTransformer.transform(line, options, NO_FEATURES);
        assertEquals(1, result.size());
        assertSame(line, result.get(0));
    }

    @Test
    void rightHandSplitThenDelimiterSplit() throws SourceSyntaxException {
        assertEquals(List.of("foo(\n", "    aaa,\n", "    bbb,\n", "    ccc,\n", ")\n"),
                split("foo(aaa, bbb, ccc)\n", 10));
    }

    @Test
    void bodyThatFitsStaysOnOneLine() throws SourceSyntaxException {
        assertEquals(List.of("foo(\n", "    aaa, bbb\n", ")\n"), split("foo(aaa, bbb)\n", 12));
    }

    @Test
    void definitionsSplitFromTheLeft() throws SourceSyntaxException {
        assertEquals(List.of("def f(\n", "    a, b\n", "):\n"), split("def f(a, b):\n    pass\n", 10));
    }

    @Test
    void lineWithoutBracketsCannotBeSplit() throws SourceSyntaxException {
        List<String> result = split("some_rather_long_name_here\n", 10);
        assertEquals(List.of("some_rather_long_name_here\n"), result);
    }

    @Test
    void magicTrailingCommaForcesSplitEvenWhenShort() throws SourceSyntaxException {
        assertEquals(List.of("f(\n", "    a,\n", ")\n"), split("f(a,)\n", 88));
    }

    @Test
    void lineLengthHelpers() throws SourceSyntaxException {
        FormatOptions options = FormatOptions.defaults();
        Line line = lines("x = 1\n", options).get(0);
        assertEquals("x = 1", LineTransformer.lineToString(line));
        assertTrue(LineTransformer.isLineShortEnough(line, 5));
        assertFalse(LineTransformer.isLineShortEnough(line, 4));
    }

    @Test
    void canBeSplitRequiresATrailerOrDelimiter() throws SourceSyntaxException {
        FormatOptions options = FormatOptions.defaults();
        assertFalse(RightHandSplit.canBeSplit(lines("x\n", options).get(0)));
    }
}

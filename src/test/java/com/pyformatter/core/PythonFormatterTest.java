package com.pyformatter.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.pyformatter.api.FormatOptions;
import com.pyformatter.api.FormatterResult;
import com.pyformatter.api.LineRange;
import com.pyformatter.api.TargetVersion;
import com.pyformatter.api.error.ErrorCategory;
import com.pyformatter.api.error.FormatterError;
import com.pyformatter.api.error.Severity;

class PythonFormatterTest {

    private final PythonFormatter formatter = new PythonFormatter();

    private String format(String source) {
        return format(source, FormatOptions.defaults());
    }

    private String format(String source, FormatOptions options) {
        FormatterResult result = formatter.format(source, options);
        assertTrue(result.isSuccessful(), () -> "formatting failed: " + result.getErrors().stream()
                .map(FormatterError::getMessage).reduce("", (a, b) -> a + b));
        return result.getFormattedCode();
    }

    private void assertFormat(String expected, String source) {
        assertEquals(expected, format(source));
        assertEquals(expected, format(expected), "formatting is not idempotent");
    }

    @Test
    void shortCollectionIsJoined() {
        assertFormat("j = [1, 2, 3]\n", "j = [1,\n 2,\n 3\n]\n");
    }

    @Test
    void magicTrailingCommaKeepsCollectionExploded() {
        assertFormat("d = {\n    \"a\": 1,\n}\n", "d = {\n \"a\": 1,\n}\n");
    }

    @Test
    void magicTrailingCommaIsIgnoredWhenSkipped() {
        FormatOptions options = FormatOptions.builder().skipMagicTrailingComma(true).build();
        assertEquals("d = {\"a\": 1}\n", format("d = {\n \"a\": 1,\n}\n", options));
    }

    @Test
    void longCallWrapsArgumentsOneLevelDeeper() {
        assertFormat(
                "result = some_function_name(\n"
                        + "    argument_number_one, argument_number_two, argument_number_three\n"
                        + ")\n",
                "result = some_function_name(argument_number_one, argument_number_two, argument_number_three)\n");
    }

    @Test
    void longDefinitionSplitsAfterTheOpeningParenthesis() {
        assertFormat(
                "def function_name(\n"
                        + "    argument_one, argument_two, argument_three, argument_four, argument_five\n"
                        + "):\n"
                        + "    pass\n",
                "def function_name(argument_one, argument_two, argument_three, argument_four, argument_five):\n"
                        + "    pass\n");
    }

    @Test
    void longConditionSplitsAtBooleanOperators() {
        assertFormat(
                "if (\n"
                        + "    some_long_condition_name\n"
                        + "    and another_long_condition_name\n"
                        + "    or yet_another_condition_name_here\n"
                        + "):\n"
                        + "    pass\n",
                "if some_long_condition_name and another_long_condition_name or yet_another_condition_name_here:\n"
                        + "    pass\n");
    }

    @Test
    void explodedCallKeepsOneArgumentPerLine() {
        assertFormat("foo(\n    a,\n    b,\n)\n", "foo(a, b,)\n");
    }

    @Test
    void backslashContinuationIsRemoved() {
        assertFormat("x = 1 + 2\n", "x = 1 + \\\n    2\n");
    }

    @Test
    void redundantParenthesesAreRemoved() {
        assertFormat("x = 1\n", "x = (1)\n");
        assertFormat("if a:\n    pass\n", "if (a):\n    pass\n");
        assertFormat("print(\"hello\")\n", "print('hello')\n");
    }

    @Test
    void blankLinesAroundTopLevelDefinitions() {
        assertFormat("import os\n\n\ndef f():\n    pass\n\n\nx = 1\n",
                "import os\ndef f():\n    pass\nx = 1\n");
    }

    @Test
    void excessBlankLinesAreCollapsed() {
        assertFormat("x = 1\n\n\ny = 2\n", "x = 1\n\n\n\n\n\ny = 2\n");
    }

    @Test
    void formFeedBetweenTopLevelStatementsIsKept() {
        assertFormat("x = 1\n\n\f\ny = 2\n", "x = 1\n\f\n\f\n\f\ny = 2\n");
        assertEquals("x = 1\n\n\f\ny = 2\n", format("x = 1\n\n\f\ny = 2\n"));
    }

    @Test
    void formFeedInsideBlockIsDropped() {
        assertFormat("if x:\n    a = 1\n\n    b = 2\n", "if x:\n    a = 1\n\f\n    b = 2\n");
    }

    @Test
    void blankLineAfterModuleDocstring() {
        assertFormat("\"\"\"Doc.\"\"\"\n\nimport os\n", "'''Doc.'''\nimport os\n");
    }

    @Test
    void commentsAreSpacedFromCode() {
        assertFormat("x = 1  # c\n", "x = 1 # c\n");
    }

    @Test
    void fmtOffRegionIsLeftAlone() {
        String source = "# fmt: off\nx = [1,2,\n  3]\n# fmt: on\ny=1\n";
        assertEquals("# fmt: off\nx = [1,2,\n  3]\n# fmt: on\ny = 1\n", format(source));
    }

    @Test
    void fmtSkipLeavesOneStatementAlone() {
        assertEquals("x=1  # fmt: skip\ny = 2\n", format("x=1  # fmt: skip\ny=2\n"));
    }

    @Test
    void onlyRequestedLinesAreFormatted() {
        FormatOptions options = FormatOptions.builder().addLineRange(new LineRange(2, 2)).build();
        assertEquals("x=1\ny = 2\nz=3\n", format("x=1\ny=2\nz=3\n", options));
    }

    @Test
    void crlfLineEndingsArePreserved() {
        assertEquals("x = 1\r\ny = 2\r\n", format("x=1\r\ny=2\r\n"));
    }

    @Test
    void missingFinalNewlineIsAdded() {
        assertEquals("x = 1\n", format("x=1"));
    }

    @Test
    void leadingBlankLinesAreRemoved() {
        assertEquals("x = 1\n", format("\n\n\nx = 1\n"));
    }

    @Test
    void blankInput() {
        FormatterResult empty = formatter.format("", FormatOptions.defaults());
        assertEquals(FormatterResult.Outcome.UNCHANGED, empty.getOutcome());
        assertEquals("", empty.getFormattedCode());

        FormatterResult blank = formatter.format("\n\n  \n", FormatOptions.defaults());
        assertEquals(FormatterResult.Outcome.REFORMATTED, blank.getOutcome());
        assertEquals("\n", blank.getFormattedCode());
    }

    @Test
    void unchangedSourceIsReportedAsSuch() {
        FormatterResult result = formatter.format("x = 1\n", FormatOptions.defaults());
        assertEquals(FormatterResult.Outcome.UNCHANGED, result.getOutcome());
        assertFalse(result.isChanged());
        assertTrue(result.getErrors().isEmpty());
    }

    @Test
    void diffModeReturnsUnifiedDiff() {
        FormatOptions options = FormatOptions.builder().diff(true).build();
        FormatterResult result = formatter.format("x=1\n", options);
        assertEquals(FormatterResult.Outcome.DIFF, result.getOutcome());
        assertEquals("x = 1\n", result.getFormattedCode());
        assertTrue(result.getDiff().contains("-x=1"));
        assertTrue(result.getDiff().contains("+x = 1"));
    }

    @Test
    void syntaxErrorFailsWithInputUntouched() {
        String source = "def f(:\n    pass\n";
        FormatterResult result = formatter.format(source, FormatOptions.defaults());
        assertEquals(FormatterResult.Outcome.FAILED, result.getOutcome());
        assertEquals(source, result.getFormattedCode());
        FormatterError error = result.getErrors().get(0);
        assertEquals(Severity.FATAL, error.getSeverity());
        assertEquals(ErrorCategory.SYNTAX, error.getCategory());
        assertEquals(1, error.getLine());
    }

    @Test
    void exceptStarKeepsTheStarOnTheKeyword() {
        assertFormat("try:\n    pass\nexcept* ValueError as e:\n    pass\n",
                "try:\n    pass\nexcept *ValueError as e:\n    pass\n");
    }

    @Test
    void typeParametersAreFormatted() {
        assertFormat("def f[T](x: T) -> T:\n    return x\n", "def f [ T ] (x: T) -> T:\n    return x\n");
        assertFormat("class C[T: int, *Ts, **P]:\n    pass\n", "class C[ T:int,* Ts,** P ]:\n    pass\n");
        assertFormat("type Point = tuple[float, float]\n", "type Point=tuple[float,float]\n");
    }

    @Test
    void typeParametersNeedPython312Targets() {
        FormatOptions options = FormatOptions.builder().addTargetVersion(TargetVersion.PY311).build();
        FormatterResult result = formatter.format("type X = int\n", options);
        assertEquals(FormatterResult.Outcome.FAILED, result.getOutcome());
        assertEquals(ErrorCategory.UNSUPPORTED, result.getErrors().get(0).getCategory());
    }

    @Test
    void featureNewerThanTargetsIsUnsupported() {
        FormatOptions options = FormatOptions.builder().addTargetVersion(TargetVersion.PY37).build();
        FormatterResult result = formatter.format("if (n := 10) > 5:\n    pass\n", options);
        assertEquals(FormatterResult.Outcome.FAILED, result.getOutcome());
        assertEquals(ErrorCategory.UNSUPPORTED, result.getErrors().get(0).getCategory());
    }

    @Test
    void featureSupportedByTargetsIsFormatted() {
        FormatOptions options = FormatOptions.builder().addTargetVersion(TargetVersion.PY38).build();
        assertEquals("if (n := 10) > 5:\n    pass\n", format("if (n:=10) > 5:\n    pass\n", options));
    }

    @Test
    void divergentOutputIsAnInternalError() {
        PythonFormatter broken = new PythonFormatter() {
            @Override
            public String formatText(String source, FormatOptions options) {
                return "x = 2\n";
            }
        };
        String source = "x = 1\n";
        FormatterResult result = broken.format(source, FormatOptions.defaults());
        assertEquals(FormatterResult.Outcome.FAILED, result.getOutcome());
        assertEquals(source, result.getFormattedCode());
        FormatterError error = result.getErrors().get(0);
        assertEquals(ErrorCategory.INTERNAL, error.getCategory());
        assertNotNull(error.getDiagnostic());
    }

    @Test
    void fastModeSkipsTheSafetyChecks() {
        PythonFormatter broken = new PythonFormatter() {
            @Override
            public String formatText(String source, FormatOptions options) {
                return "x = 2\n";
            }
        };
        FormatterResult result = broken.format("x = 1\n", FormatOptions.builder().fast(true).build());
        assertEquals(FormatterResult.Outcome.REFORMATTED, result.getOutcome());
        assertNull(result.getDiff());
    }

    @Test
    void unexpectedRuntimeFailureIsContained() {
        PythonFormatter broken = new PythonFormatter() {
            @Override
            public String formatText(String source, FormatOptions options) {
                throw new IllegalStateException("boom");
            }
        };
        FormatterResult result = broken.format("x = 1\n", FormatOptions.defaults());
        assertEquals(FormatterResult.Outcome.FAILED, result.getOutcome());
        assertEquals(ErrorCategory.INTERNAL, result.getErrors().get(0).getCategory());
    }

    @Test
    void newlineStyleDetection() {
        assertEquals("\r\n", PythonFormatter.detectNewline("a\r\nb\n"));
        assertEquals("\n", PythonFormatter.detectNewline("a\nb\r\n"));
        assertEquals("\n", PythonFormatter.detectNewline("a"));
    }
}

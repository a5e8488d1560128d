package com.pyformatter.safety;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;

import org.junit.jupiter.api.Test;

import com.pyformatter.api.TargetVersion;
import com.pyformatter.api.error.ErrorCategory;
import com.pyformatter.api.error.InternalFormatterException;
import com.pyformatter.api.error.SourceSyntaxException;

class EquivalenceCheckerTest {

    private final EquivalenceChecker checker = new EquivalenceChecker();

    private void assertSame(String src, String dst) {
        assertDoesNotThrow(() -> checker.assertEquivalent(src, dst, Set.of()));
    }

    private InternalFormatterException assertDifferent(String src, String dst) {
        return assertThrows(InternalFormatterException.class, () -> checker.assertEquivalent(src, dst, Set.of()));
    }

    @Test
    void layoutChangesAreEquivalent() {
        assertSame("x=1\n", "x = 1\n");
        assertSame("f(a,\n  b)\n", "f(a, b)\n");
        assertSame("x = [\n    1,\n    2,\n]\n", "x = [1, 2]\n");
        assertSame("x = 1 + \\\n    2\n", "x = 1 + 2\n");
    }

    @Test
    void groupingParenthesesDoNotMatter() {
        assertSame("x = (1)\n", "x = 1\n");
        assertSame("if (a):\n    pass\n", "if a:\n    pass\n");
        assertSame("del (a, b)\n", "del a, b\n");
        assertSame("for (x) in y:\n    pass\n", "for x in y:\n    pass\n");
    }

    @Test
    void literalSpellingDoesNotMatter() {
        assertSame("x = 'a'\n", "x = \"a\"\n");
        assertSame("x = 'it\\'s'\n", "x = \"it's\"\n");
        assertSame("x = 0XFF\n", "x = 0xFF\n");
        assertSame("x = 1E5\n", "x = 1e5\n");
        assertSame("x = u'a'\n", "x = 'a'\n");
    }

    @Test
    void docstringWhitespaceDoesNotMatter() {
        assertSame("def f():\n    '''   Doc.\n\n      more   '''\n",
                "def f():\n    \"\"\"Doc.\n\n    more\"\"\"\n");
    }

    @Test
    void commentsAndStatementJoiningDoNotMatter() {
        assertSame("x = 1 # c\n", "x = 1\n# c\n");
        assertSame("a = 1; b = 2\n", "a = 1\nb = 2\n");
        assertSame("if x: y()\n", "if x:\n    y()\n");
    }

    @Test
    void changedValuesAreDetected() {
        InternalFormatterException e = assertDifferent("x = 1\n", "x = 2\n");
        assertEquals(ErrorCategory.INTERNAL, e.getCategory());
        assertNotNull(e.getDiagnostic());
        assertTrue(e.getDiagnostic().contains("NUMBER"));
        assertDifferent("x = 'a'\n", "x = b'a'\n");
        assertDifferent("f(a, b)\n", "f(b, a)\n");
    }

    @Test
    void tuplesAreNotGroupingParentheses() {
        assertDifferent("x = (1,)\n", "x = (1)\n");
        assertDifferent("x = ()\n", "x = None\n");
        assertDifferent("x = a, b\n", "x = [a, b]\n");
    }

    @Test
    void invalidOutputIsAnInternalError() {
        InternalFormatterException e = assertDifferent("x = (1)\n", "x = (1\n");
        assertTrue(e.getMessage().startsWith("INTERNAL ERROR: produced invalid code"));
    }

    @Test
    void invalidSourceIsASyntaxError() {
        assertThrows(SourceSyntaxException.class, () -> checker.assertEquivalent("x = (\n", "x = 1\n", Set.of()));
    }

    @Test
    void targetVersionsAppearInTheMessage() {
        InternalFormatterException e = assertThrows(InternalFormatterException.class,
                () -> checker.assertEquivalent("x = 1\n", "x = (\n", Set.of(TargetVersion.PY38)));
        assertTrue(e.getMessage().contains("3.8"));
    }

    @Test
    void stableOutputPasses() {
        assertDoesNotThrow(() -> checker.assertStable("x=1\n", "x = 1\n", text -> text));
    }

    @Test
    void unstableOutputIsAnInternalError() {
        InternalFormatterException e = assertThrows(InternalFormatterException.class,
                () -> checker.assertStable("x=1\n", "x = 1\n", text -> text + "\n"));
        assertEquals("INTERNAL ERROR: produced different code on the second pass of the formatter", e.getMessage());
        assertTrue(e.getDiagnostic().contains("second pass"));
    }
}

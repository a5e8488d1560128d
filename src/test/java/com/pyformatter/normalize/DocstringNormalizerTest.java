package com.pyformatter.normalize;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class DocstringNormalizerTest {

    @Test
    void singleLineDocstringIsStripped() {
        assertEquals("\"\"\"Doc.\"\"\"", DocstringNormalizer.format("'''   Doc.   '''", 1, 88, true));
    }

    @Test
    void quotesAreKeptWithoutStringNormalization() {
        assertEquals("'''Doc.'''", DocstringNormalizer.format("'''Doc.  '''", 0, 88, false));
    }

    @Test
    void multiLineDocstringIsReindented() {
        String value = "'''\n        Line one.\n\n          Indented.\n        '''";
        assertEquals("\"\"\"\n    Line one.\n\n      Indented.\n    \"\"\"",
                DocstringNormalizer.format(value, 1, 88, true));
    }

    @Test
    void quoteAtTheEdgeIsPadded() {
        assertEquals("\"\"\" \"quoted\" \"\"\"",
                DocstringNormalizer.format("\"\"\"\"quoted\"\"\"\"", 0, 88, true));
    }

    @Test
    void emptyDocstringBecomesOneSpace() {
        assertEquals("\"\"\" \"\"\"", DocstringNormalizer.format("'''   '''", 0, 88, true));
    }

    @Test
    void lineContinuationLeavesDocstringUntouched() {
        String value = "'''a \\\n b'''";
        assertEquals(value, DocstringNormalizer.format(value, 0, 88, true));
    }

    @Test
    void commonIndentationIsRemoved() {
        assertEquals("first\n  a\n\n  b", DocstringNormalizer.fixDocstring("first\n    a\n\n    b", "  "));
    }
}

package com.pyformatter.normalize;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class StringNormalizerTest {

    @Test
    void prefixLettersAreNormalized() {
        assertEquals("'x'", StringNormalizer.normalizePrefix("U'x'"));
        assertEquals("'x'", StringNormalizer.normalizePrefix("u'x'"));
        assertEquals("f'x'", StringNormalizer.normalizePrefix("F'x'"));
        assertEquals("b'x'", StringNormalizer.normalizePrefix("B'x'"));
        assertEquals("R'x'", StringNormalizer.normalizePrefix("R'x'"));
    }

    @Test
    void rawMarkerMovesToTheFront() {
        assertEquals("Rb'x'", StringNormalizer.normalizePrefix("bR'x'"));
        assertEquals("rb'x'", StringNormalizer.normalizePrefix("Br'x'"));
        assertEquals("Rb'x'", StringNormalizer.normalizePrefix("Rb'x'"));
    }

    @Test
    void doubleQuotesArePreferred() {
        assertEquals("\"hello\"", StringNormalizer.normalizeQuotes("'hello'"));
        assertEquals("\"\"\"doc\"\"\"", StringNormalizer.normalizeQuotes("'''doc'''"));
        assertEquals("\"\"", StringNormalizer.normalizeQuotes("''"));
    }

    @Test
    void quotesThatWouldNeedMoreEscapesStay() {
        assertEquals("'say \"hi\"'", StringNormalizer.normalizeQuotes("'say \"hi\"'"));
        assertEquals("\"it's\"", StringNormalizer.normalizeQuotes("\"it's\""));
    }

    @Test
    void unnecessaryEscapesAreDropped() {
        assertEquals("\"it's\"", StringNormalizer.normalizeQuotes("'it\\'s'"));
    }

    @Test
    void rawStringsWithTheOtherQuoteStay() {
        assertEquals("r'a\"b'", StringNormalizer.normalizeQuotes("r'a\"b'"));
        assertEquals("r\"a\\b\"", StringNormalizer.normalizeQuotes("r'a\\b'"));
    }

    @Test
    void fStringFieldsNeverGainBackslashes() {
        String literal = "f'{x[\"a\"]}'";
        assertEquals(literal, StringNormalizer.normalizeQuotes(literal));
    }

    @Test
    void escapeSequencesAreNormalized() {
        assertEquals("'\\xab'", StringNormalizer.normalizeUnicodeEscapeSequences("'\\xAB'"));
        assertEquals("'\\u00e9'", StringNormalizer.normalizeUnicodeEscapeSequences("'\\u00E9'"));
        assertEquals("'\\N{BULLET}'", StringNormalizer.normalizeUnicodeEscapeSequences("'\\N{bullet}'"));
    }

    @Test
    void escapedBackslashesAndRawOrBytesLiteralsAreLeftAlone() {
        assertEquals("'\\\\xAB'", StringNormalizer.normalizeUnicodeEscapeSequences("'\\\\xAB'"));
        assertEquals("r'\\xAB'", StringNormalizer.normalizeUnicodeEscapeSequences("r'\\xAB'"));
        assertEquals("b'\\xAB'", StringNormalizer.normalizeUnicodeEscapeSequences("b'\\xAB'"));
    }
}

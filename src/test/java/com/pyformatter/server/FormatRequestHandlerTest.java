package com.pyformatter.server;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.EnumSet;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.pyformatter.api.FormatOptions;
import com.pyformatter.api.FormatterResult;
import com.pyformatter.api.Preview;
import com.pyformatter.api.TargetVersion;
import com.pyformatter.api.error.ErrorCategory;
import com.pyformatter.api.error.FormatterError;
import com.pyformatter.api.error.Severity;
import com.pyformatter.core.PythonFormatter;

class FormatRequestHandlerTest {

    private final FormatRequestHandler handler = new FormatRequestHandler(new PythonFormatter());

    @Test
    void changedSourceIsReturnedWith200() {
        FormatResponse response = handler.handle(Map.of(), "x=1\n");
        assertEquals(FormatResponse.OK, response.getStatus());
        assertEquals("x = 1\n", response.getBody());
        assertEquals("1", response.getHeaders().get("X-Protocol-Version"));
    }

    @Test
    void unchangedSourceGives204() {
        FormatResponse response = handler.handle(Map.of(), "x = 1\n");
        assertEquals(FormatResponse.NO_CHANGES, response.getStatus());
        assertEquals("", response.getBody());
    }

    @Test
    void syntaxErrorGives400() {
        FormatResponse response = handler.handle(Map.of(), "def f(:\n");
        assertEquals(FormatResponse.BAD_REQUEST, response.getStatus());
        assertTrue(response.getBody().startsWith("Cannot parse: 1:"));
    }

    @Test
    void internalErrorGives500() {
        FormatRequestHandler failing = new FormatRequestHandler((source, options) -> FormatterResult.builder()
                .outcome(FormatterResult.Outcome.FAILED)
                .formattedCode(source)
                .addError(new FormatterError(Severity.FATAL, ErrorCategory.INTERNAL, "INTERNAL ERROR: x", 0, 0))
                .build());
        FormatResponse response = failing.handle(Map.of(), "x = 1\n");
        assertEquals(FormatResponse.INTERNAL_ERROR, response.getStatus());
        assertEquals("INTERNAL ERROR: x", response.getBody());
    }

    @Test
    void unsupportedProtocolVersionIsRejected() {
        assertEquals(FormatResponse.BAD_REQUEST, handler.handle(Map.of("X-Protocol-Version", "2"), "x\n").getStatus());
        assertEquals(FormatResponse.NO_CHANGES, handler.handle(Map.of("X-Protocol-Version", "1"), "x\n").getStatus());
    }

    @Test
    void invalidHeadersAreRejected() {
        assertEquals(FormatResponse.BAD_REQUEST, handler.handle(Map.of("X-Line-Length", "abc"), "x\n").getStatus());
        assertEquals(FormatResponse.BAD_REQUEST, handler.handle(Map.of("X-Line-Length", "0"), "x\n").getStatus());
        assertEquals(FormatResponse.BAD_REQUEST, handler.handle(Map.of("X-Python-Variant", "py27"), "x\n").getStatus());
        assertEquals(FormatResponse.BAD_REQUEST, handler.handle(Map.of("X-Python-Variant", "cobol"), "x\n").getStatus());
        assertEquals(FormatResponse.BAD_REQUEST, handler.handle(Map.of("X-Fast-Or-Safe", "maybe"), "x\n").getStatus());
    }

    @Test
    void headersAreCaseInsensitive() {
        FormatResponse response = handler.handle(Map.of("x-diff", "yes"), "x=1\n");
        assertEquals(FormatResponse.OK, response.getStatus());
        assertTrue(response.getBody().contains("+x = 1"));
    }

    @Test
    void optionsFromHeaders() throws FormatRequestHandler.InvalidHeaderException {
        FormatOptions options = handler.parseOptions(Map.of(
                "X-Line-Length", "100",
                "X-Python-Variant", "py38, 3.9,py310",
                "X-Skip-String-Normalization", "1",
                "X-Skip-Magic-Trailing-Comma", "1",
                "X-Preview", "true",
                "X-Fast-Or-Safe", "fast"));
        assertEquals(100, options.getLineLength());
        assertEquals(EnumSet.of(TargetVersion.PY38, TargetVersion.PY39, TargetVersion.PY310),
                options.getTargetVersions());
        assertTrue(options.isSkipStringNormalization());
        assertTrue(options.isSkipMagicTrailingComma());
        assertEquals(EnumSet.allOf(Preview.class), options.getPreviewFeatures());
        assertTrue(options.isFast());
    }

    @Test
    void pyiVariant() throws FormatRequestHandler.InvalidHeaderException {
        assertTrue(handler.parseOptions(Map.of("X-Python-Variant", "pyi")).isPyi());
    }

    @Test
    void shortVersionSpellings() throws FormatRequestHandler.InvalidHeaderException {
        assertEquals(EnumSet.of(TargetVersion.PY37),
                handler.parseOptions(Map.of("X-Python-Variant", "py3.7")).getTargetVersions());
        assertThrows(FormatRequestHandler.InvalidHeaderException.class,
                () -> handler.parseOptions(Map.of("X-Python-Variant", "2.7")));
    }
}

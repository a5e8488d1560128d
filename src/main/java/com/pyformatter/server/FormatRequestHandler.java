package com.pyformatter.server;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import com.pyformatter.api.CodeFormatter;
import com.pyformatter.api.FormatOptions;
import com.pyformatter.api.FormatterResult;
import com.pyformatter.api.Preview;
import com.pyformatter.api.TargetVersion;
import com.pyformatter.api.error.ErrorCategory;
import com.pyformatter.api.error.FormatterError;
import com.pyformatter.util.LoggerUtil;

/**
 * Maps a request made of headers and a source body onto {@link CodeFormatter#format} and the
 * outcome onto a status code. Independent of any HTTP server; a listener passes the request
 * headers and the decoded body and writes back the {@link FormatResponse}.
 *
 * <p>Recognized headers:
 * <ul>
 *   <li>{@code X-Protocol-Version}: must be {@code 1} when present</li>
 *   <li>{@code X-Line-Length}: integer line length</li>
 *   <li>{@code X-Python-Variant}: {@code pyi}, or a comma list of versions such as
 *       {@code py38,py39} or {@code 3.8}</li>
 *   <li>{@code X-Skip-String-Normalization}, {@code X-Skip-Magic-Trailing-Comma},
 *       {@code X-Preview}, {@code X-Diff}: flags, set by any non-empty value</li>
 *   <li>{@code X-Fast-Or-Safe}: {@code fast} or {@code safe}</li>
 * </ul>
 */
public class FormatRequestHandler {
    private static final Logger logger = LoggerUtil.getLogger(FormatRequestHandler.class);

    public static final String PROTOCOL_VERSION_HEADER = "X-Protocol-Version";
    public static final String PROTOCOL_VERSION = "1";
    public static final String LINE_LENGTH_HEADER = "X-Line-Length";
    public static final String PYTHON_VARIANT_HEADER = "X-Python-Variant";
    public static final String SKIP_STRING_NORMALIZATION_HEADER = "X-Skip-String-Normalization";
    public static final String SKIP_MAGIC_TRAILING_COMMA_HEADER = "X-Skip-Magic-Trailing-Comma";
    public static final String PREVIEW_HEADER = "X-Preview";
    public static final String FAST_OR_SAFE_HEADER = "X-Fast-Or-Safe";
    public static final String DIFF_HEADER = "X-Diff";

    private final CodeFormatter formatter;

    public FormatRequestHandler(CodeFormatter formatter) {
        this.formatter = formatter;
    }

    /**
     * Handles one request. Header names are matched case-insensitively.
     */
    public FormatResponse handle(Map<String, String> headers, String body) {
        Map<String, String> normalized = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        normalized.putAll(headers);

        String version = normalized.get(PROTOCOL_VERSION_HEADER);
        if (version != null && !version.trim().equals(PROTOCOL_VERSION)) {
            return FormatResponse.of(FormatResponse.BAD_REQUEST, "This server only supports protocol version 1");
        }

        FormatOptions options;
        try {
            options = parseOptions(normalized);
        } catch (InvalidHeaderException e) {
            logger.fine("Rejected request: " + e.getMessage());
            return FormatResponse.of(FormatResponse.BAD_REQUEST, e.getMessage());
        }

        FormatterResult result = formatter.format(body, options);
        return switch (result.getOutcome()) {
            case UNCHANGED -> FormatResponse.of(FormatResponse.NO_CHANGES, "");
            case REFORMATTED -> FormatResponse.of(FormatResponse.OK, result.getFormattedCode());
            case DIFF -> FormatResponse.of(FormatResponse.OK, result.getDiff());
            case FAILED -> failure(result);
        };
    }

    private static FormatResponse failure(FormatterResult result) {
        String message = result.getErrors().stream()
                .map(FormatRequestHandler::describe)
                .collect(Collectors.joining("\n"));
        boolean internal = result.getErrors().stream()
                .anyMatch(error -> error.getCategory() == ErrorCategory.INTERNAL);
        if (internal) {
            logger.warning("Internal error while serving request: " + message);
            return FormatResponse.of(FormatResponse.INTERNAL_ERROR, message);
        }
        return FormatResponse.of(FormatResponse.BAD_REQUEST, message);
    }

    private static String describe(FormatterError error) {
        if (error.getCategory() == ErrorCategory.SYNTAX && error.getLine() > 0) {
            return "Cannot parse: " + error.getLine() + ":" + error.getColumn() + ": " + error.getMessage();
        }
        return error.getMessage();
    }

    FormatOptions parseOptions(Map<String, String> headers) throws InvalidHeaderException {
        FormatOptions.Builder builder = FormatOptions.builder();

        String lineLength = headers.get(LINE_LENGTH_HEADER);
        if (lineLength != null) {
            try {
                builder.lineLength(Integer.parseInt(lineLength.trim()));
            } catch (IllegalArgumentException e) {
                throw new InvalidHeaderException("Invalid line length: " + lineLength);
            }
        }

        String variant = headers.get(PYTHON_VARIANT_HEADER);
        if (variant != null && !variant.isBlank()) {
            if (variant.trim().equalsIgnoreCase("pyi")) {
                builder.pyi(true);
            } else {
                builder.targetVersions(parseTargetVersions(variant));
            }
        }

        builder.skipStringNormalization(isSet(headers, SKIP_STRING_NORMALIZATION_HEADER));
        builder.skipMagicTrailingComma(isSet(headers, SKIP_MAGIC_TRAILING_COMMA_HEADER));
        if (isSet(headers, PREVIEW_HEADER)) {
            builder.previewFeatures(EnumSet.allOf(Preview.class));
        }
        builder.diff(isSet(headers, DIFF_HEADER));

        String fastOrSafe = headers.get(FAST_OR_SAFE_HEADER);
        if (fastOrSafe != null) {
            switch (fastOrSafe.trim().toLowerCase(Locale.ROOT)) {
                case "fast" -> builder.fast(true);
                case "safe" -> builder.fast(false);
                default -> throw new InvalidHeaderException(
                        "Invalid value for " + FAST_OR_SAFE_HEADER + ": " + fastOrSafe);
            }
        }
        return builder.build();
    }

    private static Set<TargetVersion> parseTargetVersions(String header) throws InvalidHeaderException {
        Set<TargetVersion> versions = EnumSet.noneOf(TargetVersion.class);
        for (String item : header.split(",")) {
            String version = item.trim().toLowerCase(Locale.ROOT);
            if (version.startsWith("py")) {
                version = version.substring(2);
            }
            if (!version.contains(".") && version.length() > 1) {
                version = version.charAt(0) + "." + version.substring(1);
            }
            if (version.startsWith("2")) {
                throw new InvalidHeaderException("Python 2 is not supported");
            }
            try {
                versions.add(TargetVersion.parse(version));
            } catch (IllegalArgumentException e) {
                throw new InvalidHeaderException("Invalid value for " + PYTHON_VARIANT_HEADER + ": " + item.trim());
            }
        }
        return versions;
    }

    private static boolean isSet(Map<String, String> headers, String name) {
        String value = headers.get(name);
        return value != null && !value.isEmpty();
    }

    /**
     * A header value that cannot be turned into an option.
     */
    static class InvalidHeaderException extends Exception {
        InvalidHeaderException(String message) {
            super(message);
        }
    }
}

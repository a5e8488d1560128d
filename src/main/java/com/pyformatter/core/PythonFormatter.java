package com.pyformatter.core;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import com.pyformatter.api.CodeFormatter;
import com.pyformatter.api.Feature;
import com.pyformatter.api.FormatOptions;
import com.pyformatter.api.FormatterResult;
import com.pyformatter.api.LineRange;
import com.pyformatter.api.TargetVersion;
import com.pyformatter.api.error.ErrorCategory;
import com.pyformatter.api.error.FormatterError;
import com.pyformatter.api.error.FormatterException;
import com.pyformatter.api.error.Severity;
import com.pyformatter.api.error.UnsupportedConstructException;
import com.pyformatter.lines.EmptyLineTracker;
import com.pyformatter.lines.FmtOff;
import com.pyformatter.lines.Line;
import com.pyformatter.lines.LineGenerator;
import com.pyformatter.safety.EquivalenceChecker;
import com.pyformatter.split.LineTransformer;
import com.pyformatter.tree.Node;
import com.pyformatter.tree.TreeBuilder;
import com.pyformatter.util.DiffRenderer;
import com.pyformatter.util.LoggerUtil;

/**
 * Formats Python source text. Stateless and safe to share between threads; every call works
 * on its own tree.
 */
public class PythonFormatter implements CodeFormatter {
    private static final Logger logger = LoggerUtil.getLogger(PythonFormatter.class);

    private static final Set<Feature> SPLIT_FEATURES =
            EnumSet.of(Feature.TRAILING_COMMA_IN_CALL, Feature.TRAILING_COMMA_IN_DEF);

    private final EquivalenceChecker checker = new EquivalenceChecker();

    /**
     * Formats {@code sourceCode}. Failures never throw: they come back as a FAILED result that
     * carries the untouched input and a fatal error.
     */
    @Override
    public FormatterResult format(String sourceCode, FormatOptions options) {
        try {
            String newline = detectNewline(sourceCode);
            String source = sourceCode.replace("\r\n", "\n");
            String formatted = formatText(source, options);
            if (formatted.equals(source)) {
                logger.fine("Source already well formatted");
                return FormatterResult.builder()
                        .outcome(FormatterResult.Outcome.UNCHANGED)
                        .formattedCode(sourceCode)
                        .build();
            }
            if (!options.isFast()) {
                checkEquivalenceAndStability(source, formatted, options);
            }
            String output = newline.equals("\n") ? formatted : formatted.replace("\n", newline);
            if (options.isDiff()) {
                return FormatterResult.builder()
                        .outcome(FormatterResult.Outcome.DIFF)
                        .formattedCode(output)
                        .diff(DiffRenderer.unifiedDiff(sourceCode, output, "source", "formatted"))
                        .build();
            }
            return FormatterResult.builder()
                    .outcome(FormatterResult.Outcome.REFORMATTED)
                    .formattedCode(output)
                    .build();
        } catch (FormatterException e) {
            if (e.getCategory() == ErrorCategory.INTERNAL) {
                logger.log(Level.SEVERE, "Internal formatter error", e);
            } else {
                logger.warning("Cannot format source: " + e.getMessage());
            }
            return failed(sourceCode, FormatterError.fromException(e));
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Unexpected error while formatting", e);
            return failed(sourceCode, new FormatterError(Severity.FATAL, ErrorCategory.INTERNAL,
                    "Unexpected error: " + e.getMessage(), 0, 0));
        } catch (StackOverflowError e) {
            logger.log(Level.SEVERE, "Source nested too deeply to format", e);
            return failed(sourceCode, new FormatterError(Severity.FATAL, ErrorCategory.INTERNAL,
                    "Source nested too deeply to format", 0, 0));
        }
    }

    private static FormatterResult failed(String sourceCode, FormatterError error) {
        return FormatterResult.builder()
                .outcome(FormatterResult.Outcome.FAILED)
                .formattedCode(sourceCode)
                .addError(error)
                .build();
    }

    /**
     * Formats text with {@code \n} line endings, without the safety checks. A changed result is
     * formatted a second time, since trailing commas added by the first pass can change how
     * optional parentheses are handled.
     */
    public String formatText(String source, FormatOptions options) throws FormatterException {
        String formatted = formatOnce(source, options);
        if (!formatted.equals(source) && options.getLineRanges().isEmpty()) {
            return formatOnce(formatted, options);
        }
        return formatted;
    }

    private void checkEquivalenceAndStability(String source, String formatted, FormatOptions options)
            throws FormatterException {
        checker.assertEquivalent(source, formatted, options.getTargetVersions());
        if (options.getLineRanges().isEmpty()) {
            checker.assertStable(source, formatted, text -> formatText(text, options));
        }
    }

    private String formatOnce(String source, FormatOptions options) throws FormatterException {
        if (source.isBlank()) {
            return source.indexOf('\n') >= 0 ? "\n" : "";
        }
        String stripped = source.stripLeading();
        List<LineRange> ranges = shiftRanges(options.getLineRanges(),
                countNewlines(source, source.length() - stripped.length()));
        if (ranges.isEmpty() && !options.getLineRanges().isEmpty()) {
            // every requested line was leading whitespace
            return source;
        }
        Node root = TreeBuilder.parse(stripped);

        Set<TargetVersion> versions = resolveTargetVersions(root, options.getTargetVersions());
        Set<Feature> splitFeatures = EnumSet.copyOf(SPLIT_FEATURES);
        splitFeatures.retainAll(TargetVersion.commonFeatures(versions));

        FmtOff.convertRegions(root);
        FmtOff.convertSkips(root);
        FmtOff.convertOutsideRanges(root, ranges);

        LineGenerator generator = new LineGenerator(options);
        EmptyLineTracker emptyLines = new EmptyLineTracker(options);
        LineTransformer transformer = new LineTransformer(options);
        List<EmptyLineTracker.LinesBlock> blocks = new ArrayList<>();
        for (Line line : generator.generate(root)) {
            EmptyLineTracker.LinesBlock block = emptyLines.maybeEmptyLines(line);
            blocks.add(block);
            for (Line transformed : transformer.transform(line, splitFeatures)) {
                block.addContent(transformed.toString());
            }
        }
        if (blocks.isEmpty()) {
            return source.indexOf('\n') >= 0 ? "\n" : "";
        }
        blocks.get(blocks.size() - 1).setAfter(0);
        StringBuilder out = new StringBuilder();
        for (EmptyLineTracker.LinesBlock block : blocks) {
            out.append(block.render());
        }
        return out.toString();
    }

    /**
     * The requested target versions, or the versions inferred from the features the source
     * uses when none were requested.
     *
     * @throws UnsupportedConstructException when a used feature exists in none of the
     *                                       requested versions
     */
    static Set<TargetVersion> resolveTargetVersions(Node root, Set<TargetVersion> requested)
            throws UnsupportedConstructException {
        Set<Feature> used = FeatureDetector.detect(root);
        if (requested.isEmpty()) {
            Set<TargetVersion> inferred = FeatureDetector.inferTargetVersions(used);
            logger.finest(() -> "Inferred target versions " + inferred + " from " + used);
            return inferred.isEmpty() ? EnumSet.allOf(TargetVersion.class) : inferred;
        }
        for (Feature feature : used) {
            boolean supported = requested.stream().anyMatch(version -> version.supports(feature));
            if (!supported) {
                String targets = requested.stream().map(TargetVersion::toString).sorted()
                        .collect(Collectors.joining(", "));
                throw new UnsupportedConstructException(feature.getDescription(), targets);
            }
        }
        return requested;
    }

    static String detectNewline(String source) {
        int index = source.indexOf('\n');
        return index > 0 && source.charAt(index - 1) == '\r' ? "\r\n" : "\n";
    }

    private static int countNewlines(String text, int end) {
        int count = 0;
        for (int i = 0; i < end; i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }

    private static List<LineRange> shiftRanges(List<LineRange> ranges, int removedLines) {
        if (removedLines == 0) {
            return ranges;
        }
        List<LineRange> shifted = new ArrayList<>();
        for (LineRange range : ranges) {
            int end = range.getEnd() - removedLines;
            if (end >= 1) {
                shifted.add(new LineRange(Math.max(1, range.getStart() - removedLines), end));
            }
        }
        return shifted;
    }
}

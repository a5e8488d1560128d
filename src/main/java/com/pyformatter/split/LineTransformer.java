package com.pyformatter.split;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import com.pyformatter.api.Feature;
import com.pyformatter.api.FormatOptions;
import com.pyformatter.lines.Line;
import com.pyformatter.tree.Leaf;
import com.pyformatter.util.LoggerUtil;

/**
 * Turns one logical line into the physical lines that render it within the line length.
 * Strategies are tried in order and their results are transformed recursively until every
 * line fits or cannot be split any further.
 */
public class LineTransformer {
    private static final Logger logger = LoggerUtil.getLogger(LineTransformer.class);

    private final FormatOptions options;
    private final SplitStrategy delimiterSplit = new DelimiterSplit();
    private final SplitStrategy standaloneCommentSplit = new StandaloneCommentSplit();
    private final SplitStrategy leftHandSplit = new LeftHandSplit();
    private final RightHandSplit rightHandSplit;

    public LineTransformer(FormatOptions options) {
        this.options = options;
        this.rightHandSplit = new RightHandSplit(options.getLineLength());
    }

    /**
     * Convenience entry point for a single line.
     */
    public static List<Line> transform(Line line, FormatOptions options, Set<Feature> features) {
        return new LineTransformer(options).transform(line, features);
    }

    public List<Line> transform(Line line, Set<Feature> features) {
        List<Line> result = new ArrayList<>();
        if (line.isComment()) {
            result.add(line);
            return result;
        }
        String lineText = lineToString(line);
        for (SplitStrategy strategy : strategiesFor(line, lineText)) {
            try {
                result.addAll(run(line, strategy, features, lineText));
                return result;
            } catch (CannotSplitException e) {
                logger.finest(() -> strategy.getName() + " did not apply: " + e.getMessage());
            }
        }
        result.add(line);
        return result;
    }

    private List<SplitStrategy> strategiesFor(Line line, String lineText) {
        boolean fits = !line.isShouldSplitRhs()
                && line.getMagicTrailingComma() == null
                && isLineShortEnough(line, lineText, options.getLineLength())
                && !(line.isInsideBrackets() && line.containsStandaloneComments());
        if (fits) {
            return List.of();
        }
        if (line.isDef()) {
            return List.of(leftHandSplit);
        }
        if (line.isInsideBrackets()) {
            return List.of(delimiterSplit, standaloneCommentSplit, rightHandSplit);
        }
        return List.of(rightHandSplit);
    }

    /**
     * Applies {@code strategy} and transforms its output. A right-hand split whose first line
     * is still too long gets a second opinion with the optional parentheses forced visible,
     * which wins when all of its lines fit.
     *
     * @throws CannotSplitException when the strategy fails or reproduces the line unchanged
     */
    private List<Line> run(Line line, SplitStrategy strategy, Set<Feature> features, String lineText)
            throws CannotSplitException {
        List<Line> result = new ArrayList<>();
        for (Line transformed : strategy.split(line, features)) {
            if (lineToString(transformed).equals(lineText)) {
                throw new CannotSplitException("Line transformer returned an unchanged result");
            }
            result.addAll(transform(transformed, features));
        }
        if (!needsSecondOpinion(line, strategy, result)) {
            return result;
        }
        Line copy = copyWithFreshLeaves(line);
        Set<Feature> forced = features.isEmpty() ? EnumSet.noneOf(Feature.class) : EnumSet.copyOf(features);
        forced.add(Feature.FORCE_OPTIONAL_PARENTHESES);
        List<Line> secondOpinion = run(copy, strategy, forced, lineText);
        for (Line candidate : secondOpinion) {
            if (!isLineShortEnough(candidate, options.getLineLength())) {
                return result;
            }
        }
        return secondOpinion;
    }

    /**
     * Copies {@code line} onto new leaves that take the place of the old ones in the tree, so
     * that parentheses made visible while splitting the copy leave the first attempt untouched.
     */
    private static Line copyWithFreshLeaves(Line line) {
        Line copy = line.cloneEmpty();
        for (Leaf old : line.getLeaves()) {
            Leaf fresh = old.deepCopy();
            fresh.setPrefix("");
            old.replace(fresh);
            copy.append(fresh);
            for (Leaf comment : line.commentsAfter(old)) {
                copy.append(comment, true);
            }
        }
        return copy;
    }

    private boolean needsSecondOpinion(Line line, SplitStrategy strategy, List<Line> result) {
        if (strategy != rightHandSplit || line.getBracketTracker().getInvisible().isEmpty()) {
            return false;
        }
        for (Leaf bracket : line.getBracketTracker().getInvisible()) {
            if (!bracket.getValue().isEmpty()) {
                return false;
            }
        }
        if (line.containsMultilineStrings() || result.isEmpty()
                || isLineShortEnough(result.get(0), options.getLineLength())) {
            return false;
        }
        for (Leaf leaf : line.getLeaves()) {
            if (leaf.getParent() == null) {
                return false;
            }
        }
        return true;
    }

    /**
     * The line as rendered, with indentation but without the final newline.
     */
    public static String lineToString(Line line) {
        String text = line.toString();
        return text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
    }

    public static boolean isLineShortEnough(Line line, int lineLength) {
        return isLineShortEnough(line, lineToString(line), lineLength);
    }

    /**
     * True when the rendered text fits, spans one row and the line carries no standalone
     * comment.
     */
    static boolean isLineShortEnough(Line line, String lineText, int lineLength) {
        return Line.width(lineText) <= lineLength
                && lineText.indexOf('\n') < 0
                && !line.containsStandaloneComments();
    }
}

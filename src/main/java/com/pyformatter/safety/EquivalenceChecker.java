package com.pyformatter.safety;

import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.pyformatter.api.TargetVersion;
import com.pyformatter.api.error.FormatterException;
import com.pyformatter.api.error.InternalFormatterException;
import com.pyformatter.api.error.SourceSyntaxException;
import com.pyformatter.tree.Node;
import com.pyformatter.tree.TreeBuilder;
import com.pyformatter.util.DiffRenderer;
import com.pyformatter.util.LoggerUtil;

/**
 * Verifies formatter output: it must mean the same as the input and must not change when
 * formatted again.
 */
public class EquivalenceChecker {
    private static final Logger logger = LoggerUtil.getLogger(EquivalenceChecker.class);

    /**
     * Formats text a second time for {@link #assertStable}.
     */
    @FunctionalInterface
    public interface SecondPass {
        String format(String source) throws FormatterException;
    }

    /**
     * Reparses both texts and compares their projections.
     *
     * @throws SourceSyntaxException when {@code src} itself does not parse
     * @throws InternalFormatterException when {@code dst} does not parse or means something else
     */
    public void assertEquivalent(String src, String dst, Set<TargetVersion> targetVersions)
            throws FormatterException {
        Node srcTree = TreeBuilder.parse(src);
        Node dstTree;
        try {
            dstTree = TreeBuilder.parse(dst);
        } catch (SourceSyntaxException e) {
            logger.log(Level.SEVERE, "Formatted output does not parse", e);
            throw new InternalFormatterException(
                    "INTERNAL ERROR: produced invalid code for " + describe(targetVersions) + ": " + e.getMessage(),
                    DiffRenderer.unifiedDiff(src, dst, "source", "formatted"), e);
        }
        List<String> srcProjection = AstProjection.of(srcTree);
        List<String> dstProjection = AstProjection.of(dstTree);
        if (!srcProjection.equals(dstProjection)) {
            String srcDump = String.join("\n", srcProjection) + "\n";
            String dstDump = String.join("\n", dstProjection) + "\n";
            String diagnostic = DiffRenderer.unifiedDiff(srcDump, dstDump, "src", "dst");
            logger.severe("Formatted output is not equivalent to the source");
            throw new InternalFormatterException(
                    "INTERNAL ERROR: produced code that is not equivalent to the source", diagnostic);
        }
        logger.finest("Equivalence check passed");
    }

    /**
     * Formats {@code dst} once more and requires the result to be identical.
     *
     * @throws InternalFormatterException when the second pass changes the text
     */
    public void assertStable(String src, String dst, SecondPass secondPass) throws FormatterException {
        String again = secondPass.format(dst);
        if (!dst.equals(again)) {
            String diagnostic = DiffRenderer.unifiedDiff(src, dst, "source", "first pass")
                    + DiffRenderer.unifiedDiff(dst, again, "first pass", "second pass");
            logger.severe("Formatting is not stable");
            throw new InternalFormatterException(
                    "INTERNAL ERROR: produced different code on the second pass of the formatter", diagnostic);
        }
    }

    private static String describe(Set<TargetVersion> targetVersions) {
        return targetVersions.isEmpty() ? "the inferred target versions" : "target versions " + targetVersions;
    }
}

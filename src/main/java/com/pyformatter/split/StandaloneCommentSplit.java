package com.pyformatter.split;

import java.util.List;
import java.util.Set;

import com.pyformatter.api.Feature;
import com.pyformatter.lines.Line;
import com.pyformatter.tree.Leaf;

/**
 * Moves standalone comments inside brackets onto lines of their own.
 */
public class StandaloneCommentSplit implements SplitStrategy {

    @Override
    public String getName() {
        return "standalone_comment_split";
    }

    @Override
    public List<Line> split(Line line, Set<Feature> features) throws CannotSplitException {
        if (!line.containsStandaloneComments()) {
            throw new CannotSplitException("Line does not have any standalone comments");
        }
        DelimiterSplit.LineCollector collector = new DelimiterSplit.LineCollector(line);
        for (Leaf leaf : line.getLeaves()) {
            collector.add(leaf);
            for (Leaf comment : line.commentsAfter(leaf)) {
                collector.add(comment);
            }
        }
        return collector.finish();
    }
}

package com.pyformatter.split;

import java.util.ArrayList;
import java.util.List;

import com.pyformatter.lines.Line;
import com.pyformatter.tree.Leaf;

/**
 * Rendered lengths of the leaves of a line, each including its prefix and the comments
 * attached to it.
 */
final class LeafLengths {

    private LeafLengths() {
    }

    /**
     * Lengths of the leaves in line order. The list stops early at the first leaf whose value
     * spans several lines, since nothing after it can be measured on one row.
     */
    static List<Integer> of(Line line) {
        List<Integer> lengths = new ArrayList<>();
        for (Leaf leaf : line.getLeaves()) {
            if (leaf.getValue().indexOf('\n') >= 0) {
                break;
            }
            lengths.add(lengthOf(line, leaf));
        }
        return lengths;
    }

    /**
     * Same as {@link #of(Line)} but walking from the last leaf; element {@code i} belongs to
     * leaf {@code size - 1 - i}.
     */
    static List<Integer> reversed(Line line) {
        List<Integer> lengths = new ArrayList<>();
        List<Leaf> leaves = line.getLeaves();
        for (int i = leaves.size() - 1; i >= 0; i--) {
            Leaf leaf = leaves.get(i);
            if (leaf.getValue().indexOf('\n') >= 0) {
                break;
            }
            lengths.add(lengthOf(line, leaf));
        }
        return lengths;
    }

    static int lengthOf(Line line, Leaf leaf) {
        int length = leaf.getPrefix().length() + leaf.getValue().length();
        for (Leaf comment : line.commentsAfter(leaf)) {
            length += comment.getValue().length();
        }
        return length;
    }
}

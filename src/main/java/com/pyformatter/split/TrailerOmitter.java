package com.pyformatter.split;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import com.pyformatter.lines.Line;
import com.pyformatter.tokenize.TokenType;
import com.pyformatter.tree.Leaf;

/**
 * Produces the sets of closing brackets a right-hand split may skip over, so that trailing
 * calls and subscripts can stay glued to the line while an earlier bracket pair is split.
 */
final class TrailerOmitter {

    private TrailerOmitter() {
    }

    /**
     * The omit sets to try, in order. The first one is empty unless the line has a magic
     * trailing comma; each later one omits one more trailer from the right. Generation stops
     * once the omitted trailers no longer fit in {@code lineLength}, at a comment, or at a
     * bracket pair that ends with a trailing comma.
     */
    static List<Set<Leaf>> generate(Line line, int lineLength) {
        List<Set<Leaf>> result = new ArrayList<>();
        Set<Leaf> omit = identitySet();
        if (line.getMagicTrailingComma() == null) {
            result.add(copy(omit));
        }
        List<Leaf> leaves = line.getLeaves();
        List<Integer> lengths = LeafLengths.reversed(line);
        int length = 4 * line.getDepth();
        Leaf openingBracket = null;
        Leaf closingBracket = null;
        Set<Leaf> innerBrackets = identitySet();
        for (int step = 0; step < lengths.size(); step++) {
            int index = leaves.size() - 1 - step;
            Leaf leaf = leaves.get(index);
            int leafLength = lengths.get(step);
            length += leafLength;
            if (length > lineLength) {
                break;
            }
            boolean hasInlineComment = leafLength > leaf.getValue().length() + leaf.getPrefix().length();
            if (leaf.is(TokenType.STANDALONE_COMMENT) || hasInlineComment) {
                break;
            }
            if (openingBracket != null) {
                if (leaf == openingBracket) {
                    openingBracket = null;
                } else if (leaf.isClosingBracket()) {
                    innerBrackets.add(leaf);
                }
            } else if (leaf.isClosingBracket()) {
                Leaf previous = index > 0 ? leaves.get(index - 1) : null;
                if (previous != null && previous.isOpeningBracket()) {
                    // empty brackets cannot be split, so they only ride along with a real trailer
                    innerBrackets.add(leaf);
                    continue;
                }
                if (closingBracket != null) {
                    omit.add(closingBracket);
                    omit.addAll(innerBrackets);
                    innerBrackets.clear();
                    result.add(copy(omit));
                }
                if (previous != null && previous.isOp(",") && leaf.getOpeningBracket() != null) {
                    // bracket pairs with trailing commas have to explode
                    break;
                }
                if (!leaf.getValue().isEmpty()) {
                    openingBracket = leaf.getOpeningBracket();
                    closingBracket = leaf;
                }
            }
        }
        return result;
    }

    private static Set<Leaf> identitySet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }

    private static Set<Leaf> copy(Set<Leaf> omit) {
        Set<Leaf> copy = identitySet();
        copy.addAll(omit);
        return copy;
    }
}

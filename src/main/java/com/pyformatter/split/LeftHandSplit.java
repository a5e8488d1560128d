package com.pyformatter.split;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.pyformatter.api.Feature;
import com.pyformatter.lines.Line;
import com.pyformatter.tree.Leaf;
import com.pyformatter.tree.NodeType;

/**
 * Splits a definition header at its first bracket pair outside the type parameters: the name
 * goes on the head line, the parameters on an indented body and the closing bracket with the
 * rest on the tail.
 */
public class LeftHandSplit implements SplitStrategy {

    @Override
    public String getName() {
        return "left_hand_split";
    }

    @Override
    public List<Line> split(Line line, Set<Feature> features) throws CannotSplitException {
        List<Leaf> head = new ArrayList<>();
        List<Leaf> body = new ArrayList<>();
        List<Leaf> tail = new ArrayList<>();
        List<Leaf> current = head;
        Leaf matchingBracket = null;
        for (Leaf leaf : line.getLeaves()) {
            if (current == body && leaf.isClosingBracket() && matchingBracket != null
                    && leaf.getOpeningBracket() == matchingBracket) {
                leaf.makeVisible();
                matchingBracket.makeVisible();
                current = body.isEmpty() ? head : tail;
            }
            current.add(leaf);
            if (current == head && leaf.isOpeningBracket() && !isTypeParamsBracket(leaf)) {
                matchingBracket = leaf;
                current = body;
            }
        }
        if (matchingBracket == null || tail.isEmpty()) {
            throw new CannotSplitException("No brackets found");
        }
        List<Line> result = new ArrayList<>();
        for (Line built : List.of(
                BracketSplitBuilder.build(head, line, matchingBracket, BracketSplitBuilder.Component.HEAD),
                BracketSplitBuilder.build(body, line, matchingBracket, BracketSplitBuilder.Component.BODY),
                BracketSplitBuilder.build(tail, line, matchingBracket, BracketSplitBuilder.Component.TAIL))) {
            if (!built.isEmpty()) {
                result.add(built);
            }
        }
        return result;
    }

    // type parameters stay on the head line with the name
    private static boolean isTypeParamsBracket(Leaf leaf) {
        return leaf.getParent() != null && leaf.getParent().is(NodeType.TYPEPARAMS);
    }
}

package com.pyformatter.lines;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.pyformatter.api.FormatOptions;
import com.pyformatter.tokenize.TokenType;
import com.pyformatter.tree.Leaf;
import com.pyformatter.tree.Node;
import com.pyformatter.tree.NodeType;
import com.pyformatter.tree.TreeNode;
import com.pyformatter.tree.Trees;

/**
 * A logical line: the leaves of one statement (or statement header) at a given indentation
 * depth, plus the trailing comments attached to those leaves.
 */
public class Line {
    private static final Set<String> FLOW_CONTROL = Set.of("return", "raise", "break", "continue");

    private static final Set<NodeType> TEST_DESCENDANTS = Set.of(
            NodeType.TEST, NodeType.LAMBDEF, NodeType.OR_TEST, NodeType.AND_TEST, NodeType.NOT_TEST,
            NodeType.COMPARISON, NodeType.STAR_EXPR, NodeType.EXPR, NodeType.XOR_EXPR, NodeType.AND_EXPR,
            NodeType.SHIFT_EXPR, NodeType.ARITH_EXPR, NodeType.TRAILER, NodeType.TERM, NodeType.POWER,
            NodeType.NAMEDEXPR_TEST);

    private final FormatOptions options;
    private int depth;
    private final List<Leaf> leaves = new ArrayList<>();
    // Leaf has identity equality, so this map is keyed by identity in insertion order
    private final Map<Leaf, List<Leaf>> comments = new LinkedHashMap<>();
    private final BracketTracker bracketTracker = new BracketTracker();
    private boolean insideBrackets;
    private boolean shouldSplitRhs;
    private Leaf magicTrailingComma;

    public Line(FormatOptions options, int depth, boolean insideBrackets) {
        this.options = options;
        this.depth = depth;
        this.insideBrackets = insideBrackets;
    }

    public FormatOptions getOptions() {
        return options;
    }

    public int getDepth() {
        return depth;
    }

    public void setDepth(int depth) {
        this.depth = depth;
    }

    public List<Leaf> getLeaves() {
        return leaves;
    }

    public Map<Leaf, List<Leaf>> getComments() {
        return comments;
    }

    public BracketTracker getBracketTracker() {
        return bracketTracker;
    }

    public boolean isInsideBrackets() {
        return insideBrackets;
    }

    public void setInsideBrackets(boolean insideBrackets) {
        this.insideBrackets = insideBrackets;
    }

    public boolean isShouldSplitRhs() {
        return shouldSplitRhs;
    }

    public void setShouldSplitRhs(boolean shouldSplitRhs) {
        this.shouldSplitRhs = shouldSplitRhs;
    }

    /** The closing bracket preceded by a magic trailing comma, or null. */
    public Leaf getMagicTrailingComma() {
        return magicTrailingComma;
    }

    public boolean isEmpty() {
        return leaves.isEmpty();
    }

    public void append(Leaf leaf) {
        append(leaf, false, false);
    }

    public void append(Leaf leaf, boolean preformatted) {
        append(leaf, preformatted, false);
    }

    /**
     * Adds a leaf to the end of the line. Unless {@code preformatted} is set, the whitespace that
     * goes before the leaf is appended to its prefix. Inside brackets, or when not preformatted,
     * or when {@code trackBracket} is set, the leaf also goes through the bracket tracker.
     */
    public void append(Leaf leaf, boolean preformatted, boolean trackBracket) {
        boolean hasValue = leaf.isOpeningBracket() || leaf.isClosingBracket() || !leaf.getValue().isBlank();
        if (!hasValue) {
            return;
        }
        if (leaf.isOp(":") && isClassParenEmpty()) {
            leaves.remove(leaves.size() - 1);
            leaves.remove(leaves.size() - 1);
        }
        if (!leaves.isEmpty() && !preformatted) {
            leaf.setPrefix(leaf.getPrefix() + Whitespace.before(leaf, isComplexSubscript(leaf)));
        }
        if (insideBrackets || !preformatted || trackBracket) {
            bracketTracker.mark(leaf);
            if (options.isMagicTrailingComma()) {
                if (hasMagicTrailingComma(leaf, false)) {
                    magicTrailingComma = leaf;
                }
            } else if (hasMagicTrailingComma(leaf, true)) {
                removeTrailingComma();
            }
        }
        if (!appendComment(leaf)) {
            leaves.add(leaf);
        }
    }

    /**
     * Like {@link #append(Leaf, boolean)} but refuses to mix standalone comments with code.
     *
     * @throws IllegalArgumentException when the leaf cannot go on this line
     */
    public void appendSafe(Leaf leaf, boolean preformatted) {
        if (bracketTracker.getDepth() == 0) {
            if (isComment()) {
                throw new IllegalArgumentException("cannot append to standalone comments");
            }
            if (!leaves.isEmpty() && leaf.is(TokenType.STANDALONE_COMMENT)) {
                throw new IllegalArgumentException("cannot append standalone comments to a populated line");
            }
        }
        append(leaf, preformatted);
    }

    /**
     * Attaches a trailing comment to the last leaf. Returns false when the comment has to be
     * treated as a leaf of its own.
     */
    public boolean appendComment(Leaf comment) {
        if (comment.is(TokenType.STANDALONE_COMMENT) && bracketTracker.anyOpenBrackets()) {
            comment.setPrefix("");
            return false;
        }
        if (!comment.is(TokenType.COMMENT)) {
            return false;
        }
        if (leaves.isEmpty()) {
            comment.setType(TokenType.STANDALONE_COMMENT);
            comment.setPrefix("");
            return false;
        }
        Leaf lastLeaf = leaves.get(leaves.size() - 1);
        if (lastLeaf.isRightParen() && lastLeaf.isInvisible() && lastLeaf.getParent() != null
                && lastLeaf.getParent().leaves().size() <= 3 && !isTypeComment(comment)) {
            // a comment after invisible parens around a single leaf belongs to the wrapped leaf
            if (leaves.size() < 2) {
                comment.setType(TokenType.STANDALONE_COMMENT);
                comment.setPrefix("");
                return false;
            }
            lastLeaf = leaves.get(leaves.size() - 2);
        }
        comments.computeIfAbsent(lastLeaf, k -> new ArrayList<>()).add(comment);
        return true;
    }

    private static boolean isTypeComment(Leaf comment) {
        return comment.getValue().startsWith("# type:");
    }

    public List<Leaf> commentsAfter(Leaf leaf) {
        return comments.getOrDefault(leaf, Collections.emptyList());
    }

    /**
     * Removes the trailing comma, moving its comments to the leaf before it.
     */
    public void removeTrailingComma() {
        Leaf trailingComma = leaves.remove(leaves.size() - 1);
        List<Leaf> trailingComments = comments.remove(trailingComma);
        if (trailingComments != null && !leaves.isEmpty()) {
            comments.computeIfAbsent(leaves.get(leaves.size() - 1), k -> new ArrayList<>())
                    .addAll(trailingComments);
        }
    }

    /**
     * True when the line ends with a comma that precedes {@code closing} and that comma is not
     * part of a one-element tuple or a single-element subscript.
     *
     * @param ensureRemovable only report commas that can be dropped without changing meaning
     */
    public boolean hasMagicTrailingComma(Leaf closing, boolean ensureRemovable) {
        if (!closing.isClosingBracket() || leaves.isEmpty()
                || !leaves.get(leaves.size() - 1).isOp(",")) {
            return false;
        }
        if (closing.isOp("}")) {
            return true;
        }
        if (closing.isOp("]")) {
            if (closing.getParent() != null && closing.getParent().is(NodeType.TRAILER)
                    && closing.getOpeningBracket() != null
                    && isOneSequenceBetween(closing.getOpeningBracket(), closing, "[")) {
                return false;
            }
            if (!ensureRemovable) {
                return true;
            }
            Leaf comma = leaves.get(leaves.size() - 1);
            if (comma.getParent() == null) {
                return false;
            }
            return !comma.getParent().is(NodeType.SUBSCRIPTLIST) || closing.getOpeningBracket() == null
                    || !isOneSequenceBetween(closing.getOpeningBracket(), closing, "[");
        }
        if (isImport()) {
            return true;
        }
        return closing.isRightParen() && closing.getOpeningBracket() != null
                && !isOneSequenceBetween(closing.getOpeningBracket(), closing, "(");
    }

    /**
     * True when the brackets hold a single element followed by a comma. Commas of argument
     * lists always count twice, so calls and definitions never qualify.
     */
    private boolean isOneSequenceBetween(Leaf opening, Leaf closing, String kind) {
        boolean matchingKind = kind.equals("(") ? opening.isLeftParen() : opening.isOp(kind);
        if (!matchingKind) {
            return false;
        }
        int wantedDepth = closing.getBracketDepth() + 1;
        int start = leaves.indexOf(opening);
        if (start < 0) {
            return false;
        }
        int commas = 0;
        for (int i = start + 1; i < leaves.size(); i++) {
            Leaf leaf = leaves.get(i);
            if (leaf == closing) {
                break;
            }
            if (leaf.getBracketDepth() == wantedDepth && leaf.isOp(",")) {
                commas++;
                Node parent = leaf.getParent();
                if (parent != null && (parent.is(NodeType.ARGLIST) || parent.is(NodeType.TYPEDARGSLIST))) {
                    commas++;
                    break;
                }
            }
        }
        return commas < 2;
    }

    /**
     * True when {@code leaf} sits inside a subscript whose expressions are not trivial, in which
     * case slice colons get spaces like binary operators.
     */
    public boolean isComplexSubscript(Leaf leaf) {
        Leaf openBracket = bracketTracker.openSquareBracket();
        if (openBracket == null) {
            return false;
        }
        TreeNode subscriptStart = openBracket.nextSibling();
        if (subscriptStart instanceof Node) {
            Node start = (Node) subscriptStart;
            if (start.is(NodeType.LISTMAKER)) {
                return false;
            }
            if (start.is(NodeType.SUBSCRIPTLIST)) {
                subscriptStart = Trees.childTowards(start, leaf);
            }
        }
        if (subscriptStart == null) {
            return false;
        }
        for (TreeNode node : Trees.preOrder(subscriptStart)) {
            if (node instanceof Node && TEST_DESCENDANTS.contains(((Node) node).getType())) {
                return true;
            }
        }
        return false;
    }

    // ------------------------------------------------------------------ predicates

    /** A line holding just one standalone comment. */
    public boolean isComment() {
        return leaves.size() == 1 && leaves.get(0).is(TokenType.STANDALONE_COMMENT);
    }

    public boolean isDecorator() {
        return !leaves.isEmpty() && leaves.get(0).isOp("@");
    }

    public boolean isImport() {
        if (leaves.isEmpty()) {
            return false;
        }
        Leaf first = leaves.get(0);
        Node parent = first.getParent();
        if (parent == null) {
            return false;
        }
        return (first.isName("import") && parent.is(NodeType.IMPORT_NAME))
                || (first.isName("from") && parent.is(NodeType.IMPORT_FROM));
    }

    public boolean isClass() {
        return !leaves.isEmpty() && leaves.get(0).isName("class");
    }

    public boolean isStubClass() {
        return isClass() && leaves.get(leaves.size() - 1).isOp("...");
    }

    public boolean isDef() {
        if (leaves.isEmpty()) {
            return false;
        }
        Leaf first = leaves.get(0);
        if (first.isName("def")) {
            return true;
        }
        return first.isName("async") && leaves.size() > 1 && leaves.get(1).isName("def");
    }

    /** A function whose whole body is {@code ...} on the header line. */
    public boolean isStubDef() {
        int size = leaves.size();
        return isDef() && size >= 2 && leaves.get(size - 1).isOp("...") && leaves.get(size - 2).isOp(":");
    }

    public boolean isFlowControl() {
        return !leaves.isEmpty() && leaves.get(0).is(TokenType.NAME)
                && FLOW_CONTROL.contains(leaves.get(0).getValue());
    }

    public boolean isClassParenEmpty() {
        int size = leaves.size();
        return isClass() && size >= 2 && leaves.get(size - 2).isOp("(") && leaves.get(size - 1).isOp(")");
    }

    public boolean isTripleQuotedString() {
        return !leaves.isEmpty() && leaves.get(0).is(TokenType.STRING)
                && Trees.hasTripleQuotes(leaves.get(0).getValue());
    }

    /** True for a line whose first leaf is a docstring. */
    public boolean isDocstring() {
        return !leaves.isEmpty() && leaves.get(0).is(TokenType.STRING) && Trees.isDocstring(leaves.get(0));
    }

    public boolean isFlowControlOrPass() {
        return isFlowControl() || (!leaves.isEmpty() && leaves.get(0).isName("pass"));
    }

    /** The line ends with a colon and introduces an indented block. */
    public boolean opensBlock() {
        return !leaves.isEmpty() && leaves.get(leaves.size() - 1).isOp(":");
    }

    public boolean containsStandaloneComments() {
        for (Leaf leaf : leaves) {
            if (leaf.is(TokenType.STANDALONE_COMMENT)) {
                return true;
            }
        }
        return false;
    }

    public boolean containsMultilineStrings() {
        for (Leaf leaf : leaves) {
            if (Trees.isMultilineString(leaf)) {
                return true;
            }
        }
        return false;
    }

    /**
     * A copy with the same settings but no leaves.
     */
    public Line cloneEmpty() {
        Line line = new Line(options, depth, insideBrackets);
        line.shouldSplitRhs = shouldSplitRhs;
        line.magicTrailingComma = magicTrailingComma;
        return line;
    }

    /**
     * Renders the line with its indentation, trailing comments and a final newline. The first
     * leaf's prefix is not rendered; it only carries the blank lines requested before the line.
     */
    @Override
    public String toString() {
        if (leaves.isEmpty()) {
            return "\n";
        }
        StringBuilder out = new StringBuilder();
        out.append("    ".repeat(depth));
        out.append(leaves.get(0).getValue());
        for (int i = 1; i < leaves.size(); i++) {
            Leaf leaf = leaves.get(i);
            out.append(leaf.getPrefix()).append(leaf.getValue());
        }
        for (List<Leaf> attached : comments.values()) {
            for (Leaf comment : attached) {
                out.append(comment.getPrefix()).append(comment.getValue());
            }
        }
        return out.append('\n').toString();
    }

    /**
     * The rendered line without indentation and without the final newline.
     */
    public String render() {
        String text = toString();
        return text.substring(4 * depth, text.length() - 1);
    }

    /**
     * Display width of {@code text}: East Asian wide and full-width characters count as two
     * columns.
     */
    public static int width(String text) {
        int width = 0;
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            width += isWide(codePoint) ? 2 : 1;
            i += Character.charCount(codePoint);
        }
        return width;
    }

    private static boolean isWide(int cp) {
        return (cp >= 0x1100 && cp <= 0x115F)
                || (cp >= 0x2E80 && cp <= 0x303E)
                || (cp >= 0x3041 && cp <= 0x33FF)
                || (cp >= 0x3400 && cp <= 0x4DBF)
                || (cp >= 0x4E00 && cp <= 0x9FFF)
                || (cp >= 0xA000 && cp <= 0xA4CF)
                || (cp >= 0xAC00 && cp <= 0xD7A3)
                || (cp >= 0xF900 && cp <= 0xFAFF)
                || (cp >= 0xFE30 && cp <= 0xFE4F)
                || (cp >= 0xFF00 && cp <= 0xFF60)
                || (cp >= 0xFFE0 && cp <= 0xFFE6)
                || (cp >= 0x1F300 && cp <= 0x1F64F)
                || (cp >= 0x1F900 && cp <= 0x1F9FF)
                || (cp >= 0x20000 && cp <= 0x3FFFD);
    }
}

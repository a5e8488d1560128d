package com.pyformatter.tree;

import java.util.List;

import com.pyformatter.tokenize.TokenType;

/**
 * A token in the tree together with its prefix (the whitespace, comments and blank lines that
 * preceded it) and formatting metadata computed during line generation.
 */
public class Leaf extends TreeNode {
    private TokenType type;
    private String value;
    private String prefix;
    private final int line;
    private final int column;

    // Formatting metadata, assigned by the bracket tracker
    private Leaf openingBracket;
    private int bracketDepth;

    public Leaf(TokenType type, String value) {
        this(type, value, "", 0, 0);
    }

    public Leaf(TokenType type, String value, String prefix, int line, int column) {
        this.type = type;
        this.value = value;
        this.prefix = prefix;
        this.line = line;
        this.column = column;
    }

    public TokenType getType() {
        return type;
    }

    public void setType(TokenType type) {
        this.type = type;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    /** 1-based source line, 0 for synthesized leaves. */
    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public String getPrefix() {
        return prefix;
    }

    @Override
    public void setPrefix(String prefix) {
        this.prefix = prefix;
    }

    public Leaf getOpeningBracket() {
        return openingBracket;
    }

    public void setOpeningBracket(Leaf openingBracket) {
        this.openingBracket = openingBracket;
    }

    public int getBracketDepth() {
        return bracketDepth;
    }

    public void setBracketDepth(int bracketDepth) {
        this.bracketDepth = bracketDepth;
    }

    @Override
    public boolean is(TokenType type) {
        return this.type == type;
    }

    public boolean isOp(String op) {
        return type == TokenType.OP && value.equals(op);
    }

    /**
     * True for a NAME leaf with the given value (keywords are NAME leaves).
     */
    public boolean isName(String name) {
        return type == TokenType.NAME && value.equals(name);
    }

    public boolean isOpeningBracket() {
        return type == TokenType.OP
                && (value.equals("(") || value.equals("[") || value.equals("{") || hiddenOpen);
    }

    public boolean isClosingBracket() {
        return type == TokenType.OP
                && (value.equals(")") || value.equals("]") || value.equals("}") || hiddenClose);
    }

    public boolean isLeftParen() {
        return type == TokenType.OP && (value.equals("(") || hiddenOpen);
    }

    public boolean isRightParen() {
        return type == TokenType.OP && (value.equals(")") || hiddenClose);
    }

    // Set on parentheses that render (or used to render) as nothing
    private boolean hiddenOpen;
    private boolean hiddenClose;

    /**
     * Creates an invisible parenthesis: it renders as nothing until made visible.
     */
    public static Leaf invisibleParen(boolean opening) {
        Leaf leaf = new Leaf(TokenType.OP, "");
        leaf.hiddenOpen = opening;
        leaf.hiddenClose = !opening;
        return leaf;
    }

    /**
     * Hides an existing redundant parenthesis: it stops rendering but keeps its bracket role.
     */
    public void makeInvisible() {
        if (value.equals("(")) {
            hiddenOpen = true;
        } else if (value.equals(")")) {
            hiddenClose = true;
        } else {
            throw new IllegalStateException("Only parentheses can be made invisible: " + value);
        }
        value = "";
    }

    /**
     * Restores the text of an invisible parenthesis.
     */
    public void makeVisible() {
        if (hiddenOpen) {
            value = "(";
        } else if (hiddenClose) {
            value = ")";
        }
    }

    public boolean isInvisible() {
        return (hiddenOpen || hiddenClose) && value.isEmpty();
    }

    @Override
    void collectLeaves(List<Leaf> into) {
        into.add(this);
    }

    @Override
    public Leaf firstLeaf() {
        return this;
    }

    @Override
    public Leaf lastLeaf() {
        return this;
    }

    @Override
    public Leaf deepCopy() {
        Leaf copy = new Leaf(type, value, prefix, line, column);
        copy.hiddenOpen = hiddenOpen;
        copy.hiddenClose = hiddenClose;
        return copy;
    }

    @Override
    public String toString() {
        return prefix + value;
    }
}

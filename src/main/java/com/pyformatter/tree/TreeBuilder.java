package com.pyformatter.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import com.pyformatter.api.error.SourceSyntaxException;
import com.pyformatter.tokenize.TokenType;
import com.pyformatter.tokenize.Tokenizer;
import com.pyformatter.util.LoggerUtil;

/**
 * Recursive-descent parser building the full-fidelity concrete tree.
 * <p>
 * Productions with a single child collapse into that child, so a plain name is a bare
 * {@link Leaf} and only real operators, calls or literals create {@link Node}s. Operator chains
 * are flat: {@code a + b - c} is one ARITH_EXPR with five children.
 */
public class TreeBuilder {
    private static final Logger logger = LoggerUtil.getLogger(TreeBuilder.class);

    static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "break", "class", "continue", "def",
            "del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import",
            "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try",
            "while", "with", "yield");

    private static final Set<String> AUGMENTED_ASSIGNMENTS = Set.of(
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>=", "**=", "//=", "@=");

    private static final Set<String> COMPARISON_OPERATORS = Set.of("<", ">", "==", ">=", "<=", "!=");

    @FunctionalInterface
    private interface ParseStep {
        TreeNode parse() throws SourceSyntaxException;
    }

    private final List<Leaf> leaves;
    private int pos;
    private boolean patternMode;

    private TreeBuilder(List<Leaf> leaves) {
        this.leaves = leaves;
    }

    /**
     * Parses source text into a FILE_INPUT node whose rendering equals the input.
     *
     * @param source text with {@code \n} line endings
     * @throws SourceSyntaxException when the text is not valid Python 3
     */
    public static Node parse(String source) throws SourceSyntaxException {
        Tokenizer.Result scanned = Tokenizer.scan(source);
        SourceSyntaxException unclosed = scanned.getUnclosedBracket();
        TreeBuilder builder = new TreeBuilder(TokenFeeder.feed(source, scanned.getTokens()));
        Node tree;
        try {
            tree = builder.parseFileInput();
        } catch (SourceSyntaxException e) {
            if (unclosed != null && !isBefore(e, unclosed)) {
                throw unclosed;
            }
            throw e;
        } catch (StackOverflowError e) {
            Leaf leaf = builder.peek();
            throw new SourceSyntaxException("Cannot parse: expression nested too deeply",
                    leaf.getLine(), leaf.getColumn());
        }
        if (unclosed != null) {
            throw unclosed;
        }
        Node parsed = tree;
        logger.finest(() -> "Parsed tree with " + parsed.childCount() + " top-level children");
        return parsed;
    }

    private static boolean isBefore(SourceSyntaxException first, SourceSyntaxException second) {
        return first.getLine() < second.getLine()
                || (first.getLine() == second.getLine() && first.getColumn() < second.getColumn());
    }

    // ------------------------------------------------------------------ helpers

    private Leaf peek() {
        return leaves.get(pos);
    }

    private Leaf peek(int ahead) {
        int index = Math.min(pos + ahead, leaves.size() - 1);
        return leaves.get(index);
    }

    private Leaf next() {
        Leaf leaf = leaves.get(pos);
        if (pos < leaves.size() - 1) {
            pos++;
        }
        return leaf;
    }

    private boolean at(TokenType type) {
        return peek().getType() == type;
    }

    private boolean atOp(String op) {
        return peek().isOp(op);
    }

    private boolean atName(String name) {
        return peek().isName(name);
    }

    private Leaf expect(TokenType type) throws SourceSyntaxException {
        if (!at(type)) {
            throw error("expected " + type);
        }
        return next();
    }

    private Leaf expectOp(String op) throws SourceSyntaxException {
        if (!atOp(op)) {
            throw error("expected '" + op + "'");
        }
        return next();
    }

    private Leaf expectName(String name) throws SourceSyntaxException {
        if (!atName(name)) {
            throw error("expected '" + name + "'");
        }
        return next();
    }

    private Leaf expectIdentifier() throws SourceSyntaxException {
        if (!at(TokenType.NAME) || KEYWORDS.contains(peek().getValue())) {
            throw error("expected a name");
        }
        return next();
    }

    private SourceSyntaxException error(String reason) {
        Leaf leaf = peek();
        String shown = leaf.getValue().isEmpty() ? leaf.getType().name() : leaf.getValue();
        return new SourceSyntaxException("Cannot parse: " + reason + " at '" + shown + "'",
                leaf.getLine(), leaf.getColumn());
    }

    private static TreeNode collapse(NodeType type, List<TreeNode> children) {
        return children.size() == 1 ? children.get(0) : new Node(type, children);
    }

    private boolean atStatementEnd() {
        return at(TokenType.NEWLINE) || atOp(";");
    }

    private boolean atCompFor() {
        return atName("for") || (atName("async") && peek(1).isName("for"));
    }

    private boolean startsExpression() {
        Leaf leaf = peek();
        return switch (leaf.getType()) {
            case NAME -> !KEYWORDS.contains(leaf.getValue())
                    || Set.of("True", "False", "None", "not", "lambda").contains(leaf.getValue());
            case NUMBER, STRING -> true;
            case OP -> Set.of("(", "[", "{", "-", "+", "~", "...", "*", "**").contains(leaf.getValue());
            default -> false;
        };
    }

    /**
     * Parses {@code element (',' element)* [',']}; a single element without a comma is returned
     * as is.
     */
    private TreeNode parseList(NodeType type, ParseStep element) throws SourceSyntaxException {
        List<TreeNode> children = new ArrayList<>();
        children.add(element.parse());
        boolean sawComma = false;
        while (atOp(",")) {
            sawComma = true;
            children.add(next());
            if (!startsExpression()) {
                break;
            }
            children.add(element.parse());
        }
        return sawComma ? new Node(type, children) : children.get(0);
    }

    // ------------------------------------------------------------------ statements

    private Node parseFileInput() throws SourceSyntaxException {
        List<TreeNode> children = new ArrayList<>();
        while (!at(TokenType.ENDMARKER)) {
            if (at(TokenType.NEWLINE)) {
                children.add(next());
                continue;
            }
            children.add(parseStatement());
        }
        children.add(next());
        return new Node(NodeType.FILE_INPUT, children);
    }

    private TreeNode parseStatement() throws SourceSyntaxException {
        Leaf leaf = peek();
        if (leaf.is(TokenType.INDENT)) {
            throw error("unexpected indent");
        }
        if (leaf.is(TokenType.DEDENT)) {
            throw error("unexpected dedent");
        }
        if (leaf.isOp("@")) {
            return parseDecorated();
        }
        if (leaf.is(TokenType.NAME)) {
            switch (leaf.getValue()) {
                case "if":
                    return parseIf();
                case "while":
                    return parseWhile();
                case "for":
                    return parseFor();
                case "try":
                    return parseTry();
                case "with":
                    return parseWith();
                case "def":
                    return parseFuncdef();
                case "class":
                    return parseClass();
                case "async":
                    if (peek(1).isName("def") || peek(1).isName("for") || peek(1).isName("with")) {
                        return parseAsync();
                    }
                    break;
                case "match":
                    TreeNode match = tryParseMatch();
                    if (match != null) {
                        return match;
                    }
                    break;
                default:
                    break;
            }
        }
        return parseSimpleStatement();
    }

    private Node parseSimpleStatement() throws SourceSyntaxException {
        List<TreeNode> children = new ArrayList<>();
        children.add(parseSmallStatement());
        while (atOp(";")) {
            children.add(next());
            if (at(TokenType.NEWLINE)) {
                break;
            }
            children.add(parseSmallStatement());
        }
        children.add(expect(TokenType.NEWLINE));
        return new Node(NodeType.SIMPLE_STMT, children);
    }

    private TreeNode parseSmallStatement() throws SourceSyntaxException {
        Leaf leaf = peek();
        if (!leaf.is(TokenType.NAME)) {
            return parseExprStatement();
        }
        switch (leaf.getValue()) {
            case "pass":
            case "break":
            case "continue":
                return next();
            case "del":
                return new Node(NodeType.DEL_STMT, List.of(next(), parseExprList()));
            case "return": {
                Leaf keyword = next();
                if (atStatementEnd()) {
                    return keyword;
                }
                return new Node(NodeType.RETURN_STMT, List.of(keyword, parseTestlistStarExpr()));
            }
            case "raise": {
                Leaf keyword = next();
                if (atStatementEnd()) {
                    return keyword;
                }
                List<TreeNode> children = new ArrayList<>(List.of(keyword, parseTest()));
                if (atName("from")) {
                    children.add(next());
                    children.add(parseTest());
                }
                return new Node(NodeType.RAISE_STMT, children);
            }
            case "global":
            case "nonlocal": {
                List<TreeNode> children = new ArrayList<>(List.of(next(), expectIdentifier()));
                while (atOp(",")) {
                    children.add(next());
                    children.add(expectIdentifier());
                }
                return new Node(NodeType.GLOBAL_STMT, children);
            }
            case "import":
                return new Node(NodeType.IMPORT_NAME, List.of(next(), parseDottedAsNames()));
            case "from":
                return parseImportFrom();
            case "type":
                return atTypeStatement() ? parseTypeStatement() : parseExprStatement();
            case "assert": {
                List<TreeNode> children = new ArrayList<>(List.of(next(), parseTest()));
                if (atOp(",")) {
                    children.add(next());
                    children.add(parseTest());
                }
                return new Node(NodeType.ASSERT_STMT, children);
            }
            default:
                return parseExprStatement();
        }
    }

    private TreeNode parseExprStatement() throws SourceSyntaxException {
        TreeNode first = atName("yield") ? parseYieldExpr() : parseTestlistStarExpr();
        if (atOp(":")) {
            List<TreeNode> annotation = new ArrayList<>(List.of(next(), parseTest()));
            if (atOp("=")) {
                annotation.add(next());
                annotation.add(atName("yield") ? parseYieldExpr() : parseTestlistStarExpr());
            }
            return new Node(NodeType.EXPR_STMT, List.of(first, new Node(NodeType.ANNASSIGN, annotation)));
        }
        if (peek().is(TokenType.OP) && AUGMENTED_ASSIGNMENTS.contains(peek().getValue())) {
            Leaf operator = next();
            TreeNode value = atName("yield") ? parseYieldExpr() : parseTestlistStarExpr();
            return new Node(NodeType.EXPR_STMT, List.of(first, operator, value));
        }
        if (atOp("=")) {
            List<TreeNode> children = new ArrayList<>();
            children.add(first);
            while (atOp("=")) {
                children.add(next());
                children.add(atName("yield") ? parseYieldExpr() : parseTestlistStarExpr());
            }
            return new Node(NodeType.EXPR_STMT, children);
        }
        return first;
    }

    private TreeNode parseImportFrom() throws SourceSyntaxException {
        List<TreeNode> children = new ArrayList<>();
        children.add(next());
        while (atOp(".") || atOp("...")) {
            children.add(next());
        }
        if (!atName("import")) {
            children.add(parseDottedName());
        }
        children.add(expectName("import"));
        if (atOp("*")) {
            children.add(next());
        } else if (atOp("(")) {
            children.add(next());
            children.add(parseImportAsNames());
            children.add(expectOp(")"));
        } else {
            children.add(parseImportAsNames());
        }
        return new Node(NodeType.IMPORT_FROM, children);
    }

    private TreeNode parseImportAsNames() throws SourceSyntaxException {
        List<TreeNode> children = new ArrayList<>();
        children.add(parseImportAsName());
        boolean sawComma = false;
        while (atOp(",")) {
            sawComma = true;
            children.add(next());
            if (!at(TokenType.NAME)) {
                break;
            }
            children.add(parseImportAsName());
        }
        return sawComma ? new Node(NodeType.IMPORT_AS_NAMES, children) : children.get(0);
    }

    private TreeNode parseImportAsName() throws SourceSyntaxException {
        Leaf name = expectIdentifier();
        if (atName("as")) {
            return new Node(NodeType.IMPORT_AS_NAME, List.of(name, next(), expectIdentifier()));
        }
        return name;
    }

    private TreeNode parseDottedAsNames() throws SourceSyntaxException {
        List<TreeNode> children = new ArrayList<>();
        children.add(parseDottedAsName());
        while (atOp(",")) {
            children.add(next());
            children.add(parseDottedAsName());
        }
        return collapse(NodeType.DOTTED_AS_NAMES, children);
    }

    private TreeNode parseDottedAsName() throws SourceSyntaxException {
        TreeNode name = parseDottedName();
        if (atName("as")) {
            return new Node(NodeType.DOTTED_AS_NAME, List.of(name, next(), expectIdentifier()));
        }
        return name;
    }

    private TreeNode parseDottedName() throws SourceSyntaxException {
        List<TreeNode> children = new ArrayList<>();
        children.add(expectIdentifier());
        while (atOp(".")) {
            children.add(next());
            children.add(expectIdentifier());
        }
        return collapse(NodeType.DOTTED_NAME, children);
    }

    // ------------------------------------------------------------------ compound statements

    private TreeNode parseSuite() throws SourceSyntaxException {
        if (!at(TokenType.NEWLINE)) {
            return parseSimpleStatement();
        }
        List<TreeNode> children = new ArrayList<>();
        children.add(next());
        if (!at(TokenType.INDENT)) {
            throw error("expected an indented block");
        }
        children.add(next());
        do {
            children.add(parseStatement());
        } while (!at(TokenType.DEDENT) && !at(TokenType.ENDMARKER));
        children.add(expect(TokenType.DEDENT));
        return new Node(NodeType.SUITE, children);
    }

    private void addBlock(List<TreeNode> children) throws SourceSyntaxException {
        children.add(expectOp(":"));
        children.add(parseSuite());
    }

    private Node parseIf() throws SourceSyntaxException {
        List<TreeNode> children = new ArrayList<>();
        children.add(next());
        children.add(parseNamedExprTest());
        addBlock(children);
        while (atName("elif")) {
            children.add(next());
            children.add(parseNamedExprTest());
            addBlock(children);
        }
        if (atName("else")) {
            children.add(next());
            addBlock(children);
        }
        return new Node(NodeType.IF_STMT, children);
    }

    private Node parseWhile() throws SourceSyntaxException {
        List<TreeNode> children = new ArrayList<>();
        children.add(next());
        children.add(parseNamedExprTest());
        addBlock(children);
        if (atName("else")) {
            children.add(next());
            addBlock(children);
        }
        return new Node(NodeType.WHILE_STMT, children);
    }

    private Node parseFor() throws SourceSyntaxException {
        List<TreeNode> children = new ArrayList<>();
        children.add(next());
        children.add(parseExprList());
        children.add(expectName("in"));
        children.add(parseList(NodeType.TESTLIST_STAR_EXPR, this::parseTestOrStar));
        addBlock(children);
        if (atName("else")) {
            children.add(next());
            addBlock(children);
        }
        return new Node(NodeType.FOR_STMT, children);
    }

    private Node parseTry() throws SourceSyntaxException {
        List<TreeNode> children = new ArrayList<>();
        children.add(next());
        addBlock(children);
        boolean handled = false;
        while (atName("except")) {
            handled = true;
            children.add(parseExceptClause());
            addBlock(children);
        }
        if (handled && atName("else")) {
            children.add(next());
            addBlock(children);
        }
        if (atName("finally")) {
            handled = true;
            children.add(next());
            addBlock(children);
        }
        if (!handled) {
            throw error("expected 'except' or 'finally' block");
        }
        return new Node(NodeType.TRY_STMT, children);
    }

    private TreeNode parseExceptClause() throws SourceSyntaxException {
        List<TreeNode> children = new ArrayList<>();
        children.add(next());
        if (atOp("*")) {
            children.add(next());
        }
        if (!atOp(":")) {
            children.add(parseTest());
            if (atName("as")) {
                children.add(next());
                children.add(expectIdentifier());
            }
        }
        return collapse(NodeType.EXCEPT_CLAUSE, children);
    }

    private Node parseWith() throws SourceSyntaxException {
        List<TreeNode> children = new ArrayList<>();
        children.add(next());
        boolean parsed = false;
        if (atOp("(")) {
            int saved = pos;
            try {
                TreeNode items = parseParenthesizedWithItems();
                if (atOp(":")) {
                    children.add(items);
                    parsed = true;
                } else {
                    pos = saved;
                }
            } catch (SourceSyntaxException e) {
                pos = saved;
            }
        }
        if (!parsed) {
            children.add(parseWithItem());
            while (atOp(",")) {
                children.add(next());
                children.add(parseWithItem());
            }
        }
        addBlock(children);
        return new Node(NodeType.WITH_STMT, children);
    }

    private Node parseParenthesizedWithItems() throws SourceSyntaxException {
        Leaf lpar = expectOp("(");
        List<TreeNode> items = new ArrayList<>();
        items.add(parseWithItem());
        boolean sawComma = false;
        while (atOp(",")) {
            sawComma = true;
            items.add(next());
            if (atOp(")")) {
                break;
            }
            items.add(parseWithItem());
        }
        Leaf rpar = expectOp(")");
        TreeNode inner = sawComma ? new Node(NodeType.TESTLIST_GEXP, items) : items.get(0);
        return new Node(NodeType.ATOM, List.of(lpar, inner, rpar));
    }

    private TreeNode parseWithItem() throws SourceSyntaxException {
        TreeNode context = parseTest();
        if (atName("as")) {
            return new Node(NodeType.ASEXPR_TEST, List.of(context, next(), parseExpr()));
        }
        return context;
    }

    private Node parseFuncdef() throws SourceSyntaxException {
        List<TreeNode> children = new ArrayList<>();
        children.add(next());
        children.add(expectIdentifier());
        if (atOp("[")) {
            children.add(parseTypeParams());
        }
        children.add(parseParameters());
        if (atOp("->")) {
            children.add(next());
            children.add(parseTest());
        }
        addBlock(children);
        return new Node(NodeType.FUNCDEF, children);
    }

    private Node parseParameters() throws SourceSyntaxException {
        List<TreeNode> children = new ArrayList<>();
        children.add(expectOp("("));
        if (!atOp(")")) {
            children.add(parseArgsList(NodeType.TYPEDARGSLIST, ")", true));
        }
        children.add(expectOp(")"));
        return new Node(NodeType.PARAMETERS, children);
    }

    /**
     * Parameter lists of definitions (typed) and lambdas (untyped).
     */
    private TreeNode parseArgsList(NodeType type, String terminator, boolean typed) throws SourceSyntaxException {
        List<TreeNode> children = new ArrayList<>();
        while (!atOp(terminator)) {
            if (atOp("*")) {
                children.add(next());
                if (at(TokenType.NAME)) {
                    children.add(parseParameterName(typed, true));
                }
            } else if (atOp("**")) {
                children.add(next());
                children.add(parseParameterName(typed, false));
            } else if (atOp("/")) {
                children.add(next());
            } else {
                children.add(parseParameterName(typed, false));
                if (atOp("=")) {
                    children.add(next());
                    children.add(parseTest());
                }
            }
            if (!atOp(",")) {
                break;
            }
            children.add(next());
        }
        if (children.isEmpty()) {
            throw error("expected parameters");
        }
        return collapse(type, children);
    }

    private TreeNode parseParameterName(boolean typed, boolean starred) throws SourceSyntaxException {
        Leaf name = expectIdentifier();
        if (!typed || !atOp(":")) {
            return name;
        }
        Leaf colon = next();
        if (starred && atOp("*")) {
            return new Node(NodeType.TNAME_STAR, List.of(name, colon, parseStarExpr()));
        }
        return new Node(NodeType.TNAME, List.of(name, colon, parseTest()));
    }

    private Node parseClass() throws SourceSyntaxException {
        List<TreeNode> children = new ArrayList<>();
        children.add(next());
        children.add(expectIdentifier());
        if (atOp("[")) {
            children.add(parseTypeParams());
        }
        if (atOp("(")) {
            children.add(next());
            if (!atOp(")")) {
                children.add(parseArglist());
            }
            children.add(expectOp(")"));
        }
        addBlock(children);
        return new Node(NodeType.CLASSDEF, children);
    }

    /**
     * {@code [T, T2: bound, *Ts, **P]} after a function or class name, or in a type alias.
     */
    private Node parseTypeParams() throws SourceSyntaxException {
        List<TreeNode> children = new ArrayList<>();
        children.add(expectOp("["));
        do {
            if (atOp("*")) {
                children.add(new Node(NodeType.TYPEVARTUPLE, List.of(next(), expectIdentifier())));
            } else if (atOp("**")) {
                children.add(new Node(NodeType.PARAMSPEC, List.of(next(), expectIdentifier())));
            } else {
                Leaf name = expectIdentifier();
                if (atOp(":")) {
                    children.add(new Node(NodeType.TYPEVAR, List.of(name, next(), parseExpr())));
                } else {
                    children.add(name);
                }
            }
            if (!atOp(",")) {
                break;
            }
            children.add(next());
        } while (!atOp("]"));
        children.add(expectOp("]"));
        return new Node(NodeType.TYPEPARAMS, children);
    }

    /**
     * {@code type} is a soft keyword: it starts an alias only when a name and then {@code =} or
     * a type parameter list follow it.
     */
    private boolean atTypeStatement() {
        Leaf name = peek(1);
        return atName("type") && name.is(TokenType.NAME) && !KEYWORDS.contains(name.getValue())
                && (peek(2).isOp("=") || peek(2).isOp("["));
    }

    private Node parseTypeStatement() throws SourceSyntaxException {
        List<TreeNode> children = new ArrayList<>();
        children.add(next());
        children.add(expectIdentifier());
        if (atOp("[")) {
            children.add(parseTypeParams());
        }
        children.add(expectOp("="));
        children.add(parseTest());
        return new Node(NodeType.TYPE_STMT, children);
    }

    private Node parseDecorated() throws SourceSyntaxException {
        List<TreeNode> decorators = new ArrayList<>();
        while (atOp("@")) {
            decorators.add(new Node(NodeType.DECORATOR,
                    List.of(next(), parseNamedExprTest(), expect(TokenType.NEWLINE))));
        }
        TreeNode decorated;
        if (atName("def")) {
            decorated = parseFuncdef();
        } else if (atName("class")) {
            decorated = parseClass();
        } else if (atName("async") && peek(1).isName("def")) {
            decorated = new Node(NodeType.ASYNC_FUNCDEF, List.of(next(), parseFuncdef()));
        } else {
            throw error("expected a function or class after decorators");
        }
        TreeNode decoratorNode = collapse(NodeType.DECORATORS, decorators);
        return new Node(NodeType.DECORATED, List.of(decoratorNode, decorated));
    }

    private Node parseAsync() throws SourceSyntaxException {
        Leaf async = next();
        TreeNode statement;
        if (atName("def")) {
            statement = parseFuncdef();
        } else if (atName("for")) {
            statement = parseFor();
        } else {
            statement = parseWith();
        }
        return new Node(NodeType.ASYNC_STMT, List.of(async, statement));
    }

    /**
     * {@code match} is a soft keyword: the statement is only a match statement when it parses as
     * one up to its first {@code case}. Otherwise the position is restored and null returned.
     */
    private TreeNode tryParseMatch() throws SourceSyntaxException {
        int saved = pos;
        List<TreeNode> children = new ArrayList<>();
        try {
            children.add(next());
            children.add(parseList(NodeType.TESTLIST_STAR_EXPR, this::parseNamedOrStar));
            children.add(expectOp(":"));
            children.add(expect(TokenType.NEWLINE));
            children.add(expect(TokenType.INDENT));
            if (!atName("case")) {
                throw error("expected 'case'");
            }
        } catch (SourceSyntaxException e) {
            pos = saved;
            return null;
        }
        while (atName("case")) {
            children.add(parseCaseBlock());
        }
        children.add(expect(TokenType.DEDENT));
        return new Node(NodeType.MATCH_STMT, children);
    }

    private Node parseCaseBlock() throws SourceSyntaxException {
        List<TreeNode> children = new ArrayList<>();
        children.add(next());
        boolean previous = patternMode;
        patternMode = true;
        try {
            children.add(parseList(NodeType.TESTLIST_STAR_EXPR, this::parsePattern));
        } finally {
            patternMode = previous;
        }
        if (atName("if")) {
            children.add(new Node(NodeType.GUARD, List.of(next(), parseNamedExprTest())));
        }
        addBlock(children);
        return new Node(NodeType.CASE_BLOCK, children);
    }

    private TreeNode parsePattern() throws SourceSyntaxException {
        TreeNode pattern = atOp("*") ? parseStarExpr() : parseExpr();
        if (atName("as")) {
            return new Node(NodeType.ASEXPR_TEST, List.of(pattern, next(), expectIdentifier()));
        }
        return pattern;
    }

    // ------------------------------------------------------------------ expressions

    private TreeNode parseTestlistStarExpr() throws SourceSyntaxException {
        return parseList(NodeType.TESTLIST_STAR_EXPR, this::parseTestOrStar);
    }

    private TreeNode parseExprList() throws SourceSyntaxException {
        return parseList(NodeType.EXPRLIST, () -> atOp("*") ? parseStarExpr() : parseExpr());
    }

    private TreeNode parseTestOrStar() throws SourceSyntaxException {
        return atOp("*") ? parseStarExpr() : parseTest();
    }

    private TreeNode parseNamedOrStar() throws SourceSyntaxException {
        if (atOp("*")) {
            return parseStarExpr();
        }
        if (patternMode) {
            return parsePattern();
        }
        return parseNamedExprTest();
    }

    private Node parseStarExpr() throws SourceSyntaxException {
        return new Node(NodeType.STAR_EXPR, List.of(next(), parseExpr()));
    }

    private TreeNode parseNamedExprTest() throws SourceSyntaxException {
        TreeNode test = parseTest();
        if (atOp(":=")) {
            return new Node(NodeType.NAMEDEXPR_TEST, List.of(test, next(), parseTest()));
        }
        return test;
    }

    private TreeNode parseTest() throws SourceSyntaxException {
        if (atName("lambda")) {
            return parseLambdef();
        }
        TreeNode condition = parseOrTest();
        if (atName("if") && !patternMode) {
            List<TreeNode> children = new ArrayList<>();
            children.add(condition);
            children.add(next());
            children.add(parseOrTest());
            children.add(expectName("else"));
            children.add(parseTest());
            return new Node(NodeType.TEST, children);
        }
        return condition;
    }

    private TreeNode parseTestNoCond() throws SourceSyntaxException {
        return atName("lambda") ? parseLambdef() : parseOrTest();
    }

    private Node parseLambdef() throws SourceSyntaxException {
        List<TreeNode> children = new ArrayList<>();
        children.add(next());
        if (!atOp(":")) {
            children.add(parseArgsList(NodeType.VARARGSLIST, ":", false));
        }
        children.add(expectOp(":"));
        children.add(parseTest());
        return new Node(NodeType.LAMBDEF, children);
    }

    private TreeNode parseOrTest() throws SourceSyntaxException {
        List<TreeNode> children = new ArrayList<>();
        children.add(parseAndTest());
        while (atName("or")) {
            children.add(next());
            children.add(parseAndTest());
        }
        return collapse(NodeType.OR_TEST, children);
    }

    private TreeNode parseAndTest() throws SourceSyntaxException {
        List<TreeNode> children = new ArrayList<>();
        children.add(parseNotTest());
        while (atName("and")) {
            children.add(next());
            children.add(parseNotTest());
        }
        return collapse(NodeType.AND_TEST, children);
    }

    private TreeNode parseNotTest() throws SourceSyntaxException {
        if (atName("not")) {
            return new Node(NodeType.NOT_TEST, List.of(next(), parseNotTest()));
        }
        return parseComparison();
    }

    private TreeNode parseComparison() throws SourceSyntaxException {
        List<TreeNode> children = new ArrayList<>();
        children.add(parseExpr());
        while (true) {
            Leaf leaf = peek();
            if (leaf.is(TokenType.OP) && COMPARISON_OPERATORS.contains(leaf.getValue())) {
                children.add(next());
            } else if (leaf.isName("in")) {
                children.add(next());
            } else if (leaf.isName("not") && peek(1).isName("in")) {
                children.add(new Node(NodeType.COMP_OP, List.of(next(), next())));
            } else if (leaf.isName("is")) {
                if (peek(1).isName("not")) {
                    children.add(new Node(NodeType.COMP_OP, List.of(next(), next())));
                } else {
                    children.add(next());
                }
            } else {
                break;
            }
            children.add(parseExpr());
        }
        return collapse(NodeType.COMPARISON, children);
    }

    private TreeNode parseBinary(NodeType type, Set<String> operators, ParseStep operand)
            throws SourceSyntaxException {
        List<TreeNode> children = new ArrayList<>();
        children.add(operand.parse());
        while (peek().is(TokenType.OP) && operators.contains(peek().getValue())) {
            children.add(next());
            children.add(operand.parse());
        }
        return collapse(type, children);
    }

    private TreeNode parseExpr() throws SourceSyntaxException {
        return parseBinary(NodeType.EXPR, Set.of("|"), this::parseXorExpr);
    }

    private TreeNode parseXorExpr() throws SourceSyntaxException {
        return parseBinary(NodeType.XOR_EXPR, Set.of("^"), this::parseAndExpr);
    }

    private TreeNode parseAndExpr() throws SourceSyntaxException {
        return parseBinary(NodeType.AND_EXPR, Set.of("&"), this::parseShiftExpr);
    }

    private TreeNode parseShiftExpr() throws SourceSyntaxException {
        return parseBinary(NodeType.SHIFT_EXPR, Set.of("<<", ">>"), this::parseArithExpr);
    }

    private TreeNode parseArithExpr() throws SourceSyntaxException {
        return parseBinary(NodeType.ARITH_EXPR, Set.of("+", "-"), this::parseTerm);
    }

    private TreeNode parseTerm() throws SourceSyntaxException {
        return parseBinary(NodeType.TERM, Set.of("*", "/", "%", "//", "@"), this::parseFactor);
    }

    private TreeNode parseFactor() throws SourceSyntaxException {
        if (atOp("+") || atOp("-") || atOp("~")) {
            return new Node(NodeType.FACTOR, List.of(next(), parseFactor()));
        }
        return parsePower();
    }

    private TreeNode parsePower() throws SourceSyntaxException {
        List<TreeNode> children = new ArrayList<>();
        if (atName("await") && startsAwaitOperand()) {
            children.add(next());
        }
        children.add(parseAtom());
        while (atOp("(") || atOp("[") || atOp(".")) {
            children.add(parseTrailer());
        }
        TreeNode base = collapse(NodeType.POWER, children);
        if (atOp("**")) {
            return new Node(NodeType.POWER, List.of(base, next(), parseFactor()));
        }
        return base;
    }

    private boolean startsAwaitOperand() {
        Leaf following = peek(1);
        return switch (following.getType()) {
            case NAME -> !KEYWORDS.contains(following.getValue())
                    || Set.of("True", "False", "None").contains(following.getValue());
            case NUMBER, STRING -> true;
            case OP -> Set.of("(", "[", "{", "...").contains(following.getValue());
            default -> false;
        };
    }

    private TreeNode parseAtom() throws SourceSyntaxException {
        Leaf leaf = peek();
        switch (leaf.getType()) {
            case NUMBER:
                return next();
            case STRING: {
                Leaf first = next();
                if (!at(TokenType.STRING)) {
                    return first;
                }
                List<TreeNode> strings = new ArrayList<>();
                strings.add(first);
                while (at(TokenType.STRING)) {
                    strings.add(next());
                }
                return new Node(NodeType.ATOM, strings);
            }
            case NAME:
                if (KEYWORDS.contains(leaf.getValue())
                        && !Set.of("True", "False", "None").contains(leaf.getValue())) {
                    throw error("invalid syntax");
                }
                return next();
            case OP:
                break;
            default:
                throw error("invalid syntax");
        }
        switch (leaf.getValue()) {
            case "(": {
                Leaf lpar = next();
                if (atOp(")")) {
                    return new Node(NodeType.ATOM, List.of(lpar, next()));
                }
                boolean previous = patternMode;
                TreeNode inner = atName("yield") ? parseYieldExpr() : parseTestlistGexp(NodeType.TESTLIST_GEXP);
                patternMode = previous;
                return new Node(NodeType.ATOM, List.of(lpar, inner, expectOp(")")));
            }
            case "[": {
                Leaf lsqb = next();
                if (atOp("]")) {
                    return new Node(NodeType.ATOM, List.of(lsqb, next()));
                }
                TreeNode inner = parseTestlistGexp(NodeType.LISTMAKER);
                return new Node(NodeType.ATOM, List.of(lsqb, inner, expectOp("]")));
            }
            case "{": {
                Leaf lbrace = next();
                if (atOp("}")) {
                    return new Node(NodeType.ATOM, List.of(lbrace, next()));
                }
                TreeNode inner = parseDictSetMaker();
                return new Node(NodeType.ATOM, List.of(lbrace, inner, expectOp("}")));
            }
            case "...":
                return next();
            default:
                throw error("invalid syntax");
        }
    }

    private TreeNode parseTestlistGexp(NodeType type) throws SourceSyntaxException {
        TreeNode first = parseNamedOrStar();
        if (atCompFor()) {
            return new Node(type, List.of(first, parseCompFor()));
        }
        if (!atOp(",")) {
            return first;
        }
        List<TreeNode> children = new ArrayList<>();
        children.add(first);
        while (atOp(",")) {
            children.add(next());
            if (!startsExpression()) {
                break;
            }
            children.add(parseNamedOrStar());
        }
        return new Node(type, children);
    }

    private Node parseCompFor() throws SourceSyntaxException {
        List<TreeNode> children = new ArrayList<>();
        if (atName("async")) {
            children.add(next());
        }
        children.add(expectName("for"));
        children.add(parseExprList());
        children.add(expectName("in"));
        children.add(parseOrTest());
        if (atCompFor()) {
            children.add(parseCompFor());
        } else if (atName("if")) {
            children.add(parseCompIf());
        }
        return new Node(NodeType.COMP_FOR, children);
    }

    private Node parseCompIf() throws SourceSyntaxException {
        List<TreeNode> children = new ArrayList<>();
        children.add(next());
        children.add(parseTestNoCond());
        if (atCompFor()) {
            children.add(parseCompFor());
        } else if (atName("if")) {
            children.add(parseCompIf());
        }
        return new Node(NodeType.COMP_IF, children);
    }

    private TreeNode parseDictSetMaker() throws SourceSyntaxException {
        List<TreeNode> children = new ArrayList<>();
        parseDictOrSetItem(children);
        if (atCompFor()) {
            children.add(parseCompFor());
            return new Node(NodeType.DICTSETMAKER, children);
        }
        while (atOp(",")) {
            children.add(next());
            if (atOp("}")) {
                break;
            }
            parseDictOrSetItem(children);
        }
        return collapse(NodeType.DICTSETMAKER, children);
    }

    private void parseDictOrSetItem(List<TreeNode> children) throws SourceSyntaxException {
        if (atOp("**")) {
            children.add(next());
            children.add(parseExpr());
            return;
        }
        TreeNode key = parseNamedOrStar();
        children.add(key);
        if (atOp(":")) {
            children.add(next());
            children.add(patternMode ? parsePattern() : parseTest());
        }
    }

    private Node parseTrailer() throws SourceSyntaxException {
        Leaf open = next();
        if (open.isOp(".")) {
            return new Node(NodeType.TRAILER, List.of(open, expectIdentifierOrSoftKeyword()));
        }
        if (open.isOp("(")) {
            if (atOp(")")) {
                return new Node(NodeType.TRAILER, List.of(open, next()));
            }
            TreeNode arguments = parseArglist();
            return new Node(NodeType.TRAILER, List.of(open, arguments, expectOp(")")));
        }
        TreeNode subscripts = parseSubscriptList();
        return new Node(NodeType.TRAILER, List.of(open, subscripts, expectOp("]")));
    }

    private Leaf expectIdentifierOrSoftKeyword() throws SourceSyntaxException {
        if (!at(TokenType.NAME)) {
            throw error("expected a name");
        }
        return next();
    }

    private TreeNode parseArglist() throws SourceSyntaxException {
        List<TreeNode> children = new ArrayList<>();
        children.add(parseArgument());
        boolean sawComma = false;
        while (atOp(",")) {
            sawComma = true;
            children.add(next());
            if (atOp(")")) {
                break;
            }
            children.add(parseArgument());
        }
        return sawComma ? new Node(NodeType.ARGLIST, children) : children.get(0);
    }

    private TreeNode parseArgument() throws SourceSyntaxException {
        if (atOp("*") || atOp("**")) {
            return new Node(NodeType.ARGUMENT, List.of(next(), parseTest()));
        }
        TreeNode value = patternMode ? parsePattern() : parseTest();
        if (atOp(":=")) {
            return new Node(NodeType.NAMEDEXPR_TEST, List.of(value, next(), parseTest()));
        }
        if (atOp("=")) {
            return new Node(NodeType.ARGUMENT, List.of(value, next(), patternMode ? parsePattern() : parseTest()));
        }
        if (atCompFor()) {
            return new Node(NodeType.ARGUMENT, List.of(value, parseCompFor()));
        }
        return value;
    }

    private TreeNode parseSubscriptList() throws SourceSyntaxException {
        List<TreeNode> children = new ArrayList<>();
        children.add(parseSubscript());
        boolean sawComma = false;
        while (atOp(",")) {
            sawComma = true;
            children.add(next());
            if (atOp("]")) {
                break;
            }
            children.add(parseSubscript());
        }
        return sawComma ? new Node(NodeType.SUBSCRIPTLIST, children) : children.get(0);
    }

    private TreeNode parseSubscript() throws SourceSyntaxException {
        if (atOp("*")) {
            return parseStarExpr();
        }
        List<TreeNode> children = new ArrayList<>();
        if (!atOp(":")) {
            TreeNode index = parseNamedExprTest();
            if (!atOp(":")) {
                return index;
            }
            children.add(index);
        }
        children.add(next());
        if (!atOp(":") && !atOp("]") && !atOp(",")) {
            children.add(parseTest());
        }
        if (atOp(":")) {
            Leaf colon = next();
            if (!atOp("]") && !atOp(",")) {
                children.add(new Node(NodeType.SLICEOP, List.of(colon, parseTest())));
            } else {
                children.add(colon);
            }
        }
        return collapse(NodeType.SUBSCRIPT, children);
    }

    private TreeNode parseYieldExpr() throws SourceSyntaxException {
        Leaf yield = next();
        if (atName("from")) {
            return new Node(NodeType.YIELD_EXPR,
                    List.of(yield, new Node(NodeType.YIELD_ARG, List.of(next(), parseTest()))));
        }
        if (atStatementEnd() || atOp(")") || atOp("=") || !startsExpression()) {
            return yield;
        }
        return new Node(NodeType.YIELD_EXPR, List.of(yield, parseTestlistStarExpr()));
    }
}

package com.pyformatter.tree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.pyformatter.api.error.SourceSyntaxException;
import com.pyformatter.tokenize.TokenType;

class TreeBuilderTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "x = 1\n",
            "#!/usr/bin/env python\n# comment\n\nimport os, sys\nfrom . import (a,\n    b as c)\n",
            "def f(a, *, b: int = 1, **kw) -> None:\n    '''Doc.'''\n    return a\n",
            "class A(B, metaclass=M):\n    x: int = 0\n\n    # trailing comment\n",
            "if x:\n    pass\nelif y:  # why\n    pass\nelse:\n    pass\n",
            "try:\n    a()\nexcept (E1, E2) as e:\n    raise X from e\nfinally:\n    b()\n",
            "with open(f) as a, open(g) as b:\n    pass\n",
            "@dec\n@dec2(x)\nasync def g():\n    await h()\n    async for i in j:\n        yield i\n",
            "x = [i for i in range(10) if i % 2]\ny = {k: v for k, v in d.items()}\n",
            "print(*args, sep='', **kw)\nz = a[1:2, ::3]\n",
            "match p:\n    case [1, *rest] if rest:\n        pass\n    case {'k': v}:\n        pass\n    case _:\n        pass\n",
            "x = 1 + \\\n    2\n",
            "lambda x, y=1: x + y\n",
            "a = b if c else d\nnot a and b or c\n",
            "  \n\nx = 1   \n\n\n",
            "x = 1",
            "def f[T: int, *Ts, **P](x: T) -> T:\n    return x\n",
            "class C[T](Base):\n    pass\n",
            "type Alias[K, V] = dict[K, V]\ntype = 1\nprint(type(x))\n",
    })
    void renderingReproducesInput(String source) throws SourceSyntaxException {
        Node tree = TreeBuilder.parse(source);
        assertEquals(NodeType.FILE_INPUT, tree.getType());
        assertEquals(source, tree.toString());
    }

    @Test
    void operatorChainsAreFlat() throws SourceSyntaxException {
        Node tree = TreeBuilder.parse("a + b - c\n");
        Node statement = (Node) tree.child(0);
        assertEquals(NodeType.SIMPLE_STMT, statement.getType());
        Node arith = (Node) statement.child(0);
        assertEquals(NodeType.ARITH_EXPR, arith.getType());
        assertEquals(5, arith.childCount());
    }

    @Test
    void singleChildProductionsCollapse() throws SourceSyntaxException {
        Node tree = TreeBuilder.parse("x\n");
        Node statement = (Node) tree.child(0);
        Leaf name = assertInstanceOf(Leaf.class, statement.child(0));
        assertTrue(name.is(TokenType.NAME));
        assertEquals("x", name.getValue());
    }

    @Test
    void commentsGoIntoTheNextLeafPrefix() throws SourceSyntaxException {
        Node tree = TreeBuilder.parse("# lead\nx = 1\n");
        assertEquals("# lead\n", tree.firstLeaf().getPrefix());
        assertEquals("x", tree.firstLeaf().getValue());
    }

    @Test
    void callsAreTrailers() throws SourceSyntaxException {
        Node tree = TreeBuilder.parse("f(a, b)\n");
        Node power = (Node) ((Node) tree.child(0)).child(0);
        assertEquals(NodeType.POWER, power.getType());
        Node trailer = (Node) power.child(1);
        assertEquals(NodeType.TRAILER, trailer.getType());
        assertEquals(NodeType.ARGLIST, ((Node) trailer.child(1)).getType());
    }

    @Test
    void replaceKeepsParentLinks() throws SourceSyntaxException {
        Node tree = TreeBuilder.parse("x = 1\n");
        Leaf one = tree.leaves().stream().filter(l -> l.getValue().equals("1")).findFirst().orElseThrow();
        Node parent = one.getParent();
        Leaf two = new Leaf(TokenType.NUMBER, "2", " ", 1, 4);
        one.replace(two);
        assertSame(parent, two.getParent());
        assertEquals(null, one.getParent());
        assertEquals("x = 2\n", tree.toString());
    }

    @Test
    void syntaxErrorsCarryPosition() {
        SourceSyntaxException e = assertThrows(SourceSyntaxException.class,
                () -> TreeBuilder.parse("x = 1\ndef f(:\n    pass\n"));
        assertEquals(2, e.getLine());
    }

    @Test
    void firstBadTokenIsReportedBeforeUnclosedBracket() {
        SourceSyntaxException e = assertThrows(SourceSyntaxException.class,
                () -> TreeBuilder.parse("def f(:\n    pass\n"));
        assertEquals(1, e.getLine());
        assertEquals(6, e.getColumn());
        assertTrue(e.getMessage().startsWith("Cannot parse"), e.getMessage());
    }

    @Test
    void bracketLeftOpenUntilEndOfFile() {
        SourceSyntaxException e = assertThrows(SourceSyntaxException.class,
                () -> TreeBuilder.parse("x = [1,\n     2,\n"));
        assertTrue(e.getMessage().contains("EOF in multi-line statement"), e.getMessage());
        assertEquals(3, e.getLine());
    }

    @Test
    void nestingDepthIsLimited() throws SourceSyntaxException {
        String deepest = "x = " + "(".repeat(200) + "1" + ")".repeat(200) + "\n";
        assertEquals(deepest, TreeBuilder.parse(deepest).toString());

        SourceSyntaxException e = assertThrows(SourceSyntaxException.class,
                () -> TreeBuilder.parse("x = " + "(".repeat(201) + "1" + ")".repeat(201) + "\n"));
        assertTrue(e.getMessage().contains("too many nested parentheses"), e.getMessage());
        assertEquals(1, e.getLine());
    }

    @Test
    void unexpectedIndentIsRejected() {
        assertThrows(SourceSyntaxException.class, () -> TreeBuilder.parse("x = 1\n    y = 2\n"));
    }

    @Test
    void typeParametersFollowTheDefinitionName() throws SourceSyntaxException {
        Node tree = TreeBuilder.parse("class C[T: int, *Ts, **P]:\n    pass\n");
        Node classdef = (Node) tree.child(0);
        assertEquals(NodeType.CLASSDEF, classdef.getType());
        Node params = (Node) classdef.child(2);
        assertEquals(NodeType.TYPEPARAMS, params.getType());
        assertEquals(NodeType.TYPEVAR, ((Node) params.child(1)).getType());
        assertEquals(NodeType.TYPEVARTUPLE, ((Node) params.child(3)).getType());
        assertEquals(NodeType.PARAMSPEC, ((Node) params.child(5)).getType());
    }

    @Test
    void typeIsOnlyAKeywordBeforeAnAlias() throws SourceSyntaxException {
        Node alias = (Node) ((Node) TreeBuilder.parse("type X = int\n").child(0)).child(0);
        assertEquals(NodeType.TYPE_STMT, alias.getType());

        Node assignment = (Node) ((Node) TreeBuilder.parse("type = int\n").child(0)).child(0);
        assertEquals(NodeType.EXPR_STMT, assignment.getType());
    }

    @Test
    void emptyTypeParameterListIsRejected() {
        assertThrows(SourceSyntaxException.class, () -> TreeBuilder.parse("def f[]():\n    pass\n"));
    }

    @Test
    void matchAsIdentifierStillParses() throws SourceSyntaxException {
        String source = "match = 1\nmatch.group(0)\n";
        assertEquals(source, TreeBuilder.parse(source).toString());
    }
}

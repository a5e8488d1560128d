package com.pyformatter.lines;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.pyformatter.tokenize.TokenType;

class CommentsTest {

    @Test
    void spaceIsAddedAfterTheHash() {
        assertEquals("# comment", Comments.makeComment("#comment"));
        assertEquals("# comment", Comments.makeComment("# comment   "));
        assertEquals("#", Comments.makeComment("#"));
    }

    @Test
    void specialCommentsKeepTheirSpelling() {
        assertEquals("#!/usr/bin/env python", Comments.makeComment("#!/usr/bin/env python"));
        assertEquals("#: doc comment", Comments.makeComment("#: doc comment"));
        assertEquals("###", Comments.makeComment("###"));
    }

    @Test
    void firstCommentOnSameLineIsTrailing() {
        List<Comments.ProtoComment> comments = Comments.listComments("  # trailing\n# own line\n", false);
        assertEquals(2, comments.size());
        assertEquals(TokenType.COMMENT, comments.get(0).getType());
        assertEquals(TokenType.STANDALONE_COMMENT, comments.get(1).getType());
    }

    @Test
    void endmarkerCommentsAreAlwaysStandalone() {
        List<Comments.ProtoComment> comments = Comments.listComments("# last\n", true);
        assertEquals(1, comments.size());
        assertTrue(comments.get(0).isStandalone());
    }

    @Test
    void blankLinesBeforeACommentAreCounted() {
        List<Comments.ProtoComment> comments = Comments.listComments("\n\n\n# later\n", false);
        assertEquals(1, comments.size());
        assertEquals(3, comments.get(0).getNewlines());
    }

    @Test
    void commentKinds() {
        assertEquals(Comments.Kind.SHEBANG, Comments.listComments("#!/bin/python\n", true).get(0).getKind());
        assertEquals(Comments.Kind.DOC_COMMENT, Comments.listComments("#: attr\n", true).get(0).getKind());
        assertEquals(Comments.Kind.SECTION_BANNER, Comments.listComments("# -----\n", true).get(0).getKind());
        assertEquals(Comments.Kind.ORDINARY, Comments.listComments("# text\n", true).get(0).getKind());
    }

    @Test
    void textAfterTheLastComment() {
        assertEquals("    ", Comments.afterComments("# a\n# b\n    ", false));
        assertEquals("  ", Comments.afterComments("  ", false));
    }

    @Test
    void fmtSkipSentinels() {
        assertTrue(Comments.containsFmtSkip("# fmt: skip"));
        assertTrue(Comments.containsFmtSkip("# fmt:skip"));
    }
}

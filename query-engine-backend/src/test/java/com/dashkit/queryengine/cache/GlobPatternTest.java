package com.dashkit.queryengine.cache;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class GlobPatternTest {

    @Test
    public void testStarMatchesAnyRun() {
        GlobPattern glob = GlobPattern.compile("query:t1:*");
        assertTrue(glob.matches("query:t1:ds1:abc"));
        assertTrue(glob.matches("query:t1:"));
        assertFalse(glob.matches("query:t10:ds1:abc"));
        assertFalse(glob.matches("query:t2:ds1:abc"));
    }

    @Test
    public void testQuestionMarkMatchesOneCharacter() {
        GlobPattern glob = GlobPattern.compile("key?");
        assertTrue(glob.matches("key1"));
        assertFalse(glob.matches("key"));
        assertFalse(glob.matches("key12"));
    }

    @Test
    public void testCharacterClasses() {
        assertTrue(GlobPattern.compile("h[ae]llo").matches("hallo"));
        assertFalse(GlobPattern.compile("h[ae]llo").matches("hillo"));
        assertTrue(GlobPattern.compile("h[a-c]llo").matches("hbllo"));
        assertTrue(GlobPattern.compile("h[^e]llo").matches("hallo"));
        assertFalse(GlobPattern.compile("h[^e]llo").matches("hello"));
    }

    @Test
    public void testEmptyClassMatchesNothing() {
        assertFalse(GlobPattern.compile("query:[]*").matches("query:t1:ds1:abc"));
        assertFalse(GlobPattern.compile("query:[]*").matches("query:[]"));
        assertTrue(GlobPattern.compile("a[^]c").matches("abc"));
        assertFalse(GlobPattern.compile("a[^]c").matches("ac"));
    }

    @Test
    public void testReversedRangeAndTrailingDash() {
        assertTrue(GlobPattern.compile("h[c-a]llo").matches("hbllo"));
        assertFalse(GlobPattern.compile("h[c-a]llo").matches("hdllo"));
        assertTrue(GlobPattern.compile("x[a-]").matches("x-"));
        assertTrue(GlobPattern.compile("x[\\.]").matches("x."));
    }

    @Test
    public void testEscapeAndRegexMetacharacters() {
        assertTrue(GlobPattern.compile("a\\*b").matches("a*b"));
        assertFalse(GlobPattern.compile("a\\*b").matches("axb"));
        assertTrue(GlobPattern.compile("a.b(c)+").matches("a.b(c)+"));
        assertFalse(GlobPattern.compile("a.b").matches("axb"));
    }

    @Test
    public void testNullNeverMatches() {
        assertFalse(GlobPattern.compile("*").matches(null));
    }
}

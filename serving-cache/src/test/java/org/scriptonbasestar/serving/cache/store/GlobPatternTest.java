package org.scriptonbasestar.serving.cache.store;

import org.junit.Test;

import java.util.regex.Pattern;

import static org.junit.Assert.*;

public class GlobPatternTest {

	@Test
	public void testStarMatchesAnySequence() {
		Pattern p = GlobPattern.compile("api:/posts*");

		assertTrue(p.matcher("api:/posts").matches());
		assertTrue(p.matcher("api:/posts?page=2").matches());
		assertFalse(p.matcher("api:/users").matches());
	}

	@Test
	public void testQuestionMarkMatchesSingleCharacter() {
		Pattern p = GlobPattern.compile("users:?");

		assertTrue(p.matcher("users:1").matches());
		assertFalse(p.matcher("users:12").matches());
	}

	@Test
	public void testCharacterClasses() {
		assertTrue(GlobPattern.compile("h[ae]llo").matcher("hallo").matches());
		assertFalse(GlobPattern.compile("h[ae]llo").matcher("hillo").matches());
		assertTrue(GlobPattern.compile("h[^e]llo").matcher("hallo").matches());
		assertFalse(GlobPattern.compile("h[^e]llo").matcher("hello").matches());
	}

	@Test
	public void testRegexMetaCharactersAreLiteral() {
		Pattern p = GlobPattern.compile("api:/a.b+(c)");

		assertTrue(p.matcher("api:/a.b+(c)").matches());
		assertFalse(p.matcher("api:/aXbb(c)").matches());
	}

	@Test
	public void testEscapedStarIsLiteral() {
		Pattern p = GlobPattern.compile("a\\*b");

		assertTrue(p.matcher("a*b").matches());
		assertFalse(p.matcher("axb").matches());
	}
}

package coincidence;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LongestCommonSubstringTest {

	private static Set<String> setOf(String... values) {
		Set<String> s = new HashSet<String>();
		for (String v : values) {
			s.add(v);
		}
		return s;
	}

	@Test
	void someStrings() {
		assertEquals(setOf("dxy"), LongestCommonSubstring.lcs("xydxyaa", "abcdxyz"));
		assertEquals(setOf("substring"), LongestCommonSubstring.lcs("aaaaaasubstringxxxxxx", "absubstringzzz"));
		assertEquals(setOf("shorter"), LongestCommonSubstring.lcs("shorter", "shorterlonger"));
		assertEquals(setOf("shorter"), LongestCommonSubstring.lcs("shorter", "longershorter"));
	}

	@Test
	void multipleSameLength() {
		Set<String> found = LongestCommonSubstring.lcs("xxx123yyyy456zzz", "789zzz012xxx345yyy");
		assertEquals(3, found.size());
		assertTrue(found.contains("xxx"));
		assertTrue(found.contains("yyy"));
		assertTrue(found.contains("zzz"));
	}

	@Test
	void noCommonSubstrings() {
		assertTrue(LongestCommonSubstring.lcs("123456", "abcdef").isEmpty());
	}

	@Test
	void emptyString() {
		assertTrue(LongestCommonSubstring.lcs("somestring", "").isEmpty());
		assertTrue(LongestCommonSubstring.lcs("", "somestring").isEmpty());
		assertTrue(LongestCommonSubstring.lcs("", "").isEmpty());
	}

	@Test
	void duplicateMatchesCollapse() {
		// "ab" occurs twice in each text
		assertEquals(setOf("ab"), LongestCommonSubstring.lcs("abxab", "abyab"));
	}

	@Test
	void identicalTextsReturnThemselves() {
		assertEquals(setOf("same text"), LongestCommonSubstring.lcs("same text", "same text"));
	}

	@Test
	void caseAndWhitespaceAreSignificant() {
		assertEquals(setOf("ello"), LongestCommonSubstring.lcs("Hello", "hello"));
		assertEquals(setOf("a", "b"), LongestCommonSubstring.lcs("a b", "ab"));
		assertTrue(LongestCommonSubstring.lcs("ABC", "abc").isEmpty());
	}

	@Test
	void acceptsAnyCharSequence() {
		StringBuilder sb = new StringBuilder("the quick brown fox");
		assertEquals(setOf(" brown f"), LongestCommonSubstring.lcs(sb, "a brown fish"));
	}

	@Test
	void matchesExhaustiveSearchOnRandomTexts() {
		Random random = new Random(20101010L);
		for (int round = 0; round < 300; round++) {
			String a = randomText(random, random.nextInt(15));
			String b = randomText(random, random.nextInt(15));
			Set<String> expected = bruteForce(a, b);

			Set<String> found = LongestCommonSubstring.lcs(a, b);
			assertEquals(expected, found, a + " / " + b);
			assertEquals(found, LongestCommonSubstring.lcs(b, a), "swapped " + a + " / " + b);
			assertEquals(found, LongestCommonSubstring.lcs(a, b), "repeated " + a + " / " + b);

			int length = -1;
			for (String s : found) {
				assertTrue(a.contains(s));
				assertTrue(b.contains(s));
				if (length < 0) {
					length = s.length();
				}
				assertEquals(length, s.length());
			}
		}
	}

	@Test
	void longTextsWithLongOverlap() {
		StringBuilder common = new StringBuilder();
		for (int i = 0; i < 200; i++) {
			common.append((char) ('a' + (i * 7) % 26));
		}
		String a = "0123" + common + "4567";
		String b = "89" + common + "xyz";
		assertEquals(setOf(common.toString()), LongestCommonSubstring.lcs(a, b));
	}

	private static String randomText(Random random, int length) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < length; i++) {
			sb.append((char) ('a' + random.nextInt(3)));
		}
		return sb.toString();
	}

	private static Set<String> bruteForce(String a, String b) {
		Set<String> best = new HashSet<String>();
		int bestLength = 0;
		for (int i = 0; i < a.length(); i++) {
			for (int j = i + 1; j <= a.length(); j++) {
				String s = a.substring(i, j);
				if (!b.contains(s) || s.length() < bestLength) {
					continue;
				}
				if (s.length() > bestLength) {
					best.clear();
					bestLength = s.length();
				}
				best.add(s);
			}
		}
		return best;
	}
}

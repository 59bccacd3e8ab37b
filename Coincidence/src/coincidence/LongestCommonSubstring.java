package coincidence;

import java.util.HashSet;
import java.util.Set;

/**
 * Longest common substrings of two texts by dynamic programming.
 *
 * <p>Every character of one text is compared with every character of the
 * other, so the running time is O(len(text1) * len(text2)). Only the
 * nonzero cells of the current and the previous row of the matrix are
 * kept; for long texts with a long common part the memory use is roughly
 * twice their combined length at worst. A generalized suffix tree would
 * be linear in time but much heavier in memory (Gusfield 1999).
 *
 * <p>The method holds no state between calls and may be used from any
 * number of threads.
 */
public class LongestCommonSubstring {

	private LongestCommonSubstring() {
	}

	/**
	 * Returns every substring of maximal length that occurs in both texts.
	 * The set is empty when either text is empty or they share no character.
	 */
	public static Set<String> lcs(CharSequence text1, CharSequence text2) {
		// the shorter text is the inner loop, a row never holds more than its length
		CharSequence hStr;
		CharSequence vStr;
		if (text1.length() < text2.length()) {
			hStr = text1;
			vStr = text2;
		}
		else {
			hStr = text2;
			vStr = text1;
		}
		int hLen = hStr.length();
		int vLen = vStr.length();

		SparseRow prevRow = new SparseRow();
		SparseRow row = new SparseRow();
		Set<String> longest = new HashSet<String>();
		int maxLengthSeen = 0;

		for (int j = 0; j < vLen; j++) {
			char vChar = vStr.charAt(j);
			for (int i = 0; i < hLen; i++) {
				if (hStr.charAt(i) != vChar) {
					continue;
				}
				// prevRow.get(-1) is 0 for the first column
				int run = prevRow.get(i - 1) + 1;
				row.set(i, run);

				if (run < maxLengthSeen) {
					continue;
				}
				else if (run == maxLengthSeen) {
					longest.add(hStr.subSequence(i - run + 1, i + 1).toString());
				}
				else {
					maxLengthSeen = run;
					longest = new HashSet<String>();
					longest.add(hStr.subSequence(i - run + 1, i + 1).toString());
				}
			}
			prevRow = row;
			row = new SparseRow();
		}
		return longest;
	}
}

package coincidence;

import java.util.HashMap;

/**
 * One row of the common substring matrix. Only nonzero run lengths are
 * stored, every other column reads as zero.
 */
public class SparseRow {
	private HashMap<Integer, Integer> runs = new HashMap<Integer, Integer>();

	/**
	 * Run length stored for a column. Column -1, left of the first
	 * column, is always 0.
	 */
	public int get(int column) {
		if (column < 0) {
			return 0;
		}
		Integer run = runs.get(column);
		if (run == null) {
			return 0;
		}
		return run;
	}

	public void set(int column, int run) {
		runs.put(column, run);
	}

	public int size() {
		return runs.size();
	}
}

package org.ihtsdo.termserver.tx.ucum;

import java.util.List;

import org.ihtsdo.termserver.tx.provider.ConceptFilter;

import com.google.common.collect.ImmutableList;

/**
 * A canonical unit filter.  An empty canonical means "whatever is in the common units".
 * Results are only present when the filter has been materialised for iteration;
 * the cursor is an index into them, starting before the first entry.
 */
public class UcumFilter implements ConceptFilter {

	private final String canonical;
	private List<CommonUnit> results;
	private int cursor = -1;

	public UcumFilter(String canonical) {
		this.canonical = canonical == null ? "" : canonical;
	}

	public String getCanonical() {
		return canonical;
	}

	public boolean hasCanonical() {
		return !canonical.isEmpty();
	}

	void materialise(List<CommonUnit> results) {
		this.results = ImmutableList.copyOf(results);
		this.cursor = -1;
	}

	@Override
	public boolean isMaterialised() {
		return results != null;
	}

	public List<CommonUnit> getResults() {
		return results;
	}

	public int getCursor() {
		return cursor;
	}

	/**
	 * @return true if the cursor is now on an entry
	 */
	boolean advance() {
		if (cursor < results.size()) {
			cursor++;
		}
		return cursor < results.size();
	}

	CommonUnit current() {
		if (cursor < 0 || cursor >= results.size()) {
			throw new IndexOutOfBoundsException("Filter cursor " + cursor + " is not on an entry (" + results.size() + " results)");
		}
		return results.get(cursor);
	}

	@Override
	public String toString() {
		return "canonical = '" + canonical + "'" + (results == null ? "" : " (" + results.size() + " results)");
	}
}

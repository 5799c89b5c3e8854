package org.ihtsdo.termserver.tx.provider;

import java.util.*;

/**
 * The filters active for a single filtered expansion or validation.  Owned by the request that
 * created it and never used from more than one thread at a time.
 */
public class FilterExecutionContext {

	private final boolean forIterate;
	private final List<ConceptFilter> filters = new ArrayList<>();

	public FilterExecutionContext(boolean forIterate) {
		this.forIterate = forIterate;
	}

	/**
	 * @return true if the filter results will be iterated, so they have to be materialised,
	 * and false if they'll only be used to check individual codes
	 */
	public boolean isForIterate() {
		return forIterate;
	}

	public void addFilter(ConceptFilter filter) {
		filters.add(filter);
	}

	public List<ConceptFilter> getFilters() {
		return Collections.unmodifiableList(filters);
	}

	public boolean contains(ConceptFilter filter) {
		return filters.contains(filter);
	}

	public void clear() {
		filters.clear();
	}

	@Override
	public String toString() {
		return (forIterate ? "iterate " : "locate ") + filters;
	}
}

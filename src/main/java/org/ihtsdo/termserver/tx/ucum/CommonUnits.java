package org.ihtsdo.termserver.tx.ucum;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * The finite list of commonly used units layered over the unbounded UCUM code space.
 * Used for displays and to give filters something to enumerate.  Immutable.
 */
public final class CommonUnits {

	private final String url;
	private final List<CommonUnit> units;

	public CommonUnits(String url, List<CommonUnit> units) {
		this.url = url;
		this.units = ImmutableList.copyOf(units);
	}

	public String getUrl() {
		return url;
	}

	public List<CommonUnit> getUnits() {
		return units;
	}

	public boolean contains(String code) {
		for (CommonUnit unit : units) {
			if (unit.getCode().equals(code)) {
				return true;
			}
		}
		return false;
	}

	public List<CommonUnit> findByCode(String code) {
		List<CommonUnit> matches = new ArrayList<>();
		for (CommonUnit unit : units) {
			if (unit.getCode().equals(code)) {
				matches.add(unit);
			}
		}
		return matches;
	}

	/**
	 * @return the units with this canonical form, in enumeration order
	 */
	public List<CommonUnit> findByCanonical(String canonical) {
		List<CommonUnit> matches = new ArrayList<>();
		for (CommonUnit unit : units) {
			if (canonical.equals(unit.getCanonical())) {
				matches.add(unit);
			}
		}
		return matches;
	}

	public int size() {
		return units.size();
	}

	@Override
	public String toString() {
		return url + " (" + units.size() + " units)";
	}
}

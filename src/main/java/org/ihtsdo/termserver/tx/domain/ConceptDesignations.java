package org.ihtsdo.termserver.tx.domain;

import java.util.*;
import java.util.stream.Collectors;

import org.apache.commons.lang.StringUtils;
import org.ihtsdo.termserver.tx.context.Language;

/**
 * Collects the designations a provider lists for one concept.
 */
public class ConceptDesignations {

	private final List<Designation> designations = new ArrayList<>();

	public Designation addDesignation(boolean isDisplay, String status, String lang, Coding use, String value) {
		if (StringUtils.isEmpty(status)) {
			throw new IllegalArgumentException("Designation status is required");
		}
		if (value == null) {
			throw new IllegalArgumentException("Designation value is required");
		}
		Language language = StringUtils.isEmpty(lang) ? null : new Language(lang);
		Coding designationUse;
		if (isDisplay) {
			designationUse = DesignationUse.copyOf(DesignationUse.DISPLAY);
		} else {
			designationUse = use;
		}
		Designation designation = new Designation(isDisplay, status, language, designationUse, value);
		designations.add(designation);
		return designation;
	}

	public List<Designation> getDesignations() {
		return Collections.unmodifiableList(designations);
	}

	public List<Designation> getDesignations(Coding use) {
		return designations.stream()
				.filter(d -> d.hasUse(use))
				.collect(Collectors.toList());
	}

	public List<String> getValues() {
		return designations.stream()
				.map(Designation::getValue)
				.collect(Collectors.toList());
	}

	public int size() {
		return designations.size();
	}

	@Override
	public String toString() {
		return designations.toString();
	}
}

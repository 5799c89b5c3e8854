package org.ihtsdo.termserver.tx.domain;

import java.util.*;

import com.google.common.collect.ImmutableMap;
import com.google.gson.annotations.Expose;
import com.google.gson.annotations.SerializedName;

/**
 * A CodeSystem resource with content "supplement", contributing displays and designations
 * (typically in other languages) to the code system it supplements.
 */
public class CodeSystemSupplement {

	@SerializedName("resourceType")
	@Expose
	private String resourceType;

	@SerializedName("url")
	@Expose
	private String url;

	@SerializedName("version")
	@Expose
	private String version;

	@SerializedName("language")
	@Expose
	private String language;

	@SerializedName("content")
	@Expose
	private String content;

	@SerializedName("supplements")
	@Expose
	private String supplements;

	@SerializedName("concept")
	@Expose
	private List<SupplementConcept> concept = new ArrayList<>();

	private transient volatile ImmutableMap<String, SupplementConcept> codeMap;

	public String getResourceType() {
		return resourceType;
	}

	public String getUrl() {
		return url;
	}

	public void setUrl(String url) {
		this.url = url;
	}

	public String getVersion() {
		return version;
	}

	public void setVersion(String version) {
		this.version = version;
	}

	public String getVurl() {
		return version == null ? url : url + "|" + version;
	}

	public String getLanguage() {
		return language;
	}

	public void setLanguage(String language) {
		this.language = language;
	}

	public String getContent() {
		return content;
	}

	public String getSupplements() {
		return supplements;
	}

	public void setSupplements(String supplements) {
		this.supplements = supplements;
	}

	public List<SupplementConcept> getConcept() {
		return concept;
	}

	public void setConcept(List<SupplementConcept> concept) {
		this.concept = concept;
		this.codeMap = null;
	}

	/**
	 * The code index is built on first use and then replaced only by {@link #setConcept}.
	 * Supplements are shared between providers, so the index is immutable.
	 */
	public SupplementConcept getConceptByCode(String code) {
		ImmutableMap<String, SupplementConcept> index = codeMap;
		if (index == null) {
			Map<String, SupplementConcept> map = new LinkedHashMap<>();
			for (SupplementConcept c : getAllConcepts()) {
				if (c.getCode() != null) {
					map.putIfAbsent(c.getCode(), c);
				}
			}
			index = ImmutableMap.copyOf(map);
			codeMap = index;
		}
		return code == null ? null : index.get(code);
	}

	public List<SupplementConcept> getAllConcepts() {
		List<SupplementConcept> all = new ArrayList<>();
		collect(concept, all);
		return all;
	}

	private void collect(List<SupplementConcept> concepts, List<SupplementConcept> all) {
		if (concepts == null) {
			return;
		}
		for (SupplementConcept c : concepts) {
			all.add(c);
			collect(c.getConcept(), all);
		}
	}

	@Override
	public String toString() {
		return getVurl();
	}

	public static class SupplementConcept {

		@SerializedName("code")
		@Expose
		private String code;

		@SerializedName("display")
		@Expose
		private String display;

		@SerializedName("designation")
		@Expose
		private List<SupplementDesignation> designation = new ArrayList<>();

		@SerializedName("concept")
		@Expose
		private List<SupplementConcept> concept = new ArrayList<>();

		public SupplementConcept() {
		}

		public SupplementConcept(String code, String display) {
			this.code = code;
			this.display = display;
		}

		public String getCode() {
			return code;
		}

		public String getDisplay() {
			return display;
		}

		public List<SupplementDesignation> getDesignation() {
			return designation == null ? Collections.emptyList() : designation;
		}

		public List<SupplementConcept> getConcept() {
			return concept;
		}

		public SupplementConcept addDesignation(String language, Coding use, String value) {
			if (designation == null) {
				designation = new ArrayList<>();
			}
			designation.add(new SupplementDesignation(language, use, value));
			return this;
		}
	}

	public static class SupplementDesignation {

		@SerializedName("language")
		@Expose
		private String language;

		@SerializedName("use")
		@Expose
		private Coding use;

		@SerializedName("value")
		@Expose
		private String value;

		public SupplementDesignation() {
		}

		public SupplementDesignation(String language, Coding use, String value) {
			this.language = language;
			this.use = use;
			this.value = value;
		}

		public String getLanguage() {
			return language;
		}

		public Coding getUse() {
			return use;
		}

		public String getValue() {
			return value;
		}
	}
}

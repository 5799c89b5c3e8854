package org.ihtsdo.termserver.tx.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.gson.annotations.Expose;
import com.google.gson.annotations.SerializedName;

/**
 * Just enough of a FHIR ValueSet to read an enumerated compose.
 */
public class ValueSet {

	@SerializedName("resourceType")
	@Expose
	private String resourceType;

	@SerializedName("url")
	@Expose
	private String url;

	@SerializedName("version")
	@Expose
	private String version;

	@SerializedName("name")
	@Expose
	private String name;

	@SerializedName("compose")
	@Expose
	private Compose compose;

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

	public String getName() {
		return name;
	}

	public Compose getCompose() {
		return compose;
	}

	public void setCompose(Compose compose) {
		this.compose = compose;
	}

	public static class Compose {

		@SerializedName("include")
		@Expose
		private List<Include> include = new ArrayList<>();

		public List<Include> getInclude() {
			return include == null ? Collections.<Include>emptyList() : include;
		}

		public void setInclude(List<Include> include) {
			this.include = include;
		}
	}

	public static class Include {

		@SerializedName("system")
		@Expose
		private String system;

		@SerializedName("version")
		@Expose
		private String version;

		@SerializedName("concept")
		@Expose
		private List<ConceptReference> concept = new ArrayList<>();

		public Include() {
		}

		public Include(String system, List<ConceptReference> concept) {
			this.system = system;
			this.concept = concept;
		}

		public String getSystem() {
			return system;
		}

		public String getVersion() {
			return version;
		}

		public List<ConceptReference> getConcept() {
			return concept == null ? Collections.<ConceptReference>emptyList() : concept;
		}
	}

	public static class ConceptReference {

		@SerializedName("code")
		@Expose
		private String code;

		@SerializedName("display")
		@Expose
		private String display;

		public ConceptReference() {
		}

		public ConceptReference(String code, String display) {
			this.code = code;
			this.display = display;
		}

		public String getCode() {
			return code;
		}

		public String getDisplay() {
			return display;
		}
	}
}

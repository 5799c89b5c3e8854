package org.ihtsdo.termserver.tx.render;

import org.ihtsdo.termserver.tx.domain.CodeableConcept;
import org.ihtsdo.termserver.tx.domain.Coding;
import org.ihtsdo.termserver.tx.provider.CodeSystemProvider;

/**
 * The shapes of coded value that can be turned into a plain text label.  Each shape is its
 * own class and a {@link Visitor} has to handle every one of them.
 */
public abstract class DisplayRequest {

	public interface Visitor<R> {
		R visit(CodingRequest request);
		R visit(CodeableConceptRequest request);
		R visit(ProviderRequest request);
		R visit(SystemVersion request);
		R visit(SystemVersionCode request);
		R visit(SystemVersionCodeDisplay request);
	}

	private DisplayRequest() {
	}

	public abstract <R> R accept(Visitor<R> visitor);

	public static DisplayRequest of(Coding coding) {
		return new CodingRequest(coding);
	}

	public static DisplayRequest of(CodeableConcept concept) {
		return new CodeableConceptRequest(concept);
	}

	public static DisplayRequest of(CodeSystemProvider provider) {
		return new ProviderRequest(provider);
	}

	public static DisplayRequest of(String system, String version) {
		return new SystemVersion(system, version);
	}

	public static DisplayRequest of(String system, String version, String code) {
		return new SystemVersionCode(system, version, code);
	}

	public static DisplayRequest of(String system, String version, String code, String display) {
		return new SystemVersionCodeDisplay(system, version, code, display);
	}

	public static final class CodingRequest extends DisplayRequest {
		private final Coding coding;

		private CodingRequest(Coding coding) {
			this.coding = coding;
		}

		public Coding getCoding() {
			return coding;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visit(this);
		}
	}

	public static final class CodeableConceptRequest extends DisplayRequest {
		private final CodeableConcept concept;

		private CodeableConceptRequest(CodeableConcept concept) {
			this.concept = concept;
		}

		public CodeableConcept getConcept() {
			return concept;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visit(this);
		}
	}

	public static final class ProviderRequest extends DisplayRequest {
		private final CodeSystemProvider provider;

		private ProviderRequest(CodeSystemProvider provider) {
			this.provider = provider;
		}

		public CodeSystemProvider getProvider() {
			return provider;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visit(this);
		}
	}

	public static final class SystemVersion extends DisplayRequest {
		private final String system;
		private final String version;

		private SystemVersion(String system, String version) {
			this.system = system;
			this.version = version;
		}

		public String getSystem() {
			return system;
		}

		public String getVersion() {
			return version;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visit(this);
		}
	}

	public static final class SystemVersionCode extends DisplayRequest {
		private final String system;
		private final String version;
		private final String code;

		private SystemVersionCode(String system, String version, String code) {
			this.system = system;
			this.version = version;
			this.code = code;
		}

		public String getSystem() {
			return system;
		}

		public String getVersion() {
			return version;
		}

		public String getCode() {
			return code;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visit(this);
		}
	}

	public static final class SystemVersionCodeDisplay extends DisplayRequest {
		private final String system;
		private final String version;
		private final String code;
		private final String display;

		private SystemVersionCodeDisplay(String system, String version, String code, String display) {
			this.system = system;
			this.version = version;
			this.code = code;
			this.display = display;
		}

		public String getSystem() {
			return system;
		}

		public String getVersion() {
			return version;
		}

		public String getCode() {
			return code;
		}

		public String getDisplay() {
			return display;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visit(this);
		}
	}
}

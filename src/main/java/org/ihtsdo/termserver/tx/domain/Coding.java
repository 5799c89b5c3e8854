package org.ihtsdo.termserver.tx.domain;

import java.util.Objects;

import com.google.gson.annotations.Expose;
import com.google.gson.annotations.SerializedName;

public class Coding {

	@SerializedName("system")
	@Expose
	private String system;

	@SerializedName("version")
	@Expose
	private String version;

	@SerializedName("code")
	@Expose
	private String code;

	@SerializedName("display")
	@Expose
	private String display;

	public Coding() {
	}

	public Coding(String system, String code) {
		this(system, null, code, null);
	}

	public Coding(String system, String version, String code, String display) {
		this.system = system;
		this.version = version;
		this.code = code;
		this.display = display;
	}

	public String getSystem() {
		return system;
	}

	public void setSystem(String system) {
		this.system = system;
	}

	public String getVersion() {
		return version;
	}

	public void setVersion(String version) {
		this.version = version;
	}

	public String getCode() {
		return code;
	}

	public void setCode(String code) {
		this.code = code;
	}

	public String getDisplay() {
		return display;
	}

	public void setDisplay(String display) {
		this.display = display;
	}

	public boolean matches(Coding other) {
		return other != null && Objects.equals(system, other.system) && Objects.equals(code, other.code);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Coding)) {
			return false;
		}
		Coding other = (Coding) o;
		return Objects.equals(system, other.system) && Objects.equals(version, other.version)
				&& Objects.equals(code, other.code) && Objects.equals(display, other.display);
	}

	@Override
	public int hashCode() {
		return Objects.hash(system, version, code, display);
	}

	@Override
	public String toString() {
		return system + "#" + code + (display == null ? "" : " \"" + display + "\"");
	}
}

package org.ihtsdo.termserver.tx.provider;

import java.util.Objects;

/**
 * Identifies a provider factory: code system, version, and the enumeration (if any) layered over it.
 */
public class FactoryKey {

	private final String system;
	private final String version;
	private final String enumeration;

	public FactoryKey(String system, String version, String enumeration) {
		this.system = Objects.requireNonNull(system, "system");
		this.version = version;
		this.enumeration = enumeration;
	}

	public String getSystem() {
		return system;
	}

	public String getVersion() {
		return version;
	}

	public String getEnumeration() {
		return enumeration;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof FactoryKey)) {
			return false;
		}
		FactoryKey other = (FactoryKey) o;
		return system.equals(other.system) && Objects.equals(version, other.version)
				&& Objects.equals(enumeration, other.enumeration);
	}

	@Override
	public int hashCode() {
		return Objects.hash(system, version, enumeration);
	}

	@Override
	public String toString() {
		return system + (version == null ? "" : "|" + version) + (enumeration == null ? "" : " (" + enumeration + ")");
	}
}

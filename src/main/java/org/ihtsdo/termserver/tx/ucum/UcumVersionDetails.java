package org.ihtsdo.termserver.tx.ucum;

public class UcumVersionDetails {

	private final String releaseDate;
	private final String version;

	public UcumVersionDetails(String releaseDate, String version) {
		this.releaseDate = releaseDate;
		this.version = version;
	}

	public String getReleaseDate() {
		return releaseDate;
	}

	public String getVersion() {
		return version;
	}

	@Override
	public String toString() {
		return version + " (" + releaseDate + ")";
	}
}

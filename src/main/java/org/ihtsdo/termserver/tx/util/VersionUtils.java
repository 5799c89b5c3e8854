package org.ihtsdo.termserver.tx.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang.StringUtils;

public class VersionUtils {

	private static final Pattern SEMVER = Pattern.compile(
			"^(0|[1-9]\\d*)\\.(0|[1-9]\\d*)(?:\\.(0|[1-9]\\d*))?(?:-[0-9A-Za-z.-]+)?(?:\\+[0-9A-Za-z.-]+)?$");

	private VersionUtils() {
	}

	public static boolean isSemVer(String version) {
		return !StringUtils.isEmpty(version) && SEMVER.matcher(version).matches();
	}

	/**
	 * @return major.minor of a semver version, or null if the version is not semver
	 */
	public static String getMajMin(String version) {
		if (!isSemVer(version)) {
			return null;
		}
		Matcher m = SEMVER.matcher(version);
		if (!m.matches()) {
			return null;
		}
		return m.group(1) + "." + m.group(2);
	}
}

package org.ihtsdo.termserver.tx.context;

import java.util.Locale;

import org.apache.commons.lang.StringUtils;

/**
 * A single language tag from a request, eg "en-US" or "fr;q=0.8".
 * Only the subtags needed to choose displays are kept.
 */
public class Language {

	public static final double DEFAULT_QUALITY = 1.0d;

	private final String code;
	private final String language;
	private final String script;
	private final String region;
	private final double quality;

	public Language(String tag) {
		this(tag, DEFAULT_QUALITY);
	}

	public Language(String tag, double quality) {
		this.code = StringUtils.trimToEmpty(tag);
		this.quality = quality;
		String lang = "";
		String scr = "";
		String reg = "";
		if (!code.isEmpty() && !code.equals("*")) {
			String[] parts = code.split("-");
			lang = parts[0].toLowerCase(Locale.ROOT);
			for (int i = 1; i < parts.length; i++) {
				String part = parts[i];
				if (part.length() == 4 && StringUtils.isAlpha(part) && scr.isEmpty() && reg.isEmpty()) {
					scr = part;
				} else if ((part.length() == 2 && StringUtils.isAlpha(part))
						|| (part.length() == 3 && StringUtils.isNumeric(part))) {
					if (reg.isEmpty()) {
						reg = part.toUpperCase(Locale.ROOT);
					}
				}
			}
		}
		this.language = lang;
		this.script = scr;
		this.region = reg;
	}

	public String getCode() {
		return code;
	}

	public String getLanguage() {
		return language;
	}

	public String getScript() {
		return script;
	}

	public String getRegion() {
		return region;
	}

	public double getQuality() {
		return quality;
	}

	public boolean isWildcard() {
		return code.equals("*");
	}

	public boolean isEnglishOrNothing() {
		return code.isEmpty() || code.equals("en") || code.equals("en-US");
	}

	/**
	 * True if a display in this language is suitable for someone asking for the other language.
	 * The other language's script and region must match where it specifies them; this language
	 * may be more specific.
	 */
	public boolean matchesForDisplay(Language other) {
		if (other == null) {
			return false;
		}
		if (language.isEmpty()) {
			return other.code.equals("en") || other.code.equals("en-US");
		}
		if (other.language.isEmpty()) {
			return code.equals("en") || code.equals("en-US");
		}
		if (!language.equals(other.language)) {
			return false;
		}
		if (!other.script.isEmpty() && !other.script.equalsIgnoreCase(script)) {
			return false;
		}
		return other.region.isEmpty() || other.region.equals(region);
	}

	public boolean matchesForDisplay(String other) {
		return other != null && matchesForDisplay(new Language(other));
	}

	@Override
	public String toString() {
		return quality == DEFAULT_QUALITY ? code : code + ";q=" + quality;
	}
}

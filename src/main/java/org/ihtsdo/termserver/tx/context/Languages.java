package org.ihtsdo.termserver.tx.context;

import java.util.*;

import org.apache.commons.lang.StringUtils;

import com.google.common.collect.ImmutableList;

/**
 * The ordered language preferences of a request, highest quality first.
 */
public class Languages implements Iterable<Language> {

	private final List<Language> languages;

	public Languages(Collection<Language> languages) {
		List<Language> sorted = new ArrayList<>(languages);
		//Stable sort, so tags of equal quality keep the order the client sent them in
		sorted.sort(Comparator.comparingDouble(Language::getQuality).reversed());
		this.languages = ImmutableList.copyOf(sorted);
	}

	public static Languages none() {
		return new Languages(Collections.emptyList());
	}

	public static Languages fromAcceptLanguage(String header) {
		List<Language> langs = new ArrayList<>();
		if (!StringUtils.isBlank(header)) {
			for (String item : header.split(",")) {
				String[] parts = item.trim().split(";");
				if (StringUtils.isEmpty(parts[0])) {
					continue;
				}
				double quality = Language.DEFAULT_QUALITY;
				for (int i = 1; i < parts.length; i++) {
					String param = parts[i].trim();
					if (param.startsWith("q=")) {
						try {
							quality = Double.parseDouble(param.substring(2));
						} catch (NumberFormatException e) {
							throw new IllegalArgumentException("Invalid quality in Accept-Language: '" + item + "'", e);
						}
					}
				}
				langs.add(new Language(parts[0], quality));
			}
		}
		return new Languages(langs);
	}

	public boolean isEnglishOrNothing() {
		for (Language lang : languages) {
			if (!lang.isEnglishOrNothing()) {
				return false;
			}
		}
		return true;
	}

	/**
	 * @return true if a designation in the given language would be an acceptable display
	 */
	public boolean hasMatch(String languageCode) {
		if (StringUtils.isEmpty(languageCode)) {
			return false;
		}
		Language candidate = new Language(languageCode);
		for (Language requested : languages) {
			if (requested.isWildcard() || candidate.matchesForDisplay(requested)) {
				return true;
			}
		}
		return false;
	}

	public boolean isEmpty() {
		return languages.isEmpty();
	}

	public int size() {
		return languages.size();
	}

	public Language get(int index) {
		return languages.get(index);
	}

	@Override
	public Iterator<Language> iterator() {
		return languages.iterator();
	}

	@Override
	public String toString() {
		return StringUtils.join(languages, ",");
	}
}

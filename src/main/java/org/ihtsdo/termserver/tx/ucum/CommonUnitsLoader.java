package org.ihtsdo.termserver.tx.ucum;

import java.io.*;
import java.nio.charset.StandardCharsets;

import org.apache.commons.lang.StringUtils;
import org.ihtsdo.termserver.tx.TerminologyException;
import org.ihtsdo.termserver.tx.domain.ValueSet;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * Reads the common units ValueSet from its FHIR JSON form.
 */
public class CommonUnitsLoader {

	private final Gson gson = new GsonBuilder().create();

	public ValueSet load(Reader reader) throws TerminologyException {
		try {
			ValueSet vs = gson.fromJson(reader, ValueSet.class);
			if (vs == null) {
				throw new TerminologyException("Common units source is empty");
			}
			if (!"ValueSet".equals(vs.getResourceType())) {
				throw new TerminologyException("Expected a ValueSet for common units, found " + vs.getResourceType());
			}
			return vs;
		} catch (JsonParseException e) {
			throw new TerminologyException("Unable to parse common units value set", e);
		}
	}

	public ValueSet load(File file) throws TerminologyException {
		try (Reader reader = new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8)) {
			return load(reader);
		} catch (IOException e) {
			throw new TerminologyException("Unable to read common units from " + file, e);
		}
	}

	/**
	 * @param location "classpath:" prefixed resource, or a file path
	 */
	public ValueSet load(String location) throws TerminologyException {
		if (StringUtils.isEmpty(location)) {
			throw new TerminologyException("No location given for the common units value set");
		}
		if (location.startsWith("classpath:")) {
			String resource = StringUtils.removeStart(location.substring("classpath:".length()), "/");
			InputStream is = getClass().getClassLoader().getResourceAsStream(resource);
			if (is == null) {
				throw new TerminologyException("Common units resource not found: " + location);
			}
			try (Reader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
				return load(reader);
			} catch (IOException e) {
				throw new TerminologyException("Unable to read common units from " + location, e);
			}
		}
		return load(new File(location));
	}
}

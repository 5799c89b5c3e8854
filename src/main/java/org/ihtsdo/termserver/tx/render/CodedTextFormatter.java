package org.ihtsdo.termserver.tx.render;

import org.apache.commons.lang.StringUtils;
import org.ihtsdo.termserver.tx.domain.Coding;
import org.ihtsdo.termserver.tx.provider.CodeSystemProvider;

/**
 * Plain text labels for coded values, as used in messages and logs:
 * {@code system|version#code ("display")}.
 */
public class CodedTextFormatter implements DisplayRequest.Visitor<String> {

	public String format(DisplayRequest request) {
		return request.accept(this);
	}

	@Override
	public String visit(DisplayRequest.CodingRequest request) {
		Coding c = request.getCoding();
		return systemVersionCodeDisplay(c.getSystem(), c.getVersion(), c.getCode(), c.getDisplay());
	}

	@Override
	public String visit(DisplayRequest.CodeableConceptRequest request) {
		StringBuilder sb = new StringBuilder();
		for (Coding c : request.getConcept().getCoding()) {
			if (sb.length() > 0) {
				sb.append(", ");
			}
			sb.append(systemVersionCodeDisplay(c.getSystem(), c.getVersion(), c.getCode(), c.getDisplay()));
		}
		return "[" + sb + "]";
	}

	@Override
	public String visit(DisplayRequest.ProviderRequest request) {
		CodeSystemProvider cs = request.getProvider();
		String result = cs.system() + "|" + cs.version();
		if (cs.sourcePackage() != null) {
			result = result + " (from " + cs.sourcePackage() + ")";
		}
		return result;
	}

	@Override
	public String visit(DisplayRequest.SystemVersion request) {
		return systemVersion(request.getSystem(), request.getVersion());
	}

	@Override
	public String visit(DisplayRequest.SystemVersionCode request) {
		return systemVersion(request.getSystem(), request.getVersion()) + "#" + request.getCode();
	}

	@Override
	public String visit(DisplayRequest.SystemVersionCodeDisplay request) {
		return systemVersionCodeDisplay(request.getSystem(), request.getVersion(), request.getCode(), request.getDisplay());
	}

	private String systemVersion(String system, String version) {
		return StringUtils.isEmpty(version) ? system : system + "|" + version;
	}

	private String systemVersionCodeDisplay(String system, String version, String code, String display) {
		String result = systemVersion(system, version) + "#" + code;
		//A coding without a display just gets the code
		if (display != null) {
			result = result + " (\"" + display + "\")";
		}
		return result;
	}
}

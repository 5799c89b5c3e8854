package org.ihtsdo.termserver.tx.config;

import org.apache.commons.lang.StringUtils;
import org.ihtsdo.termserver.tx.context.Languages;
import org.ihtsdo.termserver.tx.context.OperationContext;

/**
 * Creates the operation context for a request, applying the configured defaults.
 */
public class OperationContextFactory {

	private final TxProviderConfig config;

	public OperationContextFactory(TxProviderConfig config) {
		this.config = config;
	}

	public OperationContext create(String acceptLanguage, String requestId) {
		String langs = StringUtils.isBlank(acceptLanguage) ? config.getDefaultLanguage() : acceptLanguage;
		return new OperationContext(Languages.fromAcceptLanguage(langs), requestId, config.getTimeLimitSeconds());
	}

	public OperationContext create(String acceptLanguage) {
		return create(acceptLanguage, null);
	}
}

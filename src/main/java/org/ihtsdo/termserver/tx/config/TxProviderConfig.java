package org.ihtsdo.termserver.tx.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "tx")
public class TxProviderConfig {

	private String defaultLanguage = "en";
	private int timeLimitSeconds = 30;
	//0 runs provider work on the calling thread
	private int providerThreads = 0;
	private final Ucum ucum = new Ucum();

	public String getDefaultLanguage() {
		return defaultLanguage;
	}

	public void setDefaultLanguage(String defaultLanguage) {
		this.defaultLanguage = defaultLanguage;
	}

	public int getTimeLimitSeconds() {
		return timeLimitSeconds;
	}

	public void setTimeLimitSeconds(int timeLimitSeconds) {
		this.timeLimitSeconds = timeLimitSeconds;
	}

	public int getProviderThreads() {
		return providerThreads;
	}

	public void setProviderThreads(int providerThreads) {
		this.providerThreads = providerThreads;
	}

	public Ucum getUcum() {
		return ucum;
	}

	public static class Ucum {

		private String commonUnits;

		/**
		 * @return location of the common units ValueSet, "classpath:" or a file path; may be empty
		 */
		public String getCommonUnits() {
			return commonUnits;
		}

		public void setCommonUnits(String commonUnits) {
			this.commonUnits = commonUnits;
		}
	}
}

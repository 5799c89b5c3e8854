package org.ihtsdo.termserver.tx.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.apache.commons.lang.StringUtils;
import org.ihtsdo.termserver.tx.TerminologyException;
import org.ihtsdo.termserver.tx.domain.ValueSet;
import org.ihtsdo.termserver.tx.provider.ProviderFactoryCache;
import org.ihtsdo.termserver.tx.ucum.CommonUnitsLoader;
import org.ihtsdo.termserver.tx.ucum.UcumCodeSystemFactory;
import org.ihtsdo.termserver.tx.ucum.UcumService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Wires the provider factories.  The UCUM grammar engine itself is supplied by the host
 * application as a {@link UcumService} bean.
 */
@Configuration
@EnableConfigurationProperties(TxProviderConfig.class)
public class TxProviderConfiguration {

	private static final Logger LOGGER = LoggerFactory.getLogger(TxProviderConfiguration.class);

	@Bean
	public ProviderFactoryCache providerFactoryCache() {
		return new ProviderFactoryCache();
	}

	@Bean
	public OperationContextFactory operationContextFactory(TxProviderConfig config) {
		return new OperationContextFactory(config);
	}

	@Bean
	public Executor providerExecutor(TxProviderConfig config) {
		return createExecutor(config.getProviderThreads());
	}

	@Bean
	public UcumCodeSystemFactory ucumCodeSystemFactory(UcumService ucumService, TxProviderConfig config,
			Executor providerExecutor, ProviderFactoryCache cache) throws TerminologyException {
		ValueSet commonUnits = null;
		String location = config.getUcum().getCommonUnits();
		if (StringUtils.isBlank(location)) {
			LOGGER.warn("No common units value set configured, UCUM filters cannot be expanded");
		} else {
			commonUnits = new CommonUnitsLoader().load(location);
		}
		UcumCodeSystemFactory factory = new UcumCodeSystemFactory(ucumService, commonUnits, providerExecutor);
		return (UcumCodeSystemFactory) cache.register(factory);
	}

	static Executor createExecutor(int threads) {
		if (threads <= 0) {
			return MoreExecutors.directExecutor();
		}
		LOGGER.info("Running provider operations on {} threads", threads);
		ExecutorService pool = Executors.newFixedThreadPool(threads,
				new ThreadFactoryBuilder().setNameFormat("tx-provider-%d").setDaemon(true).build());
		return pool;
	}
}

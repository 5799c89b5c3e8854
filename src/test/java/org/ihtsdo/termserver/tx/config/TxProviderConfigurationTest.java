package org.ihtsdo.termserver.tx.config;

import static org.junit.Assert.*;

import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import org.ihtsdo.termserver.tx.context.OperationContext;
import org.ihtsdo.termserver.tx.domain.CodeSystemSupplement;
import org.ihtsdo.termserver.tx.provider.FactoryKey;
import org.ihtsdo.termserver.tx.provider.ProviderFactoryCache;
import org.ihtsdo.termserver.tx.ucum.StubUcumService;
import org.ihtsdo.termserver.tx.ucum.UcumCodeSystemFactory;
import org.ihtsdo.termserver.tx.ucum.UcumCodeSystemProvider;
import org.ihtsdo.termserver.tx.ucum.UcumService;
import org.junit.After;
import org.junit.Test;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.MapPropertySource;

import com.google.common.util.concurrent.MoreExecutors;
import com.google.gson.Gson;

public class TxProviderConfigurationTest {

	private AnnotationConfigApplicationContext context;

	@Configuration
	static class UcumEngine {
		@Bean
		public UcumService ucumService() {
			return new StubUcumService();
		}
	}

	private AnnotationConfigApplicationContext start(Map<String, Object> properties) {
		context = new AnnotationConfigApplicationContext();
		context.getEnvironment().getPropertySources().addFirst(new MapPropertySource("test", properties));
		context.register(TxProviderConfiguration.class, UcumEngine.class);
		context.refresh();
		return context;
	}

	@After
	public void tearDown() {
		if (context != null) {
			context.close();
		}
	}

	@Test
	public void wiresUcumWithCommonUnits() {
		Map<String, Object> properties = new HashMap<>();
		properties.put("tx.ucum.common-units", "classpath:common-units-test.json");
		properties.put("tx.default-language", "fr");
		start(properties);

		UcumCodeSystemFactory factory = context.getBean(UcumCodeSystemFactory.class);
		assertEquals(7, factory.getCommonUnits().size());

		ProviderFactoryCache cache = context.getBean(ProviderFactoryCache.class);
		assertEquals(1, cache.size());
		assertSame(factory, cache.get(new FactoryKey("http://unitsofmeasure.org", "2.1",
				"http://example.org/fhir/ValueSet/test-common-units")));

		OperationContext opContext = context.getBean(OperationContextFactory.class).create(null);
		assertEquals("fr", opContext.getLangs().get(0).getCode());
		//Common unit displays are English only
		assertEquals("kg", factory.build(opContext.copy(), null).display("kg").join());
	}

	@Test
	public void ucumWorksWithoutCommonUnits() {
		start(new HashMap<>());
		UcumCodeSystemFactory factory = context.getBean(UcumCodeSystemFactory.class);
		assertNull(factory.getCommonUnits());
		assertEquals(new FactoryKey("http://unitsofmeasure.org", "2.1", null), factory.getKey());

		TxProviderConfig config = context.getBean(TxProviderConfig.class);
		assertEquals("en", config.getDefaultLanguage());
		assertEquals(30, config.getTimeLimitSeconds());
	}

	@Test
	public void requestLanguageOverridesTheDefault() {
		TxProviderConfig config = new TxProviderConfig();
		config.setDefaultLanguage("de");
		OperationContextFactory factory = new OperationContextFactory(config);
		assertEquals("de", factory.create("").getLangs().get(0).getCode());
		assertEquals("nl", factory.create("nl-BE", "req-7").getLangs().get(0).getLanguage());
		assertEquals("req-7", factory.create("nl-BE", "req-7").getId());
	}

	@Test
	public void supplementDisplaysUnderConcurrentUse() throws Exception {
		CodeSystemSupplement fr;
		try (Reader reader = new InputStreamReader(
				getClass().getClassLoader().getResourceAsStream("supplement-fr.json"), StandardCharsets.UTF_8)) {
			fr = new Gson().fromJson(reader, CodeSystemSupplement.class);
		}
		Executor executor = TxProviderConfiguration.createExecutor(4);
		try {
			UcumCodeSystemFactory factory = new UcumCodeSystemFactory(new StubUcumService(), null, executor);
			List<CompletableFuture<String>> displays = new ArrayList<>();
			for (int i = 0; i < 200; i++) {
				UcumCodeSystemProvider provider = factory.build(new OperationContext("fr"), Collections.singletonList(fr));
				displays.add(provider.display("mmHg"));
				displays.add(provider.display(i % 2 == 0 ? "kg" : "cm"));
			}
			for (int i = 0; i < displays.size(); i += 2) {
				assertEquals("millimètre de mercure", displays.get(i).get(10, TimeUnit.SECONDS));
				assertEquals(i % 4 == 0 ? "kg" : "cm", displays.get(i + 1).get(10, TimeUnit.SECONDS));
			}
		} finally {
			((ExecutorService) executor).shutdownNow();
		}
	}

	@Test
	public void directExecutorByDefault() {
		assertSame(MoreExecutors.directExecutor(), TxProviderConfiguration.createExecutor(0));
	}

	@Test
	public void pooledExecutorRunsOnNamedThreads() throws Exception {
		Executor executor = TxProviderConfiguration.createExecutor(2);
		assertTrue(executor instanceof ExecutorService);
		try {
			CompletableFuture<String> name = CompletableFuture.supplyAsync(() -> Thread.currentThread().getName(), executor);
			assertTrue(name.get(10, TimeUnit.SECONDS).startsWith("tx-provider-"));
		} finally {
			((ExecutorService) executor).shutdownNow();
		}
	}
}

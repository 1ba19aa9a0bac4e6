package my.policypayout.app.config;

import my.policypayout.app.extraction.NoopPolicyExtractionClient;
import my.policypayout.app.extraction.PolicyExtractionClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExtractionConfig {
	private static final Logger logger = LoggerFactory.getLogger(ExtractionConfig.class);

	@Bean
	@ConditionalOnMissingBean(PolicyExtractionClient.class)
	public PolicyExtractionClient noopPolicyExtractionClient(AppProperties properties) {
		String provider = properties.extraction() == null ? null : properties.extraction().provider();
		if (provider != null && !provider.isBlank() && !provider.equalsIgnoreCase("noop")) {
			logger.warn("Extraction provider '{}' has no client on the classpath, using noop.", provider);
		}
		logger.info("Policy extraction disabled (provider=noop).");
		return new NoopPolicyExtractionClient();
	}
}

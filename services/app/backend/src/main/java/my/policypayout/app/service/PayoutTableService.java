package my.policypayout.app.service;

import my.policypayout.app.config.AppProperties;
import my.policypayout.app.dto.PayoutRuleDto;
import my.policypayout.app.dto.PayoutTableDto;
import my.policypayout.app.dto.PayoutTableValidateResponse;
import my.policypayout.app.rules.PayoutTable;
import my.policypayout.app.rules.PayoutTableCompiler;
import my.policypayout.app.rules.PayoutTableDefinition;
import my.policypayout.app.rules.PayoutTableException;
import my.policypayout.app.rules.PayoutTableParser;
import my.policypayout.app.rules.PayoutTableValidator;
import my.policypayout.app.rules.RuleEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the active payout table. The table is loaded once at startup; a reload replaces it
 * atomically, so a batch that already took its snapshot is never affected.
 */
@Service
public class PayoutTableService {
	private static final Logger logger = LoggerFactory.getLogger(PayoutTableService.class);
	static final String DEFAULT_LOCATION = "classpath:payout_table.json";

	private final ResourceLoader resourceLoader;
	private final String tableLocation;
	private final PayoutTableParser parser;
	private final PayoutTableValidator validator;
	private final PayoutTableCompiler compiler;
	private final AtomicReference<PayoutTable> active = new AtomicReference<>();

	public PayoutTableService(AppProperties properties, ResourceLoader resourceLoader) {
		this.resourceLoader = resourceLoader;
		this.tableLocation = resolveLocation(properties);
		this.parser = new PayoutTableParser();
		this.validator = new PayoutTableValidator();
		this.compiler = new PayoutTableCompiler();
		this.active.set(load(tableLocation));
	}

	public PayoutTable current() {
		return active.get();
	}

	public PayoutTableDto reload() {
		PayoutTable fresh = load(tableLocation);
		active.set(fresh);
		return describe(fresh);
	}

	public PayoutTableDto describeActive() {
		return describe(current());
	}

	public PayoutTableValidateResponse validate(String content) {
		try {
			PayoutTableDefinition definition = parser.parse(content);
			List<String> errors = validator.validate(definition);
			return new PayoutTableValidateResponse(errors.isEmpty(), errors);
		} catch (PayoutTableException ex) {
			return new PayoutTableValidateResponse(false, List.of(ex.getMessage()));
		}
	}

	public PayoutTable compile(String content) {
		return compiler.compile(parser.parse(content));
	}

	private PayoutTable load(String location) {
		Resource resource = resourceLoader.getResource(location);
		if (!resource.exists()) {
			throw new PayoutTableException("Payout table resource not found: " + location);
		}
		try (InputStream inputStream = resource.getInputStream()) {
			String content = new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
			PayoutTable table = compile(content);
			logger.info("Loaded payout table '{}' with {} rules from {}", table.name(), table.size(), location);
			return table;
		} catch (IOException ex) {
			throw new PayoutTableException("Failed to read payout table " + location + ": " + ex.getMessage(), ex);
		}
	}

	private PayoutTableDto describe(PayoutTable table) {
		List<PayoutRuleDto> rules = table.rules().stream().map(this::toDto).toList();
		return new PayoutTableDto(table.name(), table.size(), rules);
	}

	private PayoutRuleDto toDto(RuleEntry rule) {
		return new PayoutRuleDto(
				rule.index() + 1,
				rule.id(),
				rule.lob().label(),
				rule.segmentPattern(),
				rule.insurerScope().describe(),
				rule.payoutFormula().description(),
				rule.remarksCondition()
		);
	}

	private static String resolveLocation(AppProperties properties) {
		if (properties == null || properties.payout() == null) {
			return DEFAULT_LOCATION;
		}
		String location = properties.payout().tableLocation();
		return location == null || location.isBlank() ? DEFAULT_LOCATION : location;
	}
}

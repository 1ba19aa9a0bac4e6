package my.policypayout.app.rules;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.PropertyNamingStrategies;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.dataformat.yaml.YAMLMapper;

/**
 * Reads a payout table document. JSON is tried first; anything that is not JSON is read
 * as YAML, so hand-edited tables can use either.
 */
public class PayoutTableParser {
	private final ObjectMapper jsonMapper;
	private final ObjectMapper yamlMapper;

	public PayoutTableParser() {
		this.jsonMapper = JsonMapper.builder()
				.propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.build();
		this.yamlMapper = YAMLMapper.builder()
				.propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.build();
	}

	public PayoutTableDefinition parse(String content) {
		if (content == null || content.isBlank()) {
			throw new PayoutTableException("Payout table document is empty");
		}
		String trimmed = content.strip();
		if (trimmed.startsWith("{")) {
			// JSON documents report JSON errors
			return read(jsonMapper, trimmed, "JSON");
		}
		return read(yamlMapper, trimmed, "YAML");
	}

	private PayoutTableDefinition read(ObjectMapper mapper, String content, String format) {
		PayoutTableDefinition definition;
		try {
			definition = mapper.readValue(content, PayoutTableDefinition.class);
		} catch (JacksonException ex) {
			throw new PayoutTableException("Payout table is not valid " + format + ": " + ex.getMessage(), ex);
		}
		if (definition == null) {
			throw new PayoutTableException("Payout table document is empty");
		}
		return definition;
	}
}

package my.policypayout.app.service;

import my.policypayout.app.classify.PayinClassification;
import my.policypayout.app.classify.PayinClassifier;
import my.policypayout.app.domain.PolicyRecord;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Coerces one loosely typed extracted record into a {@link PolicyRecord}.
 */
public class PolicyRecordNormalizer {
	static final String DEFAULT_POLICY_TYPE = "Comp";
	static final String DEFAULT_LOCATION = "N/A";

	private static final List<String> SEGMENT_KEYS = List.of("segment", "Segment", "SEGMENT");
	private static final List<String> POLICY_TYPE_KEYS = List.of("policy_type", "policyType", "policy type");
	private static final List<String> LOCATION_KEYS = List.of("location", "Location");
	private static final List<String> PAYIN_KEYS = List.of("payin", "Payin", "payinRaw");
	private static final List<String> REMARK_KEYS = List.of("remark", "remarks", "Remarks");

	private final PayinClassifier payinClassifier;

	public PolicyRecordNormalizer() {
		this(new PayinClassifier());
	}

	public PolicyRecordNormalizer(PayinClassifier payinClassifier) {
		this.payinClassifier = payinClassifier;
	}

	public PolicyRecord normalize(Map<String, Object> raw) {
		Map<String, Object> source = raw == null ? Map.of() : raw;
		String segment = text(first(source, SEGMENT_KEYS));
		String policyType = orDefault(text(first(source, POLICY_TYPE_KEYS)), DEFAULT_POLICY_TYPE);
		String location = orDefault(text(first(source, LOCATION_KEYS)), DEFAULT_LOCATION);
		Object payin = first(source, PAYIN_KEYS);
		PayinClassification payinClassification = payinClassifier.classify(payin);
		String remarks = remarks(first(source, REMARK_KEYS));
		return PolicyRecord.of(segment, policyType, location, text(payin), payinClassification.value(), remarks);
	}

	private Object first(Map<String, Object> source, List<String> keys) {
		for (String key : keys) {
			Object value = source.get(key);
			if (value != null) {
				return value;
			}
		}
		return null;
	}

	private String remarks(Object value) {
		if (value instanceof Collection<?> items) {
			return items.stream()
					.filter(Objects::nonNull)
					.map(item -> item.toString().trim())
					.filter(item -> !item.isEmpty())
					.collect(Collectors.joining("; "));
		}
		return text(value);
	}

	private String text(Object value) {
		return value == null ? "" : value.toString().trim();
	}

	private String orDefault(String value, String fallback) {
		return value.isEmpty() ? fallback : value;
	}
}

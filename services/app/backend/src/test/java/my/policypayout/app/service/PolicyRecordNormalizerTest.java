package my.policypayout.app.service;

import my.policypayout.app.classify.PayinBracket;
import my.policypayout.app.domain.PolicyRecord;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PolicyRecordNormalizerTest {
	private final PolicyRecordNormalizer normalizer = new PolicyRecordNormalizer();

	@Test
	void fillsDefaultsForMissingFields() {
		PolicyRecord record = normalizer.normalize(Map.of("segment", "TW TP", "payin", "25%"));

		assertThat(record.policyType()).isEqualTo("Comp");
		assertThat(record.location()).isEqualTo("N/A");
		assertThat(record.remarks()).isEmpty();
		assertThat(record.payinValue()).isEqualTo(25.0);
		assertThat(record.payinCategory()).isEqualTo(PayinBracket.FROM_21_TO_30);
	}

	@Test
	void acceptsAlternateKeysAndJoinsRemarkLists() {
		Map<String, Object> raw = new HashMap<>();
		raw.put("Segment", " Taxi ");
		raw.put("policyType", "TP");
		raw.put("Location", "Chennai");
		raw.put("Payin", 33.5);
		raw.put("remarks", List.of("Payin 31% to 50%", " ", "Diesel only"));

		PolicyRecord record = normalizer.normalize(raw);

		assertThat(record.segment()).isEqualTo("Taxi");
		assertThat(record.policyType()).isEqualTo("TP");
		assertThat(record.location()).isEqualTo("Chennai");
		assertThat(record.payinCategory()).isEqualTo(PayinBracket.FROM_31_TO_50);
		assertThat(record.remarks()).isEqualTo("Payin 31% to 50%; Diesel only");
	}

	@Test
	void unreadablePayinFallsBackToZero() {
		PolicyRecord record = normalizer.normalize(Map.of("segment", "BUS", "payin", "abc"));

		assertThat(record.payinValue()).isZero();
		assertThat(record.payinRaw()).isEqualTo("abc");
		assertThat(record.payinCategory()).isEqualTo(PayinBracket.BELOW_20);
	}

	@Test
	void nullRecordIsEmpty() {
		PolicyRecord record = normalizer.normalize(null);

		assertThat(record.segment()).isEmpty();
		assertThat(record.payinValue()).isZero();
	}
}

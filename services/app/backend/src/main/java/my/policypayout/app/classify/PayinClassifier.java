package my.policypayout.app.classify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Turns a raw payin (number or percentage text) into a value and its bracket.
 * Unreadable input falls back to {@link PayinClassification#DEFAULT} instead of failing.
 */
public class PayinClassifier {
	private static final Logger logger = LoggerFactory.getLogger(PayinClassifier.class);

	public PayinClassification classify(Object raw) {
		if (raw == null) {
			return PayinClassification.DEFAULT;
		}
		if (raw instanceof Number number) {
			return classify(number.doubleValue());
		}
		String cleaned = clean(raw.toString());
		if (cleaned.isEmpty() || cleaned.toUpperCase(Locale.ROOT).equals("N/A")) {
			return PayinClassification.DEFAULT;
		}
		try {
			return classify(Double.parseDouble(cleaned));
		} catch (NumberFormatException ex) {
			logger.warn("Could not parse payin '{}': {}", raw, ex.getMessage());
			return PayinClassification.DEFAULT;
		}
	}

	public PayinClassification classify(double value) {
		if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
			logger.warn("Payin {} out of range, using 0", value);
			return PayinClassification.DEFAULT;
		}
		return new PayinClassification(value, PayinBracket.of(value));
	}

	private String clean(String raw) {
		String cleaned = raw.replace("%", "").replaceAll("\\s+", "").trim();
		// negative percentages are read as positive
		while (cleaned.startsWith("-")) {
			cleaned = cleaned.substring(1);
		}
		return cleaned;
	}
}

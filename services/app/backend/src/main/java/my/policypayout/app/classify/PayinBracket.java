package my.policypayout.app.classify;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Payin brackets, ordered. Upper bounds are inclusive, so 20, 30 and 50 belong
 * to the lower bracket.
 */
public enum PayinBracket {
	BELOW_20("Payin Below 20%", 20.0d),
	FROM_21_TO_30("Payin 21% to 30%", 30.0d),
	FROM_31_TO_50("Payin 31% to 50%", 50.0d),
	ABOVE_50("Payin Above 50%", Double.POSITIVE_INFINITY);

	private final String label;
	private final double upperBound;

	PayinBracket(String label, double upperBound) {
		this.label = label;
		this.upperBound = upperBound;
	}

	public String label() {
		return label;
	}

	public static PayinBracket of(double value) {
		for (PayinBracket bracket : values()) {
			if (value <= bracket.upperBound) {
				return bracket;
			}
		}
		return ABOVE_50;
	}

	/**
	 * Finds the bracket whose label appears in the given condition text, if any.
	 * Case and repeated whitespace are ignored.
	 */
	public static Optional<PayinBracket> findIn(String text) {
		if (text == null || text.isBlank()) {
			return Optional.empty();
		}
		String condition = fold(text);
		return Arrays.stream(values())
				.filter(bracket -> condition.contains(fold(bracket.label)))
				.findFirst();
	}

	private static String fold(String value) {
		return value.trim().toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
	}
}

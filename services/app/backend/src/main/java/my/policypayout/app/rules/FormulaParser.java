package my.policypayout.app.rules;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads formula text as written in payout grids: "90% of Payin", "-3%",
 * "Less 2% of Payin" and "Payin".
 */
public class FormulaParser {
	private static final Pattern PERCENT_OF = Pattern.compile("^(\\d+(?:\\.\\d+)?)\\s*%\\s*OF\\s+PAYIN$");
	private static final Pattern LESS_OF = Pattern.compile("^LESS\\s+(\\d+(?:\\.\\d+)?)\\s*%(?:\\s+OF\\s+PAYIN)?$");
	private static final Pattern MINUS = Pattern.compile("^-\\s*(\\d+(?:\\.\\d+)?)\\s*%?$");

	public Optional<Formula> parse(String text) {
		if (text == null || text.isBlank()) {
			return Optional.empty();
		}
		String description = text.trim().replaceAll("\\s+", " ");
		String upper = description.toUpperCase(Locale.ROOT);
		if (upper.equals("PAYIN") || upper.equals("IDENTITY")) {
			return Optional.of(new Formula.Identity(description));
		}
		Matcher percent = PERCENT_OF.matcher(upper);
		if (percent.matches()) {
			return Optional.of(new Formula.PercentOf(Double.parseDouble(percent.group(1)) / 100.0d, description));
		}
		Matcher less = LESS_OF.matcher(upper);
		if (less.matches()) {
			return Optional.of(new Formula.SubtractFlat(Double.parseDouble(less.group(1)), description));
		}
		Matcher minus = MINUS.matcher(upper);
		if (minus.matches()) {
			return Optional.of(new Formula.SubtractFlat(Double.parseDouble(minus.group(1)), description));
		}
		return Optional.empty();
	}
}

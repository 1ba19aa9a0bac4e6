package my.policypayout.app.service;

import my.policypayout.app.rules.Formula;

import java.util.Locale;

public class PayoutCalculator {

	public double apply(Formula formula, double payinValue) {
		Formula effective = formula == null ? Formula.Identity.INSTANCE : formula;
		return Formula.clamp(effective.apply(payinValue));
	}

	/**
	 * Two decimals and a trailing percent sign, e.g. {@code 52.00%}.
	 */
	public static String format(double percent) {
		return String.format(Locale.ROOT, "%.2f%%", percent);
	}
}

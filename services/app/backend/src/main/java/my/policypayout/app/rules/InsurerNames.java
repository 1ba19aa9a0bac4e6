package my.policypayout.app.rules;

import java.util.Locale;

public final class InsurerNames {
	private InsurerNames() {
	}

	/**
	 * Upper-cases, drops the GENERAL and INSURANCE tokens and collapses whitespace,
	 * so "Bajaj Allianz General Insurance" and "BAJAJ ALLIANZ" compare equal.
	 */
	public static String normalize(String name) {
		if (name == null) {
			return "";
		}
		String upper = name.toUpperCase(Locale.ROOT);
		upper = upper.replaceAll("\\b(GENERAL|INSURANCE)\\b", " ");
		return upper.replaceAll("\\s+", " ").trim();
	}

	/**
	 * Substring match in both directions. Blank names never match.
	 */
	public static boolean sameInsurer(String normalizedCompany, String normalizedListed) {
		if (normalizedCompany.isEmpty() || normalizedListed.isEmpty()) {
			return false;
		}
		return normalizedCompany.contains(normalizedListed) || normalizedListed.contains(normalizedCompany);
	}
}

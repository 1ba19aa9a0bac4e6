package my.policypayout.app.classify;

import java.util.Locale;
import java.util.Optional;

public enum Lob {
	TW("TW"),
	PVT_CAR("PVT CAR"),
	CV("CV"),
	BUS("BUS"),
	TAXI("TAXI"),
	MISD("MISD"),
	UNKNOWN("UNKNOWN");

	private final String label;

	Lob(String label) {
		this.label = label;
	}

	public String label() {
		return label;
	}

	/**
	 * Accepts both the display label ("PVT CAR") and the constant name ("PVT_CAR").
	 */
	public static Optional<Lob> fromLabel(String value) {
		if (value == null || value.isBlank()) {
			return Optional.empty();
		}
		String normalized = value.trim().toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
		for (Lob lob : values()) {
			if (lob.label.equals(normalized) || lob.name().equals(normalized)) {
				return Optional.of(lob);
			}
		}
		return Optional.empty();
	}
}

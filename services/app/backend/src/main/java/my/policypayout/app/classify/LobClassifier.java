package my.policypayout.app.classify;

import java.util.List;
import java.util.Locale;

public class LobClassifier {
	// short codes count only as whole tokens, optionally plural
	private static final List<KeywordPattern<Lob>> SEGMENT_PATTERNS = List.of(
			KeywordPattern.words(Lob.TW, "TW", "2W", "MC", "SC"),
			KeywordPattern.substrings(Lob.TW, "1+5", "TWO WHEELER", "TWO-WHEELER", "SCOOTER"),
			KeywordPattern.words(Lob.PVT_CAR, "PCI"),
			KeywordPattern.substrings(Lob.PVT_CAR, "PVT CAR", "PRIVATE CAR", "CAR"),
			KeywordPattern.words(Lob.CV, "CV", "LCV", "GVW", "TN", "UPTO", "PCV", "GCV"),
			KeywordPattern.substrings(Lob.CV, "COMMERCIAL"),
			KeywordPattern.substrings(Lob.BUS, "BUS"),
			KeywordPattern.substrings(Lob.TAXI, "TAXI"),
			KeywordPattern.words(Lob.MISD, "MISD", "MISC"),
			KeywordPattern.substrings(Lob.MISD, "TRACTOR", "AMBULANCE")
	);

	// make and tonnage hints that sometimes only survive extraction in the remarks
	private static final List<KeywordPattern<Lob>> REMARKS_CV_HINTS = List.of(
			KeywordPattern.substrings(Lob.CV, "TATA", "MARUTI"),
			KeywordPattern.words(Lob.CV, "GVW", "TN"));

	public Lob classify(String segmentText, String remarksText) {
		String segment = upper(segmentText);
		return KeywordPattern.firstMatch(SEGMENT_PATTERNS, segment)
				.or(() -> KeywordPattern.firstMatch(REMARKS_CV_HINTS, upper(remarksText)))
				.orElse(Lob.UNKNOWN);
	}

	private String upper(String value) {
		return value == null ? "" : value.toUpperCase(Locale.ROOT);
	}
}

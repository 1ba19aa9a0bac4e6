package my.policypayout.app.classify;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Decides which canonical segment a record belongs to. The heuristics differ per LOB,
 * so a rule's segment pattern is matched through the definition that carries its label
 * rather than by a plain string comparison.
 */
public class SegmentMatcher {
	public static final String TW_NEW = "1+5";
	public static final String TW_SAOD_COMP = "TW SAOD + COMP";
	public static final String TW_TP = "TW TP";
	public static final String PVT_CAR_COMP = "PVT CAR COMP + SAOD";
	public static final String PVT_CAR_TP = "PVT CAR TP";
	public static final String CV_UPTO_2_5 = "Upto 2.5 GVW";
	public static final String CV_ALL = "All GVW & PCV 3W, GCV 3W";
	public static final String SCHOOL_BUS = "SCHOOL BUS";
	public static final String STAFF_BUS = "STAFF BUS";
	public static final String TAXI = "TAXI";
	public static final String MISD = "Misd, Tractor";

	private static final KeywordPattern<String> COMP_KEYWORDS =
			KeywordPattern.substrings("COMP", "COMP", "COMPREHENSIVE", "PACKAGE", "1ST PARTY", "1+1");
	private static final KeywordPattern<String> TP_KEYWORD = KeywordPattern.substrings("TP", "TP");
	private static final KeywordPattern<String> UPTO_2_5_KEYWORDS =
			KeywordPattern.substrings(CV_UPTO_2_5, "UPTO 2.5", "2.5 TN", "2.5 GVW");

	private final Map<Lob, List<SegmentDefinition>> definitions = new EnumMap<>(Lob.class);

	public SegmentMatcher() {
		definitions.put(Lob.TW, List.of(
				new SegmentDefinition(TW_NEW, KeywordPattern.substrings(TW_NEW, "1+5", "NEW", "FRESH")::matches),
				new SegmentDefinition(TW_SAOD_COMP,
						KeywordPattern.substrings(TW_SAOD_COMP, "SAOD", "COMP", "PACKAGE", "1ST PARTY", "1+1")::matches),
				// no COMP exclusion for two-wheelers, unlike private cars
				new SegmentDefinition(TW_TP, TP_KEYWORD::matches)
		));
		definitions.put(Lob.PVT_CAR, List.of(
				new SegmentDefinition(PVT_CAR_COMP, COMP_KEYWORDS::matches),
				new SegmentDefinition(PVT_CAR_TP, text -> TP_KEYWORD.matches(text) && !text.contains("COMP"))
		));
		definitions.put(Lob.CV, List.of(
				new SegmentDefinition(CV_UPTO_2_5, UPTO_2_5_KEYWORDS::matches),
				new SegmentDefinition(CV_ALL, text -> !UPTO_2_5_KEYWORDS.matches(text))
		));
		definitions.put(Lob.BUS, List.of(
				new SegmentDefinition(SCHOOL_BUS, text -> text.contains("SCHOOL")),
				new SegmentDefinition(STAFF_BUS, text -> text.contains("STAFF") || !text.contains("SCHOOL"))
		));
		definitions.put(Lob.TAXI, List.of(new SegmentDefinition(TAXI, text -> true)));
		definitions.put(Lob.MISD, List.of(new SegmentDefinition(MISD, text -> true)));
	}

	/**
	 * Returns the first canonical segment of the LOB whose heuristic accepts the text.
	 */
	public Optional<String> resolve(Lob lob, String text) {
		String upper = normalize(text);
		return definitions.getOrDefault(lob, List.of()).stream()
				.filter(definition -> definition.accepts().test(upper))
				.map(SegmentDefinition::label)
				.findFirst();
	}

	/**
	 * Checks whether a rule's segment pattern applies to the record text. Patterns that are
	 * not canonical labels fall back to a contains test on the normalized text.
	 */
	public boolean matches(Lob lob, String segmentPattern, String text) {
		String upper = normalize(text);
		String pattern = normalize(segmentPattern);
		if (pattern.isEmpty()) {
			return false;
		}
		for (SegmentDefinition definition : definitions.getOrDefault(lob, List.of())) {
			if (normalize(definition.label()).equals(pattern)) {
				return definition.accepts().test(upper);
			}
		}
		return upper.contains(pattern);
	}

	public List<String> canonicalSegments(Lob lob) {
		return definitions.getOrDefault(lob, List.of()).stream().map(SegmentDefinition::label).toList();
	}

	private static String normalize(String value) {
		if (value == null) {
			return "";
		}
		return value.trim().toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
	}

	private record SegmentDefinition(String label, Predicate<String> accepts) {
	}
}

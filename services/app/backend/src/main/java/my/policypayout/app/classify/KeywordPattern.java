package my.policypayout.app.classify;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A classification outcome guarded by a keyword set. Patterns are evaluated in
 * list order by the classifiers; the first one that hits wins.
 *
 * @param <T> the outcome produced when any keyword is present
 */
public final class KeywordPattern<T> {

	public enum MatchMode {
		/** keyword, optionally pluralized, must not be preceded or followed by a letter */
		WORD,
		/** plain substring */
		SUBSTRING
	}

	private final T outcome;
	private final List<String> keywords;
	private final MatchMode mode;
	private final List<Pattern> wordPatterns;

	public KeywordPattern(T outcome, List<String> keywords, MatchMode mode) {
		this.outcome = outcome;
		this.keywords = keywords.stream().map(k -> k.toUpperCase(Locale.ROOT)).toList();
		this.mode = mode;
		this.wordPatterns = mode == MatchMode.WORD
				? this.keywords.stream().map(KeywordPattern::wordPattern).toList()
				: List.of();
	}

	public static <T> KeywordPattern<T> words(T outcome, String... keywords) {
		return new KeywordPattern<>(outcome, List.of(keywords), MatchMode.WORD);
	}

	public static <T> KeywordPattern<T> substrings(T outcome, String... keywords) {
		return new KeywordPattern<>(outcome, List.of(keywords), MatchMode.SUBSTRING);
	}

	public T outcome() {
		return outcome;
	}

	public List<String> keywords() {
		return keywords;
	}

	public MatchMode mode() {
		return mode;
	}

	public boolean matches(String upperText) {
		return firstHit(upperText).isPresent();
	}

	public Optional<String> firstHit(String upperText) {
		if (upperText == null || upperText.isEmpty()) {
			return Optional.empty();
		}
		for (int i = 0; i < keywords.size(); i++) {
			if (contains(upperText, i)) {
				return Optional.of(keywords.get(i));
			}
		}
		return Optional.empty();
	}

	private boolean contains(String text, int index) {
		if (mode == MatchMode.SUBSTRING) {
			return text.contains(keywords.get(index));
		}
		return wordPatterns.get(index).matcher(text).find();
	}

	private static Pattern wordPattern(String keyword) {
		return Pattern.compile("(?<![A-Z])" + Pattern.quote(keyword) + "(?:E?S)?(?![A-Z])");
	}

	public static <T> Optional<T> firstMatch(List<KeywordPattern<T>> patterns, String upperText) {
		for (KeywordPattern<T> pattern : patterns) {
			if (pattern.matches(upperText)) {
				return Optional.of(pattern.outcome());
			}
		}
		return Optional.empty();
	}
}

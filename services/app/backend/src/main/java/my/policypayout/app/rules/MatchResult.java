package my.policypayout.app.rules;

import java.util.Optional;

public record MatchResult(RuleEntry rule, String explanation) {
	public static MatchResult noMatch(String explanation) {
		return new MatchResult(null, explanation);
	}

	public Optional<RuleEntry> matchedRule() {
		return Optional.ofNullable(rule);
	}

	public boolean matched() {
		return rule != null;
	}
}

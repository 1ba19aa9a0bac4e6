package my.policypayout.app.rules;

import my.policypayout.app.classify.Lob;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, ordered payout table. Alongside the rules it keeps, per (LOB, segment) group,
 * the normalized names claimed by explicit-list rules; "rest of companies" rules are
 * resolved against that index.
 */
public final class PayoutTable {
	private final String name;
	private final List<RuleEntry> rules;
	private final Map<GroupKey, Set<String>> explicitlyClaimed;

	public PayoutTable(String name, List<RuleEntry> rules) {
		this.name = name;
		this.rules = List.copyOf(rules);
		this.explicitlyClaimed = indexExplicitNames(this.rules);
	}

	public String name() {
		return name;
	}

	public List<RuleEntry> rules() {
		return rules;
	}

	public int size() {
		return rules.size();
	}

	/**
	 * Normalized insurer names listed by any explicit-list rule sharing the LOB and segment pattern.
	 */
	public Set<String> claimedBySiblings(Lob lob, String segmentPattern) {
		return explicitlyClaimed.getOrDefault(GroupKey.of(lob, segmentPattern), Set.of());
	}

	private static Map<GroupKey, Set<String>> indexExplicitNames(List<RuleEntry> rules) {
		Map<GroupKey, Set<String>> index = new HashMap<>();
		for (RuleEntry rule : rules) {
			if (rule.insurerScope() instanceof InsurerScope.ExplicitList explicit) {
				Set<String> claimed = index.computeIfAbsent(GroupKey.of(rule.lob(), rule.segmentPattern()), k -> new HashSet<>());
				for (String listed : explicit.names()) {
					String normalized = InsurerNames.normalize(listed);
					if (!normalized.isEmpty()) {
						claimed.add(normalized);
					}
				}
			}
		}
		Map<GroupKey, Set<String>> frozen = new HashMap<>();
		index.forEach((key, names) -> frozen.put(key, Set.copyOf(names)));
		return Map.copyOf(frozen);
	}

	private record GroupKey(Lob lob, String segment) {
		static GroupKey of(Lob lob, String segmentPattern) {
			String segment = segmentPattern == null ? "" : segmentPattern.trim().toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
			return new GroupKey(lob, segment);
		}
	}
}

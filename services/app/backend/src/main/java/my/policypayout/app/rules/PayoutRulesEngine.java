package my.policypayout.app.rules;

import my.policypayout.app.classify.Lob;
import my.policypayout.app.classify.PayinBracket;
import my.policypayout.app.classify.SegmentMatcher;
import my.policypayout.app.domain.PolicyRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * First-match evaluation of the payout table. Declaration order is the only tie-break;
 * there is no scoring.
 */
public class PayoutRulesEngine {
	private static final Logger logger = LoggerFactory.getLogger(PayoutRulesEngine.class);
	private static final String NIL = "NIL";

	private final PayoutTable table;
	private final SegmentMatcher segmentMatcher;
	private final InsurerScopeResolver scopeResolver;

	public PayoutRulesEngine(PayoutTable table) {
		this(table, new SegmentMatcher(), new InsurerScopeResolver());
	}

	public PayoutRulesEngine(PayoutTable table, SegmentMatcher segmentMatcher, InsurerScopeResolver scopeResolver) {
		this.table = table;
		this.segmentMatcher = segmentMatcher;
		this.scopeResolver = scopeResolver;
	}

	public PayoutTable table() {
		return table;
	}

	public MatchResult evaluate(PolicyRecord record, Lob lob, String segmentText, String companyName) {
		PayinBracket bracket = record.payinCategory();
		for (RuleEntry rule : table.rules()) {
			if (rule.lob() != lob) {
				continue;
			}
			if (!segmentMatcher.matches(lob, rule.segmentPattern(), segmentText)) {
				continue;
			}
			if (!scopeResolver.applies(rule, companyName, table)) {
				logger.debug("Rule {} skipped: insurer scope {} excludes '{}'", rule.displayId(),
						rule.insurerScope().describe(), companyName);
				continue;
			}
			RemarksCheck check = checkRemarks(rule.remarksCondition(), bracket);
			if (!check.satisfied()) {
				logger.debug("Rule {} skipped: remarks '{}' do not match {}", rule.displayId(),
						rule.remarksCondition(), bracket.label());
				continue;
			}
			if (check.catchAll()) {
				logger.warn("Rule {} matched through unrecognized remarks condition '{}' (treated as unconditional)",
						rule.displayId(), rule.remarksCondition());
			}
			String explanation = explain(rule, lob, bracket, companyName, check);
			logger.debug("Rule matched: {}", explanation);
			return new MatchResult(rule, explanation);
		}
		String segment = segmentMatcher.resolve(lob, segmentText).orElse(segmentText == null ? "" : segmentText.trim());
		return MatchResult.noMatch("no rule for " + lob.label() + "/" + segment + "/" + safe(companyName));
	}

	private RemarksCheck checkRemarks(String condition, PayinBracket bracket) {
		if (condition == null || condition.isBlank() || condition.trim().equalsIgnoreCase(NIL)) {
			return new RemarksCheck(true, false);
		}
		Optional<PayinBracket> required = PayinBracket.findIn(condition);
		if (required.isPresent()) {
			return new RemarksCheck(required.get() == bracket, false);
		}
		return new RemarksCheck(true, true);
	}

	private String explain(RuleEntry rule, Lob lob, PayinBracket bracket, String companyName, RemarksCheck check) {
		StringBuilder sb = new StringBuilder();
		sb.append("Matched rule ").append(rule.displayId())
				.append(": LOB=").append(lob.label())
				.append(", Segment='").append(rule.segmentPattern()).append("'")
				.append(", Insurer=").append(rule.insurerScope().describe())
				.append(" (company '").append(safe(companyName)).append("')")
				.append(", REMARKS='").append(rule.remarksCondition().isEmpty() ? NIL : rule.remarksCondition()).append("'")
				.append(", PayinCat='").append(bracket.label()).append("'");
		if (check.catchAll()) {
			sb.append(", condition not enforced");
		}
		return sb.toString();
	}

	private String safe(String value) {
		return value == null ? "" : value.trim();
	}

	private record RemarksCheck(boolean satisfied, boolean catchAll) {
	}
}

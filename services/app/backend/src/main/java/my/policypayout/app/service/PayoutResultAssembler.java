package my.policypayout.app.service;

import my.policypayout.app.classify.Lob;
import my.policypayout.app.classify.LobClassifier;
import my.policypayout.app.classify.SegmentMatcher;
import my.policypayout.app.domain.PolicyRecord;
import my.policypayout.app.dto.PayoutRowDto;
import my.policypayout.app.rules.Formula;
import my.policypayout.app.rules.MatchResult;
import my.policypayout.app.rules.PayoutRulesEngine;
import my.policypayout.app.rules.RuleEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Runs the per-record pipeline and turns any fault into an error row, so a single bad
 * record never aborts its batch.
 */
public class PayoutResultAssembler {
	private static final Logger logger = LoggerFactory.getLogger(PayoutResultAssembler.class);

	public static final String NO_MATCH_FORMULA = "No matching rule found";
	public static final String ERROR_PAYOUT = "Error";
	public static final String ERROR_FORMULA = "Error in calculation";

	private final PolicyRecordNormalizer normalizer;
	private final LobClassifier lobClassifier;
	private final SegmentMatcher segmentMatcher;
	private final PayoutCalculator calculator;

	public PayoutResultAssembler() {
		this(new PolicyRecordNormalizer(), new LobClassifier(), new SegmentMatcher(), new PayoutCalculator());
	}

	public PayoutResultAssembler(PolicyRecordNormalizer normalizer,
								 LobClassifier lobClassifier,
								 SegmentMatcher segmentMatcher,
								 PayoutCalculator calculator) {
		this.normalizer = normalizer;
		this.lobClassifier = lobClassifier;
		this.segmentMatcher = segmentMatcher;
		this.calculator = calculator;
	}

	public PayoutOutcome assemble(Map<String, Object> raw, String companyName, PayoutRulesEngine engine) {
		PolicyRecord record = null;
		try {
			record = normalizer.normalize(raw);
			return assemble(record, companyName, engine);
		} catch (RuntimeException ex) {
			logger.error("Error processing record {}: {}", raw, ex.getMessage(), ex);
			// payin of a normalized record still counts toward the batch average
			double payin = record == null ? 0.0d : record.payinValue();
			return PayoutOutcome.failure(errorRow(raw, ex), payin, rawText(raw, "segment"), messageOf(ex));
		}
	}

	public PayoutOutcome assemble(PolicyRecord record, String companyName, PayoutRulesEngine engine) {
		Lob lob = lobClassifier.classify(record.segment(), record.remarks());
		String resolvedSegment = segmentMatcher.resolve(lob, record.segment()).orElse(record.segment());
		MatchResult match = engine.evaluate(record, lob, record.segment(), companyName);

		Formula formula = match.matchedRule().map(RuleEntry::payoutFormula).orElse(Formula.Identity.INSTANCE);
		double payout = calculator.apply(formula, record.payinValue());
		String formulaUsed = match.matched() ? formula.description() : NO_MATCH_FORMULA;
		if (!match.matched()) {
			logger.warn("No rule matched: {}", match.explanation());
		}

		PayoutRowDto row = new PayoutRowDto(
				record.segment(),
				record.policyType(),
				record.location(),
				PayoutCalculator.format(record.payinValue()),
				record.remarks(),
				lob.label(),
				resolvedSegment,
				record.payinCategory().label(),
				PayoutCalculator.format(payout),
				formulaUsed,
				match.explanation()
		);
		return PayoutOutcome.success(row, record.payinValue(), resolvedSegment);
	}

	private PayoutRowDto errorRow(Map<String, Object> raw, RuntimeException ex) {
		return new PayoutRowDto(
				rawText(raw, "segment"),
				rawText(raw, "policy_type"),
				rawText(raw, "location"),
				rawText(raw, "payin"),
				rawText(raw, "remark"),
				Lob.UNKNOWN.label(),
				"",
				"",
				ERROR_PAYOUT,
				ERROR_FORMULA,
				"Error: " + messageOf(ex)
		);
	}

	private String rawText(Map<String, Object> raw, String key) {
		if (raw == null) {
			return "";
		}
		Object value = raw.get(key);
		return value == null ? "" : value.toString();
	}

	private String messageOf(RuntimeException ex) {
		return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
	}
}

package my.policypayout.app.rules;

import my.policypayout.app.classify.Lob;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns a validated definition into an immutable {@link PayoutTable}, keeping declaration order.
 */
public class PayoutTableCompiler {
	private final PayoutTableValidator validator;
	private final FormulaParser formulaParser;

	public PayoutTableCompiler() {
		this.formulaParser = new FormulaParser();
		this.validator = new PayoutTableValidator(formulaParser);
	}

	public PayoutTable compile(PayoutTableDefinition definition) {
		List<String> errors = validator.validate(definition);
		if (!errors.isEmpty()) {
			throw new PayoutTableException("Payout table invalid: " + String.join("; ", errors));
		}
		List<RuleEntry> entries = new ArrayList<>();
		int index = 0;
		for (PayoutRuleDefinition rule : definition.getRules()) {
			Lob lob = Lob.fromLabel(rule.getLob()).orElseThrow();
			Formula formula = formulaParser.parse(rule.getFormula()).orElseThrow();
			String remarks = rule.getRemarks() == null ? "" : rule.getRemarks().trim();
			entries.add(new RuleEntry(index++, rule.getId(), lob, rule.getSegment().trim(),
					toScope(rule.getInsurers()), formula, remarks));
		}
		return new PayoutTable(definition.getName(), entries);
	}

	private InsurerScope toScope(InsurerScopeDefinition insurers) {
		if (insurers == null || insurers.getScope() == null) {
			return new InsurerScope.AllCompanies();
		}
		return switch (insurers.getScope().trim().toUpperCase(Locale.ROOT)) {
			case InsurerScopeDefinition.EXPLICIT -> {
				Set<String> names = new LinkedHashSet<>();
				for (String name : insurers.getNames()) {
					if (name != null && !name.isBlank()) {
						names.add(name.trim());
					}
				}
				yield new InsurerScope.ExplicitList(names);
			}
			case InsurerScopeDefinition.REST -> new InsurerScope.RestOfCompanies();
			default -> new InsurerScope.AllCompanies();
		};
	}
}

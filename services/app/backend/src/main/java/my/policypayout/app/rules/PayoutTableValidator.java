package my.policypayout.app.rules;

import my.policypayout.app.classify.Lob;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public class PayoutTableValidator {
	private static final Set<String> SCOPES = Set.of(
			InsurerScopeDefinition.ALL, InsurerScopeDefinition.EXPLICIT, InsurerScopeDefinition.REST);

	private final FormulaParser formulaParser;

	public PayoutTableValidator() {
		this(new FormulaParser());
	}

	public PayoutTableValidator(FormulaParser formulaParser) {
		this.formulaParser = formulaParser;
	}

	public List<String> validate(PayoutTableDefinition definition) {
		List<String> errors = new ArrayList<>();
		if (definition == null) {
			errors.add("Payout table is empty");
			return errors;
		}
		if (definition.getSchemaVersion() != 1) {
			errors.add("schema_version must be 1");
		}
		if (definition.getName() == null || definition.getName().isBlank()) {
			errors.add("name is required");
		}
		if (definition.getRules() == null || definition.getRules().isEmpty()) {
			errors.add("rules must be provided");
			return errors;
		}
		int position = 0;
		for (PayoutRuleDefinition rule : definition.getRules()) {
			position++;
			String prefix = "rules[" + position + "]";
			if (rule == null) {
				errors.add(prefix + " is empty");
				continue;
			}
			if (rule.getLob() == null || Lob.fromLabel(rule.getLob()).filter(l -> l != Lob.UNKNOWN).isEmpty()) {
				errors.add(prefix + ".lob must be one of TW, PVT CAR, CV, BUS, TAXI, MISD");
			}
			if (rule.getSegment() == null || rule.getSegment().isBlank()) {
				errors.add(prefix + ".segment is required");
			}
			if (rule.getFormula() == null || rule.getFormula().isBlank()) {
				errors.add(prefix + ".formula is required");
			} else if (formulaParser.parse(rule.getFormula()).isEmpty()) {
				errors.add(prefix + ".formula not understood: " + rule.getFormula());
			}
			validateScope(prefix, rule.getInsurers(), errors);
		}
		return errors;
	}

	private void validateScope(String prefix, InsurerScopeDefinition insurers, List<String> errors) {
		if (insurers == null) {
			// absent scope means all companies
			return;
		}
		String scope = insurers.getScope() == null ? null : insurers.getScope().trim().toUpperCase(Locale.ROOT);
		if (scope == null || !SCOPES.contains(scope)) {
			errors.add(prefix + ".insurers.scope must be one of " + SCOPES);
			return;
		}
		boolean hasNames = insurers.getNames() != null
				&& insurers.getNames().stream().anyMatch(n -> n != null && !n.isBlank());
		if (scope.equals(InsurerScopeDefinition.EXPLICIT) && !hasNames) {
			errors.add(prefix + ".insurers.names must not be empty for EXPLICIT");
		}
		if (!scope.equals(InsurerScopeDefinition.EXPLICIT) && hasNames) {
			errors.add(prefix + ".insurers.names only allowed for EXPLICIT");
		}
	}
}

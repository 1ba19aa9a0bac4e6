package my.policypayout.app.rules;

import java.util.Set;

public class InsurerScopeResolver {

	public boolean applies(RuleEntry rule, String companyName, PayoutTable table) {
		String company = InsurerNames.normalize(companyName);
		InsurerScope scope = rule.insurerScope();
		if (scope instanceof InsurerScope.ExplicitList explicit) {
			return explicit.names().stream()
					.map(InsurerNames::normalize)
					.anyMatch(listed -> InsurerNames.sameInsurer(company, listed));
		}
		if (scope instanceof InsurerScope.RestOfCompanies) {
			Set<String> claimed = table.claimedBySiblings(rule.lob(), rule.segmentPattern());
			return claimed.stream().noneMatch(listed -> InsurerNames.sameInsurer(company, listed));
		}
		return true;
	}
}

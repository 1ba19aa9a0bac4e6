package my.policypayout.app.rules;

import my.policypayout.app.classify.Lob;

/**
 * One compiled row of the payout table. {@code index} is the declaration position and
 * doubles as the rule's priority.
 */
public record RuleEntry(int index,
						String id,
						Lob lob,
						String segmentPattern,
						InsurerScope insurerScope,
						Formula payoutFormula,
						String remarksCondition) {

	public String displayId() {
		return id == null || id.isBlank() ? "#" + (index + 1) : id;
	}
}

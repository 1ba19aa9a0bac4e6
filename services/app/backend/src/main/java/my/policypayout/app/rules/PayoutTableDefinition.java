package my.policypayout.app.rules;

import java.util.List;

public class PayoutTableDefinition {
	private int schemaVersion;
	private String name;
	private List<PayoutRuleDefinition> rules;

	public int getSchemaVersion() {
		return schemaVersion;
	}

	public void setSchemaVersion(int schemaVersion) {
		this.schemaVersion = schemaVersion;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public List<PayoutRuleDefinition> getRules() {
		return rules;
	}

	public void setRules(List<PayoutRuleDefinition> rules) {
		this.rules = rules;
	}
}

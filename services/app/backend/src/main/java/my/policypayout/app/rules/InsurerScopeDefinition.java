package my.policypayout.app.rules;

import java.util.List;

public class InsurerScopeDefinition {
	public static final String ALL = "ALL";
	public static final String EXPLICIT = "EXPLICIT";
	public static final String REST = "REST";

	private String scope;
	private List<String> names;

	public InsurerScopeDefinition() {
	}

	public InsurerScopeDefinition(String scope, List<String> names) {
		this.scope = scope;
		this.names = names;
	}

	public String getScope() {
		return scope;
	}

	public void setScope(String scope) {
		this.scope = scope;
	}

	public List<String> getNames() {
		return names;
	}

	public void setNames(List<String> names) {
		this.names = names;
	}
}

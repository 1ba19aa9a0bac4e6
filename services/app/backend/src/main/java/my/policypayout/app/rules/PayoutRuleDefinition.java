package my.policypayout.app.rules;

public class PayoutRuleDefinition {
	private String id;
	private String lob;
	private String segment;
	private InsurerScopeDefinition insurers;
	private String formula;
	private String remarks;

	public String getId() {
		return id;
	}

	public void setId(String id) {
		this.id = id;
	}

	public String getLob() {
		return lob;
	}

	public void setLob(String lob) {
		this.lob = lob;
	}

	public String getSegment() {
		return segment;
	}

	public void setSegment(String segment) {
		this.segment = segment;
	}

	public InsurerScopeDefinition getInsurers() {
		return insurers;
	}

	public void setInsurers(InsurerScopeDefinition insurers) {
		this.insurers = insurers;
	}

	public String getFormula() {
		return formula;
	}

	public void setFormula(String formula) {
		this.formula = formula;
	}

	public String getRemarks() {
		return remarks;
	}

	public void setRemarks(String remarks) {
		this.remarks = remarks;
	}
}

package my.policypayout.app.domain;

import my.policypayout.app.classify.PayinBracket;

/**
 * Canonical policy record produced by normalization. The bracket is always derived from
 * the value, never set independently.
 */
public record PolicyRecord(String segment,
						   String policyType,
						   String location,
						   String payinRaw,
						   double payinValue,
						   PayinBracket payinCategory,
						   String remarks) {

	public PolicyRecord {
		if (Double.isNaN(payinValue) || payinValue < 0) {
			throw new IllegalArgumentException("payinValue must be >= 0, was " + payinValue);
		}
		PayinBracket derived = PayinBracket.of(payinValue);
		if (payinCategory != null && payinCategory != derived) {
			throw new IllegalArgumentException("payinCategory " + payinCategory + " does not match payin " + payinValue);
		}
		payinCategory = derived;
		segment = segment == null ? "" : segment;
		policyType = policyType == null ? "" : policyType;
		location = location == null ? "" : location;
		payinRaw = payinRaw == null ? "" : payinRaw;
		remarks = remarks == null ? "" : remarks;
	}

	public static PolicyRecord of(String segment, String policyType, String location, String payinRaw,
								  double payinValue, String remarks) {
		return new PolicyRecord(segment, policyType, location, payinRaw, payinValue, null, remarks);
	}
}

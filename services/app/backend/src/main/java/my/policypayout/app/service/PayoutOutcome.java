package my.policypayout.app.service;

import my.policypayout.app.dto.PayoutRowDto;

/**
 * Result of one record: always carries a row, and a fault message when the row is an error marker.
 */
public record PayoutOutcome(PayoutRowDto row, double payinValue, String resolvedSegment, String fault) {
	public static PayoutOutcome success(PayoutRowDto row, double payinValue, String resolvedSegment) {
		return new PayoutOutcome(row, payinValue, resolvedSegment, null);
	}

	public static PayoutOutcome failure(PayoutRowDto row, double payinValue, String resolvedSegment, String fault) {
		return new PayoutOutcome(row, payinValue, resolvedSegment, fault);
	}

	public boolean failed() {
		return fault != null;
	}
}

package my.policypayout.app.rules;

/**
 * The payout table could not be read, parsed or validated. Fatal for a whole batch.
 */
public class PayoutTableException extends RuntimeException {
	public PayoutTableException(String message) {
		super(message);
	}

	public PayoutTableException(String message, Throwable cause) {
		super(message, cause);
	}
}

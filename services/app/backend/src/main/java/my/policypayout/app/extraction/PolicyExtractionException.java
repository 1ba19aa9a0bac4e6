package my.policypayout.app.extraction;

public class PolicyExtractionException extends RuntimeException {
	private final boolean retryable;

	public PolicyExtractionException(String message, boolean retryable) {
		this(message, retryable, null);
	}

	public PolicyExtractionException(String message, boolean retryable, Throwable cause) {
		super(message, cause);
		this.retryable = retryable;
	}

	public boolean isRetryable() {
		return retryable;
	}
}

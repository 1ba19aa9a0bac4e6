package my.policypayout.app.service;

/**
 * A batch that cannot be processed at all: no records, or no company to evaluate them for.
 */
public class EmptyBatchException extends IllegalArgumentException {
	public EmptyBatchException(String message) {
		super(message);
	}
}

package my.policypayout.app.extraction;

/**
 * Reads policy rows out of an uploaded grid image. Implementations return the raw model
 * output, expected to contain a JSON array of records.
 */
public interface PolicyExtractionClient {
	String extract(byte[] payload, String filename, String contentType);
}

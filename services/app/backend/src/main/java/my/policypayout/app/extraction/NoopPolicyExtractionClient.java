package my.policypayout.app.extraction;

public class NoopPolicyExtractionClient implements PolicyExtractionClient {
	@Override
	public String extract(byte[] payload, String filename, String contentType) {
		throw new PolicyExtractionException("Policy extraction disabled", false);
	}
}

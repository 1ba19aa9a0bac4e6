package my.policypayout.app.service;

import my.policypayout.app.dto.PayoutBatchResultDto;
import my.policypayout.app.dto.PayoutExtractionResultDto;
import my.policypayout.app.extraction.ExtractedRecordsParser;
import my.policypayout.app.extraction.PolicyExtractionClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Map;

@Service
public class PolicyExtractionService {
	private static final Logger logger = LoggerFactory.getLogger(PolicyExtractionService.class);

	private final PolicyExtractionClient extractionClient;
	private final PayoutBatchService batchService;
	private final ExtractedRecordsParser parser;

	public PolicyExtractionService(PolicyExtractionClient extractionClient, PayoutBatchService batchService) {
		this.extractionClient = extractionClient;
		this.batchService = batchService;
		this.parser = new ExtractedRecordsParser();
	}

	public PayoutExtractionResultDto extractAndCalculate(MultipartFile file, String companyName) {
		String filename = file.getOriginalFilename() == null ? "upload" : file.getOriginalFilename();
		byte[] payload = readFile(file);
		if (payload.length == 0) {
			throw new IllegalArgumentException("Empty file");
		}
		parser.requireImage(filename, file.getContentType());

		logger.info("Extracting policy records from {} for {}", filename, companyName);
		String extracted = extractionClient.extract(payload, filename, file.getContentType());
		List<Map<String, Object>> records = parser.parse(extracted);
		if (records.isEmpty()) {
			throw new EmptyBatchException("No text extracted from image");
		}
		logger.info("Parsed {} records from {}", records.size(), filename);
		PayoutBatchResultDto result = batchService.process(records, companyName);
		return new PayoutExtractionResultDto(result.tableName(), extracted, records, result.calculatedData(),
				result.metrics());
	}

	private byte[] readFile(MultipartFile file) {
		try {
			return file.getBytes();
		} catch (IOException ex) {
			throw new IllegalArgumentException("Failed to read upload: " + ex.getMessage(), ex);
		}
	}
}
